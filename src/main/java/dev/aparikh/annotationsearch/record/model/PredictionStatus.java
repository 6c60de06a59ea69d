package dev.aparikh.annotationsearch.record.model;

/**
 * Whether the predicted labels of a record agree with its annotated labels.
 */
public enum PredictionStatus {
    OK,
    KO
}

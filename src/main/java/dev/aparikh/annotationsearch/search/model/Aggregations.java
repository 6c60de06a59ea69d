package dev.aparikh.annotationsearch.search.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Value counts over every record matching a query, most frequent first.
 *
 * @param predictedAs counts per predicted label
 * @param annotatedAs counts per annotated label
 * @param predictedBy counts per prediction agent
 * @param annotatedBy counts per annotation agent
 * @param status      counts per record status
 * @param predicted   counts per prediction agreement
 * @param words       most frequent input words
 * @param metadata    per metadata key, counts per stringified value
 * @param score       counts per top prediction score bucket, keyed like {@code 0.95-1.00}
 */
public record Aggregations(
        @JsonProperty("predicted_as") Map<String, Long> predictedAs,
        @JsonProperty("annotated_as") Map<String, Long> annotatedAs,
        @JsonProperty("predicted_by") Map<String, Long> predictedBy,
        @JsonProperty("annotated_by") Map<String, Long> annotatedBy,
        Map<String, Long> status,
        Map<String, Long> predicted,
        Map<String, Long> words,
        Map<String, Map<String, Long>> metadata,
        Map<String, Long> score
) {
}

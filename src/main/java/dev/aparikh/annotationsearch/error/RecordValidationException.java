package dev.aparikh.annotationsearch.error;

/**
 * A single ingested record is invalid. Tallied as a failed record, never surfaced to the caller.
 */
public class RecordValidationException extends RuntimeException {

    public RecordValidationException(String message) {
        super(message);
    }
}

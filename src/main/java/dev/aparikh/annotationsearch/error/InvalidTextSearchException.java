package dev.aparikh.annotationsearch.error;

import org.springframework.http.HttpStatus;

/**
 * Raised when a free-text query cannot be parsed.
 */
public class InvalidTextSearchException extends ApiException {

    public InvalidTextSearchException(String queryText) {
        super("InvalidTextSearchError", HttpStatus.BAD_REQUEST, "Failed to parse query [" + queryText + "]");
    }

    public InvalidTextSearchException(String queryText, Throwable cause) {
        super("InvalidTextSearchError", HttpStatus.BAD_REQUEST, "Failed to parse query [" + queryText + "]", cause);
    }
}

package dev.aparikh.annotationsearch.error;

import org.springframework.http.HttpStatus;

/**
 * Another writer committed a newer version of the same document between our read and write.
 */
public class ConcurrentUpdateException extends ApiException {

    public ConcurrentUpdateException(String message, Throwable cause) {
        super("ConcurrentUpdateError", HttpStatus.CONFLICT, message, cause);
    }
}

package dev.aparikh.annotationsearch.error;

import org.springframework.http.HttpStatus;

/**
 * The search backend could not be reached or failed on its side. Never retried here.
 */
public class BackendUnavailableException extends ApiException {

    public BackendUnavailableException(String message, Throwable cause) {
        super("BackendUnavailableError", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}

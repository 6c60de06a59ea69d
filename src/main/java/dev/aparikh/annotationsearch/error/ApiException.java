package dev.aparikh.annotationsearch.error;

import org.jspecify.annotations.Nullable;
import org.springframework.http.HttpStatus;

/**
 * Base type for errors surfaced to API callers.
 *
 * <p>Each subtype carries a stable machine-readable code and the HTTP status it maps to.
 * The message is returned to the caller verbatim.
 */
public abstract class ApiException extends RuntimeException {

    public static final String CODE_PREFIX = "annotationsearch.api.errors::";

    private final String code;
    private final HttpStatus status;

    protected ApiException(String errorName, HttpStatus status, String message) {
        this(errorName, status, message, null);
    }

    protected ApiException(String errorName, HttpStatus status, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.code = CODE_PREFIX + errorName;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

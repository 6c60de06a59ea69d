package dev.aparikh.annotationsearch.error;

import org.springframework.http.HttpStatus;

public class BadRequestException extends ApiException {

    public BadRequestException(String message) {
        super("BadRequestError", HttpStatus.BAD_REQUEST, message);
    }

    public BadRequestException(String message, Throwable cause) {
        super("BadRequestError", HttpStatus.BAD_REQUEST, message, cause);
    }
}

package dev.aparikh.annotationsearch.error;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ApiException {

    public NotFoundException(String entityType, String name) {
        super("EntityNotFoundError", HttpStatus.NOT_FOUND, entityType + " with name=" + name + " not found");
    }
}

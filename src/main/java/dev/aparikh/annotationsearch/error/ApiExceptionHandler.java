package dev.aparikh.annotationsearch.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiError(ApiException exception) {
        if (exception.getStatus().is5xxServerError()) {
            log.error("Request failed: {}", exception.getMessage(), exception);
        } else {
            log.debug("Request rejected: {}", exception.getMessage());
        }
        return ResponseEntity.status(exception.getStatus())
                .body(ErrorResponse.of(exception.getCode(), exception.getMessage()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            HttpMediaTypeNotSupportedException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception exception) {
        log.debug("Malformed request: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ApiException.CODE_PREFIX + "BadRequestError", "Invalid request: " + exception.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception exception) {
        if (exception instanceof org.springframework.web.ErrorResponse webError) {
            HttpStatusCode status = webError.getStatusCode();
            String errorName = status.value() == 404 ? "EntityNotFoundError"
                    : status.is4xxClientError() ? "BadRequestError" : "GenericServerError";
            return ResponseEntity.status(status)
                    .body(ErrorResponse.of(ApiException.CODE_PREFIX + errorName, String.valueOf(exception.getMessage())));
        }
        log.error("Unexpected failure", exception);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ApiException.CODE_PREFIX + "GenericServerError", String.valueOf(exception.getMessage())));
    }
}

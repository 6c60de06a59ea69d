package dev.aparikh.annotationsearch.error;

import java.util.Map;

/**
 * Error envelope: {@code {"detail": {"code": ..., "params": {"message": ...}}}}.
 */
public record ErrorResponse(Detail detail) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(new Detail(code, Map.of("message", message)));
    }

    public record Detail(String code, Map<String, Object> params) {
    }
}

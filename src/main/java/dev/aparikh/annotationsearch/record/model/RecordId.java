package dev.aparikh.annotationsearch.record.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Record identifier, either an integer or a string.
 *
 * <p>The backend keys documents by {@link #value()}; {@link #numeric()} remembers which JSON
 * type the client used so the id is returned the way it was sent. Any other JSON scalar is kept
 * as its text; blank ids are rejected per record at ingest time.
 */
public record RecordId(String value, boolean numeric) {

    public static RecordId of(long value) {
        return new RecordId(Long.toString(value), true);
    }

    public static RecordId of(String value) {
        return new RecordId(value, false);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RecordId fromJson(JsonNode node) {
        if (node.isIntegralNumber()) {
            return of(node.longValue());
        }
        if (node.isValueNode() && !node.isNull()) {
            return of(node.asText());
        }
        throw new IllegalArgumentException("Record id must be an integer or a string, got: " + node);
    }

    public boolean isBlank() {
        return value.isBlank();
    }

    @JsonValue
    public Object jsonValue() {
        return numeric ? Long.valueOf(value) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}

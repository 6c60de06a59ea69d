package dev.aparikh.annotationsearch.record.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A class label, or a span label when {@code start} and {@code end} are set.
 *
 * @param label class or entity name
 * @param start span start offset, token classification only
 * @param end   span end offset (exclusive), token classification only
 * @param score confidence in [0, 1]; absent on annotations
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Label(
        @JsonProperty("class") @JsonAlias("label") String label,
        @Nullable Integer start,
        @Nullable Integer end,
        @Nullable Double score
) {

    public static Label of(String label, double score) {
        return new Label(label, null, null, score);
    }

    public static Label of(String label) {
        return new Label(label, null, null, null);
    }

    public boolean isSpan() {
        return start != null || end != null;
    }
}

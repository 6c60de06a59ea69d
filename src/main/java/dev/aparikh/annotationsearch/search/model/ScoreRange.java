package dev.aparikh.annotationsearch.search.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Inclusive bounds on the top prediction score; a missing bound is open.
 */
public record ScoreRange(
        @JsonProperty("from") @JsonAlias("range_from") @Nullable Double from,
        @JsonProperty("to") @JsonAlias("range_to") @Nullable Double to
) {

    public boolean isOpen() {
        return from == null && to == null;
    }
}

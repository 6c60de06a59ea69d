package dev.aparikh.annotationsearch.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SortOrder {
    ASC, DESC;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SortOrder fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}

package dev.aparikh.annotationsearch.record.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RecordStatus {
    DEFAULT("Default"),
    VALIDATED("Validated"),
    DISCARDED("Discarded"),
    EDITED("Edited");

    private final String label;

    RecordStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static RecordStatus fromLabel(String label) {
        return Arrays.stream(values())
                .filter(status -> status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown record status: " + label));
    }
}

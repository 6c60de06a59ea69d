package dev.aparikh.annotationsearch.record.model;

import java.util.List;

public record VectorValue(List<Float> value) {

    public VectorValue {
        value = value == null ? List.of() : List.copyOf(value);
    }
}

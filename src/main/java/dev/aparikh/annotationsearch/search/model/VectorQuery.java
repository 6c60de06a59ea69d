package dev.aparikh.annotationsearch.search.model;

import java.util.List;

/**
 * Nearest-neighbour search over the record vectors stored under {@code name}.
 *
 * @param name  the vector name used at ingest time
 * @param value the query vector; must match the stored dimension
 */
public record VectorQuery(String name, List<Float> value) {

    public VectorQuery {
        value = value == null ? List.of() : List.copyOf(value);
    }
}

package dev.aparikh.annotationsearch.search.model;

import io.swagger.v3.oas.annotations.media.Schema;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Search body: what to match and how to order it.
 */
@Schema(description = "Search request")
public record SearchRequest(
        @Nullable RecordQuery query,
        @Nullable List<SortConfig> sort
) {

    public static SearchRequest empty() {
        return new SearchRequest(null, null);
    }

    public RecordQuery queryOrEmpty() {
        return query != null ? query : RecordQuery.empty();
    }

    public List<SortConfig> sortOrEmpty() {
        return sort != null ? sort : List.of();
    }
}

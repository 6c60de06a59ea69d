package dev.aparikh.annotationsearch.search.model;

import io.swagger.v3.oas.annotations.media.Schema;
import org.jspecify.annotations.Nullable;

/**
 * One sort criterion.
 *
 * @param id    the sortable field, e.g. {@code last_updated} or {@code metadata.source}
 * @param order sort direction, ascending when absent
 */
@Schema(description = "Sort criterion")
public record SortConfig(
        @Schema(example = "predicted_by") String id,
        @Nullable SortOrder order
) {

    public SortOrder orderOrDefault() {
        return order != null ? order : SortOrder.ASC;
    }
}

package dev.aparikh.annotationsearch.search.model;

import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of search hits.
 *
 * @param total        number of records matching the query, across all pages
 * @param records      the hits of the requested page, in result order
 * @param aggregations value counts over all matching records; {@code null} past the first page
 */
@Schema(description = "Search results")
public record SearchResults(
        long total,
        List<AnnotationRecord> records,
        @Nullable Aggregations aggregations
) {
}

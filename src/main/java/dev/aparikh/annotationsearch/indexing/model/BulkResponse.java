package dev.aparikh.annotationsearch.indexing.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Outcome of a bulk ingest.
 *
 * @param dataset   the dataset written to
 * @param processed records written
 * @param failed    records rejected by validation or by the backend
 */
@Schema(description = "Bulk ingest result")
public record BulkResponse(String dataset, int processed, int failed) {
}

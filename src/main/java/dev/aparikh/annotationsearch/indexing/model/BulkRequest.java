package dev.aparikh.annotationsearch.indexing.model;

import com.fasterxml.jackson.databind.JsonNode;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A batch of records to create or merge, plus dataset-level tags and metadata.
 *
 * @param tags     tags merged into the dataset
 * @param metadata metadata merged into the dataset
 * @param records  records to create or merge, in order
 */
@Schema(description = "Bulk ingest request")
public record BulkRequest(
        @Nullable Map<String, String> tags,
        @Nullable Map<String, JsonNode> metadata,
        List<AnnotationRecord> records
) {

    public BulkRequest {
        records = records == null ? List.of() : records;
    }

    public Map<String, String> tagsOrEmpty() {
        return tags != null ? tags : Map.of();
    }

    public Map<String, JsonNode> metadataOrEmpty() {
        return metadata != null ? metadata : Map.of();
    }
}

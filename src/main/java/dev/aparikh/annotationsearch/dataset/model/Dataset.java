package dev.aparikh.annotationsearch.dataset.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.aparikh.annotationsearch.record.model.TaskType;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

/**
 * A named collection of records bound to one task.
 *
 * @param name        dataset name, unique
 * @param task        the task every record of the dataset belongs to
 * @param tags        string tags, merged additively on every bulk
 * @param metadata    free-form metadata, merged additively on every bulk
 * @param createdAt   creation time
 * @param lastUpdated time of the last tags or metadata merge
 */
@Schema(description = "Dataset")
public record Dataset(
        String name,
        TaskType task,
        Map<String, String> tags,
        Map<String, JsonNode> metadata,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_updated") Instant lastUpdated
) {

    public Dataset {
        tags = Map.copyOf(tags);
        metadata = Map.copyOf(metadata);
    }
}

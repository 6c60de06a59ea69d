package dev.aparikh.annotationsearch.search.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.aparikh.annotationsearch.record.model.PredictionStatus;
import dev.aparikh.annotationsearch.record.model.RecordId;
import dev.aparikh.annotationsearch.record.model.RecordStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Free-text query and structured filters. All filters present must match; a list filter matches
 * any of its values.
 *
 * @param queryText   query in Lucene syntax over {@code text}, {@code text.exact},
 *                    {@code inputs.<field>}, {@code metadata.<key>} and the label fields
 * @param ids         record ids
 * @param predictedBy prediction agents
 * @param annotatedBy annotation agents
 * @param predictedAs predicted labels
 * @param annotatedAs annotated labels
 * @param status      record statuses
 * @param predicted   agreement between prediction and annotation
 * @param metadata    metadata key to a value or a list of values
 * @param score       bounds on the top prediction score
 * @param vector      nearest-neighbour search; hits come back nearest first
 */
@Schema(description = "Record query")
public record RecordQuery(
        @JsonProperty("query_text") @JsonAlias("text") @Nullable String queryText,
        @Nullable List<RecordId> ids,
        @JsonProperty("predicted_by") @Nullable List<String> predictedBy,
        @JsonProperty("annotated_by") @Nullable List<String> annotatedBy,
        @JsonProperty("predicted_as") @Nullable List<String> predictedAs,
        @JsonProperty("annotated_as") @Nullable List<String> annotatedAs,
        @Nullable List<RecordStatus> status,
        @Nullable PredictionStatus predicted,
        @Nullable Map<String, JsonNode> metadata,
        @Nullable ScoreRange score,
        @Nullable VectorQuery vector
) {

    public static RecordQuery empty() {
        return new RecordQuery(null, null, null, null, null, null, null, null, null, null, null);
    }

    public static RecordQuery text(String queryText) {
        return new RecordQuery(queryText, null, null, null, null, null, null, null, null, null, null);
    }
}

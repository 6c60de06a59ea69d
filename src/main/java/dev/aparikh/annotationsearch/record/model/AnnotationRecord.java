package dev.aparikh.annotationsearch.record.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * An annotation record, identified by its {@link RecordId} within a dataset.
 *
 * <p>Every component is nullable so the same type carries both full stored records and the
 * partial records sent for a merge update. See {@link #mergedWith(AnnotationRecord)}.
 *
 * @param id             record identifier, unique within a dataset
 * @param inputs         input fields, each a string or a list of strings
 * @param prediction     labels assigned by a model
 * @param annotation     labels assigned by an annotator
 * @param multiLabel     whether several labels may hold at once (text classification)
 * @param metadata       free-form metadata; keys are opaque and may contain dots
 * @param status         review status
 * @param eventTimestamp when the underlying event happened; defaults to ingest time
 * @param lastUpdated    server-assigned time of the last write
 * @param metrics        server-computed metrics, read-only for clients
 * @param vectors        named embedding vectors
 * @param predicted      derived agreement between prediction and annotation, read-only
 */
@Schema(description = "Annotated record")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnnotationRecord(
        @Schema(description = "Integer or string id, unique within the dataset", example = "1")
        @Nullable RecordId id,
        @Nullable Map<String, JsonNode> inputs,
        @Nullable TaskAnnotation prediction,
        @Nullable TaskAnnotation annotation,
        @JsonProperty("multi_label") @Nullable Boolean multiLabel,
        @Nullable Map<String, JsonNode> metadata,
        @Nullable RecordStatus status,
        @JsonProperty("event_timestamp") @Nullable Instant eventTimestamp,
        @JsonProperty("last_updated") @Nullable Instant lastUpdated,
        @Nullable Map<String, JsonNode> metrics,
        @Nullable Map<String, VectorValue> vectors,
        @Nullable PredictionStatus predicted
) {

    /**
     * Returns this record with every non-null component of {@code patch} written over it.
     * Components the patch leaves null keep their current value.
     *
     * @param patch the partial record to apply
     * @return the merged record
     */
    public AnnotationRecord mergedWith(AnnotationRecord patch) {
        return new AnnotationRecord(
                patch.id != null ? patch.id : id,
                patch.inputs != null ? patch.inputs : inputs,
                patch.prediction != null ? patch.prediction : prediction,
                patch.annotation != null ? patch.annotation : annotation,
                patch.multiLabel != null ? patch.multiLabel : multiLabel,
                patch.metadata != null ? patch.metadata : metadata,
                patch.status != null ? patch.status : status,
                patch.eventTimestamp != null ? patch.eventTimestamp : eventTimestamp,
                patch.lastUpdated != null ? patch.lastUpdated : lastUpdated,
                patch.metrics != null ? patch.metrics : metrics,
                patch.vectors != null ? patch.vectors : vectors,
                patch.predicted != null ? patch.predicted : predicted
        );
    }

    public boolean isMultiLabel() {
        return Boolean.TRUE.equals(multiLabel);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private @Nullable RecordId id;
        private @Nullable Map<String, JsonNode> inputs;
        private @Nullable TaskAnnotation prediction;
        private @Nullable TaskAnnotation annotation;
        private @Nullable Boolean multiLabel;
        private @Nullable Map<String, JsonNode> metadata;
        private @Nullable RecordStatus status;
        private @Nullable Instant eventTimestamp;
        private @Nullable Instant lastUpdated;
        private @Nullable Map<String, JsonNode> metrics;
        private @Nullable Map<String, VectorValue> vectors;
        private @Nullable PredictionStatus predicted;

        private Builder() {
        }

        private Builder(AnnotationRecord record) {
            this.id = record.id;
            this.inputs = record.inputs;
            this.prediction = record.prediction;
            this.annotation = record.annotation;
            this.multiLabel = record.multiLabel;
            this.metadata = record.metadata;
            this.status = record.status;
            this.eventTimestamp = record.eventTimestamp;
            this.lastUpdated = record.lastUpdated;
            this.metrics = record.metrics;
            this.vectors = record.vectors;
            this.predicted = record.predicted;
        }

        public Builder id(@Nullable RecordId id) {
            this.id = id;
            return this;
        }

        public Builder inputs(@Nullable Map<String, JsonNode> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder prediction(@Nullable TaskAnnotation prediction) {
            this.prediction = prediction;
            return this;
        }

        public Builder annotation(@Nullable TaskAnnotation annotation) {
            this.annotation = annotation;
            return this;
        }

        public Builder multiLabel(@Nullable Boolean multiLabel) {
            this.multiLabel = multiLabel;
            return this;
        }

        public Builder metadata(@Nullable Map<String, JsonNode> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder status(@Nullable RecordStatus status) {
            this.status = status;
            return this;
        }

        public Builder eventTimestamp(@Nullable Instant eventTimestamp) {
            this.eventTimestamp = eventTimestamp;
            return this;
        }

        public Builder lastUpdated(@Nullable Instant lastUpdated) {
            this.lastUpdated = lastUpdated;
            return this;
        }

        public Builder metrics(@Nullable Map<String, JsonNode> metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder vectors(@Nullable Map<String, VectorValue> vectors) {
            this.vectors = vectors;
            return this;
        }

        public Builder predicted(@Nullable PredictionStatus predicted) {
            this.predicted = predicted;
            return this;
        }

        public AnnotationRecord build() {
            return new AnnotationRecord(id, inputs, prediction, annotation, multiLabel, metadata, status,
                    eventTimestamp, lastUpdated, metrics, vectors, predicted);
        }
    }
}

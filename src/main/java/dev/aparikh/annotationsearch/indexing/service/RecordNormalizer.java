package dev.aparikh.annotationsearch.indexing.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import dev.aparikh.annotationsearch.error.RecordValidationException;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.Label;
import dev.aparikh.annotationsearch.record.model.RecordStatus;
import dev.aparikh.annotationsearch.record.model.TaskAnnotation;
import dev.aparikh.annotationsearch.record.model.TaskType;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates incoming records and brings them to their canonical form before they are stored.
 */
@Component
public class RecordNormalizer {

    private static final Comparator<Label> BY_SCORE_DESC =
            Comparator.comparingDouble((Label label) -> label.score() == null ? 0.0 : label.score()).reversed();
    private static final Comparator<Label> BY_SPAN =
            Comparator.comparing((Label label) -> label.start()).thenComparing(Label::end);

    private final RecordStatus annotatedStatus;

    public RecordNormalizer(AnnotationSearchProperties properties) {
        this.annotatedStatus = properties.ingest().annotatedStatus();
    }

    /**
     * Checks one record of a {@code task} batch.
     *
     * @throws RecordValidationException describing the first problem found
     */
    public void validate(@Nullable AnnotationRecord record, TaskType task) {
        if (record == null) {
            throw new RecordValidationException("Record cannot be null");
        }
        if (record.id() == null) {
            throw new RecordValidationException("Record id is required");
        }
        if (record.id().isBlank()) {
            throw new RecordValidationException("Record id cannot be blank");
        }
        if (record.inputs() == null || record.inputs().isEmpty()) {
            throw new RecordValidationException("Record " + record.id() + " has no inputs");
        }
        record.inputs().forEach((name, value) -> {
            if (name.isBlank() || !isText(value)) {
                throw new RecordValidationException("Input '" + name + "' of record " + record.id()
                        + " must be a string or a list of strings");
            }
        });
        validateLabels(record, record.prediction(), task, "prediction");
        validateLabels(record, record.annotation(), task, "annotation");
        if (task == TaskType.TEXT_CLASSIFICATION && !record.isMultiLabel()
                && record.annotation() != null && record.annotation().labels().size() > 1) {
            throw new RecordValidationException("Single label record " + record.id()
                    + " cannot be annotated with more than one label");
        }
        if (record.metadata() != null && record.metadata().keySet().stream().anyMatch(String::isBlank)) {
            throw new RecordValidationException("Record " + record.id() + " has a blank metadata key");
        }
        if (record.vectors() != null) {
            record.vectors().forEach((name, vector) -> {
                if (name.isBlank() || vector == null || vector.value().isEmpty()) {
                    throw new RecordValidationException("Vector '" + name + "' of record " + record.id()
                            + " must have a name and at least one value");
                }
            });
        }
    }

    /**
     * Returns the canonical form of a validated record. Labels are trimmed and de-duplicated,
     * prediction labels sorted, annotation scores and server-owned components dropped, and a
     * status assigned when an annotation arrives without one.
     */
    public AnnotationRecord normalize(AnnotationRecord record, TaskType task) {
        return record.toBuilder()
                .prediction(normalizeLabels(record.prediction(), task, false))
                .annotation(normalizeLabels(record.annotation(), task, true))
                .status(record.status() == null && record.annotation() != null ? annotatedStatus : record.status())
                .metrics(null)
                .predicted(null)
                .lastUpdated(null)
                .build();
    }

    private static void validateLabels(AnnotationRecord record, @Nullable TaskAnnotation annotation,
                                       TaskType task, String kind) {
        if (annotation == null) {
            return;
        }
        for (Label label : annotation.labels()) {
            if (label == null || label.label() == null || label.label().isBlank()) {
                throw new RecordValidationException("Record " + record.id() + " has a " + kind + " label without a name");
            }
            if (label.score() != null && (label.score() < 0.0 || label.score() > 1.0)) {
                throw new RecordValidationException("Score " + label.score() + " of " + kind + " label "
                        + label.label() + " in record " + record.id() + " is out of [0, 1]");
            }
            if (task == TaskType.TOKEN_CLASSIFICATION) {
                if (label.start() == null || label.end() == null || label.start() < 0 || label.start() >= label.end()) {
                    throw new RecordValidationException("Span " + label.label() + " in record " + record.id()
                            + " needs 0 <= start < end");
                }
            } else if (label.isSpan()) {
                throw new RecordValidationException("Text classification record " + record.id()
                        + " cannot carry span labels");
            }
        }
    }

    private static @Nullable TaskAnnotation normalizeLabels(@Nullable TaskAnnotation annotation, TaskType task,
                                                            boolean dropScores) {
        if (annotation == null) {
            return null;
        }
        Map<String, Label> unique = new LinkedHashMap<>();
        for (Label label : annotation.labels()) {
            Label trimmed = new Label(label.label().strip(), label.start(), label.end(),
                    dropScores ? null : label.score());
            String key = trimmed.isSpan() ? trimmed.label() + "@" + trimmed.start() + ":" + trimmed.end() : trimmed.label();
            unique.merge(key, trimmed, (kept, candidate) -> BY_SCORE_DESC.compare(candidate, kept) < 0 ? candidate : kept);
        }
        List<Label> labels = unique.values().stream()
                .sorted(task == TaskType.TOKEN_CLASSIFICATION ? BY_SPAN : BY_SCORE_DESC)
                .toList();
        return new TaskAnnotation(annotation.agent() != null ? annotation.agent().strip() : null, labels);
    }

    private static boolean isText(@Nullable JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (!element.isTextual()) {
                    return false;
                }
            }
            return true;
        }
        return value.isTextual();
    }
}

package dev.aparikh.annotationsearch.indexing.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.aparikh.annotationsearch.TestUtils;
import dev.aparikh.annotationsearch.error.RecordValidationException;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.Label;
import dev.aparikh.annotationsearch.record.model.PredictionStatus;
import dev.aparikh.annotationsearch.record.model.RecordId;
import dev.aparikh.annotationsearch.record.model.RecordStatus;
import dev.aparikh.annotationsearch.record.model.TaskAnnotation;
import dev.aparikh.annotationsearch.record.model.TaskType;
import dev.aparikh.annotationsearch.record.model.VectorValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static dev.aparikh.annotationsearch.TestUtils.annotation;
import static dev.aparikh.annotationsearch.TestUtils.prediction;
import static dev.aparikh.annotationsearch.TestUtils.text;
import static dev.aparikh.annotationsearch.TestUtils.textRecord;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecordNormalizerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer(TestUtils.defaultProperties());

    @Test
    void acceptsStringAndListInputs() {
        AnnotationRecord record = textRecord(1, "x").toBuilder()
                .inputs(Map.of("title", text("t"),
                        "sentences", JsonNodeFactory.instance.arrayNode().add("a").add("b")))
                .build();

        assertDoesNotThrow(() -> normalizer.validate(record, TaskType.TEXT_CLASSIFICATION));
    }

    @Test
    void rejectsRecordsWithoutIdOrInputs() {
        assertThrows(RecordValidationException.class,
                () -> normalizer.validate(null, TaskType.TEXT_CLASSIFICATION));
        assertThrows(RecordValidationException.class,
                () -> normalizer.validate(textRecord(1, "x").toBuilder().id(null).build(), TaskType.TEXT_CLASSIFICATION));
        assertThrows(RecordValidationException.class,
                () -> normalizer.validate(textRecord(1, "x").toBuilder().id(RecordId.of(" ")).build(), TaskType.TEXT_CLASSIFICATION));
        assertThrows(RecordValidationException.class,
                () -> normalizer.validate(textRecord(1, "x").toBuilder().inputs(Map.of()).build(), TaskType.TEXT_CLASSIFICATION));
        assertThrows(RecordValidationException.class,
                () -> normalizer.validate(textRecord(1, "x").toBuilder()
                        .inputs(Map.of("text", JsonNodeFactory.instance.numberNode(3))).build(), TaskType.TEXT_CLASSIFICATION));
    }

    @Test
    void rejectsScoresOutsideUnitInterval() {
        AnnotationRecord record = textRecord(1, "x").toBuilder()
                .prediction(prediction("model", Label.of("Pos", 1.5)))
                .build();

        assertThrows(RecordValidationException.class, () -> normalizer.validate(record, TaskType.TEXT_CLASSIFICATION));
    }

    @Test
    void rejectsSeveralAnnotatedLabelsOnSingleLabelRecords() {
        AnnotationRecord record = textRecord(1, "x").toBuilder()
                .annotation(annotation("ann", "Pos", "Neg"))
                .build();

        assertThrows(RecordValidationException.class, () -> normalizer.validate(record, TaskType.TEXT_CLASSIFICATION));
        assertDoesNotThrow(() -> normalizer.validate(record.toBuilder().multiLabel(true).build(),
                TaskType.TEXT_CLASSIFICATION));
    }

    @Test
    void tokenClassificationNeedsValidSpans() {
        AnnotationRecord valid = textRecord(1, "Paris is nice").toBuilder()
                .annotation(new TaskAnnotation("ann", List.of(new Label("LOC", 0, 5, null))))
                .build();
        AnnotationRecord inverted = valid.toBuilder()
                .annotation(new TaskAnnotation("ann", List.of(new Label("LOC", 5, 5, null))))
                .build();
        AnnotationRecord unbounded = valid.toBuilder()
                .annotation(annotation("ann", "LOC"))
                .build();

        assertDoesNotThrow(() -> normalizer.validate(valid, TaskType.TOKEN_CLASSIFICATION));
        assertThrows(RecordValidationException.class, () -> normalizer.validate(inverted, TaskType.TOKEN_CLASSIFICATION));
        assertThrows(RecordValidationException.class, () -> normalizer.validate(unbounded, TaskType.TOKEN_CLASSIFICATION));
        assertThrows(RecordValidationException.class, () -> normalizer.validate(valid, TaskType.TEXT_CLASSIFICATION));
    }

    @Test
    void rejectsEmptyVectorsAndBlankMetadataKeys() {
        AnnotationRecord emptyVector = textRecord(1, "x").toBuilder()
                .vectors(Map.of("bert", new VectorValue(List.of())))
                .build();
        AnnotationRecord blankKey = textRecord(1, "x").toBuilder()
                .metadata(Map.of(" ", text("v")))
                .build();

        assertThrows(RecordValidationException.class, () -> normalizer.validate(emptyVector, TaskType.TEXT_CLASSIFICATION));
        assertThrows(RecordValidationException.class, () -> normalizer.validate(blankKey, TaskType.TEXT_CLASSIFICATION));
    }

    @Test
    void normalizesPredictionLabels() {
        // Given
        AnnotationRecord record = textRecord(1, "x").toBuilder()
                .prediction(prediction(" model ", Label.of("Neg ", 0.2), Label.of("Pos", 0.7), Label.of("Neg", 0.3)))
                .build();

        // When
        AnnotationRecord normalized = normalizer.normalize(record, TaskType.TEXT_CLASSIFICATION);

        // Then
        assertEquals(new TaskAnnotation("model", List.of(Label.of("Pos", 0.7), Label.of("Neg", 0.3))),
                normalized.prediction());
    }

    @Test
    void sortsSpansByPosition() {
        AnnotationRecord record = textRecord(1, "Paris and Rome").toBuilder()
                .prediction(new TaskAnnotation("model", List.of(
                        new Label("LOC", 10, 14, 0.9), new Label("LOC", 0, 5, 0.8))))
                .build();

        AnnotationRecord normalized = normalizer.normalize(record, TaskType.TOKEN_CLASSIFICATION);

        assertEquals(List.of(new Label("LOC", 0, 5, 0.8), new Label("LOC", 10, 14, 0.9)),
                normalized.prediction().labels());
    }

    @Test
    void annotationGetsReviewedStatusAndLosesScores() {
        // Given
        AnnotationRecord record = textRecord(1, "x").toBuilder()
                .annotation(new TaskAnnotation("ann", List.of(Label.of("Pos", 1.0))))
                .predicted(PredictionStatus.OK)
                .lastUpdated(Instant.EPOCH)
                .metrics(Map.of("text_length", text("99")))
                .build();

        // When
        AnnotationRecord normalized = normalizer.normalize(record, TaskType.TEXT_CLASSIFICATION);

        // Then
        assertEquals(List.of(Label.of("Pos")), normalized.annotation().labels());
        assertEquals(RecordStatus.VALIDATED, normalized.status());
        assertNull(normalized.predicted());
        assertNull(normalized.lastUpdated());
        assertNull(normalized.metrics());
    }

    @Test
    void explicitStatusIsKept() {
        AnnotationRecord record = textRecord(1, "x").toBuilder()
                .annotation(annotation("ann", "Pos"))
                .status(RecordStatus.DISCARDED)
                .build();

        assertEquals(RecordStatus.DISCARDED, normalizer.normalize(record, TaskType.TEXT_CLASSIFICATION).status());
        assertNull(normalizer.normalize(textRecord(2, "y"), TaskType.TEXT_CLASSIFICATION).status());
    }
}

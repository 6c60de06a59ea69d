package dev.aparikh.annotationsearch.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.Label;
import dev.aparikh.annotationsearch.record.model.PredictionStatus;
import dev.aparikh.annotationsearch.record.model.TaskAnnotation;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the read-only views of a record: label sets, agreement status, top score, text and
 * metrics. Everything here is a pure function of the record.
 */
public final class RecordProjections {

    private final double multiLabelThreshold;

    public RecordProjections(double multiLabelThreshold) {
        this.multiLabelThreshold = multiLabelThreshold;
    }

    /**
     * Labels the prediction commits to. For multi-label records every label scoring at least the
     * threshold; for single-label records the top-scoring label; for spans each distinct label.
     */
    public List<String> predictedLabels(AnnotationRecord record) {
        TaskAnnotation prediction = record.prediction();
        if (prediction == null || prediction.labels().isEmpty()) {
            return List.of();
        }
        List<Label> labels = prediction.labels();
        if (labels.stream().anyMatch(Label::isSpan)) {
            return distinctLabels(labels);
        }
        if (record.isMultiLabel()) {
            return labels.stream()
                    .filter(label -> label.score() != null && label.score() >= multiLabelThreshold)
                    .map(Label::label)
                    .distinct()
                    .toList();
        }
        return labels.stream()
                .max(Comparator.comparingDouble(label -> label.score() == null ? 0.0 : label.score()))
                .map(label -> List.of(label.label()))
                .orElse(List.of());
    }

    public List<String> annotatedLabels(AnnotationRecord record) {
        TaskAnnotation annotation = record.annotation();
        return annotation == null ? List.of() : distinctLabels(annotation.labels());
    }

    /**
     * {@code OK} when prediction and annotation agree, {@code KO} when they don't, {@code null}
     * while either one is missing. Spans must agree on label and offsets.
     */
    public @Nullable PredictionStatus predictionStatus(AnnotationRecord record) {
        if (record.prediction() == null || record.annotation() == null) {
            return null;
        }
        boolean spans = record.prediction().labels().stream().anyMatch(Label::isSpan)
                || record.annotation().labels().stream().anyMatch(Label::isSpan);
        boolean agree = spans
                ? spanKeys(record.prediction()).equals(spanKeys(record.annotation()))
                : Set.copyOf(predictedLabels(record)).equals(Set.copyOf(annotatedLabels(record)));
        return agree ? PredictionStatus.OK : PredictionStatus.KO;
    }

    public @Nullable Double topPredictionScore(AnnotationRecord record) {
        if (record.prediction() == null) {
            return null;
        }
        return record.prediction().labels().stream()
                .map(Label::score)
                .filter(Objects::nonNull)
                .max(Double::compare)
                .orElse(null);
    }

    /**
     * Input values flattened to strings, in input order. List inputs contribute each element.
     */
    public static List<String> inputTexts(AnnotationRecord record) {
        List<String> texts = new ArrayList<>();
        if (record.inputs() != null) {
            record.inputs().values().forEach(value -> texts.addAll(asTexts(value)));
        }
        return texts;
    }

    public static List<String> asTexts(JsonNode value) {
        if (value.isArray()) {
            List<String> texts = new ArrayList<>();
            value.forEach(element -> texts.add(asText(element)));
            return texts;
        }
        return value.isNull() ? List.of() : List.of(asText(value));
    }

    /**
     * Server-side metrics: total characters of the inputs and their whitespace-separated tokens.
     */
    public static Map<String, JsonNode> metrics(AnnotationRecord record) {
        List<String> texts = inputTexts(record);
        int textLength = texts.stream().mapToInt(String::length).sum();
        int tokens = texts.stream()
                .map(String::strip)
                .filter(text -> !text.isEmpty())
                .mapToInt(text -> text.split("\\s+").length)
                .sum();
        Map<String, JsonNode> metrics = new LinkedHashMap<>();
        metrics.put("text_length", JsonNodeFactory.instance.numberNode(textLength));
        metrics.put("tokens", JsonNodeFactory.instance.numberNode(tokens));
        return metrics;
    }

    private static String asText(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static List<String> distinctLabels(List<Label> labels) {
        return labels.stream().map(Label::label).distinct().toList();
    }

    private static Set<String> spanKeys(TaskAnnotation annotation) {
        return annotation.labels().stream()
                .map(label -> label.label() + "@" + label.start() + ":" + label.end())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}

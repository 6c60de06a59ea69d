package dev.aparikh.annotationsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.Label;
import dev.aparikh.annotationsearch.record.model.RecordId;
import dev.aparikh.annotationsearch.record.model.RecordStatus;
import dev.aparikh.annotationsearch.record.model.TaskAnnotation;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers shared by unit tests: default engine settings and record fixtures.
 */
public class TestUtils {

    /**
     * Settings equal to the shipped defaults, for components built without a Spring context.
     */
    public static AnnotationSearchProperties defaultProperties() {
        return properties(null);
    }

    /**
     * Default settings with vector search forced on or off; {@code null} keeps probing.
     */
    public static AnnotationSearchProperties properties(Boolean vectorSearchEnabled) {
        return new AnnotationSearchProperties(
                new AnnotationSearchProperties.Collections("ds_", "datasets", "_default", 1, 1),
                new AnnotationSearchProperties.Search(50, 10000, 100, 100, 0.05),
                new AnnotationSearchProperties.Ingest(0.5, RecordStatus.VALIDATED, null),
                new AnnotationSearchProperties.VectorSearch(vectorSearchEnabled, 1000, "euclidean")
        );
    }

    public static JsonNode text(String value) {
        return JsonNodeFactory.instance.textNode(value);
    }

    public static Map<String, JsonNode> inputs(String... nameValuePairs) {
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            inputs.put(nameValuePairs[i], text(nameValuePairs[i + 1]));
        }
        return inputs;
    }

    /**
     * A text classification record with one input field named {@code text}.
     */
    public static AnnotationRecord textRecord(long id, String text) {
        return AnnotationRecord.builder()
                .id(RecordId.of(id))
                .inputs(inputs("text", text))
                .build();
    }

    public static TaskAnnotation prediction(String agent, Label... labels) {
        return new TaskAnnotation(agent, List.of(labels));
    }

    public static TaskAnnotation annotation(String agent, String... labels) {
        return new TaskAnnotation(agent, Arrays.stream(labels).map(Label::of).toList());
    }
}

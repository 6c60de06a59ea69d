package dev.aparikh.annotationsearch.record.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import dev.aparikh.annotationsearch.record.RecordProjections;
import dev.aparikh.annotationsearch.record.WordTokenizer;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.PredictionStatus;
import dev.aparikh.annotationsearch.record.model.RecordId;
import dev.aparikh.annotationsearch.record.model.RecordStatus;
import dev.aparikh.annotationsearch.record.model.TaskAnnotation;
import dev.aparikh.annotationsearch.record.model.VectorValue;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrInputDocument;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dev.aparikh.annotationsearch.solr.SolrFields.*;

/**
 * Converts records to Solr documents and back.
 *
 * <p>A document keeps the record's JSON components verbatim in stored-only fields, which is what
 * {@link #fromDocument(SolrDocument)} reads. The other fields are search projections rebuilt on
 * every write.
 */
@Component
public class SolrRecordMapper {

    private static final String NUMERIC_ID = "int";
    private static final String STRING_ID = "str";

    private static final TypeReference<Map<String, JsonNode>> JSON_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, VectorValue>> VECTOR_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final RecordProjections projections;
    private final WordTokenizer tokenizer;

    public SolrRecordMapper(ObjectMapper objectMapper, AnnotationSearchProperties properties) {
        this.objectMapper = objectMapper;
        this.projections = new RecordProjections(properties.ingest().multiLabelThreshold());
        List<String> stopWords = properties.ingest().stopWords();
        this.tokenizer = stopWords != null ? new WordTokenizer(stopWords) : new WordTokenizer();
    }

    /**
     * Fills the server-owned components of a merged record: status and event time defaults,
     * metrics, prediction agreement and the write time.
     */
    public AnnotationRecord withDerivedFields(AnnotationRecord record, Instant lastUpdated) {
        return record.toBuilder()
                .status(record.status() != null ? record.status() : RecordStatus.DEFAULT)
                .eventTimestamp(record.eventTimestamp() != null ? record.eventTimestamp() : lastUpdated)
                .lastUpdated(lastUpdated)
                .metrics(RecordProjections.metrics(record))
                .predicted(projections.predictionStatus(record))
                .build();
    }

    /**
     * Builds the document for a record.
     *
     * @param record       a record with its derived fields set
     * @param vectorFields indexed vector field per vector name; vectors missing here are stored only
     */
    public SolrInputDocument toDocument(AnnotationRecord record, Map<String, String> vectorFields) {
        RecordId id = requireId(record);
        SolrInputDocument doc = new SolrInputDocument();
        doc.setField(ID, id.value());
        doc.setField(ID_TYPE, id.numeric() ? NUMERIC_ID : STRING_ID);

        setJson(doc, INPUTS_JSON, record.inputs());
        setJson(doc, PREDICTION_JSON, record.prediction());
        setJson(doc, ANNOTATION_JSON, record.annotation());
        setJson(doc, METADATA_JSON, record.metadata());
        setJson(doc, METRICS_JSON, record.metrics());
        setJson(doc, VECTORS_JSON, record.vectors());

        List<String> texts = RecordProjections.inputTexts(record);
        setValues(doc, TEXT, texts);
        setValues(doc, TEXT_EXACT, texts);
        if (record.inputs() != null) {
            record.inputs().forEach((name, value) ->
                    setValues(doc, inputTextField(name), RecordProjections.asTexts(value)));
        }
        Set<String> words = new LinkedHashSet<>();
        texts.forEach(text -> words.addAll(tokenizer.tokenize(text)));
        setValues(doc, WORDS, words);

        List<String> predictedAs = projections.predictedLabels(record);
        setValues(doc, PREDICTED_AS, predictedAs);
        if (!predictedAs.isEmpty()) {
            doc.setField(PREDICTED_AS_TOP, predictedAs.get(0));
        }
        List<String> annotatedAs = projections.annotatedLabels(record);
        setValues(doc, ANNOTATED_AS, annotatedAs);
        if (!annotatedAs.isEmpty()) {
            doc.setField(ANNOTATED_AS_TOP, annotatedAs.get(0));
        }
        setIfPresent(doc, PREDICTED_BY, record.prediction() != null ? record.prediction().agent() : null);
        setIfPresent(doc, ANNOTATED_BY, record.annotation() != null ? record.annotation().agent() : null);
        setIfPresent(doc, PREDICTION_SCORE, projections.topPredictionScore(record));
        setIfPresent(doc, PREDICTED, record.predicted() != null ? record.predicted().name() : null);
        setIfPresent(doc, STATUS, record.status() != null ? record.status().label() : null);
        setIfPresent(doc, MULTI_LABEL, record.multiLabel());
        setIfPresent(doc, EVENT_TIMESTAMP, toDate(record.eventTimestamp()));
        setIfPresent(doc, LAST_UPDATED, toDate(record.lastUpdated()));

        if (record.metadata() != null) {
            setValues(doc, METADATA_KEYS, record.metadata().keySet());
            record.metadata().forEach((key, value) -> {
                List<String> values = RecordProjections.asTexts(value);
                setValues(doc, metadataValuesField(key), values);
                if (!values.isEmpty()) {
                    doc.setField(metadataSortField(key), values.get(0));
                }
            });
        }

        if (record.vectors() != null) {
            record.vectors().forEach((name, vector) -> {
                String field = vectorFields.get(name);
                if (field != null) {
                    doc.setField(field, vector.value());
                }
            });
        }
        return doc;
    }

    public AnnotationRecord fromDocument(SolrDocument doc) {
        String id = String.valueOf(doc.getFirstValue(ID));
        Object status = doc.getFirstValue(STATUS);
        Object predicted = doc.getFirstValue(PREDICTED);
        return AnnotationRecord.builder()
                .id(new RecordId(id, NUMERIC_ID.equals(doc.getFirstValue(ID_TYPE))))
                .inputs(readJson(doc, INPUTS_JSON, JSON_MAP))
                .prediction(readJson(doc, PREDICTION_JSON, new TypeReference<TaskAnnotation>() {
                }))
                .annotation(readJson(doc, ANNOTATION_JSON, new TypeReference<TaskAnnotation>() {
                }))
                .multiLabel((Boolean) doc.getFirstValue(MULTI_LABEL))
                .metadata(readJson(doc, METADATA_JSON, JSON_MAP))
                .status(status != null ? RecordStatus.fromLabel(status.toString()) : null)
                .eventTimestamp(toInstant(doc.getFirstValue(EVENT_TIMESTAMP)))
                .lastUpdated(toInstant(doc.getFirstValue(LAST_UPDATED)))
                .metrics(readJson(doc, METRICS_JSON, JSON_MAP))
                .vectors(readJson(doc, VECTORS_JSON, VECTOR_MAP))
                .predicted(predicted != null ? PredictionStatus.valueOf(predicted.toString()) : null)
                .build();
    }

    static RecordId requireId(AnnotationRecord record) {
        if (record.id() == null) {
            throw new IllegalArgumentException("Record id is required");
        }
        return record.id();
    }

    private void setJson(SolrInputDocument doc, String field, @Nullable Object value) {
        if (value == null) {
            return;
        }
        try {
            doc.setField(field, objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize field " + field, e);
        }
    }

    private <T> @Nullable T readJson(SolrDocument doc, String field, TypeReference<T> type) {
        Object json = doc.getFirstValue(field);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json.toString(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored field " + field + " is not valid JSON", e);
        }
    }

    private static void setValues(SolrInputDocument doc, String field, Collection<String> values) {
        if (!values.isEmpty()) {
            doc.setField(field, new ArrayList<>(values));
        }
    }

    private static void setIfPresent(SolrInputDocument doc, String field, @Nullable Object value) {
        if (value != null) {
            doc.setField(field, value);
        }
    }

    private static @Nullable Date toDate(@Nullable Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static @Nullable Instant toInstant(@Nullable Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return value != null ? Instant.parse(value.toString()) : null;
    }
}

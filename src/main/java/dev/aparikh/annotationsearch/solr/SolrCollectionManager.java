package dev.aparikh.annotationsearch.solr;

import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.request.CollectionAdminRequest;
import org.apache.solr.client.solrj.request.schema.FieldTypeDefinition;
import org.apache.solr.client.solrj.request.schema.SchemaRequest;
import org.apache.solr.client.solrj.response.CollectionAdminResponse;
import org.apache.solr.client.solrj.response.schema.SchemaResponse;
import org.apache.solr.common.SolrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static dev.aparikh.annotationsearch.solr.SolrFields.*;

/**
 * Creates and drops the Solr collections backing datasets and provisions their schema.
 *
 * <p>Provisioning is idempotent. Collections and vector fields already seen by this process are
 * remembered, so the Solr admin APIs are only hit the first time a collection or a vector name is
 * used. A collection created concurrently by another writer is treated as success.
 */
@Component
public class SolrCollectionManager {

    private static final Logger log = LoggerFactory.getLogger(SolrCollectionManager.class);

    private static final String ALREADY_EXISTS = "already exists";

    private static final List<Map<String, Object>> RECORD_FIELDS = List.of(
            storedOnly(ID_TYPE),
            storedOnly(INPUTS_JSON),
            storedOnly(PREDICTION_JSON),
            storedOnly(ANNOTATION_JSON),
            storedOnly(METADATA_JSON),
            storedOnly(METRICS_JSON),
            storedOnly(VECTORS_JSON),
            field(TEXT, "text_general", true),
            field(TEXT_EXACT, "text_ws", true),
            field(WORDS, "strings", true),
            field(PREDICTED_AS, "strings", true),
            field(PREDICTED_AS_TOP, "string", false),
            field(PREDICTED_BY, "string", false),
            field(ANNOTATED_AS, "strings", true),
            field(ANNOTATED_AS_TOP, "string", false),
            field(ANNOTATED_BY, "string", false),
            field(PREDICTION_SCORE, "pdouble", false),
            field(PREDICTED, "string", false),
            field(STATUS, "string", false),
            field(MULTI_LABEL, "boolean", false),
            field(EVENT_TIMESTAMP, "pdate", false),
            field(LAST_UPDATED, "pdate", false),
            field(METADATA_KEYS, "strings", true)
    );

    private static final List<Map<String, Object>> DATASET_FIELDS = List.of(
            field(DatasetFields.NAME, "string", false),
            field(DatasetFields.TASK, "string", false),
            storedOnly(DatasetFields.TAGS_JSON),
            storedOnly(DatasetFields.METADATA_JSON),
            field(DatasetFields.CREATED_AT, "pdate", false),
            field(DatasetFields.LAST_UPDATED, "pdate", false)
    );

    private final SolrClient solrClient;
    private final AnnotationSearchProperties.Collections settings;
    private final AnnotationSearchProperties.VectorSearch vectorSettings;

    private final Set<String> provisionedCollections = ConcurrentHashMap.newKeySet();
    private final Set<String> provisionedVectorFields = ConcurrentHashMap.newKeySet();

    public SolrCollectionManager(SolrClient solrClient, AnnotationSearchProperties properties) {
        this.solrClient = solrClient;
        this.settings = properties.collections();
        this.vectorSettings = properties.vectorSearch();
    }

    public String recordCollection(String dataset) {
        return settings.prefix() + dataset;
    }

    public String datasetsCollection() {
        return settings.datasets();
    }

    /**
     * Makes sure the record collection of {@code dataset} exists with its schema.
     *
     * @return the collection name
     */
    public String ensureRecordCollection(String dataset) {
        String collection = recordCollection(dataset);
        ensureCollection(collection, RECORD_FIELDS);
        return collection;
    }

    public String ensureDatasetsCollection() {
        String collection = datasetsCollection();
        ensureCollection(collection, DATASET_FIELDS);
        return collection;
    }

    /**
     * Drops the record collection of {@code dataset}. Dropping a missing collection is a no-op.
     */
    public void dropRecordCollection(String dataset) {
        String collection = recordCollection(dataset);
        provisionedCollections.remove(collection);
        provisionedVectorFields.removeIf(key -> key.startsWith(collection + "/"));
        if (!listCollections().contains(collection)) {
            log.debug("Collection '{}' does not exist, nothing to drop", collection);
            return;
        }
        try {
            CollectionAdminRequest.deleteCollection(collection).process(solrClient);
            log.info("Dropped collection '{}'", collection);
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("drop collection " + collection, e);
        }
    }

    /**
     * Adds a dense vector field for {@code vectorName} sized to {@code dimension}, unless the
     * collection already has one.
     *
     * @return the vector field name
     */
    public String ensureVectorField(String collection, String vectorName, int dimension) {
        String fieldName = vectorField(vectorName);
        String cacheKey = collection + "/" + fieldName;
        if (provisionedVectorFields.contains(cacheKey)) {
            return fieldName;
        }
        String typeName = "knn_vector_" + dimension + "_" + vectorSettings.similarity();
        try {
            Set<String> types = new SchemaRequest.FieldTypes().process(solrClient, collection)
                    .getFieldTypes().stream()
                    .map(type -> (String) type.getAttributes().get("name"))
                    .collect(Collectors.toSet());
            List<SchemaRequest.Update> updates = new ArrayList<>();
            if (!types.contains(typeName)) {
                FieldTypeDefinition definition = new FieldTypeDefinition();
                definition.setAttributes(Map.of(
                        "name", typeName,
                        "class", "solr.DenseVectorField",
                        "vectorDimension", String.valueOf(dimension),
                        "similarityFunction", vectorSettings.similarity(),
                        "knnAlgorithm", "hnsw"
                ));
                updates.add(new SchemaRequest.AddFieldType(definition));
            }
            if (!existingFields(collection).contains(fieldName)) {
                updates.add(new SchemaRequest.AddField(Map.of(
                        "name", fieldName,
                        "type", typeName,
                        "indexed", true,
                        "stored", false
                )));
            }
            applySchemaUpdates(collection, updates);
            provisionedVectorFields.add(cacheKey);
            log.info("Vector field '{}' ({} dims) ready in '{}'", fieldName, dimension, collection);
            return fieldName;
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("provision vector field " + fieldName, e);
        }
    }

    private void ensureCollection(String collection, List<Map<String, Object>> fields) {
        if (provisionedCollections.contains(collection)) {
            return;
        }
        try {
            if (!listCollections().contains(collection)) {
                createCollection(collection);
            }
            Set<String> existing = existingFields(collection);
            List<SchemaRequest.Update> updates = fields.stream()
                    .filter(f -> !existing.contains((String) f.get("name")))
                    .<SchemaRequest.Update>map(SchemaRequest.AddField::new)
                    .toList();
            applySchemaUpdates(collection, updates);
            provisionedCollections.add(collection);
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("provision collection " + collection, e);
        }
    }

    private void createCollection(String collection) throws SolrServerException, IOException {
        try {
            CollectionAdminResponse response = CollectionAdminRequest
                    .createCollection(collection, settings.configSet(), settings.numShards(),
                            settings.replicationFactor())
                    .process(solrClient);
            if (!response.isSuccess()) {
                throw new SolrException(SolrException.ErrorCode.SERVER_ERROR,
                        "Failed to create collection " + collection + ": " + response.getErrorMessages());
            }
            log.info("Created collection '{}'", collection);
        } catch (SolrException e) {
            if (!isAlreadyExists(e)) {
                throw e;
            }
            log.debug("Collection '{}' was created concurrently", collection);
        }
    }

    private void applySchemaUpdates(String collection, List<SchemaRequest.Update> updates)
            throws SolrServerException, IOException {
        if (updates.isEmpty()) {
            return;
        }
        try {
            SchemaResponse.UpdateResponse response = new SchemaRequest.MultiUpdate(updates)
                    .process(solrClient, collection);
            Object errors = response.getResponse().get("errors");
            if (errors != null && !errors.toString().contains(ALREADY_EXISTS)) {
                throw new SolrException(SolrException.ErrorCode.SERVER_ERROR,
                        "Schema update of " + collection + " failed: " + errors);
            }
            log.debug("Applied {} schema updates to '{}'", updates.size(), collection);
        } catch (SolrException e) {
            if (!isAlreadyExists(e)) {
                throw e;
            }
            log.debug("Schema of '{}' was updated concurrently", collection);
        }
    }

    private Set<String> existingFields(String collection) throws SolrServerException, IOException {
        return new SchemaRequest.Fields().process(solrClient, collection).getFields().stream()
                .map(f -> (String) f.get("name"))
                .collect(Collectors.toSet());
    }

    @SuppressWarnings("unchecked")
    private List<String> listCollections() {
        try {
            CollectionAdminResponse response = new CollectionAdminRequest.List().process(solrClient);
            List<String> collections = (List<String>) response.getResponse().get("collections");
            return collections != null ? collections : List.of();
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("list collections", e);
        }
    }

    private static boolean isAlreadyExists(SolrException e) {
        return e.getMessage() != null && e.getMessage().contains(ALREADY_EXISTS);
    }

    private static Map<String, Object> storedOnly(String name) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("type", "string");
        field.put("indexed", false);
        field.put("docValues", false);
        field.put("stored", true);
        return field;
    }

    private static Map<String, Object> field(String name, String type, boolean multiValued) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("type", type);
        field.put("indexed", true);
        field.put("stored", true);
        field.put("multiValued", multiValued);
        return field;
    }
}

package dev.aparikh.annotationsearch.dataset.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.annotationsearch.dataset.model.Dataset;
import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.error.NotFoundException;
import dev.aparikh.annotationsearch.record.model.TaskType;
import dev.aparikh.annotationsearch.solr.SolrCollectionManager;
import dev.aparikh.annotationsearch.solr.SolrExceptions;
import dev.aparikh.annotationsearch.solr.SolrFields;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.request.UpdateRequest;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.SolrInputDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static dev.aparikh.annotationsearch.solr.SolrFields.DatasetFields.*;

/**
 * {@link DatasetRegistry} storing one document per dataset in a dedicated Solr collection.
 *
 * <p>Lookups use real-time get, so a dataset is visible as soon as it is written. Tag and
 * metadata merges are conditioned on the {@code _version_} that was read.
 */
@Repository
public class SolrDatasetRegistry implements DatasetRegistry {

    private static final Logger log = LoggerFactory.getLogger(SolrDatasetRegistry.class);

    private static final TypeReference<Map<String, String>> TAGS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, JsonNode>> METADATA = new TypeReference<>() {
    };

    private final SolrClient solrClient;
    private final SolrCollectionManager collections;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SolrDatasetRegistry(SolrClient solrClient,
                               SolrCollectionManager collections,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.solrClient = solrClient;
        this.collections = collections;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Dataset createOrUpdate(String name, TaskType task, Map<String, String> tags,
                                 Map<String, JsonNode> metadata) {
        validateName(name);
        String registry = collections.ensureDatasetsCollection();
        try {
            SolrDocument existingDoc = solrClient.getById(registry, name);
            Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            Dataset dataset;
            long version;
            if (existingDoc == null) {
                dataset = new Dataset(name, task, tags, metadata, now, now);
                version = -1L;
            } else {
                Dataset existing = fromDocument(existingDoc);
                if (existing.task() != task) {
                    throw new BadRequestException("Dataset " + name + " was created for task "
                            + existing.task().pathName() + " and cannot be used for " + task.pathName());
                }
                Map<String, String> mergedTags = new LinkedHashMap<>(existing.tags());
                mergedTags.putAll(tags);
                Map<String, JsonNode> mergedMetadata = new LinkedHashMap<>(existing.metadata());
                mergedMetadata.putAll(metadata);
                dataset = new Dataset(name, task, mergedTags, mergedMetadata, existing.createdAt(), now);
                version = ((Number) existingDoc.getFirstValue(SolrFields.VERSION)).longValue();
            }

            SolrInputDocument doc = toDocument(dataset);
            doc.setField(SolrFields.VERSION, version);
            UpdateRequest request = new UpdateRequest();
            request.add(doc);
            request.process(solrClient, registry);
            collections.ensureRecordCollection(name);

            log.info("{} dataset '{}' for task {}", existingDoc == null ? "Created" : "Updated",
                    name, task.pathName());
            return dataset;
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("register dataset " + name, e);
        }
    }

    @Override
    public Optional<Dataset> find(String name) {
        String registry = collections.ensureDatasetsCollection();
        try {
            return Optional.ofNullable(solrClient.getById(registry, name)).map(this::fromDocument);
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("read dataset " + name, e);
        }
    }

    @Override
    public Dataset get(String name) {
        return find(name).orElseThrow(() -> new NotFoundException("Dataset", name));
    }

    @Override
    public void delete(String name) {
        String registry = collections.ensureDatasetsCollection();
        collections.dropRecordCollection(name);
        try {
            solrClient.deleteById(registry, name);
            solrClient.commit(registry);
            log.info("Deleted dataset '{}'", name);
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("delete dataset " + name, e);
        }
    }

    static void validateName(String name) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new BadRequestException("Invalid dataset name " + name + ". Names must match "
                    + NAME_PATTERN.pattern());
        }
    }

    private SolrInputDocument toDocument(Dataset dataset) {
        SolrInputDocument doc = new SolrInputDocument();
        doc.setField(SolrFields.ID, dataset.name());
        doc.setField(NAME, dataset.name());
        doc.setField(TASK, dataset.task().pathName());
        try {
            doc.setField(TAGS_JSON, objectMapper.writeValueAsString(dataset.tags()));
            doc.setField(METADATA_JSON, objectMapper.writeValueAsString(dataset.metadata()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize dataset " + dataset.name(), e);
        }
        doc.setField(CREATED_AT, Date.from(dataset.createdAt()));
        doc.setField(LAST_UPDATED, Date.from(dataset.lastUpdated()));
        return doc;
    }

    private Dataset fromDocument(SolrDocument doc) {
        try {
            return new Dataset(
                    String.valueOf(doc.getFirstValue(NAME)),
                    TaskType.fromPathName(String.valueOf(doc.getFirstValue(TASK))),
                    objectMapper.readValue(String.valueOf(doc.getFirstValue(TAGS_JSON)), TAGS),
                    objectMapper.readValue(String.valueOf(doc.getFirstValue(METADATA_JSON)), METADATA),
                    ((Date) doc.getFirstValue(CREATED_AT)).toInstant(),
                    ((Date) doc.getFirstValue(LAST_UPDATED)).toInstant()
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored dataset " + doc.getFirstValue(NAME) + " is corrupt", e);
        }
    }
}

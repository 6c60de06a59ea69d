package dev.aparikh.annotationsearch.record.store;

import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.RecordId;
import dev.aparikh.annotationsearch.record.model.VectorValue;
import dev.aparikh.annotationsearch.solr.SolrCapabilities;
import dev.aparikh.annotationsearch.solr.SolrCollectionManager;
import dev.aparikh.annotationsearch.solr.SolrExceptions;
import dev.aparikh.annotationsearch.solr.SolrFields;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.request.UpdateRequest;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.SolrInputDocument;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link RecordStore} keeping each dataset in its own Solr collection.
 *
 * <p>An upsert reads the stored document through real-time get, merges in memory and writes the
 * whole document back conditioned on the {@code _version_} it read ({@code -1} when the id was
 * absent). A concurrent writer therefore makes the losing write fail with a conflict instead of
 * silently dropping either merge. No retry happens here.
 */
@Repository
public class SolrRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(SolrRecordStore.class);

    static final long MUST_NOT_EXIST = -1L;
    static final long MUST_EXIST = 1L;

    private final SolrClient solrClient;
    private final SolrCollectionManager collections;
    private final SolrCapabilities capabilities;
    private final SolrRecordMapper mapper;
    private final Clock clock;

    public SolrRecordStore(SolrClient solrClient,
                           SolrCollectionManager collections,
                           SolrCapabilities capabilities,
                           SolrRecordMapper mapper,
                           Clock clock) {
        this.solrClient = solrClient;
        this.collections = collections;
        this.capabilities = capabilities;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public AnnotationRecord upsert(String dataset, AnnotationRecord record) {
        RecordId id = SolrRecordMapper.requireId(record);
        String collection = collections.ensureRecordCollection(dataset);
        try {
            SolrDocument existingDoc = solrClient.getById(collection, id.value());
            AnnotationRecord existing = existingDoc != null ? mapper.fromDocument(existingDoc) : null;
            long version = existingDoc != null ? versionOf(existingDoc) : MUST_NOT_EXIST;

            AnnotationRecord merged = existing != null ? existing.mergedWith(record) : record;
            AnnotationRecord stored = mapper.withDerivedFields(merged,
                    nextLastUpdated(existing != null ? existing.lastUpdated() : null));

            SolrInputDocument doc = mapper.toDocument(stored, vectorFields(collection, stored.vectors()));
            doc.setField(SolrFields.VERSION, version);

            UpdateRequest request = new UpdateRequest();
            request.add(doc);
            request.process(solrClient, collection);

            log.debug("{} record '{}' in '{}'", existing != null ? "Merged" : "Created", id, collection);
            return stored;
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("write record " + id + " of dataset " + dataset, e);
        }
    }

    @Override
    public Optional<AnnotationRecord> get(String dataset, RecordId id) {
        String collection = collections.recordCollection(dataset);
        try {
            SolrDocument doc = solrClient.getById(collection, id.value());
            return Optional.ofNullable(doc).map(mapper::fromDocument);
        } catch (SolrServerException | IOException | SolrException e) {
            if (SolrExceptions.isNotFound(e)) {
                return Optional.empty();
            }
            throw SolrExceptions.translate("read record " + id + " of dataset " + dataset, e);
        }
    }

    @Override
    public void refresh(String dataset) {
        String collection = collections.recordCollection(dataset);
        try {
            solrClient.commit(collection);
        } catch (SolrServerException | IOException | SolrException e) {
            throw SolrExceptions.translate("refresh dataset " + dataset, e);
        }
    }

    /**
     * Write time for a record last written at {@code previous}: now, pushed at least one
     * millisecond past {@code previous} so consecutive writes are strictly ordered.
     */
    Instant nextLastUpdated(@Nullable Instant previous) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusMillis(1);
        }
        return now;
    }

    private Map<String, String> vectorFields(String collection, @Nullable Map<String, VectorValue> vectors) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (vectors == null || vectors.isEmpty() || !capabilities.vectorSearchSupported()) {
            return fields;
        }
        vectors.forEach((name, vector) ->
                fields.put(name, collections.ensureVectorField(collection, name, vector.value().size())));
        return fields;
    }

    private static long versionOf(SolrDocument doc) {
        Object version = doc.getFirstValue(SolrFields.VERSION);
        return version instanceof Number number ? number.longValue() : MUST_EXIST;
    }
}

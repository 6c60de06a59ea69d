package dev.aparikh.annotationsearch.indexing.service;

import dev.aparikh.annotationsearch.dataset.repository.DatasetRegistry;
import dev.aparikh.annotationsearch.error.BackendUnavailableException;
import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.error.ConcurrentUpdateException;
import dev.aparikh.annotationsearch.error.RecordValidationException;
import dev.aparikh.annotationsearch.indexing.model.BulkRequest;
import dev.aparikh.annotationsearch.indexing.model.BulkResponse;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.TaskType;
import dev.aparikh.annotationsearch.record.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service for ingesting batches of annotation records.
 *
 * <p>This service handles:
 * <ul>
 *   <li>Registering the dataset and merging its tags and metadata</li>
 *   <li>Validating and normalizing each record</li>
 *   <li>Creating or merging each record in the record store</li>
 *   <li>Tallying processed and failed records</li>
 * </ul>
 *
 * <p>A record that is invalid or rejected by the backend counts as failed and the batch goes on.
 * An unreachable backend aborts the batch.
 */
@Service
public class BulkIngestService {

    private static final Logger log = LoggerFactory.getLogger(BulkIngestService.class);

    private final DatasetRegistry datasetRegistry;
    private final RecordStore recordStore;
    private final RecordNormalizer normalizer;

    public BulkIngestService(DatasetRegistry datasetRegistry, RecordStore recordStore, RecordNormalizer normalizer) {
        this.datasetRegistry = datasetRegistry;
        this.recordStore = recordStore;
        this.normalizer = normalizer;
    }

    /**
     * Ingests a batch into {@code dataset}, creating the dataset on first use.
     *
     * @param dataset the dataset name
     * @param task    the task of the records
     * @param request tags, metadata and records to ingest
     * @return how many records were written and how many failed
     * @throws BadRequestException          if the dataset name is invalid or bound to another task
     * @throws BackendUnavailableException  if the backend cannot be reached
     */
    public BulkResponse bulk(String dataset, TaskType task, BulkRequest request) {
        log.debug("Bulk of {} records into dataset '{}'", request.records().size(), dataset);
        datasetRegistry.createOrUpdate(dataset, task, request.tagsOrEmpty(), request.metadataOrEmpty());

        int processed = 0;
        int failed = 0;
        for (AnnotationRecord record : request.records()) {
            try {
                normalizer.validate(record, task);
                recordStore.upsert(dataset, normalizer.normalize(record, task));
                processed++;
            } catch (RecordValidationException e) {
                log.warn("Rejected record in dataset '{}': {}", dataset, e.getMessage());
                failed++;
            } catch (ConcurrentUpdateException | BadRequestException e) {
                log.warn("Backend refused record {} in dataset '{}': {}",
                        record.id(), dataset, e.getMessage());
                failed++;
            }
        }
        if (processed > 0) {
            recordStore.refresh(dataset);
        }

        log.info("Bulk into dataset '{}' done: {} processed, {} failed", dataset, processed, failed);
        return new BulkResponse(dataset, processed, failed);
    }
}

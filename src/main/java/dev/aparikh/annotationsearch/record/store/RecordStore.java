package dev.aparikh.annotationsearch.record.store;

import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.RecordId;

import java.util.Optional;

/**
 * Per-dataset storage of annotation records keyed by id.
 */
public interface RecordStore {

    /**
     * Creates the record, or merges it into the stored one with the same id. Non-null components of
     * {@code record} replace the stored values; the rest are kept. Derived values are recomputed
     * from the merged record before it is written.
     *
     * @param dataset the dataset name
     * @param record  the full or partial record; its id must be set
     * @return the record as written
     * @throws dev.aparikh.annotationsearch.error.ConcurrentUpdateException if another writer
     *         committed the same id between the read and the write
     * @throws dev.aparikh.annotationsearch.error.BackendUnavailableException if the backend
     *         cannot be reached
     */
    AnnotationRecord upsert(String dataset, AnnotationRecord record);

    Optional<AnnotationRecord> get(String dataset, RecordId id);

    /**
     * Makes every write accepted so far visible to searches.
     */
    void refresh(String dataset);
}

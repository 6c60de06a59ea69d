package dev.aparikh.annotationsearch.indexing.service;

import dev.aparikh.annotationsearch.TestUtils;
import dev.aparikh.annotationsearch.dataset.repository.DatasetRegistry;
import dev.aparikh.annotationsearch.error.BackendUnavailableException;
import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.error.ConcurrentUpdateException;
import dev.aparikh.annotationsearch.indexing.model.BulkRequest;
import dev.aparikh.annotationsearch.indexing.model.BulkResponse;
import dev.aparikh.annotationsearch.record.model.AnnotationRecord;
import dev.aparikh.annotationsearch.record.model.RecordId;
import dev.aparikh.annotationsearch.record.model.RecordStatus;
import dev.aparikh.annotationsearch.record.model.TaskType;
import dev.aparikh.annotationsearch.record.store.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static dev.aparikh.annotationsearch.TestUtils.annotation;
import static dev.aparikh.annotationsearch.TestUtils.text;
import static dev.aparikh.annotationsearch.TestUtils.textRecord;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkIngestServiceTest {

    private static final String DATASET = "test";

    @Mock
    private DatasetRegistry datasetRegistry;

    @Mock
    private RecordStore recordStore;

    private BulkIngestService bulkIngestService;

    @BeforeEach
    void setUp() {
        bulkIngestService = new BulkIngestService(datasetRegistry, recordStore,
                new RecordNormalizer(TestUtils.defaultProperties()));
    }

    @Test
    void shouldRegisterDatasetThenWriteEveryRecord() {
        // Given
        BulkRequest request = new BulkRequest(Map.of("env", "test"), Map.of("owner", text("team")),
                List.of(textRecord(0, "my data"), textRecord(1, "your data")));

        // When
        BulkResponse response = bulkIngestService.bulk(DATASET, TaskType.TEXT_CLASSIFICATION, request);

        // Then
        assertEquals(new BulkResponse(DATASET, 2, 0), response);
        InOrder order = inOrder(datasetRegistry, recordStore);
        order.verify(datasetRegistry).createOrUpdate(DATASET, TaskType.TEXT_CLASSIFICATION,
                Map.of("env", "test"), Map.of("owner", text("team")));
        order.verify(recordStore, times(2)).upsert(eq(DATASET), any(AnnotationRecord.class));
        order.verify(recordStore).refresh(DATASET);
    }

    @Test
    void invalidRecordsAreCountedAndSkipped() {
        // Given
        AnnotationRecord noInputs = textRecord(1, "x").toBuilder().inputs(Map.of()).build();
        BulkRequest request = new BulkRequest(null, null, Arrays.asList(textRecord(0, "ok"), noInputs, null));

        // When
        BulkResponse response = bulkIngestService.bulk(DATASET, TaskType.TEXT_CLASSIFICATION, request);

        // Then
        assertEquals(new BulkResponse(DATASET, 1, 2), response);
        verify(recordStore, times(1)).upsert(eq(DATASET), any(AnnotationRecord.class));
    }

    @Test
    void rejectedWritesAreCountedAsFailed() {
        // Given
        when(recordStore.upsert(eq(DATASET), any(AnnotationRecord.class))).thenAnswer(invocation -> {
            AnnotationRecord record = invocation.getArgument(1);
            if (record.id().equals(RecordId.of(1))) {
                throw new ConcurrentUpdateException("Concurrent update", new IOException("conflict"));
            }
            if (record.id().equals(RecordId.of(2))) {
                throw new BadRequestException("Document contains multiple values for uniqueKey");
            }
            return record;
        });
        BulkRequest request = new BulkRequest(null, null,
                List.of(textRecord(0, "a"), textRecord(1, "b"), textRecord(2, "c")));

        // When
        BulkResponse response = bulkIngestService.bulk(DATASET, TaskType.TEXT_CLASSIFICATION, request);

        // Then
        assertEquals(new BulkResponse(DATASET, 1, 2), response);
        verify(recordStore).refresh(DATASET);
    }

    @Test
    void unreachableBackendAbortsTheBatch() {
        // Given
        when(recordStore.upsert(eq(DATASET), any(AnnotationRecord.class)))
                .thenThrow(new BackendUnavailableException("Backend unavailable", new IOException("refused")));
        BulkRequest request = new BulkRequest(null, null, List.of(textRecord(0, "a"), textRecord(1, "b")));

        // When/Then
        assertThrows(BackendUnavailableException.class,
                () -> bulkIngestService.bulk(DATASET, TaskType.TEXT_CLASSIFICATION, request));
        verify(recordStore, times(1)).upsert(eq(DATASET), any(AnnotationRecord.class));
        verify(recordStore, never()).refresh(DATASET);
    }

    @Test
    void datasetErrorsStopBeforeAnyRecordIsWritten() {
        // Given
        when(datasetRegistry.createOrUpdate(eq(DATASET), eq(TaskType.TOKEN_CLASSIFICATION), anyMap(), anyMap()))
                .thenThrow(new BadRequestException("Dataset test was created for task TextClassification"));
        BulkRequest request = new BulkRequest(null, null, List.of(textRecord(0, "a")));

        // When/Then
        assertThrows(BadRequestException.class,
                () -> bulkIngestService.bulk(DATASET, TaskType.TOKEN_CLASSIFICATION, request));
        verifyNoInteractions(recordStore);
    }

    @Test
    void recordsAreNormalizedBeforeTheyAreStored() {
        // Given
        AnnotationRecord record = textRecord(0, "a").toBuilder().annotation(annotation("ann", " Pos ")).build();
        BulkRequest request = new BulkRequest(null, null, List.of(record));

        // When
        bulkIngestService.bulk(DATASET, TaskType.TEXT_CLASSIFICATION, request);

        // Then
        ArgumentCaptor<AnnotationRecord> stored = ArgumentCaptor.forClass(AnnotationRecord.class);
        verify(recordStore).upsert(eq(DATASET), stored.capture());
        assertEquals("Pos", stored.getValue().annotation().labels().get(0).label());
        assertEquals(RecordStatus.VALIDATED, stored.getValue().status());
    }

    @Test
    void emptyBatchOnlyRegistersTheDataset() {
        BulkResponse response = bulkIngestService.bulk(DATASET, TaskType.TEXT_CLASSIFICATION,
                new BulkRequest(null, null, null));

        assertEquals(new BulkResponse(DATASET, 0, 0), response);
        verify(datasetRegistry).createOrUpdate(DATASET, TaskType.TEXT_CLASSIFICATION, Map.of(), Map.of());
        verifyNoInteractions(recordStore);
    }
}

package dev.aparikh.annotationsearch.dataset.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.aparikh.annotationsearch.dataset.model.Dataset;
import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.error.NotFoundException;
import dev.aparikh.annotationsearch.record.model.TaskType;
import dev.aparikh.annotationsearch.solr.SolrCollectionManager;
import dev.aparikh.annotationsearch.solr.SolrFields;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.request.UpdateRequest;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrInputDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;

import static dev.aparikh.annotationsearch.TestUtils.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolrDatasetRegistryTest {

    private static final String REGISTRY = "datasets";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private SolrClient solrClient;

    @Mock
    private SolrCollectionManager collections;

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private SolrDatasetRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SolrDatasetRegistry(solrClient, collections, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateDatasetAndItsRecordCollection() throws Exception {
        // Given
        when(collections.ensureDatasetsCollection()).thenReturn(REGISTRY);
        when(solrClient.getById(REGISTRY, "test")).thenReturn(null);

        // When
        Dataset dataset = registry.createOrUpdate("test", TaskType.TEXT_CLASSIFICATION,
                Map.of("env", "test"), Map.of());

        // Then
        assertEquals(new Dataset("test", TaskType.TEXT_CLASSIFICATION, Map.of("env", "test"), Map.of(), NOW, NOW),
                dataset);
        SolrInputDocument doc = capturedDocument();
        assertEquals(-1L, doc.getFieldValue(SolrFields.VERSION));
        assertEquals("TextClassification", doc.getFieldValue(SolrFields.DatasetFields.TASK));
        verify(collections).ensureRecordCollection("test");
    }

    @Test
    void shouldMergeTagsAndMetadataAdditively() throws Exception {
        // Given
        when(collections.ensureDatasetsCollection()).thenReturn(REGISTRY);
        when(solrClient.getById(REGISTRY, "test")).thenReturn(storedDataset("TextClassification",
                "{\"env\":\"dev\",\"team\":\"a\"}", "{\"owner\":\"x\"}", 7L));

        // When
        Dataset dataset = registry.createOrUpdate("test", TaskType.TEXT_CLASSIFICATION,
                Map.of("env", "prod"), Map.of("source", text("web")));

        // Then
        assertEquals(Map.of("env", "prod", "team", "a"), dataset.tags());
        assertEquals(Map.of("owner", text("x"), "source", text("web")), dataset.metadata());
        assertEquals(CREATED, dataset.createdAt());
        assertEquals(NOW, dataset.lastUpdated());
        assertEquals(7L, capturedDocument().getFieldValue(SolrFields.VERSION));
    }

    @Test
    void shouldRejectTaskChange() throws Exception {
        // Given
        when(collections.ensureDatasetsCollection()).thenReturn(REGISTRY);
        when(solrClient.getById(REGISTRY, "test")).thenReturn(storedDataset("TextClassification", "{}", "{}", 3L));

        // When/Then
        BadRequestException e = assertThrows(BadRequestException.class, () ->
                registry.createOrUpdate("test", TaskType.TOKEN_CLASSIFICATION, Map.of(), Map.of()));
        assertTrue(e.getMessage().startsWith("Dataset test was created for task TextClassification"));
        verify(solrClient, never()).request(any(UpdateRequest.class), eq(REGISTRY));
    }

    @Test
    void shouldRejectInvalidNames() {
        assertThrows(BadRequestException.class, () ->
                registry.createOrUpdate("Bad Name", TaskType.TEXT_CLASSIFICATION, Map.of(), Map.of()));
        assertThrows(BadRequestException.class, () ->
                registry.createOrUpdate("_hidden", TaskType.TEXT_CLASSIFICATION, Map.of(), Map.of()));
        verifyNoInteractions(collections, solrClient);
    }

    @Test
    void getOfMissingDatasetIsNotFound() throws Exception {
        when(collections.ensureDatasetsCollection()).thenReturn(REGISTRY);
        when(solrClient.getById(REGISTRY, "missing")).thenReturn(null);

        NotFoundException e = assertThrows(NotFoundException.class, () -> registry.get("missing"));
        assertEquals("Dataset with name=missing not found", e.getMessage());
    }

    @Test
    void findReadsStoredDataset() throws Exception {
        when(collections.ensureDatasetsCollection()).thenReturn(REGISTRY);
        when(solrClient.getById(REGISTRY, "test"))
                .thenReturn(storedDataset("TokenClassification", "{\"a\":\"b\"}", "{}", 1L));

        Dataset dataset = registry.find("test").orElseThrow();

        assertEquals(TaskType.TOKEN_CLASSIFICATION, dataset.task());
        assertEquals(Map.of("a", "b"), dataset.tags());
    }

    @Test
    void deleteDropsRecordsThenRegistryEntry() throws Exception {
        // Given
        when(collections.ensureDatasetsCollection()).thenReturn(REGISTRY);

        // When
        registry.delete("test");

        // Then
        InOrder order = inOrder(collections, solrClient);
        order.verify(collections).dropRecordCollection("test");
        order.verify(solrClient).deleteById(REGISTRY, "test");
        order.verify(solrClient).commit(REGISTRY);
    }

    private static SolrDocument storedDataset(String task, String tagsJson, String metadataJson, long version) {
        SolrDocument doc = new SolrDocument();
        doc.setField(SolrFields.ID, "test");
        doc.setField(SolrFields.DatasetFields.NAME, "test");
        doc.setField(SolrFields.DatasetFields.TASK, task);
        doc.setField(SolrFields.DatasetFields.TAGS_JSON, tagsJson);
        doc.setField(SolrFields.DatasetFields.METADATA_JSON, metadataJson);
        doc.setField(SolrFields.DatasetFields.CREATED_AT, Date.from(CREATED));
        doc.setField(SolrFields.DatasetFields.LAST_UPDATED, Date.from(CREATED));
        doc.setField(SolrFields.VERSION, version);
        return doc;
    }

    private SolrInputDocument capturedDocument() throws Exception {
        ArgumentCaptor<UpdateRequest> request = ArgumentCaptor.forClass(UpdateRequest.class);
        verify(solrClient).request(request.capture(), eq(REGISTRY));
        return request.getValue().getDocuments().get(0);
    }
}

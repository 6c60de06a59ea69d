package dev.aparikh.annotationsearch.search.service;

import dev.aparikh.annotationsearch.TestUtils;
import dev.aparikh.annotationsearch.search.model.Aggregations;
import dev.aparikh.annotationsearch.search.query.BackendQuery;
import dev.aparikh.annotationsearch.search.repository.SearchRepository;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.response.FacetField;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.client.solrj.response.RangeFacet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregationEngineTest {

    private static final String COLLECTION = "ds_test";
    private static final BackendQuery QUERY = new BackendQuery("*:*", List.of(), List.of("id asc"), null);

    @Mock
    private SearchRepository searchRepository;

    private AggregationEngine aggregationEngine;

    @BeforeEach
    void setUp() {
        aggregationEngine = new AggregationEngine(searchRepository, TestUtils.defaultProperties());
    }

    @Test
    void laterPagesHaveNoAggregations() {
        assertNull(aggregationEngine.aggregate(COLLECTION, QUERY, 10));
        verifyNoInteractions(searchRepository);
    }

    @Test
    @SuppressWarnings("unchecked")
    void firstPageCountsLabelsWordsScoresAndMetadata() {
        // Given
        QueryResponse first = response(Map.of(
                "predicted_as", facet("predicted_as", "Mocking", 2, "Test", 2),
                "status", facet("status", "Default", 3),
                "words", facet("words", "data", 1),
                "metadata_keys", facet("metadata_keys", "field.one", 2)
        ));
        RangeFacet.Numeric scores = new RangeFacet.Numeric("prediction_score", 0.0, 1.0, 0.05, null, null, null);
        scores.addCount("0.0", 0);
        scores.addCount("0.9", 1);
        scores.addCount("0.95", 2);
        when(first.getFacetRanges()).thenReturn(List.of(scores));
        QueryResponse second = response(Map.of(
                "metadata.field.one_ss", facet("metadata.field.one_ss", "1", 2)
        ));
        when(searchRepository.facet(eq(COLLECTION), eq(QUERY), any())).thenReturn(first, second);

        // When
        Aggregations aggregations = aggregationEngine.aggregate(COLLECTION, QUERY, 0);

        // Then
        assertEquals(Map.of("Mocking", 2L, "Test", 2L), aggregations.predictedAs());
        assertEquals(Map.of("Default", 3L), aggregations.status());
        assertEquals(Map.of("data", 1L), aggregations.words());
        assertTrue(aggregations.annotatedAs().isEmpty());
        assertEquals(Map.of("field.one", Map.of("1", 2L)), aggregations.metadata());
        assertEquals(Map.of("0.90-0.95", 1L, "0.95-1.00", 2L), aggregations.score());

        ArgumentCaptor<Consumer<SolrQuery>> facets = ArgumentCaptor.forClass(Consumer.class);
        verify(searchRepository, times(2)).facet(eq(COLLECTION), eq(QUERY), facets.capture());
        SolrQuery firstQuery = new SolrQuery();
        facets.getAllValues().get(0).accept(firstQuery);
        assertEquals("100", firstQuery.get("f.words.facet.limit"));
        assertEquals("-1", firstQuery.get("f.metadata_keys.facet.limit"));
        SolrQuery secondQuery = new SolrQuery();
        facets.getAllValues().get(1).accept(secondQuery);
        assertEquals(List.of("metadata.field.one_ss"), List.of(secondQuery.getFacetFields()));
    }

    @Test
    void noMetadataKeysMeansSingleRequest() {
        // Given
        QueryResponse first = response(Map.of());
        when(searchRepository.facet(eq(COLLECTION), eq(QUERY), any())).thenReturn(first);

        // When
        Aggregations aggregations = aggregationEngine.aggregate(COLLECTION, QUERY, 0);

        // Then
        assertTrue(aggregations.metadata().isEmpty());
        assertTrue(aggregations.score().isEmpty());
        verify(searchRepository, times(1)).facet(eq(COLLECTION), eq(QUERY), any());
    }

    private static QueryResponse response(Map<String, FacetField> facets) {
        QueryResponse response = mock(QueryResponse.class);
        Map<String, FacetField> byName = new HashMap<>(facets);
        when(response.getFacetField(anyString())).thenAnswer(invocation -> byName.get(invocation.<String>getArgument(0)));
        return response;
    }

    private static FacetField facet(String name, Object... valueCountPairs) {
        FacetField facet = new FacetField(name);
        for (int i = 0; i < valueCountPairs.length; i += 2) {
            facet.add((String) valueCountPairs[i], ((Integer) valueCountPairs[i + 1]).longValue());
        }
        return facet;
    }
}

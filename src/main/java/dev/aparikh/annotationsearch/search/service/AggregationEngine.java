package dev.aparikh.annotationsearch.search.service;

import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import dev.aparikh.annotationsearch.search.model.Aggregations;
import dev.aparikh.annotationsearch.search.query.BackendQuery;
import dev.aparikh.annotationsearch.search.repository.SearchRepository;
import dev.aparikh.annotationsearch.solr.SolrFields;
import org.apache.solr.client.solrj.response.FacetField;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.client.solrj.response.RangeFacet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes value counts over every record a query matches.
 *
 * <p>Aggregations are only computed for the first page; any request with {@code from > 0} gets
 * {@code null}. Label, agent, status, word and score counts come from one facet request. Metadata
 * counts need the keys first, so they take a second request over the keys found by the first.
 */
@Component
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private static final List<String> TERM_FACETS = List.of(
            SolrFields.PREDICTED_AS,
            SolrFields.ANNOTATED_AS,
            SolrFields.PREDICTED_BY,
            SolrFields.ANNOTATED_BY,
            SolrFields.STATUS,
            SolrFields.PREDICTED,
            SolrFields.METADATA_KEYS
    );

    private final SearchRepository searchRepository;
    private final AnnotationSearchProperties.Search settings;

    public AggregationEngine(SearchRepository searchRepository, AnnotationSearchProperties properties) {
        this.searchRepository = searchRepository;
        this.settings = properties.search();
    }

    public @Nullable Aggregations aggregate(String collection, BackendQuery query, int from) {
        if (from > 0) {
            log.debug("Skipping aggregations for page starting at {}", from);
            return null;
        }
        double gap = settings.scoreBucketGap();
        QueryResponse response = searchRepository.facet(collection, query, solrQuery -> {
            TERM_FACETS.forEach(solrQuery::addFacetField);
            solrQuery.set("f." + SolrFields.METADATA_KEYS + ".facet.limit", -1);
            solrQuery.addFacetField(SolrFields.WORDS);
            solrQuery.set("f." + SolrFields.WORDS + ".facet.limit", settings.wordCloudSize());
            solrQuery.addNumericRangeFacet(SolrFields.PREDICTION_SCORE, 0.0, 1.0, gap);
            solrQuery.set("f." + SolrFields.PREDICTION_SCORE + ".facet.range.include", "lower", "edge");
        });

        Map<String, Long> metadataKeys = counts(response.getFacetField(SolrFields.METADATA_KEYS));
        return new Aggregations(
                counts(response.getFacetField(SolrFields.PREDICTED_AS)),
                counts(response.getFacetField(SolrFields.ANNOTATED_AS)),
                counts(response.getFacetField(SolrFields.PREDICTED_BY)),
                counts(response.getFacetField(SolrFields.ANNOTATED_BY)),
                counts(response.getFacetField(SolrFields.STATUS)),
                counts(response.getFacetField(SolrFields.PREDICTED)),
                counts(response.getFacetField(SolrFields.WORDS)),
                metadata(collection, query, List.copyOf(metadataKeys.keySet())),
                scoreBuckets(response, gap)
        );
    }

    private Map<String, Map<String, Long>> metadata(String collection, BackendQuery query, List<String> keys) {
        Map<String, Map<String, Long>> metadata = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return metadata;
        }
        QueryResponse response = searchRepository.facet(collection, query, solrQuery -> keys.forEach(key -> {
            String field = SolrFields.metadataValuesField(key);
            solrQuery.addFacetField(field);
            solrQuery.set("f." + field + ".facet.limit", settings.metadataValuesSize());
        }));
        keys.forEach(key -> metadata.put(key, counts(response.getFacetField(SolrFields.metadataValuesField(key)))));
        return metadata;
    }

    private static Map<String, Long> scoreBuckets(QueryResponse response, double gap) {
        Map<String, Long> buckets = new LinkedHashMap<>();
        if (response.getFacetRanges() == null) {
            return buckets;
        }
        for (RangeFacet<?, ?> range : response.getFacetRanges()) {
            if (!SolrFields.PREDICTION_SCORE.equals(range.getName())) {
                continue;
            }
            for (RangeFacet.Count count : range.getCounts()) {
                if (count.getCount() > 0) {
                    double start = Double.parseDouble(count.getValue());
                    buckets.put(String.format(Locale.ROOT, "%.2f-%.2f", start, Math.min(1.0, start + gap)),
                            (long) count.getCount());
                }
            }
        }
        return buckets;
    }

    private static Map<String, Long> counts(@Nullable FacetField facet) {
        Map<String, Long> counts = new LinkedHashMap<>();
        if (facet != null && facet.getValues() != null) {
            facet.getValues().forEach(count -> counts.put(count.getName(), count.getCount()));
        }
        return counts;
    }
}

package dev.aparikh.annotationsearch.search.service;

import dev.aparikh.annotationsearch.search.model.Aggregations;
import dev.aparikh.annotationsearch.search.model.SearchResults;
import dev.aparikh.annotationsearch.search.repository.SearchHits;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ResultAssembler {

    /**
     * Combines a page of hits with the aggregations of the whole result set. Hit order is kept.
     */
    public SearchResults assemble(SearchHits hits, @Nullable Aggregations aggregations) {
        return new SearchResults(hits.total(), List.copyOf(hits.records()), aggregations);
    }
}

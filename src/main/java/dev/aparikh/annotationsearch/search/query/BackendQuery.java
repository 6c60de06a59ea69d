package dev.aparikh.annotationsearch.search.query;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A search translated to Solr terms, independent of pagination.
 *
 * @param query         the main query: the rewritten text query, a KNN query or match-all
 * @param filterQueries filters every hit must match
 * @param sort          sort clauses in order, e.g. {@code predicted_by desc}
 * @param queryText     the raw text query, kept to report syntax errors found by Solr
 */
public record BackendQuery(
        String query,
        List<String> filterQueries,
        List<String> sort,
        @Nullable String queryText
) {

    public BackendQuery {
        filterQueries = List.copyOf(filterQueries);
        sort = List.copyOf(sort);
    }
}

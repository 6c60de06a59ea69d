package dev.aparikh.annotationsearch.search.repository;

import dev.aparikh.annotationsearch.error.InvalidTextSearchException;
import dev.aparikh.annotationsearch.record.store.SolrRecordMapper;
import dev.aparikh.annotationsearch.search.query.BackendQuery;
import dev.aparikh.annotationsearch.solr.SolrExceptions;
import dev.aparikh.annotationsearch.solr.SolrFields;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Runs translated searches against a dataset collection.
 *
 * <p>Requests go out as POST so that long filters and query vectors do not hit URI length limits.
 */
@Repository
public class SearchRepository {

    private static final Logger log = LoggerFactory.getLogger(SearchRepository.class);

    private static final String SYNTAX_ERROR = "SyntaxError";

    private final SolrClient solrClient;
    private final SolrRecordMapper mapper;

    public SearchRepository(SolrClient solrClient, SolrRecordMapper mapper) {
        this.solrClient = solrClient;
        this.mapper = mapper;
    }

    /**
     * Fetches the {@code limit} hits starting at {@code from}.
     */
    public SearchHits search(String collection, BackendQuery backendQuery, int from, int limit) {
        SolrQuery query = baseQuery(backendQuery);
        query.setStart(from);
        query.setRows(limit);
        query.set("sort", String.join(", ", backendQuery.sort()));
        query.setFields("*");

        QueryResponse response = execute(collection, query, backendQuery);
        log.debug("Search in '{}' matched {} records", collection, response.getResults().getNumFound());
        return new SearchHits(
                response.getResults().getNumFound(),
                response.getResults().stream().map(mapper::fromDocument).toList()
        );
    }

    /**
     * Runs a rows=0 query over the same matches, with facets configured by {@code facets}.
     */
    public QueryResponse facet(String collection, BackendQuery backendQuery, Consumer<SolrQuery> facets) {
        SolrQuery query = baseQuery(backendQuery);
        query.setRows(0);
        query.setFacet(true);
        query.setFacetMinCount(1);
        facets.accept(query);
        return execute(collection, query, backendQuery);
    }

    private static SolrQuery baseQuery(BackendQuery backendQuery) {
        SolrQuery query = new SolrQuery(backendQuery.query());
        query.set("df", SolrFields.TEXT);
        query.set("q.op", "AND");
        backendQuery.filterQueries().forEach(query::addFilterQuery);
        return query;
    }

    private QueryResponse execute(String collection, SolrQuery query, BackendQuery backendQuery) {
        try {
            return solrClient.query(collection, query, SolrRequest.METHOD.POST);
        } catch (SolrServerException | IOException | SolrException e) {
            if (backendQuery.queryText() != null && isSyntaxError(e)) {
                throw new InvalidTextSearchException(backendQuery.queryText(), e);
            }
            throw SolrExceptions.translate("search " + collection, e);
        }
    }

    private static boolean isSyntaxError(Exception e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SolrException solrException
                    && solrException.code() == SolrException.ErrorCode.BAD_REQUEST.code
                    && String.valueOf(solrException.getMessage()).contains(SYNTAX_ERROR)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

package dev.aparikh.annotationsearch.search.service;

import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import dev.aparikh.annotationsearch.dataset.model.Dataset;
import dev.aparikh.annotationsearch.dataset.repository.DatasetRegistry;
import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.record.model.TaskType;
import dev.aparikh.annotationsearch.search.model.Aggregations;
import dev.aparikh.annotationsearch.search.model.SearchRequest;
import dev.aparikh.annotationsearch.search.model.SearchResults;
import dev.aparikh.annotationsearch.search.query.BackendQuery;
import dev.aparikh.annotationsearch.search.query.QueryTranslator;
import dev.aparikh.annotationsearch.search.repository.SearchHits;
import dev.aparikh.annotationsearch.search.repository.SearchRepository;
import dev.aparikh.annotationsearch.solr.SolrCapabilities;
import dev.aparikh.annotationsearch.solr.SolrCollectionManager;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Searches the records of a dataset: translates the request, fetches the requested page,
 * aggregates the first page and assembles the response.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final DatasetRegistry datasetRegistry;
    private final SolrCollectionManager collections;
    private final SolrCapabilities capabilities;
    private final QueryTranslator queryTranslator;
    private final SearchRepository searchRepository;
    private final AggregationEngine aggregationEngine;
    private final ResultAssembler resultAssembler;
    private final AnnotationSearchProperties.Search settings;

    public SearchService(DatasetRegistry datasetRegistry,
                         SolrCollectionManager collections,
                         SolrCapabilities capabilities,
                         QueryTranslator queryTranslator,
                         SearchRepository searchRepository,
                         AggregationEngine aggregationEngine,
                         ResultAssembler resultAssembler,
                         AnnotationSearchProperties properties) {
        this.datasetRegistry = datasetRegistry;
        this.collections = collections;
        this.capabilities = capabilities;
        this.queryTranslator = queryTranslator;
        this.searchRepository = searchRepository;
        this.aggregationEngine = aggregationEngine;
        this.resultAssembler = resultAssembler;
        this.settings = properties.search();
    }

    /**
     * @param dataset the dataset name
     * @param task    the task the caller expects the dataset to have
     * @param request query and sort; may be empty
     * @param from    offset of the first hit
     * @param limit   page size; the configured default when {@code null}
     * @throws dev.aparikh.annotationsearch.error.NotFoundException if the dataset does not exist
     * @throws BadRequestException if the task does not match or the page is out of bounds
     */
    public SearchResults search(String dataset, TaskType task, SearchRequest request, int from,
                                @Nullable Integer limit) {
        int pageSize = limit != null ? limit : settings.defaultPageSize();
        validatePage(from, pageSize);

        Dataset target = datasetRegistry.get(dataset);
        if (target.task() != task) {
            throw new BadRequestException("Dataset " + dataset + " is a " + target.task().pathName()
                    + " dataset, not " + task.pathName());
        }
        String collection = collections.recordCollection(dataset);

        boolean vectorSearch = request.queryOrEmpty().vector() != null && capabilities.vectorSearchSupported();
        BackendQuery query = queryTranslator.translate(request, vectorSearch);
        SearchHits hits = searchRepository.search(collection, query, from, pageSize);
        Aggregations aggregations = aggregationEngine.aggregate(collection, query, from);

        log.debug("Search in dataset '{}' returned {} of {} records", dataset, hits.records().size(), hits.total());
        return resultAssembler.assemble(hits, aggregations);
    }

    private void validatePage(int from, int limit) {
        if (from < 0 || limit < 0) {
            throw new BadRequestException("Pagination values cannot be negative, got from=" + from + " limit=" + limit);
        }
        if ((long) from + limit > settings.maxResultWindow()) {
            throw new BadRequestException("Result window is too large, from + limit must be less than or equal to "
                    + settings.maxResultWindow() + " but was " + ((long) from + limit));
        }
    }
}

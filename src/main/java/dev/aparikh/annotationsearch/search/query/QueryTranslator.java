package dev.aparikh.annotationsearch.search.query;

import com.fasterxml.jackson.databind.JsonNode;
import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.record.RecordProjections;
import dev.aparikh.annotationsearch.record.model.RecordId;
import dev.aparikh.annotationsearch.record.model.RecordStatus;
import dev.aparikh.annotationsearch.search.model.RecordQuery;
import dev.aparikh.annotationsearch.search.model.SearchRequest;
import dev.aparikh.annotationsearch.search.model.SortConfig;
import dev.aparikh.annotationsearch.search.model.VectorQuery;
import dev.aparikh.annotationsearch.solr.SolrFields;
import dev.aparikh.annotationsearch.solr.SolrQueryUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates a {@link SearchRequest} into a {@link BackendQuery}.
 *
 * <p>Free text goes through {@link TextQueryParser}; structured filters become Solr filter
 * queries; sort ids are checked against {@link SortableField}. Hits are always sorted by
 * {@code id} last so that pages are stable. A vector query replaces the main query with a KNN
 * query, and any free text then becomes a filter.
 */
@Component
public class QueryTranslator {

    private static final Logger log = LoggerFactory.getLogger(QueryTranslator.class);

    private static final String ID_ASC = SolrFields.ID + " asc";
    private static final String SCORE_DESC = SolrFields.SCORE + " desc";
    private static final String LUCENE_LOCAL_PARAMS = "{!lucene q.op=AND df=" + SolrFields.TEXT + "}";

    private final TextQueryParser textQueryParser = new TextQueryParser();
    private final int topK;

    public QueryTranslator(AnnotationSearchProperties properties) {
        this.topK = properties.vectorSearch().topK();
    }

    /**
     * @param request                the search request
     * @param vectorSearchSupported  whether the backend can run KNN queries
     * @throws BadRequestException   for an unknown sort id or an unsupported vector query
     * @throws dev.aparikh.annotationsearch.error.InvalidTextSearchException for malformed free text
     */
    public BackendQuery translate(SearchRequest request, boolean vectorSearchSupported) {
        RecordQuery query = request.queryOrEmpty();
        String text = query.queryText() != null ? query.queryText() : "";
        String textQuery = textQueryParser.rewrite(text);

        List<String> filters = filters(query);
        String mainQuery = textQuery;
        VectorQuery vector = query.vector();
        if (vector != null) {
            mainQuery = knnQuery(vector, vectorSearchSupported);
            if (!SolrQueryUtils.MATCH_ALL.equals(textQuery)) {
                filters.add(0, LUCENE_LOCAL_PARAMS + textQuery);
            }
        }

        BackendQuery backendQuery = new BackendQuery(mainQuery, filters,
                sort(request.sortOrEmpty(), vector != null), text.isBlank() ? null : text);
        log.debug("Translated search into {}", backendQuery);
        return backendQuery;
    }

    private List<String> filters(RecordQuery query) {
        List<String> filters = new ArrayList<>();
        addAnyOf(filters, SolrFields.ID, query.ids() == null ? null : query.ids().stream().map(RecordId::value).toList());
        addAnyOf(filters, SolrFields.PREDICTED_BY, query.predictedBy());
        addAnyOf(filters, SolrFields.ANNOTATED_BY, query.annotatedBy());
        addAnyOf(filters, SolrFields.PREDICTED_AS, query.predictedAs());
        addAnyOf(filters, SolrFields.ANNOTATED_AS, query.annotatedAs());
        addAnyOf(filters, SolrFields.STATUS,
                query.status() == null ? null : query.status().stream().map(RecordStatus::label).toList());
        if (query.predicted() != null) {
            filters.add(SolrQueryUtils.anyOf(SolrFields.PREDICTED, List.of(query.predicted().name())));
        }
        if (query.metadata() != null) {
            for (Map.Entry<String, JsonNode> entry : query.metadata().entrySet()) {
                addAnyOf(filters, SolrFields.metadataValuesField(entry.getKey()),
                        RecordProjections.asTexts(entry.getValue()));
            }
        }
        if (query.score() != null && !query.score().isOpen()) {
            filters.add(SolrQueryUtils.range(SolrFields.PREDICTION_SCORE, query.score().from(), query.score().to()));
        }
        return filters;
    }

    private String knnQuery(VectorQuery vector, boolean vectorSearchSupported) {
        if (!vectorSearchSupported) {
            throw new BadRequestException("Vector search is not supported by the search backend");
        }
        if (vector.name() == null || vector.name().isBlank() || vector.value().isEmpty()) {
            throw new BadRequestException("Vector query needs a name and a non-empty value");
        }
        return SolrQueryUtils.buildKnnQuery(SolrFields.vectorField(vector.name()), topK, vector.value());
    }

    private static List<String> sort(List<SortConfig> sortConfigs, boolean vectorSearch) {
        List<String> clauses = new ArrayList<>();
        if (sortConfigs.isEmpty() && vectorSearch) {
            clauses.add(SCORE_DESC);
        }
        boolean sortsById = false;
        for (SortConfig config : sortConfigs) {
            if (config == null || config.id() == null) {
                throw new BadRequestException("Sort id is required. Valid values are: " + SortableField.validIds());
            }
            String field = SortableField.solrFieldFor(config.id());
            sortsById |= SolrFields.ID.equals(field);
            clauses.add(field + " " + config.orderOrDefault().name().toLowerCase(Locale.ROOT));
        }
        if (!sortsById) {
            clauses.add(ID_ASC);
        }
        return clauses;
    }

    private static void addAnyOf(List<String> filters, String field, @Nullable List<String> values) {
        if (values != null && !values.isEmpty()) {
            filters.add(SolrQueryUtils.anyOf(field, values));
        }
    }
}

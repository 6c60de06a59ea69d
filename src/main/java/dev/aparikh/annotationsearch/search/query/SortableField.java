package dev.aparikh.annotationsearch.search.query;

import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.solr.SolrFields;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Fields a search may be sorted by, with the Solr field each one sorts on. Metadata sorts name a
 * key, as in {@code metadata.source}.
 */
public enum SortableField {
    ID("id", SolrFields.ID),
    METADATA("metadata", null),
    SCORE("score", SolrFields.PREDICTION_SCORE),
    PREDICTED("predicted", SolrFields.PREDICTED),
    PREDICTED_AS("predicted_as", SolrFields.PREDICTED_AS_TOP),
    PREDICTED_BY("predicted_by", SolrFields.PREDICTED_BY),
    ANNOTATED_AS("annotated_as", SolrFields.ANNOTATED_AS_TOP),
    ANNOTATED_BY("annotated_by", SolrFields.ANNOTATED_BY),
    STATUS("status", SolrFields.STATUS),
    LAST_UPDATED("last_updated", SolrFields.LAST_UPDATED),
    EVENT_TIMESTAMP("event_timestamp", SolrFields.EVENT_TIMESTAMP);

    private static final String METADATA_PREFIX = "metadata.";

    private final String id;
    private final @Nullable String solrField;

    SortableField(String id, @Nullable String solrField) {
        this.id = id;
        this.solrField = solrField;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a sort id to the Solr field to sort on.
     *
     * @throws BadRequestException if the id is not sortable
     */
    public static String solrFieldFor(String sortId) {
        if (sortId.startsWith(METADATA_PREFIX)) {
            String key = sortId.substring(METADATA_PREFIX.length());
            if (key.isEmpty()) {
                throw missingMetadataKey();
            }
            return SolrFields.metadataSortField(key);
        }
        SortableField field = Arrays.stream(values())
                .filter(candidate -> candidate.id.equals(sortId))
                .findFirst()
                .orElseThrow(() -> new BadRequestException("Wrong sort id " + sortId + ". Valid values are: " + validIds()));
        if (field.solrField == null) {
            throw missingMetadataKey();
        }
        return field.solrField;
    }

    static String validIds() {
        return Arrays.stream(values())
                .map(field -> "'" + field.id + "'")
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static BadRequestException missingMetadataKey() {
        return new BadRequestException("Sorting by metadata needs a key, use metadata.<key>");
    }
}

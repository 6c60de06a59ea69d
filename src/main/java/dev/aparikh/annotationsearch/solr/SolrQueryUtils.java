package dev.aparikh.annotationsearch.solr;

import org.apache.solr.client.solrj.util.ClientUtils;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Utility class for building Apache Solr query strings.
 *
 * <p>Provides static methods for term filters over a set of values and for vector similarity
 * search using KNN (K-Nearest Neighbors).</p>
 */
public final class SolrQueryUtils {

    public static final String MATCH_ALL = "*:*";

    private SolrQueryUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Builds a KNN (K-Nearest Neighbors) query string for Solr vector search.
     *
     * <p>Constructs a query in the format: {@code {!knn f=vector_my_bert topK=10}[0.1, 0.2, 0.3]}</p>
     *
     * @param vectorFieldName the name of the vector field in the Solr schema
     * @param topK            the number of nearest neighbors to return
     * @param vector          the query vector
     * @return a KNN query string ready for use in Solr
     * @throws IllegalArgumentException if vectorFieldName is empty, topK <= 0, or vector is empty
     */
    public static String buildKnnQuery(String vectorFieldName, int topK, List<Float> vector) {
        if (vectorFieldName.isBlank()) {
            throw new IllegalArgumentException("Vector field name cannot be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be greater than 0");
        }
        if (vector.isEmpty()) {
            throw new IllegalArgumentException("Vector cannot be empty");
        }
        return String.format("{!knn f=%s topK=%d}%s", vectorFieldName, topK, formatVector(vector));
    }

    /**
     * Converts a list like {@code [0.1, 0.2, 0.3]} to the string {@code "[0.1, 0.2, 0.3]"}
     * expected by Solr's KNN query parser.
     */
    public static String formatVector(List<Float> vector) {
        return vector.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Builds a filter matching documents whose {@code field} holds any of {@code values},
     * e.g. {@code status:("Validated" OR "Edited")}.
     */
    public static String anyOf(String field, Collection<String> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("At least one value is required for field " + field);
        }
        return values.stream()
                .map(value -> "\"" + ClientUtils.escapeQueryChars(value) + "\"")
                .collect(Collectors.joining(" OR ", escapeFieldName(field) + ":(", ")"));
    }

    /**
     * Builds a range filter; a {@code null} bound is open.
     */
    public static String range(String field, @Nullable Object from, @Nullable Object to) {
        return escapeFieldName(field) + ":[" + bound(from) + " TO " + bound(to) + "]";
    }

    public static String escapeFieldName(String field) {
        return ClientUtils.escapeQueryChars(field);
    }

    private static String bound(@Nullable Object value) {
        return value == null ? "*" : ClientUtils.escapeQueryChars(value.toString());
    }
}

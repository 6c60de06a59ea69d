package dev.aparikh.annotationsearch.solr;

/**
 * Names of the Solr fields a record is stored under.
 *
 * <p>Stored-only JSON fields keep the record exactly as written; the remaining fields are
 * projections indexed for search, filtering, faceting and sorting. Per-key metadata and
 * per-input fields use the {@code *_ss}, {@code *_s} and {@code *_txt} dynamic fields of the
 * {@code _default} config set.
 */
public final class SolrFields {

    public static final String ID = "id";
    public static final String ID_TYPE = "id_type";
    public static final String VERSION = "_version_";
    public static final String SCORE = "score";

    public static final String INPUTS_JSON = "inputs_json";
    public static final String PREDICTION_JSON = "prediction_json";
    public static final String ANNOTATION_JSON = "annotation_json";
    public static final String METADATA_JSON = "metadata_json";
    public static final String METRICS_JSON = "metrics_json";
    public static final String VECTORS_JSON = "vectors_json";

    public static final String TEXT = "text";
    public static final String TEXT_EXACT = "text_exact";
    public static final String WORDS = "words";

    public static final String PREDICTED_AS = "predicted_as";
    public static final String PREDICTED_AS_TOP = "predicted_as_top";
    public static final String PREDICTED_BY = "predicted_by";
    public static final String ANNOTATED_AS = "annotated_as";
    public static final String ANNOTATED_AS_TOP = "annotated_as_top";
    public static final String ANNOTATED_BY = "annotated_by";
    public static final String PREDICTION_SCORE = "prediction_score";
    public static final String PREDICTED = "predicted";
    public static final String STATUS = "status";
    public static final String MULTI_LABEL = "multi_label";
    public static final String EVENT_TIMESTAMP = "event_timestamp";
    public static final String LAST_UPDATED = "last_updated";
    public static final String METADATA_KEYS = "metadata_keys";

    public static final String INPUTS_PREFIX = "inputs.";
    public static final String METADATA_PREFIX = "metadata.";
    public static final String VECTOR_PREFIX = "vector_";

    private static final String VALUES_SUFFIX = "_ss";
    private static final String SORT_SUFFIX = "_s";
    private static final String TEXT_SUFFIX = "_txt";

    /**
     * Fields of the dataset registry collection.
     */
    public static final class DatasetFields {

        public static final String NAME = "name";
        public static final String TASK = "task";
        public static final String TAGS_JSON = "tags_json";
        public static final String METADATA_JSON = "metadata_json";
        public static final String CREATED_AT = "created_at";
        public static final String LAST_UPDATED = "last_updated";

        private DatasetFields() {
        }
    }

    private SolrFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Multi-valued string field holding every value of a metadata key.
     */
    public static String metadataValuesField(String key) {
        return METADATA_PREFIX + encode(key) + VALUES_SUFFIX;
    }

    /**
     * Single-valued string field holding the first value of a metadata key, used for sorting.
     */
    public static String metadataSortField(String key) {
        return METADATA_PREFIX + encode(key) + SORT_SUFFIX;
    }

    public static String inputTextField(String input) {
        return INPUTS_PREFIX + encode(input) + TEXT_SUFFIX;
    }

    public static String vectorField(String name) {
        return VECTOR_PREFIX + encode(name);
    }

    /**
     * Makes an arbitrary key usable inside a field name. Letters, digits, {@code _} and {@code .}
     * are kept; any other character becomes {@code _uXXXX} with its UTF-16 code in hex.
     */
    static String encode(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char ch = key.charAt(i);
            if ((ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '.') {
                sb.append(ch);
            } else {
                sb.append(String.format("_u%04X", (int) ch));
            }
        }
        return sb.toString();
    }
}

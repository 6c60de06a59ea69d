package dev.aparikh.annotationsearch.config;

import dev.aparikh.annotationsearch.record.model.RecordStatus;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Engine settings bound from {@code annotation-search.*}.
 *
 * @param collections  how datasets map onto Solr collections
 * @param search       pagination and aggregation limits
 * @param ingest       normalization policy applied to ingested records
 * @param vectorSearch k-nearest-neighbour search settings
 */
@ConfigurationProperties(prefix = "annotation-search")
public record AnnotationSearchProperties(
        @DefaultValue Collections collections,
        @DefaultValue Search search,
        @DefaultValue Ingest ingest,
        @DefaultValue VectorSearch vectorSearch
) {

    /**
     * @param prefix            prepended to a dataset name to form its record collection
     * @param datasets          collection holding the dataset registry
     * @param configSet         Solr config set used when a collection is created
     * @param numShards         shards per created collection
     * @param replicationFactor replicas per shard
     */
    public record Collections(
            @DefaultValue("ds_") String prefix,
            @DefaultValue("datasets") String datasets,
            @DefaultValue("_default") String configSet,
            @DefaultValue("1") int numShards,
            @DefaultValue("1") int replicationFactor
    ) {
    }

    /**
     * @param defaultPageSize    page size when the request carries no {@code limit}
     * @param maxResultWindow    upper bound for {@code from + limit}
     * @param wordCloudSize      number of tokens returned in the {@code words} aggregation
     * @param metadataValuesSize values returned per metadata key
     * @param scoreBucketGap     width of the {@code score} aggregation buckets
     */
    public record Search(
            @DefaultValue("50") int defaultPageSize,
            @DefaultValue("10000") int maxResultWindow,
            @DefaultValue("100") int wordCloudSize,
            @DefaultValue("100") int metadataValuesSize,
            @DefaultValue("0.05") double scoreBucketGap
    ) {
    }

    /**
     * @param multiLabelThreshold minimum score for a label to count as predicted in multi-label records
     * @param annotatedStatus     status given to records that arrive with an annotation and no status
     * @param stopWords           tokens left out of the word cloud; {@code null} uses the built-in list
     */
    public record Ingest(
            @DefaultValue("0.5") double multiLabelThreshold,
            @DefaultValue("VALIDATED") RecordStatus annotatedStatus,
            @Nullable List<String> stopWords
    ) {
    }

    /**
     * @param enabled    forces vector support on or off; {@code null} probes the backend once
     * @param topK       neighbours requested from the kNN query
     * @param similarity similarity function of created vector fields
     */
    public record VectorSearch(
            @Nullable Boolean enabled,
            @DefaultValue("1000") int topK,
            @DefaultValue("euclidean") String similarity
    ) {
    }
}

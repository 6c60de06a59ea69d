package dev.aparikh.annotationsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Connection settings for the Solr backend.
 *
 * @param url            base URL of the Solr node; normalized by {@link SolrConfig}
 * @param connectTimeout time allowed to establish a connection
 * @param requestTimeout time allowed for a whole request, response included
 */
@ConfigurationProperties(prefix = "solr")
public record SolrConfigurationProperties(
        @DefaultValue("http://localhost:8983") String url,
        @DefaultValue("10s") Duration connectTimeout,
        @DefaultValue("60s") Duration requestTimeout
) {
}

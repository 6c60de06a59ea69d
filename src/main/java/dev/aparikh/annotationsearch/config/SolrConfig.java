package dev.aparikh.annotationsearch.config;

import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.impl.HttpJdkSolrClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the process-wide Solr client.
 *
 * <p>A single {@link SolrClient} is created at startup, shared by every component that talks
 * to Solr and closed when the application context shuts down. The client is built on the JDK
 * {@code HttpClient}, so no Jetty client is pulled onto the runtime path next to the servlet
 * container.
 *
 * <p><strong>Supported URL Formats:</strong>
 *
 * <ul>
 *   <li>{@code http://localhost:8983} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr} → {@code http://localhost:8983/solr/}
 *   <li>{@code http://localhost:8983/solr/} → {@code http://localhost:8983/solr/} (unchanged)
 * </ul>
 *
 * @see SolrConfigurationProperties
 */
@Configuration
@EnableConfigurationProperties({SolrConfigurationProperties.class, AnnotationSearchProperties.class})
public class SolrConfig {

    private static final Logger log = LoggerFactory.getLogger(SolrConfig.class);

    private static final String SOLR_PATH = "solr/";

    @Bean(destroyMethod = "close")
    SolrClient solrClient(SolrConfigurationProperties properties) {
        String url = normalizeUrl(properties.url());
        log.info("Connecting to Solr at {}", url);

        return new HttpJdkSolrClient.Builder(url)
                .withConnectionTimeout(properties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .withIdleTimeout(properties.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .withRequestTimeout(properties.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }

    /**
     * Ensures the URL ends with {@code /solr/} so collection paths resolve against it.
     *
     * @param url the configured URL
     * @return the normalized URL
     */
    static String normalizeUrl(String url) {
        String normalized = url.endsWith("/") ? url : url + "/";
        if (!normalized.endsWith("/" + SOLR_PATH) && !normalized.contains("/" + SOLR_PATH)) {
            normalized = normalized + SOLR_PATH;
        }
        return normalized;
    }
}

package dev.aparikh.annotationsearch.solr;

import dev.aparikh.annotationsearch.config.AnnotationSearchProperties;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.request.GenericSolrRequest;
import org.apache.solr.common.util.NamedList;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Detects whether the connected Solr can index and query dense vectors.
 *
 * <p>The backend is probed once through {@code /admin/info/system} and the answer is kept for the
 * lifetime of the process. A failed probe is not cached, so the next call tries again. Setting
 * {@code annotation-search.vector-search.enabled} skips the probe.
 */
@Component
public class SolrCapabilities {

    private static final Logger log = LoggerFactory.getLogger(SolrCapabilities.class);

    static final String SYSTEM_INFO_PATH = "/admin/info/system";
    private static final int MIN_VECTOR_MAJOR_VERSION = 9;

    private final SolrClient solrClient;
    private final @Nullable Boolean configured;

    private volatile @Nullable Boolean vectorSearchSupported;

    public SolrCapabilities(SolrClient solrClient, AnnotationSearchProperties properties) {
        this.solrClient = solrClient;
        this.configured = properties.vectorSearch().enabled();
    }

    public boolean vectorSearchSupported() {
        if (configured != null) {
            return configured;
        }
        Boolean supported = vectorSearchSupported;
        if (supported == null) {
            supported = probe();
            vectorSearchSupported = supported;
        }
        return supported;
    }

    private boolean probe() {
        try {
            NamedList<Object> info = solrClient.request(
                    new GenericSolrRequest(SolrRequest.METHOD.GET, SYSTEM_INFO_PATH));
            String version = String.valueOf(lookup(info.get("lucene"), "solr-spec-version"));
            boolean supported = majorVersion(version) >= MIN_VECTOR_MAJOR_VERSION;
            log.info("Solr {} detected, vector search {}", version, supported ? "enabled" : "disabled");
            return supported;
        } catch (Exception e) {
            throw SolrExceptions.translate("read backend version", e);
        }
    }

    static int majorVersion(String version) {
        int dot = version.indexOf('.');
        try {
            return Integer.parseInt(dot < 0 ? version : version.substring(0, dot));
        } catch (NumberFormatException e) {
            log.warn("Unrecognized Solr version '{}', assuming no vector support", version);
            return 0;
        }
    }

    private static @Nullable Object lookup(@Nullable Object section, String key) {
        if (section instanceof NamedList<?> namedList) {
            return namedList.get(key);
        }
        if (section instanceof Map<?, ?> map) {
            return map.get(key);
        }
        return null;
    }
}

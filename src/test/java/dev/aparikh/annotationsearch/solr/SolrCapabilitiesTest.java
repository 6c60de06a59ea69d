package dev.aparikh.annotationsearch.solr;

import dev.aparikh.annotationsearch.TestUtils;
import dev.aparikh.annotationsearch.error.BackendUnavailableException;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.request.GenericSolrRequest;
import org.apache.solr.common.util.NamedList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolrCapabilitiesTest {

    @Mock
    private SolrClient solrClient;

    @Test
    void configuredValueSkipsProbe() {
        SolrCapabilities capabilities = new SolrCapabilities(solrClient, TestUtils.properties(false));

        assertFalse(capabilities.vectorSearchSupported());
        verifyNoInteractions(solrClient);
    }

    @Test
    void probesOnceAndCachesTheAnswer() throws Exception {
        // Given
        when(solrClient.request(any(GenericSolrRequest.class))).thenReturn(systemInfo("9.7.0"));
        SolrCapabilities capabilities = new SolrCapabilities(solrClient, TestUtils.defaultProperties());

        // When
        boolean first = capabilities.vectorSearchSupported();
        boolean second = capabilities.vectorSearchSupported();

        // Then
        assertTrue(first);
        assertTrue(second);
        verify(solrClient, times(1)).request(any(GenericSolrRequest.class));
    }

    @Test
    void olderSolrHasNoVectorSupport() throws Exception {
        when(solrClient.request(any(GenericSolrRequest.class))).thenReturn(systemInfo("8.11.2"));

        assertFalse(new SolrCapabilities(solrClient, TestUtils.defaultProperties()).vectorSearchSupported());
    }

    @Test
    void failedProbeIsRetriedOnNextCall() throws Exception {
        // Given
        when(solrClient.request(any(GenericSolrRequest.class)))
                .thenThrow(new IOException("Connection refused"))
                .thenReturn(systemInfo("9.10.0"));
        SolrCapabilities capabilities = new SolrCapabilities(solrClient, TestUtils.defaultProperties());

        // When/Then
        assertThrows(BackendUnavailableException.class, capabilities::vectorSearchSupported);
        assertTrue(capabilities.vectorSearchSupported());
    }

    @Test
    void parsesMajorVersion() {
        assertEquals(9, SolrCapabilities.majorVersion("9.10.0"));
        assertEquals(10, SolrCapabilities.majorVersion("10"));
        assertEquals(0, SolrCapabilities.majorVersion("unknown"));
    }

    private static NamedList<Object> systemInfo(String version) {
        NamedList<Object> lucene = new NamedList<>();
        lucene.add("solr-spec-version", version);
        NamedList<Object> info = new NamedList<>();
        info.add("lucene", lucene);
        return info;
    }
}

package dev.aparikh.annotationsearch.solr;

import dev.aparikh.annotationsearch.error.ApiException;
import dev.aparikh.annotationsearch.error.BackendUnavailableException;
import dev.aparikh.annotationsearch.error.BadRequestException;
import dev.aparikh.annotationsearch.error.ConcurrentUpdateException;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.common.SolrException;

/**
 * Maps SolrJ failures onto API errors.
 *
 * <ul>
 *   <li>connection failures and 5xx responses: {@link BackendUnavailableException}
 *   <li>409 version conflicts: {@link ConcurrentUpdateException}
 *   <li>any other 4xx: {@link BadRequestException}
 * </ul>
 */
public final class SolrExceptions {

    private SolrExceptions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ApiException translate(String action, Exception e) {
        if (e instanceof ApiException apiException) {
            return apiException;
        }
        if (e instanceof SolrServerException && e.getCause() instanceof SolrException cause) {
            return translate(action, cause, e);
        }
        return translate(action, e, e);
    }

    private static ApiException translate(String action, Exception failure, Exception reported) {
        if (failure instanceof SolrException solrException) {
            int code = solrException.code();
            if (code == SolrException.ErrorCode.CONFLICT.code) {
                return new ConcurrentUpdateException("Concurrent update while trying to " + action, reported);
            }
            if (code >= 400 && code < 500) {
                return new BadRequestException("Backend rejected request to " + action + ": "
                        + solrException.getMessage(), reported);
            }
        }
        return new BackendUnavailableException("Backend unavailable while trying to " + action, reported);
    }

    public static boolean isNotFound(Exception e) {
        return e instanceof SolrException solrException
                && solrException.code() == SolrException.ErrorCode.NOT_FOUND.code;
    }
}

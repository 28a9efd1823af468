package org.opensearch.migrations.graphsync.common.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Moves one request to the cluster and back. Implementations emit every response, whatever its status;
 * the Mono errors only when nothing came back.
 */
@FunctionalInterface
public interface HttpClientAdapter {
    /**
     * @param path relative to the cluster's base URI, without a leading slash
     * @param body null for requests without a body
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);
}

package org.opensearch.migrations.graphsync.common.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Verb-level access to one cluster. Every request carries a user agent, the Host header and, when the
 * connection has credentials, basic authorization; requests with a body default to JSON.
 */
public abstract class AbstractRestClient {
    public static final String USER_AGENT = "GraphDocumentsSync-1.0";
    public static final String JSON_CONTENT_TYPE = "application/json";
    public static final String NDJSON_CONTENT_TYPE = "application/x-ndjson";

    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
    }

    /** The Host header for the endpoint; the scheme's default port is left out. */
    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        var uri = connectionContext.getUri();
        int defaultPort;
        switch (connectionContext.getProtocol()) {
            case HTTP:
                defaultPort = 80;
                break;
            case HTTPS:
                defaultPort = 443;
                break;
            default:
                throw new IllegalArgumentException("Unexpected protocol " + connectionContext.getProtocol());
        }
        return (uri.getPort() == -1 || uri.getPort() == defaultPort)
            ? uri.getHost()
            : uri.getHost() + ":" + uri.getPort();
    }

    public Mono<HttpResponse> getAsync(String path) {
        return send("GET", path, null, Map.of());
    }

    public Mono<HttpResponse> headAsync(String path) {
        return send("HEAD", path, null, Map.of());
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return send("PUT", path, body, Map.of());
    }

    public Mono<HttpResponse> deleteAsync(String path) {
        return send("DELETE", path, null, Map.of());
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return send("POST", path, body, Map.of());
    }

    /** Headers given here replace the defaults of the same name. */
    public Mono<HttpResponse> postAsync(String path, String body, Map<String, List<String>> headerOverrides) {
        return send("POST", path, body, headerOverrides);
    }

    private Mono<HttpResponse> send(String method, String path, String body,
                                    Map<String, List<String>> headerOverrides) {
        var headers = new LinkedHashMap<String, List<String>>();
        headers.put("User-Agent", List.of(USER_AGENT));
        headers.put("Host", List.of(getHostHeaderValue(connectionContext)));
        var authorization = connectionContext.getAuthorizationHeaderValue();
        if (authorization != null) {
            headers.put("Authorization", List.of(authorization));
        }
        if (body != null) {
            headers.put("Content-Type", List.of(JSON_CONTENT_TYPE));
        }
        if (headerOverrides != null) {
            headers.putAll(headerOverrides);
        }
        return httpClientAdapter.request(method, path, body, headers);
    }
}

package org.opensearch.migrations.graphsync.common.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Getter;

/**
 * Stores the connection context for an OpenSearch cluster
 */
@Getter
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final String username;
    @Getter(lombok.AccessLevel.NONE)
    private final String password;

    private ConnectionContext(IParams params) {
        if (params.getHost() == null || params.getHost().isBlank()) {
            throw new IllegalArgumentException("OpenSearch host is required");
        }

        this.insecure = params.isInsecure();

        try {
            uri = new URI(params.getHost()); // e.g. http://localhost:9200
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format", e);
        }

        if ("http".equals(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equals(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol in " + params.getHost());
        }

        if (params.getUsername() != null ^ params.getPassword() != null) {
            throw new IllegalArgumentException("Both username and password must be provided, or neither");
        }
        this.username = params.getUsername();
        this.password = params.getPassword();
    }

    public boolean isBasicAuthEnabled() {
        return username != null;
    }

    /** Value of the Authorization header, or null when the cluster is not secured. */
    public String getAuthorizationHeaderValue() {
        return isBasicAuthEnabled() ? HttpClientUtils.basicAuthorization(username, password) : null;
    }

    @Override
    public String toString() {
        return "ConnectionContext(uri=" + uri + ", insecure=" + insecure
            + ", basicAuth=" + isBasicAuthEnabled() + ")";
    }

    public interface IParams {
        String getHost();

        String getUsername();

        String getPassword();

        boolean isInsecure();

        default ConnectionContext toConnectionContext() {
            return new ConnectionContext(this);
        }
    }
}

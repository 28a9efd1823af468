package org.opensearch.migrations.graphsync.common.bolt;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;

/**
 * Stores where and how to reach the graph database over Bolt.
 * Credentials are sent only when both a username and a password are given.
 */
@Slf4j
@Getter
public class BoltConnectionContext {
    public static final int DEFAULT_PORT = 7687;

    private final String host;
    private final int port;
    private final String username;
    @Getter(lombok.AccessLevel.NONE)
    private final String password;

    private BoltConnectionContext(IParams params) {
        if (params.getHost() == null || params.getHost().isBlank()) {
            throw new IllegalArgumentException("Memgraph host is required");
        }
        this.host = params.getHost();
        this.port = params.getPort() == null ? DEFAULT_PORT : params.getPort();
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid Memgraph port " + port);
        }
        this.username = params.getUsername();
        this.password = params.getPassword();
        if (isBlank(username) ^ isBlank(password)) {
            log.warn("Only one of the Memgraph username and password is set, connecting without authentication");
        }
    }

    public String getUri() {
        return "bolt://" + host + ":" + port;
    }

    public boolean isAuthEnabled() {
        return !isBlank(username) && !isBlank(password);
    }

    public AuthToken getAuthToken() {
        return isAuthEnabled() ? AuthTokens.basic(username, password) : AuthTokens.none();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    @Override
    public String toString() {
        return "BoltConnectionContext(uri=" + getUri() + ", auth=" + isAuthEnabled() + ")";
    }

    public interface IParams {
        String getHost();

        Integer getPort();

        String getUsername();

        String getPassword();

        default BoltConnectionContext toConnectionContext() {
            return new BoltConnectionContext(this);
        }
    }
}

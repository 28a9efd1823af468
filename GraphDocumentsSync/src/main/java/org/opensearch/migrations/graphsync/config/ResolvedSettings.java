package org.opensearch.migrations.graphsync.config;

import org.opensearch.migrations.graphsync.common.bolt.BoltConnectionContext;
import org.opensearch.migrations.graphsync.common.http.ConnectionContext;
import org.opensearch.migrations.graphsync.pipeline.orchestration.SyncSettings;

import lombok.ToString;
import lombok.Value;

/**
 * The effective configuration of a run, after command line, environment, config file and defaults have
 * been merged. {@code toString()} never includes passwords.
 */
public record ResolvedSettings(
    MemgraphSettings memgraph,
    OpenSearchSettings opensearch,
    String indexSpecFile,
    SyncSettings syncSettings
) {
    @Value
    public static class MemgraphSettings implements BoltConnectionContext.IParams {
        String host;
        Integer port;
        String username;
        @ToString.Exclude
        String password;
    }

    @Value
    public static class OpenSearchSettings implements ConnectionContext.IParams {
        String host;
        String username;
        @ToString.Exclude
        String password;
        boolean insecure;
    }
}

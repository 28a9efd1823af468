package org.opensearch.migrations.graphsync.config;

import com.beust.jcommander.Parameter;

public class MemgraphArgs {
    @Parameter(names = {"--memgraph-host", "--memgraphHost"},
        description = "Memgraph host. Default: localhost")
    public String host;

    @Parameter(names = {"--memgraph-port", "--memgraphPort"},
        description = "Memgraph Bolt port. Default: 7687")
    public Integer port;

    @Parameter(names = {"--memgraph-username", "--memgraphUsername"},
        description = "Memgraph username; used only together with a password")
    public String username;

    @Parameter(names = {"--memgraph-password", "--memgraphPassword"},
        description = "Memgraph password; used only together with a username")
    public String password;
}

package org.opensearch.migrations.graphsync.config;

import com.beust.jcommander.Parameter;

public class OpenSearchArgs {
    @Parameter(names = {"--opensearch-host", "--opensearchHost"},
        description = "OpenSearch endpoint, e.g. http://localhost:9200. Without a scheme, the scheme follows "
            + "--opensearch-use-ssl. Default: http://localhost:9200")
    public String host;

    @Parameter(names = {"--opensearch-use-ssl", "--opensearchUseSsl"},
        description = "Use https when the host has no scheme")
    public Boolean useSsl;

    @Parameter(names = {"--opensearch-no-ssl", "--opensearchNoSsl"},
        description = "Use http when the host has no scheme")
    public Boolean noSsl;

    @Parameter(names = {"--opensearch-verify-certs", "--opensearchVerifyCerts"},
        description = "Verify the cluster's TLS certificate")
    public Boolean verifyCerts;

    @Parameter(names = {"--opensearch-no-verify-certs", "--opensearchNoVerifyCerts"},
        description = "Trust any TLS certificate the cluster presents. This is the default")
    public Boolean noVerifyCerts;

    @Parameter(names = {"--opensearch-username", "--opensearchUsername"},
        description = "OpenSearch username for basic auth; used only together with a password")
    public String username;

    @Parameter(names = {"--opensearch-password", "--opensearchPassword"},
        description = "OpenSearch password for basic auth; used only together with a username")
    public String password;
}

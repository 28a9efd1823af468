package org.opensearch.migrations.graphsync.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.opensearch.migrations.graphsync.common.bolt.BoltConnectionContext;
import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncConfigurationException;
import org.opensearch.migrations.graphsync.pipeline.orchestration.SyncSettings;
import org.opensearch.migrations.graphsync.pipeline.query.PaginatedQueryExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Merges the sources of configuration into {@link ResolvedSettings}.
 *
 * Precedence, highest first: command line, {@code OS_LOADER_*} environment variables (both already applied
 * to {@link SyncArgs}), the YAML config file, built-in defaults. Strings are trimmed and blank strings count
 * as unset. A negative flag such as {@code --no-allow-index-creation} beats its positive counterpart.
 */
@Slf4j
public class SettingsResolver {
    public static final String DEFAULT_CONFIG_FILE = "config.yaml";
    public static final String DEFAULT_MEMGRAPH_HOST = "localhost";
    public static final String DEFAULT_OPENSEARCH_HOST = "http://localhost:9200";

    private final Path workingDirectory;

    public SettingsResolver() {
        this(Path.of(""));
    }

    /**
     * @param workingDirectory where {@value #DEFAULT_CONFIG_FILE} is looked up when no config file is given
     */
    public SettingsResolver(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public ResolvedSettings resolve(SyncArgs args) {
        var file = loadConfigFile(trimToNull(args.config));

        var memgraph = resolveMemgraph(args.memgraph, file.memgraph);
        var opensearch = resolveOpenSearch(args.opensearch, file.opensearch);

        var indexSpecFile = first(trimToNull(args.indexSpecFile), trimToNull(file.indexSpecFile));
        if (indexSpecFile == null) {
            throw new SyncConfigurationException("index_spec_file not specified in configuration");
        }

        int defaultPageSize = first(args.defaultPageSize, file.defaultPageSize,
            PaginatedQueryExecutor.DEFAULT_PAGE_SIZE);
        if (defaultPageSize <= 0) {
            throw new SyncConfigurationException("default_page_size must be positive, got " + defaultPageSize);
        }

        var syncSettings = new SyncSettings(
            flag(args.clearExistingIndices, args.noClearExistingIndices, file.clearExistingIndices, false),
            flag(args.allowIndexCreation, args.noAllowIndexCreation, file.allowIndexCreation, true),
            trimNames(args.selectedIndices != null ? args.selectedIndices : file.selectedIndices),
            first(args.testMode, file.testMode, false),
            defaultPageSize
        );
        return new ResolvedSettings(memgraph, opensearch, indexSpecFile, syncSettings);
    }

    ConfigFile loadConfigFile(String explicitPath) {
        if (explicitPath != null) {
            var path = Path.of(explicitPath);
            if (!Files.isRegularFile(path)) {
                throw new SyncConfigurationException("Configuration file not found: " + explicitPath);
            }
            log.info("Reading configuration from {}", path);
            return ConfigFile.load(path);
        }
        var defaultPath = workingDirectory.resolve(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(defaultPath)) {
            log.info("Reading configuration from {}", defaultPath);
            return ConfigFile.load(defaultPath);
        }
        log.debug("No configuration file, using command line, environment and defaults only");
        return new ConfigFile();
    }

    private ResolvedSettings.MemgraphSettings resolveMemgraph(MemgraphArgs args, ConfigFile.Memgraph file) {
        var host = first(trimToNull(args.host), trimToNull(file.host), DEFAULT_MEMGRAPH_HOST);
        var port = first(args.port, file.port, BoltConnectionContext.DEFAULT_PORT);
        var username = first(trimToNull(args.username), trimToNull(file.username));
        var password = first(trimToNull(args.password), trimToNull(file.password));
        return new ResolvedSettings.MemgraphSettings(host, port, username, password);
    }

    private ResolvedSettings.OpenSearchSettings resolveOpenSearch(OpenSearchArgs args, ConfigFile.OpenSearch file) {
        boolean useSsl = flag(args.useSsl, args.noSsl, file.useSsl, false);
        boolean verifyCerts = flag(args.verifyCerts, args.noVerifyCerts, file.verifyCerts, false);
        var host = withScheme(first(trimToNull(args.host), trimToNull(file.host), DEFAULT_OPENSEARCH_HOST), useSsl);

        var username = first(trimToNull(args.username), trimToNull(file.username));
        var password = first(trimToNull(args.password), trimToNull(file.password));
        if (username == null ^ password == null) {
            log.warn("Only one of the OpenSearch username and password is set, connecting without authentication");
            username = null;
            password = null;
        }
        return new ResolvedSettings.OpenSearchSettings(host, username, password, !verifyCerts);
    }

    static String withScheme(String host, boolean useSsl) {
        if (host.contains("://")) {
            return host;
        }
        return (useSsl ? "https://" : "http://") + host;
    }

    static List<String> trimNames(List<String> names) {
        var trimmed = new ArrayList<String>();
        if (names == null) {
            return trimmed;
        }
        for (var name : names) {
            if (name == null) {
                continue;
            }
            // A config file may hold "a, b" as a single string
            for (var part : name.split(",")) {
                if (!part.isBlank()) {
                    trimmed.add(part.trim());
                }
            }
        }
        return trimmed;
    }

    private static boolean flag(Boolean positive, Boolean negative, Boolean fromFile, boolean defaultValue) {
        if (Boolean.TRUE.equals(negative)) {
            return false;
        }
        return first(positive, fromFile, defaultValue);
    }

    @SafeVarargs
    private static <T> T first(T... candidates) {
        for (var candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}

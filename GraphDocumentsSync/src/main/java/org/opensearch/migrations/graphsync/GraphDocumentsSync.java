package org.opensearch.migrations.graphsync;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.opensearch.migrations.graphsync.common.OpenSearchClient;
import org.opensearch.migrations.graphsync.common.bolt.BoltConnectionContext;
import org.opensearch.migrations.graphsync.common.http.ConnectionContext;
import org.opensearch.migrations.graphsync.config.IndexSpecLoader;
import org.opensearch.migrations.graphsync.config.ResolvedSettings;
import org.opensearch.migrations.graphsync.config.SettingsResolver;
import org.opensearch.migrations.graphsync.config.SyncArgs;
import org.opensearch.migrations.graphsync.jcommander.EnvVarParameterPuller;
import org.opensearch.migrations.graphsync.pipeline.adapter.BoltGraphQueryClient;
import org.opensearch.migrations.graphsync.pipeline.adapter.OpenSearchDocumentSink;
import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncConfigurationException;
import org.opensearch.migrations.graphsync.pipeline.ir.IndexSpec;
import org.opensearch.migrations.graphsync.pipeline.ir.RunReport;
import org.opensearch.migrations.graphsync.pipeline.orchestration.IndexSpecValidator;
import org.opensearch.migrations.graphsync.pipeline.orchestration.SyncOrchestrator;
import org.opensearch.migrations.graphsync.pipeline.sink.DocumentSink;
import org.opensearch.migrations.graphsync.pipeline.source.GraphQueryClient;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

/**
 * Syncs the results of read-only graph queries into OpenSearch indices, as declared by an index
 * specification file.
 */
@Slf4j
public class GraphDocumentsSync {
    public static final String ENV_PREFIX = "OS_LOADER_";

    public static final int SUCCESS_EXIT_CODE = 0;
    public static final int CONFIGURATION_ERROR_EXIT_CODE = 1;
    public static final int INDEX_FAILED_EXIT_CODE = 2;
    public static final int INTERRUPTED_EXIT_CODE = 130;

    /** Opens the connections a run needs; replaced in tests. */
    interface ClientFactory {
        GraphQueryClient graphClient(BoltConnectionContext connectionContext);

        DocumentSink documentSink(ConnectionContext connectionContext);
    }

    static final ClientFactory DEFAULT_CLIENTS = new ClientFactory() {
        @Override
        public GraphQueryClient graphClient(BoltConnectionContext connectionContext) {
            return new BoltGraphQueryClient(connectionContext);
        }

        @Override
        public DocumentSink documentSink(ConnectionContext connectionContext) {
            return new OpenSearchDocumentSink(new OpenSearchClient(connectionContext));
        }
    };

    private final EnvVarParameterPuller.EnvVarGetter envVarGetter;
    private final SettingsResolver settingsResolver;
    private final ClientFactory clientFactory;

    GraphDocumentsSync(EnvVarParameterPuller.EnvVarGetter envVarGetter, SettingsResolver settingsResolver,
                       ClientFactory clientFactory) {
        this.envVarGetter = envVarGetter;
        this.settingsResolver = settingsResolver;
        this.clientFactory = clientFactory;
    }

    public static void main(String[] args) {
        // Log4j must not shut down before our own hook has logged the interruption
        System.setProperty("log4j2.shutdownHookEnabled", "false");
        var finished = new AtomicBoolean(false);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Thread.currentThread().setName("Shutdown-Hook-Thread");
            if (!finished.get()) {
                log.atWarn().setMessage("Interrupted by user, exiting with code {}")
                    .addArgument(INTERRUPTED_EXIT_CODE).log();
            }
            LogManager.shutdown();
        }));

        int exitCode = new GraphDocumentsSync(System::getenv, new SettingsResolver(), DEFAULT_CLIENTS).run(args);
        finished.set(true);
        System.exit(exitCode);
    }

    /**
     * @return the process exit code: 0 when every index is done, 1 when the configuration is unusable and
     *         nothing was processed, 2 when at least one index failed
     */
    int run(String[] args) {
        var arguments = new SyncArgs();
        var jCommander = JCommander.newBuilder().addObject(arguments).programName("GraphDocumentsSync").build();
        try {
            jCommander.parse(args);
        } catch (ParameterException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            jCommander.usage();
            return CONFIGURATION_ERROR_EXIT_CODE;
        }
        // Environment only fills what the command line left unset
        EnvVarParameterPuller.injectFromEnv(arguments, envVarGetter, ENV_PREFIX);
        if (arguments.help) {
            jCommander.usage();
            return SUCCESS_EXIT_CODE;
        }
        if (arguments.verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }

        ResolvedSettings settings;
        List<IndexSpec> specs;
        BoltConnectionContext graphConnection;
        ConnectionContext searchConnection;
        try {
            settings = settingsResolver.resolve(arguments);
            logConfiguration(settings);
            specs = IndexSpecLoader.load(Path.of(settings.indexSpecFile()));
            IndexSpecValidator.validate(specs);
            graphConnection = settings.memgraph().toConnectionContext();
            searchConnection = settings.opensearch().toConnectionContext();
        } catch (SyncConfigurationException | IllegalArgumentException e) {
            log.atError().setMessage("Configuration error: {}").addArgument(e.getMessage())
                .setCause(arguments.verbose ? e : null).log();
            return CONFIGURATION_ERROR_EXIT_CODE;
        }

        log.info("Using graph database {} and search cluster {}", graphConnection, searchConnection);
        try (var graphClient = clientFactory.graphClient(graphConnection);
             var sink = clientFactory.documentSink(searchConnection)) {
            var report = new SyncOrchestrator(graphClient, sink, settings.syncSettings()).run(specs);
            logSummary(report);
            return report.isSuccess() ? SUCCESS_EXIT_CODE : INDEX_FAILED_EXIT_CODE;
        } catch (SyncConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return CONFIGURATION_ERROR_EXIT_CODE;
        } catch (Exception e) {
            log.error("Unexpected failure while syncing", e);
            return CONFIGURATION_ERROR_EXIT_CODE;
        }
    }

    private static void logConfiguration(ResolvedSettings settings) {
        var sync = settings.syncSettings();
        log.info("Configuration:");
        log.info("  index_spec_file: {}", settings.indexSpecFile());
        log.info("  clear_existing_indices: {}", sync.clearExistingIndices());
        log.info("  allow_index_creation: {}", sync.allowIndexCreation());
        if (!sync.selectedIndices().isEmpty()) {
            log.info("  selected_indices: {}", sync.selectedIndices());
        }
        log.info("  default_page_size: {}", sync.defaultPageSize());
        if (sync.testMode()) {
            log.info("  test_mode: true");
        }
    }

    private static void logSummary(RunReport report) {
        for (var index : report.indices()) {
            if (index.isDone()) {
                log.info("{}: {} ({} upserted, {} failed)", index.indexName(), index.finalState(),
                    index.totalUpserted(), index.totalFailed());
            } else {
                log.error("{}: {} ({})", index.indexName(), index.finalState(), index.failureReason());
            }
        }
        if (report.isSuccess()) {
            log.info("Data loading completed successfully");
        }
    }
}

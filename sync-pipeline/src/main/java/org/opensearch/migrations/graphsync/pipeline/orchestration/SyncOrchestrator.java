package org.opensearch.migrations.graphsync.pipeline.orchestration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.opensearch.migrations.graphsync.pipeline.SyncPipeline;
import org.opensearch.migrations.graphsync.pipeline.ir.IndexReport;
import org.opensearch.migrations.graphsync.pipeline.ir.IndexSpec;
import org.opensearch.migrations.graphsync.pipeline.ir.QueryReport;
import org.opensearch.migrations.graphsync.pipeline.ir.QuerySpec;
import org.opensearch.migrations.graphsync.pipeline.ir.RunReport;
import org.opensearch.migrations.graphsync.pipeline.ir.SyncState;
import org.opensearch.migrations.graphsync.pipeline.lifecycle.IndexLifecycleManager;
import org.opensearch.migrations.graphsync.pipeline.query.PaginatedQueryExecutor;
import org.opensearch.migrations.graphsync.pipeline.query.QueryValidator;
import org.opensearch.migrations.graphsync.pipeline.sink.DocumentSink;
import org.opensearch.migrations.graphsync.pipeline.source.GraphQueryClient;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs every index spec through VALIDATING, LOADING, UPDATING and DONE, one index after another.
 *
 * Any failure moves the index to FAILED and the run carries on with the next index; indices never share
 * documents, so they fail independently. Configuration problems are the exception: they are detected over
 * all specs up front and abort the run before anything is written.
 */
@Slf4j
public class SyncOrchestrator {

    private final SyncSettings settings;
    private final SyncListener listener;
    private final SyncPipeline pipeline;
    private final IndexLifecycleManager lifecycleManager;

    public SyncOrchestrator(GraphQueryClient graphClient, DocumentSink sink, SyncSettings settings) {
        this(graphClient, sink, settings, SyncListener.NOOP);
    }

    public SyncOrchestrator(GraphQueryClient graphClient, DocumentSink sink, SyncSettings settings,
                            SyncListener listener) {
        this.settings = settings;
        this.listener = listener;
        var executor = new PaginatedQueryExecutor(graphClient, settings.defaultPageSize(), settings.testMode());
        this.pipeline = new SyncPipeline(executor, sink, listener);
        this.lifecycleManager = new IndexLifecycleManager(sink);
    }

    /**
     * @throws org.opensearch.migrations.graphsync.pipeline.exceptions.SyncConfigurationException if the specs
     *         are malformed; nothing has been written in that case
     */
    public RunReport run(List<IndexSpec> specs) {
        IndexSpecValidator.validate(specs);
        var selected = select(specs);
        log.info("Processing {} indices", selected.size());
        if (settings.testMode()) {
            log.warn("Test mode: each query stops after its first page");
        }

        var reports = new ArrayList<IndexReport>(selected.size());
        for (var spec : selected) {
            var report = syncIndex(spec);
            reports.add(report);
            if (report.isDone()) {
                log.info("Index {} done: {} documents upserted, {} failed",
                    spec.indexName(), report.totalUpserted(), report.totalFailed());
            }
        }
        var runReport = new RunReport(reports);
        if (!runReport.isSuccess()) {
            log.warn("{} of {} indices failed: {}", runReport.failedIndices().size(), reports.size(),
                runReport.failedIndices().stream().map(IndexReport::indexName).collect(Collectors.joining(", ")));
        }
        return runReport;
    }

    List<IndexSpec> select(List<IndexSpec> specs) {
        var wanted = settings.selectedIndices().stream()
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (wanted.isEmpty()) {
            return specs;
        }
        var known = specs.stream().map(IndexSpec::indexName).collect(Collectors.toSet());
        wanted.stream()
            .filter(name -> !known.contains(name))
            .forEach(name -> log.warn("Selected index '{}' is not defined in the specification file", name));
        log.info("Restricting run to selected indices {}", wanted);
        return specs.stream().filter(spec -> wanted.contains(spec.indexName())).toList();
    }

    IndexReport syncIndex(IndexSpec spec) {
        var indexName = spec.indexName();
        var queryReports = new ArrayList<QueryReport>();
        try {
            transition(indexName, SyncState.VALIDATING);
            spec.allQueries().forEach(QueryValidator::validate);

            transition(indexName, SyncState.LOADING);
            lifecycleManager.ensure(indexName, settings.clearExistingIndices(), settings.allowIndexCreation())
                .block();
            runQuery(spec, spec.initialQuery(), queryReports);

            transition(indexName, SyncState.UPDATING);
            for (var update : spec.updateQueries()) {
                runQuery(spec, update, queryReports);
            }

            transition(indexName, SyncState.DONE);
            return new IndexReport(indexName, SyncState.DONE, queryReports, null);
        } catch (RuntimeException e) {
            var reason = describe(e);
            log.atError()
                .setMessage("Index {} failed: {}")
                .addArgument(indexName)
                .addArgument(reason)
                .setCause(e)
                .log();
            transition(indexName, SyncState.FAILED);
            return new IndexReport(indexName, SyncState.FAILED, queryReports, reason);
        }
    }

    private void runQuery(IndexSpec spec, QuerySpec query, List<QueryReport> queryReports) {
        log.info("Running query '{}' for index {}", query.name(), spec.indexName());
        var totals = new AtomicReference<>(QueryReport.empty(query.name()));
        try {
            pipeline.syncQuery(spec.indexName(), spec.idField(), query)
                .doOnNext(progress -> totals.updateAndGet(report -> report.add(progress)))
                .blockLast();
        } finally {
            // Keep the counts of pages written before a failure
            queryReports.add(totals.get());
        }
        listener.onQueryCompleted(spec.indexName(), totals.get());
        log.info("Query '{}' for index {} finished: {} pages, {} upserted, {} failed, {} skipped",
            query.name(), spec.indexName(), totals.get().pages(), totals.get().upserted(),
            totals.get().failed(), totals.get().skipped());
    }

    private void transition(String indexName, SyncState state) {
        log.debug("Index {} -> {}", indexName, state);
        listener.onStateChange(indexName, state);
    }

    private static String describe(Throwable e) {
        var message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}

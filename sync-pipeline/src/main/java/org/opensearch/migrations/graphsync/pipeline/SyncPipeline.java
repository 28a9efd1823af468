package org.opensearch.migrations.graphsync.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.opensearch.migrations.graphsync.pipeline.exceptions.RowProjectionException;
import org.opensearch.migrations.graphsync.pipeline.ir.BatchProgress;
import org.opensearch.migrations.graphsync.pipeline.ir.Document;
import org.opensearch.migrations.graphsync.pipeline.ir.QuerySpec;
import org.opensearch.migrations.graphsync.pipeline.ir.ResultPage;
import org.opensearch.migrations.graphsync.pipeline.ir.UpsertResult;
import org.opensearch.migrations.graphsync.pipeline.orchestration.SyncListener;
import org.opensearch.migrations.graphsync.pipeline.projection.DocumentProjector;
import org.opensearch.migrations.graphsync.pipeline.query.PaginatedQueryExecutor;
import org.opensearch.migrations.graphsync.pipeline.sink.DocumentSink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Wires the paginated executor to a DocumentSink, one bulk upsert per page.
 *
 * This is the core pipeline. It knows nothing about Bolt, OpenSearch or any specific source/target.
 * Pages are handled strictly one after another: the next page is not fetched until the current one has
 * been upserted.
 */
@Slf4j
public class SyncPipeline {

    private final PaginatedQueryExecutor executor;
    private final DocumentSink sink;
    private final SyncListener listener;

    public SyncPipeline(PaginatedQueryExecutor executor, DocumentSink sink, SyncListener listener) {
        this.executor = executor;
        this.sink = sink;
        this.listener = listener;
    }

    /**
     * Run one query to completion into the index.
     * Returns a Flux of progress records, one per page written.
     */
    public Flux<BatchProgress> syncQuery(String indexName, String idField, QuerySpec query) {
        return executor.stream(query)
            .concatMap(page -> writePage(indexName, idField, query.name(), page), 0);
    }

    private Mono<BatchProgress> writePage(String indexName, String idField, String queryName, ResultPage page) {
        return Mono.defer(() -> {
            var documents = new ArrayList<Document>(page.size());
            int skipped = 0;
            for (var row : page.rows()) {
                try {
                    documents.add(DocumentProjector.project(row, idField));
                } catch (RowProjectionException e) {
                    skipped++;
                    log.atWarn()
                        .setMessage("Skipping row of query '{}' for index {}: {}")
                        .addArgument(queryName)
                        .addArgument(indexName)
                        .addArgument(e.getMessage())
                        .log();
                    listener.onRowSkipped(indexName, queryName, e.getMessage());
                }
            }
            int skippedRows = skipped;
            return upsert(indexName, documents)
                .map(result -> {
                    reportFailures(indexName, queryName, result);
                    log.info("Upserted {} documents into {} ({} failed, {} rows skipped)",
                        result.succeeded(), indexName, result.failed(), skippedRows);
                    return new BatchProgress(indexName, queryName, page.pageNumber(), page.offset(),
                        page.size(), skippedRows, result.succeeded(), result.failed());
                });
        });
    }

    private Mono<UpsertResult> upsert(String indexName, List<Document> documents) {
        if (documents.isEmpty()) {
            return Mono.just(UpsertResult.empty());
        }
        return sink.upsertBatch(indexName, documents);
    }

    private void reportFailures(String indexName, String queryName, UpsertResult result) {
        for (var failure : result.failures()) {
            log.atWarn()
                .setMessage("Failed to upsert document {} into {}: {}")
                .addArgument(failure.id())
                .addArgument(indexName)
                .addArgument(failure.reason())
                .log();
            listener.onDocumentFailed(indexName, queryName, failure);
        }
    }
}

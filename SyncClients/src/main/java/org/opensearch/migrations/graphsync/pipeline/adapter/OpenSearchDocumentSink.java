package org.opensearch.migrations.graphsync.pipeline.adapter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.opensearch.migrations.graphsync.common.BulkDocSection;
import org.opensearch.migrations.graphsync.common.BulkResponseParser;
import org.opensearch.migrations.graphsync.common.OpenSearchClient;
import org.opensearch.migrations.graphsync.pipeline.ir.Document;
import org.opensearch.migrations.graphsync.pipeline.ir.UpsertResult;
import org.opensearch.migrations.graphsync.pipeline.sink.DocumentSink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Writes documents to OpenSearch. Each batch becomes one {@code _bulk} request of merge-upserts.
 */
@Slf4j
public class OpenSearchDocumentSink implements DocumentSink {
    private final OpenSearchClient client;

    public OpenSearchDocumentSink(OpenSearchClient client) {
        this.client = client;
    }

    @Override
    public Mono<Boolean> indexExists(String indexName) {
        return client.hasIndex(indexName);
    }

    @Override
    public Mono<Void> createIndex(String indexName) {
        return client.createIndex(indexName);
    }

    @Override
    public Mono<Void> deleteIndex(String indexName) {
        return client.deleteIndex(indexName);
    }

    @Override
    public Mono<UpsertResult> upsertBatch(String indexName, List<Document> batch) {
        if (batch.isEmpty()) {
            return Mono.just(UpsertResult.empty());
        }
        var sections = batch.stream()
            .map(doc -> new BulkDocSection(doc.id(), indexName, doc.fields()))
            .toList();
        return client.sendBulkRequest(indexName, sections)
            .flatMap(response -> {
                if (!response.hasFailedOperations()) {
                    return Mono.just(new UpsertResult(batch.size(), List.of()));
                }
                try {
                    return Mono.just(toUpsertResult(batch, response.getItems()));
                } catch (IOException e) {
                    return Mono.error(new OpenSearchClient.OperationFailed(
                        "Unable to read bulk response for index " + indexName + ": " + e.getMessage(), response));
                }
            });
    }

    /**
     * Items come back in request order; an item without an id is attributed to the document at its position.
     * Documents the response does not mention are counted as failed.
     */
    private static UpsertResult toUpsertResult(List<Document> batch, List<BulkResponseParser.ItemResult> items) {
        var failures = new ArrayList<UpsertResult.DocumentFailure>();
        int succeeded = 0;
        for (int i = 0; i < batch.size(); i++) {
            var documentId = batch.get(i).id();
            if (i >= items.size()) {
                failures.add(new UpsertResult.DocumentFailure(documentId, "missing from bulk response"));
                continue;
            }
            var item = items.get(i);
            if (item.isSuccess()) {
                succeeded++;
            } else {
                var id = item.id() != null ? item.id() : documentId;
                var reason = item.errorType() != null ? item.describeError() : "status " + item.status();
                failures.add(new UpsertResult.DocumentFailure(id, reason));
            }
        }
        log.atDebug().setMessage("Bulk response had {} successes and {} failures")
            .addArgument(succeeded).addArgument(failures::size).log();
        return new UpsertResult(succeeded, failures);
    }
}

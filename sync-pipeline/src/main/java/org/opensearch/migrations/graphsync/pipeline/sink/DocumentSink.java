package org.opensearch.migrations.graphsync.pipeline.sink;

import java.util.List;

import org.opensearch.migrations.graphsync.pipeline.ir.Document;
import org.opensearch.migrations.graphsync.pipeline.ir.UpsertResult;

import reactor.core.publisher.Mono;

/**
 * Port for writing documents into a document index store (OpenSearch cluster, in-memory test store).
 *
 * Consumes the pipeline IR only; it never sees query text, rows or graph types.
 */
public interface DocumentSink extends AutoCloseable {

    Mono<Boolean> indexExists(String indexName);

    /** Create the index with dynamic mappings. */
    Mono<Void> createIndex(String indexName);

    /** Delete the index; completes normally when the index does not exist. */
    Mono<Void> deleteIndex(String indexName);

    /**
     * Merge-upsert a batch in one bulk operation. A document whose id is new is inserted as-is. For an
     * existing id, fields present in the incoming document overwrite the stored ones and all other stored
     * fields are kept. Failures of individual documents are reported in the result, not signalled as errors;
     * an error signal means the whole operation could not be carried out.
     */
    Mono<UpsertResult> upsertBatch(String indexName, List<Document> batch);

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}

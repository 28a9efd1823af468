package org.opensearch.migrations.graphsync.pipeline.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

import org.opensearch.migrations.graphsync.pipeline.ir.Document;
import org.opensearch.migrations.graphsync.pipeline.ir.UpsertResult;

import reactor.core.publisher.Mono;

/**
 * A DocumentSink that keeps indices in memory, for exercising the pipeline without a real cluster.
 *
 * Upserts merge exactly like the cluster's partial update with {@code doc_as_upsert}. Individual documents
 * can be made to fail with {@link #failDocumentsMatching(Predicate)}, and every batch is recorded so tests
 * can assert on what the pipeline actually sent.
 */
public class InMemoryDocumentSink implements DocumentSink {

    private final Map<String, Map<String, Map<String, Object>>> indices = new ConcurrentHashMap<>();
    private final List<String> createdIndices = new CopyOnWriteArrayList<>();
    private final List<String> deletedIndices = new CopyOnWriteArrayList<>();
    private final List<List<Document>> batches = new CopyOnWriteArrayList<>();
    private volatile Predicate<Document> rejectDocument = doc -> false;

    @Override
    public Mono<Boolean> indexExists(String indexName) {
        return Mono.fromCallable(() -> indices.containsKey(indexName));
    }

    @Override
    public Mono<Void> createIndex(String indexName) {
        return Mono.fromRunnable(() -> {
            indices.putIfAbsent(indexName, new LinkedHashMap<>());
            createdIndices.add(indexName);
        });
    }

    @Override
    public Mono<Void> deleteIndex(String indexName) {
        return Mono.fromRunnable(() -> {
            if (indices.remove(indexName) != null) {
                deletedIndices.add(indexName);
            }
        });
    }

    @Override
    public Mono<UpsertResult> upsertBatch(String indexName, List<Document> batch) {
        return Mono.fromCallable(() -> {
            batches.add(List.copyOf(batch));
            // Writing to a missing index creates it, as the cluster does with automatic index creation
            var stored = indices.computeIfAbsent(indexName, name -> new LinkedHashMap<>());
            int succeeded = 0;
            var failures = new ArrayList<UpsertResult.DocumentFailure>();
            for (var doc : batch) {
                if (rejectDocument.test(doc)) {
                    failures.add(new UpsertResult.DocumentFailure(doc.id(), "rejected by test sink"));
                    continue;
                }
                stored.merge(doc.id(), doc.fields(), FieldMerger::merge);
                succeeded++;
            }
            return new UpsertResult(succeeded, failures);
        });
    }

    /** Documents matching the predicate fail individually in later batches instead of being stored. */
    public void failDocumentsMatching(Predicate<Document> predicate) {
        this.rejectDocument = predicate;
    }

    /** Seed an existing document, as if it were already in the index before the run. */
    public void putDocument(String indexName, String id, Map<String, Object> fields) {
        indices.computeIfAbsent(indexName, name -> new LinkedHashMap<>()).put(id, new LinkedHashMap<>(fields));
    }

    public Optional<Map<String, Object>> getDocument(String indexName, String id) {
        return Optional.ofNullable(indices.get(indexName))
            .map(docs -> docs.get(id))
            .map(Collections::unmodifiableMap);
    }

    public Map<String, Map<String, Object>> getDocuments(String indexName) {
        return Collections.unmodifiableMap(indices.getOrDefault(indexName, Map.of()));
    }

    public List<String> getCreatedIndices() {
        return Collections.unmodifiableList(createdIndices);
    }

    public List<String> getDeletedIndices() {
        return Collections.unmodifiableList(deletedIndices);
    }

    public List<List<Document>> getBatches() {
        return Collections.unmodifiableList(batches);
    }
}

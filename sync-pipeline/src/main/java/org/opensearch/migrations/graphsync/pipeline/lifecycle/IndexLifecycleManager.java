package org.opensearch.migrations.graphsync.pipeline.lifecycle;

import org.opensearch.migrations.graphsync.pipeline.exceptions.IndexLifecycleException;
import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncException;
import org.opensearch.migrations.graphsync.pipeline.sink.DocumentSink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Makes sure a target index is ready to receive documents before its initial query runs.
 */
@Slf4j
public class IndexLifecycleManager {

    private final DocumentSink sink;

    public IndexLifecycleManager(DocumentSink sink) {
        this.sink = sink;
    }

    /**
     * Optionally drops the index, then creates it if it is missing.
     *
     * @param clearExisting  delete the index first if it exists
     * @param allowCreation  create a missing index with dynamic mappings; when false a missing index is an error
     */
    public Mono<Void> ensure(String indexName, boolean clearExisting, boolean allowCreation) {
        var cleared = clearExisting ? clear(indexName) : Mono.<Void>empty();
        return cleared
            .then(Mono.defer(() -> sink.indexExists(indexName)))
            .flatMap(exists -> {
                if (Boolean.TRUE.equals(exists)) {
                    log.info("Index {} already exists", indexName);
                    return Mono.<Void>empty();
                }
                if (!allowCreation) {
                    return Mono.<Void>error(new IndexLifecycleException(
                        "Index " + indexName + " is missing and index creation is disallowed"));
                }
                log.info("Creating index {}", indexName);
                return sink.createIndex(indexName);
            })
            .onErrorMap(e -> !(e instanceof SyncException),
                e -> new IndexLifecycleException("Unable to prepare index " + indexName, e));
    }

    private Mono<Void> clear(String indexName) {
        return sink.indexExists(indexName)
            .flatMap(exists -> {
                if (Boolean.TRUE.equals(exists)) {
                    log.info("Deleting existing index {}", indexName);
                    return sink.deleteIndex(indexName);
                }
                log.debug("Index {} does not exist, nothing to clear", indexName);
                return Mono.<Void>empty();
            });
    }
}

package org.opensearch.migrations.graphsync.pipeline.ir;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a whole run, one entry per processed index in processing order.
 */
public record RunReport(List<IndexReport> indices) {
    public RunReport {
        indices = indices == null ? List.of() : List.copyOf(indices);
    }

    /** True only when every processed index finished in DONE. */
    public boolean isSuccess() {
        return indices.stream().allMatch(IndexReport::isDone);
    }

    public List<IndexReport> failedIndices() {
        return indices.stream().filter(r -> !r.isDone()).toList();
    }

    public Optional<IndexReport> forIndex(String indexName) {
        return indices.stream().filter(r -> r.indexName().equals(indexName)).findFirst();
    }
}

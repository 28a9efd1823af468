package org.opensearch.migrations.graphsync.pipeline.ir;

import java.util.List;

/**
 * Final state of one index after a run. {@code failureReason} is null unless the state is FAILED.
 * Queries that ran before a failure keep their counts.
 */
public record IndexReport(
    String indexName,
    SyncState finalState,
    List<QueryReport> queries,
    String failureReason
) {
    public IndexReport {
        queries = queries == null ? List.of() : List.copyOf(queries);
    }

    public boolean isDone() {
        return finalState == SyncState.DONE;
    }

    public long totalUpserted() {
        return queries.stream().mapToLong(QueryReport::upserted).sum();
    }

    public long totalFailed() {
        return queries.stream().mapToLong(QueryReport::failed).sum();
    }
}

package org.opensearch.migrations.graphsync.pipeline.orchestration;

import org.opensearch.migrations.graphsync.pipeline.ir.QueryReport;
import org.opensearch.migrations.graphsync.pipeline.ir.SyncState;
import org.opensearch.migrations.graphsync.pipeline.ir.UpsertResult;

/**
 * Observer of a sync run. All callbacks are invoked on the thread driving the run.
 */
public interface SyncListener {
    SyncListener NOOP = new SyncListener() {};

    default void onStateChange(String indexName, SyncState state) {}

    default void onRowSkipped(String indexName, String queryName, String reason) {}

    default void onDocumentFailed(String indexName, String queryName, UpsertResult.DocumentFailure failure) {}

    default void onQueryCompleted(String indexName, QueryReport report) {}
}

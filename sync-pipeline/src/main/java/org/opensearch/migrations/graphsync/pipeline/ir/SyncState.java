package org.opensearch.migrations.graphsync.pipeline.ir;

public enum SyncState {
    VALIDATING,
    LOADING,
    UPDATING,
    DONE,
    FAILED
}

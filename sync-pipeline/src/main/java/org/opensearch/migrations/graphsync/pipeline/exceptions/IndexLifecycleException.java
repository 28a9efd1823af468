package org.opensearch.migrations.graphsync.pipeline.exceptions;

public class IndexLifecycleException extends SyncException {
    public IndexLifecycleException(String message) {
        super(message);
    }

    public IndexLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}

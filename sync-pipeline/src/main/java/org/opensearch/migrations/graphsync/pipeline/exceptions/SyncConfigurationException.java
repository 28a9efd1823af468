package org.opensearch.migrations.graphsync.pipeline.exceptions;

/**
 * The run's configuration or index specs are ill-formed. Raised before any index is touched.
 */
public class SyncConfigurationException extends SyncException {
    public SyncConfigurationException(String message) {
        super(message);
    }

    public SyncConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.opensearch.migrations.graphsync.pipeline.exceptions;

/**
 * A result row cannot become a document, usually because its identity column is missing or empty.
 * Recoverable: the row is skipped.
 */
public class RowProjectionException extends SyncException {
    public RowProjectionException(String message) {
        super(message);
    }
}

package org.opensearch.migrations.graphsync.pipeline.exceptions;

/**
 * The graph database could not be reached, refused the credentials, or refused to run a page of a query
 * (including parameters it could not bind).
 */
public class GraphQueryException extends SyncException {
    public GraphQueryException(String message) {
        super(message);
    }

    public GraphQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}

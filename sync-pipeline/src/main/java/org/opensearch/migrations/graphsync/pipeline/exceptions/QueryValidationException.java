package org.opensearch.migrations.graphsync.pipeline.exceptions;

import lombok.Getter;

/**
 * A query of an index spec is not allowed to run. Fails the owning index before any write.
 */
@Getter
public class QueryValidationException extends SyncException {
    private final String queryName;

    public QueryValidationException(String queryName, String reason) {
        super("Query '" + queryName + "' rejected: " + reason);
        this.queryName = queryName;
    }
}

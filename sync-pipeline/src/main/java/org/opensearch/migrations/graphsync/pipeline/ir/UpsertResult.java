package org.opensearch.migrations.graphsync.pipeline.ir;

import java.util.List;

/**
 * Outcome of one bulk merge-upsert. Failed documents are listed individually; the rest succeeded.
 */
public record UpsertResult(
    int succeeded,
    List<DocumentFailure> failures
) {
    public UpsertResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static UpsertResult empty() {
        return new UpsertResult(0, List.of());
    }

    public int failed() {
        return failures.size();
    }

    public record DocumentFailure(String id, String reason) {}
}

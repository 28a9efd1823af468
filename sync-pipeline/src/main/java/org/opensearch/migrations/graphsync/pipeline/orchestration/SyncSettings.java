package org.opensearch.migrations.graphsync.pipeline.orchestration;

import java.util.List;

import org.opensearch.migrations.graphsync.pipeline.query.PaginatedQueryExecutor;

/**
 * Run-wide switches of the orchestrator.
 *
 * @param selectedIndices restricts the run to these index names; empty means every index of the spec file
 * @param testMode        stop each query after its first page
 */
public record SyncSettings(
    boolean clearExistingIndices,
    boolean allowIndexCreation,
    List<String> selectedIndices,
    boolean testMode,
    int defaultPageSize
) {
    public SyncSettings {
        selectedIndices = selectedIndices == null ? List.of() : List.copyOf(selectedIndices);
    }

    public static SyncSettings defaults() {
        return new SyncSettings(false, true, List.of(), false, PaginatedQueryExecutor.DEFAULT_PAGE_SIZE);
    }
}

package org.opensearch.migrations.graphsync.pipeline.ir;

/**
 * Totals for one query of one index.
 */
public record QueryReport(
    String queryName,
    int pages,
    long upserted,
    long failed,
    long skipped
) {
    public static QueryReport empty(String queryName) {
        return new QueryReport(queryName, 0, 0, 0, 0);
    }

    public QueryReport add(BatchProgress progress) {
        return new QueryReport(
            queryName,
            pages + 1,
            upserted + progress.succeeded(),
            failed + progress.failed(),
            skipped + progress.skippedRows()
        );
    }
}

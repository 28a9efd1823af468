package org.opensearch.migrations.graphsync.pipeline.ir;

/**
 * Emitted by the pipeline after each page has been projected and upserted.
 */
public record BatchProgress(
    String indexName,
    String queryName,
    int pageNumber,
    long offset,
    int rowsInPage,
    int skippedRows,
    int succeeded,
    int failed
) {}

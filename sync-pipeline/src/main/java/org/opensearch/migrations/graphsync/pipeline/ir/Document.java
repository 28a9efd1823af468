package org.opensearch.migrations.graphsync.pipeline.ir;

import java.util.Map;

/**
 * A row turned into an index document. {@code fields} holds every column of the row, including the
 * identity column; {@code id} is that column's value rendered as a string.
 */
public record Document(
    String id,
    Map<String, Object> fields
) {}

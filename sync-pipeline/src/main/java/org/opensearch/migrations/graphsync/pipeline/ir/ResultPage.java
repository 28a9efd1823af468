package org.opensearch.migrations.graphsync.pipeline.ir;

import java.util.List;
import java.util.Map;

/**
 * One page of rows as returned by the graph database, in the order the store returned them.
 */
public record ResultPage(
    int pageNumber,
    long offset,
    List<Map<String, Object>> rows
) {
    public int size() {
        return rows.size();
    }
}

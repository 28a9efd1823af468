package org.opensearch.migrations.graphsync.pipeline.projection;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.opensearch.migrations.graphsync.pipeline.exceptions.RowProjectionException;
import org.opensearch.migrations.graphsync.pipeline.ir.Document;

/**
 * Turns a result row into a document. Every column is copied as-is, the identity column included;
 * the identity is the column's value as a string.
 */
public final class DocumentProjector {

    private DocumentProjector() {}

    public static Document project(Map<String, Object> row, String idField) {
        if (!row.containsKey(idField)) {
            throw new RowProjectionException("Row is missing identity field '" + idField + "'");
        }
        var idValue = row.get(idField);
        if (idValue == null) {
            throw new RowProjectionException("Identity field '" + idField + "' is null");
        }
        if (idValue instanceof Map || idValue instanceof Collection) {
            throw new RowProjectionException("Identity field '" + idField + "' is not a scalar value: " + idValue);
        }
        var id = String.valueOf(idValue);
        if (id.isBlank()) {
            throw new RowProjectionException("Identity field '" + idField + "' is empty");
        }
        return new Document(id, Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }
}

package org.opensearch.migrations.graphsync.common;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One merge-upsert of a bulk request: an {@code update} action line for the document id, followed by a
 * partial document with {@code doc_as_upsert}, so the cluster inserts unknown ids and merges into known ones.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public class BulkDocSection {
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();
    private static final String NEWLINE = "\n";

    @EqualsAndHashCode.Include
    @ToString.Include
    @Getter
    private final String docId;
    @EqualsAndHashCode.Include
    @ToString.Include
    @Getter
    private final String indexName;
    private final Map<String, Object> fields;

    public BulkDocSection(String id, String indexName, Map<String, Object> fields) {
        this.docId = id;
        this.indexName = indexName;
        this.fields = fields;
    }

    /** Body of a {@code _bulk} request; every line, the last one included, ends with a newline. */
    public static String convertToBulkRequestBody(Collection<BulkDocSection> bulkSections) {
        var body = new StringBuilder();
        for (var section : bulkSections) {
            body.append(section.asString()).append(NEWLINE);
        }
        return body.toString();
    }

    /** The action line and the document line, without a trailing newline. */
    public String asString() {
        return actionLine() + NEWLINE + upsertLine();
    }

    private String actionLine() {
        var target = new LinkedHashMap<String, Object>();
        target.put("_id", docId);
        if (indexName != null) {
            target.put("_index", indexName);
        }
        return write(Map.of("update", target));
    }

    private String upsertLine() {
        var upsert = new LinkedHashMap<String, Object>();
        upsert.put("doc", fields);
        upsert.put("doc_as_upsert", true);
        return write(upsert);
    }

    private String write(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize document " + docId + " for index "
                + indexName + ": " + e.getOriginalMessage());
        }
    }

    public static class SerializationException extends RuntimeException {
        public SerializationException(String message) {
            super(message);
        }
    }
}

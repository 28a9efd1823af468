package org.opensearch.migrations.graphsync.pipeline.projection;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.opensearch.migrations.graphsync.pipeline.exceptions.RowProjectionException;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentProjectorTest {

    @Test
    void copiesEveryColumnAndKeepsTheIdentityColumn() {
        var row = new LinkedHashMap<String, Object>();
        row.put("id", "u1");
        row.put("name", "Alice");
        row.put("tags", List.of("a", "b"));
        row.put("missing", null);

        var document = DocumentProjector.project(row, "id");

        assertEquals("u1", document.id());
        assertEquals(row, document.fields());
        assertThat(document.fields().keySet(), contains("id", "name", "tags", "missing"));
    }

    @Test
    void numericIdentityIsRenderedAsString() {
        var document = DocumentProjector.project(Map.of("subject_id", 42L, "age", 30), "subject_id");

        assertEquals("42", document.id());
        assertEquals(42L, document.fields().get("subject_id"));
    }

    @Test
    void documentDoesNotFollowLaterChangesToTheRow() {
        var row = new HashMap<String, Object>(Map.of("id", "u1"));
        var document = DocumentProjector.project(row, "id");

        row.put("name", "changed");

        assertEquals(1, document.fields().size());
    }

    @Test
    void missingIdentityColumnFails() {
        var e = assertThrows(RowProjectionException.class,
            () -> DocumentProjector.project(Map.of("name", "Alice"), "id"));
        assertThat(e.getMessage(), containsString("missing identity field 'id'"));
    }

    @Test
    void nullOrBlankIdentityFails() {
        var nullId = new HashMap<String, Object>();
        nullId.put("id", null);

        assertThrows(RowProjectionException.class, () -> DocumentProjector.project(nullId, "id"));
        assertThrows(RowProjectionException.class, () -> DocumentProjector.project(Map.of("id", "  "), "id"));
    }

    @Test
    void compositeIdentityFails() {
        assertThrows(RowProjectionException.class,
            () -> DocumentProjector.project(Map.of("id", List.of(1, 2)), "id"));
        assertThrows(RowProjectionException.class,
            () -> DocumentProjector.project(Map.of("id", Map.of("k", "v")), "id"));
    }
}

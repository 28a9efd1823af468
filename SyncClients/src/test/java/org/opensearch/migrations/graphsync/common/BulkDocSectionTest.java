package org.opensearch.migrations.graphsync.common;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;

class BulkDocSectionTest {

    @Test
    void asString_writesUpdateActionAndUpsertDocument() {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("id", "s1");
        fields.put("name", "Ada");

        var section = new BulkDocSection("s1", "subjects", fields);

        assertThat(section.asString(), equalTo(
            "{\"update\":{\"_id\":\"s1\",\"_index\":\"subjects\"}}\n"
                + "{\"doc\":{\"id\":\"s1\",\"name\":\"Ada\"},\"doc_as_upsert\":true}"));
    }

    @Test
    void convertToBulkRequestBody_isNewlineTerminatedNdjson() {
        var sections = List.of(
            new BulkDocSection("a", "subjects", Map.of("id", "a")),
            new BulkDocSection("b", "subjects", Map.of("id", "b"))
        );

        var body = BulkDocSection.convertToBulkRequestBody(sections);

        var lines = body.split("\n", -1);
        assertThat(lines.length, equalTo(5));
        assertThat(lines[0], equalTo("{\"update\":{\"_id\":\"a\",\"_index\":\"subjects\"}}"));
        assertThat(lines[2], equalTo("{\"update\":{\"_id\":\"b\",\"_index\":\"subjects\"}}"));
        assertThat(lines[4], equalTo(""));
    }

    @Test
    void nestedValuesAreWrittenAsJson() {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("tags", List.of("x", "y"));
        fields.put("address", Map.of("city", "Oslo"));
        fields.put("missing", null);

        var doc = new BulkDocSection("s1", "subjects", fields).asString().split("\n")[1];

        assertThat(doc, equalTo(
            "{\"doc\":{\"tags\":[\"x\",\"y\"],\"address\":{\"city\":\"Oslo\"},\"missing\":null},\"doc_as_upsert\":true}"));
    }

    @Test
    void equalityIsByIdAndIndex() {
        var first = new BulkDocSection("s1", "subjects", Map.of("name", "Ada"));
        var second = new BulkDocSection("s1", "subjects", Map.of("name", "Grace"));

        assertThat(first, equalTo(second));
        assertThat(first, not(equalTo(new BulkDocSection("s1", "studies", Map.of()))));
    }

    @Test
    void idsAndValuesAreEscaped() {
        var section = new BulkDocSection("s\"1", "subjects", Map.of("note", "line\nbreak"));

        assertThat(section.asString(), equalTo(
            "{\"update\":{\"_id\":\"s\\\"1\",\"_index\":\"subjects\"}}\n"
                + "{\"doc\":{\"note\":\"line\\nbreak\"},\"doc_as_upsert\":true}"));
    }
}

package org.opensearch.migrations.graphsync.common;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BulkResponseParserTest {

    @Test
    void parsesSuccessesAndFailuresInOrder() throws IOException {
        var body = "{\"took\":11,\"errors\":true,\"items\":["
            + "{\"update\":{\"_index\":\"subjects\",\"_id\":\"a\",\"_version\":1,\"result\":\"created\","
            + "\"_shards\":{\"total\":2,\"successful\":1,\"failed\":0},\"status\":201}},"
            + "{\"update\":{\"_index\":\"subjects\",\"_id\":\"b\",\"status\":400,\"error\":{"
            + "\"type\":\"mapper_parsing_exception\",\"reason\":\"failed to parse field [age]\","
            + "\"caused_by\":{\"type\":\"number_format_exception\",\"reason\":\"For input string\"}}}},"
            + "{\"update\":{\"_index\":\"subjects\",\"_id\":\"c\",\"result\":\"noop\",\"status\":200}}]}";

        var items = BulkResponseParser.parseItems(body);

        assertThat(items, hasSize(3));
        assertThat(items.get(0).id(), equalTo("a"));
        assertThat(items.get(0).isSuccess(), equalTo(true));
        assertThat(items.get(0).result(), equalTo("created"));
        assertThat(items.get(1).id(), equalTo("b"));
        assertThat(items.get(1).isSuccess(), equalTo(false));
        assertThat(items.get(1).status(), equalTo(400));
        assertThat(items.get(1).describeError(), equalTo("mapper_parsing_exception: failed to parse field [age]"));
        assertThat(items.get(2).isSuccess(), equalTo(true));
        assertThat(items.get(2).errorType(), nullValue());
    }

    @Test
    void emptyItemList() throws IOException {
        assertThat(BulkResponseParser.parseItems("{\"errors\":false,\"items\":[]}"), hasSize(0));
    }

    @Test
    void rejectsNonObjectBody() {
        assertThrows(IOException.class, () -> BulkResponseParser.parseItems("[1,2]"));
        assertThrows(IOException.class, () -> BulkResponseParser.parseItems(null));
    }
}

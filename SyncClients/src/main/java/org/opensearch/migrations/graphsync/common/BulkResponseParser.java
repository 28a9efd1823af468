package org.opensearch.migrations.graphsync.common;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public class BulkResponseParser {
    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    /**
     * Outcome of one operation of a bulk request. {@code errorType} and {@code errorReason} are null when
     * the operation succeeded.
     */
    public record ItemResult(String id, int status, String result, String errorType, String errorReason) {
        public boolean isSuccess() {
            return errorType == null && status >= 200 && status < 300;
        }

        public String describeError() {
            return errorReason == null ? errorType : errorType + ": " + errorReason;
        }
    }

    /**
     * Reads the per-operation outcomes of a bulk response, in request order.
     *
     * {
        "errors": true,
        "items": [
            { "update": { "_id": "u1", "status": 200, "result": "updated" } },
            { "update": { "_id": "u2", "status": 400, "error": { "type": "mapper_parsing_exception", "reason": "..." } } }
        ]
     * }
     *
     * @param bulkResponse The response body
     * @return One entry per item of the response
     * @throws IOException If the body is not a bulk response
     */
    public static List<ItemResult> parseItems(String bulkResponse) throws IOException {
        if (bulkResponse == null) {
            throw new IOException("Bulk response has no body");
        }
        var items = new ArrayList<ItemResult>();
        try (var parser = JSON_FACTORY.createParser(bulkResponse)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Expected data to start with an Object");
            }
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                var fieldName = parser.currentName();
                parser.nextToken();
                if ("items".equals(fieldName)) {
                    scanItems(parser, items);
                } else {
                    // Skip other fields at the root level
                    parser.skipChildren();
                }
            }
        }
        return items;
    }

    private static void scanItems(JsonParser parser, List<ItemResult> items) throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            throw new IOException("Expected 'items' to be an array");
        }
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            if (parser.currentToken() != JsonToken.START_OBJECT) {
                parser.skipChildren();
                continue;
            }
            // Each item is an object with one key naming the action ("update", "index", ...)
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                if (parser.nextToken() == JsonToken.START_OBJECT) {
                    items.add(extractItem(parser));
                } else {
                    parser.skipChildren();
                }
            }
        }
    }

    private static ItemResult extractItem(JsonParser parser) throws IOException {
        String id = null;
        String result = null;
        String errorType = null;
        String errorReason = null;
        int status = 0;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            var fieldName = parser.currentName();
            parser.nextToken(); // Move to the value of the field
            if ("_id".equals(fieldName)) {
                id = parser.getText();
            } else if ("status".equals(fieldName)) {
                status = parser.getIntValue();
            } else if ("result".equals(fieldName)) {
                result = parser.getText();
            } else if ("error".equals(fieldName)) {
                if (parser.currentToken() == JsonToken.START_OBJECT) {
                    while (parser.nextToken() != JsonToken.END_OBJECT) {
                        var errorField = parser.currentName();
                        parser.nextToken();
                        if ("type".equals(errorField)) {
                            errorType = parser.getText();
                        } else if ("reason".equals(errorField)) {
                            errorReason = parser.getText();
                        } else {
                            parser.skipChildren();
                        }
                    }
                } else {
                    errorType = parser.getText();
                }
            } else {
                parser.skipChildren();
            }
        }
        log.atTrace().setMessage("Bulk item {} status {} result {} error {}")
            .addArgument(id).addArgument(status).addArgument(result).addArgument(errorType).log();
        return new ItemResult(id, status, result, errorType, errorReason);
    }
}

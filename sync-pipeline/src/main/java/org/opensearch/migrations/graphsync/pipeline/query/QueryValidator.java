package org.opensearch.migrations.graphsync.pipeline.query;

import java.util.List;

import org.opensearch.migrations.graphsync.pipeline.exceptions.QueryValidationException;
import org.opensearch.migrations.graphsync.pipeline.ir.QuerySpec;
import org.opensearch.migrations.graphsync.pipeline.source.GraphQueryClient;

import lombok.extern.slf4j.Slf4j;

/**
 * Checks that a query may run before anything is written: it must be read-only and it must page
 * through the {@code $skip} and {@code $limit} parameters that the executor binds.
 */
@Slf4j
public final class QueryValidator {

    private QueryValidator() {}

    public static void validate(QuerySpec query) {
        var classification = ReadOnlyQueryClassifier.classify(query.text());
        if (!classification.allowed()) {
            throw new QueryValidationException(query.name(), classification.reason());
        }
        for (var parameter : List.of(GraphQueryClient.SKIP_PARAMETER, GraphQueryClient.LIMIT_PARAMETER)) {
            if (!ReadOnlyQueryClassifier.referencesParameter(query.text(), parameter)) {
                throw new QueryValidationException(query.name(), "Query must contain $" + parameter + " parameter");
            }
        }
        log.debug("Query '{}' validated as read-only", query.name());
    }
}

package org.opensearch.migrations.graphsync.common;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import org.opensearch.migrations.graphsync.common.http.AbstractRestClient;
import org.opensearch.migrations.graphsync.common.http.ConnectionContext;
import org.opensearch.migrations.graphsync.common.http.HttpClientUtils;
import org.opensearch.migrations.graphsync.common.http.HttpResponse;
import org.opensearch.migrations.graphsync.common.http.ReactorNettyRestClient;
import org.opensearch.migrations.graphsync.pipeline.exceptions.SyncException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Index administration and bulk merge-upserts against one OpenSearch cluster.
 *
 * Requests that fail at the transport level, or that the cluster answers with 429 or a 5xx status, are
 * retried with exponential backoff. Any other unexpected status fails the request right away. Failures of
 * individual bulk operations are never retried; they are returned in the {@link BulkResponse}.
 */
@Slf4j
public class OpenSearchClient {
    private static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    private static final Retry CHECK_RETRY_STRATEGY = Retry.backoff(DEFAULT_MAX_RETRY_ATTEMPTS, DEFAULT_BACKOFF)
        .maxBackoff(DEFAULT_MAX_BACKOFF)
        .filter(OpenSearchClient::isRetryable);

    private static final int BULK_MAX_RETRY_ATTEMPTS = 10;
    private static final Duration BULK_BACKOFF = Duration.ofSeconds(2);
    private static final Duration BULK_MAX_BACKOFF = Duration.ofSeconds(60);
    private static final Retry BULK_RETRY_STRATEGY = Retry.backoff(BULK_MAX_RETRY_ATTEMPTS, BULK_BACKOFF)
        .maxBackoff(BULK_MAX_BACKOFF)
        .filter(OpenSearchClient::isRetryable);

    public static final int TRUNCATED_RESPONSE_MAX_LENGTH = 1500;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final String ALREADY_EXISTS_ERROR = "resource_already_exists_exception";

    protected final AbstractRestClient client;

    public OpenSearchClient(ConnectionContext connectionContext) {
        this(new ReactorNettyRestClient(connectionContext));
    }

    public OpenSearchClient(AbstractRestClient client) {
        this.client = client;
    }

    /**
     * Emits true if the index exists, false if the cluster reports it missing.
     */
    public Mono<Boolean> hasIndex(String indexName) {
        return Mono.defer(() -> client.headAsync(indexName))
            .flatMap(resp -> {
                if (resp.statusCode == HttpURLConnection.HTTP_OK) {
                    return Mono.just(true);
                } else if (resp.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
                    return Mono.just(false);
                }
                return Mono.<Boolean>error(new OperationFailed("Could not check index " + indexName, resp));
            })
            .doOnError(e -> log.warn("Index check for {} failed: {}", indexName, e.getMessage()))
            .retryWhen(getCheckRetryStrategy());
    }

    /**
     * Creates the index with dynamic mappings. An index created concurrently by someone else is accepted.
     */
    public Mono<Void> createIndex(String indexName) {
        return Mono.defer(() -> client.putAsync(indexName, "{}"))
            .flatMap(resp -> {
                if (resp.statusCode == HttpURLConnection.HTTP_OK) {
                    log.info("Created index {}", indexName);
                    return Mono.<Void>empty();
                } else if (resp.statusCode == HttpURLConnection.HTTP_BAD_REQUEST) {
                    if (resp.body != null && resp.body.contains(ALREADY_EXISTS_ERROR)) {
                        log.info("Index {} already exists", indexName);
                        return Mono.<Void>empty();
                    }
                    return Mono.<Void>error(new InvalidResponse("Create index failed for " + indexName, resp));
                }
                return Mono.<Void>error(new OperationFailed("Could not create index " + indexName, resp));
            })
            .doOnError(e -> log.warn("Creating index {} failed: {}", indexName, e.getMessage()))
            .retryWhen(getCheckRetryStrategy());
    }

    /**
     * Deletes the index and its documents. Deleting an index that does not exist succeeds.
     */
    public Mono<Void> deleteIndex(String indexName) {
        return Mono.defer(() -> client.deleteAsync(indexName))
            .flatMap(resp -> {
                if (resp.statusCode == HttpURLConnection.HTTP_OK) {
                    log.info("Deleted index {}", indexName);
                    return Mono.<Void>empty();
                } else if (resp.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
                    log.debug("Index {} was already absent", indexName);
                    return Mono.<Void>empty();
                }
                return Mono.<Void>error(new OperationFailed("Could not delete index " + indexName, resp));
            })
            .doOnError(e -> log.warn("Deleting index {} failed: {}", indexName, e.getMessage()))
            .retryWhen(getCheckRetryStrategy());
    }

    /**
     * Sends the sections as one {@code _bulk} request to the index. The returned response may still
     * contain failed operations; check {@link BulkResponse#hasFailedOperations()}.
     */
    public Mono<BulkResponse> sendBulkRequest(String indexName, Collection<BulkDocSection> docs) {
        final var attemptCounter = new AtomicInteger(0);
        final var targetPath = indexName + "/_bulk";
        return Mono.defer(() -> {
            log.atTrace().setMessage("Creating bulk body with {} documents for {}")
                .addArgument(docs::size).addArgument(indexName).log();
            var body = BulkDocSection.convertToBulkRequestBody(docs);
            attemptCounter.incrementAndGet();
            return client.postAsync(targetPath, body,
                    Map.of("Content-Type", List.of(AbstractRestClient.NDJSON_CONTENT_TYPE)))
                .flatMap(response -> {
                    var resp =
                        new BulkResponse(response.statusCode, response.statusText, response.headers, response.body);
                    if (!resp.hasBadStatusCode()) {
                        return Mono.just(resp);
                    }
                    log.atWarn()
                        .setMessage("Bulk request attempt {} on index '{}' was answered with {}: {}")
                        .addArgument(attemptCounter::get)
                        .addArgument(indexName)
                        .addArgument(resp.statusCode)
                        .addArgument(() -> HttpClientUtils.truncate(resp.body, TRUNCATED_RESPONSE_MAX_LENGTH))
                        .log();
                    return Mono.error(new OperationFailed(resp.getFailureMessage(), resp));
                });
        })
        .retryWhen(getBulkRetryStrategy())
        .doOnError(error -> log.atError()
            .setCause(error)
            .setMessage("Bulk request of {} documents on index {} failed after {} attempts")
            .addArgument(docs::size)
            .addArgument(indexName)
            .addArgument(attemptCounter::get)
            .log());
    }

    protected Retry getCheckRetryStrategy() {
        return CHECK_RETRY_STRATEGY;
    }

    protected Retry getBulkRetryStrategy() {
        return BULK_RETRY_STRATEGY;
    }

    /**
     * Transport errors and throttled or server-side failures may go away; anything else the cluster
     * answered will not.
     */
    static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof InvalidResponse) {
            return false;
        }
        if (throwable instanceof OperationFailed) {
            int status = ((OperationFailed) throwable).response.statusCode;
            return status == HTTP_TOO_MANY_REQUESTS || status >= HttpURLConnection.HTTP_INTERNAL_ERROR;
        }
        return !(throwable instanceof BulkDocSection.SerializationException);
    }

    public static class BulkResponse extends HttpResponse {
        private static final Pattern ERRORS_TRUE = Pattern.compile("\"errors\"\\s*:\\s*true");

        public BulkResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
            super(statusCode, statusText, headers, body);
        }

        public boolean hasBadStatusCode() {
            return !(statusCode == HttpURLConnection.HTTP_OK || statusCode == HttpURLConnection.HTTP_CREATED);
        }

        public boolean hasFailedOperations() {
            // The top-level "errors" field tells whether any operation failed; no need to parse the whole body
            return body != null && ERRORS_TRUE.matcher(body).find();
        }

        /**
         * Per-operation outcomes, in request order.
         *
         * @throws IOException if the body is not a bulk response
         */
        public List<BulkResponseParser.ItemResult> getItems() throws IOException {
            return BulkResponseParser.parseItems(body);
        }

        public String getFailureMessage() {
            if (hasBadStatusCode()) {
                return "Bulk request failed.  Status code: " + statusCode + ", Response body: "
                    + HttpClientUtils.truncate(body, TRUNCATED_RESPONSE_MAX_LENGTH);
            }
            return "Bulk request succeeded, but some operations failed.";
        }
    }

    public static class OperationFailed extends SyncException {
        public final transient HttpResponse response;

        public OperationFailed(String message, HttpResponse response) {
            super(message + ". Response Code: " + response.statusCode
                + ", Response Message: " + response.statusText
                + ", Response Body: " + HttpClientUtils.truncate(response.body, TRUNCATED_RESPONSE_MAX_LENGTH));
            this.response = response;
        }
    }

    /** The cluster rejected the request itself; sending it again will not help. */
    public static class InvalidResponse extends OperationFailed {
        public InvalidResponse(String message, HttpResponse response) {
            super(message, response);
        }
    }
}

package org.opensearch.migrations.graphsync.pipeline.query;

import java.util.List;
import java.util.Map;

import org.opensearch.migrations.graphsync.pipeline.ir.QuerySpec;
import org.opensearch.migrations.graphsync.pipeline.ir.ResultPage;
import org.opensearch.migrations.graphsync.pipeline.source.GraphQueryClient;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Drives one query to completion page by page.
 *
 * Page k binds {@code skip = k * pageSize} and {@code limit = pageSize} next to the query's own variables,
 * which never change between pages. The stream ends after a short page; an empty page ends it without
 * being emitted. Pages are fetched one at a time, only when downstream asks for the next one.
 */
@Slf4j
public class PaginatedQueryExecutor {
    public static final int DEFAULT_PAGE_SIZE = 1000;

    private final GraphQueryClient client;
    private final int defaultPageSize;
    private final boolean firstPageOnly;

    public PaginatedQueryExecutor(GraphQueryClient client) {
        this(client, DEFAULT_PAGE_SIZE, false);
    }

    /**
     * @param firstPageOnly stop every query after its first page; used to check that queries run without
     *                      loading everything
     */
    public PaginatedQueryExecutor(GraphQueryClient client, int defaultPageSize, boolean firstPageOnly) {
        if (defaultPageSize <= 0) {
            throw new IllegalArgumentException("Default page size must be positive, got " + defaultPageSize);
        }
        this.client = client;
        this.defaultPageSize = defaultPageSize;
        this.firstPageOnly = firstPageOnly;
    }

    /**
     * Returns a cold Flux of the query's pages; subscribing triggers the first fetch.
     */
    public Flux<ResultPage> stream(QuerySpec query) {
        int pageSize = query.effectivePageSize(defaultPageSize);
        return Flux.generate(PageCursor::new, (cursor, sink) -> {
            if (cursor.exhausted) {
                sink.complete();
                return cursor;
            }
            List<Map<String, Object>> rows;
            try {
                rows = client.execute(query.text(), query.variables(), cursor.offset, pageSize);
            } catch (RuntimeException e) {
                log.atError()
                    .setMessage("Page {} of query '{}' failed at offset {}")
                    .addArgument(cursor.pageNumber)
                    .addArgument(query.name())
                    .addArgument(cursor.offset)
                    .setCause(e)
                    .log();
                sink.error(e);
                return cursor;
            }

            if (rows.isEmpty()) {
                log.debug("Query '{}' exhausted after {} pages", query.name(), cursor.pageNumber);
                sink.complete();
                return cursor;
            }
            log.info("Graph query '{}' returned {} records (page {}, offset {})",
                query.name(), rows.size(), cursor.pageNumber, cursor.offset);
            sink.next(new ResultPage(cursor.pageNumber, cursor.offset, rows));

            cursor.exhausted = rows.size() < pageSize || firstPageOnly;
            cursor.offset += pageSize;
            cursor.pageNumber++;
            return cursor;
        });
    }

    private static class PageCursor {
        private long offset;
        private int pageNumber;
        private boolean exhausted;
    }
}

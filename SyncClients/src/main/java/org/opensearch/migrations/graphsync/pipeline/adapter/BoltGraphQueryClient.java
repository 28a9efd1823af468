package org.opensearch.migrations.graphsync.pipeline.adapter;

import java.util.List;
import java.util.Map;

import org.opensearch.migrations.graphsync.common.bolt.BoltConnectionContext;
import org.opensearch.migrations.graphsync.common.bolt.BoltValueConverter;
import org.opensearch.migrations.graphsync.pipeline.exceptions.GraphQueryException;
import org.opensearch.migrations.graphsync.pipeline.source.GraphQueryClient;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Logging;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;

/**
 * Runs query pages against Memgraph (or any Bolt-speaking graph database) with the Neo4j Java driver.
 * Every page runs in its own session, so a lost connection only fails the page being fetched. Sessions are
 * opened in READ access mode, so a server that enforces it refuses writes the query classifier missed.
 */
@Slf4j
public class BoltGraphQueryClient implements GraphQueryClient {
    static final SessionConfig READ_SESSION = SessionConfig.builder()
        .withDefaultAccessMode(AccessMode.READ)
        .build();

    private final Driver driver;
    private final String description;

    public BoltGraphQueryClient(BoltConnectionContext connectionContext) {
        this(GraphDatabase.driver(connectionContext.getUri(), connectionContext.getAuthToken(),
                Config.builder().withLogging(Logging.slf4j()).build()),
            connectionContext.getUri());
        log.info("Using graph database at {}", connectionContext.getUri());
    }

    BoltGraphQueryClient(Driver driver, String description) {
        this.driver = driver;
        this.description = description;
    }

    @Override
    public List<Map<String, Object>> execute(String text, Map<String, Object> variables, long skip, int limit) {
        var parameters = GraphQueryClient.withPagination(variables, skip, limit);
        try (var session = driver.session(READ_SESSION)) {
            var rows = session.run(text, parameters).list(BoltValueConverter::toRow);
            log.debug("Executed query, returned {} results", rows.size());
            return rows;
        } catch (Neo4jException e) {
            throw new GraphQueryException("Query against " + description + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        log.debug("Closing connection to {}", description);
        driver.close();
    }
}

package org.opensearch.migrations.graphsync.common.bolt;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Point;
import org.neo4j.driver.types.TypeSystem;

/**
 * Turns driver values into plain JSON-compatible Java values: maps, lists, strings, numbers, booleans and null.
 *
 * Nodes and relationships become their property maps and a path becomes the list of its nodes' property maps.
 * Temporal values are rendered as ISO-8601 strings, points as a map of their coordinates and byte arrays as
 * Base64 text.
 */
public final class BoltValueConverter {
    private static final TypeSystem TYPES = TypeSystem.getDefault();

    private BoltValueConverter() {}

    /** The record's columns in result order. */
    public static Map<String, Object> toRow(Record record) {
        var row = new LinkedHashMap<String, Object>();
        for (var key : record.keys()) {
            row.put(key, toJavaValue(record.get(key)));
        }
        return row;
    }

    public static Object toJavaValue(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.hasType(TYPES.NODE())) {
            return value.asNode().asMap(BoltValueConverter::toJavaValue);
        }
        if (value.hasType(TYPES.RELATIONSHIP())) {
            return value.asRelationship().asMap(BoltValueConverter::toJavaValue);
        }
        if (value.hasType(TYPES.PATH())) {
            var nodes = new ArrayList<Object>();
            for (Node node : value.asPath().nodes()) {
                nodes.add(node.asMap(BoltValueConverter::toJavaValue));
            }
            return nodes;
        }
        if (value.hasType(TYPES.LIST())) {
            return value.asList(BoltValueConverter::toJavaValue);
        }
        if (value.hasType(TYPES.MAP())) {
            return new LinkedHashMap<>(value.asMap(BoltValueConverter::toJavaValue));
        }
        if (value.hasType(TYPES.DATE_TIME())) {
            return value.asZonedDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (value.hasType(TYPES.DATE()) || value.hasType(TYPES.TIME()) || value.hasType(TYPES.LOCAL_TIME())
            || value.hasType(TYPES.LOCAL_DATE_TIME())) {
            return value.asObject().toString();
        }
        if (value.hasType(TYPES.DURATION())) {
            return value.asIsoDuration().toString();
        }
        if (value.hasType(TYPES.POINT())) {
            return toMap(value.asPoint());
        }
        if (value.hasType(TYPES.BYTES())) {
            return Base64.getEncoder().encodeToString(value.asByteArray());
        }
        return value.asObject();
    }

    private static Map<String, Object> toMap(Point point) {
        var coordinates = new LinkedHashMap<String, Object>();
        coordinates.put("srid", point.srid());
        coordinates.put("x", point.x());
        coordinates.put("y", point.y());
        if (!Double.isNaN(point.z())) {
            coordinates.put("z", point.z());
        }
        return coordinates;
    }
}

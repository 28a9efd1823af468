package org.opensearch.migrations.graphsync.common.bolt;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.TypeSystem;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BoltValueConverterTest {

    @Test
    void scalarsPassThrough() {
        assertThat(BoltValueConverter.toJavaValue(Values.value("Ada")), equalTo("Ada"));
        assertThat(BoltValueConverter.toJavaValue(Values.value(42)), equalTo(42L));
        assertThat(BoltValueConverter.toJavaValue(Values.value(1.5)), equalTo(1.5));
        assertThat(BoltValueConverter.toJavaValue(Values.value(true)), equalTo(true));
        assertThat(BoltValueConverter.toJavaValue(Values.NULL), nullValue());
        assertThat(BoltValueConverter.toJavaValue(null), nullValue());
    }

    @Test
    void collectionsAreConvertedRecursively() {
        var value = Values.value(Map.of("born", LocalDate.of(1815, 12, 10), "tags", List.of("math", "poetry")));

        @SuppressWarnings("unchecked")
        var converted = (Map<String, Object>) BoltValueConverter.toJavaValue(value);

        assertThat(converted.get("born"), equalTo("1815-12-10"));
        assertThat(converted.get("tags"), equalTo(List.of("math", "poetry")));
    }

    @Test
    void temporalsBecomeIsoStrings() {
        var zoned = ZonedDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC);
        assertThat(BoltValueConverter.toJavaValue(Values.value(zoned)), equalTo("2024-01-02T03:04:05Z"));
        assertThat(BoltValueConverter.toJavaValue(Values.value(LocalDateTime.of(2024, 1, 2, 3, 4, 5))),
            equalTo("2024-01-02T03:04:05"));
    }

    @Test
    void pointsBecomeCoordinateMaps() {
        assertThat(BoltValueConverter.toJavaValue(Values.point(7203, 1.0, 2.0)),
            equalTo(Map.of("srid", 7203, "x", 1.0, "y", 2.0)));
        assertThat(BoltValueConverter.toJavaValue(Values.point(9157, 1.0, 2.0, 3.0)),
            equalTo(Map.of("srid", 9157, "x", 1.0, "y", 2.0, "z", 3.0)));
    }

    @Test
    void bytesBecomeBase64() {
        assertThat(BoltValueConverter.toJavaValue(Values.value(new byte[] {1, 2, 3})), equalTo("AQID"));
    }

    @Test
    void nodesBecomeTheirProperties() {
        var node = mock(Node.class);
        when(node.<Object>asMap(any())).thenReturn(Map.<String, Object>of("name", "Ada"));
        var value = mock(Value.class);
        when(value.hasType(TypeSystem.getDefault().NODE())).thenReturn(true);
        when(value.asNode()).thenReturn(node);

        assertThat(BoltValueConverter.toJavaValue(value), equalTo(Map.of("name", "Ada")));
    }

    @Test
    void toRow_keepsColumnOrder() {
        var record = mock(Record.class);
        when(record.keys()).thenReturn(List.of("name", "id", "age"));
        when(record.get("id")).thenReturn(Values.value("s1"));
        when(record.get("name")).thenReturn(Values.value("Ada"));
        when(record.get("age")).thenReturn(Values.NULL);

        var row = BoltValueConverter.toRow(record);

        assertThat(row.keySet(), contains("name", "id", "age"));
        assertThat(row.get("id"), equalTo("s1"));
        assertThat(row.get("age"), nullValue());
    }
}

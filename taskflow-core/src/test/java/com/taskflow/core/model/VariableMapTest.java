package com.taskflow.core.model;

import com.taskflow.core.exception.VariableTypeException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class VariableMapTest {

    @Test
    void typedGetters_shouldReturnPresentValues() {
        UUID id = UUID.randomUUID();
        VariableMap vars = VariableMap.of(Map.of(
            "name", "report",
            "count", 3,
            "ratio", 0.5,
            "flag", true,
            "project_id", id.toString(),
            "tags", List.of("a", "b")
        ));

        assertEquals(Optional.of("report"), vars.string("name"));
        assertEquals(Optional.of(3), vars.integer("count"));
        assertEquals(Optional.of(0.5), vars.decimal("ratio"));
        assertEquals(Optional.of(true), vars.bool("flag"));
        assertEquals(Optional.of(id), vars.uuid("project_id"));
        assertEquals(Optional.of(List.of("a", "b")), vars.stringList("tags"));
    }

    @Test
    void typedGetters_shouldReturnEmptyForAbsentOrNull() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("nothing", null);
        VariableMap vars = VariableMap.of(raw);

        assertTrue(vars.string("missing").isEmpty());
        assertTrue(vars.integer("nothing").isEmpty());
        assertFalse(vars.containsKey("nothing"));
    }

    @Test
    void typedGetters_shouldRejectWrongType() {
        VariableMap vars = VariableMap.of(Map.of("count", "three", "name", 7, "ratio", 1.5));

        assertThrows(VariableTypeException.class, () -> vars.integer("count"));
        assertThrows(VariableTypeException.class, () -> vars.string("name"));
        assertThrows(VariableTypeException.class, () -> vars.integer("ratio"));
        assertThrows(VariableTypeException.class, () -> vars.bool("name"));
        assertThrows(VariableTypeException.class, () -> vars.list("name"));
    }

    @Test
    void integer_shouldAcceptIntegralDoubles() {
        VariableMap vars = VariableMap.of(Map.of("count", 4.0, "big", 12L));

        assertEquals(Optional.of(4), vars.integer("count"));
        assertEquals(Optional.of(12), vars.integer("big"));
    }

    @Test
    void integer_shouldRejectValuesOutsideIntRange() {
        VariableMap vars = VariableMap.of(Map.of("huge", 3_000_000_000L, "hugeDouble", 3e9));

        VariableTypeException error = assertThrows(VariableTypeException.class, () -> vars.integer("huge"));
        assertTrue(error.getMessage().contains("out of int range"));
        assertThrows(VariableTypeException.class, () -> vars.integer("hugeDouble"));
    }

    @Test
    void uuid_shouldRejectMalformedString() {
        VariableMap vars = VariableMap.of(Map.of("id", "not-a-uuid"));

        VariableTypeException e = assertThrows(VariableTypeException.class, () -> vars.uuid("id"));
        assertTrue(e.getMessage().contains("not-a-uuid"));
    }

    @Test
    void uuidList_shouldRejectAnyMalformedElement() {
        VariableMap vars = VariableMap.of(Map.of("recipients", List.of(UUID.randomUUID().toString(), "bogus")));

        assertThrows(VariableTypeException.class, () -> vars.uuidList("recipients"));
    }

    @Test
    void list_shouldAcceptArraysAndDropNulls() {
        VariableMap vars = VariableMap.of(Map.of(
            "array", new Object[]{"x", null, "y"},
            "list", Arrays.asList(1, null, 2)
        ));

        assertEquals(List.of("x", "y"), vars.list("array").orElseThrow());
        assertEquals(List.of(1, 2), vars.list("list").orElseThrow());
    }

    @Test
    void duration_shouldAcceptIsoCompactAndSeconds() {
        VariableMap vars = VariableMap.of(Map.of(
            "iso", "PT5S",
            "compact", "1m30s",
            "millis", "500ms",
            "seconds", 2,
            "typed", Duration.ofHours(1)
        ));

        assertEquals(Optional.of(Duration.ofSeconds(5)), vars.duration("iso"));
        assertEquals(Optional.of(Duration.ofSeconds(90)), vars.duration("compact"));
        assertEquals(Optional.of(Duration.ofMillis(500)), vars.duration("millis"));
        assertEquals(Optional.of(Duration.ofSeconds(2)), vars.duration("seconds"));
        assertEquals(Optional.of(Duration.ofHours(1)), vars.duration("typed"));
    }

    @Test
    void duration_shouldRejectGarbage() {
        VariableMap vars = VariableMap.of(Map.of("wait", "soon", "partial", "5s later"));

        assertThrows(VariableTypeException.class, () -> vars.duration("wait"));
        assertThrows(VariableTypeException.class, () -> vars.duration("partial"));
    }

    @Test
    void merge_shouldOverrideWithoutMutatingOriginal() {
        VariableMap base = VariableMap.of(Map.of("a", 1, "b", 2));

        VariableMap merged = base.merge(Map.of("b", 3, "c", 4));

        assertEquals(2, base.get("b"));
        assertEquals(3, merged.get("b"));
        assertEquals(4, merged.get("c"));
        assertThrows(UnsupportedOperationException.class, () -> merged.asMap().put("d", 5));
    }

    @Test
    void durationsFormat_shouldRenderCompactForm() {
        assertEquals("1m30s", Durations.format(Duration.ofSeconds(90)));
        assertEquals("500ms", Durations.format(Duration.ofMillis(500)));
        assertEquals("2h", Durations.format(Duration.ofHours(2)));
        assertEquals("0s", Durations.format(Duration.ZERO));
    }
}

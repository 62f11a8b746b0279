package com.tiendapago.bi.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataTableTest {

    private final DataTable table = DataTable.of(
            List.of("a", "b"),
            List.of(Arrays.asList(1, "uno"), Arrays.asList(2, null), Arrays.asList(3, "tres")));

    @Test
    void of_rejectsRowsWithWrongWidth() {
        assertThrows(IllegalArgumentException.class,
                () -> DataTable.of(List.of("a", "b"), List.of(List.of(1))));
    }

    @Test
    void slice_clampsBounds() {
        assertEquals(2, table.slice(1, 99).rowCount());
        assertEquals(0, table.slice(5, 2).rowCount());
        assertEquals(List.of("a", "b"), table.slice(5, 2).getColumns());
    }

    @Test
    void renameAndSelect() {
        DataTable renamed = table.renameColumns(Map.of("a", "id"));
        assertEquals(List.of("id", "b"), renamed.getColumns());

        DataTable projected = renamed.select(List.of("b", "id"));
        assertEquals(Arrays.asList("uno", 1), projected.getRows().get(0));
        assertThrows(IllegalArgumentException.class, () -> renamed.select(List.of("a")));
    }

    @Test
    void mapColumn_keepsNullsAndDoesNotMutateOriginal() {
        DataTable mapped = table.mapColumn("b", v -> v == null ? null : v.toString().toUpperCase());

        assertEquals("UNO", mapped.value(0, "b"));
        assertNull(mapped.value(1, "b"));
        assertEquals("uno", table.value(0, "b"));
    }

    @Test
    void filterAndAppend() {
        DataTable filtered = table.filterRows(row -> row.get(1) != null);
        assertEquals(List.of(1, 3), filtered.columnValues("a"));

        DataTable appended = filtered.appendRows(List.of(Arrays.asList(9, "nueve")));
        assertEquals(List.of(1, 3, 9), appended.columnValues("a"));
    }

    @Test
    void rowsAreImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> table.getRows().get(0).set(0, 5));
    }

    @Test
    void equalityIsByColumnsAndValues() {
        DataTable copy = DataTable.of(List.of("a", "b"),
                List.of(Arrays.asList(1, "uno"), Arrays.asList(2, null), Arrays.asList(3, "tres")));
        assertEquals(table, copy);
        assertEquals(table.hashCode(), copy.hashCode());
        assertNotEquals(table, table.dropColumn("b"));
    }
}

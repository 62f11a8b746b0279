package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityReconcilerTest {

    private final IntegrityReconciler reconciler = new IntegrityReconciler();

    private static DataTable transactionsWithTypes(Object... typeCodes) {
        List<List<Object>> rows = new ArrayList<>();
        int id = 1;
        for (Object code : typeCodes) {
            rows.add(Arrays.asList(100L, "2025-06-14", code, id++, 50.0, 1.0, 1L));
        }
        return DataTable.of(List.of("c0", "c1", "c2", "c3", "c4", "c5", "c6"), rows);
    }

    private static DataTable tipos(Object[]... rows) {
        List<List<Object>> data = new ArrayList<>();
        for (Object[] row : rows) {
            data.add(Arrays.asList(row));
        }
        return DataTable.of(List.of("id_tipo_trx", "descripcion_tipo"), data);
    }

    @Test
    void reconcile_missingCodeIsSynthesizedAndWarned() {
        TransformDiagnostics diagnostics = new TransformDiagnostics();

        DataTable result = reconciler.reconcile(
                tipos(new Object[]{10L, "Cash"}, new Object[]{20L, "Card"}),
                transactionsWithTypes(10L, 99L, 20L),
                2, diagnostics);

        assertEquals(List.of(10, 20, 99), result.columnValues("id_tipo_trx"));
        assertEquals(IntegrityReconciler.UNKNOWN_TYPE_DESCRIPTION, result.value(2, "descripcion_tipo"));
        assertEquals("Unknown type (system-generated)", result.value(2, "descripcion_tipo"));
        assertEquals(1, diagnostics.getWarnings().size());
        assertTrue(diagnostics.getWarnings().get(0).contains("99"));
    }

    @Test
    void reconcile_appendsInFirstEncounterOrderWithoutDuplicates() {
        DataTable result = reconciler.reconcile(
                tipos(new Object[]{1L, "A"}),
                transactionsWithTypes(7L, 3L, 7L, "3", 5.0),
                2, new TransformDiagnostics());

        assertEquals(List.of(1, 7, 3, 5), result.columnValues("id_tipo_trx"));
    }

    @Test
    void reconcile_dropsCatalogRowsWithInvalidCode() {
        TransformDiagnostics diagnostics = new TransformDiagnostics();

        DataTable result = reconciler.reconcile(
                tipos(new Object[]{null, "sin código"}, new Object[]{"abc", "basura"}, new Object[]{"10", "Cash"}),
                transactionsWithTypes(10L),
                2, diagnostics);

        assertEquals(List.of(10), result.columnValues("id_tipo_trx"));
        assertEquals(1, diagnostics.getWarnings().size());
    }

    @Test
    void reconcile_ignoresNullAndUnparsableTransactionCodes() {
        TransformDiagnostics diagnostics = new TransformDiagnostics();

        DataTable result = reconciler.reconcile(
                tipos(new Object[]{10L, "Cash"}),
                transactionsWithTypes(null, "n/a", 10L),
                2, diagnostics);

        assertEquals(1, result.rowCount());
        assertFalse(diagnostics.hasWarnings());
    }

    @Test
    void reconcile_everyReferencedCodeEndsUpInCatalog() {
        Object[] referenced = {4L, 8L, 15L, 16L, 23L, 42L, 8L, 4L};
        DataTable result = reconciler.reconcile(
                tipos(new Object[]{15L, "x"}, new Object[]{99L, "y"}),
                transactionsWithTypes(referenced),
                2, new TransformDiagnostics());

        Set<Object> catalogCodes = new HashSet<>(result.columnValues("id_tipo_trx"));
        for (Object code : referenced) {
            assertTrue(catalogCodes.contains(((Long) code).intValue()), "Falta el código " + code);
        }
    }

    @Test
    void reconcile_emptyCatalogGetsAllCodes() {
        DataTable result = reconciler.reconcile(
                DataTable.empty("id_tipo_trx", "descripcion_tipo"),
                transactionsWithTypes(1L, 2L),
                2, new TransformDiagnostics());

        assertEquals(List.of(1, 2), result.columnValues("id_tipo_trx"));
    }

    @Test
    void reconcile_typePositionOutOfRange_isSchemaMismatch() {
        assertThrows(SchemaMismatchException.class, () -> reconciler.reconcile(
                tipos(), DataTable.empty("a", "b"), 2, new TransformDiagnostics()));
    }
}

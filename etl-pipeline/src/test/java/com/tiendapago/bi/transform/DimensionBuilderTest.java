package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DimensionBuilderTest {

    private static final List<String> RECOMMENDATION_COLUMNS =
            List.of("IDCLIENTE", "IDDISTRIBUIDOR", "NOMBRE DISTRIBUIDOR", "TELEFONO", "categoría", "recomendados");

    private static DataTable recomendados(List<?>... rows) {
        return DataTable.of(RECOMMENDATION_COLUMNS, Arrays.asList(rows));
    }

    private static DataTable clientes(List<?>... rows) {
        return DataTable.of(List.of("IDCLIENTE", "fechaafiliacion", "fechaprimertrx"), Arrays.asList(rows));
    }

    private static final LocalDateTime AFILIACION = LocalDateTime.of(2025, 1, 10, 0, 0);
    private static final LocalDateTime PRIMERA = LocalDateTime.of(2025, 2, 1, 0, 0);

    @Test
    void buildDistributors_deduplicatesKeepingFirstSeen() {
        DataTable recomendados = recomendados(
                Arrays.asList(1, 500, "Dist Norte", 999111222L, "Oro", 3),
                Arrays.asList(2, 500, "Dist Norte (dup)", 999000000L, "Plata", 1),
                Arrays.asList(3, 600, "Dist Sur", 988777666L, "Plata", 0));

        DataTable distribuidores = new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildDistributors(recomendados, new TransformDiagnostics());

        assertEquals(List.of("id_distribuidor", "nombre_distribuidor", "telefono", "categoria"),
                distribuidores.getColumns());
        assertEquals(2, distribuidores.rowCount());
        assertEquals("Dist Norte", distribuidores.value(0, "nombre_distribuidor"));
        assertEquals(2, new HashSet<>(distribuidores.columnValues("id_distribuidor")).size());
    }

    @Test
    void buildDistributors_missingRequiredColumn_isSchemaMismatch() {
        DataTable recomendados = DataTable.of(List.of("IDCLIENTE", "IDDISTRIBUIDOR"), List.of(List.of(1, 2)));

        assertThrows(SchemaMismatchException.class, () -> new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildDistributors(recomendados, new TransformDiagnostics()));
    }

    @Test
    void buildDistributors_optionalColumnsMayBeAbsent() {
        DataTable recomendados = DataTable.of(List.of("IDCLIENTE", "IDDISTRIBUIDOR", "NOMBRE DISTRIBUIDOR"),
                List.of(List.of(1, 500, "Dist Norte")));

        DataTable distribuidores = new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildDistributors(recomendados, new TransformDiagnostics());

        assertEquals(1, distribuidores.rowCount());
        assertNull(distribuidores.value(0, "telefono"));
    }

    @Test
    void buildClients_leftJoinKeepsUnmatchedClientsWithNullDistributor() {
        DataTable clientes = clientes(
                Arrays.asList(1L, AFILIACION, PRIMERA),
                Arrays.asList(2L, AFILIACION, null));
        DataTable recomendados = recomendados(Arrays.asList(1, 500, "Dist Norte", 999111222L, "Oro", 3));

        DataTable result = new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildClients(clientes, recomendados, new TransformDiagnostics());

        assertEquals(List.of("id_cliente", "fecha_afiliacion", "fecha_primera_trx",
                "id_distribuidor", "telefono", "categoria", "recomendados"), result.getColumns());
        assertEquals(2, result.rowCount());
        assertEquals(500L, result.value(0, "id_distribuidor"));
        assertEquals("Oro", result.value(0, "categoria"));
        assertNull(result.value(1, "id_distribuidor"));
        assertFalse(result.hasColumn("IDCLIENTE"));
    }

    @Test
    void buildClients_atMostOneMatch_rowCountPreserved() {
        DataTable clientes = clientes(
                Arrays.asList(1L, AFILIACION, PRIMERA),
                Arrays.asList(2L, AFILIACION, PRIMERA),
                Arrays.asList(3L, AFILIACION, PRIMERA));
        DataTable recomendados = recomendados(
                Arrays.asList(3, 600, "Dist Sur", null, null, null),
                Arrays.asList(1, 500, "Dist Norte", null, null, null));

        DataTable result = new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildClients(clientes, recomendados, new TransformDiagnostics());

        assertEquals(clientes.rowCount(), result.rowCount());
        assertEquals(Arrays.asList(500L, null, 600L), result.columnValues("id_distribuidor"));
    }

    @Test
    void buildClients_matchesNumericKeysAcrossTypes() {
        DataTable clientes = clientes(Arrays.asList(7.0, AFILIACION, PRIMERA));
        DataTable recomendados = recomendados(Arrays.asList("7", 500, "Dist Norte", null, null, null));

        DataTable result = new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildClients(clientes, recomendados, new TransformDiagnostics());

        assertEquals(500L, result.value(0, "id_distribuidor"));
    }

    @Test
    void buildClients_twoMatches_keepAllDuplicatesClientAndWarns() {
        DataTable clientes = clientes(Arrays.asList(1L, AFILIACION, PRIMERA));
        DataTable recomendados = recomendados(
                Arrays.asList(1, 500, "Dist Norte", null, null, null),
                Arrays.asList(1, 600, "Dist Sur", null, null, null));
        TransformDiagnostics diagnostics = new TransformDiagnostics();

        DataTable result = new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildClients(clientes, recomendados, diagnostics);

        assertEquals(2, result.rowCount());
        assertEquals(List.of(500L, 600L), result.columnValues("id_distribuidor"));
        assertTrue(diagnostics.hasWarnings());
    }

    @Test
    void buildClients_twoMatches_keepFirstKeepsOneRow() {
        DataTable clientes = clientes(Arrays.asList(1L, AFILIACION, PRIMERA));
        DataTable recomendados = recomendados(
                Arrays.asList(1, 500, "Dist Norte", null, null, null),
                Arrays.asList(1, 600, "Dist Sur", null, null, null));

        DataTable result = new DimensionBuilder(DuplicateMatchPolicy.KEEP_FIRST)
                .buildClients(clientes, recomendados, new TransformDiagnostics());

        assertEquals(1, result.rowCount());
        assertEquals(500L, result.value(0, "id_distribuidor"));
    }

    @Test
    void buildClients_twoMatches_rejectFails() {
        DataTable clientes = clientes(Arrays.asList(1L, AFILIACION, PRIMERA));
        DataTable recomendados = recomendados(
                Arrays.asList(1, 500, "Dist Norte", null, null, null),
                Arrays.asList(1, 600, "Dist Sur", null, null, null));

        assertThrows(TransformException.class, () -> new DimensionBuilder(DuplicateMatchPolicy.REJECT)
                .buildClients(clientes, recomendados, new TransformDiagnostics()));
    }

    @Test
    void buildClients_unnamedColumnsAreAssignedByPosition() {
        DataTable clientes = DataTable.of(List.of("col0", "col1", "col2"),
                List.of(Arrays.asList(1L, AFILIACION, PRIMERA)));

        DataTable result = new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildClients(clientes, DataTable.empty(), new TransformDiagnostics());

        assertEquals(1L, result.value(0, "id_cliente"));
        assertEquals(AFILIACION, result.value(0, "fecha_afiliacion"));
        assertNull(result.value(0, "id_distribuidor"));
    }

    @Test
    void buildClients_unrecognizedShape_isSchemaMismatch() {
        DataTable clientes = DataTable.of(List.of("a", "b"), List.of(List.of(1L, 2L)));

        assertThrows(SchemaMismatchException.class, () -> new DimensionBuilder(DuplicateMatchPolicy.KEEP_ALL)
                .buildClients(clientes, DataTable.empty(), new TransformDiagnostics()));
    }
}

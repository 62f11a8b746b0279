package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.tiendapago.bi.model.WarehouseColumns.CATEGORIA;
import static com.tiendapago.bi.model.WarehouseColumns.FECHA_AFILIACION;
import static com.tiendapago.bi.model.WarehouseColumns.FECHA_PRIMERA_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.ID_CLIENTE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_DISTRIBUIDOR;
import static com.tiendapago.bi.model.WarehouseColumns.NOMBRE_DISTRIBUIDOR;
import static com.tiendapago.bi.model.WarehouseColumns.RECOMENDADOS;
import static com.tiendapago.bi.model.WarehouseColumns.TELEFONO;

/**
 * Construye dim_distribuidores y dim_clientes a partir de la hoja de clientes y del JSON de
 * recomendados.
 */
public class DimensionBuilder {

    private static final Logger log = LoggerFactory.getLogger(DimensionBuilder.class);

    static final String SRC_ID_CLIENTE = "IDCLIENTE";
    static final String SRC_FECHA_AFILIACION = "fechaafiliacion";
    static final String SRC_FECHA_PRIMERA_TRX = "fechaprimertrx";

    static final String SRC_ID_DISTRIBUIDOR = "IDDISTRIBUIDOR";
    static final String SRC_NOMBRE_DISTRIBUIDOR = "NOMBRE DISTRIBUIDOR";
    static final String SRC_TELEFONO = "TELEFONO";
    static final String SRC_CATEGORIA = "categoría";
    static final String SRC_RECOMENDADOS = "recomendados";

    private static final List<String> CLIENT_SOURCE_COLUMNS =
            List.of(SRC_ID_CLIENTE, SRC_FECHA_AFILIACION, SRC_FECHA_PRIMERA_TRX);
    private static final List<String> CLIENT_CANONICAL_COLUMNS =
            List.of(ID_CLIENTE, FECHA_AFILIACION, FECHA_PRIMERA_TRX);

    private static final List<String> DISTRIBUTOR_COLUMNS =
            List.of(ID_DISTRIBUIDOR, NOMBRE_DISTRIBUIDOR, TELEFONO, CATEGORIA);
    private static final List<String> CLIENT_ENRICHMENT_COLUMNS =
            List.of(ID_DISTRIBUIDOR, TELEFONO, CATEGORIA, RECOMENDADOS);

    private final DuplicateMatchPolicy duplicateMatchPolicy;

    public DimensionBuilder(DuplicateMatchPolicy duplicateMatchPolicy) {
        this.duplicateMatchPolicy = duplicateMatchPolicy;
    }

    /**
     * Un distribuidor por id, conservando la primera aparición en el orden del JSON.
     */
    public DataTable buildDistributors(DataTable recomendados, TransformDiagnostics diagnostics) {
        if (recomendados.isEmpty()) {
            diagnostics.warn(log, "El JSON de recomendados no trae registros. dim_distribuidores queda vacía.");
            return DataTable.empty(DISTRIBUTOR_COLUMNS.toArray(new String[0]));
        }
        requireColumns(recomendados, "recomendados", SRC_ID_DISTRIBUIDOR, SRC_NOMBRE_DISTRIBUIDOR);
        int idIndex = recomendados.indexOf(SRC_ID_DISTRIBUIDOR);
        int nameIndex = recomendados.indexOf(SRC_NOMBRE_DISTRIBUIDOR);
        int phoneIndex = recomendados.indexOf(SRC_TELEFONO);
        int categoryIndex = recomendados.indexOf(SRC_CATEGORIA);

        Set<Object> seen = new HashSet<>();
        List<List<Object>> rows = new ArrayList<>();
        int withoutId = 0;
        for (List<Object> row : recomendados.getRows()) {
            Object key = TypeCaster.toKey(row.get(idIndex));
            if (key == null) {
                withoutId++;
                continue;
            }
            if (seen.add(key)) {
                rows.add(Arrays.asList(key, nullable(row, nameIndex), nullable(row, phoneIndex), nullable(row, categoryIndex)));
            }
        }
        if (withoutId > 0) {
            diagnostics.warn(log, "Se ignoraron {} recomendaciones sin {}.", withoutId, SRC_ID_DISTRIBUIDOR);
        }
        return DataTable.of(DISTRIBUTOR_COLUMNS, rows);
    }

    /**
     * Renombra las columnas base del cliente y cruza (left join) con las recomendaciones por id de cliente.
     * Todo cliente base aparece al menos una vez; los que no tienen recomendación quedan sin distribuidor.
     */
    public DataTable buildClients(DataTable clientes, DataTable recomendados, TransformDiagnostics diagnostics) {
        DataTable base = canonicalClients(clientes);
        int clientIdIndex = base.indexOf(ID_CLIENTE);

        Map<Object, List<List<Object>>> enrichmentByClient = indexEnrichment(recomendados);
        List<Object> duplicated = new ArrayList<>();
        enrichmentByClient.forEach((clientId, matches) -> {
            if (matches.size() > 1) {
                duplicated.add(clientId);
            }
        });
        if (!duplicated.isEmpty()) {
            if (duplicateMatchPolicy == DuplicateMatchPolicy.REJECT) {
                throw new TransformException("Clientes con más de una recomendación: " + duplicated);
            }
            diagnostics.warn(log, "{} clientes tienen más de una recomendación ({}); política aplicada: {}.",
                    duplicated.size(), duplicated, duplicateMatchPolicy);
        }

        List<String> columns = new ArrayList<>(base.getColumns());
        columns.addAll(CLIENT_ENRICHMENT_COLUMNS);
        List<Object> noMatch = Collections.nCopies(CLIENT_ENRICHMENT_COLUMNS.size(), null);

        List<List<Object>> rows = new ArrayList<>();
        for (List<Object> clientRow : base.getRows()) {
            Object key = TypeCaster.toKey(clientRow.get(clientIdIndex));
            List<List<Object>> matches = key == null ? null : enrichmentByClient.get(key);
            if (matches == null || matches.isEmpty()) {
                rows.add(concat(clientRow, noMatch));
            } else if (duplicateMatchPolicy == DuplicateMatchPolicy.KEEP_FIRST) {
                rows.add(concat(clientRow, matches.get(0)));
            } else {
                for (List<Object> match : matches) {
                    rows.add(concat(clientRow, match));
                }
            }
        }
        return DataTable.of(columns, rows);
    }

    private DataTable canonicalClients(DataTable clientes) {
        Map<String, String> renames = new LinkedHashMap<>();
        for (int i = 0; i < CLIENT_SOURCE_COLUMNS.size(); i++) {
            String actual = findIgnoringCase(clientes, CLIENT_SOURCE_COLUMNS.get(i));
            if (actual != null) {
                renames.put(actual, CLIENT_CANONICAL_COLUMNS.get(i));
            }
        }
        if (renames.size() == CLIENT_SOURCE_COLUMNS.size()) {
            return clientes.renameColumns(renames);
        }
        if (clientes.columnCount() == CLIENT_CANONICAL_COLUMNS.size()) {
            log.info("La hoja de clientes no trae encabezados reconocibles {}; se asignan nombres por posición.",
                    clientes.getColumns());
            return clientes.withColumnNames(CLIENT_CANONICAL_COLUMNS);
        }
        throw new SchemaMismatchException(String.format(
                "La hoja de clientes no tiene las columnas %s ni exactamente %d columnas posicionales: %s",
                CLIENT_SOURCE_COLUMNS, CLIENT_CANONICAL_COLUMNS.size(), clientes.getColumns()));
    }

    private Map<Object, List<List<Object>>> indexEnrichment(DataTable recomendados) {
        Map<Object, List<List<Object>>> index = new LinkedHashMap<>();
        if (recomendados.isEmpty()) {
            return index;
        }
        requireColumns(recomendados, "recomendados", SRC_ID_CLIENTE, SRC_ID_DISTRIBUIDOR);
        int clientIndex = recomendados.indexOf(SRC_ID_CLIENTE);
        int distributorIndex = recomendados.indexOf(SRC_ID_DISTRIBUIDOR);
        int phoneIndex = recomendados.indexOf(SRC_TELEFONO);
        int categoryIndex = recomendados.indexOf(SRC_CATEGORIA);
        int recommendedIndex = recomendados.indexOf(SRC_RECOMENDADOS);

        for (List<Object> row : recomendados.getRows()) {
            Object key = TypeCaster.toKey(row.get(clientIndex));
            if (key == null) {
                continue;
            }
            List<Object> enrichment = new ArrayList<>(CLIENT_ENRICHMENT_COLUMNS.size());
            enrichment.add(TypeCaster.toKey(row.get(distributorIndex)));
            enrichment.add(nullable(row, phoneIndex));
            enrichment.add(nullable(row, categoryIndex));
            enrichment.add(nullable(row, recommendedIndex));
            index.computeIfAbsent(key, k -> new ArrayList<>()).add(enrichment);
        }
        return index;
    }

    private static String findIgnoringCase(DataTable table, String column) {
        for (String actual : table.getColumns()) {
            if (actual != null && actual.trim().toLowerCase(Locale.ROOT).equals(column.toLowerCase(Locale.ROOT))) {
                return actual;
            }
        }
        return null;
    }

    private static void requireColumns(DataTable table, String tableName, String... columns) {
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!table.hasColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(String.format(
                    "A la fuente %s le faltan las columnas %s. Columnas: %s", tableName, missing, table.getColumns()));
        }
    }

    private static Object nullable(List<Object> row, int index) {
        return index < 0 ? null : row.get(index);
    }

    private static List<Object> concat(List<Object> left, List<Object> right) {
        List<Object> joined = new ArrayList<>(left.size() + right.size());
        joined.addAll(left);
        joined.addAll(right);
        return joined;
    }
}

package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.tiendapago.bi.model.WarehouseColumns.DESCRIPCION_TIPO;
import static com.tiendapago.bi.model.WarehouseColumns.ID_SEDE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_TIPO_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.NOMBRE_SEDE;

/**
 * Separa la hoja "Varios" en el catálogo de sedes y el de tipos de transacción.
 * Los catálogos vienen concatenados y separados por filas cuyo primer valor es "ID".
 * Nunca lanza excepción: una hoja mal formada degrada los catálogos en lugar de abortar.
 */
public class CatalogSplitter {

    private static final Logger log = LoggerFactory.getLogger(CatalogSplitter.class);

    static final String SENTINEL = "ID";

    private final CutPointRule cutPointRule;

    public CatalogSplitter(CutPointRule cutPointRule) {
        this.cutPointRule = cutPointRule;
    }

    /**
     * Resultado del corte: ambos catálogos, sin tipar todavía.
     */
    @Value
    public static class Catalogs {
        DataTable sedes;
        DataTable tipos;
    }

    public Catalogs split(DataTable varios, TransformDiagnostics diagnostics) {
        if (varios.columnCount() == 0) {
            diagnostics.warn(log, "La hoja Varios no tiene columnas. Se generan catálogos vacíos.");
            return emptyCatalogs();
        }

        List<Integer> sentinels = findSentinels(varios);

        if (sentinels.size() > 1) {
            if (cutPointRule == CutPointRule.FIRST_SENTINEL) {
                int cutPoint = sentinels.get(0);
                return catalogs(varios.slice(0, cutPoint), varios.slice(cutPoint + 1, varios.rowCount()), diagnostics);
            }
            int cutPoint = sentinels.get(1);
            return catalogs(varios.slice(1, cutPoint), varios.slice(cutPoint + 1, varios.rowCount()), diagnostics);
        }

        if (sentinels.size() == 1) {
            int cutPoint = sentinels.get(0);
            if (cutPoint == 0) {
                diagnostics.warn(log, "Solo se encontró un encabezado 'ID' en la fila 0. Se asume que no hay catálogo de tipos.");
                return catalogs(varios.slice(1, varios.rowCount()), DataTable.empty(), diagnostics);
            }
            diagnostics.warn(log, "Solo se encontró un encabezado 'ID' (fila {}). Se corta la hoja en ese punto.", cutPoint);
            return catalogs(varios.slice(0, cutPoint), varios.slice(cutPoint + 1, varios.rowCount()), diagnostics);
        }

        diagnostics.warn(log, "Formato de la hoja Varios no estándar (sin encabezados 'ID'). Se generan catálogos vacíos.");
        return emptyCatalogs();
    }

    private List<Integer> findSentinels(DataTable varios) {
        List<Integer> sentinels = new ArrayList<>();
        List<Object> firstColumn = varios.columnValues(0);
        for (int i = 0; i < firstColumn.size(); i++) {
            if (SENTINEL.equals(firstColumn.get(i))) {
                sentinels.add(i);
            }
        }
        return sentinels;
    }

    private Catalogs catalogs(DataTable sedesRows, DataTable tiposRows, TransformDiagnostics diagnostics) {
        return new Catalogs(
                twoColumns(sedesRows, ID_SEDE, NOMBRE_SEDE, diagnostics),
                twoColumns(tiposRows, ID_TIPO_TRX, DESCRIPCION_TIPO, diagnostics));
    }

    private DataTable twoColumns(DataTable slice, String idColumn, String descriptionColumn,
                                 TransformDiagnostics diagnostics) {
        if (slice.isEmpty()) {
            return DataTable.empty(idColumn, descriptionColumn);
        }
        if (slice.columnCount() < 2) {
            diagnostics.warn(log, "El catálogo {} tiene una sola columna; se completa la descripción con nulos.", idColumn);
        }
        List<List<Object>> rows = new ArrayList<>(slice.rowCount());
        for (List<Object> row : slice.getRows()) {
            List<Object> values = new ArrayList<>(2);
            values.add(row.get(0));
            values.add(row.size() > 1 ? row.get(1) : null);
            rows.add(values);
        }
        return DataTable.of(List.of(idColumn, descriptionColumn), rows);
    }

    private Catalogs emptyCatalogs() {
        return new Catalogs(DataTable.empty(ID_SEDE, NOMBRE_SEDE), DataTable.empty(ID_TIPO_TRX, DESCRIPCION_TIPO));
    }
}

package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.tiendapago.bi.model.WarehouseColumns.DESCRIPCION_TIPO;
import static com.tiendapago.bi.model.WarehouseColumns.ID_TIPO_TRX;

/**
 * Garantiza la integridad referencial de fct_transacciones → dim_tipo_transaccion.
 * Por cada código de tipo usado en transacciones y ausente del catálogo se agrega una fila
 * sintética al catálogo; ninguna transacción se rechaza.
 */
public class IntegrityReconciler {

    private static final Logger log = LoggerFactory.getLogger(IntegrityReconciler.class);

    public static final String UNKNOWN_TYPE_DESCRIPTION = "Unknown type (system-generated)";

    /**
     * @param tipos            Catálogo de tipos tal como sale del corte de la hoja Varios.
     * @param transacciones    Transacciones crudas, con columnas posicionales.
     * @param typeCodePosition Posición de la columna del código de tipo en las transacciones.
     * @param diagnostics      Contexto de la corrida.
     * @return El catálogo con códigos enteros, filas originales primero y sintéticas después.
     */
    public DataTable reconcile(DataTable tipos, DataTable transacciones, int typeCodePosition,
                               TransformDiagnostics diagnostics) {
        int codeIndex = tipos.indexOf(ID_TIPO_TRX);
        if (codeIndex < 0) {
            throw new SchemaMismatchException("El catálogo de tipos no tiene la columna " + ID_TIPO_TRX);
        }
        if (typeCodePosition >= transacciones.columnCount()) {
            throw new SchemaMismatchException(String.format(
                    "Las transacciones tienen %d columnas; no existe la posición %d del código de tipo",
                    transacciones.columnCount(), typeCodePosition));
        }

        DataTable catalog = tipos.filterRows(row -> TypeCaster.toInteger(row.get(codeIndex)) != null);
        int discarded = tipos.rowCount() - catalog.rowCount();
        if (discarded > 0) {
            diagnostics.warn(log, "Catálogo de tipos: se descartaron {} filas con código nulo o no numérico.", discarded);
        }
        catalog = catalog.mapColumn(ID_TIPO_TRX, TypeCaster::toInteger);

        Set<Integer> catalogCodes = new HashSet<>();
        for (Object code : catalog.columnValues(ID_TIPO_TRX)) {
            catalogCodes.add((Integer) code);
        }

        Set<Integer> missing = new LinkedHashSet<>();
        for (Object raw : transacciones.columnValues(typeCodePosition)) {
            Integer code = TypeCaster.toInteger(raw);
            if (code != null && !catalogCodes.contains(code)) {
                missing.add(code);
            }
        }

        if (missing.isEmpty()) {
            return catalog;
        }

        diagnostics.warn(log, "Integridad referencial: códigos de tipo huérfanos detectados: {}. Se generan filas sintéticas.",
                missing);
        int descriptionIndex = catalog.indexOf(DESCRIPCION_TIPO);
        List<List<Object>> synthesized = new ArrayList<>(missing.size());
        for (Integer code : missing) {
            Object[] row = new Object[catalog.columnCount()];
            row[codeIndex] = code;
            if (descriptionIndex >= 0) {
                row[descriptionIndex] = UNKNOWN_TYPE_DESCRIPTION;
            }
            synthesized.add(Arrays.asList(row));
        }
        return catalog.appendRows(synthesized);
    }
}

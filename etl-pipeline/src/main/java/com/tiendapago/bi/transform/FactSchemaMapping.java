package com.tiendapago.bi.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.tiendapago.bi.model.WarehouseColumns.FECHA_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.FEE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_CLIENTE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_SEDE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_TIPO_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.ID_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.MONTO;

/**
 * Mapeo posicional de la hoja de transacciones a la tabla de hechos: el elemento i es el nombre
 * canónico de la columna en la posición i de la fuente. Los encabezados de la fuente se ignoran.
 */
public final class FactSchemaMapping {

    public static final List<String> FACT_COLUMNS = List.of(
            ID_CLIENTE, FECHA_TRX, ID_TIPO_TRX, ID_TRX, MONTO, FEE, ID_SEDE);

    private final List<String> canonicalNames;

    private FactSchemaMapping(List<String> canonicalNames) {
        Set<String> distinct = new HashSet<>(canonicalNames);
        if (distinct.size() != canonicalNames.size() || !distinct.equals(new HashSet<>(FACT_COLUMNS))) {
            throw new IllegalArgumentException(String.format(
                    "El mapeo de la tabla de hechos debe contener exactamente las columnas %s, se recibió %s",
                    FACT_COLUMNS, canonicalNames));
        }
        this.canonicalNames = Collections.unmodifiableList(new ArrayList<>(canonicalNames));
    }

    /**
     * Orden de la hoja Transacciones: cliente, fecha, tipo, id de transacción, monto, fee, sede.
     */
    public static FactSchemaMapping standard() {
        return new FactSchemaMapping(FACT_COLUMNS);
    }

    public static FactSchemaMapping of(List<String> canonicalNames) {
        return new FactSchemaMapping(canonicalNames);
    }

    public List<String> getCanonicalNames() {
        return canonicalNames;
    }

    public int size() {
        return canonicalNames.size();
    }

    public int positionOf(String canonicalName) {
        return canonicalNames.indexOf(canonicalName);
    }

    @Override
    public String toString() {
        return "FactSchemaMapping" + canonicalNames;
    }
}

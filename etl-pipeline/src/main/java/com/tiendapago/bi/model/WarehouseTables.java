package com.tiendapago.bi.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Las cinco tablas del data warehouse, indexadas por nombre y en el orden canónico de carga:
 * dimensiones primero y la tabla de hechos al final.
 */
public final class WarehouseTables {

    public static final String DIM_SEDES = "dim_sedes";
    public static final String DIM_TIPO_TRANSACCION = "dim_tipo_transaccion";
    public static final String DIM_DISTRIBUIDORES = "dim_distribuidores";
    public static final String DIM_CLIENTES = "dim_clientes";
    public static final String FCT_TRANSACCIONES = "fct_transacciones";

    public static final List<String> CANONICAL_ORDER = List.of(
            DIM_SEDES, DIM_TIPO_TRANSACCION, DIM_DISTRIBUIDORES, DIM_CLIENTES, FCT_TRANSACCIONES);

    private final Map<String, DataTable> tables;

    public WarehouseTables(DataTable sedes, DataTable tiposTransaccion, DataTable distribuidores,
                           DataTable clientes, DataTable transacciones) {
        Map<String, DataTable> ordered = new LinkedHashMap<>();
        ordered.put(DIM_SEDES, sedes);
        ordered.put(DIM_TIPO_TRANSACCION, tiposTransaccion);
        ordered.put(DIM_DISTRIBUIDORES, distribuidores);
        ordered.put(DIM_CLIENTES, clientes);
        ordered.put(FCT_TRANSACCIONES, transacciones);
        ordered.forEach((name, table) -> {
            if (table == null) {
                throw new IllegalArgumentException("Falta la tabla " + name);
            }
        });
        this.tables = Collections.unmodifiableMap(ordered);
    }

    public DataTable get(String tableName) {
        DataTable table = tables.get(tableName);
        if (table == null) {
            throw new IllegalArgumentException("Tabla desconocida: " + tableName);
        }
        return table;
    }

    /**
     * @return Vista inmutable nombre → tabla, iterada en el orden canónico.
     */
    public Map<String, DataTable> asMap() {
        return tables;
    }

    public DataTable getSedes() {
        return tables.get(DIM_SEDES);
    }

    public DataTable getTiposTransaccion() {
        return tables.get(DIM_TIPO_TRANSACCION);
    }

    public DataTable getDistribuidores() {
        return tables.get(DIM_DISTRIBUIDORES);
    }

    public DataTable getClientes() {
        return tables.get(DIM_CLIENTES);
    }

    public DataTable getTransacciones() {
        return tables.get(FCT_TRANSACCIONES);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof WarehouseTables && tables.equals(((WarehouseTables) o).tables));
    }

    @Override
    public int hashCode() {
        return tables.hashCode();
    }

    @Override
    public String toString() {
        return "WarehouseTables" + tables;
    }
}

package com.tiendapago.bi.repository;

import com.tiendapago.bi.model.WarehouseTables;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.tiendapago.bi.model.WarehouseColumns.CATEGORIA;
import static com.tiendapago.bi.model.WarehouseColumns.DESCRIPCION_TIPO;
import static com.tiendapago.bi.model.WarehouseColumns.FECHA_AFILIACION;
import static com.tiendapago.bi.model.WarehouseColumns.FECHA_PRIMERA_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.FECHA_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.FEE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_CLIENTE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_DISTRIBUIDOR;
import static com.tiendapago.bi.model.WarehouseColumns.ID_SEDE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_TIPO_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.ID_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.MONTO;
import static com.tiendapago.bi.model.WarehouseColumns.NOMBRE_DISTRIBUIDOR;
import static com.tiendapago.bi.model.WarehouseColumns.NOMBRE_SEDE;
import static com.tiendapago.bi.model.WarehouseColumns.TELEFONO;

/**
 * Columnas persistidas y clave primaria de cada tabla, tal como en schema.sql.
 */
public final class WarehouseSchema {

    @Value
    public static class TableDefinition {
        String name;
        String primaryKey;
        List<String> columns;

        String insertSql() {
            return "INSERT INTO " + name + " (" + String.join(", ", columns) + ") VALUES ("
                    + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
        }

        String selectKeysSql() {
            return "SELECT " + primaryKey + " FROM " + name;
        }
    }

    private static final Map<String, TableDefinition> TABLES = Map.of(
            WarehouseTables.DIM_SEDES, new TableDefinition(WarehouseTables.DIM_SEDES, ID_SEDE,
                    List.of(ID_SEDE, NOMBRE_SEDE)),
            WarehouseTables.DIM_TIPO_TRANSACCION, new TableDefinition(WarehouseTables.DIM_TIPO_TRANSACCION, ID_TIPO_TRX,
                    List.of(ID_TIPO_TRX, DESCRIPCION_TIPO)),
            WarehouseTables.DIM_DISTRIBUIDORES, new TableDefinition(WarehouseTables.DIM_DISTRIBUIDORES, ID_DISTRIBUIDOR,
                    List.of(ID_DISTRIBUIDOR, NOMBRE_DISTRIBUIDOR, TELEFONO, CATEGORIA)),
            WarehouseTables.DIM_CLIENTES, new TableDefinition(WarehouseTables.DIM_CLIENTES, ID_CLIENTE,
                    List.of(ID_CLIENTE, FECHA_AFILIACION, FECHA_PRIMERA_TRX, ID_DISTRIBUIDOR)),
            WarehouseTables.FCT_TRANSACCIONES, new TableDefinition(WarehouseTables.FCT_TRANSACCIONES, ID_TRX,
                    List.of(ID_TRX, ID_CLIENTE, ID_SEDE, ID_TIPO_TRX, FECHA_TRX, MONTO, FEE)));

    private WarehouseSchema() {
    }

    public static TableDefinition table(String tableName) {
        TableDefinition definition = TABLES.get(tableName);
        if (definition == null) {
            throw new IllegalArgumentException("Tabla sin definición en el esquema: " + tableName);
        }
        return definition;
    }
}

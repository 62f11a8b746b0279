package com.tiendapago.bi.repository;

import com.tiendapago.bi.model.WarehouseTables;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WarehouseSchemaTest {

    @Test
    void table_factDefinitionFollowsDdl() {
        WarehouseSchema.TableDefinition fact = WarehouseSchema.table(WarehouseTables.FCT_TRANSACCIONES);

        assertEquals("fct_transacciones", fact.getName());
        assertEquals("id_trx", fact.getPrimaryKey());
        assertEquals(List.of("id_trx", "id_cliente", "id_sede", "id_tipo_trx", "fecha_trx", "monto", "fee"),
                fact.getColumns());
        assertEquals("INSERT INTO fct_transacciones (id_trx, id_cliente, id_sede, id_tipo_trx, fecha_trx, monto, fee) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)", fact.insertSql());
        assertEquals("SELECT id_trx FROM fct_transacciones", fact.selectKeysSql());
    }

    @Test
    void table_definitionsAreValues() {
        assertEquals(new WarehouseSchema.TableDefinition("dim_sedes", "id_sede", List.of("id_sede", "nombre_sede")),
                WarehouseSchema.table(WarehouseTables.DIM_SEDES));
    }

    @Test
    void table_unknownName_fails() {
        assertThrows(IllegalArgumentException.class, () -> WarehouseSchema.table("dim_productos"));
    }
}

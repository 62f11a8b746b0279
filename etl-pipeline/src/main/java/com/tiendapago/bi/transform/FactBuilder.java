package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;

/**
 * Construye fct_transacciones reasignando los nombres de columna por posición.
 */
public class FactBuilder {

    private final FactSchemaMapping mapping;

    public FactBuilder(FactSchemaMapping mapping) {
        this.mapping = mapping;
    }

    /**
     * @throws SchemaMismatchException Si la fuente no tiene exactamente las columnas del mapeo.
     */
    public DataTable build(DataTable transacciones) {
        if (transacciones.columnCount() != mapping.size()) {
            throw new SchemaMismatchException(String.format(
                    "La hoja de transacciones tiene %d columnas %s; se esperaban %d para %s",
                    transacciones.columnCount(), transacciones.getColumns(), mapping.size(), mapping));
        }
        return transacciones.withColumnNames(mapping.getCanonicalNames());
    }
}

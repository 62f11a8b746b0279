package com.tiendapago.bi.repository;

/**
 * Estrategia de inserción en el data warehouse.
 */
public enum LoadMode {
    /** Inserta todas las filas. */
    APPEND,
    /** Inserta solo las filas cuya clave primaria aún no existe en la tabla destino. */
    INCREMENTAL
}

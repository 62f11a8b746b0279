package com.tiendapago.bi.transform;

/**
 * Qué hacer cuando un cliente tiene más de un registro de recomendación.
 */
public enum DuplicateMatchPolicy {
    /** Una fila de cliente por cada coincidencia (el cliente se duplica). */
    KEEP_ALL,
    /** Solo la primera coincidencia en el orden de la fuente. */
    KEEP_FIRST,
    /** Cualquier cliente con varias coincidencias aborta la transformación. */
    REJECT
}

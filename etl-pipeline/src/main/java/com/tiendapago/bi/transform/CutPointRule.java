package com.tiendapago.bi.transform;

/**
 * Regla para elegir el punto de corte de la hoja mixta cuando hay dos o más filas "ID".
 */
public enum CutPointRule {

    /**
     * La hoja trae su primer encabezado "ID" en la fila 0: sedes entre la fila 1 y el segundo "ID",
     * tipos de transacción después del segundo.
     */
    SECOND_SENTINEL,

    /**
     * El primer encabezado ya fue consumido aguas arriba: sedes antes del primer "ID",
     * tipos de transacción después de él.
     */
    FIRST_SENTINEL
}

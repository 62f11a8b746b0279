package com.tiendapago.bi.model;

/**
 * Nombres canónicos de las columnas del data warehouse.
 */
public final class WarehouseColumns {

    public static final String ID_SEDE = "id_sede";
    public static final String NOMBRE_SEDE = "nombre_sede";

    public static final String ID_TIPO_TRX = "id_tipo_trx";
    public static final String DESCRIPCION_TIPO = "descripcion_tipo";

    public static final String ID_DISTRIBUIDOR = "id_distribuidor";
    public static final String NOMBRE_DISTRIBUIDOR = "nombre_distribuidor";
    public static final String TELEFONO = "telefono";
    public static final String CATEGORIA = "categoria";

    public static final String ID_CLIENTE = "id_cliente";
    public static final String FECHA_AFILIACION = "fecha_afiliacion";
    public static final String FECHA_PRIMERA_TRX = "fecha_primera_trx";
    public static final String RECOMENDADOS = "recomendados";

    public static final String ID_TRX = "id_trx";
    public static final String FECHA_TRX = "fecha_trx";
    public static final String MONTO = "monto";
    public static final String FEE = "fee";

    private WarehouseColumns() {
    }
}

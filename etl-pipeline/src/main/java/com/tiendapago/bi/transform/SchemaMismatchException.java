package com.tiendapago.bi.transform;

/**
 * La forma de una tabla de entrada no coincide con la esperada (columnas faltantes o de más).
 */
public class SchemaMismatchException extends TransformException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}

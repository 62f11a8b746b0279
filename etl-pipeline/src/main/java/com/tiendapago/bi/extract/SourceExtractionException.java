package com.tiendapago.bi.extract;

/**
 * No fue posible obtener o leer una de las fuentes de datos.
 */
public class SourceExtractionException extends Exception {

    public SourceExtractionException(String message) {
        super(message);
    }

    public SourceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}

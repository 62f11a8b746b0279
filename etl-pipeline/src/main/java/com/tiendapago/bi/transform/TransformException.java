package com.tiendapago.bi.transform;

/**
 * Falla estructural durante la transformación. Aborta la corrida completa.
 */
public class TransformException extends RuntimeException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}

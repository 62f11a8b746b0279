package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.WarehouseTables;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Resultado de una corrida de transformación: éxito (posiblemente con advertencias) o falla total.
 * Una falla nunca trae tablas, de modo que no hay carga parcial posible.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TransformResult {

    public enum Status { SUCCESS, FAILED }

    private final Status status;
    private final WarehouseTables tables;
    private final List<String> warnings;
    private final Exception failure;

    public static TransformResult success(WarehouseTables tables, List<String> warnings) {
        return new TransformResult(Status.SUCCESS, tables, List.copyOf(warnings), null);
    }

    public static TransformResult failed(Exception failure, List<String> warnings) {
        return new TransformResult(Status.FAILED, null, List.copyOf(warnings), failure);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}

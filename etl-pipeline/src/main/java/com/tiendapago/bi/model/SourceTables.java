package com.tiendapago.bi.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Las cuatro fuentes crudas que alimentan la transformación.
 */
@Value
@Builder
public class SourceTables {
    @NonNull DataTable clientes;
    @NonNull DataTable transacciones;
    @NonNull DataTable varios;
    @NonNull DataTable recomendados;
}

package com.tiendapago.bi.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Montos colocados en la fecha de corte y en lo que va del mes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesMetrics {
    private BigDecimal diaria;
    private BigDecimal acumuladoMes;
}

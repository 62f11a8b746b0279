package com.tiendapago.bi.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributorSales {
    private String nombreDistribuidor;
    private BigDecimal totalPrestamos;
}

package com.tiendapago.bi.repository;

import com.tiendapago.bi.model.DistributorSales;
import com.tiendapago.bi.model.SalesMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Consultas de colocación sobre el data warehouse.
 */
@Repository
public class SalesReportRepository {

    private static final Logger log = LoggerFactory.getLogger(SalesReportRepository.class);

    static final String METRICS_SQL =
            "SELECT COALESCE(SUM(CASE WHEN CAST(fecha_trx AS DATE) = ? THEN monto ELSE 0 END), 0) AS diaria, "
                    + "COALESCE(SUM(monto), 0) AS acumulado_mes "
                    + "FROM fct_transacciones "
                    + "WHERE fecha_trx >= ? AND fecha_trx < ?";

    // Las ventas sin distribuidor asociado se agrupan como venta directa
    static final String DISTRIBUTORS_SQL =
            "SELECT COALESCE(d.nombre_distribuidor, 'Venta Directa') AS nombre_distribuidor, "
                    + "SUM(f.monto) AS total_prestamos "
                    + "FROM fct_transacciones f "
                    + "LEFT JOIN dim_clientes c ON f.id_cliente = c.id_cliente "
                    + "LEFT JOIN dim_distribuidores d ON c.id_distribuidor = d.id_distribuidor "
                    + "WHERE CAST(f.fecha_trx AS DATE) = ? "
                    + "GROUP BY 1 "
                    + "ORDER BY total_prestamos DESC";

    private static final RowMapper<SalesMetrics> METRICS_MAPPER = (rs, rowNum) -> SalesMetrics.builder()
            .diaria(rs.getBigDecimal("diaria"))
            .acumuladoMes(rs.getBigDecimal("acumulado_mes"))
            .build();

    private static final RowMapper<DistributorSales> DISTRIBUTOR_MAPPER = (rs, rowNum) -> DistributorSales.builder()
            .nombreDistribuidor(rs.getString("nombre_distribuidor"))
            .totalPrestamos(rs.getBigDecimal("total_prestamos"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public SalesReportRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @param fechaCorte Día del reporte; el acumulado cubre desde el primer día del mes hasta el final de este día.
     */
    public SalesMetrics findMetrics(LocalDate fechaCorte) {
        log.debug("Consultando métricas de colocación al {}", fechaCorte);
        return jdbcTemplate.queryForObject(METRICS_SQL, METRICS_MAPPER,
                fechaCorte, fechaCorte.withDayOfMonth(1), fechaCorte.plusDays(1));
    }

    public List<DistributorSales> findDistributorSales(LocalDate fechaCorte) {
        log.debug("Consultando colocación por distribuidora al {}", fechaCorte);
        return jdbcTemplate.query(DISTRIBUTORS_SQL, DISTRIBUTOR_MAPPER, fechaCorte);
    }
}

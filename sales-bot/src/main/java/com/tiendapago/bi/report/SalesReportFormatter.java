package com.tiendapago.bi.report;

import com.tiendapago.bi.config.SalesReportProperties;
import com.tiendapago.bi.model.DistributorSales;
import com.tiendapago.bi.model.SalesMetrics;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Arma el texto del reporte de colocación en formato Markdown de Telegram.
 */
@Component
public class SalesReportFormatter {

    private static final String[] MESES = {
            "ENE", "FEB", "MAR", "ABR", "MAY", "JUN", "JUL", "AGO", "SEP", "OCT", "NOV", "DIC"
    };

    private static final String MARKDOWN_SPECIAL = "_*`[";

    private final SalesReportProperties reportProperties;

    public SalesReportFormatter(SalesReportProperties reportProperties) {
        this.reportProperties = reportProperties;
    }

    public String format(LocalDate fechaCorte, SalesMetrics metrics, List<DistributorSales> distribuidores) {
        StringBuilder reporte = new StringBuilder()
                .append("REPORTE DE COLOCACIÓN - PRÉSTAMOS\n")
                .append("FECHA DE CORTE: ").append(formatDate(fechaCorte)).append('\n')
                .append("=".repeat(30)).append("\n\n")
                .append("PRÉSTAMOS DEL DÍA: ").append(formatAmount(metrics.getDiaria())).append('\n')
                .append("ACUMULADO MENSUAL: ").append(formatAmount(metrics.getAcumuladoMes())).append("\n\n")
                .append("RENDIMIENTO POR DISTRIBUIDORA:\n");

        for (DistributorSales dist : distribuidores) {
            reporte.append("- ").append(escapeMarkdown(dist.getNombreDistribuidor())).append(": ")
                    .append(formatAmount(dist.getTotalPrestamos())).append('\n');
        }

        return reporte
                .append("\nANÁLISIS DETALLADO:\n")
                .append("[CONSULTAR DASHBOARD COMPLETO](").append(reportProperties.getDashboardUrl()).append(")\n")
                .toString();
    }

    static String formatDate(LocalDate date) {
        return date.getDayOfMonth() + " " + MESES[date.getMonthValue() - 1] + ", " + date.getYear();
    }

    /**
     * Escapa los caracteres reservados del modo Markdown de Telegram.
     */
    static String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (MARKDOWN_SPECIAL.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    static String formatAmount(BigDecimal amount) {
        // DecimalFormat no es thread-safe
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        return "$" + format.format(amount != null ? amount : BigDecimal.ZERO);
    }
}

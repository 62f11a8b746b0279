package com.tiendapago.bi.job;

import com.tiendapago.bi.config.SalesReportProperties;
import com.tiendapago.bi.model.DistributorSales;
import com.tiendapago.bi.model.SalesMetrics;
import com.tiendapago.bi.report.SalesReportFormatter;
import com.tiendapago.bi.repository.SalesReportRepository;
import com.tiendapago.bi.telegram.TelegramClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Genera el reporte diario de colocación y lo publica en Telegram.
 */
@Component
public class SalesBotJob implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SalesBotJob.class);

    private final SalesReportRepository salesReportRepository;
    private final SalesReportFormatter salesReportFormatter;
    private final TelegramClient telegramClient;
    private final SalesReportProperties reportProperties;
    private final boolean runOnStartup;

    public SalesBotJob(SalesReportRepository salesReportRepository,
                       SalesReportFormatter salesReportFormatter,
                       TelegramClient telegramClient,
                       SalesReportProperties reportProperties,
                       @Value("${app.bot.run-on-startup:false}") boolean runOnStartup) {
        this.salesReportRepository = salesReportRepository;
        this.salesReportFormatter = salesReportFormatter;
        this.telegramClient = telegramClient;
        this.reportProperties = reportProperties;
        this.runOnStartup = runOnStartup;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (runOnStartup) {
            sendReport();
        }
    }

    @Scheduled(cron = "${app.bot.cron:0 0 8 * * *}")
    public void runScheduled() {
        sendReport();
    }

    /**
     * @return true si el reporte llegó a Telegram.
     */
    public boolean sendReport() {
        LocalDate fechaCorte = reportProperties.resolveFechaCorte();
        log.info("Iniciando generación del reporte de colocación al {}...", fechaCorte);

        SalesMetrics metrics;
        List<DistributorSales> distribuidores;
        try {
            metrics = salesReportRepository.findMetrics(fechaCorte);
            distribuidores = salesReportRepository.findDistributorSales(fechaCorte);
        } catch (DataAccessException e) {
            log.error("Error en la base de datos: {}", e.getMessage(), e);
            return false;
        }

        if (metrics == null || distribuidores == null || distribuidores.isEmpty()) {
            log.error("No se pudieron obtener datos para el reporte del {}.", fechaCorte);
            return false;
        }

        String mensaje = salesReportFormatter.format(fechaCorte, metrics, distribuidores);
        return telegramClient.sendMessage(mensaje);
    }
}

package com.tiendapago.bi.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Dispara el pipeline según el cron configurado y, opcionalmente, una vez al arrancar.
 * Para una ejecución única (por ejemplo desde CI) usar run-on-startup=true y cron "-".
 */
@Component
public class EtlPipelineScheduler implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(EtlPipelineScheduler.class);

    private final EtlPipeline etlPipeline;
    private final boolean runOnStartup;

    public EtlPipelineScheduler(EtlPipeline etlPipeline,
                                @Value("${app.pipeline.run-on-startup:false}") boolean runOnStartup) {
        this.etlPipeline = etlPipeline;
        this.runOnStartup = runOnStartup;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (runOnStartup) {
            log.info("Ejecución del pipeline al iniciar la aplicación.");
            etlPipeline.run();
        }
    }

    @Scheduled(cron = "${app.pipeline.cron:0 0 6 * * *}")
    public void runScheduled() {
        log.info("Iniciando ejecución agendada del pipeline...");
        try {
            etlPipeline.run();
        } catch (Exception e) {
            log.error("Error inesperado durante la ejecución agendada del pipeline: {}", e.getMessage(), e);
        }
        log.info("Ejecución agendada del pipeline concluida.");
    }
}

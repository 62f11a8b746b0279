package com.tiendapago.bi.pipeline;

import com.tiendapago.bi.config.PipelineProperties;
import com.tiendapago.bi.extract.SourceExtractionException;
import com.tiendapago.bi.extract.SourceExtractor;
import com.tiendapago.bi.model.LoadReport;
import com.tiendapago.bi.model.SourceTables;
import com.tiendapago.bi.repository.WarehouseLoader;
import com.tiendapago.bi.transform.TransformOrchestrator;
import com.tiendapago.bi.transform.TransformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Orquestador principal: extracción, transformación y carga.
 * Si la transformación falla no se carga ninguna tabla.
 */
@Service
public class EtlPipeline {

    private static final Logger log = LoggerFactory.getLogger(EtlPipeline.class);

    private final SourceExtractor sourceExtractor;
    private final TransformOrchestrator transformOrchestrator;
    private final WarehouseLoader warehouseLoader;
    private final PipelineProperties pipelineProperties;

    public EtlPipeline(SourceExtractor sourceExtractor,
                       TransformOrchestrator transformOrchestrator,
                       WarehouseLoader warehouseLoader,
                       PipelineProperties pipelineProperties) {
        this.sourceExtractor = sourceExtractor;
        this.transformOrchestrator = transformOrchestrator;
        this.warehouseLoader = warehouseLoader;
        this.pipelineProperties = pipelineProperties;
    }

    /**
     * @return El reporte de carga, o vacío si alguna fase falló.
     */
    public Optional<LoadReport> run() {
        log.info("--- INICIANDO PIPELINE DE DATOS ---");

        log.info("Fase 1: Ingesta de datos...");
        SourceTables sources;
        try {
            sources = sourceExtractor.extract();
        } catch (SourceExtractionException e) {
            log.error("Falla crítica: no se pudieron obtener todas las fuentes de datos. Abortando. {}", e.getMessage(), e);
            return Optional.empty();
        }

        log.info("Fase 2: Transformación y lógica de negocio...");
        TransformResult result = transformOrchestrator.transform(sources);
        if (!result.isSuccess()) {
            log.error("Error en la transformación de datos: {}. No se carga ninguna tabla.",
                    result.getFailure().getMessage());
            return Optional.empty();
        }
        if (!result.getWarnings().isEmpty()) {
            log.warn("La transformación terminó con {} advertencias de calidad de datos.", result.getWarnings().size());
        }

        log.info("Fase 3: Carga al data warehouse...");
        try {
            LoadReport report = warehouseLoader.load(result.getTables(), pipelineProperties.getLoadMode());
            log.info("--- PIPELINE FINALIZADO CON ÉXITO ---");
            return Optional.of(report);
        } catch (DataAccessException | TransactionException | IllegalStateException e) {
            log.error("Error crítico en la base de datos, la carga se revirtió: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }
}

package com.tiendapago.bi.extract;

import com.tiendapago.bi.config.PipelineProperties;
import com.tiendapago.bi.model.DataTable;
import com.tiendapago.bi.model.SourceTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Fase de extracción: obtiene el libro de clientes y el JSON de recomendados y los lee como tablas.
 */
@Service
public class SourceExtractor {

    private static final Logger log = LoggerFactory.getLogger(SourceExtractor.class);

    private final SourceFileResolver sourceFileResolver;
    private final ExcelSheetReader excelSheetReader;
    private final JsonRecordsReader jsonRecordsReader;
    private final PipelineProperties.Sources sources;

    public SourceExtractor(SourceFileResolver sourceFileResolver,
                           ExcelSheetReader excelSheetReader,
                           JsonRecordsReader jsonRecordsReader,
                           PipelineProperties pipelineProperties) {
        this.sourceFileResolver = sourceFileResolver;
        this.excelSheetReader = excelSheetReader;
        this.jsonRecordsReader = jsonRecordsReader;
        this.sources = pipelineProperties.getSources();
    }

    /**
     * @throws SourceExtractionException Si alguna de las cuatro fuentes no se puede obtener.
     */
    public SourceTables extract() throws SourceExtractionException {
        Path excel = sourceFileResolver.resolve(Path.of(sources.getExcelPath()));
        Path json = sourceFileResolver.resolve(Path.of(sources.getJsonPath()));

        DataTable clientes = excelSheetReader.readSheet(excel, sources.getClientesSheet(), true);
        DataTable transacciones = excelSheetReader.readSheet(excel, sources.getTransaccionesSheet(), true);
        DataTable varios = excelSheetReader.readSheet(excel, sources.getVariosSheet(), false);
        DataTable recomendados = jsonRecordsReader.read(json);

        log.info("Fuentes extraídas: clientes={}, transacciones={}, varios={}, recomendados={}",
                clientes.rowCount(), transacciones.rowCount(), varios.rowCount(), recomendados.rowCount());
        return SourceTables.builder()
                .clientes(clientes)
                .transacciones(transacciones)
                .varios(varios)
                .recomendados(recomendados)
                .build();
    }
}

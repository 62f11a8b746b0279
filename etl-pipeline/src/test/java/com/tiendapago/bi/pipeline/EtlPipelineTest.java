package com.tiendapago.bi.pipeline;

import com.tiendapago.bi.config.PipelineProperties;
import com.tiendapago.bi.extract.SourceExtractionException;
import com.tiendapago.bi.extract.SourceExtractor;
import com.tiendapago.bi.model.DataTable;
import com.tiendapago.bi.model.LoadReport;
import com.tiendapago.bi.model.SourceTables;
import com.tiendapago.bi.model.WarehouseTables;
import com.tiendapago.bi.repository.LoadMode;
import com.tiendapago.bi.repository.WarehouseLoader;
import com.tiendapago.bi.transform.CatalogSplitter;
import com.tiendapago.bi.transform.CutPointRule;
import com.tiendapago.bi.transform.DimensionBuilder;
import com.tiendapago.bi.transform.DuplicateMatchPolicy;
import com.tiendapago.bi.transform.FactSchemaMapping;
import com.tiendapago.bi.transform.IntegrityReconciler;
import com.tiendapago.bi.transform.TransformOrchestrator;
import com.tiendapago.bi.transform.TypeCaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EtlPipelineTest {

    @Mock private SourceExtractor sourceExtractor;
    @Mock private WarehouseLoader warehouseLoader;

    private PipelineProperties pipelineProperties;
    private EtlPipeline etlPipeline;

    @BeforeEach
    void setUp() {
        pipelineProperties = new PipelineProperties();
        pipelineProperties.setLoadMode(LoadMode.INCREMENTAL);
        TransformOrchestrator orchestrator = new TransformOrchestrator(
                new CatalogSplitter(CutPointRule.SECOND_SENTINEL),
                new IntegrityReconciler(),
                new DimensionBuilder(DuplicateMatchPolicy.KEEP_FIRST),
                FactSchemaMapping.standard(),
                new TypeCaster());
        etlPipeline = new EtlPipeline(sourceExtractor, orchestrator, warehouseLoader, pipelineProperties);
    }

    private static SourceTables sources(int transactionColumns) {
        List<Object> transaction = Arrays.asList(100L, LocalDateTime.of(2025, 6, 14, 9, 0), 10L, 1L, 300.0, 3.0, 1L);
        List<String> columns = List.of("c0", "c1", "c2", "c3", "c4", "c5", "c6");
        return SourceTables.builder()
                .clientes(DataTable.of(List.of("IDCLIENTE", "fechaafiliacion", "fechaprimertrx"),
                        List.of(Arrays.asList(100L, "2025-01-05", null))))
                .transacciones(DataTable.of(columns.subList(0, transactionColumns),
                        List.of(transaction.subList(0, transactionColumns))))
                .varios(DataTable.of(List.of("col0", "col1"),
                        List.of(List.of("ID", "SEDE"), List.of(1L, "Lima"), List.of("ID", "TIPO"), List.of(10L, "Préstamo"))))
                .recomendados(DataTable.empty())
                .build();
    }

    @Test
    void run_successfulTransform_isLoaded() throws Exception {
        when(sourceExtractor.extract()).thenReturn(sources(7));
        LoadReport report = LoadReport.builder().mode(LoadMode.INCREMENTAL).build();
        when(warehouseLoader.load(any(WarehouseTables.class), eq(LoadMode.INCREMENTAL))).thenReturn(report);

        Optional<LoadReport> result = etlPipeline.run();

        assertEquals(Optional.of(report), result);
    }

    @Test
    void run_failedTransform_loadsNothing() throws Exception {
        when(sourceExtractor.extract()).thenReturn(sources(6));

        Optional<LoadReport> result = etlPipeline.run();

        assertTrue(result.isEmpty());
        verifyNoInteractions(warehouseLoader);
    }

    @Test
    void run_missingSource_abortsBeforeTransform() throws Exception {
        when(sourceExtractor.extract()).thenThrow(new SourceExtractionException("El archivo fuente no está disponible"));

        assertTrue(etlPipeline.run().isEmpty());
        verifyNoInteractions(warehouseLoader);
    }

    @Test
    void run_databaseError_isReportedAsEmptyResult() throws Exception {
        when(sourceExtractor.extract()).thenReturn(sources(7));
        when(warehouseLoader.load(any(), any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertTrue(etlPipeline.run().isEmpty());
    }

    @Test
    void run_unreachableDatabase_isReportedAsEmptyResult() throws Exception {
        when(sourceExtractor.extract()).thenReturn(sources(7));
        when(warehouseLoader.load(any(), any()))
                .thenThrow(new CannotCreateTransactionException("Could not open JDBC Connection for transaction"));

        assertTrue(etlPipeline.run().isEmpty());
    }
}

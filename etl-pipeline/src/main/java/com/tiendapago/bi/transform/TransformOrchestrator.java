package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;
import com.tiendapago.bi.model.SourceTables;
import com.tiendapago.bi.model.WarehouseTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.tiendapago.bi.model.WarehouseColumns.ID_TIPO_TRX;

/**
 * Ejecuta la transformación completa: corte del catálogo mixto, reconciliación de tipos,
 * dimensiones, hechos y tipado final. Todo o nada: cualquier excepción produce un resultado FAILED.
 */
public class TransformOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TransformOrchestrator.class);

    private final CatalogSplitter catalogSplitter;
    private final IntegrityReconciler integrityReconciler;
    private final DimensionBuilder dimensionBuilder;
    private final FactBuilder factBuilder;
    private final FactSchemaMapping factSchemaMapping;
    private final TypeCaster typeCaster;

    public TransformOrchestrator(CatalogSplitter catalogSplitter,
                                 IntegrityReconciler integrityReconciler,
                                 DimensionBuilder dimensionBuilder,
                                 FactSchemaMapping factSchemaMapping,
                                 TypeCaster typeCaster) {
        this.catalogSplitter = catalogSplitter;
        this.integrityReconciler = integrityReconciler;
        this.dimensionBuilder = dimensionBuilder;
        this.factSchemaMapping = factSchemaMapping;
        this.factBuilder = new FactBuilder(factSchemaMapping);
        this.typeCaster = typeCaster;
    }

    public TransformResult transform(SourceTables sources) {
        return transform(sources, new TransformDiagnostics());
    }

    public TransformResult transform(SourceTables sources, TransformDiagnostics diagnostics) {
        log.info("[run {}] Iniciando transformación de datos.", diagnostics.getRunId());
        try {
            CatalogSplitter.Catalogs catalogs = catalogSplitter.split(sources.getVarios(), diagnostics);

            DataTable tipos = integrityReconciler.reconcile(catalogs.getTipos(), sources.getTransacciones(),
                    factSchemaMapping.positionOf(ID_TIPO_TRX), diagnostics);

            DataTable distribuidores = dimensionBuilder.buildDistributors(sources.getRecomendados(), diagnostics);
            DataTable clientes = dimensionBuilder.buildClients(sources.getClientes(), sources.getRecomendados(), diagnostics);
            DataTable transacciones = factBuilder.build(sources.getTransacciones());

            WarehouseTables tables = typeCaster.apply(
                    new WarehouseTables(catalogs.getSedes(), tipos, distribuidores, clientes, transacciones), diagnostics);

            tables.asMap().forEach((name, table) ->
                    log.info("[run {}] {}: {} filas", diagnostics.getRunId(), name, table.rowCount()));
            log.info("[run {}] Transformación completada con {} advertencias.",
                    diagnostics.getRunId(), diagnostics.getWarnings().size());
            return TransformResult.success(tables, diagnostics.getWarnings());
        } catch (RuntimeException e) {
            log.error("[run {}] Error crítico durante la transformación: {}", diagnostics.getRunId(), e.getMessage(), e);
            return TransformResult.failed(e, diagnostics.getWarnings());
        }
    }
}

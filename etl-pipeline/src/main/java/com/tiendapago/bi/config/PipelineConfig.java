package com.tiendapago.bi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tiendapago.bi.transform.CatalogSplitter;
import com.tiendapago.bi.transform.DimensionBuilder;
import com.tiendapago.bi.transform.FactSchemaMapping;
import com.tiendapago.bi.transform.IntegrityReconciler;
import com.tiendapago.bi.transform.TransformOrchestrator;
import com.tiendapago.bi.transform.TypeCaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public TransformOrchestrator transformOrchestrator(PipelineProperties pipelineProperties) {
        PipelineProperties.Transform transform = pipelineProperties.getTransform();
        FactSchemaMapping factSchemaMapping = FactSchemaMapping.of(transform.getFactColumns());
        log.info("Transformación configurada: corte={}, recomendaciones duplicadas={}, columnas de hechos={}",
                transform.getCutPointRule(), transform.getDuplicateMatchPolicy(), factSchemaMapping.getCanonicalNames());
        return new TransformOrchestrator(
                new CatalogSplitter(transform.getCutPointRule()),
                new IntegrityReconciler(),
                new DimensionBuilder(transform.getDuplicateMatchPolicy()),
                factSchemaMapping,
                new TypeCaster());
    }
}

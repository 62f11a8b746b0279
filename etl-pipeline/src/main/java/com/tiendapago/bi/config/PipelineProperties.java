package com.tiendapago.bi.config;

import com.tiendapago.bi.repository.LoadMode;
import com.tiendapago.bi.transform.CutPointRule;
import com.tiendapago.bi.transform.DuplicateMatchPolicy;
import com.tiendapago.bi.transform.FactSchemaMapping;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    @Valid
    private Sources sources = new Sources();

    @Valid
    private Transform transform = new Transform();

    @NotNull
    private LoadMode loadMode = LoadMode.APPEND;

    @Data
    public static class Sources {
        @NotBlank
        private String excelPath = "data/ClientesMarca.xlsx";
        @NotBlank
        private String jsonPath = "data/RecomendadosMarca.json";
        @NotBlank
        private String clientesSheet = "Clientes";
        @NotBlank
        private String transaccionesSheet = "Transacciones";
        @NotBlank
        private String variosSheet = "Varios";
    }

    @Data
    public static class Transform {
        @NotNull
        private CutPointRule cutPointRule = CutPointRule.SECOND_SENTINEL;
        @NotNull
        private DuplicateMatchPolicy duplicateMatchPolicy = DuplicateMatchPolicy.KEEP_ALL;
        /** Nombre canónico de cada columna de la hoja Transacciones, por posición. */
        @NotEmpty
        private List<String> factColumns = new ArrayList<>(FactSchemaMapping.FACT_COLUMNS);
    }
}

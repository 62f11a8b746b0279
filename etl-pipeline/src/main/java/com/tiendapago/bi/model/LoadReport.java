package com.tiendapago.bi.model;

import com.tiendapago.bi.repository.LoadMode;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * Resumen de una carga al data warehouse.
 */
@Data
@Builder
public class LoadReport {

    private LoadMode mode;
    private Instant loadedAt;
    @Singular
    private List<TableLoad> tables;

    @Data
    @Builder
    public static class TableLoad {
        private String tableName;
        private int inserted;
        private int skipped;
    }

    public int totalInserted() {
        return tables.stream().mapToInt(TableLoad::getInserted).sum();
    }
}

package com.tiendapago.bi.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Tabla en memoria: nombres de columna ordenados y filas posicionales.
 * Las filas admiten valores nulos. Todas las operaciones devuelven una tabla nueva.
 */
public final class DataTable {

    private final List<String> columns;
    private final List<List<Object>> rows;

    private DataTable(List<String> columns, List<List<Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Crea una tabla validando que cada fila tenga tantos valores como columnas.
     *
     * @param columns Nombres de columna, en orden.
     * @param rows    Filas posicionales.
     * @return La tabla.
     * @throws IllegalArgumentException Si alguna fila no coincide con el número de columnas.
     */
    public static DataTable of(List<String> columns, List<? extends List<?>> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        List<String> copiedColumns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Object>> copiedRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<?> row = rows.get(i);
            if (row.size() != copiedColumns.size()) {
                throw new IllegalArgumentException(String.format(
                        "La fila %d tiene %d valores pero la tabla tiene %d columnas %s",
                        i, row.size(), copiedColumns.size(), copiedColumns));
            }
            copiedRows.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
        }
        return new DataTable(copiedColumns, Collections.unmodifiableList(copiedRows));
    }

    public static DataTable empty(String... columns) {
        return of(Arrays.asList(columns), Collections.emptyList());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @return La posición de la columna, o -1 si no existe.
     */
    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Object value(int row, String column) {
        int index = indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Columna inexistente: " + column);
        }
        return rows.get(row).get(index);
    }

    public List<Object> columnValues(int index) {
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    public List<Object> columnValues(String column) {
        int index = indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Columna inexistente: " + column);
        }
        return columnValues(index);
    }

    /**
     * Filas en el rango [from, to). Los límites se ajustan al tamaño de la tabla.
     */
    public DataTable slice(int fromInclusive, int toExclusive) {
        int from = Math.max(0, Math.min(fromInclusive, rows.size()));
        int to = Math.max(from, Math.min(toExclusive, rows.size()));
        return new DataTable(columns, rows.subList(from, to));
    }

    /**
     * Reasigna los nombres de columna por posición.
     */
    public DataTable withColumnNames(List<String> names) {
        if (names.size() != columns.size()) {
            throw new IllegalArgumentException(String.format(
                    "Se esperaban %d nombres de columna, se recibieron %d", columns.size(), names.size()));
        }
        return new DataTable(Collections.unmodifiableList(new ArrayList<>(names)), rows);
    }

    /**
     * Renombra las columnas presentes en el mapa; las demás conservan su nombre.
     */
    public DataTable renameColumns(Map<String, String> renames) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            renamed.add(renames.getOrDefault(column, column));
        }
        return new DataTable(Collections.unmodifiableList(renamed), rows);
    }

    /**
     * Proyección sobre las columnas indicadas, en el orden indicado.
     */
    public DataTable select(List<String> selected) {
        int[] indexes = new int[selected.size()];
        for (int i = 0; i < selected.size(); i++) {
            indexes[i] = indexOf(selected.get(i));
            if (indexes[i] < 0) {
                throw new IllegalArgumentException("Columna inexistente: " + selected.get(i));
            }
        }
        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> values = new ArrayList<>(indexes.length);
            for (int index : indexes) {
                values.add(row.get(index));
            }
            projected.add(values);
        }
        return of(selected, projected);
    }

    public DataTable dropColumn(String column) {
        List<String> remaining = new ArrayList<>(columns);
        remaining.remove(column);
        return select(remaining);
    }

    public DataTable filterRows(Predicate<List<Object>> predicate) {
        List<List<Object>> kept = new ArrayList<>();
        for (List<Object> row : rows) {
            if (predicate.test(row)) {
                kept.add(row);
            }
        }
        return new DataTable(columns, Collections.unmodifiableList(kept));
    }

    /**
     * Aplica la función a cada valor de la columna.
     */
    public DataTable mapColumn(String column, Function<Object, Object> mapper) {
        int index = indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Columna inexistente: " + column);
        }
        List<List<Object>> mapped = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> values = new ArrayList<>(row);
            values.set(index, mapper.apply(row.get(index)));
            mapped.add(values);
        }
        return of(columns, mapped);
    }

    public DataTable appendRows(List<? extends List<?>> extraRows) {
        List<List<?>> all = new ArrayList<>(rows);
        all.addAll(extraRows);
        return of(columns, all);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataTable)) {
            return false;
        }
        DataTable other = (DataTable) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}

package com.tiendapago.bi.extract;

import com.tiendapago.bi.model.DataTable;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lee una hoja de un libro Excel como {@link DataTable}.
 */
@Component
public class ExcelSheetReader {

    private static final Logger log = LoggerFactory.getLogger(ExcelSheetReader.class);

    /**
     * @param workbookPath Ruta del archivo .xlsx.
     * @param sheetName    Nombre de la hoja.
     * @param headerRow    Si la primera fila no vacía contiene los nombres de columna. Si es false,
     *                     todas las filas son datos y las columnas se llaman col0, col1, ...
     * @return La hoja como tabla; las filas completamente vacías se omiten.
     * @throws SourceExtractionException Si el archivo no se puede leer o la hoja no existe.
     */
    public DataTable readSheet(Path workbookPath, String sheetName, boolean headerRow) throws SourceExtractionException {
        try (InputStream inputStream = Files.newInputStream(workbookPath);
             Workbook workbook = WorkbookFactory.create(inputStream)) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new SourceExtractionException(String.format(
                        "La hoja '%s' no existe en %s", sheetName, workbookPath));
            }

            List<List<Object>> rawRows = new ArrayList<>();
            int width = 0;
            for (Row row : sheet) {
                List<Object> values = readRow(row);
                if (values.stream().allMatch(v -> v == null)) {
                    continue;
                }
                rawRows.add(values);
                width = Math.max(width, values.size());
            }

            List<String> columns = new ArrayList<>();
            if (headerRow && !rawRows.isEmpty()) {
                List<Object> header = rawRows.remove(0);
                for (int i = 0; i < width; i++) {
                    Object name = i < header.size() ? header.get(i) : null;
                    columns.add(name == null ? "col" + i : headerName(name));
                }
            } else {
                for (int i = 0; i < width; i++) {
                    columns.add("col" + i);
                }
            }

            List<List<Object>> rows = new ArrayList<>(rawRows.size());
            for (List<Object> values : rawRows) {
                List<Object> padded = new ArrayList<>(values);
                while (padded.size() < columns.size()) {
                    padded.add(null);
                }
                rows.add(padded.subList(0, columns.size()));
            }

            DataTable table = DataTable.of(columns, rows);
            log.info("Extracción exitosa: {} registros obtenidos de la hoja '{}'", table.rowCount(), sheetName);
            return table;
        } catch (IOException e) {
            throw new SourceExtractionException(String.format(
                    "Error de lectura en el archivo Excel %s (hoja %s): %s", workbookPath, sheetName, e.getMessage()), e);
        }
    }

    private List<Object> readRow(Row row) {
        List<Object> values = new ArrayList<>();
        int lastCell = Math.max(row.getLastCellNum(), 0);
        for (int c = 0; c < lastCell; c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            values.add(cell == null ? null : cellValue(cell, cell.getCellType()));
        }
        while (!values.isEmpty() && values.get(values.size() - 1) == null) {
            values.remove(values.size() - 1);
        }
        return values;
    }

    private Object cellValue(Cell cell, CellType type) {
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text.isBlank() ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                double number = cell.getNumericCellValue();
                if (number == Math.rint(number) && Math.abs(number) < Long.MAX_VALUE) {
                    return (long) number;
                }
                return number;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case FORMULA:
                return cellValue(cell, cell.getCachedFormulaResultType());
            default:
                return null;
        }
    }

    private String headerName(Object value) {
        return value instanceof String ? ((String) value).trim() : String.valueOf(value);
    }
}

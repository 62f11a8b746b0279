package com.tiendapago.bi.extract;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tiendapago.bi.model.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lee un arreglo JSON de objetos como {@link DataTable}. Las columnas son la unión de las claves,
 * en el orden en que aparecen por primera vez; las claves ausentes en un registro quedan nulas.
 */
@Component
public class JsonRecordsReader {

    private static final Logger log = LoggerFactory.getLogger(JsonRecordsReader.class);

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;

    public JsonRecordsReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DataTable read(Path jsonPath) throws SourceExtractionException {
        JsonNode root;
        try (InputStream inputStream = Files.newInputStream(jsonPath)) {
            root = objectMapper.readTree(inputStream);
        } catch (IOException e) {
            throw new SourceExtractionException(String.format(
                    "Error de parseo en el archivo JSON %s: %s", jsonPath, e.getMessage()), e);
        }

        if (root == null || !root.isArray()) {
            throw new SourceExtractionException("El archivo JSON " + jsonPath + " no contiene un arreglo de registros");
        }

        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> records = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new SourceExtractionException("Registro no válido en " + jsonPath + ": " + node);
            }
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                columns.add(names.next());
            }
            records.add(objectMapper.convertValue(node, RECORD_TYPE));
        }

        List<String> columnList = new ArrayList<>(columns);
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            List<Object> row = new ArrayList<>(columnList.size());
            for (String column : columnList) {
                row.add(record.get(column));
            }
            rows.add(row);
        }

        DataTable table = DataTable.of(columnList, rows);
        log.info("Extracción exitosa: {} registros obtenidos desde JSON {}", table.rowCount(), jsonPath.getFileName());
        return table;
    }
}

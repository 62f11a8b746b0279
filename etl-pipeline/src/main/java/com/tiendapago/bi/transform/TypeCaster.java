package com.tiendapago.bi.transform;

import com.tiendapago.bi.model.DataTable;
import com.tiendapago.bi.model.WarehouseTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.function.Function;

import static com.tiendapago.bi.model.WarehouseColumns.FECHA_AFILIACION;
import static com.tiendapago.bi.model.WarehouseColumns.FECHA_PRIMERA_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.FECHA_TRX;
import static com.tiendapago.bi.model.WarehouseColumns.ID_SEDE;
import static com.tiendapago.bi.model.WarehouseColumns.ID_TIPO_TRX;

/**
 * Tipado final de las tablas de salida. Tolerante a datos sucios: una fecha o clave inválida
 * se anula o se descarta, salvo el código de tipo en la tabla de hechos, cuya validez ya fue
 * garantizada por la reconciliación y cuyo fallo aborta la transformación.
 * Aplicarlo dos veces produce el mismo resultado que aplicarlo una.
 */
public class TypeCaster {

    private static final Logger log = LoggerFactory.getLogger(TypeCaster.class);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy"));

    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    public WarehouseTables apply(WarehouseTables tables, TransformDiagnostics diagnostics) {
        DataTable sedes = castKeyDroppingInvalid(tables.getSedes(), ID_SEDE, WarehouseTables.DIM_SEDES, diagnostics);
        DataTable tipos = castKeyDroppingInvalid(tables.getTiposTransaccion(), ID_TIPO_TRX,
                WarehouseTables.DIM_TIPO_TRANSACCION, diagnostics);

        DataTable clientes = tables.getClientes();
        clientes = castLenient(clientes, FECHA_AFILIACION, TypeCaster::toLocalDate, WarehouseTables.DIM_CLIENTES, diagnostics);
        clientes = castLenient(clientes, FECHA_PRIMERA_TRX, TypeCaster::toLocalDate, WarehouseTables.DIM_CLIENTES, diagnostics);

        DataTable transacciones = tables.getTransacciones();
        transacciones = castLenient(transacciones, FECHA_TRX, TypeCaster::toLocalDateTime,
                WarehouseTables.FCT_TRANSACCIONES, diagnostics);
        transacciones = castKeyStrict(transacciones, ID_TIPO_TRX, WarehouseTables.FCT_TRANSACCIONES);

        return new WarehouseTables(sedes, tipos, tables.getDistribuidores(), clientes, transacciones);
    }

    private DataTable castKeyDroppingInvalid(DataTable table, String column, String tableName,
                                             TransformDiagnostics diagnostics) {
        int index = requireColumn(table, column, tableName);
        DataTable valid = table.filterRows(row -> toInteger(row.get(index)) != null);
        int dropped = table.rowCount() - valid.rowCount();
        if (dropped > 0) {
            diagnostics.warn(log, "{}: se descartaron {} filas con {} nulo o no numérico.", tableName, dropped, column);
        }
        return valid.mapColumn(column, TypeCaster::toInteger);
    }

    private DataTable castKeyStrict(DataTable table, String column, String tableName) {
        int index = requireColumn(table, column, tableName);
        for (int i = 0; i < table.rowCount(); i++) {
            Object raw = table.getRows().get(i).get(index);
            if (toInteger(raw) == null) {
                throw new TransformException(String.format(
                        "%s: no se pudo convertir %s='%s' a entero en la fila %d", tableName, column, raw, i));
            }
        }
        return table.mapColumn(column, TypeCaster::toInteger);
    }

    private DataTable castLenient(DataTable table, String column, Function<Object, Object> caster, String tableName,
                                  TransformDiagnostics diagnostics) {
        int index = requireColumn(table, column, tableName);
        int invalid = 0;
        for (List<Object> row : table.getRows()) {
            Object raw = row.get(index);
            if (raw != null && caster.apply(raw) == null) {
                invalid++;
            }
        }
        if (invalid > 0) {
            diagnostics.warn(log, "{}: {} valores de {} no se pudieron interpretar como fecha y quedan nulos.",
                    tableName, invalid, column);
        }
        return table.mapColumn(column, caster);
    }

    private int requireColumn(DataTable table, String column, String tableName) {
        int index = table.indexOf(column);
        if (index < 0) {
            throw new SchemaMismatchException(String.format(
                    "La tabla %s no tiene la columna %s. Columnas: %s", tableName, column, table.getColumns()));
        }
        return index;
    }

    /**
     * Convierte a entero un número entero, o un texto que lo represente.
     *
     * @return El entero, o null si el valor es nulo, no numérico, tiene decimales o no cabe en un int.
     */
    public static Integer toInteger(Object value) {
        BigInteger whole = toWholeNumber(value);
        if (whole == null || whole.compareTo(INT_MIN) < 0 || whole.compareTo(INT_MAX) > 0) {
            return null;
        }
        return whole.intValue();
    }

    /**
     * Normaliza una clave de cruce: los números enteros (como número o texto) pasan a Long
     * para que 7, 7L, 7.0 y "7" coincidan; otros textos se recortan; nulos y vacíos son null.
     */
    public static Object toKey(Object value) {
        BigInteger whole = toWholeNumber(value);
        if (whole != null && whole.bitLength() < Long.SIZE) {
            return whole.longValue();
        }
        if (value instanceof String) {
            String trimmed = ((String) value).trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        return value;
    }

    private static BigInteger toWholeNumber(Object value) {
        BigDecimal decimal;
        if (value == null || value instanceof Boolean) {
            return null;
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof BigInteger) {
            return (BigInteger) value;
        } else if (value instanceof BigDecimal) {
            decimal = (BigDecimal) value;
        } else if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            decimal = BigDecimal.valueOf(d);
        } else if (value instanceof String) {
            String trimmed = ((String) value).trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                decimal = new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        try {
            return decimal.toBigIntegerExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    public static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            for (DateTimeFormatter format : DATE_FORMATS) {
                try {
                    return LocalDate.parse(text, format);
                } catch (DateTimeParseException ignored) {
                    // se prueba el siguiente formato
                }
            }
            LocalDateTime dateTime = parseDateTime(text);
            return dateTime == null ? null : dateTime.toLocalDate();
        }
        return null;
    }

    public static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().atZone(ZoneId.systemDefault()).toLocalDateTime();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            LocalDateTime dateTime = parseDateTime(text);
            if (dateTime != null) {
                return dateTime;
            }
            LocalDate date = toLocalDate(text);
            return date == null ? null : date.atStartOfDay();
        }
        return null;
    }

    private static LocalDateTime parseDateTime(String text) {
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // se prueba el siguiente formato
            }
        }
        return null;
    }
}

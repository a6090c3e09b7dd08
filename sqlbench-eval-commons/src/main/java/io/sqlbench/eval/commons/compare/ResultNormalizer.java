package io.sqlbench.eval.commons.compare;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.postgresql.util.PGobject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical form of result rows: dates reduced to the day, numbers rounded to two decimals and
 * compared by value, nested structures serialized to sorted-key JSON.
 */
public final class ResultNormalizer {

    public static final int SCALE = 2;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    private ResultNormalizer() {
    }

    public static List<List<Object>> normalizeRows(List<List<Object>> rows) {
        if (rows == null) {
            return null;
        }
        var result = new ArrayList<List<Object>>(rows.size());
        for (List<Object> row : rows) {
            result.add(normalizeRow(row));
        }
        return result;
    }

    public static List<Object> normalizeRow(List<?> row) {
        var result = new ArrayList<>(row.size());
        for (Object value : row) {
            result.add(normalizeValue(value));
        }
        return Collections.unmodifiableList(result);
    }

    public static Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().format(DAY);
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toLocalDate().format(DAY);
        }
        if (value instanceof LocalDate date) {
            return date.format(DAY);
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate().format(DAY);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate().format(DAY);
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate().format(DAY);
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof byte[] bytes) {
            return HexFormat.of().formatHex(bytes);
        }
        if (value instanceof PGobject pgObject) {
            return normalizePgObject(pgObject);
        }
        if (value instanceof Map<?, ?> || value instanceof List<?> || value instanceof Object[]) {
            return toJson(round(value));
        }
        return value;
    }

    /**
     * Decimals and floats are rounded half-up to two places. Every number is then compared by value,
     * so {@code 5}, {@code 5.0} and {@code 5.00} are equal.
     */
    public static Object normalizeNumber(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal bigDecimal) {
            decimal = bigDecimal.setScale(SCALE, RoundingMode.HALF_UP);
        } else if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return number.toString();
            }
            decimal = new BigDecimal(number.toString()).setScale(SCALE, RoundingMode.HALF_UP);
        } else if (number instanceof BigInteger bigInteger) {
            decimal = new BigDecimal(bigInteger);
        } else {
            decimal = BigDecimal.valueOf(number.longValue());
        }
        var stripped = decimal.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static Object normalizePgObject(PGobject pgObject) {
        var type = pgObject.getType();
        var text = pgObject.getValue();
        if (text != null && ("json".equals(type) || "jsonb".equals(type))) {
            try {
                return toJson(round(MAPPER.readValue(text, Object.class)));
            } catch (JsonProcessingException e) {
                return text;
            }
        }
        return text;
    }

    private static Object round(Object value) {
        if (value instanceof Map<?, ?> map) {
            var result = new TreeMap<String, Object>();
            map.forEach((k, v) -> result.put(String.valueOf(k), round(v)));
            return result;
        }
        if (value instanceof List<?> list) {
            var result = new ArrayList<>(list.size());
            list.forEach(v -> result.add(round(v)));
            return result;
        }
        if (value instanceof Object[] array) {
            return round(Arrays.asList(array));
        }
        if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
            return normalizeNumber((Number) value);
        }
        return value;
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize " + value, e);
        }
    }
}

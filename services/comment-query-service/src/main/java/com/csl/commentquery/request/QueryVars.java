package com.csl.commentquery.request;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class QueryVars {
    private static final Pattern NUMERIC = Pattern.compile(
        "^\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?\\s*$"
    );
    private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[\\s,]+");
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);

    private QueryVars() {
    }

    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isEmpty() || "0".equals(text);
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0d;
        }
        if (value instanceof Boolean flag) {
            return !flag;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    public static boolean isIntegerZero(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue() == 0L;
        }
        return false;
    }

    public static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof String text) {
            return NUMERIC.matcher(text).matches();
        }
        return false;
    }

    public static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof BigDecimal decimal) {
            return saturate(decimal);
        }
        if (value instanceof BigInteger integer) {
            return saturate(new BigDecimal(integer));
        }
        if (value instanceof Double || value instanceof Float) {
            return (long) ((Number) value).doubleValue();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1L : 0L;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty() ? 0L : 1L;
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty() ? 0L : 1L;
        }
        String text = value.toString();
        if (NUMERIC.matcher(text).matches()) {
            try {
                return saturate(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        Matcher matcher = LEADING_INT.matcher(text);
        if (matcher.find()) {
            return saturate(new BigDecimal(matcher.group(1)));
        }
        return 0L;
    }

    public static long toAbsLong(Object value) {
        long number = toLong(value);
        return number == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(number);
    }

    public static int toInt(Object value) {
        long number = toLong(value);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, number));
    }

    private static long saturate(BigDecimal decimal) {
        if (decimal.compareTo(LONG_MAX) > 0) {
            return Long.MAX_VALUE;
        }
        if (decimal.compareTo(LONG_MIN) < 0) {
            return Long.MIN_VALUE;
        }
        return decimal.longValue();
    }

    public static String asString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Boolean flag) {
            return flag ? "1" : "";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return Long.toString((long) number);
            }
        }
        return value.toString();
    }

    public static List<Object> toList(Object value) {
        List<Object> values = new ArrayList<>();
        if (value == null) {
            return values;
        }
        if (value instanceof Collection<?> collection) {
            values.addAll(collection);
        } else if (value instanceof Map<?, ?> map) {
            values.addAll(map.values());
        } else {
            values.add(value);
        }
        return values;
    }

    public static List<String> splitAndTrim(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof String text) {
            for (String part : text.split(",", -1)) {
                values.add(part.trim());
            }
            return values;
        }
        for (Object item : toList(value)) {
            values.add(asString(item).trim());
        }
        return values;
    }

    public static List<Object> parseList(Object value) {
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            return toList(value);
        }
        List<Object> values = new ArrayList<>();
        for (String part : LIST_SEPARATOR.split(asString(value))) {
            if (!part.isEmpty()) {
                values.add(part);
            }
        }
        return values;
    }
}

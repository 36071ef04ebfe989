package xyz.vvrf.reactor.flow.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.*;

/**
 * 节点之间传递的动态值（Map / List / 字符串 / 数字 / 布尔）的转换与比较。
 */
public final class Values {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Values() {}

    /**
     * 真值判断：null、false、0、NaN、空字符串为假；Map 与集合总为真。
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        return true;
    }

    /**
     * 数值转换。无法转换时返回 NaN，调用方用 {@link Double#isFinite(double)} 判断。
     */
    public static double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return Double.NaN;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * 字符串转换。整数值的浮点数不带小数部分，Map 与集合转换为紧凑 JSON。
     */
    public static String asString(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return value.toString();
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            return toJson(value, false);
        }
        return value.toString();
    }

    public static boolean isStructured(Object value) {
        return value instanceof Map || value instanceof Collection;
    }

    /**
     * 结构化比较：Map 按键、列表按位置递归比较，数字按数值比较，其余按字符串比较。
     */
    public static boolean deepEquals(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Map && right instanceof Map) {
            Map<?, ?> l = (Map<?, ?>) left;
            Map<?, ?> r = (Map<?, ?>) right;
            if (l.size() != r.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : l.entrySet()) {
                if (!r.containsKey(entry.getKey()) || !deepEquals(entry.getValue(), r.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof List && right instanceof List) {
            List<?> l = (List<?>) left;
            List<?> r = (List<?>) right;
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!deepEquals(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (isStructured(left) || isStructured(right)) {
            return false;
        }
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue()) == 0;
        }
        return asString(left).equals(asString(right));
    }

    /**
     * 尝试将字符串解析为 JSON（对象或数组）。
     */
    public static Optional<Object> parseJson(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(trimmed, Object.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public static String toJson(Object value, boolean pretty) {
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                    : MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /**
     * 集合拆分为元素列表，其它值包装为单元素列表。
     */
    public static List<Object> toItems(Object value) {
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value instanceof Object[]) {
            return new ArrayList<>(Arrays.asList((Object[]) value));
        }
        return new ArrayList<>(Collections.singletonList(value));
    }
}

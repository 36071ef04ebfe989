package xyz.vvrf.reactor.flow.node;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.node.config.ConditionalConfig;
import xyz.vvrf.reactor.flow.util.JsonPaths;
import xyz.vvrf.reactor.flow.util.Values;

import java.util.*;

/**
 * 条件的规范化与求值。
 */
@Slf4j
public final class ConditionEvaluator {

    public static final String NUMBER_GREATER_THAN = "numberGreaterThan";
    public static final String NUMBER_LESS_THAN = "numberLessThan";
    public static final String EQUAL_TO = "equalTo";
    public static final String CONTAINS_SUBSTRING = "containsSubstring";
    public static final String JSON_PATH_EXISTS_TRUTHY = "jsonPathExistsTruthy";

    private static final Set<String> KNOWN_TYPES = new HashSet<>(Arrays.asList(
            NUMBER_GREATER_THAN, NUMBER_LESS_THAN, EQUAL_TO, CONTAINS_SUBSTRING, JSON_PATH_EXISTS_TRUTHY));

    private static final Map<String, String> LEGACY_ALIASES = new HashMap<>();

    static {
        LEGACY_ALIASES.put("contains", CONTAINS_SUBSTRING);
        LEGACY_ALIASES.put("greater_than", NUMBER_GREATER_THAN);
        LEGACY_ALIASES.put("less_than", NUMBER_LESS_THAN);
        LEGACY_ALIASES.put("equal_to", EQUAL_TO);
        LEGACY_ALIASES.put("json_path", JSON_PATH_EXISTS_TRUTHY);
    }

    private ConditionEvaluator() {}

    /**
     * 规范化后的条件。
     */
    @Getter
    public static final class Condition {
        private final String type;
        private final Object value;

        Condition(String type, Object value) {
            this.type = type;
            this.value = value;
        }

        @Override
        public String toString() {
            return type + "(" + value + ")";
        }
    }

    /**
     * 将各种历史配置形态归一为 {type, value}。什么都没配置时为 equalTo true；未知类型回退为 equalTo。
     */
    public static Condition normalize(ConditionalConfig config) {
        Map<String, Object> nested = config.getCondition() != null ? config.getCondition() : Collections.emptyMap();

        String type = firstNonBlank(config.getConditionType(), config.getType(),
                stringOrNull(nested.get("conditionType")), stringOrNull(nested.get("type")));
        Object value = firstNonNull(config.getConditionValue(), config.getValue(),
                nested.get("conditionValue"), nested.get("value"));

        if (type == null && value == null) {
            return new Condition(EQUAL_TO, Boolean.TRUE);
        }
        if (type == null) {
            type = EQUAL_TO;
        }
        type = LEGACY_ALIASES.getOrDefault(type, type);
        if (!KNOWN_TYPES.contains(type)) {
            log.warn("Unknown condition type '{}', falling back to {}.", type, EQUAL_TO);
            type = EQUAL_TO;
        }
        return new Condition(type, value != null ? value : "");
    }

    /**
     * 求值。
     *
     * @throws RuntimeException 谓词内部失败，调用方负责按 false 处理
     */
    public static boolean evaluate(Condition condition, Object input) {
        Object expected = condition.getValue();
        switch (condition.getType()) {
            case NUMBER_GREATER_THAN: {
                double actual = Values.toNumber(input);
                double threshold = Values.toNumber(expected);
                return Double.isFinite(actual) && Double.isFinite(threshold) && actual > threshold;
            }
            case NUMBER_LESS_THAN: {
                double actual = Values.toNumber(input);
                double threshold = Values.toNumber(expected);
                return Double.isFinite(actual) && Double.isFinite(threshold) && actual < threshold;
            }
            case CONTAINS_SUBSTRING:
                return input != null && Values.asString(input).contains(Values.asString(expected));
            case JSON_PATH_EXISTS_TRUTHY:
                return jsonPathTruthy(input, Values.asString(expected));
            case EQUAL_TO:
            default:
                return equalTo(input, expected);
        }
    }

    private static boolean equalTo(Object input, Object expected) {
        if (Values.isStructured(input) || Values.isStructured(expected)) {
            Object left = structuredOrSelf(input);
            Object right = structuredOrSelf(expected);
            return Values.deepEquals(left, right);
        }
        return Values.asString(input).equals(Values.asString(expected));
    }

    private static Object structuredOrSelf(Object value) {
        if (value instanceof String) {
            return Values.parseJson((String) value).orElse(value);
        }
        return value;
    }

    private static boolean jsonPathTruthy(Object input, String path) {
        Object root = structuredOrSelf(input);
        if (!Values.isStructured(root)) {
            return false;
        }
        return JsonPaths.read(root, path).map(Values::isTruthy).orElse(false);
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.trim().isEmpty()) {
                return candidate.trim();
            }
        }
        return null;
    }

    private static Object firstNonNull(Object... candidates) {
        for (Object candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }
}

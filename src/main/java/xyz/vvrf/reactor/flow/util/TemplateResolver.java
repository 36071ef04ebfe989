package xyz.vvrf.reactor.flow.util;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析 {@code {{input}}} 与 {@code {{some.path}}} 形式的模板变量。
 * 无法解析的路径变量保持原样。
 */
public final class TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^}]+?)\\s*}}");

    private TemplateResolver() {}

    public static boolean hasPlaceholders(String template) {
        return template != null && template.contains("{{");
    }

    /**
     * {@code {{input}}} 中结构化输入渲染为紧凑 JSON。
     */
    public static String resolve(String template, Object input) {
        return resolve(template, input, TemplateResolver::renderCompact);
    }

    /**
     * @param inputRenderer {@code {{input}}} 的渲染方式
     */
    public static String resolve(String template, Object input, Function<Object, String> inputRenderer) {
        if (template == null) {
            return "";
        }
        if (!hasPlaceholders(template)) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuffer result = new StringBuffer();
        while (matcher.find()) {
            String expression = matcher.group(1).trim();
            String replacement;
            if (expression.equals("input")) {
                replacement = inputRenderer.apply(input);
            } else {
                replacement = resolvePath(input, expression).orElse(matcher.group(0));
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Optional<String> resolvePath(Object input, String expression) {
        String path = expression.startsWith("input.") ? expression.substring("input.".length()) : expression;
        Object root = input instanceof String ? Values.parseJson((String) input).orElse(null) : input;
        if (!(root instanceof Map) && !(root instanceof List)) {
            return Optional.empty();
        }
        try {
            return JsonPaths.read(root, path).map(TemplateResolver::renderCompact);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String renderCompact(Object value) {
        if (value == null) {
            return "";
        }
        return Values.asString(value);
    }
}

package xyz.vvrf.reactor.flow.util;

import java.util.*;

/**
 * 简单的点路径访问：{@code a.b.0.c}、{@code a.b[0].c}，可带 {@code $.} 前缀。
 */
public final class JsonPaths {

    private JsonPaths() {}

    /**
     * 解析路径为段列表。段保持原始字符串，是否作为下标由读取时的当前值决定。
     *
     * @throws IllegalArgumentException 路径格式错误（空段、括号不匹配、非数字下标）
     */
    public static List<String> parse(String path) {
        Objects.requireNonNull(path, "path");
        String normalized = path.trim();
        if (normalized.equals("$")) {
            return Collections.emptyList();
        }
        if (normalized.startsWith("$.")) {
            normalized = normalized.substring(2);
        } else if (normalized.startsWith("$[")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> segments = new ArrayList<>();
        for (String part : normalized.split("\\.", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in path '" + path + "'");
            }
            int bracket = part.indexOf('[');
            String key = bracket < 0 ? part : part.substring(0, bracket);
            if (!key.isEmpty()) {
                segments.add(key);
            }
            while (bracket >= 0) {
                int close = part.indexOf(']', bracket);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '[' in path '" + path + "'");
                }
                String index = part.substring(bracket + 1, close).trim();
                if (!isDigits(index)) {
                    throw new IllegalArgumentException("Invalid index '" + index + "' in path '" + path + "'");
                }
                segments.add(index);
                bracket = part.indexOf('[', close);
                if (bracket < 0 && close != part.length() - 1) {
                    throw new IllegalArgumentException("Unexpected characters after ']' in path '" + path + "'");
                }
            }
        }
        return segments;
    }

    /**
     * 按路径读取。Map 按原始字符串取键，List 仅接受数字下标。
     * 任意中间值缺失或不是容器时返回空；null 值视为缺失。
     *
     * @throws IllegalArgumentException 路径格式错误
     */
    public static Optional<Object> read(Object root, String path) {
        Object current = root;
        for (String segment : parse(path)) {
            if (current instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) current;
                if (!map.containsKey(segment)) {
                    return Optional.empty();
                }
                current = map.get(segment);
            } else if (current instanceof List && isDigits(segment)) {
                List<?> list = (List<?>) current;
                long index;
                try {
                    index = Long.parseLong(segment);
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
                if (index >= list.size()) {
                    return Optional.empty();
                }
                current = list.get((int) index);
            } else {
                return Optional.empty();
            }
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}

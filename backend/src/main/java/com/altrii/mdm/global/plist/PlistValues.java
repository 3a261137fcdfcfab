package com.altrii.mdm.global.plist;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class PlistValues {

    private PlistValues() {
    }

    public static Optional<String> string(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value instanceof String text && !text.isBlank() ? Optional.of(text) : Optional.empty();
    }

    public static boolean bool(Map<String, Object> source, String key) {
        Object value = source.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value instanceof String text && Boolean.parseBoolean(text);
    }

    public static Optional<Boolean> optionalBool(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value instanceof Boolean flag ? Optional.of(flag) : Optional.empty();
    }

    public static Optional<byte[]> bytes(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value instanceof byte[] data ? Optional.of(data) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> dictionary(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> dictionaries(Map<String, Object> source, String key) {
        Object value = source.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Map.class::isInstance)
                .map(item -> (Map<String, Object>) item)
                .toList();
    }
}

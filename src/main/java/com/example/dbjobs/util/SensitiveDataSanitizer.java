package com.example.dbjobs.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 日志输出前脱敏：key 含 password/secret/token/key 的值替换掉，嵌套的 Map / List 递归处理
 */
public final class SensitiveDataSanitizer {
    public static final String REDACTED = "***REDACTED***";
    private static final String[] SENSITIVE_MARKERS = {"password", "secret", "token", "key"};

    private SensitiveDataSanitizer() {
    }

    public static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String marker : SENSITIVE_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    public static Object sanitize(Object data) {
        if (data instanceof Map) {
            Map<String, Object> sanitized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
                String key = String.valueOf(entry.getKey());
                sanitized.put(key, isSensitiveKey(key) ? REDACTED : sanitize(entry.getValue()));
            }
            return sanitized;
        }
        if (data instanceof List) {
            List<Object> sanitized = new ArrayList<>();
            for (Object item : (List<?>) data) {
                sanitized.add(sanitize(item));
            }
            return sanitized;
        }
        return data;
    }
}

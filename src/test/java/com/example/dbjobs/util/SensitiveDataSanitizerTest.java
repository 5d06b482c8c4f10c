package com.example.dbjobs.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SensitiveDataSanitizerTest {

    @Test
    @DisplayName("敏感字段名不区分大小写")
    void sensitiveKeys() {
        assertTrue(SensitiveDataSanitizer.isSensitiveKey("PGPASSWORD"));
        assertTrue(SensitiveDataSanitizer.isSensitiveKey("client_secret"));
        assertTrue(SensitiveDataSanitizer.isSensitiveKey("apiKey"));
        assertTrue(SensitiveDataSanitizer.isSensitiveKey("refresh_token"));
        assertFalse(SensitiveDataSanitizer.isSensitiveKey("username"));
        assertFalse(SensitiveDataSanitizer.isSensitiveKey(null));
    }

    @Test
    @DisplayName("嵌套 Map / List 递归脱敏，原对象不变")
    void nested() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("name", "api_token");
        inner.put("token", "abc");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user", "ops");
        data.put("password", "hunter2");
        data.put("parameters", List.of(inner, 5));

        Object sanitized = SensitiveDataSanitizer.sanitize(data);

        Map<String, Object> expectedInner = new LinkedHashMap<>();
        expectedInner.put("name", "api_token");
        expectedInner.put("token", SensitiveDataSanitizer.REDACTED);
        Map<String, Object> expected = new HashMap<>();
        expected.put("user", "ops");
        expected.put("password", SensitiveDataSanitizer.REDACTED);
        expected.put("parameters", List.of(expectedInner, 5));
        assertEquals(expected, sanitized);
        assertEquals("hunter2", data.get("password"));
    }

    @Test
    @DisplayName("标量原样返回")
    void scalars() {
        assertEquals("plain", SensitiveDataSanitizer.sanitize("plain"));
        assertNull(SensitiveDataSanitizer.sanitize(null));
    }
}

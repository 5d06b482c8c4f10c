package com.example.dbjobs.exception;

/**
 * 配置错误：不支持的数据库类型、非法 cron、缺少必填字段等
 * 直接返回给调用方，从不自动重试
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

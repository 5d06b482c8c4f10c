package com.example.dbjobs.util;

import com.example.dbjobs.enums.DatabaseType;
import com.example.dbjobs.exception.ConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 连接地址拼装/解析
 * 关系库统一转成 JDBC URL，MongoDB 保持 mongodb:// URI
 */
public final class ConnectionUrls {

    private ConnectionUrls() {
    }

    /**
     * 由完整连接串解析出的结果；用户名/密码为空表示连接串里没带
     */
    @Getter
    @AllArgsConstructor(access = AccessLevel.PACKAGE)
    public static final class Parsed {
        private final String url;
        private final String username;
        private final String password;
        private final String host;
        private final Integer port;
        private final String database;
    }

    public static String build(DatabaseType type, String host, Integer port, String database,
                               String username, String password) {
        int actualPort = port == null || port <= 0 ? type.getDefaultPort() : port;
        switch (type) {
            case POSTGRESQL:
                return "jdbc:postgresql://" + host + ":" + actualPort + "/" + StringUtils.defaultString(database);
            case MYSQL:
            case MARIADB:
                return "jdbc:mysql://" + host + ":" + actualPort + "/" + StringUtils.defaultString(database);
            case SQLITE:
                // SQLite 的 database 是文件路径
                return "jdbc:sqlite:" + StringUtils.defaultIfBlank(database, host);
            case MONGODB:
                StringBuilder sb = new StringBuilder("mongodb://");
                if (StringUtils.isNotEmpty(username)) {
                    sb.append(encode(username));
                    if (StringUtils.isNotEmpty(password)) {
                        sb.append(':').append(encode(password));
                    }
                    sb.append('@');
                }
                sb.append(host).append(':').append(actualPort).append('/').append(StringUtils.defaultString(database));
                return sb.toString();
            default:
                throw new ConfigurationException("Unsupported database type: " + type);
        }
    }

    /**
     * 解析用户保存的完整连接串
     * <ul>
     *     <li>jdbc: 开头原样使用</li>
     *     <li>postgresql:// / postgres:// / mysql:// 转成 JDBC URL，userinfo 拆成用户名密码</li>
     *     <li>mongodb:// / mongodb+srv:// 原样使用</li>
     * </ul>
     */
    public static Parsed parse(DatabaseType type, String connectionString) {
        String raw = connectionString.trim();
        if (raw.startsWith("jdbc:")) {
            return new Parsed(raw, null, null, null, null, null);
        }
        if (raw.startsWith("mongodb://") || raw.startsWith("mongodb+srv://")) {
            return new Parsed(raw, null, null, null, null, null);
        }
        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid connection string: " + e.getReason());
        }
        String scheme = StringUtils.defaultString(uri.getScheme()).toLowerCase();
        // 去掉 SQLAlchemy 风格的驱动后缀，如 postgresql+psycopg2
        int plus = scheme.indexOf('+');
        if (plus > 0) {
            scheme = scheme.substring(0, plus);
        }
        String jdbcScheme;
        switch (scheme) {
            case "postgresql":
            case "postgres":
                jdbcScheme = "postgresql";
                break;
            case "mysql":
            case "mariadb":
                jdbcScheme = "mysql";
                break;
            case "sqlite":
                return new Parsed("jdbc:sqlite:" + StringUtils.removeStart(raw.substring(raw.indexOf(':') + 1), "//"),
                        null, null, null, null, null);
            default:
                throw new ConfigurationException("Unsupported connection string scheme for " + type + ": " + uri.getScheme());
        }
        String username = null;
        String password = null;
        if (uri.getRawUserInfo() != null) {
            String[] parts = uri.getRawUserInfo().split(":", 2);
            username = decode(parts[0]);
            password = parts.length > 1 ? decode(parts[1]) : null;
        }
        Integer port = uri.getPort() > 0 ? uri.getPort() : null;
        String database = StringUtils.removeStart(uri.getPath(), "/");
        StringBuilder url = new StringBuilder("jdbc:").append(jdbcScheme).append("://").append(uri.getHost());
        if (port != null) {
            url.append(':').append(port);
        }
        url.append(StringUtils.defaultString(uri.getRawPath()));
        if (uri.getRawQuery() != null) {
            url.append('?').append(uri.getRawQuery());
        }
        return new Parsed(url.toString(), username, password, uri.getHost(), port, database);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}

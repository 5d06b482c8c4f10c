package com.example.dbjobs.dto;

import com.example.dbjobs.enums.DatabaseType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 解密后的连接信息，只在一次调用内存活，不落库、不打日志
 * url: 关系库为 JDBC URL，MongoDB 为 mongodb:// URI
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionTarget {
    private DatabaseType dbType;
    @ToString.Exclude
    private String url;
    private String host;
    private Integer port;
    private String database;
    private String username;
    @ToString.Exclude
    private String password;
    private int poolSize;
    private int timeoutSeconds;
    private boolean readOnly;
    private boolean sslEnabled;
    private String sslCertPath;
    private String sslKeyPath;
    private String sslCaPath;

    public boolean isDocumentStore() {
        return dbType != null && dbType.isDocumentStore();
    }
}

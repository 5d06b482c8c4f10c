package com.example.dbjobs.dto;

import com.example.dbjobs.enums.ConnectionMode;
import com.example.dbjobs.enums.DatabaseType;
import lombok.Data;
import lombok.ToString;

/**
 * 新建 / 修改连接档案的入参，password 与 connectionString 为明文，入库前加密
 */
@Data
public class ConnectionRequest {
    private String name;
    private String description;
    private DatabaseType dbType;
    private String host;
    private Integer port;
    private String databaseName;
    private String username;
    private String schemaName;
    @ToString.Exclude
    private String password;
    @ToString.Exclude
    private String connectionString;
    private Integer poolSize;
    private Integer maxConnections;
    private Integer timeoutSeconds;
    private ConnectionMode connectionMode;
    private Boolean sslEnabled;
    private String sslCertPath;
    private String sslKeyPath;
    private String sslCaPath;
    private Boolean active;
    private Boolean defaultProfile;
}

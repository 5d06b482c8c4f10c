package com.example.dbjobs.enums;

/**
 * 支持登记的数据库类型
 * ORACLE / SQLSERVER 可以登记，但暂无连接器
 */
public enum DatabaseType {
    POSTGRESQL(5432, false),
    MYSQL(3306, false),
    MARIADB(3306, false),
    SQLITE(0, false),
    MONGODB(27017, true),
    ORACLE(1521, false),
    SQLSERVER(1433, false);

    private final int defaultPort;
    private final boolean documentStore;

    DatabaseType(int defaultPort, boolean documentStore) {
        this.defaultPort = defaultPort;
        this.documentStore = documentStore;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    public boolean isDocumentStore() {
        return documentStore;
    }

    /**
     * MySQL 与 MariaDB 共用驱动和 mysqldump
     */
    public boolean isMysqlFamily() {
        return this == MYSQL || this == MARIADB;
    }
}

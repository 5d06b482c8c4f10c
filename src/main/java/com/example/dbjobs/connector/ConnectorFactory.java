package com.example.dbjobs.connector;

import com.example.dbjobs.dto.ConnectionTarget;
import com.example.dbjobs.exception.ConfigurationException;
import org.springframework.stereotype.Component;

/**
 * 按数据库类型创建连接器 (未连接状态)
 */
@Component
public class ConnectorFactory {

    public Connector create(ConnectionTarget target) {
        if (target.getDbType() == null) {
            throw new ConfigurationException("Database type is required");
        }
        switch (target.getDbType()) {
            case POSTGRESQL:
                return new PostgresConnector(target);
            case MYSQL:
            case MARIADB:
                return new MySqlConnector(target);
            case SQLITE:
                return new SqliteConnector(target);
            case MONGODB:
                return new MongoConnector(target);
            default:
                throw new ConfigurationException("Unsupported database type: " + target.getDbType());
        }
    }
}

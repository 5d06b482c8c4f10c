package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ConnectionTarget;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 执行器用的独立 JDBC 连接，不占用 ConnectionManager 缓存的连接池
 */
public interface ConnectionOpener {

    Connection open(ConnectionTarget target) throws SQLException;
}

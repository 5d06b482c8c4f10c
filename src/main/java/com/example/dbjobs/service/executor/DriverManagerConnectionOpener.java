package com.example.dbjobs.service.executor;

import com.example.dbjobs.dto.ConnectionTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

@Slf4j
@Component
public class DriverManagerConnectionOpener implements ConnectionOpener {

    @Override
    public Connection open(ConnectionTarget target) throws SQLException {
        Properties props = new Properties();
        if (target.getUsername() != null) {
            props.setProperty("user", target.getUsername());
        }
        if (target.getPassword() != null) {
            props.setProperty("password", target.getPassword());
        }
        if (target.getDbType() != null && target.getDbType().isMysqlFamily()) {
            // 脚本作业整段下发
            props.setProperty("allowMultiQueries", "true");
        }
        Connection conn = DriverManager.getConnection(target.getUrl(), props);
        if (target.isReadOnly()) {
            try {
                conn.setReadOnly(true);
            } catch (SQLException e) {
                log.warn("驱动不支持连接建立后设置只读 ({}): {}", target.getDbType(), e.getMessage());
            }
        }
        return conn;
    }
}

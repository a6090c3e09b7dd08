package io.sqlbench.eval.commons;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class HikariConnectionPool implements ConnectionPool {
    private static final Logger logger = LoggerFactory.getLogger(HikariConnectionPool.class);

    private final DatabaseConfig config;
    private final Map<String, HikariDataSource> dataSources = new ConcurrentHashMap<>();

    public HikariConnectionPool(DatabaseConfig config) {
        this.config = config;
    }

    @Override
    public Connection getConnection(String database) {
        var dataSource = dataSources.computeIfAbsent(database, this::createDataSource);
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new RuntimeSqlException("Error getting connection for " + database, e);
        }
    }

    @Override
    public void release(String database, Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Error returning connection for {}", database);
        }
    }

    @Override
    public void close(String database) {
        var dataSource = dataSources.remove(database);
        if (dataSource != null) {
            logger.info("Closing connection pool for database {}", database);
            dataSource.close();
        }
    }

    @Override
    public void close() {
        for (String database : new ArrayList<>(dataSources.keySet())) {
            close(database);
        }
    }

    protected HikariConfig hikariConfig(String database) {
        var hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.jdbcUrl(database));
        hikariConfig.setUsername(config.user());
        hikariConfig.setPassword(config.password());
        hikariConfig.setMinimumIdle(config.minConnections());
        hikariConfig.setMaximumPoolSize(config.maxConnections());
        // Every statement commits or rolls back explicitly
        hikariConfig.setAutoCommit(false);
        hikariConfig.setPoolName("sqlbench-" + database);
        return hikariConfig;
    }

    private HikariDataSource createDataSource(String database) {
        logger.info("Creating connection pool for database {} ({})", database, config);
        return new HikariDataSource(hikariConfig(database));
    }
}

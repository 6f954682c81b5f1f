package infra.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Plain DriverManager connections, auto-commit off.
 */
public class JdbcConnectionFactory {

    private final DbConfig config;

    public JdbcConnectionFactory(DbConfig config) {
        if (config == null) throw new IllegalArgumentException("config is null");
        this.config = config;
    }

    public Connection open() throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", config.getUser());
        props.setProperty("password", config.getPassword());
        props.setProperty("connectTimeout", String.valueOf(DbConfig.CONNECT_TIMEOUT_SECONDS));

        Connection conn = DriverManager.getConnection(config.jdbcUrl(), props);
        conn.setAutoCommit(false);
        return conn;
    }

    public DbConfig getConfig() {
        return config;
    }
}

package infra.db;

import domain.output.BalanceSession;
import domain.output.BalanceSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

public class JdbcBalanceSessionFactory implements BalanceSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(JdbcBalanceSessionFactory.class);

    private final JdbcConnectionFactory connections;
    private final String schema;

    public JdbcBalanceSessionFactory(JdbcConnectionFactory connections, String schema) {
        if (connections == null) throw new IllegalArgumentException("connections is null");
        this.connections = connections;
        this.schema = schema;
    }

    @Override
    public BalanceSession open() {
        try {
            log.debug("Connecting to {}", connections.getConfig());
            return new JdbcBalanceSession(connections.open(), schema);
        } catch (SQLException e) {
            throw new IllegalStateException("Database connection failed (" + connections.getConfig() + "): "
                    + e.getMessage(), e);
        }
    }
}

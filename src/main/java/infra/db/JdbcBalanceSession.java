package infra.db;

import domain.id.IdAllocator;
import domain.output.BalanceSession;
import domain.output.ScriptExecutionException;
import domain.process.ChangeScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One connection per input file. Allocations made while building the script are
 * rolled back with the rest of the file when execution fails or when the
 * session is closed without executing (script mode).
 */
public class JdbcBalanceSession implements BalanceSession {

    private static final Logger log = LoggerFactory.getLogger(JdbcBalanceSession.class);

    private final Connection connection;
    private final JdbcIdAllocator allocator;
    private final JdbcScriptExecutor executor;

    public JdbcBalanceSession(Connection connection, String schema) {
        this.connection = connection;
        this.allocator = new JdbcIdAllocator(connection, schema);
        this.executor = new JdbcScriptExecutor(connection);
    }

    @Override
    public IdAllocator idAllocator() {
        return allocator;
    }

    @Override
    public void execute(ChangeScript script) throws ScriptExecutionException {
        executor.execute(script);
    }

    @Override
    public void close() {
        try {
            if (connection.isClosed()) return;
        } catch (SQLException e) {
            log.warn("Connection state check failed: {}", e.getMessage());
        }
        try {
            // id sequence advances are not transactional; this only drops uncommitted work
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback on close failed: {}", e.getMessage());
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Closing connection failed: {}", e.getMessage());
            }
        }
    }
}

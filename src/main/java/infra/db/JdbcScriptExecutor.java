package infra.db;

import domain.emit.EmittedStatement;
import domain.output.ScriptExecutionException;
import domain.process.ChangeScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs a file's statements in order as one transaction.
 */
public class JdbcScriptExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcScriptExecutor.class);

    private final Connection connection;

    public JdbcScriptExecutor(Connection connection) {
        if (connection == null) throw new IllegalArgumentException("connection is null");
        this.connection = connection;
    }

    public void execute(ChangeScript script) throws ScriptExecutionException {
        List<EmittedStatement> statements = script.getStatements();
        int index = 0;
        try (Statement st = connection.createStatement()) {
            for (EmittedStatement s : statements) {
                index++;
                log.debug("{} [{}/{}] row {}", script.getSourceName(), index, statements.size(), s.getRowNumber());
                st.execute(s.getText());
            }
            connection.commit();
            log.info("{}: {} statement(s) committed", script.getSourceName(), statements.size());
        } catch (SQLException e) {
            rollback(script.getSourceName());
            throw new ScriptExecutionException(
                    "Statement " + index + " of " + statements.size() + " failed in "
                            + script.getSourceName() + ": " + e.getMessage(),
                    index, e);
        }
    }

    private void rollback(String source) {
        try {
            connection.rollback();
            log.warn("{}: transaction rolled back", source);
        } catch (SQLException re) {
            log.error("{}: rollback failed: {}", source, re.getMessage(), re);
        }
    }
}

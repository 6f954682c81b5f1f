package infra.db;

import domain.id.IdAllocationException;
import domain.id.IdAllocator;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Asks the database for one new object id per call.
 */
public class JdbcIdAllocator implements IdAllocator {

    static final String FN_GET_NEW_OBJ_IDS = "fn_get_new_obj_ids";

    private final Connection connection;
    private final String query;

    public JdbcIdAllocator(Connection connection, String schema) {
        if (connection == null) throw new IllegalArgumentException("connection is null");
        this.connection = connection;
        this.query = "SELECT " + schema + "." + FN_GET_NEW_OBJ_IDS + "(1)";
    }

    @Override
    public long allocateNewId() throws IdAllocationException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(query)) {
            if (!rs.next()) {
                throw new IdAllocationException("No id returned by " + query);
            }
            long id = rs.getLong(1);
            if (rs.wasNull()) {
                throw new IdAllocationException("NULL id returned by " + query);
            }
            return id;
        } catch (SQLException e) {
            throw new IdAllocationException("Id allocation failed: " + e.getMessage(), e);
        }
    }

    String getQuery() {
        return query;
    }
}

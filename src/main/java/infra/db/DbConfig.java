package infra.db;

/**
 * PostgreSQL connection settings.
 */
public final class DbConfig {

    public static final int DEFAULT_PORT = 5432;
    public static final int CONNECT_TIMEOUT_SECONDS = 10;

    private final String host;
    private final int port;
    private final String database;
    private final String user;
    private final String password;

    public DbConfig(String host, int port, String database, String user, String password) {
        if (database == null || database.isBlank()) throw new IllegalArgumentException("database is blank");
        if (user == null || user.isBlank()) throw new IllegalArgumentException("user is blank");
        this.host = host == null || host.isBlank() ? "localhost" : host.trim();
        this.port = port <= 0 ? DEFAULT_PORT : port;
        this.database = database.trim();
        this.user = user.trim();
        this.password = password == null ? "" : password;
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        // password intentionally left out
        return user + "@" + host + ":" + port + "/" + database;
    }
}

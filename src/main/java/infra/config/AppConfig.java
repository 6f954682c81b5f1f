package infra.config;

import domain.emit.BalanceApiSettings;
import infra.db.DbConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Layered settings lookup.
 *
 * <p>Per key, the first non-blank value wins:</p>
 * <ol>
 *   <li>CLI argument ({@code --DB_HOST=...})</li>
 *   <li>JVM system property ({@code -DDB_HOST=...})</li>
 *   <li>environment variable</li>
 *   <li>{@code .env} file ({@link Properties} format)</li>
 * </ol>
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String DB_HOST = "DB_HOST";
    public static final String DB_PORT = "DB_PORT";
    public static final String DB_NAME = "DB_NAME";
    public static final String DB_USER = "DB_USER";
    public static final String DB_PASSWORD = "DB_PASSWORD";
    public static final String BALANCE_API_SCHEMA = "BALANCE_API_SCHEMA";
    public static final String NEW_VALID_DATE = "NEW_VALID_DATE";
    public static final String ESCAPE_LITERALS = "ESCAPE_LITERALS";

    private static final String[] REQUIRED_DB_KEYS = {DB_NAME, DB_USER, DB_PASSWORD};

    private final Map<String, String> argv;
    private final Properties systemProperties;
    private final Map<String, String> env;
    private final Properties dotEnv;

    AppConfig(Map<String, String> argv, Properties systemProperties, Map<String, String> env, Properties dotEnv) {
        this.argv = argv == null ? Collections.emptyMap() : argv;
        this.systemProperties = systemProperties == null ? new Properties() : systemProperties;
        this.env = env == null ? Collections.emptyMap() : env;
        this.dotEnv = dotEnv == null ? new Properties() : dotEnv;
    }

    /**
     * @param dotEnvFile may be null or missing; then only the other layers apply
     */
    public static AppConfig load(Map<String, String> argv, Path dotEnvFile) {
        return new AppConfig(argv, System.getProperties(), System.getenv(), readDotEnv(dotEnvFile));
    }

    public static AppConfig of(Map<String, String> argv, Map<String, String> env, Properties dotEnv) {
        return new AppConfig(argv, new Properties(), env, dotEnv);
    }

    static Properties readDotEnv(Path file) {
        Properties p = new Properties();
        if (file == null || !Files.isRegularFile(file)) {
            if (file != null) log.debug(".env not found: {}", file.toAbsolutePath());
            return p;
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            p.load(r);
            log.info("Loaded {} key(s) from {}", p.size(), file.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read .env: " + file.toAbsolutePath(), e);
        }
        // tolerate KEY="value" as written for shell tools
        Properties unquoted = new Properties();
        for (String k : p.stringPropertyNames()) unquoted.setProperty(k, unquote(p.getProperty(k)));
        return unquoted;
    }

    private static String unquote(String v) {
        if (v == null) return null;
        String t = v.trim();
        if (t.length() >= 2
                && ((t.startsWith("\"") && t.endsWith("\"")) || (t.startsWith("'") && t.endsWith("'")))) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }

    public String get(String key) {
        String v = trimToNull(argv.get(key));
        if (v != null) return v;
        v = trimToNull(systemProperties.getProperty(key));
        if (v != null) return v;
        v = trimToNull(env.get(key));
        if (v != null) return v;
        return trimToNull(dotEnv.getProperty(key));
    }

    public String get(String key, String def) {
        String v = get(key);
        return v == null ? def : v;
    }

    public boolean getBoolean(String key, boolean def) {
        String v = get(key);
        if (v == null) return def;
        String t = v.toLowerCase(Locale.ROOT);
        return t.equals("true") || t.equals("1") || t.equals("y") || t.equals("yes");
    }

    public int getInt(String key, int def) {
        String v = get(key);
        if (v == null) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + v, e);
        }
    }

    /**
     * Names of required database keys with no value in any layer.
     */
    public List<String> missingDbKeys() {
        List<String> missing = new ArrayList<>();
        for (String k : REQUIRED_DB_KEYS) {
            if (get(k) == null) missing.add(k);
        }
        return missing;
    }

    /**
     * @throws IllegalStateException listing every missing key
     */
    public DbConfig dbConfig() {
        List<String> missing = missingDbKeys();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing database settings: " + String.join(", ", missing)
                    + " (set them in .env, the environment, or as --KEY=value)");
        }
        return new DbConfig(
                get(DB_HOST, "localhost"),
                getInt(DB_PORT, DbConfig.DEFAULT_PORT),
                get(DB_NAME),
                get(DB_USER),
                get(DB_PASSWORD));
    }

    public BalanceApiSettings balanceApiSettings(boolean escapeOverride) {
        return new BalanceApiSettings(
                get(BALANCE_API_SCHEMA, BalanceApiSettings.DEFAULT_SCHEMA),
                get(NEW_VALID_DATE, BalanceApiSettings.DEFAULT_NEW_VALID_DATE),
                BalanceApiSettings.DEFAULT_DATE_PATTERN,
                escapeOverride || getBoolean(ESCAPE_LITERALS, false));
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}

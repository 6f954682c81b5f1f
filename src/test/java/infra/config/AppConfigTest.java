package infra.config;

import domain.emit.BalanceApiSettings;
import infra.db.DbConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2) p.setProperty(kv[i], kv[i + 1]);
        return p;
    }

    @Test
    void cli_beats_environment_beats_dotenv() {
        AppConfig c = AppConfig.of(
                Map.of("DB_HOST", "cli-host"),
                Map.of("DB_HOST", "env-host", "DB_NAME", "env-db"),
                props("DB_HOST", "file-host", "DB_NAME", "file-db", "DB_USER", "file-user"));

        assertEquals("cli-host", c.get(AppConfig.DB_HOST));
        assertEquals("env-db", c.get(AppConfig.DB_NAME));
        assertEquals("file-user", c.get(AppConfig.DB_USER));
        assertNull(c.get(AppConfig.DB_PASSWORD));
    }

    @Test
    void system_property_sits_between_cli_and_environment() {
        AppConfig c = new AppConfig(Map.of(), props("DB_PORT", "6543"), Map.of("DB_PORT", "7000"), props());
        assertEquals(6543, c.getInt(AppConfig.DB_PORT, 0));
    }

    @Test
    void blank_values_fall_through() {
        AppConfig c = AppConfig.of(Map.of("DB_NAME", "  "), Map.of(), props("DB_NAME", "db"));
        assertEquals("db", c.get(AppConfig.DB_NAME));
    }

    @Test
    void missing_db_keys_are_all_listed() {
        AppConfig c = AppConfig.of(Map.of(), Map.of("DB_USER", "u"), props());

        assertEquals(List.of("DB_NAME", "DB_PASSWORD"), c.missingDbKeys());
        IllegalStateException e = assertThrows(IllegalStateException.class, c::dbConfig);
        assertTrue(e.getMessage().contains("DB_NAME, DB_PASSWORD"));
    }

    @Test
    void db_config_defaults_host_and_port() {
        AppConfig c = AppConfig.of(Map.of(), Map.of(), props("DB_NAME", "bal", "DB_USER", "u", "DB_PASSWORD", "p"));
        DbConfig db = c.dbConfig();

        assertEquals("jdbc:postgresql://localhost:5432/bal", db.jdbcUrl());
        assertFalse(db.toString().contains("p@"));
    }

    @Test
    void invalid_port_is_reported() {
        AppConfig c = AppConfig.of(Map.of("DB_PORT", "x"), Map.of(), props());
        assertThrows(IllegalStateException.class, () -> c.getInt(AppConfig.DB_PORT, 5432));
    }

    @Test
    void balance_api_settings_from_layers() {
        AppConfig c = AppConfig.of(Map.of(), Map.of("BALANCE_API_SCHEMA", "api_v2"), props("ESCAPE_LITERALS", "yes"));
        BalanceApiSettings s = c.balanceApiSettings(false);

        assertEquals("api_v2", s.getSchema());
        assertEquals(BalanceApiSettings.DEFAULT_NEW_VALID_DATE, s.getNewValidDate());
        assertTrue(s.isEscapeLiterals());
        assertTrue(AppConfig.of(Map.of(), Map.of(), props()).balanceApiSettings(true).isEscapeLiterals());
    }

    @Test
    void dotenv_file_is_read_and_quotes_stripped() throws Exception {
        Path env = tempDir.resolve(".env");
        Files.writeString(env, "# local db\nDB_HOST=db.local\nDB_PASSWORD=\"s3cret\"\n", StandardCharsets.UTF_8);

        Properties p = AppConfig.readDotEnv(env);

        assertEquals("db.local", p.getProperty("DB_HOST"));
        assertEquals("s3cret", p.getProperty("DB_PASSWORD"));
        assertTrue(AppConfig.readDotEnv(tempDir.resolve("missing.env")).isEmpty());
    }
}

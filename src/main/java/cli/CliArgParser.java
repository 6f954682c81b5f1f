package cli;

import app.RunMode;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noResult       => true</li>
     *   <li>--noResult=true  => true</li>
     *   <li>--noResult=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Parses {@code --mode}; blank means SCRIPT.
     * <ul>
     *   <li>script / sql / file / 1 -> SCRIPT</li>
     *   <li>execute / exec / db / 2 -> EXECUTE</li>
     * </ul>
     */
    public static RunMode parseMode(String raw) {
        if (raw == null || raw.isBlank()) return RunMode.SCRIPT;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);

        if (v.equals("script") || v.equals("sql") || v.equals("file") || v.equals("1")) {
            return RunMode.SCRIPT;
        }
        if (v.equals("execute") || v.equals("exec") || v.equals("db") || v.equals("2")) {
            return RunMode.EXECUTE;
        }
        throw new IllegalArgumentException("Unknown --mode: " + raw + " (expected script or execute)");
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}

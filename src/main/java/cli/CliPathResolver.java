package cli;

import infra.input.ChangeLogReaders;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** CLI path resolver (baseDir / input files / output paths). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "baseDir";

    public static void applyBaseDirPropertyIfPresent(Map<String, String> argv) {
        String bd = (argv == null) ? null : argv.get("baseDir");
        if (bd == null || bd.isBlank()) return;
        System.setProperty(PROP_BASE_DIR, bd.trim());
    }

    public static Path resolveBaseDir() {
        String bd = System.getProperty(PROP_BASE_DIR);
        if (bd != null && !bd.isBlank()) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }

    public static Path resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return null;
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute()) {
            if (baseDir != null) p = baseDir.resolve(p);
            else p = resolveAgainstUserDir(input.trim());
        }
        return p.toAbsolutePath().normalize();
    }

    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    public static void validateFileExists(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is null");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
    }

    /**
     * Expands {@code --in} into change-log files.
     * <ul>
     *   <li>comma-separated entries</li>
     *   <li>a file is taken as is</li>
     *   <li>a directory contributes its *.xlsx / *.csv (not recursive), sorted by name</li>
     * </ul>
     * Duplicates are dropped, first occurrence wins.
     */
    public static List<Path> resolveInputFiles(Path baseDir, String rawIn) {
        if (rawIn == null || rawIn.isBlank()) {
            throw new IllegalArgumentException("input (--in) is required");
        }
        Set<Path> out = new LinkedHashSet<>();
        for (String part : rawIn.split(",")) {
            Path p = resolvePath(baseDir, part);
            if (p == null) continue;
            validateFileExists(p, "input (--in)");

            if (Files.isDirectory(p)) {
                out.addAll(listChangeLogs(p));
            } else {
                out.add(p);
            }
        }
        return new ArrayList<>(out);
    }

    private static List<Path> listChangeLogs(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(ChangeLogReaders::isSupported)
                    .map(x -> x.toAbsolutePath().normalize())
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list input dir: " + dir, e);
        }
    }

    public static void mkdirs(Path p) {
        if (p == null) return;
        try {
            Files.createDirectories(p);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory: " + p, e);
        }
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}

package cli;

import java.nio.file.Path;
import java.nio.file.Paths;

/** Resolves --in / --out paths against {@code -Dsql.indent.baseDir} or the working directory. */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "sql.indent.baseDir";

    public static Path resolveBaseDir() {
        String bd = trimToNull(System.getProperty(PROP_BASE_DIR));
        if (bd == null) return null;
        return Paths.get(bd).toAbsolutePath().normalize();
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

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}

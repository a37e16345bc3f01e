package cli;

import domain.format.FormatStyle;

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
     *   <li>--lowercase       => true</li>
     *   <li>--lowercase=true  => true</li>
     *   <li>--lowercase=false => false</li>
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
     * Style name, case-insensitive and trimmed.
     * <p>
     * Default (null): basic
     *
     * @throws CliUsageException for an empty or unknown name
     */
    public static FormatStyle parseStyle(String raw) {
        if (raw == null) return FormatStyle.BASIC;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);
        FormatStyle style = FormatStyle.lookup(v);
        if (style == null) {
            throw new CliUsageException("invalid value '" + raw + "' for --style (expected one of: "
                    + styleNames() + ")");
        }
        return style;
    }

    public static String styleNames() {
        StringBuilder sb = new StringBuilder();
        for (FormatStyle s : FormatStyle.values()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(s.styleName());
        }
        return sb.toString();
    }

    /**
     * Value of a {@code --key=value} / {@code --key value} option that must not be empty.
     *
     * @return trimmed value, or {@code null} when the option is absent
     */
    public static String requireValue(Map<String, String> argv, String key) {
        if (argv == null || !argv.containsKey(key)) return null;
        String v = argv.get(key);
        if (v == null || v.isBlank()) throw new CliUsageException("missing value for --" + key);
        return v.trim();
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

package domain.format;

import domain.lex.SqlLexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formatting entry point.
 *
 * <p>Never fails on malformed, dialect-specific or templated SQL: unknown input is carried
 * through as tokens and laid out as well as the local context allows. Blank input formats
 * to an empty string. The result has no trailing whitespace and no trailing newline.</p>
 *
 * <p>Stateless; every call works on its own state, so concurrent use is safe.</p>
 */
public final class SqlFormatter {

    private static final Logger log = LoggerFactory.getLogger(SqlFormatter.class);

    private SqlFormatter() {
    }

    public static String format(String sql, FormatOptions options) {
        if (sql == null || sql.isBlank()) return "";
        FormatOptions opts = (options == null) ? FormatOptions.defaults() : options;
        return LayoutEngine.render(SqlLexer.tokenize(sql), opts);
    }

    /** Upper-case keywords, {@code basic} style. */
    public static String format(String sql) {
        return format(sql, FormatOptions.defaults());
    }

    /**
     * String-typed entry for bindings. An unknown style name falls back to {@code basic}.
     */
    public static String format(String sql, boolean uppercase, String styleName) {
        FormatStyle style = FormatStyle.lookup(styleName);
        if (style == null) {
            log.debug("Unknown style '{}', using {}", styleName, FormatStyle.BASIC.styleName());
            style = FormatStyle.BASIC;
        }
        return format(sql, FormatOptions.of(style, uppercase));
    }
}

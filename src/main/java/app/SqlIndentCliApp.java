package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliUsageException;
import cli.SqlIndentCli;
import domain.format.FormatOptions;
import domain.format.FormatStyle;
import domain.format.SqlFormatter;
import domain.output.SqlOutputWriter;
import domain.text.SqlTextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/** CLI entry (invoked by {@link SqlIndentCli}). */
public final class SqlIndentCliApp {

    private static final Logger log = LoggerFactory.getLogger(SqlIndentCliApp.class);

    public static final String PROP_STYLE = "sql.indent.style";
    public static final String PROP_UPPERCASE = "sql.indent.uppercase";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String VERSION_RESOURCE = "/sql-indent.properties";

    private SqlIndentCliApp() {}

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    /**
     * Runs one formatting pass.
     *
     * @return process exit status: 0 ok, 1 no input or I/O failure, 2 usage error
     */
    public static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        if (CliArgParser.flag(argv, "help")) {
            stdout.print(usage());
            return EXIT_OK;
        }
        if (CliArgParser.flag(argv, "version")) {
            stdout.println("sql-indent " + version());
            return EXIT_OK;
        }

        // ------------------------------------------------------------
        // options (flags first, then -D fallbacks, then style defaults)
        // ------------------------------------------------------------
        FormatOptions options;
        Path inFile;
        Path outFile;
        try {
            options = resolveOptions(argv);
            Path baseDir = CliPathResolver.resolveBaseDir();
            inFile = CliPathResolver.resolvePath(baseDir, CliArgParser.requireValue(argv, "in"));
            outFile = CliPathResolver.resolvePath(baseDir, CliArgParser.requireValue(argv, "out"));
        } catch (CliUsageException e) {
            stderr.println("[ERROR] " + e.getMessage());
            stderr.println("        run with --help for usage");
            return EXIT_USAGE;
        }

        SqlIndentComponentsFactory factory = new SqlIndentComponentsFactory();
        SqlTextProvider input = factory.createSqlTextProvider(inFile, stdin);
        SqlOutputWriter output = factory.createSqlOutputWriter(outFile, stdout);

        log.debug("[CONF] style={}, uppercase={}, in={}, out={}",
                options.getStyle().styleName(), options.isUppercase(), input.describe(), output.describe());

        try {
            String sql = input.read();
            if (sql.isBlank()) {
                stderr.println("[ERROR] no SQL input provided");
                return EXIT_FAILURE;
            }

            String formatted = SqlFormatter.format(sql, options);
            output.write(formatted);

            if (outFile != null) {
                log.info("Formatted SQL written to {} ({} chars, elapsed={}ms)", outFile, formatted.length(), ms(t0));
            } else {
                log.debug("Formatted {} chars, elapsed={}ms", sql.length(), ms(t0));
            }
            return EXIT_OK;
        } catch (IllegalStateException e) {
            log.debug("I/O failure", e);
            stderr.println("[ERROR] " + e.getMessage());
            if (e.getCause() != null) {
                stderr.println("        cause=" + e.getCause().getClass().getName() + ": " + safe(e.getCause().getMessage()));
            }
            return EXIT_FAILURE;
        }
    }

    static FormatOptions resolveOptions(Map<String, String> argv) {
        String styleRaw = argv.containsKey("style")
                ? argv.get("style")
                : System.getProperty(PROP_STYLE);
        FormatStyle style = CliArgParser.parseStyle(styleRaw);

        boolean upper = CliArgParser.flag(argv, "uppercase");
        boolean lower = CliArgParser.flag(argv, "lowercase");
        if (upper && lower) {
            throw new CliUsageException("--uppercase and --lowercase cannot be used together");
        }

        FormatOptions options = FormatOptions.forStyle(style);
        if (upper || lower) {
            return options.withUppercase(upper);
        }
        return options.withUppercase(
                CliArgParser.parseBoolean(System.getProperty(PROP_UPPERCASE), options.isUppercase()));
    }

    static String version() {
        Properties p = new Properties();
        try (InputStream in = SqlIndentCliApp.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in != null) p.load(in);
        } catch (Exception e) {
            log.warn("Cannot read {}: {}", VERSION_RESOURCE, e.toString());
        }
        String v = p.getProperty("version");
        return (v == null || v.isBlank() || v.startsWith("${")) ? "unknown" : v.trim();
    }

    static String usage() {
        return "Usage: sql-indent [options] < input.sql\n"
                + "\n"
                + "Options:\n"
                + "  --style=<" + CliArgParser.styleNames().replace(", ", "|") + ">  layout style (default: basic)\n"
                + "  --uppercase              upper-case keywords\n"
                + "  --lowercase              lower-case keywords (default for streamline)\n"
                + "  --in=<file>              read SQL from a file instead of stdin\n"
                + "  --out=<file>             write the result to a file instead of stdout\n"
                + "  --version                print the version and exit\n"
                + "  --help                   print this help and exit\n"
                + "\n"
                + "JVM options: -D" + PROP_STYLE + "=<style>, -D" + PROP_UPPERCASE + "=<true|false>, -D"
                + CliPathResolver.PROP_BASE_DIR + "=<dir>\n";
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}

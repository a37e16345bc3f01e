package cli;

import app.SqlIndentCliApp;

/**
 * CLI entrypoint facade (jar main class).
 *
 * <p>The logic lives in {@link SqlIndentCliApp} so it can be tested without a JVM exit.</p>
 */
public class SqlIndentCli {

    public static void main(String[] args) {
        SqlIndentCliApp.main(args);
    }
}

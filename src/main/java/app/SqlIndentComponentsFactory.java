package app;

import domain.output.SqlOutputWriter;
import domain.text.SqlTextProvider;
import infra.output.FileSqlOutputWriter;
import infra.output.StreamSqlOutputWriter;
import infra.text.FileSqlTextProvider;
import infra.text.StreamSqlTextProvider;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Object-assembly factory for {@link SqlIndentCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration and diagnostics; the choice between
 * console and file adapters is made here.
 */
final class SqlIndentComponentsFactory {

    SqlTextProvider createSqlTextProvider(Path inFile, InputStream stdin) {
        if (inFile == null) return new StreamSqlTextProvider(stdin);
        return new FileSqlTextProvider(inFile);
    }

    SqlOutputWriter createSqlOutputWriter(Path outFile, PrintStream stdout) {
        if (outFile == null) return new StreamSqlOutputWriter(stdout);
        return new FileSqlOutputWriter(outFile);
    }
}

package infra.output;

import domain.output.SqlOutputWriter;

import java.io.PrintStream;

/**
 * Writes to a console stream (normally stdout).
 */
public final class StreamSqlOutputWriter implements SqlOutputWriter {

    private final PrintStream out;

    public StreamSqlOutputWriter(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("out is null");
        this.out = out;
    }

    @Override
    public void write(String formattedSql) {
        out.print(SqlOutputWriter.withTrailingNewline(formattedSql));
        out.flush();
        if (out.checkError()) {
            throw new IllegalStateException("Failed to write formatted SQL to " + describe());
        }
    }

    @Override
    public String describe() {
        return "stdout";
    }
}

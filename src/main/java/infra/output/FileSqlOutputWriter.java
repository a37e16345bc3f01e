package infra.output;

import domain.output.SqlOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores the formatted SQL into one file (UTF-8),
 * creating missing parent directories. An existing file is replaced.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    private final Path file;

    public FileSqlOutputWriter(Path file) {
        if (file == null) throw new IllegalArgumentException("file is null");
        this.file = file;
    }

    @Override
    public void write(String formattedSql) {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to create output directory: " + parent, e);
            }
        }
        try {
            Files.writeString(file, SqlOutputWriter.withTrailingNewline(formattedSql), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write SQL file: " + file, e);
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }
}

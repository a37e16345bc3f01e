package infra.text;

import domain.text.SqlTextProvider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads one SQL file (UTF-8).
 */
public final class FileSqlTextProvider implements SqlTextProvider {

    private final Path file;

    public FileSqlTextProvider(Path file) {
        if (file == null) throw new IllegalArgumentException("file is null");
        this.file = file;
    }

    @Override
    public String read() {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("SQL input file not found: " + file);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL file: " + file, e);
        }
    }

    @Override
    public String describe() {
        return file.toString();
    }
}

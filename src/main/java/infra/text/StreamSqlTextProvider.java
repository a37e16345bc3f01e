package infra.text;

import domain.text.SqlTextProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads the whole stream (normally stdin) as UTF-8.
 */
public final class StreamSqlTextProvider implements SqlTextProvider {

    private final InputStream in;

    public StreamSqlTextProvider(InputStream in) {
        if (in == null) throw new IllegalArgumentException("in is null");
        this.in = in;
    }

    @Override
    public String read() {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL from " + describe(), e);
        }
    }

    @Override
    public String describe() {
        return "stdin";
    }
}

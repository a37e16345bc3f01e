package infra.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSqlOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_create_parent_directories_and_end_with_one_newline() throws Exception {
        Path target = tempDir.resolve("output").resolve("q").resolve("formatted.sql");
        FileSqlOutputWriter w = new FileSqlOutputWriter(target);

        w.write("SELECT\n    1");

        assertTrue(Files.exists(target), "expected file not found: " + target);
        assertEquals("SELECT\n    1\n", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    void should_replace_existing_file_and_collapse_trailing_newlines() throws Exception {
        Path target = tempDir.resolve("formatted.sql");
        Files.writeString(target, "old content that is longer");

        new FileSqlOutputWriter(target).write("SELECT 1\n\n\n");

        assertEquals("SELECT 1\n", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    void should_fail_with_path_in_message_when_parent_is_a_file() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");
        Path target = blocker.resolve("out.sql");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new FileSqlOutputWriter(target).write("SELECT 1"));
        assertTrue(e.getMessage().contains("blocker"), e.getMessage());
        assertNotNull(e.getCause());
    }

    @Test
    void stream_writer_prints_with_trailing_newline() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        new StreamSqlOutputWriter(new PrintStream(buf, true, StandardCharsets.UTF_8)).write("SELECT 名前");
        assertEquals("SELECT 名前\n", buf.toString(StandardCharsets.UTF_8));
    }
}

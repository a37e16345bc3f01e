package domain.output;

/** Destination of the formatted SQL. */
public interface SqlOutputWriter {

    /**
     * Writes the formatted text followed by exactly one newline.
     *
     * @throws IllegalStateException when the destination cannot be written
     */
    void write(String formattedSql);

    String describe();

    /** Drops trailing line breaks and adds a single {@code \n}. */
    static String withTrailingNewline(String text) {
        String s = (text == null) ? "" : text;
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) end--;
        return s.substring(0, end) + "\n";
    }
}

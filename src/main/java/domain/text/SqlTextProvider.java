package domain.text;

/**
 * Where the SQL to format comes from.
 *
 * <p>Implementations wrap I/O failures in {@link IllegalStateException}.</p>
 */
public interface SqlTextProvider {

    /** Whole input as text; never {@code null}. */
    String read();

    /** Short label for logs ("stdin", a file path). */
    String describe();
}

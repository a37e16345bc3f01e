package cli;

/**
 * Invalid command-line usage (unknown option value, conflicting flags).
 * The CLI reports it and exits with status 2.
 */
public class CliUsageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CliUsageException(String message) {
        super(message);
    }
}

package in.mechmate.application.port.output;

/**
 * Storage failure surfaced by a repository implementation.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}

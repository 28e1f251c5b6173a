package max.repertoire.tree;

/**
 * Structural failure of a repertoire operation. Never transient: the operation is aborted and not retried.
 */
public class RepertoireException extends RuntimeException {
    private final ErrorKind kind;

    public RepertoireException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RepertoireException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}

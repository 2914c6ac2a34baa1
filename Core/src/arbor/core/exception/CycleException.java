package arbor.core.exception;

/**
 * Thrown while a suite tree or a fixture dependency graph is being constructed to indicate that the requested edge
 * would introduce a cycle or reference the same node twice.
 *
 * A cycle is a fatal configuration error: it is raised before any test executes and never becomes a test outcome.
 */
public final class CycleException extends RuntimeException {

    public CycleException(String message) {
        super(message);
    }
}

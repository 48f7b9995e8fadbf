package ai.apigraph.graph;

/**
 * An internal consistency rule of the graph was broken. This signals a bug in
 * the analysis itself rather than bad input, and aborts the run.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}

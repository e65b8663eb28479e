package tree;

/**
 * Thrown when the construction engine observes a broken structural invariant, e.g. a negative
 * remainder or an edge whose start lies past its end. This is a bug in the engine, not a data
 * problem; the build is aborted and no tree is handed out.
 */
public class ConstructionInvariantViolation extends IllegalStateException {

    public ConstructionInvariantViolation(String message) {
        super(message);
    }
}

package decision.engine.claims;

public class AdjudicationException extends RuntimeException {
    public AdjudicationException(String message, Throwable cause) {
        super(message, cause);
    }
}

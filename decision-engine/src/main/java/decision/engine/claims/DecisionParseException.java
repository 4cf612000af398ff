package decision.engine.claims;

public class DecisionParseException extends Exception {
    public DecisionParseException(String message) {
        super(message);
    }

    public DecisionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package decision.engine.classify;

public record Classification(String label, double score) {
    public boolean hasLabel(String candidate) {
        return label != null && label.equalsIgnoreCase(candidate);
    }
}

package decision.engine.fraud;

public enum DetectionMethod {
    PATTERN("pattern_based", 0.2),
    MODEL("ml_based", 0.4),
    SENTIMENT("sentiment_based", 0.2),
    STATISTICAL("statistical", 0.2);

    private final String key;
    private final double weight;

    DetectionMethod(String key, double weight) {
        this.key = key;
        this.weight = weight;
    }

    public String key() {
        return key;
    }

    public double weight() {
        return weight;
    }
}

package decision.engine.risk;

public record DecisionThresholds(double autoApprove, double autoReject, double reviewMin, double reviewMax) {
    public static final DecisionThresholds DEFAULTS = new DecisionThresholds(30, 85, 70, 85);

    public DecisionThresholds {
        checkRange("autoApprove", autoApprove);
        checkRange("autoReject", autoReject);
        checkRange("reviewMin", reviewMin);
        checkRange("reviewMax", reviewMax);
        if (autoApprove > reviewMin || reviewMin > reviewMax) {
            throw new IllegalStateException(
                    "thresholds must satisfy autoApprove <= reviewMin <= reviewMax, got "
                            + autoApprove + " / " + reviewMin + " / " + reviewMax);
        }
    }

    public Ruling decide(double score) {
        if (score <= autoApprove) {
            return new Ruling(UnderwritingDecision.APPROVE, 0.95);
        }
        if (score >= autoReject) {
            return new Ruling(UnderwritingDecision.REJECT, 0.90);
        }
        if (score >= reviewMin && score <= reviewMax) {
            return new Ruling(UnderwritingDecision.MANUAL_REVIEW, 0.70);
        }
        if (score < reviewMin) {
            return new Ruling(UnderwritingDecision.APPROVE, 0.80);
        }
        return new Ruling(UnderwritingDecision.REJECT, 0.85);
    }

    private static void checkRange(String name, double value) {
        if (value < 0 || value > 100) {
            throw new IllegalStateException(name + " must be within [0, 100]: " + value);
        }
    }

    public record Ruling(UnderwritingDecision decision, double confidence) {}
}

package decision.engine.classify;

import java.util.List;
import java.util.Locale;

public class LexiconTextClassifier implements TextClassifier {
    private static final int SATURATION_HITS = 3;

    private final String positiveLabel;
    private final List<String> positiveTerms;
    private final String negativeLabel;
    private final List<String> negativeTerms;
    private final String neutralLabel;
    private final double neutralConfidence;

    public LexiconTextClassifier(
            String positiveLabel,
            List<String> positiveTerms,
            String negativeLabel,
            List<String> negativeTerms,
            String neutralLabel,
            double neutralConfidence
    ) {
        this.positiveLabel = positiveLabel;
        this.positiveTerms = List.copyOf(positiveTerms);
        this.negativeLabel = negativeLabel;
        this.negativeTerms = List.copyOf(negativeTerms);
        this.neutralLabel = neutralLabel;
        this.neutralConfidence = neutralConfidence;
    }

    public static LexiconTextClassifier fraud() {
        return new LexiconTextClassifier(
                "FRAUD",
                List.of("fake", "forged", "staged", "cash only", "no receipt", "lost receipt", "no witnesses",
                        "unavailable", "urgent", "immediately", "asap", "right now", "need money",
                        "destroyed all", "can't remember", "cannot remember", "friend of mine"),
                "LEGITIMATE",
                List.of("police report", "report number", "officer", "invoice", "receipt no", "estimate from",
                        "hospital", "physician", "witness", "photographs", "certificate", "claim number"),
                "LEGITIMATE",
                0.8
        );
    }

    public static LexiconTextClassifier sentiment() {
        return new LexiconTextClassifier(
                "POSITIVE",
                List.of("great", "excellent", "happy", "wonderful", "perfect", "amazing", "thank", "love",
                        "fantastic", "pleased"),
                "NEGATIVE",
                List.of("terrible", "awful", "horrible", "devastated", "furious", "disaster", "worst", "angry",
                        "ruined", "destroyed", "desperate", "nightmare"),
                "NEUTRAL",
                0.5
        );
    }

    public static LexiconTextClassifier financial() {
        return new LexiconTextClassifier(
                "positive",
                List.of("excellent", "on time", "stable", "good standing", "no claims", "0 claims"),
                "negative",
                List.of("late", "default", "missed", "bankrupt", "delinquent", "collections", "poor"),
                "neutral",
                0.6
        );
    }

    public static LexiconTextClassifier clauses() {
        return new LexiconTextClassifier(
                "EXCLUSION",
                List.of("exclude", "excluded", "exclusion", "not covered", "does not cover", "except"),
                "COVERAGE",
                List.of("covered", "coverage", "benefit", "insured against", "we will pay"),
                "GENERAL",
                0.5
        );
    }

    @Override
    public Classification classify(String text) {
        if (text == null) {
            throw new ClassificationException("text must not be null");
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int positive = countHits(lower, positiveTerms);
        int negative = countHits(lower, negativeTerms);
        int total = positive + negative;
        if (total == 0 || positive == negative) {
            return new Classification(neutralLabel, neutralConfidence);
        }
        double margin = (double) Math.abs(positive - negative) / total;
        double saturation = Math.min(1.0, (double) total / SATURATION_HITS);
        double confidence = 0.5 + 0.5 * margin * saturation;
        return new Classification(positive > negative ? positiveLabel : negativeLabel, confidence);
    }

    private static int countHits(String lower, List<String> terms) {
        int hits = 0;
        for (String term : terms) {
            if (lower.contains(term)) {
                hits++;
            }
        }
        return hits;
    }
}

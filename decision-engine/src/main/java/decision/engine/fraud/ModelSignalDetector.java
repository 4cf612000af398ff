package decision.engine.fraud;

import decision.engine.classify.Classification;
import decision.engine.classify.TextClassifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class ModelSignalDetector implements FraudSignalDetector {
    private static final int MAX_INPUT_CHARS = 512;
    private static final Set<String> FRAUD_LABELS = Set.of("LABEL_1", "POSITIVE", "FRAUD");

    private final TextClassifier classifier;

    public ModelSignalDetector(@Qualifier("fraudClassifier") TextClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.MODEL;
    }

    @Override
    public DetectionResult detect(String text, Map<String, Object> metadata) {
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        Classification result = classifier.classify(input);
        String label = result.label() == null ? "" : result.label().toUpperCase(Locale.ROOT);

        if (FRAUD_LABELS.contains(label)) {
            double score = result.score();
            return new DetectionResult(score, List.of(
                    String.format(Locale.ROOT, "ML detected fraud signals (confidence: %.2f)", score)));
        }
        return new DetectionResult(1 - result.score(), List.of());
    }
}

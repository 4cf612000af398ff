package decision.engine.fraud;

import decision.engine.classify.Classification;
import decision.engine.classify.TextClassifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class SentimentSignalDetector implements FraudSignalDetector {
    private static final int MAX_INPUT_CHARS = 512;
    private static final double EXTREME_CONFIDENCE = 0.95;
    private static final double NEGATIVE_PENALTY = 0.3;
    private static final double POSITIVE_PENALTY = 0.2;

    private final TextClassifier classifier;

    public SentimentSignalDetector(@Qualifier("sentimentClassifier") TextClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SENTIMENT;
    }

    @Override
    public DetectionResult detect(String text, Map<String, Object> metadata) {
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        Classification sentiment = classifier.classify(input);

        if (sentiment.hasLabel("NEGATIVE") && sentiment.score() > EXTREME_CONFIDENCE) {
            return new DetectionResult(NEGATIVE_PENALTY,
                    List.of("Extremely negative sentiment (possible manipulation)"));
        }
        if (sentiment.hasLabel("POSITIVE") && sentiment.score() > EXTREME_CONFIDENCE) {
            return new DetectionResult(POSITIVE_PENALTY, List.of("Unusually positive sentiment"));
        }
        return DetectionResult.clean();
    }
}

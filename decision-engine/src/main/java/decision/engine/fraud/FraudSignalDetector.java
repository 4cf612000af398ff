package decision.engine.fraud;

import java.util.Map;

public interface FraudSignalDetector {
    DetectionMethod method();

    DetectionResult detect(String text, Map<String, Object> metadata);
}

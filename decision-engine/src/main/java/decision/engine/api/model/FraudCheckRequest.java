package decision.engine.api.model;

import java.util.Map;

public record FraudCheckRequest(
        String text,
        Map<String, Object> metadata
) {
    public Map<String, Object> safeMetadata() {
        return metadata == null ? Map.of() : metadata;
    }
}

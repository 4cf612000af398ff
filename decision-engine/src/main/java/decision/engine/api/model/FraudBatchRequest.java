package decision.engine.api.model;

import java.util.List;

public record FraudBatchRequest(List<FraudCheckRequest> items) {
    public List<FraudCheckRequest> safeItems() {
        return items == null ? List.of() : items;
    }
}

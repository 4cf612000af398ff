package decision.engine.api.model;

public record DecisionResponse<T>(
        String requestId,
        T result,
        long processingMs
) {}

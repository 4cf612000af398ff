package decision.engine.api.model;

public record PolicyIndexRequest(
        String text,
        String source
) {}

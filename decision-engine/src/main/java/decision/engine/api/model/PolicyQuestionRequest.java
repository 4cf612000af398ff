package decision.engine.api.model;

public record PolicyQuestionRequest(
        String question
) {}

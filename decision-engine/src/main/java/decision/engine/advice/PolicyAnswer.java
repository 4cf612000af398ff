package decision.engine.advice;

public record PolicyAnswer(
        String answer,
        boolean contextAvailable
) {}

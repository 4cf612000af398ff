package decision.engine.advice;

import decision.engine.llm.GenerationService;
import decision.engine.retrieval.ContextRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class PolicyAdvisor {
    private static final Logger log = LoggerFactory.getLogger(PolicyAdvisor.class);

    static final double TEMPERATURE = 0.7;
    static final int MAX_TOKENS = 2000;
    static final String NO_CONTEXT = "No policy documents are available. Answer from general insurance knowledge "
            + "and say that the customer should confirm the details in their own policy.";
    static final String NO_ANSWER = "We could not answer this question right now. Please contact your policy advisor.";

    private static final String TEMPLATE = """
            You are a helpful insurance advisor.

            POLICY CONTEXT:
            %s

            CUSTOMER QUESTION:
            %s

            Provide a clear, accurate answer with policy clause references where applicable.""";

    private final ContextRetriever contextRetriever;
    private final GenerationService generationService;
    private final int contextK;

    public PolicyAdvisor(
            ContextRetriever contextRetriever,
            GenerationService generationService,
            @Value("${decision.engine.advice.context-k:5}") int contextK
    ) {
        this.contextRetriever = contextRetriever;
        this.generationService = generationService;
        this.contextK = Math.max(1, contextK);
    }

    public PolicyAnswer answer(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be empty");
        }
        String context = retrieveContext(question.strip());
        String raw = generationService.generate(prompt(context, question.strip()), TEMPERATURE, MAX_TOKENS);
        String answer = raw.isBlank() ? NO_ANSWER : raw.strip();
        return new PolicyAnswer(answer, !context.isBlank());
    }

    static String prompt(String context, String question) {
        return String.format(TEMPLATE, context.isBlank() ? NO_CONTEXT : context, question);
    }

    private String retrieveContext(String question) {
        try {
            return contextRetriever.retrieve(question, contextK);
        } catch (RuntimeException e) {
            log.warn("event=advice_context_unavailable error={}", e.getMessage());
            return "";
        }
    }
}

package decision.engine.llm;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "decision.engine.llm", name = "provider", havingValue = "none", matchIfMissing = true)
public class NoopLlmClient implements LlmClient {
    @Override
    public String generate(String prompt, double temperature, int maxTokens) {
        return "";
    }
}

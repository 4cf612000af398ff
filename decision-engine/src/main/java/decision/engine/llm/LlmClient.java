package decision.engine.llm;

public interface LlmClient {
    String generate(String prompt, double temperature, int maxTokens);
}

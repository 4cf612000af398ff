package decision.engine.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Component
@Primary
@ConditionalOnProperty(prefix = "decision.engine.llm", name = "provider", havingValue = "openai")
public class OpenAiLlmClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);
    private static final String SYSTEM_PROMPT =
            "You are a careful insurance decision assistant. Follow the output format you are given exactly.";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String apiKey;
    private final String endpoint;
    private final String model;
    private final long httpTimeoutMs;

    public OpenAiLlmClient(
            ObjectMapper objectMapper,
            @Value("${decision.engine.llm.openai.api-key:}") String apiKey,
            @Value("${decision.engine.llm.openai.endpoint:https://api.openai.com/v1/chat/completions}") String endpoint,
            @Value("${decision.engine.llm.openai.model:gpt-4o}") String model,
            @Value("${decision.engine.llm.openai.http-timeout-ms:30000}") long httpTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.endpoint = endpoint;
        this.model = model;
        this.httpTimeoutMs = httpTimeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                .build();
    }

    @Override
    public String generate(String prompt, double temperature, int maxTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new GenerationException("openai api key is not configured");
        }

        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildPayload(prompt, temperature, maxTokens)))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new GenerationException("generation returned status " + response.statusCode());
            }

            JsonNode root = objectMapper.readTree(response.body());
            JsonNode usage = root.path("usage").path("total_tokens");
            if (!usage.isMissingNode()) {
                log.debug("event=llm_usage model={} total_tokens={}", model, usage.asInt());
            }
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new GenerationException("generation response carried no content");
            }
            return content.asText().trim();
        } catch (IOException e) {
            throw new GenerationException("generation call failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("generation call interrupted", e);
        }
    }

    private String buildPayload(String prompt, double temperature, int maxTokens) throws IOException {
        ArrayNode messages = objectMapper.createArrayNode()
                .add(objectMapper.createObjectNode()
                        .put("role", "system")
                        .put("content", SYSTEM_PROMPT))
                .add(objectMapper.createObjectNode()
                        .put("role", "user")
                        .put("content", prompt));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);
        body.set("messages", messages);
        return objectMapper.writeValueAsString(body);
    }
}

package decision.engine.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "decision.engine.llm", name = "provider", havingValue = "openai")
public class OpenAiEmbeddingClient implements EmbeddingClient {
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String apiKey;
    private final String endpoint;
    private final String model;
    private final long httpTimeoutMs;

    public OpenAiEmbeddingClient(
            ObjectMapper objectMapper,
            @Value("${decision.engine.llm.openai.api-key:}") String apiKey,
            @Value("${decision.engine.llm.openai.embedding-endpoint:https://api.openai.com/v1/embeddings}") String endpoint,
            @Value("${decision.engine.llm.openai.embedding-model:text-embedding-3-large}") String model,
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
    public List<float[]> embed(List<String> texts) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new EmbeddingException("openai api key is not configured");
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        try {
            ArrayNode input = objectMapper.createArrayNode();
            texts.forEach(input::add);
            ObjectNode body = objectMapper.createObjectNode();
            body.put("model", model);
            body.set("input", input);

            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new EmbeddingException("embedding returned status " + response.statusCode());
            }

            JsonNode data = objectMapper.readTree(response.body()).path("data");
            if (data.size() != texts.size()) {
                throw new EmbeddingException("expected " + texts.size() + " embeddings, got " + data.size());
            }
            List<float[]> vectors = new ArrayList<>(data.size());
            for (JsonNode item : data) {
                JsonNode values = item.path("embedding");
                float[] vector = new float[values.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = (float) values.get(i).asDouble();
                }
                vectors.add(vector);
            }
            return vectors;
        } catch (IOException e) {
            throw new EmbeddingException("embedding call failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("embedding call interrupted", e);
        }
    }
}

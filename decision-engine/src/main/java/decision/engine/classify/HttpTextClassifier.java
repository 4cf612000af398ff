package decision.engine.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class HttpTextClassifier implements TextClassifier {
    private static final int MAX_INPUT_CHARS = 512;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String endpoint;
    private final String apiKey;
    private final long httpTimeoutMs;

    public HttpTextClassifier(ObjectMapper objectMapper, String endpoint, String apiKey, long httpTimeoutMs) {
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.httpTimeoutMs = httpTimeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                .build();
    }

    @Override
    public Classification classify(String text) {
        if (text == null) {
            throw new ClassificationException("text must not be null");
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        try {
            String payload = objectMapper.writeValueAsString(objectMapper.createObjectNode().put("inputs", input));
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new ClassificationException("classifier returned status " + response.statusCode());
            }
            return best(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            throw new ClassificationException("classifier call failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassificationException("classifier call interrupted", e);
        }
    }

    private static Classification best(JsonNode root) {
        JsonNode candidates = root.path(0).isArray() ? root.path(0) : root;
        Classification best = null;
        for (JsonNode candidate : candidates) {
            String label = candidate.path("label").asText("");
            double score = candidate.path("score").asDouble(0.0);
            if (!label.isEmpty() && (best == null || score > best.score())) {
                best = new Classification(label, score);
            }
        }
        if (best == null) {
            throw new ClassificationException("classifier response carried no labels");
        }
        return best;
    }
}

package decision.engine.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiLlmClientTest {
    @Test
    void shouldFailWhenApiKeyMissing() {
        OpenAiLlmClient client = new OpenAiLlmClient(
                new ObjectMapper(),
                "",
                "http://127.0.0.1:65535/v1/chat/completions",
                "gpt-4o-mini",
                300
        );

        assertThrows(GenerationException.class, () -> client.generate("prompt", 0.1, 100));
    }

    @Test
    void shouldReturnContentOnSuccess() throws Exception {
        AtomicReference<String> requestBody = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = """
                    {"choices":[{"message":{"content":"  {\\"verdict\\": \\"APPROVED\\"}  "}}],"usage":{"total_tokens":42}}
                    """.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        try {
            OpenAiLlmClient client = client(server);

            String text = client.generate("Assess this claim", 0.1, 2000);

            assertEquals("{\"verdict\": \"APPROVED\"}", text);
            assertTrue(requestBody.get().contains("\"model\":\"gpt-4o-mini\""));
            assertTrue(requestBody.get().contains("\"max_tokens\":2000"));
            assertTrue(requestBody.get().contains("Assess this claim"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void shouldFailOnServerError() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.start();
        try {
            OpenAiLlmClient client = client(server);

            GenerationException error = assertThrows(GenerationException.class, () -> client.generate("prompt", 0.1, 100));
            assertTrue(error.getMessage().contains("500"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void shouldFailWhenResponseHasNoContent() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            byte[] body = "{\"choices\":[]}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        try {
            OpenAiLlmClient client = client(server);

            assertThrows(GenerationException.class, () -> client.generate("prompt", 0.1, 100));
        } finally {
            server.stop(0);
        }
    }

    private static OpenAiLlmClient client(HttpServer server) {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions";
        return new OpenAiLlmClient(new ObjectMapper(), "dummy-key", endpoint, "gpt-4o-mini", 2000);
    }
}

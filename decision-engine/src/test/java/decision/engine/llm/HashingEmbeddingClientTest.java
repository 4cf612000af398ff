package decision.engine.llm;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashingEmbeddingClientTest {
    private final HashingEmbeddingClient client = new HashingEmbeddingClient();

    @Test
    void shouldProduceUnitVectorsOfFixedSize() {
        List<float[]> vectors = client.embed(List.of("Flood damage is excluded", ""));

        assertEquals(2, vectors.size());
        assertEquals(HashingEmbeddingClient.DIMENSIONS, vectors.get(0).length);
        double norm = 0;
        for (float v : vectors.get(0)) {
            norm += v * v;
        }
        assertEquals(1.0, norm, 1e-5);
        for (float v : vectors.get(1)) {
            assertEquals(0.0f, v);
        }
    }

    @Test
    void shouldIgnoreCaseAndPunctuation() {
        List<float[]> vectors = client.embed(List.of("Flood, DAMAGE!", "flood damage"));

        assertArrayEquals(vectors.get(0), vectors.get(1));
    }
}

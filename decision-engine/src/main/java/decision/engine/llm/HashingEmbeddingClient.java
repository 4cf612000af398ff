package decision.engine.llm;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
@ConditionalOnProperty(prefix = "decision.engine.llm", name = "provider", havingValue = "none", matchIfMissing = true)
public class HashingEmbeddingClient implements EmbeddingClient {
    static final int DIMENSIONS = 256;

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text == null ? "" : text));
        }
        return vectors;
    }

    private static float[] embedOne(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() < 2) {
                continue;
            }
            vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1.0f;
        }
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }
}

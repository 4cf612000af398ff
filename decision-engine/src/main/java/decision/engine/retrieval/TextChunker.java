package decision.engine.retrieval;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
public class TextChunker {
    public static final int DEFAULT_MAX_TOKENS = 500;

    public List<String> chunk(String text, int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] words = text.trim().split("\\s+");
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < words.length; start += maxTokens) {
            int end = Math.min(words.length, start + maxTokens);
            chunks.add(String.join(" ", Arrays.copyOfRange(words, start, end)));
        }
        return chunks;
    }
}

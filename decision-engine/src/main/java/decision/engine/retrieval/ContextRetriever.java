package decision.engine.retrieval;

import decision.engine.llm.EmbeddingClient;
import decision.engine.llm.EmbeddingException;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ContextRetriever {
    private final EmbeddingClient embeddingClient;
    private final VectorStore vectorStore;

    public ContextRetriever(EmbeddingClient embeddingClient, VectorStore vectorStore) {
        this.embeddingClient = embeddingClient;
        this.vectorStore = vectorStore;
    }

    public String retrieve(String query, int k) {
        if (query == null || query.isBlank() || vectorStore.size() == 0) {
            return "";
        }
        List<float[]> vectors = embeddingClient.embed(List.of(query));
        if (vectors.isEmpty()) {
            throw new EmbeddingException("no embedding returned for query");
        }
        return String.join("\n\n", vectorStore.retrieve(vectors.get(0), k));
    }
}

package decision.engine.llm;

import java.util.List;

public interface EmbeddingClient {
    List<float[]> embed(List<String> texts);
}

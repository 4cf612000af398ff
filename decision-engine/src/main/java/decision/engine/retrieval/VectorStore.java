package decision.engine.retrieval;

import java.util.List;
import java.util.Map;

public interface VectorStore {
    List<String> retrieve(float[] vector, int k);

    void add(List<String> texts, List<float[]> vectors, List<Map<String, String>> metadata);

    int size();
}

package decision.engine.retrieval;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryVectorStore implements VectorStore {
    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    @Override
    public List<String> retrieve(float[] vector, int k) {
        if (k <= 0 || vector == null) {
            return List.of();
        }
        List<Scored> scored = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.vector().length == vector.length) {
                scored.add(new Scored(entry.text(), cosine(vector, entry.vector())));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::similarity).reversed());
        return scored.stream().limit(k).map(Scored::text).toList();
    }

    @Override
    public void add(List<String> texts, List<float[]> vectors, List<Map<String, String>> metadata) {
        if (texts.size() != vectors.size()) {
            throw new IllegalArgumentException("texts and vectors must have the same size");
        }
        List<Entry> batch = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            Map<String, String> meta = metadata != null && i < metadata.size() && metadata.get(i) != null
                    ? Map.copyOf(metadata.get(i))
                    : Map.of();
            batch.add(new Entry(texts.get(i), vectors.get(i).clone(), meta));
        }
        entries.addAll(batch);
    }

    @Override
    public int size() {
        return entries.size();
    }

    private static double cosine(float[] a, float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record Entry(String text, float[] vector, Map<String, String> metadata) {}

    private record Scored(String text, double similarity) {}
}

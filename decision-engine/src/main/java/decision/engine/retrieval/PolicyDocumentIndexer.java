package decision.engine.retrieval;

import decision.engine.classify.ClassificationException;
import decision.engine.classify.TextClassifier;
import decision.engine.fraud.FraudAssessment;
import decision.engine.fraud.FraudEnsemble;
import decision.engine.llm.EmbeddingClient;
import decision.engine.llm.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class PolicyDocumentIndexer {
    private static final Logger log = LoggerFactory.getLogger(PolicyDocumentIndexer.class);

    static final int MIN_TEXT_LENGTH = 50;
    static final String DEFAULT_LABEL = "GENERAL";

    private final FraudEnsemble fraudEnsemble;
    private final TextChunker chunker;
    private final TextClassifier clauseClassifier;
    private final EmbeddingClient embeddingClient;
    private final VectorStore vectorStore;

    public PolicyDocumentIndexer(
            FraudEnsemble fraudEnsemble,
            TextChunker chunker,
            @Qualifier("clauseClassifier") TextClassifier clauseClassifier,
            EmbeddingClient embeddingClient,
            VectorStore vectorStore
    ) {
        this.fraudEnsemble = fraudEnsemble;
        this.chunker = chunker;
        this.clauseClassifier = clauseClassifier;
        this.embeddingClient = embeddingClient;
        this.vectorStore = vectorStore;
    }

    public IndexingResult index(String text, String source) {
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
            throw new IllegalArgumentException("policy text must contain at least " + MIN_TEXT_LENGTH + " characters");
        }
        String name = source == null || source.isBlank() ? "unnamed" : source.trim();

        FraudAssessment screen = fraudEnsemble.assess(text);
        if (screen.suspicious()) {
            log.warn("event=policy_flagged source={} fraud_score={}", name, screen.fraudScore());
            return new IndexingResult(name, false, true, 0, Map.of(), screen);
        }

        List<String> chunks = chunker.chunk(text, TextChunker.DEFAULT_MAX_TOKENS);
        List<Map<String, String>> metadata = new ArrayList<>(chunks.size());
        Map<String, Integer> labels = new TreeMap<>();
        for (String chunk : chunks) {
            String label = label(chunk);
            labels.merge(label, 1, Integer::sum);
            metadata.add(Map.of("label", label, "source", name));
        }

        List<float[]> vectors = embeddingClient.embed(chunks);
        vectorStore.add(chunks, vectors, metadata);
        log.info("event=policy_indexed source={} chunks={} store_size={}", name, chunks.size(), vectorStore.size());
        return new IndexingResult(name, true, false, chunks.size(), labels, null);
    }

    private String label(String chunk) {
        try {
            return clauseClassifier.classify(chunk).label();
        } catch (ClassificationException e) {
            log.warn("event=chunk_label_failed error={}", e.getMessage());
            return DEFAULT_LABEL;
        }
    }
}

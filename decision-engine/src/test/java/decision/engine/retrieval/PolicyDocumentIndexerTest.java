package decision.engine.retrieval;

import decision.engine.classify.ClassificationException;
import decision.engine.classify.LexiconTextClassifier;
import decision.engine.fraud.TestEnsembles;
import decision.engine.llm.HashingEmbeddingClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PolicyDocumentIndexerTest {
    private static final String POLICY = "Section 4. Flood damage is excluded from this policy. "
            + "Section 5. Fire damage to the dwelling is covered up to the stated limit.";

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final InMemoryVectorStore store = new InMemoryVectorStore();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldChunkLabelAndStoreCleanDocument() {
        PolicyDocumentIndexer indexer = new PolicyDocumentIndexer(
                TestEnsembles.uniform(0.1, executor), new TextChunker(), LexiconTextClassifier.clauses(),
                new HashingEmbeddingClient(), store);

        IndexingResult result = indexer.index(POLICY, " home-policy.pdf ");

        assertTrue(result.indexed());
        assertFalse(result.flagged());
        assertEquals("home-policy.pdf", result.source());
        assertEquals(1, result.chunks());
        assertEquals(Map.of("EXCLUSION", 1), result.labels());
        assertNull(result.fraudDetails());
        assertEquals(1, store.size());
    }

    @Test
    void shouldFlagSuspiciousDocumentWithoutIndexing() {
        PolicyDocumentIndexer indexer = new PolicyDocumentIndexer(
                TestEnsembles.uniform(0.9, executor), new TextChunker(), LexiconTextClassifier.clauses(),
                new HashingEmbeddingClient(), store);

        IndexingResult result = indexer.index(POLICY, null);

        assertFalse(result.indexed());
        assertTrue(result.flagged());
        assertEquals("unnamed", result.source());
        assertNotNull(result.fraudDetails());
        assertEquals(0, store.size());
    }

    @Test
    void shouldLabelGeneralWhenClassifierFails() {
        PolicyDocumentIndexer indexer = new PolicyDocumentIndexer(
                TestEnsembles.uniform(0.1, executor), new TextChunker(), text -> {
                    throw new ClassificationException("endpoint down");
                },
                new HashingEmbeddingClient(), store);

        IndexingResult result = indexer.index(POLICY, "policy");

        assertEquals(Map.of("GENERAL", 1), result.labels());
        assertEquals(1, store.size());
    }

    @Test
    void shouldRejectShortText() {
        PolicyDocumentIndexer indexer = new PolicyDocumentIndexer(
                TestEnsembles.uniform(0.1, executor), new TextChunker(), LexiconTextClassifier.clauses(),
                new HashingEmbeddingClient(), store);

        assertThrows(IllegalArgumentException.class, () -> indexer.index("   too short   ", "policy"));
    }
}

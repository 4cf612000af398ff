package decision.engine.retrieval;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorStoreTest {
    private final InMemoryVectorStore store = new InMemoryVectorStore();

    @Test
    void shouldReturnNearestTextsFirst() {
        store.add(
                List.of("exclusions", "coverage", "claims"),
                List.of(new float[]{1, 0, 0}, new float[]{0, 1, 0}, new float[]{0.7f, 0.7f, 0}),
                List.of(Map.of("label", "EXCLUSION"), Map.of("label", "COVERAGE"), Map.of()));

        assertEquals(List.of("exclusions", "claims"), store.retrieve(new float[]{1, 0.1f, 0}, 2));
        assertEquals(3, store.size());
    }

    @Test
    void shouldReturnEmptyForNonPositiveK() {
        store.add(List.of("a"), List.of(new float[]{1, 0}), null);

        assertTrue(store.retrieve(new float[]{1, 0}, 0).isEmpty());
    }

    @Test
    void shouldSkipVectorsOfOtherDimensions() {
        store.add(List.of("short", "long"), List.of(new float[]{1, 0}, new float[]{1, 0, 0}), null);

        assertEquals(List.of("long"), store.retrieve(new float[]{1, 0, 0}, 5));
    }

    @Test
    void shouldRejectMismatchedBatch() {
        assertThrows(IllegalArgumentException.class,
                () -> store.add(List.of("a", "b"), List.of(new float[]{1}), null));
        assertEquals(0, store.size());
    }
}

package decision.engine.retrieval;

public interface TextExtractor {
    String extract(byte[] content);
}

package decision.engine.classify;

public interface TextClassifier {
    Classification classify(String text);
}

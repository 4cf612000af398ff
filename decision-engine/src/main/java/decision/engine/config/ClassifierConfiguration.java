package decision.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import decision.engine.classify.HttpTextClassifier;
import decision.engine.classify.LexiconTextClassifier;
import decision.engine.classify.TextClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClassifierConfiguration {

    @Configuration
    @ConditionalOnProperty(prefix = "decision.engine.classifier", name = "provider", havingValue = "lexicon", matchIfMissing = true)
    static class Lexicon {
        @Bean
        TextClassifier fraudClassifier() {
            return LexiconTextClassifier.fraud();
        }

        @Bean
        TextClassifier sentimentClassifier() {
            return LexiconTextClassifier.sentiment();
        }

        @Bean
        TextClassifier financialClassifier() {
            return LexiconTextClassifier.financial();
        }

        @Bean
        TextClassifier clauseClassifier() {
            return LexiconTextClassifier.clauses();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "decision.engine.classifier", name = "provider", havingValue = "http")
    static class Http {
        private final ObjectMapper objectMapper;
        private final String apiKey;
        private final long timeoutMs;

        Http(
                ObjectMapper objectMapper,
                @Value("${decision.engine.classifier.http.api-key:}") String apiKey,
                @Value("${decision.engine.classifier.http.timeout-ms:10000}") long timeoutMs
        ) {
            this.objectMapper = objectMapper;
            this.apiKey = apiKey;
            this.timeoutMs = timeoutMs;
        }

        @Bean
        TextClassifier fraudClassifier(@Value("${decision.engine.classifier.http.fraud-endpoint}") String endpoint) {
            return new HttpTextClassifier(objectMapper, endpoint, apiKey, timeoutMs);
        }

        @Bean
        TextClassifier sentimentClassifier(@Value("${decision.engine.classifier.http.sentiment-endpoint}") String endpoint) {
            return new HttpTextClassifier(objectMapper, endpoint, apiKey, timeoutMs);
        }

        @Bean
        TextClassifier financialClassifier(@Value("${decision.engine.classifier.http.financial-endpoint}") String endpoint) {
            return new HttpTextClassifier(objectMapper, endpoint, apiKey, timeoutMs);
        }

        @Bean
        TextClassifier clauseClassifier(@Value("${decision.engine.classifier.http.clause-endpoint}") String endpoint) {
            return new HttpTextClassifier(objectMapper, endpoint, apiKey, timeoutMs);
        }
    }
}

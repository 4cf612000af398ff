package decision.engine.fraud;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class PatternSignalDetector implements FraudSignalDetector {
    private static final double PATTERN_INCREMENT = 0.15;
    private static final double BRIEF_INCREMENT = 0.10;
    private static final double URGENCY_INCREMENT = 0.05;
    private static final double DATE_DENSITY_INCREMENT = 0.10;
    private static final int BRIEF_WORD_LIMIT = 20;
    private static final int MAX_EXCLAMATIONS = 3;
    private static final int MAX_DATES = 5;

    private static final Pattern DATE = Pattern.compile("\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}");

    private static final List<FraudPattern> PATTERNS = List.of(
            new FraudPattern("document forgery language",
                    "\\b(fake|forged|counterfeit|fabricated)\\b"),
            new FraudPattern("urgent payment demand",
                    "\\b(urgent|immediately|asap|right now)\\b.*\\b(claim|payment)\\b"),
            new FraudPattern("repeated incidents",
                    "\\b(multiple|several|many)\\b.*\\b(claims|accidents|incidents)\\b"),
            new FraudPattern("large cash reimbursement",
                    "\\$\\d{4,}.*\\b(cash|payment|reimburse)\\b"),
            new FraudPattern("prior condition or damage",
                    "\\b(pre-existing|prior|previous)\\b.*\\b(condition|injury|damage)\\b"),
            new FraudPattern("evidence unavailable",
                    "\\b(witness|proof|evidence)\\b.*\\b(unavailable|lost|missing)\\b")
    );

    @Override
    public DetectionMethod method() {
        return DetectionMethod.PATTERN;
    }

    @Override
    public DetectionResult detect(String text, Map<String, Object> metadata) {
        double score = 0.0;
        List<String> indicators = new ArrayList<>();

        for (FraudPattern pattern : PATTERNS) {
            if (pattern.regex().matcher(text).find()) {
                score += PATTERN_INCREMENT;
                indicators.add("Pattern match: " + pattern.name());
            }
        }

        if (Words.split(text).length < BRIEF_WORD_LIMIT) {
            score += BRIEF_INCREMENT;
            indicators.add("Unusually brief description");
        }

        if (text.chars().filter(c -> c == '!').count() > MAX_EXCLAMATIONS) {
            score += URGENCY_INCREMENT;
            indicators.add("Excessive urgency markers");
        }

        if (countDates(text) > MAX_DATES) {
            score += DATE_DENSITY_INCREMENT;
            indicators.add("Multiple conflicting dates");
        }

        return new DetectionResult(Math.min(score, 1.0), indicators);
    }

    private static int countDates(String text) {
        Matcher matcher = DATE.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private record FraudPattern(String name, Pattern regex) {
        FraudPattern(String name, String regex) {
            this(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
    }
}

package decision.engine.risk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ApplicantProfileParser {
    private static final Pattern AGE = Pattern.compile("\\b(\\d{1,2})\\s*(?:years?\\s*old|yo)\\b", Pattern.CASE_INSENSITIVE);
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1");
    private static final Pattern SMOKER = Pattern.compile("\\b(smoker|smoking)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_SMOKER = Pattern.compile("\\b(non-?smoker|never smoked|does not smoke|doesn't smoke)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OCCUPATION = Pattern.compile("\\b(?:occupation|work|job):\\s*(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREDIT = Pattern.compile("\\bcredit(?:\\s+score)?[:\\s]+(\\d{3})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOCATION = Pattern.compile("\\b(?:location|lives in|living in|based in)[:\\s]+([\\w ,-]+?)(?:[.;\\n]|$)", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public ApplicantProfileParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ApplicantProfile parse(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return fromNode(objectMapper.createObjectNode());
        }
        if (input.isTextual()) {
            String text = input.asText();
            try {
                JsonNode parsed = objectMapper.readTree(text);
                return parsed != null && parsed.isObject() ? fromNode(parsed) : fromText(text);
            } catch (JsonProcessingException e) {
                return fromText(text);
            }
        }
        if (!input.isObject()) {
            throw new IllegalArgumentException("applicant data must be an object or text");
        }
        return fromNode(input);
    }

    private ApplicantProfile fromNode(JsonNode node) {
        JsonNode claims = node.path("claims_history");
        int claimsCount = claims.isArray() ? claims.size() : claims.asInt(0);
        return new ApplicantProfile(
                node.path("age").asInt(0),
                lower(node.path("gender").asText("")),
                lower(node.path("occupation").asText("")),
                lower(node.path("location").asText("")),
                node.path("health_status").asText("unknown"),
                flag(node.path("smoking")),
                node.path("credit_score").asInt(ApplicantProfile.DEFAULT_CREDIT_SCORE),
                Math.max(0, claimsCount),
                node.path("coverage_years").asInt(0),
                node.path("payment_history").asText("unknown")
        );
    }

    private static ApplicantProfile fromText(String text) {
        int age = 0;
        Matcher ageMatch = AGE.matcher(text);
        if (ageMatch.find()) {
            age = Integer.parseInt(ageMatch.group(1));
        }

        boolean smoking = SMOKER.matcher(text).find() && !NON_SMOKER.matcher(text).find();

        String occupation = "";
        Matcher occupationMatch = OCCUPATION.matcher(text);
        if (occupationMatch.find()) {
            occupation = occupationMatch.group(1);
        }

        int credit = ApplicantProfile.DEFAULT_CREDIT_SCORE;
        Matcher creditMatch = CREDIT.matcher(text);
        if (creditMatch.find()) {
            credit = Integer.parseInt(creditMatch.group(1));
        }

        String location = "";
        Matcher locationMatch = LOCATION.matcher(text);
        if (locationMatch.find()) {
            location = locationMatch.group(1).trim();
        }

        return new ApplicantProfile(age, "", lower(occupation), lower(location), "unknown", smoking, credit,
                0, 0, "unknown");
    }

    private static boolean flag(JsonNode node) {
        if (node.isTextual()) {
            return TRUE_WORDS.contains(lower(node.asText()));
        }
        return node.asBoolean(false);
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}

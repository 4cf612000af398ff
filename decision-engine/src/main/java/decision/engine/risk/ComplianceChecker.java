package decision.engine.risk;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ComplianceChecker {
    private static final int MINIMUM_AGE = 18;
    private static final int LIFE_GUIDELINE_AGE = 80;
    private static final List<String> REGULATIONS = List.of("ACA", "HIPAA", "State Insurance Codes");

    public ComplianceReport check(ApplicantProfile profile, String policyType) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        int age = profile.age();
        if (age > 0 && age < MINIMUM_AGE) {
            issues.add("Applicant under minimum age (18)");
        }
        if (age > LIFE_GUIDELINE_AGE && "life".equals(policyType)) {
            warnings.add("Age exceeds typical underwriting guidelines for life insurance");
        }
        if (profile.gender().isBlank() || age <= 0) {
            warnings.add("Incomplete demographic data may impact compliance");
        }

        return new ComplianceReport(issues.isEmpty(), issues, warnings, REGULATIONS);
    }
}

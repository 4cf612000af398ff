package decision.engine.risk;

import java.util.LinkedHashMap;
import java.util.Map;

public record ApplicantProfile(
        int age,
        String gender,
        String occupation,
        String location,
        String healthStatus,
        boolean smoking,
        int creditScore,
        int claimsHistoryCount,
        int coverageYears,
        String paymentHistory
) {
    public static final int DEFAULT_CREDIT_SCORE = 650;

    public ApplicantProfile {
        gender = gender == null ? "" : gender;
        occupation = occupation == null ? "" : occupation;
        location = location == null ? "" : location;
        healthStatus = healthStatus == null || healthStatus.isBlank() ? "unknown" : healthStatus;
        paymentHistory = paymentHistory == null || paymentHistory.isBlank() ? "unknown" : paymentHistory;
    }

    public ApplicantProfile withSmoking(boolean value) {
        return new ApplicantProfile(age, gender, occupation, location, healthStatus, value, creditScore,
                claimsHistoryCount, coverageYears, paymentHistory);
    }

    public ApplicantProfile withCreditScore(int value) {
        return new ApplicantProfile(age, gender, occupation, location, healthStatus, smoking, value,
                claimsHistoryCount, coverageYears, paymentHistory);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("age", age);
        map.put("gender", gender);
        map.put("occupation", occupation);
        map.put("location", location);
        map.put("health_status", healthStatus);
        map.put("smoking", smoking);
        map.put("credit_score", creditScore);
        map.put("claims_history", claimsHistoryCount);
        map.put("coverage_years", coverageYears);
        map.put("payment_history", paymentHistory);
        return map;
    }
}

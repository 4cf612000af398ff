package decision.engine.policy;

import decision.engine.claims.ClaimVerdict;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class ClaimantMessagePolicy {
    static final int MIN_MESSAGE_LENGTH = 30;
    static final String SIGNATURE = "Warm regards,\nPolicyGenie Claims Department";
    static final String DEFAULT_REJECTION_REASON =
            "The incident does not fall within the covered perils of your policy.";

    public String apply(ClaimVerdict verdict, String message, String reason, List<String> missingDocuments) {
        String safe = message == null ? "" : message.trim();
        if (safe.length() < MIN_MESSAGE_LENGTH) {
            if (verdict == ClaimVerdict.PENDING_DOCUMENTS) {
                safe = pendingTemplate(missingDocuments);
            } else if (verdict == ClaimVerdict.REJECTED) {
                safe = rejectedTemplate(reason);
            }
        }

        return safe
                .replace("guaranteed payout", "payout subject to policy terms")
                .replace("will definitely be paid", "will be assessed against your policy terms");
    }

    private static String pendingTemplate(List<String> missingDocuments) {
        String documents = missingDocuments == null || missingDocuments.isEmpty()
                ? "  - See the required documents checklist"
                : missingDocuments.stream().map(d -> "  - " + d).collect(Collectors.joining("\n"));
        return "Dear Claimant,\n\n"
                + "Thank you for your claim. It appears to be largely in order and we want to help you "
                + "complete it.\n\n"
                + "We cannot approve it yet because the following required document(s) are missing or "
                + "could not be verified:\n\n"
                + documents + "\n\n"
                + "Please gather these documents and re-submit your claim. Complete submissions are "
                + "processed as a priority, and our helpline can assist if you have trouble obtaining "
                + "any of them.\n\n"
                + SIGNATURE;
    }

    private static String rejectedTemplate(String reason) {
        String why = reason == null || reason.isBlank() ? DEFAULT_REJECTION_REASON : reason.trim();
        return "Dear Claimant,\n\n"
                + "Thank you for your claim. After reviewing it against the terms and conditions of your "
                + "policy, we regret that it cannot be approved at this time.\n\n"
                + "Reason: " + why + "\n\n"
                + "If you believe this decision is incorrect or have additional information, you may appeal "
                + "within 30 days by contacting our disputes resolution team.\n\n"
                + SIGNATURE;
    }
}

package decision.engine.policy;

import decision.engine.claims.ClaimVerdict;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaimantMessagePolicyTest {
    private final ClaimantMessagePolicy policy = new ClaimantMessagePolicy();

    @Test
    void shouldListMissingDocumentsForShortPendingMessage() {
        String message = policy.apply(ClaimVerdict.PENDING_DOCUMENTS, "Pending.", "", List.of("Photos", "Police Report"));

        assertTrue(message.startsWith("Dear Claimant,"));
        assertTrue(message.contains("  - Photos\n  - Police Report"));
        assertTrue(message.endsWith(ClaimantMessagePolicy.SIGNATURE));
    }

    @Test
    void shouldExplainShortRejection() {
        String message = policy.apply(ClaimVerdict.REJECTED, "", "", List.of());

        assertTrue(message.contains("Reason: " + ClaimantMessagePolicy.DEFAULT_REJECTION_REASON));
        assertTrue(message.contains("appeal within 30 days"));
    }

    @Test
    void shouldKeepAdequateMessages() {
        String original = "Your claim has been reviewed and is pending two documents listed below.";

        assertEquals(original, policy.apply(ClaimVerdict.PENDING_DOCUMENTS, original, "", List.of("Photos")));
    }

    @Test
    void shouldNotTemplateApprovedOrInvestigatedClaims() {
        assertEquals("OK", policy.apply(ClaimVerdict.APPROVED, " OK ", "", List.of()));
        assertEquals("", policy.apply(ClaimVerdict.UNDER_INVESTIGATION, null, "", List.of()));
    }

    @Test
    void shouldSoftenPayoutPromises() {
        String message = policy.apply(ClaimVerdict.APPROVED,
                "Good news: your claim will definitely be paid, a guaranteed payout within a week.", "", List.of());

        assertFalse(message.contains("will definitely be paid"));
        assertFalse(message.contains("guaranteed payout"));
        assertTrue(message.contains("will be assessed against your policy terms"));
    }
}

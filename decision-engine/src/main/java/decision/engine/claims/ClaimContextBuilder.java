package decision.engine.claims;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class ClaimContextBuilder {
    private final Clock clock;

    public ClaimContextBuilder(Clock clock) {
        this.clock = clock;
    }

    public ClaimContext build(ClaimSubmission submission) {
        Double amount = submission.claimAmount();
        String bucket;
        if (amount == null) {
            bucket = "UNSTATED";
        } else if (amount < 10_000) {
            bucket = "SMALL";
        } else if (amount < 50_000) {
            bucket = "MEDIUM";
        } else {
            bucket = "LARGE";
        }

        List<IncidentType> types = IncidentType.infer(submission.narrative());
        return new ClaimContext(
                clock.instant(),
                submission,
                types,
                IncidentType.checklist(types),
                bucket
        );
    }
}

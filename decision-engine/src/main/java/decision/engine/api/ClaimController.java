package decision.engine.api;

import decision.engine.api.model.ClaimRequest;
import decision.engine.api.model.DecisionResponse;
import decision.engine.claims.ClaimAdjudication;
import decision.engine.service.DecisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/claims")
public class ClaimController {
    private final DecisionService service;

    public ClaimController(DecisionService service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<DecisionResponse<ClaimAdjudication>> submit(@RequestBody ClaimRequest request) {
        return ResponseEntity.ok(service.submitClaim(RequestIds.next(), request));
    }
}

package decision.engine.api;

import decision.engine.api.model.DecisionResponse;
import decision.engine.api.model.RiskAssessmentRequest;
import decision.engine.api.model.WhatIfRequest;
import decision.engine.risk.RiskAssessment;
import decision.engine.risk.WhatIfComparison;
import decision.engine.service.DecisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/risk")
public class RiskController {
    private final DecisionService service;

    public RiskController(DecisionService service) {
        this.service = service;
    }

    @PostMapping("/assessments")
    public ResponseEntity<DecisionResponse<RiskAssessment>> assess(@RequestBody RiskAssessmentRequest request) {
        return ResponseEntity.ok(service.assessRisk(RequestIds.next(), request));
    }

    @PostMapping("/what-if")
    public ResponseEntity<DecisionResponse<WhatIfComparison>> whatIf(@RequestBody WhatIfRequest request) {
        return ResponseEntity.ok(service.whatIf(RequestIds.next(), request));
    }
}

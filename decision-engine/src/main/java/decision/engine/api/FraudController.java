package decision.engine.api;

import decision.engine.api.model.DecisionResponse;
import decision.engine.api.model.FraudBatchRequest;
import decision.engine.api.model.FraudCheckRequest;
import decision.engine.cache.CacheStats;
import decision.engine.fraud.FraudAssessment;
import decision.engine.service.DecisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/fraud")
public class FraudController {
    private final DecisionService service;

    public FraudController(DecisionService service) {
        this.service = service;
    }

    @PostMapping("/checks")
    public ResponseEntity<DecisionResponse<FraudAssessment>> check(@RequestBody FraudCheckRequest request) {
        return ResponseEntity.ok(service.checkFraud(RequestIds.next(), request));
    }

    @PostMapping("/checks/batch")
    public ResponseEntity<DecisionResponse<List<FraudAssessment>>> checkBatch(@RequestBody FraudBatchRequest request) {
        return ResponseEntity.ok(service.checkFraudBatch(RequestIds.next(), request));
    }

    @GetMapping("/cache")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(service.cacheStats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        service.clearFraudCache();
        return ResponseEntity.noContent().build();
    }
}

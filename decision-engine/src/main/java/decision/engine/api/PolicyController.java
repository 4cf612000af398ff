package decision.engine.api;

import decision.engine.advice.PolicyAnswer;
import decision.engine.api.model.DecisionResponse;
import decision.engine.api.model.PolicyIndexRequest;
import decision.engine.api.model.PolicyQuestionRequest;
import decision.engine.retrieval.IndexingResult;
import decision.engine.service.DecisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/policies")
public class PolicyController {
    private final DecisionService service;

    public PolicyController(DecisionService service) {
        this.service = service;
    }

    @PostMapping("/index")
    public ResponseEntity<DecisionResponse<IndexingResult>> index(@RequestBody PolicyIndexRequest request) {
        return ResponseEntity.ok(service.indexPolicy(RequestIds.next(), request));
    }

    @PostMapping("/upload")
    public ResponseEntity<DecisionResponse<IndexingResult>> upload(@RequestParam("file") MultipartFile file) throws IOException {
        return ResponseEntity.ok(service.uploadPolicy(RequestIds.next(), file.getOriginalFilename(), file.getBytes()));
    }

    @PostMapping("/ask")
    public ResponseEntity<DecisionResponse<PolicyAnswer>> ask(@RequestBody PolicyQuestionRequest request) {
        return ResponseEntity.ok(service.askPolicy(RequestIds.next(), request));
    }
}

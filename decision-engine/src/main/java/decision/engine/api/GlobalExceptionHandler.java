package decision.engine.api;

import decision.engine.claims.AdjudicationException;
import decision.engine.llm.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(IllegalArgumentException ex) {
        log.warn("event=invalid_input error={}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("event=invalid_input error=unreadable request body");
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Request body could not be read.");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("event=invalid_input error=upload too large");
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Uploaded file exceeds the maximum size.");
    }

    @ExceptionHandler(AdjudicationException.class)
    public ResponseEntity<Map<String, Object>> handleAdjudication(AdjudicationException ex) {
        log.error("event=decision_unavailable error={}", ex.getMessage(), ex);
        return buildResponse(HttpStatus.BAD_GATEWAY, "DECISION_UNAVAILABLE",
                "The claim could not be adjudicated right now. Please retry later.");
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<Map<String, Object>> handleGeneration(GenerationException ex) {
        log.error("event=generation_unavailable error={}", ex.getMessage(), ex);
        return buildResponse(HttpStatus.BAD_GATEWAY, "GENERATION_UNAVAILABLE",
                "An answer could not be generated right now. Please retry later.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("event=unhandled_error", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected system error occurred.");
    }

    private static ResponseEntity<Map<String, Object>> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error_code", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}

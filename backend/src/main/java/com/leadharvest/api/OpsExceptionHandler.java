package com.leadharvest.api;

import com.leadharvest.scrape.service.IllegalStatusTransitionException;
import com.leadharvest.scrape.service.RecordNotFoundException;
import com.leadharvest.scrape.service.TargetNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class OpsExceptionHandler {

  @ExceptionHandler(IllegalStatusTransitionException.class)
  public ResponseEntity<Map<String, String>> handleIllegalTransition(IllegalStatusTransitionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "invalid_status_transition", "message", ex.getMessage()));
  }

  @ExceptionHandler(RecordNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleRecordNotFound(RecordNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "record_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(TargetNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleTargetNotFound(TargetNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "target_not_found", "message", ex.getMessage()));
  }
}

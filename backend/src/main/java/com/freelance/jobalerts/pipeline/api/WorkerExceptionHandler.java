package com.freelance.jobalerts.pipeline.api;

import com.freelance.jobalerts.pipeline.service.CycleInProgressException;
import com.freelance.jobalerts.pipeline.service.StoreUnavailableException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class WorkerExceptionHandler {

  @ExceptionHandler(CycleInProgressException.class)
  public ResponseEntity<Map<String, String>> handleCycleInProgress(CycleInProgressException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "cycle_in_progress", "message", ex.getMessage()));
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleStoreUnavailable(StoreUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "store_unavailable", "message", ex.getMessage()));
  }
}

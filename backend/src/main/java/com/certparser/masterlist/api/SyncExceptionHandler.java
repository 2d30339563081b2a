package com.certparser.masterlist.api;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SyncExceptionHandler {

  @ExceptionHandler(RejectedExecutionException.class)
  public ResponseEntity<Map<String, String>> handleRejected(RejectedExecutionException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "sync_unavailable", "message", "Master list sync is not accepting runs"));
  }
}

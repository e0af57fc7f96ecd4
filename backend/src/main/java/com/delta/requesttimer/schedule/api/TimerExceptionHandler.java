package com.delta.requesttimer.schedule.api;

import com.delta.requesttimer.schedule.service.ConfigValidationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TimerExceptionHandler {

  @ExceptionHandler(ConfigValidationException.class)
  public ResponseEntity<Map<String, String>> handleInvalidConfig(ConfigValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "config_validation", "message", ex.getMessage()));
  }
}

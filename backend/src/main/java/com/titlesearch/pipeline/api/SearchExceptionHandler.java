package com.titlesearch.pipeline.api;

import com.titlesearch.pipeline.service.BatchNotFoundException;
import com.titlesearch.pipeline.service.InvalidBatchStateException;
import com.titlesearch.pipeline.service.InvalidSearchStateException;
import com.titlesearch.pipeline.service.SearchNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SearchExceptionHandler {

  @ExceptionHandler(SearchNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(SearchNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "search_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidSearchStateException.class)
  public ResponseEntity<Map<String, String>> handleInvalidState(InvalidSearchStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "invalid_search_state", "message", ex.getMessage()));
  }

  @ExceptionHandler(BatchNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleBatchNotFound(BatchNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "batch_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidBatchStateException.class)
  public ResponseEntity<Map<String, String>> handleInvalidBatchState(InvalidBatchStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "invalid_batch_state", "message", ex.getMessage()));
  }
}

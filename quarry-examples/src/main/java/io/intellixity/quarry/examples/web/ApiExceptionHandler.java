package io.intellixity.quarry.examples.web;

import io.intellixity.quarry.registry.DatasourceNotFoundException;
import io.intellixity.quarry.registry.UnknownDatasourceTypeException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public final class ApiExceptionHandler {

  public record ApiError(int status, String error, String message) {}

  @ExceptionHandler({DatasourceNotFoundException.class, UnknownDatasourceTypeException.class})
  public ResponseEntity<ApiError> notFound(RuntimeException e) {
    HttpStatus status = HttpStatus.NOT_FOUND;
    return ResponseEntity.status(status).body(new ApiError(status.value(), status.getReasonPhrase(), e.getMessage()));
  }
}

package uk.ac.ebi.orthoviewer.ortholog_service.config;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import uk.ac.ebi.orthoviewer.ortholog_service.exceptions.DataNotFoundException;
import uk.ac.ebi.orthoviewer.ortholog_service.exceptions.UnknownSearchKindException;
import uk.ac.ebi.orthoviewer.ortholog_service.rest.ApiError;
import uk.ac.ebi.orthoviewer.ortholog_service.rest.RestResponse;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(DataNotFoundException.class)
  public ResponseEntity<RestResponse<Void>> handleDataNotFound(DataNotFoundException ex) {
    log.error("Orthology data unavailable: {}", ex.getMessage());
    ApiError error =
        new ApiError(
            "DATA_UNAVAILABLE", null, ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE.value());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(RestResponse.error("Orthology data unavailable", List.of(error)));
  }

  @ExceptionHandler(UnknownSearchKindException.class)
  public ResponseEntity<RestResponse<Void>> handleUnknownSearchKind(
      UnknownSearchKindException ex) {
    log.warn(ex.getMessage());
    ApiError error =
        new ApiError(
            "UNKNOWN_SEARCH_KIND", "searchType", ex.getMessage(), HttpStatus.BAD_REQUEST.value());
    return ResponseEntity.badRequest().body(RestResponse.error(ex.getMessage(), List.of(error)));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<RestResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
    List<ApiError> errors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                fe ->
                    new ApiError(
                        "VALIDATION_ERROR",
                        fe.getField(),
                        fe.getDefaultMessage(),
                        HttpStatus.BAD_REQUEST.value()))
            .toList();
    return ResponseEntity.badRequest().body(RestResponse.error("Invalid request", errors));
  }

  // Catch-all for other exceptions
  @ExceptionHandler(Exception.class)
  public ResponseEntity<RestResponse<Void>> handleGeneric(Exception ex) {
    log.error("Unexpected error", ex);
    ApiError error = new ApiError("INTERNAL_ERROR", null, "Internal server error", 500);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(RestResponse.error("Operation failed", List.of(error)));
  }
}

package uk.ac.ebi.orthoviewer.ortholog_service.rest;

import java.util.List;

public record RestResponse<T>(boolean success, String message, T data, List<ApiError> errors) {

  public static <T> RestResponse<T> success(String msg, T data) {
    return new RestResponse<>(true, msg, data, List.of());
  }

  public static <T> RestResponse<T> error(String msg, List<ApiError> errors) {
    return new RestResponse<>(false, msg, null, errors);
  }

  public static <T> RestResponse<T> notFound(String msg, String field) {
    return new RestResponse<>(
        false, msg, null, List.of(new ApiError("NOT_FOUND", field, msg, 404)));
  }
}

package com.scholary.transcripts.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/** Error body returned by {@link GlobalExceptionHandler}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, Map<String, String> details) {

  public static ErrorResponse of(String error, String message) {
    return new ErrorResponse(error, message, null);
  }
}

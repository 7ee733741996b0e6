package org.bookstore.inventory.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/** Error body returned for every failed request. */
@Schema(description = "Error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    @Schema(description = "Always false", example = "false") boolean success,
    @Schema(description = "Human-readable explanation", example = "無效的通知頻率") String message,
    @Schema(description = "Machine-readable error code, when one applies", example = "PUBLISHER_HAS_BOOKS")
        String code) {

  public static ApiErrorResponse of(String message) {
    return new ApiErrorResponse(false, message, null);
  }

  public static ApiErrorResponse of(String message, String code) {
    return new ApiErrorResponse(false, message, code);
  }
}

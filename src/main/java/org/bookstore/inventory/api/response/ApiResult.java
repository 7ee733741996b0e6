package org.bookstore.inventory.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Success envelope {@code {success, message, data}} used by the bookstore endpoints.
 *
 * @param <T> payload type
 */
@Schema(description = "Success envelope")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResult<T>(
    @Schema(description = "Always true", example = "true") boolean success,
    @Schema(description = "Optional display message") String message,
    @Schema(description = "Payload") T data) {

  public static <T> ApiResult<T> of(T data) {
    return new ApiResult<>(true, null, data);
  }

  public static <T> ApiResult<T> of(String message, T data) {
    return new ApiResult<>(true, message, data);
  }
}

package org.bookstore.inventory.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.domain.UserAccount;

/** Response DTO for user operations. */
@Schema(description = "User")
public record UserResponse(
    @Schema(description = "Unique identifier", example = "1") Long id,
    @Schema(description = "Username", example = "reader01") String username,
    @Schema(description = "Email address", example = "reader01@example.com") String email,
    @Schema(description = "Creation timestamp") Instant createdAt) {

  public static UserResponse from(UserAccount user) {
    return new UserResponse(user.getId(), user.getUsername(), user.getEmail(), user.getCreatedAt());
  }
}

package org.bookstore.inventory.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

/** Request DTO for registering a user. */
@Schema(description = "User fields")
public record UserCreateRequest(
    @Schema(description = "Unique username", requiredMode = Schema.RequiredMode.REQUIRED, example = "reader01")
        @NotBlank(message = "Username is required")
        @Size(max = 150, message = "Username must not exceed 150 characters")
        String username,
    @Schema(description = "Email address", example = "reader01@example.com")
        @Email(message = "Email must be a valid address")
        @Size(max = 254, message = "Email must not exceed 254 characters")
        String email) {}

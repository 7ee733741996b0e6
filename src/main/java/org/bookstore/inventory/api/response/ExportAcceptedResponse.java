package org.bookstore.inventory.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

/** Response DTO for an accepted export request. */
@Schema(description = "Accepted export")
public record ExportAcceptedResponse(
    @Schema(description = "Id of the background export", example = "3f0c2a4e-...") String taskId) {}

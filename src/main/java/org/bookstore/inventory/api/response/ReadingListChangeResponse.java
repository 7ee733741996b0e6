package org.bookstore.inventory.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

/** Response DTO for adding or removing a reading-list book. */
@Schema(description = "Affected book")
public record ReadingListChangeResponse(
    @Schema(description = "Book id", example = "7") Long bookId) {}

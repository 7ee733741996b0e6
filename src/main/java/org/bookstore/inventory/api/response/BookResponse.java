package org.bookstore.inventory.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.domain.Book;
import org.bookstore.inventory.service.dto.PublisherSummary;

/** Response DTO for a single book. */
@Schema(description = "Book")
public record BookResponse(
    @Schema(description = "Unique identifier", example = "1") Long id,
    @Schema(description = "Title", example = "小王子") String title,
    @Schema(description = "Price in whole units", example = "250") int price,
    @Schema(description = "Units in stock", example = "12") int stock,
    @Schema(description = "Publisher, null when none") PublisherSummary publisher,
    @Schema(description = "Creation timestamp", example = "2025-01-15T10:30:00Z") Instant createdAt,
    @Schema(description = "Last update timestamp", example = "2025-01-15T14:45:00Z")
        Instant updatedAt) {

  public static BookResponse from(Book book) {
    var publisher = book.getPublisher();
    return new BookResponse(
        book.getId(),
        book.getTitle(),
        book.getPrice(),
        book.getStock(),
        publisher == null ? null : new PublisherSummary(publisher.getId(), publisher.getName()),
        book.getCreatedAt(),
        book.getUpdatedAt());
  }
}

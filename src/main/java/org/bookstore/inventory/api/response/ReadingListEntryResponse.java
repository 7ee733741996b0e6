package org.bookstore.inventory.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.domain.ReadingListEntry;
import org.bookstore.inventory.service.dto.BookListingEntry;

/** Response DTO for one reading-list entry. */
@Schema(description = "Reading list entry")
public record ReadingListEntryResponse(
    @Schema(description = "The saved book") BookListingEntry book,
    @Schema(description = "When the book was added") Instant addedDate) {

  public static ReadingListEntryResponse from(ReadingListEntry entry) {
    return new ReadingListEntryResponse(
        BookListingEntry.from(entry.getBook()), entry.getAddedDate());
  }
}

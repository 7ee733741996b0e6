package org.bookstore.inventory.api.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.service.dto.BookListingEntry;

/** Response DTO for the book listing page. */
@Schema(description = "Book listing with the caller's favorites")
public record BookListResponse(
    @Schema(description = "All books, ordered by id") List<BookListingEntry> books,
    @Schema(description = "Ids of books on the caller's reading list")
        List<Long> userFavoriteBookIds,
    @Schema(description = "Whether a user id was supplied")
        @JsonProperty("is_authenticated")
        boolean authenticated) {}

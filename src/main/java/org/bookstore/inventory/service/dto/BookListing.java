package org.bookstore.inventory.service.dto;

import java.util.List;

/**
 * Cached projection of every book, ordered by id.
 *
 * @param books one entry per book
 */
public record BookListing(List<BookListingEntry> books) {

  public BookListing {
    books = books == null ? List.of() : List.copyOf(books);
  }
}

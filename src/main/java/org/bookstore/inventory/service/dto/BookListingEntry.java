package org.bookstore.inventory.service.dto;

import org.bookstore.inventory.domain.Book;

/**
 * One row of the book listing.
 *
 * @param id book id
 * @param title book title
 * @param price price in whole units
 * @param stock units in stock
 * @param publisher publisher summary, or null when the book has none
 */
public record BookListingEntry(
    Long id, String title, int price, int stock, PublisherSummary publisher) {

  public static BookListingEntry from(Book book) {
    var publisher = book.getPublisher();
    return new BookListingEntry(
        book.getId(),
        book.getTitle(),
        book.getPrice(),
        book.getStock(),
        publisher == null ? null : new PublisherSummary(publisher.getId(), publisher.getName()));
  }
}

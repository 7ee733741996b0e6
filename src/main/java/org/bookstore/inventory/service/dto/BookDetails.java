package org.bookstore.inventory.service.dto;

/**
 * Writable fields of a book.
 *
 * @param title book title
 * @param price price in whole units, not negative
 * @param stock units in stock, not negative
 * @param publisherId publisher to link the book to
 */
public record BookDetails(String title, int price, int stock, Long publisherId) {}

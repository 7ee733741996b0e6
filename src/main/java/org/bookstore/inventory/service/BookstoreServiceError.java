package org.bookstore.inventory.service;

/** Error codes for bookstore business exceptions. */
public enum BookstoreServiceError {
  /** A publisher with the same name already exists. */
  DUPLICATE_PUBLISHER_NAME,

  /** The publisher is still referenced by at least one book. */
  PUBLISHER_HAS_BOOKS,

  /** The username is already taken. */
  DUPLICATE_USERNAME,

  /** The book is already on the user's reading list. */
  BOOK_ALREADY_IN_READING_LIST,

  /** The book is not on the user's reading list. */
  BOOK_NOT_IN_READING_LIST,
}

package org.bookstore.inventory.service.exception;

/** Input that fails validation, e.g. an unknown notification frequency. Surfaces as HTTP 400. */
public class InvalidRequestException extends ServiceException {

  public InvalidRequestException(String message) {
    super(message);
  }
}

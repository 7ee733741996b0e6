package org.bookstore.inventory.service.exception;

/** The requested entity does not exist. Surfaces as HTTP 404. */
public class ResourceNotFoundException extends ServiceException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}

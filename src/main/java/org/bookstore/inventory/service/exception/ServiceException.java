package org.bookstore.inventory.service.exception;

/** Root of the service's exception hierarchy. Unhandled subtypes surface as HTTP 500. */
public class ServiceException extends RuntimeException {

  public ServiceException(String message) {
    super(message);
  }

  public ServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}

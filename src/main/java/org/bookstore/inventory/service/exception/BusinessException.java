package org.bookstore.inventory.service.exception;

/**
 * A request that is well formed but breaks a business rule, such as deleting a publisher that
 * still has books. Surfaces as HTTP 422 with {@link #getCode()}.
 */
public class BusinessException extends ServiceException {

  private final String code;

  public BusinessException(String message, String code) {
    super(message);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}

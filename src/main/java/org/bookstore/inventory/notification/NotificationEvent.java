package org.bookstore.inventory.notification;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Message pushed to every client subscribed to the broadcast channel.
 *
 * @param type message family, always {@value #BOOK_UPDATE}
 * @param action what happened
 * @param message display text
 * @param userId recipient hint for client-side filtering, or null for everyone
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationEvent(String type, NotificationAction action, String message, Long userId) {

  public static final String BOOK_UPDATE = "book_update";

  public static NotificationEvent broadcast(NotificationAction action, String message) {
    return new NotificationEvent(BOOK_UPDATE, action, message, null);
  }

  public static NotificationEvent forUser(NotificationAction action, String message, Long userId) {
    return new NotificationEvent(BOOK_UPDATE, action, message, userId);
  }
}

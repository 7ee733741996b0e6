package org.bookstore.inventory.notification;

/**
 * Hands events to the broadcast channel.
 *
 * <p>Publishing is fire-and-forget: implementations return once the transport accepted the event
 * and never throw, so a delivery problem cannot fail the operation that produced the event.
 */
public interface NotificationPublisher {

  void publish(NotificationEvent event);
}

package org.bookstore.inventory.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Component;

import org.bookstore.inventory.config.BookstoreServiceProperties;

/**
 * Publishes straight to this instance's STOMP broker. Suitable for a single instance; clients
 * connected to other instances do not see the event.
 */
@Component
@ConditionalOnProperty(name = "bookstore.notifications.transport", havingValue = "local")
public class LocalNotificationPublisher implements NotificationPublisher {

  private static final Logger log = LoggerFactory.getLogger(LocalNotificationPublisher.class);

  private final SimpMessageSendingOperations messagingTemplate;
  private final String destination;

  public LocalNotificationPublisher(
      SimpMessageSendingOperations messagingTemplate, BookstoreServiceProperties properties) {
    this.messagingTemplate = messagingTemplate;
    this.destination = properties.getNotifications().getDestination();
  }

  @Override
  public void publish(NotificationEvent event) {
    try {
      messagingTemplate.convertAndSend(destination, event);
      log.debug("Published {} to {}", event.action(), destination);
    } catch (MessagingException e) {
      log.warn("Failed to publish {} to {}: {}", event.action(), destination, e.getMessage());
    }
  }
}

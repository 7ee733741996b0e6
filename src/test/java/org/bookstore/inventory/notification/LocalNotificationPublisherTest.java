package org.bookstore.inventory.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessageSendingOperations;

import org.bookstore.inventory.config.BookstoreServiceProperties;

@ExtendWith(MockitoExtension.class)
@DisplayName("LocalNotificationPublisher Unit Tests")
class LocalNotificationPublisherTest {

  @Mock private SimpMessageSendingOperations messagingTemplate;

  private LocalNotificationPublisher publisher;

  @BeforeEach
  void setUp() {
    publisher = new LocalNotificationPublisher(messagingTemplate, new BookstoreServiceProperties());
  }

  @Test
  @DisplayName("publish - sends the event to the STOMP destination")
  void publish_SendsToDestination() {
    var event = NotificationEvent.broadcast(NotificationAction.UPDATE, "書籍已更新：三體");

    publisher.publish(event);

    verify(messagingTemplate).convertAndSend("/topic/book_updates", event);
  }

  @Test
  @DisplayName("publish - broker rejects the message - failure is contained")
  void publish_BrokerFailure_DoesNotThrow() {
    doThrow(new MessageDeliveryException("broker unavailable"))
        .when(messagingTemplate)
        .convertAndSend(eq("/topic/book_updates"), any(NotificationEvent.class));

    assertThatCode(
            () -> publisher.publish(NotificationEvent.broadcast(NotificationAction.CREATE, "x")))
        .doesNotThrowAnyException();
  }
}

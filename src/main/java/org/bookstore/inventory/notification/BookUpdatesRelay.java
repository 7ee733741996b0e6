package org.bookstore.inventory.notification;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageSendingOperations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Forwards events received on the Redis channel to this instance's STOMP subscribers. */
public class BookUpdatesRelay implements MessageListener {

  private static final Logger log = LoggerFactory.getLogger(BookUpdatesRelay.class);

  private final SimpMessageSendingOperations messagingTemplate;
  private final ObjectMapper objectMapper;
  private final String destination;

  public BookUpdatesRelay(
      SimpMessageSendingOperations messagingTemplate, ObjectMapper objectMapper, String destination) {
    this.messagingTemplate = messagingTemplate;
    this.objectMapper = objectMapper;
    this.destination = destination;
  }

  @Override
  public void onMessage(Message message, byte[] pattern) {
    var body = new String(message.getBody(), StandardCharsets.UTF_8);
    try {
      var event = objectMapper.readValue(body, NotificationEvent.class);
      messagingTemplate.convertAndSend(destination, event);
    } catch (JsonProcessingException e) {
      log.warn("Dropping malformed notification payload: {}", body);
    } catch (MessagingException e) {
      log.warn("Failed to relay notification to {}: {}", destination, e.getMessage());
    }
  }
}

package org.bookstore.inventory.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.bookstore.inventory.config.BookstoreServiceProperties;

/**
 * Publishes events as JSON on a Redis pub/sub channel. Every instance subscribes through {@link
 * BookUpdatesRelay} and forwards to its own STOMP clients, so a client sees the event whichever
 * instance it is connected to.
 */
@Component
@ConditionalOnProperty(
    name = "bookstore.notifications.transport",
    havingValue = "redis",
    matchIfMissing = true)
public class RedisNotificationPublisher implements NotificationPublisher {

  private static final Logger log = LoggerFactory.getLogger(RedisNotificationPublisher.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String channel;

  public RedisNotificationPublisher(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      BookstoreServiceProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.channel = properties.getNotifications().getChannel();
  }

  @Override
  public void publish(NotificationEvent event) {
    try {
      var payload = objectMapper.writeValueAsString(event);
      redisTemplate.convertAndSend(channel, payload);
      log.debug("Published {} to channel {}", event.action(), channel);
    } catch (JsonProcessingException e) {
      log.error("Could not serialize notification {}", event, e);
    } catch (DataAccessException e) {
      log.warn("Failed to publish {} to channel {}: {}", event.action(), channel, e.getMessage());
    }
  }
}

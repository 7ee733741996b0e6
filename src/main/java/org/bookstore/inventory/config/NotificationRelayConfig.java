package org.bookstore.inventory.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessageSendingOperations;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.bookstore.inventory.notification.BookUpdatesRelay;

/** Subscribes this instance to the Redis broadcast channel when the Redis transport is active. */
@Configuration
@ConditionalOnProperty(
    name = "bookstore.notifications.transport",
    havingValue = "redis",
    matchIfMissing = true)
public class NotificationRelayConfig {

  @Bean
  public BookUpdatesRelay bookUpdatesRelay(
      SimpMessageSendingOperations messagingTemplate,
      ObjectMapper objectMapper,
      BookstoreServiceProperties properties) {
    return new BookUpdatesRelay(
        messagingTemplate, objectMapper, properties.getNotifications().getDestination());
  }

  @Bean
  public RedisMessageListenerContainer bookUpdatesListenerContainer(
      RedisConnectionFactory connectionFactory,
      BookUpdatesRelay bookUpdatesRelay,
      BookstoreServiceProperties properties) {
    var container = new RedisMessageListenerContainer();
    container.setConnectionFactory(connectionFactory);
    container.addMessageListener(
        bookUpdatesRelay, new ChannelTopic(properties.getNotifications().getChannel()));
    return container;
  }
}

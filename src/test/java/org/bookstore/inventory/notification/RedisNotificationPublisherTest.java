package org.bookstore.inventory.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import org.bookstore.inventory.config.BookstoreServiceProperties;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisNotificationPublisher Unit Tests")
class RedisNotificationPublisherTest {

  @Mock private StringRedisTemplate redisTemplate;

  private final ObjectMapper objectMapper =
      new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

  private RedisNotificationPublisher publisher;

  @BeforeEach
  void setUp() {
    publisher =
        new RedisNotificationPublisher(
            redisTemplate, objectMapper, new BookstoreServiceProperties());
  }

  @Test
  @DisplayName("publish - sends JSON on the book_updates channel")
  void publish_SendsJson() throws Exception {
    // Act
    publisher.publish(
        NotificationEvent.forUser(NotificationAction.LOW_STOCK_WARNING, "庫存警告：沙丘 庫存不足！", 7L));

    // Assert
    var payload = ArgumentCaptor.forClass(String.class);
    verify(redisTemplate).convertAndSend(eq("book_updates"), payload.capture());
    var json = objectMapper.readTree(payload.getValue());
    assertThat(json.get("type").asText()).isEqualTo("book_update");
    assertThat(json.get("action").asText()).isEqualTo("low_stock_warning");
    assertThat(json.get("message").asText()).isEqualTo("庫存警告：沙丘 庫存不足！");
    assertThat(json.get("user_id").asText()).isEqualTo("7");
  }

  @Test
  @DisplayName("publish - broadcast event omits user_id")
  void publish_Broadcast_OmitsUserId() throws Exception {
    // Act
    publisher.publish(NotificationEvent.broadcast(NotificationAction.CREATE, "新書上架：三體"));

    // Assert
    var payload = ArgumentCaptor.forClass(String.class);
    verify(redisTemplate).convertAndSend(eq("book_updates"), payload.capture());
    assertThat(objectMapper.readTree(payload.getValue()).has("user_id")).isFalse();
  }

  @Test
  @DisplayName("publish - Redis unavailable - failure is contained")
  void publish_RedisDown_DoesNotThrow() {
    // Arrange
    when(redisTemplate.convertAndSend(eq("book_updates"), anyString()))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    // Act & Assert
    assertThatCode(
            () ->
                publisher.publish(
                    NotificationEvent.broadcast(NotificationAction.DELETE, "書籍已下架：三體")))
        .doesNotThrowAnyException();
  }
}

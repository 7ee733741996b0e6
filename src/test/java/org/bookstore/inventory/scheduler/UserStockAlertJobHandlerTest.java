package org.bookstore.inventory.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.bookstore.inventory.service.StockAlertService;
import org.bookstore.inventory.service.dto.StockAlertResult;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserStockAlertJobHandler Unit Tests")
class UserStockAlertJobHandlerTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private StockAlertService stockAlertService;

  @InjectMocks private UserStockAlertJobHandler handler;

  @Test
  @DisplayName("task - matches the registry task identity")
  void task_MatchesRegistry() {
    assertThat(handler.task()).isEqualTo("stock_alert.check_low_stock_for_user");
  }

  @Test
  @DisplayName("execute - user id argument - evaluates for that user")
  void execute_UserId_EvaluatesForUser() throws Exception {
    // Arrange
    when(stockAlertService.evaluate(42L)).thenReturn(StockAlertResult.success(42L, 0, null));

    // Act
    handler.execute(objectMapper.readTree("{\"user_id\":42}"));

    // Assert
    verify(stockAlertService).evaluate(42L);
  }

  @Test
  @DisplayName("execute - user no longer exists - completes quietly")
  void execute_UserGone_Completes() throws Exception {
    // Arrange
    when(stockAlertService.evaluate(42L)).thenReturn(StockAlertResult.userNotFound(42L));

    // Act
    handler.execute(objectMapper.readTree("{\"user_id\":42}"));

    // Assert
    verify(stockAlertService).evaluate(42L);
  }

  @Test
  @DisplayName("execute - missing user id - rejected before evaluation")
  void execute_MissingUserId_Throws() throws Exception {
    var arguments = objectMapper.readTree("{}");

    assertThatThrownBy(() -> handler.execute(arguments))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(stockAlertService);
  }
}

package org.bookstore.inventory.api.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.service.dto.BookDetails;

/** Request DTO for creating or updating a book. */
@Schema(description = "Book fields")
public record BookRequest(
    @Schema(description = "Title", requiredMode = Schema.RequiredMode.REQUIRED, example = "小王子")
        @NotBlank(message = "書名不能為空")
        @Size(max = 200, message = "書名不能超過 200 個字")
        String title,
    @Schema(description = "Price in whole units", requiredMode = Schema.RequiredMode.REQUIRED, example = "250")
        @NotNull(message = "價格必須是正整數")
        @Min(value = 0, message = "價格必須是正整數")
        Integer price,
    @Schema(description = "Units in stock", requiredMode = Schema.RequiredMode.REQUIRED, example = "12")
        @NotNull(message = "庫存必須是正整數")
        @Min(value = 0, message = "庫存必須是正整數")
        Integer stock,
    @Schema(description = "Publisher id", requiredMode = Schema.RequiredMode.REQUIRED, example = "1")
        @NotNull(message = "請選擇出版社")
        Long publisherId) {

  public BookDetails toDetails() {
    return new BookDetails(title, price, stock, publisherId);
  }
}

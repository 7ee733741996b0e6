package org.bookstore.inventory.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

/** Request DTO for creating or updating a publisher. */
@Schema(description = "Publisher fields")
public record PublisherRequest(
    @Schema(description = "Unique name", requiredMode = Schema.RequiredMode.REQUIRED, example = "遠流出版")
        @NotBlank(message = "出版社名稱不能為空")
        @Size(max = 100, message = "出版社名稱不能超過 100 個字")
        String name,
    @Schema(description = "City", requiredMode = Schema.RequiredMode.REQUIRED, example = "台北")
        @NotBlank(message = "城市不能為空")
        @Size(max = 100, message = "城市不能超過 100 個字")
        String city) {}

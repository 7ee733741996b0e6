package org.bookstore.inventory.api.response;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import org.bookstore.inventory.domain.Publisher;
import org.bookstore.inventory.service.dto.PublisherWithBookCount;

/** Response DTO for publisher operations. */
@Schema(description = "Publisher")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublisherResponse(
    @Schema(description = "Unique identifier", example = "1") Long id,
    @Schema(description = "Name", example = "遠流出版") String name,
    @Schema(description = "City", example = "台北") String city,
    @Schema(description = "Number of linked books, present in listings", example = "3")
        Long bookCount,
    @Schema(description = "Creation timestamp") Instant createdAt,
    @Schema(description = "Last update timestamp") Instant updatedAt) {

  public static PublisherResponse from(Publisher publisher) {
    return new PublisherResponse(
        publisher.getId(),
        publisher.getName(),
        publisher.getCity(),
        null,
        publisher.getCreatedAt(),
        publisher.getUpdatedAt());
  }

  public static PublisherResponse from(PublisherWithBookCount row) {
    var publisher = row.publisher();
    return new PublisherResponse(
        publisher.getId(),
        publisher.getName(),
        publisher.getCity(),
        row.bookCount(),
        publisher.getCreatedAt(),
        publisher.getUpdatedAt());
  }
}

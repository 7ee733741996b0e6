package org.bookstore.inventory.api;

import java.util.List;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.bookstore.inventory.api.request.PublisherRequest;
import org.bookstore.inventory.api.response.ApiErrorResponse;
import org.bookstore.inventory.api.response.PublisherResponse;
import org.bookstore.inventory.service.PublisherService;

/** Endpoints for managing publishers. */
@Tag(name = "Publishers", description = "Publisher maintenance")
@RestController
@RequestMapping(path = "/v1/publishers")
public class PublisherController {

  private static final Logger log = LoggerFactory.getLogger(PublisherController.class);

  private final PublisherService publisherService;

  public PublisherController(PublisherService publisherService) {
    this.publisherService = publisherService;
  }

  @Operation(summary = "List publishers", description = "Every publisher with its book count")
  @GetMapping(produces = "application/json")
  public List<PublisherResponse> list() {
    return publisherService.getAllWithBookCount().stream().map(PublisherResponse::from).toList();
  }

  @Operation(summary = "Get publisher by ID")
  @GetMapping(path = "/{id}", produces = "application/json")
  public PublisherResponse getById(@PathVariable("id") Long id) {
    return PublisherResponse.from(publisherService.getById(id));
  }

  @Operation(summary = "Create a publisher")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Publisher created"),
        @ApiResponse(responseCode = "400", description = "Invalid request"),
        @ApiResponse(
            responseCode = "422",
            description = "Name already taken",
            content = @Content(schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<PublisherResponse> create(@Valid @RequestBody PublisherRequest request) {
    log.info("Creating publisher name={}", request.name());
    var created = publisherService.create(request.name(), request.city());

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();
    return ResponseEntity.created(location).body(PublisherResponse.from(created));
  }

  @Operation(summary = "Update a publisher")
  @PutMapping(path = "/{id}", produces = "application/json", consumes = "application/json")
  public PublisherResponse update(
      @PathVariable("id") Long id, @Valid @RequestBody PublisherRequest request) {
    log.info("Updating publisher id={}", id);
    return PublisherResponse.from(publisherService.update(id, request.name(), request.city()));
  }

  @Operation(summary = "Delete a publisher", description = "Refused while books reference it")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Publisher deleted"),
        @ApiResponse(responseCode = "404", description = "Publisher not found"),
        @ApiResponse(
            responseCode = "422",
            description = "Publisher still has books",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples =
                        @ExampleObject(
                            name = "Publisher Has Books",
                            value =
                                """
                                {
                                  "success": false,
                                  "message": "無法刪除！此出版社還有 2 本書籍關聯，請先刪除或轉移這些書籍。",
                                  "code": "PUBLISHER_HAS_BOOKS"
                                }
                                """)))
      })
  @DeleteMapping(path = "/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable("id") Long id) {
    log.info("Deleting publisher id={}", id);
    publisherService.delete(id);
  }
}

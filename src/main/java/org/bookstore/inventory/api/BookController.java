package org.bookstore.inventory.api;

import java.util.List;
import java.util.UUID;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.bookstore.inventory.api.request.BookRequest;
import org.bookstore.inventory.api.response.ApiErrorResponse;
import org.bookstore.inventory.api.response.ApiResult;
import org.bookstore.inventory.api.response.BookListResponse;
import org.bookstore.inventory.api.response.BookResponse;
import org.bookstore.inventory.api.response.ExportAcceptedResponse;
import org.bookstore.inventory.service.BookExportService;
import org.bookstore.inventory.service.BookListingService;
import org.bookstore.inventory.service.BookService;
import org.bookstore.inventory.service.ReadingListService;

/** Endpoints for browsing and maintaining books. */
@Tag(name = "Books", description = "Book listing, maintenance and export")
@RestController
@RequestMapping(path = "/v1/books")
public class BookController {

  private static final Logger log = LoggerFactory.getLogger(BookController.class);

  static final String EXPORT_ACCEPTED_MESSAGE = "報表產生中，完成後會通知您！";

  private final BookService bookService;
  private final BookListingService bookListingService;
  private final ReadingListService readingListService;
  private final BookExportService bookExportService;

  public BookController(
      BookService bookService,
      BookListingService bookListingService,
      ReadingListService readingListService,
      BookExportService bookExportService) {
    this.bookService = bookService;
    this.bookListingService = bookListingService;
    this.readingListService = readingListService;
    this.bookExportService = bookExportService;
  }

  @Operation(
      summary = "List books",
      description =
          "Return every book with its publisher. The book list is cached for a short time and "
              + "refreshed on every book change; the caller's favorites are always read fresh.")
  @GetMapping(produces = "application/json")
  public ApiResult<BookListResponse> list(
      @Parameter(description = "Caller's user id, used to mark favorites")
          @RequestParam(name = "user_id", required = false)
          Long userId) {
    var listing = bookListingService.getListing();
    List<Long> favorites = userId == null ? List.of() : readingListService.getBookIds(userId);
    return ApiResult.of(new BookListResponse(listing.books(), favorites, userId != null));
  }

  @Operation(summary = "Get book by ID")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Book found"),
        @ApiResponse(
            responseCode = "404",
            description = "Book not found",
            content = @Content(schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/{id}", produces = "application/json")
  public BookResponse getById(@PathVariable("id") Long id) {
    return BookResponse.from(bookService.getById(id));
  }

  @Operation(summary = "Create a book", description = "Connected clients are notified.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "201", description = "Book created"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request",
            content = @Content(schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "Publisher not found")
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<BookResponse> create(@Valid @RequestBody BookRequest request) {
    log.info("Creating book title={}", request.title());
    var created = bookService.create(request.toDetails());

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();
    return ResponseEntity.created(location).body(BookResponse.from(created));
  }

  @Operation(summary = "Update a book", description = "Connected clients are notified.")
  @PutMapping(path = "/{id}", produces = "application/json", consumes = "application/json")
  public BookResponse update(@PathVariable("id") Long id, @Valid @RequestBody BookRequest request) {
    log.info("Updating book id={}", id);
    return BookResponse.from(bookService.update(id, request.toDetails()));
  }

  @Operation(summary = "Delete a book", description = "Connected clients are notified.")
  @DeleteMapping(path = "/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable("id") Long id) {
    log.info("Deleting book id={}", id);
    bookService.delete(id);
  }

  @Operation(
      summary = "Export books to CSV",
      description =
          "Start a background export. An export_complete notification names the file when done.")
  @PostMapping(path = "/export", produces = "application/json")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public ApiResult<ExportAcceptedResponse> export(
      @Parameter(description = "User to tag the completion notice with")
          @RequestParam(name = "user_id", required = false)
          Long userId) {
    var taskId = UUID.randomUUID().toString();
    log.info("Queueing book export taskId={} userId={}", taskId, userId);
    bookExportService
        .exportAsync(taskId, userId)
        .whenComplete(
            (result, error) -> {
              if (error != null) {
                log.error("Book export failed taskId={}: {}", taskId, error.getMessage(), error);
              }
            });
    return ApiResult.of(EXPORT_ACCEPTED_MESSAGE, new ExportAcceptedResponse(taskId));
  }
}

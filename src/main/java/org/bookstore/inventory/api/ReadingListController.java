package org.bookstore.inventory.api;

import java.util.List;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.bookstore.inventory.api.response.ApiResult;
import org.bookstore.inventory.api.response.ReadingListChangeResponse;
import org.bookstore.inventory.api.response.ReadingListEntryResponse;
import org.bookstore.inventory.service.ReadingListService;

/** Endpoints for a user's reading list. */
@Tag(name = "Reading List", description = "Books a user has saved")
@RestController
@RequestMapping(path = "/v1/users/{userId}/reading-list")
public class ReadingListController {

  private final ReadingListService readingListService;

  public ReadingListController(ReadingListService readingListService) {
    this.readingListService = readingListService;
  }

  @Operation(summary = "List the reading list", description = "Most recently added first")
  @GetMapping(produces = "application/json")
  public ApiResult<List<ReadingListEntryResponse>> list(@PathVariable("userId") Long userId) {
    return ApiResult.of(
        readingListService.getEntries(userId).stream()
            .map(ReadingListEntryResponse::from)
            .toList());
  }

  @Operation(summary = "Add a book to the reading list")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Book added"),
        @ApiResponse(responseCode = "404", description = "User or book not found"),
        @ApiResponse(responseCode = "422", description = "Book already on the list")
      })
  @PostMapping(path = "/{bookId}", produces = "application/json")
  public ApiResult<ReadingListChangeResponse> add(
      @PathVariable("userId") Long userId, @PathVariable("bookId") Long bookId) {
    var book = readingListService.add(userId, bookId);
    return ApiResult.of(
        "已將《" + book.getTitle() + "》加入最愛！", new ReadingListChangeResponse(bookId));
  }

  @Operation(summary = "Remove a book from the reading list")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Book removed"),
        @ApiResponse(responseCode = "404", description = "User or book not found"),
        @ApiResponse(responseCode = "422", description = "Book not on the list")
      })
  @DeleteMapping(path = "/{bookId}", produces = "application/json")
  public ApiResult<ReadingListChangeResponse> remove(
      @PathVariable("userId") Long userId, @PathVariable("bookId") Long bookId) {
    var book = readingListService.remove(userId, bookId);
    return ApiResult.of(
        "已將《" + book.getTitle() + "》從最愛移除！", new ReadingListChangeResponse(bookId));
  }
}

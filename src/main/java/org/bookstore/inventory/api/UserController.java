package org.bookstore.inventory.api;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.bookstore.inventory.api.request.UserCreateRequest;
import org.bookstore.inventory.api.response.UserResponse;
import org.bookstore.inventory.service.UserService;

/** Endpoints for user accounts. */
@Tag(name = "Users", description = "User accounts")
@RestController
@RequestMapping(path = "/v1/users")
public class UserController {

  private static final Logger log = LoggerFactory.getLogger(UserController.class);

  private final UserService userService;

  public UserController(UserService userService) {
    this.userService = userService;
  }

  @Operation(summary = "Register a user")
  @PostMapping(produces = "application/json", consumes = "application/json")
  @ResponseStatus(HttpStatus.CREATED)
  public ResponseEntity<UserResponse> create(@Valid @RequestBody UserCreateRequest request) {
    log.info("Creating user username={}", request.username());
    var created = userService.create(request.username(), request.email());

    var location =
        ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();
    return ResponseEntity.created(location).body(UserResponse.from(created));
  }

  @Operation(summary = "Get user by ID")
  @GetMapping(path = "/{id}", produces = "application/json")
  public UserResponse getById(@PathVariable("id") Long id) {
    return UserResponse.from(userService.getById(id));
  }

  @Operation(
      summary = "Delete a user",
      description = "Also removes the reading list, preference and stock alert schedule")
  @DeleteMapping(path = "/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable("id") Long id) {
    log.info("Deleting user id={}", id);
    userService.delete(id);
  }
}

package org.bookstore.inventory.service.dto;

import org.bookstore.inventory.domain.Publisher;

/**
 * A publisher and the number of books referencing it.
 *
 * @param publisher the publisher
 * @param bookCount number of linked books
 */
public record PublisherWithBookCount(Publisher publisher, long bookCount) {}

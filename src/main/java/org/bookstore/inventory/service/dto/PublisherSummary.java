package org.bookstore.inventory.service.dto;

/**
 * Publisher fields embedded in book projections.
 *
 * @param id publisher id
 * @param name publisher name
 */
public record PublisherSummary(Long id, String name) {}

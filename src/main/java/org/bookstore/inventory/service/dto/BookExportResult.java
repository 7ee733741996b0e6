package org.bookstore.inventory.service.dto;

/**
 * Outcome of a CSV export.
 *
 * @param taskId id handed to the requester when the export was accepted
 * @param filename name of the written file
 * @param totalBooks number of exported rows
 * @param message summary text
 */
public record BookExportResult(String taskId, String filename, int totalBooks, String message) {}

package org.bookstore.inventory.service;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import org.bookstore.inventory.config.BookstoreServiceProperties;
import org.bookstore.inventory.domain.Book;
import org.bookstore.inventory.notification.NotificationAction;
import org.bookstore.inventory.notification.NotificationEvent;
import org.bookstore.inventory.notification.NotificationPublisher;
import org.bookstore.inventory.repository.BookRepository;
import org.bookstore.inventory.service.dto.BookExportResult;
import org.bookstore.inventory.service.exception.ServiceException;

/**
 * Writes every book to a CSV file in the background and announces the file when it is done.
 *
 * <p>Files are named {@code books_export_<yyyyMMdd_HHmmss>.csv}, start with a UTF-8 byte order mark
 * so spreadsheet tools detect the encoding, and carry the columns {@code ID, 書名, 價格, 庫存, 出版社}.
 * Books without a publisher show {@code 無}.
 */
@Service
public class BookExportService {

  private static final Logger log = LoggerFactory.getLogger(BookExportService.class);

  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
  private static final String NO_PUBLISHER = "無";
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final BookRepository bookRepository;
  private final NotificationPublisher notificationPublisher;
  private final BookstoreServiceProperties properties;
  private final Clock clock;
  private final CsvMapper csvMapper = new CsvMapper();

  public BookExportService(
      BookRepository bookRepository,
      NotificationPublisher notificationPublisher,
      BookstoreServiceProperties properties,
      Clock clock) {
    this.bookRepository = bookRepository;
    this.notificationPublisher = notificationPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Export asynchronously on the application task executor.
   *
   * @param taskId id returned to the requester
   * @param userId user to tag the completion notice with, may be null
   * @return the export result once the file is written
   */
  @Async
  public CompletableFuture<BookExportResult> exportAsync(String taskId, Long userId) {
    return CompletableFuture.completedFuture(export(taskId, userId));
  }

  /**
   * Export synchronously.
   *
   * @param taskId id returned to the requester
   * @param userId user to tag the completion notice with, may be null
   * @return the export result
   * @throws ServiceException if the file can not be written
   */
  public BookExportResult export(String taskId, Long userId) {
    log.info("Starting book export taskId={} userId={}", taskId, userId);

    var books = bookRepository.findAllWithPublisher();
    var filename = "books_export_" + LocalDateTime.now(clock).format(TIMESTAMP) + ".csv";
    var file = Path.of(properties.getExport().getDirectory()).resolve(filename);

    try {
      Files.createDirectories(file.getParent());
      writeCsv(file, books);
    } catch (IOException e) {
      throw new ServiceException("Failed to write export file " + file, e);
    }

    log.info("Finished book export taskId={} file={} books={}", taskId, file, books.size());

    notificationPublisher.publish(
        NotificationEvent.forUser(
            NotificationAction.EXPORT_COMPLETE, "報表匯出完成！檔案：" + filename, userId));

    return new BookExportResult(
        taskId, filename, books.size(), "成功匯出 " + books.size() + " 本書籍");
  }

  private void writeCsv(Path file, List<Book> books) throws IOException {
    CsvSchema schema = csvMapper.schemaFor(ExportRow.class).withHeader();
    try (var writer = new OutputStreamWriter(Files.newOutputStream(file), StandardCharsets.UTF_8)) {
      writer.write(BYTE_ORDER_MARK);
      try (var rows = csvMapper.writer(schema).writeValues(writer)) {
        for (var book : books) {
          rows.write(ExportRow.from(book));
        }
      }
    }
  }

  @JsonPropertyOrder({"ID", "書名", "價格", "庫存", "出版社"})
  record ExportRow(
      @JsonProperty("ID") Long id,
      @JsonProperty("書名") String title,
      @JsonProperty("價格") int price,
      @JsonProperty("庫存") int stock,
      @JsonProperty("出版社") String publisher) {

    static ExportRow from(Book book) {
      var publisher = book.getPublisher();
      return new ExportRow(
          book.getId(),
          book.getTitle(),
          book.getPrice(),
          book.getStock(),
          publisher == null ? NO_PUBLISHER : publisher.getName());
    }
  }
}

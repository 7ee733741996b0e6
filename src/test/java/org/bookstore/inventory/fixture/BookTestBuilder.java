package org.bookstore.inventory.fixture;

import org.bookstore.inventory.domain.Book;
import org.bookstore.inventory.domain.Publisher;

/**
 * Fluent builder for {@link Book} test data.
 *
 * <p><b>Defaults:</b> title {@value TestConstants#BOOK_TITLE}, price {@value
 * TestConstants#BOOK_PRICE}, stock {@value TestConstants#WELL_STOCKED}, no publisher, no id.
 *
 * <pre>{@code
 * Book lowStock = new BookTestBuilder().withTitle("沙丘").withStock(1).withPublisher(p).build();
 * }</pre>
 */
public class BookTestBuilder {

  private Long id;
  private String title = TestConstants.BOOK_TITLE;
  private int price = TestConstants.BOOK_PRICE;
  private int stock = TestConstants.WELL_STOCKED;
  private Publisher publisher;

  public BookTestBuilder withId(Long id) {
    this.id = id;
    return this;
  }

  public BookTestBuilder withTitle(String title) {
    this.title = title;
    return this;
  }

  public BookTestBuilder withPrice(int price) {
    this.price = price;
    return this;
  }

  public BookTestBuilder withStock(int stock) {
    this.stock = stock;
    return this;
  }

  public BookTestBuilder withPublisher(Publisher publisher) {
    this.publisher = publisher;
    return this;
  }

  public Book build() {
    var book = new Book();
    book.setId(id);
    book.setTitle(title);
    book.setPrice(price);
    book.setStock(stock);
    book.setPublisher(publisher);
    return book;
  }
}

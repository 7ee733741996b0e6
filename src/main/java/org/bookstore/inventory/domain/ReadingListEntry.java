package org.bookstore.inventory.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/** A book a user has saved to their reading list. A book appears at most once per user. */
@Entity
@Table(
    name = "reading_list_entry",
    uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "book_id"}))
public class ReadingListEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "user_id", nullable = false)
  private UserAccount user;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "book_id", nullable = false)
  private Book book;

  @Column(name = "added_date", nullable = false, updatable = false)
  private Instant addedDate;

  protected ReadingListEntry() {}

  public ReadingListEntry(UserAccount user, Book book) {
    this.user = user;
    this.book = book;
  }

  @PrePersist
  void onCreate() {
    if (addedDate == null) {
      addedDate = Instant.now();
    }
  }

  public Long getId() {
    return id;
  }

  public UserAccount getUser() {
    return user;
  }

  public Book getBook() {
    return book;
  }

  public Instant getAddedDate() {
    return addedDate;
  }
}

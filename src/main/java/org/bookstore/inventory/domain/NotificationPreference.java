package org.bookstore.inventory.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

/**
 * Per-user notification settings. Exactly one row exists per user once it has been read.
 *
 * <p>The stock-alert schedule registered for the user always follows {@link #getFrequency()}.
 * Only {@link org.bookstore.inventory.service.NotificationPreferenceService} writes this entity.
 */
@Entity
@Table(name = "notification_preference")
public class NotificationPreference extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @OneToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "user_id", nullable = false, unique = true)
  private UserAccount user;

  @Enumerated(EnumType.STRING)
  @Column(name = "stock_alert_frequency", nullable = false, length = 20)
  private NotificationFrequency frequency = NotificationFrequency.DAILY;

  @Column(name = "email_notification", nullable = false)
  private boolean emailEnabled = true;

  @Column(name = "browser_notification", nullable = false)
  private boolean browserEnabled = true;

  protected NotificationPreference() {}

  public NotificationPreference(UserAccount user) {
    this.user = user;
  }

  public Long getId() {
    return id;
  }

  public UserAccount getUser() {
    return user;
  }

  public NotificationFrequency getFrequency() {
    return frequency;
  }

  public void setFrequency(NotificationFrequency frequency) {
    this.frequency = frequency;
  }

  public boolean isEmailEnabled() {
    return emailEnabled;
  }

  public void setEmailEnabled(boolean emailEnabled) {
    this.emailEnabled = emailEnabled;
  }

  public boolean isBrowserEnabled() {
    return browserEnabled;
  }

  public void setBrowserEnabled(boolean browserEnabled) {
    this.browserEnabled = browserEnabled;
  }
}

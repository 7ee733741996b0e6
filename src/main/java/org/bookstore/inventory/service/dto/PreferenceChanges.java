package org.bookstore.inventory.service.dto;

import org.bookstore.inventory.domain.NotificationFrequency;

/**
 * Fields supplied in a preference update. A null component means "leave unchanged".
 *
 * @param frequency new stock alert frequency
 * @param emailEnabled new email channel flag
 * @param browserEnabled new browser channel flag
 */
public record PreferenceChanges(
    NotificationFrequency frequency, Boolean emailEnabled, Boolean browserEnabled) {

  public static PreferenceChanges frequency(NotificationFrequency frequency) {
    return new PreferenceChanges(frequency, null, null);
  }
}

package org.bookstore.inventory.domain.event;

/**
 * Published when a registry entry is created, modified or removed.
 *
 * <p>Listeners act on it after the surrounding transaction commits, so a rolled-back
 * reconciliation never re-arms a trigger.
 *
 * @param jobName unique name of the affected registry entry
 */
public record ScheduledJobChangedEvent(String jobName) {}

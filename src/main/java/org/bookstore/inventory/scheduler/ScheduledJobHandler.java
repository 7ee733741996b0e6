package org.bookstore.inventory.scheduler;

import com.fasterxml.jackson.databind.JsonNode;

/** Body of a registry job, selected by the job's task identity. */
public interface ScheduledJobHandler {

  /**
   * Task identity this handler serves, matched against {@code ScheduledJob#getTask()}.
   *
   * @return the task identity
   */
  String task();

  /**
   * Run one firing.
   *
   * @param arguments the job's JSON arguments
   */
  void execute(JsonNode arguments);
}

package com.telegram.geolocation.pipeline;

import java.util.Optional;

import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.MessageRecord;

/**
 * One self-contained extraction method in the geolocation cascade.
 *
 * <p>Implementations must be stateless with respect to messages: everything they learn about a
 * message goes into the returned result and the shared {@link AttemptLog}.
 */
public interface GeolocationStrategy {

  /**
   * Gets the name of this strategy for logging and metrics.
   *
   * @return strategy name, e.g. "coordinates"
   */
  String getName();

  /**
   * Gets the position of this strategy in the cascade. Lower values run first.
   *
   * @return the strategy priority
   */
  int getPriority();

  /**
   * Tries to locate the message.
   *
   * <p>Implementations append at least one entry to {@code attempts}, whether or not they produce
   * a result. An accepted result carries a snapshot of the log including that entry.
   *
   * @param message the message being processed
   * @param attempts the message's attempts trail so far
   * @return an accepted result, or empty to let the next strategy run
   */
  Optional<GeolocationResult> attempt(MessageRecord message, AttemptLog attempts);
}

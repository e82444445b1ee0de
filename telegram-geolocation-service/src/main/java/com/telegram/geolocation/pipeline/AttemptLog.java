package com.telegram.geolocation.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only diagnostic trail built while one message moves through the strategy cascade.
 *
 * <p>A fresh log is created per message and handed to every strategy in turn. Entries are never
 * removed or rewritten.
 */
public final class AttemptLog {

  private final List<String> entries = new ArrayList<>();

  public AttemptLog record(String entry) {
    entries.add(entry);
    return this;
  }

  public AttemptLog recordAll(List<String> more) {
    entries.addAll(more);
    return this;
  }

  public List<String> snapshot() {
    return List.copyOf(entries);
  }

  public List<String> entries() {
    return Collections.unmodifiableList(entries);
  }
}

package com.mk.fx.qa.dicom.load.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A submitted run: its id, submission time and the raw option map it was submitted with. */
public class LoadRun {

  private final UUID id;
  private final Instant createdAt;
  private final Map<String, Object> options;

  public LoadRun(UUID id, Instant createdAt, Map<String, Object> options) {
    this.id = id;
    this.createdAt = createdAt;
    this.options = options == null ? Map.of() : Map.copyOf(options);
  }

  public UUID getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Map<String, Object> getOptions() {
    return options;
  }
}

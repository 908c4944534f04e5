package com.github.simbo1905.pingstore;

import com.google.gson.JsonObject;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/// One persisted record: a JSON payload to be delivered to a server path, identified by a
/// caller-assigned, non-negative, monotonically increasing id.
///
/// Immutable. The payload is deep-copied on the way in and on the way out so that callers
/// cannot mutate a ping after it has been handed to the store.
@EqualsAndHashCode
@ToString
public final class Ping {

  @Getter private final long id;

  /// The server URL path the payload is uploaded to.
  @Getter private final String destination;

  private final JsonObject payload;

  public Ping(long id, String destination, JsonObject payload) {
    if (id < 0) {
      throw new IllegalArgumentException("id must be non-negative, got " + id);
    }
    Objects.requireNonNull(destination, "destination");
    if (destination.isEmpty()) {
      throw new IllegalArgumentException("destination must not be empty");
    }
    Objects.requireNonNull(payload, "payload");
    this.id = id;
    this.destination = destination;
    this.payload = payload.deepCopy();
  }

  public JsonObject getPayload() {
    return payload.deepCopy();
  }
}

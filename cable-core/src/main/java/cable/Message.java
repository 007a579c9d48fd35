package cable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A published message as delivered to a {@link MessageHandler}.
 *
 * <p>{@code id} is assigned by the store and is the only total order between messages.
 * {@code payload} is opaque to the bus. {@code metadata} is never {@code null} and is not
 * used for routing.
 *
 * @param id        store-assigned, monotonically increasing id
 * @param channel   channel the message was published on ({@code "*"} for broadcasts)
 * @param payload   serialized payload
 * @param metadata  immutable metadata map, possibly empty
 * @param createdAt time the publisher wrote the message
 */
public record Message(
    long id,
    String channel,
    String payload,
    Map<String, String> metadata,
    Instant createdAt
) {
  public Message {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Returns {@code true} if this message was published with {@link SolidCable#broadcast}.
   *
   * @return whether the message targets every subscription
   */
  public boolean isBroadcast() {
    return SolidCable.WILDCARD.equals(channel);
  }
}

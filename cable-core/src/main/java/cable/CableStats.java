package cable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot returned by {@link SolidCable#getStats()}.
 *
 * @param totalSubscriptions number of registered subscriptions
 * @param totalChannels      number of channels with at least one subscription
 * @param channels           subscriptions per channel
 * @param totalMessages      messages currently stored
 * @param lastMessageId      poller cursor: id of the last message read from the store
 * @param storeSizeBytes     space used by the message log, or {@code -1} if unknown
 */
public record CableStats(
    int totalSubscriptions,
    int totalChannels,
    Map<String, Integer> channels,
    long totalMessages,
    long lastMessageId,
    long storeSizeBytes
) {
  public CableStats {
    channels = channels == null
        ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(channels));
  }

  /**
   * Returns the store size in MiB, or {@code -1} if unknown.
   *
   * @return size in mebibytes
   */
  public double storeSizeMb() {
    return storeSizeBytes < 0 ? -1 : storeSizeBytes / (1024.0 * 1024.0);
  }
}

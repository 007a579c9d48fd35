package cable.model;

import java.time.Instant;

/**
 * Raw message row as read back from a {@link cable.spi.MessageStore}. Metadata is still
 * JSON text; the poller decodes it into a {@link cable.Message}.
 *
 * @see cable.spi.MessageStore#querySince
 */
public record MessageRecord(
    long id,
    String channel,
    String payload,
    String metadataJson,
    Instant createdAt
) {}

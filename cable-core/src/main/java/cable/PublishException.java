package cable;

/**
 * Thrown when the store rejects or fails a publish. The message was not written.
 */
public class PublishException extends CableException {

    private final String channel;

    public PublishException(String channel, Throwable cause) {
        super("Failed to publish message to channel '" + channel + "'", cause);
        this.channel = channel;
    }

    /**
     * Returns the channel the failed publish targeted.
     *
     * @return the channel name
     */
    public String channel() {
        return channel;
    }
}

package cable.poller;

import cable.Message;

import java.util.List;

/**
 * Receives each non-empty batch read by the {@link MessagePoller}.
 *
 * @see cable.dispatch.MessageDispatcher
 */
@FunctionalInterface
public interface MessagePollerHandler {

    /**
     * Handles a polled batch. Must not block on slow consumers.
     *
     * @param batch messages ordered by id ascending, never empty
     */
    void onBatch(List<Message> batch);
}

package cable;

/**
 * Callback invoked by a subscription's delivery worker for every message it receives.
 *
 * <p>Handlers run on the subscription's own worker thread, one message at a time and in id
 * order. A slow handler only fills its own queue; once that queue is full, further messages
 * for the subscription are dropped.
 *
 * <p>Exceptions thrown here are logged and counted, then the worker moves on to the next
 * message. Failed messages are never retried.
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * Handles one message.
   *
   * @param message the delivered message
   * @throws Exception to signal a failure; the message is not redelivered
   */
  void onMessage(Message message) throws Exception;
}

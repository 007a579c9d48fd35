/**
 * Cursor-based reader of the message log.
 *
 * <p>{@link cable.poller.MessagePoller} is the only component that advances the read cursor.
 *
 * @see cable.poller.MessagePoller
 * @see cable.poller.MessagePollerHandler
 */
package cable.poller;

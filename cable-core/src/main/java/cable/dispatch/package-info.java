/**
 * Fan-out of polled messages to per-subscription queues and the workers that drain them.
 *
 * <p>Every subscription gets its own bounded queue and its own daemon thread, so a slow or
 * failing handler only affects itself.
 *
 * @see cable.dispatch.MessageDispatcher
 */
package cable.dispatch;

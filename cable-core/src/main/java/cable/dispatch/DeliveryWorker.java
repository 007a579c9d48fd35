package cable.dispatch;

import cable.Message;
import cable.Subscription;
import cable.spi.MetricsExporter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains one subscription's queue into its handler on a dedicated thread.
 *
 * <p>Runs until the subscription leaves {@code ACTIVE} or the thread is interrupted, then
 * marks the subscription {@code CLOSED}. Handler failures, errors included, never end the loop.
 */
final class DeliveryWorker implements Runnable {
  private static final Logger logger = Logger.getLogger(DeliveryWorker.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final Subscription subscription;
  private final MetricsExporter metrics;

  DeliveryWorker(Subscription subscription, MetricsExporter metrics) {
    this.subscription = subscription;
    this.metrics = metrics;
  }

  @Override
  public void run() {
    try {
      while (subscription.isActive() && !Thread.currentThread().isInterrupted()) {
        Message message = subscription.poll(QUEUE_POLL_TIMEOUT_MS);
        if (message == null || !subscription.isActive()) {
          continue;
        }
        deliver(message);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      subscription.markClosed();
      logger.log(Level.FINE, "Delivery worker stopped for {0}", subscription.id());
    }
  }

  private void deliver(Message message) {
    try {
      subscription.handler().onMessage(message);
      metrics.incrementDelivered();
    } catch (InterruptedException e) {
      // shutdown interrupted the handler; the loop exits on the restored flag
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      metrics.incrementHandlerFailure();
      logger.log(Level.WARNING, "Handler failed for subscription " + subscription.id()
          + " on message id=" + message.id(), e);
    } catch (Throwable t) {
      metrics.incrementHandlerFailure();
      logger.log(Level.SEVERE, "Handler error for subscription " + subscription.id()
          + " on message id=" + message.id(), t);
    }
  }
}

package cable.registry;

import cable.Subscription;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Tracks active subscriptions by channel.
 *
 * <p>The dispatcher asks the registry which subscriptions should receive a message; the bus
 * mutates it on subscribe, unsubscribe and shutdown.
 *
 * @see DefaultSubscriptionRegistry
 */
public interface SubscriptionRegistry {

  /** Channel name that receives every message and whose messages reach every subscription. */
  String WILDCARD = "*";

  /**
   * Registers a subscription under its channel.
   *
   * @param subscription the subscription to add
   * @throws IllegalArgumentException if a subscription with the same id is already registered
   */
  void add(Subscription subscription);

  /**
   * Removes a subscription, deleting its channel bucket once empty.
   *
   * @param subscription the subscription to remove
   * @return {@code true} if the subscription was registered
   */
  boolean remove(Subscription subscription);

  /**
   * Returns the subscriptions that should receive a message published on {@code channel}.
   *
   * <p>The result holds the exact-channel subscriptions followed by the wildcard ones. For
   * {@link #WILDCARD} it holds every registered subscription. No subscription appears twice.
   *
   * @param channel the channel the message was published on
   * @return an immutable snapshot, possibly empty
   */
  List<Subscription> subscribersFor(String channel);

  /**
   * Returns {@code true} if at least one subscription is registered on {@code channel}.
   *
   * @param channel channel name
   * @return whether the channel has subscribers
   */
  boolean channelExists(String channel);

  /**
   * Returns the channels that currently have subscribers, in first-subscribed order.
   *
   * @return immutable snapshot of channel names
   */
  List<String> channels();

  /**
   * Returns the number of subscriptions registered on {@code channel}.
   *
   * @param channel channel name
   * @return subscription count, {@code 0} for unknown channels
   */
  int subscriptionCount(String channel);

  /**
   * Returns the total number of registered subscriptions.
   *
   * @return subscription count across all channels
   */
  int totalSubscriptions();

  /**
   * Returns per-channel subscription counts.
   *
   * @return immutable map of channel to subscription count
   */
  Map<String, Integer> channelCounts();

  /**
   * Removes every subscription and returns what was registered.
   *
   * @return the removed subscriptions
   */
  Collection<Subscription> removeAll();
}

package cable.registry;

import cable.Subscription;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe {@link SubscriptionRegistry} backed by two maps guarded by one read/write lock.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubscriptionRegistry registry = new DefaultSubscriptionRegistry();
 * registry.add(new Subscription("orders", handler, 100));
 * registry.add(new Subscription("*", auditHandler, 100));
 *
 * registry.subscribersFor("orders"); // orders subscription, then the wildcard one
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Lookups take the read lock and return snapshots, so the dispatcher never iterates a map
 * that a concurrent subscribe is changing. Mutations take the write lock.
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Map<String, Subscription>> channels = new LinkedHashMap<>();
  private final Map<String, Subscription> subscriptions = new HashMap<>();

  @Override
  public void add(Subscription subscription) {
    lock.writeLock().lock();
    try {
      if (subscriptions.putIfAbsent(subscription.id(), subscription) != null) {
        throw new IllegalArgumentException("Duplicate subscription id: " + subscription.id());
      }
      channels.computeIfAbsent(subscription.channel(), ignored -> new LinkedHashMap<>())
          .put(subscription.id(), subscription);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public boolean remove(Subscription subscription) {
    lock.writeLock().lock();
    try {
      if (subscriptions.remove(subscription.id()) == null) {
        return false;
      }
      Map<String, Subscription> bucket = channels.get(subscription.channel());
      if (bucket != null) {
        bucket.remove(subscription.id());
        if (bucket.isEmpty()) {
          channels.remove(subscription.channel());
        }
      }
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Subscription> subscribersFor(String channel) {
    lock.readLock().lock();
    try {
      if (WILDCARD.equals(channel)) {
        List<Subscription> all = new ArrayList<>(subscriptions.size());
        for (Map<String, Subscription> bucket : channels.values()) {
          all.addAll(bucket.values());
        }
        return Collections.unmodifiableList(all);
      }
      List<Subscription> result = new ArrayList<>();
      Map<String, Subscription> exact = channels.get(channel);
      if (exact != null) {
        result.addAll(exact.values());
      }
      Map<String, Subscription> wildcard = channels.get(WILDCARD);
      if (wildcard != null) {
        result.addAll(wildcard.values());
      }
      return Collections.unmodifiableList(result);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public boolean channelExists(String channel) {
    lock.readLock().lock();
    try {
      Map<String, Subscription> bucket = channels.get(channel);
      return bucket != null && !bucket.isEmpty();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<String> channels() {
    lock.readLock().lock();
    try {
      return List.copyOf(channels.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int subscriptionCount(String channel) {
    lock.readLock().lock();
    try {
      Map<String, Subscription> bucket = channels.get(channel);
      return bucket == null ? 0 : bucket.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int totalSubscriptions() {
    lock.readLock().lock();
    try {
      return subscriptions.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Map<String, Integer> channelCounts() {
    lock.readLock().lock();
    try {
      Map<String, Integer> counts = new LinkedHashMap<>();
      channels.forEach((channel, bucket) -> counts.put(channel, bucket.size()));
      return Collections.unmodifiableMap(counts);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Collection<Subscription> removeAll() {
    lock.writeLock().lock();
    try {
      List<Subscription> removed = new ArrayList<>(subscriptions.values());
      subscriptions.clear();
      channels.clear();
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }
}

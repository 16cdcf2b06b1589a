package net.jodah.tether.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks calls awaiting a reply, keyed by a correlation key. Each call completes at most once:
 * whichever of complete, fail or cancel removes the key first settles the call, and later attempts
 * for the same key are no-ops.
 *
 * @param <K> key type
 * @param <V> result type
 */
public class PendingCalls<K, V> {
  private final ConcurrentMap<K, CompletableFuture<V>> calls = new ConcurrentHashMap<K, CompletableFuture<V>>();

  /**
   * Registers a call for the {@code key}, returning the future that will receive its result.
   *
   * @throws IllegalStateException if a call is already pending for the {@code key}
   */
  public CompletableFuture<V> register(K key) {
    CompletableFuture<V> future = new CompletableFuture<V>();
    if (calls.putIfAbsent(key, future) != null)
      throw new IllegalStateException("A call is already pending for " + key);
    return future;
  }

  /**
   * Completes the call for the {@code key}, returning false if it was not pending.
   */
  public boolean complete(K key, V value) {
    CompletableFuture<V> future = calls.remove(key);
    return future != null && future.complete(value);
  }

  /**
   * Fails the call for the {@code key}, returning false if it was not pending.
   */
  public boolean fail(K key, Throwable failure) {
    CompletableFuture<V> future = calls.remove(key);
    return future != null && future.completeExceptionally(failure);
  }

  /**
   * Abandons the call for the {@code key} without settling it, returning false if it was not
   * pending.
   */
  public boolean cancel(K key) {
    CompletableFuture<V> future = calls.remove(key);
    return future != null && future.cancel(false);
  }

  /**
   * Fails every pending call with the {@code failure}.
   */
  public void failAll(Throwable failure) {
    for (K key : keys())
      fail(key, failure);
  }

  public boolean isPending(K key) {
    return calls.containsKey(key);
  }

  /**
   * Returns a snapshot of the pending keys.
   */
  public List<K> keys() {
    return new ArrayList<K>(calls.keySet());
  }

  public int size() {
    return calls.size();
  }
}

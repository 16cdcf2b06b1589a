package net.jodah.tether.internal;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Records what must be restored on a fresh channel after recovery. Entries are keyed by the
 * caller-level identity of what they restore, so re-recording the same key replaces the entry in
 * place. Entries are replayed grouped by phase, and in recorded order within a phase.
 *
 * @param <T> the type of channel entries are restored on
 */
public class RestorationLedger<T> {
  private final Map<Object, Entry<T>> entries = new LinkedHashMap<Object, Entry<T>>();

  /**
   * Replay phases, in the order they are restored.
   */
  public enum Phase {
    DECLARATION, BINDING, QOS, CONSUMER
  }

  /**
   * Something to restore on a fresh channel.
   *
   * @param <T> channel type
   */
  public interface Entry<T> {
    Phase getPhase();

    /**
     * Restores the entry on the {@code channel}.
     */
    void restore(T channel) throws IOException;

    /**
     * Returns whether the entry can no longer be restored once the {@code entity} is deleted.
     */
    boolean dependsOn(Object entity);
  }

  private static final Comparator<Entry<?>> PHASE_ORDER = new Comparator<Entry<?>>() {
    @Override
    public int compare(Entry<?> a, Entry<?> b) {
      return a.getPhase().compareTo(b.getPhase());
    }
  };

  public synchronized boolean contains(Object key) {
    return entries.containsKey(key);
  }

  /**
   * Returns a snapshot of the entries in replay order.
   */
  public synchronized List<Entry<T>> entries() {
    List<Entry<T>> result = new ArrayList<Entry<T>>(entries.values());
    Collections.sort(result, PHASE_ORDER);
    return result;
  }

  public synchronized Entry<T> get(Object key) {
    return entries.get(key);
  }

  /**
   * Returns a snapshot of the keys in recorded order.
   */
  public synchronized List<Object> keys() {
    return new ArrayList<Object>(entries.keySet());
  }

  /**
   * Records the {@code entry} under the {@code key}. An entry already recorded for the key is
   * replaced without changing its position.
   */
  public synchronized void record(Object key, Entry<T> entry) {
    entries.put(key, entry);
  }

  /**
   * Removes the entry for the {@code key}, returning it, or null if there was none.
   */
  public synchronized Entry<T> remove(Object key) {
    return entries.remove(key);
  }

  /**
   * Removes every entry that depends on the {@code entity}, returning how many were removed.
   */
  public synchronized int removeDependents(Object entity) {
    int removed = 0;
    for (Iterator<Entry<T>> it = entries.values().iterator(); it.hasNext();)
      if (it.next().dependsOn(entity)) {
        it.remove();
        removed++;
      }
    return removed;
  }

  public synchronized int size() {
    return entries.size();
  }

  @Override
  public synchronized String toString() {
    return entries.values().toString();
  }
}

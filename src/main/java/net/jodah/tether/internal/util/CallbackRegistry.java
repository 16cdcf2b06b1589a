package net.jodah.tether.internal.util;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A thread-safe, ordered collection of callbacks. Callbacks may be held strongly or weakly. Weakly
 * held callbacks are dropped once their referent has been garbage collected.
 *
 * @param <T> callback type
 */
public class CallbackRegistry<T> {
  private final List<Entry<T>> entries = new CopyOnWriteArrayList<Entry<T>>();

  private static class Entry<T> {
    private final T strong;
    private final WeakReference<T> weak;

    Entry(T callback, boolean weak) {
      this.strong = weak ? null : callback;
      this.weak = weak ? new WeakReference<T>(callback) : null;
    }

    T get() {
      return weak == null ? strong : weak.get();
    }
  }

  /**
   * Adds a strongly held {@code callback}.
   */
  public void add(T callback) {
    add(callback, false);
  }

  /**
   * Adds the {@code callback}, holding it weakly if {@code weak} is true.
   *
   * @throws NullPointerException if {@code callback} is null
   */
  public void add(T callback, boolean weak) {
    Assert.notNull(callback, "callback");
    entries.add(new Entry<T>(callback, weak));
  }

  /**
   * Removes the first registration of the {@code callback}, returning true if one was found.
   */
  public boolean remove(T callback) {
    for (Entry<T> entry : entries) {
      T existing = entry.get();
      if (existing == null)
        entries.remove(entry);
      else if (existing.equals(callback))
        return entries.remove(entry);
    }

    return false;
  }

  /**
   * Returns the live callbacks in registration order, dropping any that have been collected.
   */
  public List<T> snapshot() {
    List<T> result = new ArrayList<T>(entries.size());
    for (Entry<T> entry : entries) {
      T callback = entry.get();
      if (callback == null)
        entries.remove(entry);
      else
        result.add(callback);
    }

    return result;
  }

  public int size() {
    return snapshot().size();
  }
}

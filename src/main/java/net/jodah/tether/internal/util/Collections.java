package net.jodah.tether.internal.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Collections {
  private Collections() {
  }

  public static <K, V> Map<K, V> synchronizedLinkedMap() {
    return java.util.Collections.<K, V>synchronizedMap(new LinkedHashMap<K, V>());
  }

  /**
   * Returns a copy of the {@code map}'s values, taken while holding the map's monitor.
   */
  public static <K, V> List<V> snapshot(Map<K, V> map) {
    synchronized (map) {
      return new ArrayList<V>(map.values());
    }
  }
}

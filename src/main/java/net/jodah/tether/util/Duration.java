package net.jodah.tether.util;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.jodah.tether.internal.util.Assert;

/**
 * Duration unit, consisting of length and time unit.
 */
public class Duration implements Serializable {
  private static final long serialVersionUID = -3171524470815633497L;
  /** A duration of Long.MAX_VALUE Days */
  public static final Duration INFINITE = new Duration();
  private static final Pattern PATTERN = Pattern.compile("(\\d+)\\s*(ns|ms|s|m|h|d|nanos|millis|"
      + "seconds?|minutes?|hours?|days?)?");
  private static final Map<String, TimeUnit> SUFFIXES = new HashMap<String, TimeUnit>();

  public final long length;
  public final TimeUnit timeUnit;
  public final boolean finite;

  static {
    SUFFIXES.put("ns", TimeUnit.NANOSECONDS);
    SUFFIXES.put("nanos", TimeUnit.NANOSECONDS);
    SUFFIXES.put("ms", TimeUnit.MILLISECONDS);
    SUFFIXES.put("millis", TimeUnit.MILLISECONDS);
    SUFFIXES.put("s", TimeUnit.SECONDS);
    SUFFIXES.put("second", TimeUnit.SECONDS);
    SUFFIXES.put("seconds", TimeUnit.SECONDS);
    SUFFIXES.put("m", TimeUnit.MINUTES);
    SUFFIXES.put("minute", TimeUnit.MINUTES);
    SUFFIXES.put("minutes", TimeUnit.MINUTES);
    SUFFIXES.put("h", TimeUnit.HOURS);
    SUFFIXES.put("hour", TimeUnit.HOURS);
    SUFFIXES.put("hours", TimeUnit.HOURS);
    SUFFIXES.put("d", TimeUnit.DAYS);
    SUFFIXES.put("day", TimeUnit.DAYS);
    SUFFIXES.put("days", TimeUnit.DAYS);
  }

  /** Infinite constructor. */
  private Duration() {
    finite = false;
    this.length = Long.MAX_VALUE;
    this.timeUnit = TimeUnit.DAYS;
  }

  private Duration(long length, TimeUnit timeUnit) {
    Assert.isTrue(length >= 0, "length must be >= 0");
    this.length = length;
    this.timeUnit = Assert.notNull(timeUnit, "timeUnit");
    finite = !(length == Long.MAX_VALUE && TimeUnit.DAYS.equals(timeUnit));
  }

  public static Duration days(long count) {
    return new Duration(count, TimeUnit.DAYS);
  }

  public static Duration hours(long count) {
    return new Duration(count, TimeUnit.HOURS);
  }

  public static Duration inf() {
    return INFINITE;
  }

  public static Duration millis(long count) {
    return new Duration(count, TimeUnit.MILLISECONDS);
  }

  public static Duration mins(long count) {
    return new Duration(count, TimeUnit.MINUTES);
  }

  public static Duration nanos(long count) {
    return new Duration(count, TimeUnit.NANOSECONDS);
  }

  public static Duration seconds(long count) {
    return new Duration(count, TimeUnit.SECONDS);
  }

  /**
   * Returns a Duration of {@code seconds}, which may be fractional such as {@code 0.5}. The result
   * is truncated to millisecond precision.
   *
   * @throws IllegalArgumentException if {@code seconds} is negative or not a number
   */
  public static Duration seconds(double seconds) {
    Assert.isTrue(!Double.isNaN(seconds) && seconds >= 0, "seconds must be >= 0");
    if (Double.isInfinite(seconds))
      return INFINITE;
    return millis((long) (seconds * 1000));
  }

  /**
   * Parses a duration string such as {@code "5 seconds"}, {@code "250ms"}, {@code "1.5"} (seconds)
   * or {@code "inf"}.
   *
   * @throws NullPointerException if {@code duration} is null
   * @throws IllegalArgumentException if {@code duration} cannot be parsed
   */
  public static Duration of(String duration) {
    Assert.notNull(duration, "duration");
    String value = duration.trim().toLowerCase();
    if ("inf".equals(value) || "infinite".equals(value) || "∞".equals(value))
      return INFINITE;

    Matcher matcher = PATTERN.matcher(value);
    if (matcher.matches()) {
      TimeUnit unit = matcher.group(2) == null ? TimeUnit.SECONDS : SUFFIXES.get(matcher.group(2));
      return new Duration(Long.parseLong(matcher.group(1)), unit);
    }

    try {
      return seconds(Double.parseDouble(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration: " + duration);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if ((obj == null) || (getClass() != obj.getClass()))
      return false;
    final Duration duration = (Duration) obj;
    return toNanos() == duration.toNanos() && finite == duration.finite;
  }

  @Override
  public int hashCode() {
    return Long.valueOf(toNanos()).hashCode();
  }

  public long toMillis() {
    return timeUnit.toMillis(length);
  }

  public long toSeconds() {
    return timeUnit.toSeconds(length);
  }

  public long toNanos() {
    return timeUnit.toNanos(length);
  }

  @Override
  public String toString() {
    if (!finite)
      return "infinite";
    return length + " " + timeUnit.name().toLowerCase();
  }
}

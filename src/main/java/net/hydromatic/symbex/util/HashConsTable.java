/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.symbex.util;

import static java.util.Objects.requireNonNull;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Interning table that maps a structural key to a canonical value.
 *
 * <p>Values are weakly held. Once a value is no longer reachable from
 * outside the table, the collector may clear it; the table entry remains
 * until the next sweep, and a lookup of that key creates a fresh value.
 *
 * <p>{@link #compact()} sweeps explicitly. A sweep also runs when the
 * number of entries reaches a power of two.
 *
 * <p>All methods are synchronized, so a sweep never interleaves with a
 * lookup.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public class HashConsTable<K, V> {
  private final Map<K, Entry<K, V>> map = new HashMap<>();
  private final ReferenceQueue<V> queue = new ReferenceQueue<>();
  private int sweepCount;

  /**
   * Returns the canonical value for a key, creating it if necessary.
   *
   * <p>If the key is present and its value has not been collected, returns
   * that value with {@link Result#isNew} false. Otherwise calls
   * {@code factory}, stores the value and returns it with
   * {@link Result#isNew} true.
   *
   * <p>The factory may re-enter this table.
   */
  public synchronized Result<V> getOrAdd(K key,
      Supplier<? extends V> factory) {
    final Entry<K, V> entry = map.get(key);
    if (entry != null) {
      final V value = entry.get();
      if (value != null) {
        return new Result<>(false, value);
      }
    }
    final V value = requireNonNull(factory.get(), "factory returned null");
    map.put(key, new Entry<>(key, value, queue));
    if (Integer.bitCount(map.size()) == 1) {
      expunge();
    }
    return new Result<>(true, value);
  }

  /** Returns the live value for a key, or null. */
  public synchronized @Nullable V get(K key) {
    final Entry<K, V> entry = map.get(key);
    return entry == null ? null : entry.get();
  }

  /** Returns the number of entries, including those not yet swept. */
  public synchronized int size() {
    return map.size();
  }

  /** Returns the number of sweeps performed so far. */
  public synchronized int sweepCount() {
    return sweepCount;
  }

  /**
   * Removes entries whose values have been collected. Returns the number of
   * entries removed.
   */
  public synchronized int compact() {
    final int removed = expunge();
    // Entries cleared but not yet enqueued
    final int size = map.size();
    map.values().removeIf(entry -> entry.get() == null);
    return removed + size - map.size();
  }

  @SuppressWarnings("unchecked")
  private int expunge() {
    ++sweepCount;
    int removed = 0;
    for (Reference<? extends V> ref; (ref = queue.poll()) != null; ) {
      final Entry<K, V> entry = (Entry<K, V>) ref;
      // Only remove if the slot has not since been re-populated
      if (map.get(entry.key) == entry) {
        map.remove(entry.key);
        ++removed;
      }
    }
    return removed;
  }

  /** Result of {@link #getOrAdd}.
   *
   * @param <V> Value type */
  public static final class Result<V> {
    public final boolean isNew;
    public final V value;

    Result(boolean isNew, V value) {
      this.isNew = isNew;
      this.value = requireNonNull(value);
    }
  }

  /** Weak reference that remembers its key.
   *
   * @param <K> Key type
   * @param <V> Value type */
  private static class Entry<K, V> extends WeakReference<V> {
    final K key;

    Entry(K key, V value, ReferenceQueue<V> queue) {
      super(value, queue);
      this.key = requireNonNull(key);
    }
  }
}

// End HashConsTable.java

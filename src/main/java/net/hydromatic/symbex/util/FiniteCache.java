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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Cache with a fixed capacity.
 *
 * <p>When a new key is added to a full cache, the least recently used entry
 * is evicted. If the capacity is zero or negative, the cache is unbounded.
 *
 * <p>Not thread-safe.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public class FiniteCache<K, V> {
  private final int capacity;
  private final Map<K, V> map;

  /** Creates a FiniteCache. */
  public FiniteCache(int capacity) {
    this.capacity = capacity;
    this.map =
        new LinkedHashMap<K, V>(16, 0.75f, true) {
          @Override protected boolean removeEldestEntry(
              Map.Entry<K, V> eldest) {
            return FiniteCache.this.capacity > 0
                && size() > FiniteCache.this.capacity;
          }
        };
  }

  /** Returns the capacity; zero or negative if unbounded. */
  public int capacity() {
    return capacity;
  }

  /** Returns the number of entries. */
  public int size() {
    return map.size();
  }

  /**
   * Adds or replaces an entry. Replacing the value of an existing key does
   * not evict anything.
   */
  public void put(K key, V value) {
    map.put(requireNonNull(key, "key"), requireNonNull(value, "value"));
  }

  /** Returns the value for a key, or null if absent. */
  public @Nullable V get(K key) {
    return map.get(key);
  }

  /** Returns whether the cache contains a key. Does not affect recency. */
  public boolean containsKey(K key) {
    return map.containsKey(key);
  }

  /**
   * Returns the value for a key, computing and caching it if absent.
   *
   * <p>The function may itself use this cache.
   */
  public V computeIfAbsent(K key, Function<? super K, ? extends V> function) {
    final V v = map.get(key);
    if (v != null) {
      return v;
    }
    final V v2 = requireNonNull(function.apply(key));
    put(key, v2);
    return v2;
  }

  /** Removes all entries. */
  public void clear() {
    map.clear();
  }
}

// End FiniteCache.java

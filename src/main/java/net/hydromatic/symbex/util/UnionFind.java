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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Disjoint-set (union-find) structure.
 *
 * <p>Elements must be registered via {@link #add} before they are used in
 * {@link #union} or {@link #find}. Sets are merged by size, and
 * {@link #find} compresses paths.
 *
 * @param <E> Element type
 */
public class UnionFind<E> {
  /** Elements in the order they were added. */
  private final List<E> elements = new ArrayList<>();
  private final Map<E, Integer> ordinals = new HashMap<>();
  private final List<Integer> parents = new ArrayList<>();
  private final List<Integer> sizes = new ArrayList<>();

  /** Adds an element. Returns false if it was already present. */
  public boolean add(E e) {
    requireNonNull(e);
    if (ordinals.containsKey(e)) {
      return false;
    }
    final int ordinal = elements.size();
    elements.add(e);
    ordinals.put(e, ordinal);
    parents.add(ordinal);
    sizes.add(1);
    return true;
  }

  /** Returns the number of elements. */
  public int size() {
    return elements.size();
  }

  /** Returns whether an element has been added. */
  public boolean contains(E e) {
    return ordinals.containsKey(e);
  }

  /**
   * Returns the representative of the set that contains an element.
   *
   * @throws NoSuchElementException if the element was never added
   */
  public E find(E e) {
    return elements.get(root(ordinal(e)));
  }

  /** Merges the sets containing two elements. Returns the new
   * representative. */
  public E union(E e0, E e1) {
    int r0 = root(ordinal(e0));
    int r1 = root(ordinal(e1));
    if (r0 == r1) {
      return elements.get(r0);
    }
    if (sizes.get(r0) < sizes.get(r1)) {
      final int t = r0;
      r0 = r1;
      r1 = t;
    }
    parents.set(r1, r0);
    sizes.set(r0, sizes.get(r0) + sizes.get(r1));
    return elements.get(r0);
  }

  /**
   * Returns the disjoint sets.
   *
   * <p>Each set lists its elements in the order they were added, and sets
   * are ordered by their earliest element.
   */
  public ImmutableList<ImmutableList<E>> getDisjointSets() {
    final Map<Integer, ImmutableList.Builder<E>> builders =
        new LinkedHashMap<>();
    for (int i = 0; i < elements.size(); i++) {
      builders
          .computeIfAbsent(root(i), r -> ImmutableList.builder())
          .add(elements.get(i));
    }
    final ImmutableList.Builder<ImmutableList<E>> b = ImmutableList.builder();
    builders.values().forEach(builder -> b.add(builder.build()));
    return b.build();
  }

  private int ordinal(E e) {
    final Integer ordinal = ordinals.get(e);
    if (ordinal == null) {
      throw new NoSuchElementException("element not found: " + e);
    }
    return ordinal;
  }

  private int root(int i) {
    int r = i;
    while (parents.get(r) != r) {
      r = parents.get(r);
    }
    // Compress the path
    while (parents.get(i) != r) {
      final int next = parents.get(i);
      parents.set(i, r);
      i = next;
    }
    return r;
  }
}

// End UnionFind.java

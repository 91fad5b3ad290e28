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
package net.hydromatic.symbex.eval;

import static net.hydromatic.symbex.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.symbex.type.BagType;
import net.hydromatic.symbex.type.ConstMapType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.OptionType;
import net.hydromatic.symbex.type.SeqType;
import net.hydromatic.symbex.type.SetType;
import net.hydromatic.symbex.type.Type;

/**
 * Total orderings on values.
 *
 * <p>Used to put the results of a search into a deterministic order.
 */
@SuppressWarnings("rawtypes")
public class Comparators {
  private Comparators() {}

  /** Returns a comparator for values of a given type. */
  public static Comparator comparatorFor(Type type) {
    return new ComparatorBuilder().comparatorFor(type);
  }

  /** Returns a comparator for lists of values, the {@code i}th value having
   * the {@code i}th type. */
  @SuppressWarnings("unchecked")
  public static Comparator<List<Object>> tupleComparator(
      List<? extends Type> types) {
    final ComparatorBuilder builder = new ComparatorBuilder();
    final List<Comparator> comparators =
        transformEager(types, builder::comparatorFor);
    return (list1, list2) -> {
      for (int i = 0; i < comparators.size(); i++) {
        final int c = comparators.get(i).compare(list1.get(i), list2.get(i));
        if (c != 0) {
          return c;
        }
      }
      return 0;
    };
  }

  /** Compares two objects using their natural order. */
  @SuppressWarnings("unchecked")
  public static int compare(Object o1, Object o2) {
    return ((Comparable) o1).compareTo(o2);
  }

  /** Contains shared state while building comparators for various types. */
  static class ComparatorBuilder {
    private final Map<Type, Comparator> cache = new HashMap<>();

    Comparator comparatorFor(Type type) {
      final Comparator comparator = cache.get(type);
      if (comparator != null) {
        return comparator;
      }
      final Comparator comparator2 = comparatorFor2(type);
      cache.put(type, comparator2);
      return comparator2;
    }

    @SuppressWarnings("unchecked")
    private Comparator comparatorFor2(Type type) {
      switch (type.op()) {
        case BOOL_TYPE:
        case CHAR_TYPE:
        case BIGINT_TYPE:
        case INT_TYPE:
        case STRING_TYPE:
          // Atomic types are compared using their natural order.
          return Comparators::compare;

        case OBJECT_TYPE:
          final List<Comparator> fieldComparators =
              transformEager(((ObjectType) type).fieldTypes.values(),
                  this::comparatorFor);
          return (Comparator<ObjectValue>)
              (o1, o2) -> {
                for (int i = 0; i < fieldComparators.size(); i++) {
                  final Comparator comparator = fieldComparators.get(i);
                  final int c =
                      comparator.compare(o1.values.get(i), o2.values.get(i));
                  if (c != 0) {
                    return c;
                  }
                }
                return 0;
              };

        case OPTION_TYPE:
          final Comparator<Object> elementComparator =
              comparatorFor(((OptionType) type).elementType);
          // Absent sorts before present.
          return (Comparator<Optional<Object>>)
              (o1, o2) -> {
                if (o1.isPresent() && o2.isPresent()) {
                  return elementComparator.compare(o1.get(), o2.get());
                }
                return Boolean.compare(o1.isPresent(), o2.isPresent());
              };

        case LIST_TYPE:
          return listComparator(((ListType) type).elementType);

        case SEQ_TYPE:
          return listComparator(((SeqType) type).elementType);

        case SET_TYPE:
          final Comparator<Object> setElementComparator =
              comparatorFor(((SetType) type).elementType);
          final Comparator<List> setListComparator =
              listComparator(((SetType) type).elementType);
          return (Comparator<Set<Object>>)
              (s1, s2) ->
                  setListComparator.compare(
                      Ordering.from(setElementComparator).sortedCopy(s1),
                      Ordering.from(setElementComparator).sortedCopy(s2));

        case BAG_TYPE:
          final Comparator<Object> bagElementComparator =
              comparatorFor(((BagType) type).elementType);
          final Comparator<List> bagListComparator =
              listComparator(((BagType) type).elementType);
          return (Comparator<Multiset<Object>>)
              (b1, b2) ->
                  bagListComparator.compare(
                      Ordering.from(bagElementComparator).sortedCopy(b1),
                      Ordering.from(bagElementComparator).sortedCopy(b2));

        case MAP_TYPE:
          final MapType mapType = (MapType) type;
          final Comparator<Object> keyComparator =
              comparatorFor(mapType.keyType);
          final Comparator<Object> valueComparator =
              comparatorFor(mapType.valueType);
          final Comparator<Map.Entry<Object, Object>> entryComparator =
              Map.Entry.<Object, Object>comparingByKey(keyComparator)
                  .thenComparing(
                      Map.Entry.<Object, Object>comparingByValue(
                          valueComparator));
          return (Comparator<Map<Object, Object>>)
              (m1, m2) -> {
                final List<Map.Entry<Object, Object>> entries1 =
                    Ordering.from(entryComparator).sortedCopy(m1.entrySet());
                final List<Map.Entry<Object, Object>> entries2 =
                    Ordering.from(entryComparator).sortedCopy(m2.entrySet());
                final int n = Math.min(entries1.size(), entries2.size());
                for (int i = 0; i < n; i++) {
                  final int c =
                      entryComparator.compare(entries1.get(i), entries2.get(i));
                  if (c != 0) {
                    return c;
                  }
                }
                return Integer.compare(entries1.size(), entries2.size());
              };

        case CONST_MAP_TYPE:
          // Every value has the same keys, in the same order
          final Comparator<List> valuesComparator =
              listComparator(((ConstMapType) type).valueType);
          return (Comparator<Map<Object, Object>>)
              (m1, m2) ->
                  valuesComparator.compare(
                      ImmutableList.copyOf(m1.values()),
                      ImmutableList.copyOf(m2.values()));

        default:
          throw new AssertionError("unknown type: " + type);
      }
    }

    @SuppressWarnings("unchecked")
    private Comparator<List> listComparator(Type elementType) {
      final Comparator<Object> elementComparator =
          (Comparator<Object>) comparatorFor(elementType);
      return (list1, list2) -> {
        final int n1 = list1.size();
        final int n2 = list2.size();
        final int n = Math.min(n1, n2);
        for (int i = 0; i < n; i++) {
          final Object element0 = list1.get(i);
          final Object element1 = list2.get(i);
          final int c = elementComparator.compare(element0, element1);
          if (c != 0) {
            return c;
          }
        }
        return Integer.compare(n1, n2);
      };
    }
  }
}

// End Comparators.java

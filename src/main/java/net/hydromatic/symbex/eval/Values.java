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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.math.BigInteger;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.symbex.type.BagType;
import net.hydromatic.symbex.type.ConstMapType;
import net.hydromatic.symbex.type.DomainException;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.OptionType;
import net.hydromatic.symbex.type.PrimitiveType;
import net.hydromatic.symbex.type.SeqType;
import net.hydromatic.symbex.type.SetType;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.type.TypeException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Host representation of values.
 *
 * <table>
 *   <caption>Representation of each type</caption>
 *   <tr><th>Type</th><th>Java class</th></tr>
 *   <tr><td>bool</td><td>{@link Boolean}</td></tr>
 *   <tr><td>char</td><td>{@link Character}</td></tr>
 *   <tr><td>bigint, intN, uintN</td><td>{@link BigInteger}</td></tr>
 *   <tr><td>string</td><td>{@link String}</td></tr>
 *   <tr><td>object</td><td>{@link ObjectValue}</td></tr>
 *   <tr><td>option</td><td>{@link Optional}</td></tr>
 *   <tr><td>list, seq</td><td>{@link ImmutableList}</td></tr>
 *   <tr><td>map, cmap</td><td>{@link ImmutableMap}</td></tr>
 *   <tr><td>set</td><td>{@link ImmutableSet}</td></tr>
 *   <tr><td>bag</td><td>{@link ImmutableMultiset}</td></tr>
 * </table>
 */
public abstract class Values {
  private Values() {}

  /**
   * Converts a host value to the canonical representation of a type,
   * validating it.
   *
   * <p>Integers may be given as any {@link Number} or as {@link BigInteger};
   * characters as {@link Character} or as an {@link Integer} code; objects
   * as {@link ObjectValue} or as a {@link Map} from field name to value.
 * A constant-key map may omit keys; they get the default value.
   *
   * @throws TypeException if the value is null, has a null or missing
   *   component, or has the wrong shape
   * @throws DomainException if the value is out of range
   */
  public static Object embed(Type type, @Nullable Object value) {
    if (value == null) {
      throw new TypeException("null value for type " + type.moniker());
    }
    switch (type.op()) {
    case BOOL_TYPE:
      return cast(type, value, Boolean.class);

    case CHAR_TYPE:
      if (value instanceof Character) {
        return value;
      }
      final int code = cast(type, value, Integer.class);
      if (code < 0 || code > PrimitiveType.MAX_CHAR) {
        throw new DomainException("character code out of range: " + code);
      }
      return (char) code;

    case BIGINT_TYPE:
      return toBigInteger(type, value);

    case INT_TYPE:
      final BigInteger i = toBigInteger(type, value);
      if (!((IntType) type).contains(i)) {
        throw new DomainException("value " + i + " out of range for type "
            + type.moniker());
      }
      return i;

    case STRING_TYPE:
      return cast(type, value, String.class);

    case OBJECT_TYPE:
      final ObjectType objectType = (ObjectType) type;
      if (value instanceof ObjectValue) {
        final ObjectValue o = (ObjectValue) value;
        if (!o.type.equals(objectType)) {
          throw new TypeException("expected " + type.moniker() + ", got "
              + o.type.moniker());
        }
        return o;
      }
      return object(objectType, cast(type, value, Map.class));

    case OPTION_TYPE:
      final Optional<?> optional = cast(type, value, Optional.class);
      return optional.map(v -> embed(((OptionType) type).elementType, v));

    case LIST_TYPE:
      final ListType listType = (ListType) type;
      final List<Object> list =
          embedAll(listType.elementType, cast(type, value, List.class));
      if (list.size() > listType.capacity) {
        throw new DomainException("list of length " + list.size()
            + " exceeds capacity " + listType.capacity);
      }
      return list;

    case SEQ_TYPE:
      return embedAll(((SeqType) type).elementType,
          cast(type, value, List.class));

    case MAP_TYPE:
      final MapType mapType = (MapType) type;
      final ImmutableMap.Builder<Object, Object> mb = ImmutableMap.builder();
      cast(type, value, Map.class).forEach((k, v) ->
          mb.put(embed(mapType.keyType, k), embed(mapType.valueType, v)));
      return mb.build();

    case CONST_MAP_TYPE:
      final ConstMapType constMapType = (ConstMapType) type;
      final Map<Object, Object> entries = new HashMap<>();
      cast(type, value, Map.class).forEach((k, v) -> {
        final Object key = embed(constMapType.keyType, k);
        if (!constMapType.keys.contains(key)) {
          throw new DomainException("key " + key + " is not a key of type "
              + type.moniker());
        }
        entries.put(key, embed(constMapType.valueType, v));
      });
      final ImmutableMap.Builder<Object, Object> cb = ImmutableMap.builder();
      constMapType.keys.forEach(key ->
          cb.put(key,
              entries.containsKey(key) ? entries.get(key)
                  : defaultValue(constMapType.valueType)));
      return cb.build();

    case SET_TYPE:
      return ImmutableSet.copyOf(
          embedAll(((SetType) type).elementType,
              cast(type, value, Set.class)));

    case BAG_TYPE:
      final Multiset<?> multiset = cast(type, value, Multiset.class);
      final ImmutableMultiset.Builder<Object> bb = ImmutableMultiset.builder();
      multiset.entrySet().forEach(e ->
          bb.addCopies(embed(((BagType) type).elementType, e.getElement()),
              e.getCount()));
      return bb.build();

    case FN_TYPE:
      throw new TypeException("cannot embed a value of function type "
          + type.moniker());

    default:
      throw new AssertionError("unknown type " + type);
    }
  }

  /** Creates an object value from a map of field values.
   *
   * @throws TypeException if a field is missing or unknown */
  public static ObjectValue object(ObjectType type, Map<?, ?> fieldValues) {
    for (Object fieldName : fieldValues.keySet()) {
      if (!type.fieldTypes.containsKey(fieldName)) {
        throw new TypeException("type " + type.name + " has no field '"
            + fieldName + "'");
      }
    }
    final ImmutableList.Builder<Object> values = ImmutableList.builder();
    type.fieldTypes.forEach((fieldName, fieldType) -> {
      if (!fieldValues.containsKey(fieldName)) {
        throw new TypeException("missing value for field '" + fieldName
            + "' of type " + type.name);
      }
      values.add(embed(fieldType, fieldValues.get(fieldName)));
    });
    return new ObjectValue(type, values.build());
  }

  /** Creates an object value from field values in declaration order. */
  public static ObjectValue object(ObjectType type, Object... values) {
    if (values.length != type.fieldTypes.size()) {
      throw new TypeException("type " + type.name + " has "
          + type.fieldTypes.size() + " fields, got " + values.length);
    }
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (int i = 0; i < values.length; i++) {
      b.add(embed(type.fieldTypes.values().asList().get(i), values[i]));
    }
    return new ObjectValue(type, b.build());
  }

  /** Returns the default value of a type: false, zero, the empty string,
   * an empty collection, an absent option, an object of defaults, or a
   * constant-key map whose values are defaults. */
  public static Object defaultValue(Type type) {
    switch (type.op()) {
    case BOOL_TYPE:
      return false;
    case CHAR_TYPE:
      return (char) 0;
    case BIGINT_TYPE:
    case INT_TYPE:
      return BigInteger.ZERO;
    case STRING_TYPE:
      return "";
    case OBJECT_TYPE:
      final ObjectType objectType = (ObjectType) type;
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      objectType.fieldTypes.values().forEach(t -> b.add(defaultValue(t)));
      return new ObjectValue(objectType, b.build());
    case OPTION_TYPE:
      return Optional.empty();
    case LIST_TYPE:
    case SEQ_TYPE:
      return ImmutableList.of();
    case MAP_TYPE:
      return ImmutableMap.of();
    case CONST_MAP_TYPE:
      final ConstMapType constMapType = (ConstMapType) type;
      final ImmutableMap.Builder<Object, Object> mb = ImmutableMap.builder();
      final Object value = defaultValue(constMapType.valueType);
      constMapType.keys.forEach(key -> mb.put(key, value));
      return mb.build();
    case SET_TYPE:
      return ImmutableSet.of();
    case BAG_TYPE:
      return ImmutableMultiset.of();
    default:
      throw new TypeException("type has no default value: " + type.moniker());
    }
  }

  private static ImmutableList<Object> embedAll(Type elementType,
      Collection<?> values) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (Object value : values) {
      b.add(embed(elementType, value));
    }
    return b.build();
  }

  private static BigInteger toBigInteger(Type type, Object value) {
    if (value instanceof BigInteger) {
      return (BigInteger) value;
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return BigInteger.valueOf(((Number) value).longValue());
    }
    throw new TypeException("expected integer for type " + type.moniker()
        + ", got " + value.getClass().getSimpleName());
  }

  private static <C> C cast(Type type, Object value, Class<C> clazz) {
    if (!clazz.isInstance(value)) {
      throw new TypeException("expected " + clazz.getSimpleName()
          + " for type " + type.moniker() + ", got "
          + value.getClass().getSimpleName());
    }
    return clazz.cast(value);
  }
}

// End Values.java

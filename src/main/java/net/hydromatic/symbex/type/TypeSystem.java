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
package net.hydromatic.symbex.type;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.symbex.eval.Values;

/**
 * A collection of types.
 *
 * <p>Creates and interns types, so that two requests for structurally equal
 * types return the same object.
 */
public class TypeSystem {
  private final Map<Type, Type> typeByKey = new HashMap<>();

  public final PrimitiveType boolType = PrimitiveType.BOOL;
  public final PrimitiveType charType = PrimitiveType.CHAR;
  public final PrimitiveType bigintType = PrimitiveType.BIGINT;
  public final PrimitiveType stringType = PrimitiveType.STRING;

  @SuppressWarnings("unchecked")
  private synchronized <T extends Type> T intern(T type) {
    return (T) typeByKey.computeIfAbsent(type, t -> t);
  }

  /** Creates a fixed-width integer type. */
  public IntType intType(int width, boolean signed) {
    return intern(new IntType(width, signed));
  }

  /** Returns the type of 8-bit unsigned integers. */
  public IntType byteType() {
    return intType(8, false);
  }

  /** Returns the type of 16-bit signed integers. */
  public IntType shortType() {
    return intType(16, true);
  }

  /** Returns the type of 16-bit unsigned integers. */
  public IntType ushortType() {
    return intType(16, false);
  }

  /** Returns the type of 32-bit signed integers. */
  public IntType intType() {
    return intType(32, true);
  }

  /** Returns the type of 32-bit unsigned integers. */
  public IntType uintType() {
    return intType(32, false);
  }

  /** Returns the type of 64-bit signed integers. */
  public IntType longType() {
    return intType(64, true);
  }

  /** Creates an object type. Fields are ordered as in the map. */
  public ObjectType objectType(String name,
      Map<String, ? extends Type> fieldTypes) {
    return intern(new ObjectType(name, fieldTypes));
  }

  /** Creates an object type with fields given as alternating names and
   * types. */
  public ObjectType objectType(String name, Object... namesAndTypes) {
    final ImmutableMap.Builder<String, Type> b = ImmutableMap.builder();
    for (int i = 0; i < namesAndTypes.length; i += 2) {
      b.put((String) namesAndTypes[i], (Type) namesAndTypes[i + 1]);
    }
    return objectType(name, b.build());
  }

  /** Creates an option type. */
  public OptionType optionType(Type elementType) {
    return intern(new OptionType(elementType));
  }

  /** Creates a list type with a given capacity. */
  public ListType listType(Type elementType, int capacity) {
    return intern(new ListType(elementType, capacity));
  }

  /** Creates a sequence type. */
  public SeqType seqType(Type elementType) {
    return intern(new SeqType(elementType));
  }

  /** Creates a map type. */
  public MapType mapType(Type keyType, Type valueType) {
    return intern(new MapType(keyType, valueType));
  }

  /** Creates a map type with a fixed list of keys. Keys are converted as
   * by {@link Values#embed}; duplicates are removed.
   *
   * @throws TypeException if there are no keys, or a key does not have the
   *   key type */
  public ConstMapType constMapType(Type keyType, Iterable<?> keys,
      Type valueType) {
    final Set<Object> keySet = new LinkedHashSet<>();
    keys.forEach(key -> keySet.add(Values.embed(keyType, key)));
    if (keySet.isEmpty()) {
      throw new TypeException("constant map type must have a key");
    }
    return intern(
        new ConstMapType(keyType, ImmutableList.copyOf(keySet), valueType));
  }

  /** Creates a set type. */
  public SetType setType(Type elementType) {
    return intern(new SetType(elementType));
  }

  /** Creates a bag type. */
  public BagType bagType(Type elementType) {
    return intern(new BagType(elementType));
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return intern(new FnType(paramType, resultType));
  }

  /** Returns the type of the length of a list of a given type. */
  public IntType lengthType(ListType listType) {
    return intType(listType.lengthWidth(), false);
  }

  /** Throws if a type is not atomic. */
  static void checkAtomic(Type type, String role) {
    if (!type.isAtomic()) {
      throw new TypeException(role + " type must be atomic, but was "
          + type.moniker());
    }
  }
}

// End TypeSystem.java

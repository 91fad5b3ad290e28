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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.symbex.ast.Op;

/**
 * Map type whose keys are a fixed list of constants.
 *
 * <p>A value holds an entry for every key, so it is represented as one
 * value per key, like the fields of an object. The type is finite if its
 * value type is finite.
 */
public class ConstMapType extends BaseType {
  public final Type keyType;
  /** Keys, in the representation of
   * {@link net.hydromatic.symbex.eval.Values}, without duplicates. */
  public final ImmutableList<Object> keys;
  public final Type valueType;

  ConstMapType(Type keyType, ImmutableList<Object> keys, Type valueType) {
    super(Op.CONST_MAP_TYPE);
    this.keyType = requireNonNull(keyType);
    this.keys = requireNonNull(keys);
    this.valueType = requireNonNull(valueType);
    TypeSystem.checkAtomic(keyType, "constant map key");
    if (valueType.op() == Op.FN_TYPE) {
      throw new TypeException("constant map value type must not be a "
          + "function, but was " + valueType.moniker());
    }
  }

  @Override
  public String moniker() {
    final StringBuilder b = new StringBuilder("cmap<")
        .append(keyType.moniker()).append(" {");
    for (int i = 0; i < keys.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(keys.get(i));
    }
    return b.append("}, ").append(valueType.moniker()).append('>')
        .toString();
  }

  @Override
  public boolean isFinite() {
    return valueType.isFinite();
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyType, keys, valueType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ConstMapType
            && keyType.equals(((ConstMapType) o).keyType)
            && keys.equals(((ConstMapType) o).keys)
            && valueType.equals(((ConstMapType) o).valueType);
  }

  /**
   * Returns the position of a key.
   *
   * @throws TypeException if the key is not one of this type's keys
   */
  public int keyOrdinal(Object key) {
    final int i = keys.indexOf(key);
    if (i < 0) {
      throw new TypeException("type " + moniker() + " has no key " + key);
    }
    return i;
  }
}

// End ConstMapType.java

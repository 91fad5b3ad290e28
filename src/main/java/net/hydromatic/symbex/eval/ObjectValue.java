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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.symbex.type.ObjectType;

/** Value of an {@link ObjectType}. Field values are held in declaration
 * order. */
public class ObjectValue {
  public final ObjectType type;
  public final ImmutableList<Object> values;

  ObjectValue(ObjectType type, List<?> values) {
    this.type = requireNonNull(type);
    this.values = ImmutableList.copyOf(values);
    checkArgument(values.size() == type.fieldTypes.size());
  }

  /** Returns the value of a field.
   *
   * @throws net.hydromatic.symbex.type.TypeException if there is no such
   * field */
  public Object get(String fieldName) {
    return values.get(type.fieldOrdinal(fieldName));
  }

  /** Returns a copy of this object with one field changed. The value must
   * already be valid for the field's type. */
  public ObjectValue with(String fieldName, Object value) {
    final int i = type.fieldOrdinal(fieldName);
    final Object[] newValues = values.toArray();
    newValues[i] = requireNonNull(value);
    return new ObjectValue(type, ImmutableList.copyOf(newValues));
  }

  @Override public int hashCode() {
    return Objects.hash(type, values);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ObjectValue
        && type.equals(((ObjectValue) o).type)
        && values.equals(((ObjectValue) o).values);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder(type.name).append('{');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(type.fieldNames().get(i)).append('=').append(values.get(i));
    }
    return b.append('}').toString();
  }
}

// End ObjectValue.java

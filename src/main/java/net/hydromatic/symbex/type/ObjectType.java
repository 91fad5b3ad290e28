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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.symbex.ast.Op;

/**
 * Object type: a named structure with an ordered list of fields.
 *
 * <p>Field order is the declaration order. It determines the order in which
 * backends allocate variables for the fields.
 */
public class ObjectType extends BaseType {
  public final String name;
  public final ImmutableMap<String, Type> fieldTypes;

  ObjectType(String name, Map<String, ? extends Type> fieldTypes) {
    super(Op.OBJECT_TYPE);
    this.name = requireNonNull(name);
    this.fieldTypes = ImmutableMap.copyOf(fieldTypes);
  }

  @Override
  public String moniker() {
    final StringBuilder b = new StringBuilder(name).append('{');
    fieldTypes.forEach((fieldName, type) -> {
      if (b.charAt(b.length() - 1) != '{') {
        b.append(", ");
      }
      b.append(fieldName).append(": ").append(type.moniker());
    });
    return b.append('}').toString();
  }

  @Override
  public boolean isFinite() {
    return fieldTypes.values().stream().allMatch(Type::isFinite);
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fieldTypes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ObjectType
            && name.equals(((ObjectType) o).name)
            && fieldTypes.equals(((ObjectType) o).fieldTypes);
  }

  /** Returns the field names, in declaration order. */
  public ImmutableList<String> fieldNames() {
    return fieldTypes.keySet().asList();
  }

  /**
   * Returns the type of a field.
   *
   * @throws TypeException if there is no such field
   */
  public Type fieldType(String fieldName) {
    final Type type = fieldTypes.get(fieldName);
    if (type == null) {
      throw new TypeException("type " + name + " has no field '"
          + fieldName + "'");
    }
    return type;
  }

  /** Returns the ordinal of a field.
   *
   * @throws TypeException if there is no such field */
  public int fieldOrdinal(String fieldName) {
    final int i = fieldNames().indexOf(fieldName);
    if (i < 0) {
      throw new TypeException("type " + name + " has no field '"
          + fieldName + "'");
    }
    return i;
  }
}

// End ObjectType.java

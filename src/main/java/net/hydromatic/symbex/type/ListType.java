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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbex.util.Static.bitWidth;

import java.util.Objects;
import net.hydromatic.symbex.ast.Op;

/**
 * List type with a fixed capacity.
 *
 * <p>A list holds between 0 and {@link #capacity} elements. Because its size
 * is bounded, a list type is finite if its element type is finite.
 */
public class ListType extends BaseType {
  public final Type elementType;
  public final int capacity;

  ListType(Type elementType, int capacity) {
    super(Op.LIST_TYPE);
    checkArgument(capacity >= 0, "negative capacity %s", capacity);
    this.elementType = requireNonNull(elementType);
    this.capacity = capacity;
  }

  @Override
  public String moniker() {
    return "list<" + elementType.moniker() + ", " + capacity + ">";
  }

  @Override
  public boolean isFinite() {
    return elementType.isFinite();
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, capacity);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ListType
            && elementType.equals(((ListType) o).elementType)
            && capacity == ((ListType) o).capacity;
  }

  /** Returns the number of bits needed to hold the length, at least 1. */
  public int lengthWidth() {
    return bitWidth(capacity);
  }
}

// End ListType.java

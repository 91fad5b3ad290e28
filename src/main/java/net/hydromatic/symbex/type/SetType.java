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

import net.hydromatic.symbex.ast.Op;

/** Unbounded set type. */
public class SetType extends BaseType {
  public final Type elementType;

  SetType(Type elementType) {
    super(Op.SET_TYPE);
    this.elementType = requireNonNull(elementType);
    TypeSystem.checkAtomic(elementType, "set element");
  }

  @Override
  public String moniker() {
    return "set<" + elementType.moniker() + ">";
  }

  @Override
  public boolean isFinite() {
    return false;
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public int hashCode() {
    return elementType.hashCode() * 37 + 3;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SetType
            && elementType.equals(((SetType) o).elementType);
  }
}

// End SetType.java

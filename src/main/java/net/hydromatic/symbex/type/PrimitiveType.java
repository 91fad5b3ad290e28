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

import java.util.Locale;
import net.hydromatic.symbex.ast.Op;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL(Op.BOOL_TYPE),
  /** 16-bit code unit; values 0 to 0xFFFF. */
  CHAR(Op.CHAR_TYPE),
  /** Arbitrary-precision integer. */
  BIGINT(Op.BIGINT_TYPE),
  STRING(Op.STRING_TYPE);

  /** Largest valid value of a {@link #CHAR}. */
  public static final int MAX_CHAR = 0xFFFF;

  private final Op op;

  /** The name, e.g. {@code bool}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  PrimitiveType(Op op) {
    this.op = op;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public boolean isFinite() {
    return this == BOOL || this == CHAR;
  }

  @Override
  public boolean isAtomic() {
    return true;
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) {
    return visitor.visit(this);
  }
}

// End PrimitiveType.java

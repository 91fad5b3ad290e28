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

import net.hydromatic.symbex.ast.Op;

/**
 * Logical type of an expression.
 *
 * <p>The set of implementations is closed: {@link PrimitiveType},
 * {@link IntType}, {@link ObjectType}, {@link OptionType}, {@link ListType},
 * {@link SeqType}, {@link MapType}, {@link ConstMapType}, {@link SetType},
 * {@link BagType}, {@link FnType}. Code that handles types switches on
 * {@link #op()}.
 *
 * <p>Types are immutable and compare structurally; {@link TypeSystem}
 * interns them so that equal types are usually also identical.
 */
public interface Type {
  /** Type operator. */
  Op op();

  /** Description of the type, e.g. "{@code uint8}", "{@code
   * option<bool>}". */
  String moniker();

  /**
   * Whether every value of this type has an encoding of bounded size.
   *
   * <p>The bounded backend can only handle expressions all of whose types
   * are finite.
   */
  boolean isFinite();

  /**
   * Whether this type is atomic: {@code bool}, {@code char}, {@code bigint},
   * {@code string} or a fixed-width integer. Only atomic types may be the
   * elements of sequences, the keys and values of maps, and the elements of
   * sets and bags.
   */
  default boolean isAtomic() {
    return false;
  }

  /** Visits this type. */
  <R> R accept(TypeVisitor<R> visitor);
}

// End Type.java

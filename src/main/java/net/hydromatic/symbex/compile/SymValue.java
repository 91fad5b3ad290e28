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
package net.hydromatic.symbex.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.type.Type;

/**
 * Symbolic value of an expression, as compiled for a backend.
 *
 * <p>A value of a composite type is a tree whose leaves are backend terms:
 * {@code B} for a boolean, {@code W} for a scalar (a bit-vector, integer,
 * sequence or array).
 *
 * @param <B> Backend boolean term
 * @param <W> Backend scalar term
 */
public abstract class SymValue<B, W> {
  public final Type type;

  SymValue(Type type) {
    this.type = requireNonNull(type);
  }

  /** Boolean value. */
  public static class Bool<B, W> extends SymValue<B, W> {
    public final B value;

    public Bool(Type type, B value) {
      super(type);
      this.value = requireNonNull(value);
    }
  }

  /** Value of an atomic type, a sequence, a set or a bag. */
  public static class Scalar<B, W> extends SymValue<B, W> {
    public final W value;

    public Scalar(Type type, W value) {
      super(type);
      this.value = requireNonNull(value);
    }
  }

  /** Object value, or value of a map with constant keys; one symbolic
   * value per field or key, in declaration order. */
  public static class Struct<B, W> extends SymValue<B, W> {
    public final ImmutableList<SymValue<B, W>> fields;

    public Struct(Type type, ImmutableList<SymValue<B, W>> fields) {
      super(type);
      this.fields = requireNonNull(fields);
    }
  }

  /** Option value. If {@link #present} is false, {@link #value} is
   * ignored. */
  public static class Option<B, W> extends SymValue<B, W> {
    public final B present;
    public final SymValue<B, W> value;

    public Option(Type type, B present, SymValue<B, W> value) {
      super(type);
      this.present = requireNonNull(present);
      this.value = requireNonNull(value);
    }
  }

  /** Bounded list: a length and one slot per unit of capacity. Slots at or
   * beyond the length are ignored. The tail of a list has one slot fewer;
   * the length never exceeds the number of slots. */
  public static class BoundedList<B, W> extends SymValue<B, W> {
    public final W length;
    public final ImmutableList<SymValue<B, W>> slots;

    public BoundedList(Type type, W length,
        ImmutableList<SymValue<B, W>> slots) {
      super(type);
      this.length = requireNonNull(length);
      this.slots = requireNonNull(slots);
    }
  }

  /** Map value: an array from key to presence, and an array from key to
   * value. */
  public static class MapPair<B, W> extends SymValue<B, W> {
    public final W present;
    public final W values;

    public MapPair(Type type, W present, W values) {
      super(type);
      this.present = requireNonNull(present);
      this.values = requireNonNull(values);
    }
  }

  /** Function value: a list of lambdas, each with the condition under which
   * it is the function, and the bindings it closes over. */
  public static class Fn<B, W> extends SymValue<B, W> {
    public final ImmutableList<Alternative<B, W>> alternatives;

    public Fn(Type type, ImmutableList<Alternative<B, W>> alternatives) {
      super(type);
      this.alternatives = requireNonNull(alternatives);
    }
  }

  /** One possible lambda of a {@link Fn}. */
  public static class Alternative<B, W> {
    public final B guard;
    public final Sym.Lambda lambda;
    public final ImmutableMap<Sym.Var, SymValue<B, W>> env;

    public Alternative(B guard, Sym.Lambda lambda,
        ImmutableMap<Sym.Var, SymValue<B, W>> env) {
      this.guard = requireNonNull(guard);
      this.lambda = requireNonNull(lambda);
      this.env = requireNonNull(env);
    }
  }
}

// End SymValue.java

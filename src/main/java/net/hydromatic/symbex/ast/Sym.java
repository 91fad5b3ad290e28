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
package net.hydromatic.symbex.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.type.TypeException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic expressions.
 *
 * <p>Expressions form a directed acyclic graph. They are immutable, and are
 * created only by {@link SymBuilder}, which ensures that two expressions
 * with the same operator, type, parameters and arguments (compared by
 * identity) are the same object. Therefore {@link Exp#equals} is identity.
 */
public class Sym {
  private Sym() {}

  /** Abstract expression. */
  public abstract static class Exp {
    /** Identifier, unique within the {@link SymBuilder} that created this
     * expression. */
    public final int id;
    public final Op op;
    public final Type type;
    public final ImmutableList<Exp> args;

    Exp(int id, Op op, Type type, List<? extends Exp> args) {
      this.id = id;
      this.op = requireNonNull(op);
      this.type = requireNonNull(type);
      this.args = ImmutableList.copyOf(args);
    }

    /** Returns the {@code i}<sup>th</sup> argument. */
    public Exp arg(int i) {
      return args.get(i);
    }

    @Override public int hashCode() {
      return id;
    }

    @Override public boolean equals(Object obj) {
      return this == obj;
    }

    @Override public String toString() {
      return unparse(new StringBuilder(), 8).toString();
    }

    /** Writes this expression to a builder, expanding at most {@code depth}
     * levels. */
    public StringBuilder unparse(StringBuilder b, int depth) {
      b.append(op.opName).append('(');
      if (depth <= 0) {
        return b.append("...)");
      }
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        args.get(i).unparse(b, depth - 1);
      }
      return b.append(')');
    }

    /** Returns whether this expression is a literal. */
    public boolean isLiteral() {
      return op == Op.LITERAL;
    }

    /** Returns whether this expression is the literal {@code true}. */
    public boolean isTrue() {
      return false;
    }

    /** Returns whether this expression is the literal {@code false}. */
    public boolean isFalse() {
      return false;
    }
  }

  /** Literal. */
  public static class Literal extends Exp {
    /** Value, in the representation of
     * {@link net.hydromatic.symbex.eval.Values}. */
    public final Object value;

    Literal(int id, Type type, Object value) {
      super(id, Op.LITERAL, type, ImmutableList.of());
      this.value = requireNonNull(value);
    }

    @Override public StringBuilder unparse(StringBuilder b, int depth) {
      if (value instanceof String) {
        return b.append('"').append(value).append('"');
      }
      if (value instanceof Optional) {
        final Optional<?> o = (Optional<?>) value;
        return o.isPresent() ? b.append("some(").append(o.get()).append(')')
            : b.append("none");
      }
      return b.append(value);
    }

    @Override public boolean isTrue() {
      return Boolean.TRUE.equals(value);
    }

    @Override public boolean isFalse() {
      return Boolean.FALSE.equals(value);
    }

    /** Returns the value, cast to a given class. */
    public <C> C unwrap(Class<C> clazz) {
      return clazz.cast(value);
    }
  }

  /** Symbolic variable.
   *
   * <p>Each call to {@link SymBuilder#var} creates a distinct variable, even
   * if the name and type are the same. */
  public static class Var extends Exp {
    public final String name;

    Var(int id, Type type, String name) {
      super(id, Op.VAR, type, ImmutableList.of());
      this.name = requireNonNull(name);
    }

    @Override public StringBuilder unparse(StringBuilder b, int depth) {
      return b.append(name);
    }
  }

  /** Call to an operator.
   *
   * <p>For {@link Op#CREATE_OBJECT}, the arguments are the field values in
   * declaration order; for {@link Op#CAST}, the target type is the type of
   * the call. */
  public static class Call extends Exp {
    Call(int id, Op op, Type type, List<? extends Exp> args) {
      super(id, op, type, args);
      checkArgument(op != Op.GET_FIELD && op != Op.WITH_FIELD
          && op != Op.LAMBDA && op != Op.LITERAL && op != Op.VAR
          && op != Op.LIST_CASE);
    }
  }

  /** Access to a field of an object: {@link Op#GET_FIELD} with one argument,
   * or {@link Op#WITH_FIELD} with two. */
  public static class Field extends Exp {
    public final String fieldName;

    Field(int id, Op op, Type type, List<? extends Exp> args,
        String fieldName) {
      super(id, op, type, args);
      checkArgument(op == Op.GET_FIELD || op == Op.WITH_FIELD);
      this.fieldName = requireNonNull(fieldName);
    }

    /** Returns the type of the object whose field is accessed. */
    public ObjectType objectType() {
      return (ObjectType) arg(0).type;
    }

    @Override public StringBuilder unparse(StringBuilder b, int depth) {
      super.unparse(b, depth);
      return b.insert(b.length() - 1, ", " + fieldName);
    }
  }

  /** Function of one parameter. The arguments are the parameter and the
   * body. */
  public static class Lambda extends Exp {
    public final Var param;
    public final Exp body;

    Lambda(int id, Type type, Var param, Exp body) {
      super(id, Op.LAMBDA, type, ImmutableList.of(param, body));
      this.param = param;
      this.body = body;
    }
  }

  /** Case analysis of a bounded list. The arguments are the list and the
   * value if it is empty.
   *
   * <p>If the list is not empty, the value is the body, with {@link #head}
   * bound to the first element and {@link #tail} to the remaining
   * elements. The body is built on first use by calling {@link #cons}, so
   * {@code cons} may build another case on the tail; that is how recursive
   * functions over lists are written. */
  public static class ListCase extends Exp {
    public final Var head;
    public final Var tail;
    public final BiFunction<Exp, Exp, Exp> cons;
    private @Nullable Exp body;

    ListCase(int id, Type type, Exp list, Exp empty, Var head, Var tail,
        BiFunction<Exp, Exp, Exp> cons) {
      super(id, Op.LIST_CASE, type, ImmutableList.of(list, empty));
      this.head = requireNonNull(head);
      this.tail = requireNonNull(tail);
      this.cons = requireNonNull(cons);
    }

    /** Returns the value if the list is not empty, in terms of
     * {@link #head} and {@link #tail}. */
    public synchronized Exp body() {
      if (body == null) {
        final Exp e = cons.apply(head, tail);
        if (!e.type.equals(type)) {
          throw new TypeException("non-empty case of list must have type "
              + type.moniker() + ", but was " + e.type.moniker());
        }
        body = e;
      }
      return body;
    }
  }
}

// End Sym.java

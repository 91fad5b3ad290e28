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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.symbex.ast.Op;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates an expression, given values for its variables.
 *
 * <p>Shared sub-expressions are evaluated once. The semantics of each
 * operator are defined by {@link #call}; the backends must agree with
 * them.
 */
public class Evaluator {
  private static final BigInteger MINUS_ONE = BigInteger.ONE.negate();

  private final ImmutableMap<Sym.Var, Object> env;
  private final Map<Sym.Exp, Object> cache = new HashMap<>();

  /** Creates an Evaluator. Values must be in the representation of
   * {@link Values}. */
  public Evaluator(Map<Sym.Var, Object> env) {
    this.env = ImmutableMap.copyOf(env);
  }

  /** Evaluates an expression. */
  public Object eval(Sym.Exp e) {
    Object v = cache.get(e);
    if (v == null) {
      v = eval2(e);
      cache.put(e, v);
    }
    return v;
  }

  private Object eval2(Sym.Exp e) {
    switch (e.op) {
      case LITERAL:
        return ((Sym.Literal) e).value;

      case VAR:
        final Object o = env.get((Sym.Var) e);
        if (o == null) {
          throw new IllegalArgumentException("no value for variable " + e);
        }
        return o;

      case IF:
        return (Boolean) eval(e.arg(0)) ? eval(e.arg(1)) : eval(e.arg(2));

      case AND:
        return (Boolean) eval(e.arg(0)) && (Boolean) eval(e.arg(1));

      case OR:
        return (Boolean) eval(e.arg(0)) || (Boolean) eval(e.arg(1));

      case LAMBDA:
        return new Closure((Sym.Lambda) e, env);

      case APPLY:
        return ((Closure) eval(e.arg(0))).apply(eval(e.arg(1)));

      case LIST_CASE:
        final Sym.ListCase listCase = (Sym.ListCase) e;
        final List<?> list = (List<?>) eval(e.arg(0));
        if (list.isEmpty()) {
          return eval(e.arg(1));
        }
        final Map<Sym.Var, Object> env2 = new HashMap<>(env);
        env2.put(listCase.head, list.get(0));
        env2.put(listCase.tail,
            ImmutableList.copyOf(list.subList(1, list.size())));
        return new Evaluator(env2).eval(listCase.body());

      default:
        final List<Object> args = new ArrayList<>(e.args.size());
        e.args.forEach(arg -> args.add(eval(arg)));
        return call(e.op, e.type,
            e instanceof Sym.Field ? ((Sym.Field) e).fieldName : null, args);
    }
  }

  /**
   * Applies an operator to argument values.
   *
   * @param op Operator; must be {@link Op#isFoldable() foldable}, or
   *     {@link Op#AND}, {@link Op#OR}
   * @param type Result type
   * @param fieldName Field name, for {@link Op#GET_FIELD} and
   *     {@link Op#WITH_FIELD}
   * @param args Argument values
   */
  @SuppressWarnings("unchecked")
  public static Object call(Op op, Type type, @Nullable String fieldName,
      List<Object> args) {
    final Object a0 = args.isEmpty() ? null : args.get(0);
    final Object a1 = args.size() < 2 ? null : args.get(1);
    switch (op) {
      case NOT:
        return !(Boolean) a0;
      case AND:
        return (Boolean) a0 && (Boolean) a1;
      case OR:
        return (Boolean) a0 || (Boolean) a1;
      case EQ:
        return a0.equals(a1);

      case PLUS:
        return arith(type, ((BigInteger) a0).add((BigInteger) a1));
      case MINUS:
        return arith(type, ((BigInteger) a0).subtract((BigInteger) a1));
      case TIMES:
        return arith(type, ((BigInteger) a0).multiply((BigInteger) a1));
      case BIT_AND:
        return arith(type, ((BigInteger) a0).and((BigInteger) a1));
      case BIT_OR:
        return arith(type, ((BigInteger) a0).or((BigInteger) a1));
      case BIT_XOR:
        return arith(type, ((BigInteger) a0).xor((BigInteger) a1));
      case BIT_NOT:
        return arith(type, ((BigInteger) a0).not());
      case LT:
        return compare(a0, a1) < 0;
      case LE:
        return compare(a0, a1) <= 0;
      case CAST:
        return cast(type, a0);

      case GET_FIELD:
        return ((ObjectValue) a0).get(fieldName);
      case WITH_FIELD:
        return ((ObjectValue) a0).with(fieldName, a1);
      case CREATE_OBJECT:
        return new ObjectValue((ObjectType) type, args);

      case SOME:
        return Optional.of(a0);
      case IS_SOME:
        return ((Optional<?>) a0).isPresent();
      case OPTION_VALUE_OR:
        return ((Optional<Object>) a0).orElse(a1);

      case LIST_ADD_FRONT:
        final ImmutableList<Object> list =
            ImmutableList.builder().add(a1).addAll((List<?>) a0).build();
        final int capacity = ((ListType) type).capacity;
        // Adding to a full list drops its last element
        return list.size() > capacity ? list.subList(0, capacity) : list;
      case LIST_LENGTH:
        return BigInteger.valueOf(((List<?>) a0).size());
      case LIST_HEAD:
        final List<Object> list0 = (List<Object>) a0;
        return list0.isEmpty() ? Optional.empty() : Optional.of(list0.get(0));
      case LIST_CONTAINS:
        return ((List<?>) a0).contains(a1);
      case LIST_TAIL:
        final List<?> list1 = (List<?>) a0;
        return list1.isEmpty() ? list1
            : ImmutableList.copyOf(list1.subList(1, list1.size()));

      case SEQ_UNIT:
        return ImmutableList.of(a0);
      case SEQ_CONCAT:
        if (a0 instanceof String) {
          return (String) a0 + a1;
        }
        return ImmutableList.builder()
            .addAll((List<?>) a0)
            .addAll((List<?>) a1)
            .build();
      case SEQ_LENGTH:
        return BigInteger.valueOf(length(a0));
      case SEQ_AT:
        return slice(a0, (BigInteger) a1, BigInteger.ONE);
      case SEQ_CONTAINS:
        return indexOf(a0, a1, 0) >= 0;
      case SEQ_INDEX_OF:
        final BigInteger offset = (BigInteger) args.get(2);
        if (offset.signum() < 0
            || offset.compareTo(BigInteger.valueOf(length(a0))) > 0) {
          return MINUS_ONE;
        }
        return BigInteger.valueOf(indexOf(a0, a1, offset.intValueExact()));
      case SEQ_SLICE:
        return slice(a0, (BigInteger) a1, (BigInteger) args.get(2));
      case SEQ_REPLACE_FIRST:
        return replaceFirst(a0, a1, args.get(2));

      case MAP_SET:
        final Map<Object, Object> map = new LinkedHashMap<>((Map<?, ?>) a0);
        map.put(a1, args.get(2));
        return ImmutableMap.copyOf(map);
      case MAP_DELETE:
        final Map<Object, Object> map2 = new LinkedHashMap<>((Map<?, ?>) a0);
        map2.remove(a1);
        return ImmutableMap.copyOf(map2);
      case MAP_GET:
        return Optional.ofNullable(((Map<?, ?>) a0).get(a1));

      case SET_ADD:
        return ImmutableSet.builder().addAll((Set<?>) a0).add(a1).build();
      case SET_REMOVE:
        return ImmutableSet.copyOf(
            Sets.difference((Set<?>) a0, ImmutableSet.of(a1)));
      case SET_CONTAINS:
        return ((Set<?>) a0).contains(a1);
      case SET_UNION:
        return ImmutableSet.copyOf(
            Sets.union((Set<Object>) a0, (Set<Object>) a1));
      case SET_INTERSECT:
        return ImmutableSet.copyOf(
            Sets.intersection((Set<Object>) a0, (Set<Object>) a1));

      case BAG_ADD:
        return ImmutableMultiset.builder()
            .addAll((Multiset<?>) a0)
            .add(a1)
            .build();
      case BAG_COUNT:
        return BigInteger.valueOf(((Multiset<?>) a0).count(a1));

      case CONST_MAP_GET:
        return ((Map<?, ?>) a0).get(a1);
      case CONST_MAP_SET:
        final Map<Object, Object> map3 = new LinkedHashMap<>((Map<?, ?>) a0);
        map3.put(a1, args.get(2));
        return ImmutableMap.copyOf(map3);

      default:
        throw new AssertionError("unknown op " + op);
    }
  }

  /** Reduces the result of an arithmetic operation into the range of its
   * type. */
  private static BigInteger arith(Type type, BigInteger v) {
    return type instanceof IntType ? ((IntType) type).wrap(v) : v;
  }

  private static Object cast(Type type, Object v) {
    final BigInteger i = v instanceof Character
        ? BigInteger.valueOf((Character) v)
        : (BigInteger) v;
    switch (type.op()) {
      case INT_TYPE:
        return ((IntType) type).wrap(i);
      case BIGINT_TYPE:
        return i;
      case CHAR_TYPE:
        return (char) i.intValue();
      default:
        throw new AssertionError("cannot cast to " + type);
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static int compare(Object o0, Object o1) {
    return ((Comparable) o0).compareTo(o1);
  }

  private static int length(Object seq) {
    return seq instanceof String ? ((String) seq).length()
        : ((List<?>) seq).size();
  }

  private static int indexOf(Object seq, Object sub, int from) {
    if (seq instanceof String) {
      return ((String) seq).indexOf((String) sub, from);
    }
    final List<?> list = (List<?>) seq;
    final int i =
        Collections.indexOfSubList(list.subList(from, list.size()),
            (List<?>) sub);
    return i < 0 ? i : i + from;
  }

  /** Returns the sub-sequence starting at {@code offset} of length at most
   * {@code length}; empty if {@code offset} is not a valid index or
   * {@code length} is not positive. */
  private static Object slice(Object seq, BigInteger offset,
      BigInteger length) {
    final int n = length(seq);
    if (offset.signum() < 0
        || offset.compareTo(BigInteger.valueOf(n)) >= 0
        || length.signum() <= 0) {
      return seq instanceof String ? "" : ImmutableList.of();
    }
    final int start = offset.intValueExact();
    final int end =
        (int) Math.min(n, (long) start + length.min(BigInteger.valueOf(n))
            .longValueExact());
    return seq instanceof String ? ((String) seq).substring(start, end)
        : ImmutableList.copyOf(((List<?>) seq).subList(start, end));
  }

  /** Replaces the first occurrence of {@code src} by {@code dst}. If
   * {@code src} is empty, prepends {@code dst}. */
  private static Object replaceFirst(Object seq, Object src, Object dst) {
    final int i = indexOf(seq, src, 0);
    if (i < 0) {
      return seq;
    }
    final int end = i + length(src);
    if (seq instanceof String) {
      final String s = (String) seq;
      return s.substring(0, i) + dst + s.substring(end);
    }
    final List<?> list = (List<?>) seq;
    return ImmutableList.builder()
        .addAll(list.subList(0, i))
        .addAll((List<?>) dst)
        .addAll(list.subList(end, list.size()))
        .build();
  }
}

// End Evaluator.java

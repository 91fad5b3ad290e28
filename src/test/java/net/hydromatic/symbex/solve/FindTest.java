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
package net.hydromatic.symbex.solve;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.symbex.Engine;
import net.hydromatic.symbex.SymFunction;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.BackendException;
import net.hydromatic.symbex.type.ConstMapType;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link Finder}, via {@link SymFunction#find} and
 * {@link SymFunction#findAll}. */
public class FindTest {
  private final Engine engine = Engine.create();
  private final TypeSystem typeSystem = engine.typeSystem();
  private final SymBuilder builder = engine.builder();

  /** A 16-bit unsigned value {@code x <= 10} has 11 solutions, 0 to 10. */
  @Test void testFindAllCount() {
    final IntType uint16 = typeSystem.ushortType();
    final SymFunction f = engine.function(uint16, x -> x);
    for (Backend backend : Backend.values()) {
      final ImmutableList<ImmutableList<Object>> list =
          f.findAll((args, out) ->
              builder.le(out, builder.intLiteral(uint16, 10)), backend);
      assertThat(list, hasSize(11));
      assertThat(new HashSet<>(list).size(), is(11));
      assertThat(list.get(0), hasToString("[0]"));
      assertThat(list.get(10), hasToString("[10]"));
      // Repeated calls return the same list
      assertThat(
          f.findAll((args, out) ->
              builder.le(out, builder.intLiteral(uint16, 10)), backend),
          is(list));
    }
  }

  @Test void testFind() {
    final IntType uint8 = typeSystem.byteType();
    final SymFunction f =
        engine.function(uint8,
            x -> builder.plus(x, builder.intLiteral(uint8, 1)));
    final Optional<ImmutableList<Object>> result =
        f.find((args, out) -> builder.eq(out, builder.intLiteral(uint8, 0)));
    assertThat(result.isPresent(), is(true));
    assertThat(result.get().get(0), is(BigInteger.valueOf(255)));
    assertThat(f.evaluate(result.get().get(0)), is(BigInteger.ZERO));

    final Optional<ImmutableList<Object>> none =
        f.find((args, out) ->
            builder.and(builder.eq(out, builder.intLiteral(uint8, 0)),
                builder.lt(args.get(0), builder.intLiteral(uint8, 100))));
    assertThat(none.isPresent(), is(false));
  }

  /** Finds two arguments; the backends agree. */
  @Test void testFindTwoArguments() {
    final IntType int32 = typeSystem.intType();
    final SymFunction f =
        engine.function(ImmutableList.of(int32, int32),
            args -> builder.ifThenElse(builder.lt(args.get(0), args.get(1)),
                builder.minus(args.get(1), args.get(0)),
                builder.minus(args.get(0), args.get(1))));
    for (Backend backend
        : ImmutableList.of(Backend.BOUNDED, Backend.GENERAL)) {
      final Optional<ImmutableList<Object>> result =
          f.find((args, out) ->
              builder.and(builder.eq(out, builder.intLiteral(int32, 7)),
                  builder.eq(args.get(0), builder.intLiteral(int32, 3))),
              backend);
      assertThat(result.isPresent(), is(true));
      final List<Object> values = result.get();
      assertThat(values.get(0), is(BigInteger.valueOf(3)));
      assertThat(f.evaluate(values.toArray()), is(BigInteger.valueOf(7)));
    }
  }

  @Test void testFindObject() {
    final ObjectType point =
        typeSystem.objectType("Point", "x", typeSystem.byteType(),
            "y", typeSystem.boolType);
    final SymFunction f =
        engine.function(point, p -> builder.getField(p, "x"));
    final ImmutableList<ImmutableList<Object>> list =
        f.findAll((args, out) ->
            builder.and(
                builder.eq(out, builder.intLiteral(typeSystem.byteType(), 4)),
                builder.not(builder.getField(args.get(0), "y"))));
    assertThat(list, hasToString("[[Point{x=4, y=false}]]"));
  }

  @Test void testFindAllLists() {
    final ListType listType = typeSystem.listType(typeSystem.boolType, 2);
    final SymFunction f =
        engine.function(listType, l -> builder.listLength(l));
    final ImmutableList<ImmutableList<Object>> list =
        f.findAll((args, out) -> builder.trueLiteral());
    // [], [false], [true], and four lists of length 2
    assertThat(list, hasSize(7));
    assertThat(list.get(0), hasToString("[[]]"));
  }

  /** The bounded backend rejects what it cannot encode; the general
   * backend accepts it. */
  @Test void testBackendInapplicable() {
    final SymFunction f =
        engine.function(typeSystem.stringType, s -> builder.seqLength(s));
    final BackendException e =
        assertThrows(BackendException.class,
            () -> f.find((args, out) ->
                builder.eq(out, builder.bigintLiteral(3)), Backend.BOUNDED));
    assertThat(e.backend, is(Backend.BOUNDED));
    assertThat(e.suggested, is(Backend.GENERAL));
    final Optional<ImmutableList<Object>> result =
        f.find((args, out) -> builder.eq(out, builder.bigintLiteral(3)),
            Backend.GENERAL);
    assertThat(((String) result.get().get(0)).length(), is(3));

    final IntType int32 = typeSystem.intType();
    final SymFunction g =
        engine.function(ImmutableList.of(int32, int32),
            args -> builder.times(args.get(0), args.get(1)));
    assertThrows(BackendException.class,
        () -> g.find((args, out) ->
            builder.eq(out, builder.intLiteral(int32, 12)), Backend.BOUNDED));
    final List<Object> values =
        g.find((args, out) ->
                builder.and(builder.eq(out, builder.intLiteral(int32, 12)),
                    builder.lt(builder.intLiteral(int32, 1), args.get(0))),
            Backend.AUTO).get();
    assertThat(g.evaluate(values.toArray()), is(BigInteger.valueOf(12)));
  }

  /** Witnesses for set, map and bag arguments satisfy the invariant. */
  @Test void testFindContainers() {
    final IntType int32 = typeSystem.intType();
    final SymFunction f =
        engine.function(typeSystem.setType(int32),
            s -> builder.setContains(s, builder.intLiteral(int32, 5)));
    final List<Object> set =
        f.find((args, out) -> out, Backend.GENERAL).get();
    assertThat(((Set<?>) set.get(0)).contains(BigInteger.valueOf(5)),
        is(true));
    assertThat(f.evaluate(set.toArray()), is(true));

    final SymFunction g =
        engine.function(typeSystem.mapType(int32, typeSystem.boolType),
            m -> builder.isSome(
                builder.mapGet(m, builder.intLiteral(int32, 7))));
    final List<Object> map =
        g.find((args, out) -> out, Backend.GENERAL).get();
    assertThat(((Map<?, ?>) map.get(0)).containsKey(BigInteger.valueOf(7)),
        is(true));
    assertThat(g.evaluate(map.toArray()), is(true));

    final SymFunction h =
        engine.function(typeSystem.bagType(typeSystem.charType),
            b -> builder.bagCount(b, builder.charLiteral('a')));
    final List<Object> bag =
        h.find((args, out) -> builder.eq(out, builder.bigintLiteral(3)),
            Backend.GENERAL).get();
    assertThat(h.evaluate(bag.toArray()), is(BigInteger.valueOf(3)));
  }

  @Test void testChoose() {
    final IntType int32 = typeSystem.intType();
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Var y = builder.var(int32, "y");
    assertThat(
        Solvers.choose(Backend.AUTO,
            builder.eq(builder.times(x, builder.intLiteral(int32, 3)), y)),
        is(Backend.BOUNDED));
    assertThat(
        Solvers.choose(Backend.AUTO, builder.eq(builder.times(x, y), y)),
        is(Backend.GENERAL));
    final Sym.Var s = builder.var(typeSystem.stringType, "s");
    assertThat(
        Solvers.choose(Backend.AUTO,
            builder.eq(builder.seqLength(s), builder.bigintLiteral(0))),
        is(Backend.GENERAL));
    assertThat(
        Solvers.choose(Backend.GENERAL, builder.eq(x, y)),
        is(Backend.GENERAL));
    // The body of a list case is checked too
    final Sym.Var list =
        builder.var(typeSystem.listType(int32, 2), "list");
    assertThat(
        Solvers.choose(Backend.AUTO,
            builder.listCase(list, builder.falseLiteral(),
                (h, t) -> builder.eq(builder.seqLength(s),
                    builder.bigintLiteral(0)))),
        is(Backend.GENERAL));
  }

  /** Sum of a list, recursing on the tail. */
  private Sym.Exp sum(Sym.Exp list, IntType type) {
    return builder.listCase(list, builder.intLiteral(type, 0),
        (h, t) -> builder.plus(h, sum(t, type)));
  }

  /** Finds a list by the result of a recursive function; the backends
   * agree. */
  @Test void testFindListRecursion() {
    final IntType uint8 = typeSystem.byteType();
    final ListType listType = typeSystem.listType(uint8, 3);
    final SymFunction f = engine.function(listType, l -> sum(l, uint8));
    assertThat(Solvers.choose(Backend.AUTO, f.body), is(Backend.BOUNDED));
    for (Backend backend
        : ImmutableList.of(Backend.BOUNDED, Backend.GENERAL)) {
      final Optional<ImmutableList<Object>> result =
          f.find((args, out) ->
              builder.and(builder.eq(out, builder.intLiteral(uint8, 10)),
                  builder.eq(builder.listLength(args.get(0)),
                      builder.intLiteral(typeSystem.lengthType(listType),
                          3))),
              backend);
      assertThat(result.isPresent(), is(true));
      assertThat((List<?>) result.get().get(0), hasSize(3));
      assertThat(f.evaluate(result.get().toArray()), is(BigInteger.TEN));
    }
  }

  /** Counts the keys of a map with constant keys whose value is true. The
   * map is finite, so the bounded backend applies. */
  @Test void testFindAllConstMap() {
    final IntType uint8 = typeSystem.byteType();
    final ConstMapType mapType =
        typeSystem.constMapType(uint8, ImmutableList.of(1, 2, 3),
            typeSystem.boolType);
    final SymFunction f =
        engine.function(mapType, m -> {
          Sym.Exp count = builder.intLiteral(uint8, 0);
          for (Object key : mapType.keys) {
            count =
                builder.plus(count,
                    builder.ifThenElse(
                        builder.constMapGet(m, builder.literal(uint8, key)),
                        builder.intLiteral(uint8, 1),
                        builder.intLiteral(uint8, 0)));
          }
          return count;
        });
    assertThat(Solvers.choose(Backend.AUTO, f.body), is(Backend.BOUNDED));
    for (Backend backend
        : ImmutableList.of(Backend.BOUNDED, Backend.GENERAL)) {
      final ImmutableList<ImmutableList<Object>> list =
          f.findAll((args, out) ->
              builder.eq(out, builder.intLiteral(uint8, 2)), backend);
      assertThat(list, hasSize(3));
      assertThat(list.get(0), hasToString("[{1=false, 2=true, 3=true}]"));
      for (ImmutableList<Object> values : list) {
        assertThat(f.evaluate(values.toArray()), is(BigInteger.valueOf(2)));
      }
    }
  }

  @Test void testInvariantMustBeBoolean() {
    final SymFunction f = engine.function(typeSystem.intType(), x -> x);
    assertThrows(IllegalArgumentException.class,
        () -> f.find((args, out) -> out));
  }
}

// End FindTest.java

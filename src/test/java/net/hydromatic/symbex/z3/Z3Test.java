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
package net.hydromatic.symbex.z3;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.Tracers;
import net.hydromatic.symbex.eval.Evaluator;
import net.hydromatic.symbex.eval.Values;
import net.hydromatic.symbex.solve.Assignment;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.SeqType;
import net.hydromatic.symbex.type.SetType;
import net.hydromatic.symbex.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for the general backend, {@link Z3Solver}. */
public class Z3Test {
  private final TypeSystem typeSystem = new TypeSystem();
  private final SymBuilder builder = new SymBuilder(typeSystem);

  private Z3Solver solver() {
    return new Z3Solver(typeSystem, Tracers.empty(), 8, null);
  }

  /** Solves a constraint, checks that the evaluator agrees that the
   * assignment satisfies it, and returns the assignment. */
  private Assignment solve(Sym.Exp constraint) {
    try (Z3Solver solver = solver()) {
      solver.assertTrue(constraint);
      final Assignment assignment = solver.solve();
      assertThat(assignment, notNullValue());
      assertThat(new Evaluator(assignment.values()).eval(constraint),
          is(true));
      return assignment;
    }
  }

  /** Computes an expression over a variable of known value with the
   * solver, and checks that the evaluator gets the same result. */
  private Object compute(Sym.Var var, Object value, Sym.Exp e) {
    final Sym.Var result = builder.var(e.type, "result");
    final Sym.Exp constraint =
        builder.and(builder.eq(var, builder.literal(var.type, value)),
            builder.eq(result, e));
    final Object solved = solve(constraint).get(result);
    final Object evaluated =
        new Evaluator(ImmutableMap.of(var, Values.embed(var.type, value)))
            .eval(e);
    assertThat(solved, is(evaluated));
    return solved;
  }

  @Test void testBackend() {
    try (Z3Solver solver = solver()) {
      assertThat(solver.backend(), is(Backend.GENERAL));
    }
  }

  @Test void testBigintMultiply() {
    final Sym.Var x = builder.var(typeSystem.bigintType, "x");
    final Sym.Var y = builder.var(typeSystem.bigintType, "y");
    final Sym.Exp constraint =
        builder.andAll(
            ImmutableList.of(
                builder.eq(builder.times(x, y), builder.bigintLiteral(35)),
                builder.lt(builder.bigintLiteral(1), x),
                builder.lt(x, y)));
    final Assignment assignment = solve(constraint);
    assertThat(assignment.get(x), is(BigInteger.valueOf(5)));
    assertThat(assignment.get(y), is(BigInteger.valueOf(7)));
  }

  @Test void testFixedWidth() {
    final IntType int8 = typeSystem.intType(8, true);
    final Sym.Var x = builder.var(int8, "x");
    // Only -128 overflows to itself when negated
    final Sym.Exp constraint =
        builder.andAll(
            ImmutableList.of(
                builder.eq(builder.minus(builder.intLiteral(int8, 0), x), x),
                builder.lt(x, builder.intLiteral(int8, 0))));
    assertThat(solve(constraint).get(x), is(BigInteger.valueOf(-128)));
  }

  @Test void testPushPop() {
    final Sym.Var x = builder.var(typeSystem.bigintType, "x");
    try (Z3Solver solver = solver()) {
      solver.assertTrue(builder.lt(builder.bigintLiteral(10), x));
      solver.push();
      solver.assertTrue(builder.lt(x, builder.bigintLiteral(5)));
      assertThat(solver.solve(), nullValue());
      solver.pop();
      assertThat(solver.solve(), notNullValue());
    }
  }

  @Test void testString() {
    final Sym.Var s = builder.var(typeSystem.stringType, "s");
    final Sym.Exp constraint =
        builder.andAll(
            ImmutableList.of(
                builder.eq(builder.seqLength(s), builder.bigintLiteral(5)),
                builder.eq(
                    builder.seqIndexOf(s, builder.stringLiteral("ab"),
                        builder.bigintLiteral(0)),
                    builder.bigintLiteral(2))));
    final String value = (String) solve(constraint).get(s);
    assertThat(value.length(), is(5));
    assertThat(value.indexOf("ab"), is(2));
  }

  /** Sequence operations give the same results in the solver as in the
   * evaluator, including at the edges of their domains. */
  @Test void testStringAgreement() {
    final Sym.Var s = builder.var(typeSystem.stringType, "s");
    final String hello = "hello world";
    assertThat(
        compute(s, hello,
            builder.seqReplaceFirst(s, builder.stringLiteral("o"),
                builder.stringLiteral("0"))),
        is("hell0 world"));
    assertThat(
        compute(s, hello,
            builder.seqReplaceFirst(s, builder.stringLiteral(""),
                builder.stringLiteral(">"))),
        is(">hello world"));
    assertThat(
        compute(s, hello,
            builder.seqSlice(s, builder.bigintLiteral(6),
                builder.bigintLiteral(100))),
        is("world"));
    assertThat(
        compute(s, hello,
            builder.seqSlice(s, builder.bigintLiteral(3),
                builder.bigintLiteral(-1))),
        is(""));
    assertThat(compute(s, hello, builder.seqAt(s, builder.bigintLiteral(11))),
        is(""));
    assertThat(
        compute(s, hello,
            builder.seqIndexOf(s, builder.stringLiteral("o"),
                builder.bigintLiteral(5))),
        is(BigInteger.valueOf(7)));
    assertThat(
        compute(s, hello,
            builder.seqIndexOf(s, builder.stringLiteral("o"),
                builder.bigintLiteral(12))),
        is(BigInteger.valueOf(-1)));
  }

  @Test void testSequence() {
    final SeqType seqType = typeSystem.seqType(typeSystem.intType());
    final Sym.Var s = builder.var(seqType, "s");
    final Sym.Exp three = builder.intLiteral(typeSystem.intType(), 3);
    final Sym.Exp constraint =
        builder.andAll(
            ImmutableList.of(
                builder.eq(builder.seqLength(s), builder.bigintLiteral(3)),
                builder.eq(builder.seqAt(s, builder.bigintLiteral(1)),
                    builder.seqUnit(three))));
    final List<?> value = (List<?>) solve(constraint).get(s);
    assertThat(value.size(), is(3));
    assertThat(value.get(1), is(BigInteger.valueOf(3)));
  }

  @Test void testMap() {
    final IntType int32 = typeSystem.intType();
    final MapType mapType = typeSystem.mapType(int32, typeSystem.boolType);
    final Sym.Var m = builder.var(mapType, "m");
    final Sym.Exp one = builder.intLiteral(int32, 1);
    final Sym.Exp two = builder.intLiteral(int32, 2);
    final Sym.Exp constraint =
        builder.and(
            builder.eq(builder.mapGet(m, one),
                builder.some(builder.trueLiteral())),
            builder.not(builder.isSome(builder.mapGet(m, two))));
    final Map<?, ?> value = (Map<?, ?>) solve(constraint).get(m);
    assertThat(value.get(BigInteger.ONE), is(true));
    assertThat(value.containsKey(BigInteger.valueOf(2)), is(false));

    // Setting then getting a key
    final Sym.Var k = builder.var(int32, "k");
    final Sym.Exp constraint2 =
        builder.eq(
            builder.mapGet(builder.mapSet(builder.emptyMap(mapType), k,
                builder.falseLiteral()), one),
            builder.some(builder.falseLiteral()));
    assertThat(solve(constraint2).get(k), is(BigInteger.ONE));
  }

  @Test void testSet() {
    final IntType int32 = typeSystem.intType();
    final SetType setType = typeSystem.setType(int32);
    final Sym.Var a = builder.var(setType, "a");
    final Sym.Exp three = builder.intLiteral(int32, 3);
    final Sym.Exp four = builder.intLiteral(int32, 4);
    final Sym.Exp constraint =
        builder.and(builder.setContains(a, three),
            builder.not(
                builder.setContains(
                    builder.setUnion(a,
                        builder.setAdd(builder.emptySet(setType), three)),
                    four)));
    final Set<?> value = (Set<?>) solve(constraint).get(a);
    assertThat(value.contains(BigInteger.valueOf(3)), is(true));
    assertThat(value.contains(BigInteger.valueOf(4)), is(false));
  }

  @Test void testBag() {
    final Sym.Var bag =
        builder.var(typeSystem.bagType(typeSystem.charType), "bag");
    final Sym.Exp c = builder.charLiteral('c');
    final Sym.Exp constraint =
        builder.eq(builder.bagCount(builder.bagAdd(bag, c), c),
            builder.bigintLiteral(3));
    final Object value = solve(constraint).get(bag);
    assertThat(
        ((Multiset<?>) value).count('c'), is(2));
  }

  /** A set variable holds no more elements than the container size. */
  @Test void testContainerSize() {
    final IntType int32 = typeSystem.intType();
    final Sym.Var s = builder.var(typeSystem.setType(int32), "s");
    Sym.Exp constraint = builder.trueLiteral();
    for (int i = 0; i < 3; i++) {
      constraint =
          builder.and(constraint,
              builder.setContains(s, builder.intLiteral(int32, i)));
    }
    try (Z3Solver solver =
             new Z3Solver(typeSystem, Tracers.empty(), 2, null)) {
      solver.assertTrue(constraint);
      assertThat(solver.solve(), nullValue());
    }
    final Set<?> value = (Set<?>) solve(constraint).get(s);
    assertThat(
        value.containsAll(
            ImmutableList.of(BigInteger.ZERO, BigInteger.ONE,
                BigInteger.valueOf(2))),
        is(true));
  }

  /** A bag variable whose count of an element is fixed decodes with that
   * many copies, and no others. */
  @Test void testBagCount() {
    final Sym.Var bag =
        builder.var(typeSystem.bagType(typeSystem.intType()), "bag");
    final Sym.Exp seven = builder.intLiteral(typeSystem.intType(), 7);
    final Sym.Exp constraint =
        builder.eq(builder.bagCount(bag, seven), builder.bigintLiteral(4));
    final Multiset<?> value = (Multiset<?>) solve(constraint).get(bag);
    assertThat(value.count(BigInteger.valueOf(7)), is(4));
  }

  @Test void testOption() {
    final Sym.Var o =
        builder.var(typeSystem.optionType(typeSystem.bigintType), "o");
    final Sym.Exp constraint =
        builder.eq(builder.valueOr(o, builder.bigintLiteral(0)),
            builder.bigintLiteral(9));
    assertThat(solve(constraint).get(o),
        is(Optional.of(BigInteger.valueOf(9))));
  }

  @Test void testUnescape() {
    assertThat(Z3Compiler.unescape("a\\u{48}b"), is("aHb"));
    assertThat(Z3Compiler.unescape("plain"), is("plain"));
  }
}

// End Z3Test.java

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
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbex.Engine;
import net.hydromatic.symbex.Prop;
import net.hydromatic.symbex.SymFunction;
import net.hydromatic.symbex.ast.Op;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Tracer;
import net.hydromatic.symbex.compile.Tracers;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link PathExplorer} and {@link InputGenerator}. */
public class SymbolicExecutionTest {
  private final Engine engine = Engine.create();
  private final TypeSystem typeSystem = engine.typeSystem();
  private final SymBuilder builder = engine.builder();
  private final IntType int32 = typeSystem.intType();

  private Sym.Exp lit(int i) {
    return builder.intLiteral(int32, i);
  }

  /** {@code if x < 0 then 1 else if x == 0 then 2 else 3}. */
  private Sym.Exp sign(Sym.Exp x) {
    return builder.ifThenElse(builder.lt(x, lit(0)), lit(1),
        builder.ifThenElse(builder.eq(x, lit(0)), lit(2), lit(3)));
  }

  /** Sum of a list, recursing on the tail. */
  private Sym.Exp sum(Sym.Exp list) {
    return builder.listCase(list, lit(0),
        (h, t) -> builder.plus(h, sum(t)));
  }

  private static boolean hasListCase(Sym.Exp e) {
    return e.op == Op.LIST_CASE
        || e.args.stream().anyMatch(SymbolicExecutionTest::hasListCase);
  }

  @Test void testPaths() {
    final Sym.Var x = builder.var(int32, "x");
    final List<PathExplorer.Path> paths =
        new PathExplorer(builder, 64).explore(sign(x));
    assertThat(paths, hasSize(3));
    assertThat(paths.get(0).value, is(lit(1)));
    assertThat(paths.get(0).condition.conditions,
        is(ImmutableList.of(builder.lt(x, lit(0)))));
    assertThat(paths.get(2).condition.depth(), is(2));
  }

  @Test void testPathsAndOr() {
    final Sym.Var p = builder.var(typeSystem.boolType, "p");
    final Sym.Var q = builder.var(typeSystem.boolType, "q");
    // "a && b" explores as "if a then (if b then true else false)
    // else false"
    final List<PathExplorer.Path> paths =
        new PathExplorer(builder, 64).explore(builder.and(p, q));
    assertThat(paths, hasSize(3));
    final List<Sym.Exp> values = new ArrayList<>();
    paths.forEach(path -> values.add(path.value));
    assertThat(values,
        is(ImmutableList.of(builder.trueLiteral(), builder.falseLiteral(),
            builder.falseLiteral())));

    final List<PathExplorer.Path> paths2 =
        new PathExplorer(builder, 64).explore(builder.or(p, q));
    assertThat(paths2, hasSize(3));
  }

  /** Once the depth is reached, conditionals no longer fork. */
  @Test void testMaxDepth() {
    final Sym.Var x = builder.var(int32, "x");
    final List<PathExplorer.Path> paths =
        new PathExplorer(builder, 1).explore(sign(x));
    assertThat(paths, hasSize(2));
    assertThat(paths.get(1).value.op, is(Op.IF));
  }

  /** Each level of recursion over a list is a path, one per possible
   * length; the depth limit stops the unrolling. */
  @Test void testPathsListRecursion() {
    final ListType listType = typeSystem.listType(int32, 3);
    final Sym.Var list = builder.var(listType, "list");
    final List<PathExplorer.Path> paths =
        new PathExplorer(builder, 64).explore(sum(list));
    assertThat(paths, hasSize(4));
    assertThat(paths.get(0).value, is(lit(0)));
    for (PathExplorer.Path path : paths) {
      assertThat(hasListCase(path.value), is(false));
    }
    assertThat(paths.get(3).condition.depth(), is(3));

    final List<PathExplorer.Path> paths2 =
        new PathExplorer(builder, 2).explore(sum(list));
    assertThat(paths2, hasSize(3));
    assertThat(paths2.get(2).condition.depth(), is(2));
    assertThat(hasListCase(paths2.get(2).value), is(true));
  }

  /** Inputs for a recursive function cover each length of list. */
  @Test void testGenerateInputsListRecursion() {
    final ListType listType = typeSystem.listType(int32, 3);
    final SymFunction f = engine.function(listType, this::sum);
    final Set<Integer> lengths = new HashSet<>();
    for (ImmutableList<Object> input : f.generateInputs()) {
      lengths.add(((List<?>) input.get(0)).size());
    }
    assertThat(lengths, is(ImmutableSet.of(0, 1, 2, 3)));
  }

  @Test void testInfeasiblePathsPruned() {
    final Sym.Var x = builder.var(int32, "x");
    // The inner test repeats the outer one, so its "else" branch is
    // infeasible and is pruned
    final Sym.Exp c = builder.lt(x, lit(0));
    final Sym.Exp e =
        builder.ifThenElse(c, builder.ifThenElse(c, lit(1), lit(2)), lit(3));
    final List<PathExplorer.Path> paths =
        new PathExplorer(builder, 64).explore(e);
    assertThat(paths, hasSize(2));
  }

  /** Three mutually exclusive branches give three inputs; each input
   * evaluates to its branch's value. */
  @Test void testGenerateInputs() {
    final SymFunction f = engine.function(int32, this::sign);
    final List<ImmutableList<Object>> inputs = f.generateInputs();
    assertThat(inputs, hasSize(3));
    final Set<Object> results = new HashSet<>();
    for (ImmutableList<Object> input : inputs) {
      results.add(f.evaluate(input.toArray()));
    }
    assertThat(results,
        is(ImmutableSet.<Object>of(BigInteger.ONE, BigInteger.valueOf(2),
            BigInteger.valueOf(3))));
  }

  @Test void testGenerateInputsUnsatisfiable() {
    final SymFunction f = engine.function(int32, this::sign);
    final List<ImmutableList<Object>> inputs =
        f.generateInputs(args ->
            builder.and(builder.lt(args.get(0), lit(5)),
                builder.lt(lit(10), args.get(0))));
    assertThat(inputs, empty());
  }

  @Test void testGenerateInputsPrecondition() {
    final SymFunction f = engine.function(int32, this::sign);
    // Only the positive branch is reachable
    final List<ImmutableList<Object>> inputs =
        f.generateInputs(args -> builder.lt(lit(100), args.get(0)));
    assertThat(inputs, hasSize(1));
    assertThat(f.evaluate(inputs.get(0).toArray()),
        is(BigInteger.valueOf(3)));
  }

  @Test void testGenerateInputsBound() {
    final SymFunction f =
        engine.function(ImmutableList.of(int32, int32),
            args -> builder.ifThenElse(builder.lt(args.get(0), args.get(1)),
                args.get(0), args.get(1)));
    final List<ImmutableList<Object>> inputs =
        f.generateInputs(args -> builder.trueLiteral(),
            ImmutableMap.<Integer, Object>of(1, 5));
    assertThat(inputs, hasSize(2));
    for (ImmutableList<Object> input : inputs) {
      assertThat(input.get(1), is(BigInteger.valueOf(5)));
    }
    final BigInteger a = (BigInteger) inputs.get(0).get(0);
    final BigInteger b = (BigInteger) inputs.get(1).get(0);
    assertThat(a.compareTo(BigInteger.valueOf(5)) < 0, is(true));
    assertThat(b.compareTo(BigInteger.valueOf(5)) >= 0, is(true));
  }

  @Test void testTracePaths() {
    final List<String> events = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPath(Tracers.empty(),
            (conditions, feasible) ->
                events.add(conditions.size() + ":" + feasible));
    final Engine engine2 =
        Engine.create(ImmutableMap.of(Prop.PATH_DEPTH, 64), tracer);
    final SymBuilder builder2 = engine2.builder();
    final IntType int32b = engine2.typeSystem().intType();
    final SymFunction f =
        engine2.function(int32b,
            x -> builder2.ifThenElse(
                builder2.lt(x, builder2.intLiteral(int32b, 0)),
                builder2.intLiteral(int32b, 1),
                builder2.intLiteral(int32b, 2)));
    f.generateInputs(args ->
        builder2.lt(builder2.intLiteral(int32b, 0), args.get(0)));
    assertThat(events, hasToString("[1:false, 1:true]"));
  }
}

// End SymbolicExecutionTest.java

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
package net.hydromatic.symbex.dd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.BitSet;
import java.util.List;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.BackendException;
import net.hydromatic.symbex.compile.Tracers;
import net.hydromatic.symbex.solve.Assignment;
import net.hydromatic.symbex.type.ConstMapType;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link DdManager} and the bounded backend. */
public class DdTest {
  private final TypeSystem typeSystem = new TypeSystem();
  private final SymBuilder builder = new SymBuilder(typeSystem);

  private static BitSet bits(int... indexes) {
    final BitSet bitSet = new BitSet();
    for (int index : indexes) {
      bitSet.set(index);
    }
    return bitSet;
  }

  @Test void testCanonical() {
    final DdManager manager = new DdManager();
    final DdNode x = manager.var(manager.createVariable());
    final DdNode y = manager.var(manager.createVariable());
    assertThat(manager.and(x, y), sameInstance(manager.and(y, x)));
    assertThat(manager.not(manager.not(x)), sameInstance(x));
    assertThat(manager.or(x, manager.not(x)), sameInstance(manager.one()));
    assertThat(manager.and(x, manager.not(x)), sameInstance(manager.zero()));
    // De Morgan
    assertThat(manager.not(manager.and(x, y)),
        sameInstance(manager.or(manager.not(x), manager.not(y))));
    assertThat(manager.implies(x, manager.or(x, y)),
        sameInstance(manager.one()));
    assertThat(manager.xor(x, y),
        sameInstance(manager.not(manager.iff(x, y))));
  }

  @Test void testSatOne() {
    final DdManager manager = new DdManager();
    final DdNode x = manager.var(manager.createVariable());
    final DdNode y = manager.var(manager.createVariable());
    assertThat(manager.satOne(manager.zero()), nullValue());
    assertThat(manager.satOne(manager.one()), is(new BitSet()));

    final DdNode f = manager.or(x, y);
    final BitSet assignment = manager.satOne(f);
    assertThat(assignment, notNullValue());
    // The lowest assignment sets y, not x
    assertThat(assignment, is(bits(1)));
    assertThat(manager.evaluate(f, assignment), is(true));
    assertThat(manager.evaluate(f, new BitSet()), is(false));
  }

  @Test void testExistsAndReplace() {
    final DdManager manager = new DdManager();
    final DdNode x = manager.var(manager.createVariable());
    final DdNode y = manager.var(manager.createVariable());
    final DdNode z = manager.var(manager.createVariable());
    final DdNode f = manager.and(x, manager.not(y));
    assertThat(manager.exists(f, bits(1)), sameInstance(x));
    assertThat(manager.exists(f, bits(0, 1)), sameInstance(manager.one()));
    assertThat(manager.exists(f, new BitSet()), sameInstance(f));

    // Rename y to z
    final int[] mapping = {-1, 2, -1};
    assertThat(manager.replace(f, mapping),
        sameInstance(manager.and(x, manager.not(z))));
  }

  @Test void testCompact() {
    final DdManager manager = new DdManager();
    final DdNode x = manager.var(manager.createVariable());
    final DdNode y = manager.var(manager.createVariable());
    final DdNode f = manager.xor(x, y);
    final int before = manager.nodeCount();
    assertThat(manager.compact() >= 0, is(true));
    // Live nodes survive compaction
    assertThat(manager.xor(x, y), sameInstance(f));
    assertThat(manager.nodeCount() <= before, is(true));
  }

  /** Handles of nodes that are no longer referenced are released. */
  @Test void testCompactReleases() throws InterruptedException {
    final DdManager manager = new DdManager();
    final DdNode x = manager.var(manager.createVariable());
    final DdNode y = manager.var(manager.createVariable());
    manager.not(manager.xor(x, y));
    final int before = manager.nodeCount();
    int released = 0;
    for (int i = 0; i < 100 && released == 0; i++) {
      System.gc();
      Thread.sleep(10);
      released += manager.compact();
    }
    assertThat(released > 0, is(true));
    assertThat(manager.nodeCount(), is(before - released));
    // The function can be built again
    assertThat(manager.evaluate(manager.xor(x, y), bits(0)), is(true));
  }

  @Test void testUnknownVariable() {
    final DdManager manager = new DdManager();
    assertThrows(IllegalArgumentException.class, () -> manager.var(0));
  }

  /** Solves {@code x + y == 10 && x - y == 4} over 8-bit unsigned
   * integers. */
  @Test void testArithmetic() {
    final IntType uint8 = typeSystem.byteType();
    final Sym.Var x = builder.var(uint8, "x");
    final Sym.Var y = builder.var(uint8, "y");
    final Sym.Exp constraint =
        builder.and(
            builder.eq(builder.plus(x, y), builder.intLiteral(uint8, 10)),
            builder.eq(builder.minus(x, y), builder.intLiteral(uint8, 4)));
    final DdSolver solver =
        new DdSolver(typeSystem, new DdManager(), Tracers.empty());
    solver.allocate(constraint);
    solver.assertTrue(constraint);
    final Assignment assignment = solver.solve();
    assertThat(assignment, notNullValue());
    // Modulo 256, x = 7, y = 3 and x = 135, y = 131 both satisfy; the
    // lowest assignment is found first
    assertThat(assignment.get(x), is(BigInteger.valueOf(7)));
    assertThat(assignment.get(y), is(BigInteger.valueOf(3)));
    assertThat(solver.backend(), is(Backend.BOUNDED));
  }

  @Test void testSignedCompare() {
    final IntType int8 = typeSystem.intType(8, true);
    final Sym.Var x = builder.var(int8, "x");
    final Sym.Exp constraint =
        builder.and(builder.lt(x, builder.intLiteral(int8, -100)),
            builder.lt(builder.intLiteral(int8, -102), x));
    final DdSolver solver =
        new DdSolver(typeSystem, new DdManager(), Tracers.empty());
    solver.assertTrue(constraint);
    final Assignment assignment = solver.solve();
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(x), is(BigInteger.valueOf(-101)));

    solver.push();
    solver.assertTrue(builder.eq(x, builder.intLiteral(int8, 0)));
    assertThat(solver.solve(), nullValue());
    solver.pop();
    assertThat(solver.solve(), notNullValue());
  }

  @Test void testMultiplyByLiteral() {
    final IntType uint8 = typeSystem.byteType();
    final Sym.Var x = builder.var(uint8, "x");
    final Sym.Exp constraint =
        builder.eq(builder.times(builder.intLiteral(uint8, 3), x),
            builder.intLiteral(uint8, 21));
    final DdSolver solver =
        new DdSolver(typeSystem, new DdManager(), Tracers.empty());
    solver.assertTrue(constraint);
    final Assignment assignment = solver.solve();
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(x), is(BigInteger.valueOf(7)));
  }

  @Test void testLists() {
    final ListType listType = typeSystem.listType(typeSystem.boolType, 3);
    final Sym.Var list = builder.var(listType, "list");
    final Sym.Exp constraint =
        builder.and(
            builder.eq(builder.listLength(list),
                builder.intLiteral(typeSystem.lengthType(listType), 2)),
            builder.listContains(list, builder.trueLiteral()));
    final DdSolver solver =
        new DdSolver(typeSystem, new DdManager(), Tracers.empty());
    solver.assertTrue(constraint);
    final Assignment assignment = solver.solve();
    assertThat(assignment, notNullValue());
    final Object value = assignment.get(list);
    assertThat(((List<?>) value).size(), is(2));
    assertThat(((List<?>) value).contains(true), is(true));
  }

  /** A recursive function over a list compiles to one level per slot. */
  @Test void testListCase() {
    final IntType uint8 = typeSystem.byteType();
    final ListType listType = typeSystem.listType(uint8, 3);
    final Sym.Var list = builder.var(listType, "list");
    final Sym.Exp constraint =
        builder.and(
            builder.eq(sum(list, uint8), builder.intLiteral(uint8, 6)),
            builder.eq(builder.listLength(list),
                builder.intLiteral(typeSystem.lengthType(listType), 3)));
    final DdSolver solver =
        new DdSolver(typeSystem, new DdManager(), Tracers.empty());
    solver.assertTrue(constraint);
    final Assignment assignment = solver.solve();
    assertThat(assignment, notNullValue());
    final List<?> value = (List<?>) assignment.get(list);
    assertThat(value.size(), is(3));
    BigInteger total = BigInteger.ZERO;
    for (Object element : value) {
      total = total.add((BigInteger) element);
    }
    assertThat(uint8.wrap(total), is(BigInteger.valueOf(6)));

    // With 5 and 5 at the front, the sum wraps: 5 + 5 + 252 = 6 (mod 256)
    solver.push();
    solver.assertTrue(
        builder.and(
            builder.eq(builder.listHead(list),
                builder.some(builder.intLiteral(uint8, 5))),
            builder.eq(builder.listHead(builder.listTail(list)),
                builder.some(builder.intLiteral(uint8, 5)))));
    final Assignment assignment2 = solver.solve();
    assertThat(assignment2, notNullValue());
    assertThat(assignment2.get(list), hasToString("[5, 5, 252]"));
    solver.pop();
  }

  private Sym.Exp sum(Sym.Exp list, IntType type) {
    return builder.listCase(list, builder.intLiteral(type, 0),
        (h, t) -> builder.plus(h, sum(t, type)));
  }

  /** A map with constant keys has one group of bits per key. */
  @Test void testConstMap() {
    final IntType uint8 = typeSystem.byteType();
    final ConstMapType mapType =
        typeSystem.constMapType(uint8, ImmutableList.of(1, 2, 3),
            typeSystem.boolType);
    assertThat(DdCompiler.bitCount(mapType), is(3));
    assertThat(
        DdCompiler.bitCount(
            typeSystem.constMapType(typeSystem.charType,
                ImmutableList.of('a', 'b'), uint8)),
        is(16));

    // Setting key 1 to false gives {2: true}, so key 1 is free and keys 2
    // and 3 are fixed
    final Sym.Var m = builder.var(mapType, "m");
    final Sym.Exp constraint =
        builder.eq(
            builder.constMapSet(m, builder.intLiteral(uint8, 1),
                builder.falseLiteral()),
            builder.literal(mapType, ImmutableMap.of(2, true)));
    final DdSolver solver =
        new DdSolver(typeSystem, new DdManager(), Tracers.empty());
    solver.assertTrue(constraint);
    final Assignment assignment = solver.solve();
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(m),
        is(
            ImmutableMap.of(BigInteger.ONE, false, BigInteger.valueOf(2),
                true, BigInteger.valueOf(3), false)));
  }

  @Test void testNotFinite() {
    final DdSolver solver =
        new DdSolver(typeSystem, new DdManager(), Tracers.empty());
    final Sym.Var s = builder.var(typeSystem.stringType, "s");
    final BackendException e =
        assertThrows(BackendException.class,
            () -> solver.assertTrue(
                builder.eq(builder.seqLength(s), builder.bigintLiteral(3))));
    assertThat(e.suggested, is(Backend.GENERAL));

    final IntType uint8 = typeSystem.byteType();
    final Sym.Var x = builder.var(uint8, "x");
    final Sym.Var y = builder.var(uint8, "y");
    assertThrows(BackendException.class,
        () -> solver.assertTrue(
            builder.eq(builder.times(x, y), builder.intLiteral(uint8, 6))));
  }

  @Test void testInterleavingHeuristic() {
    final IntType uint8 = typeSystem.byteType();
    final Sym.Var x = builder.var(uint8, "x");
    final Sym.Var y = builder.var(uint8, "y");
    final Sym.Var z = builder.var(uint8, "z");
    final Sym.Var b = builder.var(typeSystem.boolType, "b");
    final Sym.Exp e =
        builder.and(builder.lt(x, y),
            builder.and(builder.eq(z, builder.intLiteral(uint8, 1)), b));
    assertThat(InterleavingHeuristic.groups(ImmutableList.of(e)),
        hasToString("[[x, y]]"));
  }
}

// End DdTest.java

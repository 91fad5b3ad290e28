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
package net.hydromatic.symbex.transform;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Optional;
import net.hydromatic.symbex.Engine;
import net.hydromatic.symbex.SymFunction;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.BackendException;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link StateSetTransformer} and {@link StateSet}. */
public class TransformerTest {
  private final Engine engine = Engine.create();
  private final TypeSystem typeSystem = engine.typeSystem();
  private final SymBuilder builder = engine.builder();
  private final IntType uint8 = typeSystem.byteType();

  /** {@code fun f (x: uint8) = x + 1}. */
  private SymFunction increment(Engine engine) {
    final SymBuilder b = engine.builder();
    final IntType t = engine.typeSystem().byteType();
    return engine.function(t, x -> b.plus(x, b.intLiteral(t, 1)));
  }

  @Test void testForwardBackward() {
    final StateSetTransformer t = increment(engine).transformer();
    assertThat(t.inputType, is(uint8));
    assertThat(t.outputType, is(uint8));

    final StateSet s =
        t.inputSet((i, o) -> builder.lt(i, builder.intLiteral(uint8, 10)));
    final StateSet image = t.transformForward(s);
    assertThat(image.equals(s), is(false));
    assertThat(t.transformBackwards(image), is(s));
    assertThat(
        t.outputSet((i, o) -> builder.lt(i, builder.intLiteral(uint8, 10))),
        is(image));

    // The image is {1, ..., 10}
    final Optional<Object> element = image.element();
    assertThat(element.isPresent(), is(true));
    final BigInteger value = (BigInteger) element.get();
    assertThat(value, greaterThanOrEqualTo(BigInteger.ONE));
    assertThat(value, lessThanOrEqualTo(BigInteger.TEN));

    // A set built from a predicate is the same set
    final TransformerManager tm = engine.transformerManager();
    assertThat(
        tm.stateSet(uint8, x -> builder.lt(x, builder.intLiteral(uint8, 10))),
        is(s));
  }

  @Test void testSetOperations() {
    final TransformerManager tm = engine.transformerManager();
    final StateSet small =
        tm.stateSet(uint8, x -> builder.lt(x, builder.intLiteral(uint8, 10)));
    final StateSet even =
        tm.stateSet(uint8, x ->
            builder.eq(builder.bitAnd(x, builder.intLiteral(uint8, 1)),
                builder.intLiteral(uint8, 0)));
    assertThat(small.intersect(small.complement()).isEmpty(), is(true));
    assertThat(small.union(small.complement()).isFull(), is(true));
    assertThat(small.complement().complement(), is(small));
    assertThat(tm.fullSet(uint8).isFull(), is(true));
    assertThat(tm.emptySet(uint8).isEmpty(), is(true));
    assertThat(tm.emptySet(uint8).element().isPresent(), is(false));

    final StateSet smallEven = small.intersect(even);
    assertThat(
        tm.stateSet(uint8, x ->
            builder.and(builder.lt(x, builder.intLiteral(uint8, 10)),
                builder.eq(builder.bitAnd(x, builder.intLiteral(uint8, 1)),
                    builder.intLiteral(uint8, 0)))),
        is(smallEven));
    assertThat(smallEven.union(small), is(small));
  }

  /** Predicates that ignore their variable give a set of the requested
   * type, whichever type was asked for first. */
  @Test void testStateSetPerType() {
    final TransformerManager tm = engine.transformerManager();
    final StateSet s8 = tm.stateSet(uint8, x -> builder.trueLiteral());
    final StateSet sb =
        tm.stateSet(typeSystem.boolType, x -> builder.trueLiteral());
    assertThat(s8.type, is(uint8));
    assertThat(sb.type, is(typeSystem.boolType));
    assertThat(s8.isFull(), is(true));
    assertThat(sb.isFull(), is(true));
    assertThat(sb.intersect(tm.fullSet(typeSystem.boolType)).isFull(),
        is(true));
    assertThat(
        tm.stateSet(typeSystem.boolType, x -> builder.falseLiteral())
            .isEmpty(),
        is(true));
  }

  /** Input sets of two transformers over the same type can be
   * combined. */
  @Test void testTwoTransformers() {
    final StateSetTransformer inc = increment(engine).transformer();
    final StateSetTransformer xor3 =
        engine.function(uint8,
            x -> builder.bitXor(x, builder.intLiteral(uint8, 3)))
            .transformer();
    // x + 1 == 10 iff x == 9; 9 ^ 3 == 10
    final StateSet a =
        inc.inputSet((i, o) -> builder.eq(o, builder.intLiteral(uint8, 10)));
    final StateSet b =
        xor3.inputSet((i, o) -> builder.eq(o, builder.intLiteral(uint8, 10)));
    assertThat(a, is(b));
    assertThat(a.intersect(b).element(),
        is(Optional.<Object>of(BigInteger.valueOf(9))));

    // x ^ 3 == 0 iff x == 3
    final StateSet c =
        xor3.inputSet((i, o) -> builder.eq(o, builder.intLiteral(uint8, 0)));
    assertThat(a.intersect(c).isEmpty(), is(true));
    final StateSet ac = a.union(c);
    assertThat(ac.intersect(c), is(c));
    assertThat(
        ac.intersect(
            engine.transformerManager().stateSet(uint8,
                x -> builder.lt(x, builder.intLiteral(uint8, 5)))),
        is(c));
    assertThat(ac.complement().intersect(a).isEmpty(), is(true));
  }

  @Test void testTransformerCached() {
    final SymFunction f = increment(engine);
    assertThat(f.transformer(), sameInstance(f.transformer()));
  }

  @Test void testPredicateOnOutput() {
    final SymFunction f =
        engine.function(uint8, x ->
            builder.lt(x, builder.intLiteral(uint8, 10)));
    final StateSetTransformer t = f.transformer();
    assertThat(t.outputType, is(typeSystem.boolType));
    final TransformerManager tm = engine.transformerManager();
    final StateSet trueSet = tm.stateSet(typeSystem.boolType, b -> b);
    assertThat(t.transformBackwards(trueSet),
        is(tm.stateSet(uint8, x ->
            builder.lt(x, builder.intLiteral(uint8, 10)))));
    assertThat(t.outputSet().isFull(), is(true));
    assertThat(t.inputSet((i, o) -> o),
        is(t.transformBackwards(trueSet)));
  }

  @Test void testListLength() {
    final ListType listType = typeSystem.listType(typeSystem.boolType, 2);
    final IntType lengthType = typeSystem.lengthType(listType);
    final SymFunction f = engine.function(listType, builder::listLength);
    final StateSetTransformer t = f.transformer();
    final TransformerManager tm = engine.transformerManager();
    assertThat(t.outputSet(),
        is(tm.stateSet(lengthType, n ->
            builder.le(n, builder.intLiteral(lengthType, 2)))));
    final StateSet empty =
        t.transformBackwards(
            tm.stateSet(lengthType, n ->
                builder.eq(n, builder.intLiteral(lengthType, 0))));
    assertThat(empty.element(), is(Optional.<Object>of(ImmutableList.of())));
  }

  @Test void testIncompatible() {
    final StateSetTransformer t = increment(engine).transformer();
    final Engine engine2 = Engine.create();
    final StateSet other =
        increment(engine2).transformer().inputSet();
    assertThrows(IllegalArgumentException.class,
        () -> t.transformForward(other));
    final StateSet bools =
        engine.transformerManager().fullSet(typeSystem.boolType);
    assertThrows(IllegalArgumentException.class,
        () -> t.transformBackwards(bools));
    assertThrows(IllegalArgumentException.class,
        () -> t.inputSet().union(bools));
  }

  @Test void testNotFinite() {
    final SymFunction f =
        engine.function(typeSystem.stringType, s ->
            builder.eq(s, builder.stringLiteral("a")));
    final BackendException e =
        assertThrows(BackendException.class, f::transformer);
    assertThat(e.suggested, is(Backend.GENERAL));
  }

  @Test void testTwoParameters() {
    final SymFunction f =
        engine.function(ImmutableList.of(uint8, uint8),
            args -> builder.plus(args.get(0), args.get(1)));
    assertThrows(IllegalArgumentException.class, f::transformer);
  }
}

// End TransformerTest.java

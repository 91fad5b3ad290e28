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
package net.hydromatic.symbex;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.Tracer;
import net.hydromatic.symbex.compile.Tracers;
import net.hydromatic.symbex.type.IntType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Engine}, {@link Prop} and {@link SymFunction}. */
public class EngineTest {
  @Test void testPropLookup() {
    assertThat(Prop.lookup("backend"), is(Prop.BACKEND));
    assertThat(Prop.lookup("PATH_DEPTH"), is(Prop.PATH_DEPTH));
    assertThat(Prop.lookup("pathDepth"), is(Prop.PATH_DEPTH));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("noSuchProp"));
    assertThat(e.getMessage(), is("property noSuchProp not found"));
    assertThat(Prop.BY_CAMEL_NAME,
        hasToString("[BACKEND, CACHE_SIZE, CONTAINER_SIZE, PATH_DEPTH, "
            + "SOLVER_TIMEOUT]"));
  }

  @Test void testPropDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.BACKEND.enumValue(map, Backend.class), is(Backend.AUTO));
    assertThat(Prop.CACHE_SIZE.intValue(map), is(1024));
    assertThat(Prop.CONTAINER_SIZE.intValue(map), is(8));
    assertThat(Prop.PATH_DEPTH.intValue(map), is(64));
    assertThat(Prop.SOLVER_TIMEOUT.optionalIntValue(map), nullValue());
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SOLVER_TIMEOUT.intValue(map));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.BACKEND.intValue(map));
  }

  @Test void testPropSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.BACKEND.setLenient(map, "general");
    assertThat(map.get(Prop.BACKEND), is(Backend.GENERAL));
    Prop.PATH_DEPTH.setLenient(map, "10");
    assertThat(map.get(Prop.PATH_DEPTH), is(10));
    Prop.SOLVER_TIMEOUT.setLenient(map, 500);
    assertThat(Prop.SOLVER_TIMEOUT.optionalIntValue(map), is(500));
    Prop.SOLVER_TIMEOUT.set(map, null);
    assertThat(map.containsKey(Prop.SOLVER_TIMEOUT), is(false));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.BACKEND.setLenient(map, "fast"));
    assertThat(e.getMessage(),
        is("value must be one of: 'BOUNDED', 'GENERAL', 'AUTO'"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.BACKEND.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PATH_DEPTH.set(map, "ten"));
  }

  @Test void testEngineBackend() {
    assertThat(Engine.create().backend(), is(Backend.AUTO));
    final Map<Prop, Object> map = new HashMap<>();
    Prop.BACKEND.setLenient(map, "bounded");
    final Engine engine = Engine.create(map);
    assertThat(engine.backend(), is(Backend.BOUNDED));

    // Later changes to the map do not affect the engine
    Prop.BACKEND.set(map, Backend.GENERAL);
    assertThat(engine.backend(), is(Backend.BOUNDED));
  }

  @Test void testEvaluate() {
    final Engine engine = Engine.create();
    final SymBuilder builder = engine.builder();
    final IntType uint8 = engine.typeSystem().byteType();
    final SymFunction f =
        engine.function(uint8, x ->
            builder.plus(x, builder.intLiteral(uint8, 1)));
    assertThat(f.evaluate(3), is(BigInteger.valueOf(4)));
    assertThat(f.evaluate(255), is(BigInteger.ZERO));
    assertThrows(IllegalArgumentException.class, () -> f.evaluate());
    assertThrows(IllegalArgumentException.class, () -> f.evaluate(1, 2));
  }

  @Test void testTracer() {
    final List<String> compiles = new ArrayList<>();
    final List<String> solves = new ArrayList<>();
    final List<Integer> compacts = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnCompile(tracer, (backend, e) ->
        compiles.add(backend.name()));
    tracer = Tracers.withOnSolve(tracer, (backend, satisfiable) ->
        solves.add(backend + ":" + satisfiable));
    tracer = Tracers.withOnCompact(tracer, compacts::add);
    final Engine engine = Engine.create(new HashMap<>(), tracer);
    final SymBuilder builder = engine.builder();
    final IntType uint8 = engine.typeSystem().byteType();
    final SymFunction f = engine.function(uint8, x -> x);

    final List<ImmutableList<Object>> list =
        f.findAll((args, result) ->
            builder.lt(result, builder.intLiteral(uint8, 3)));
    assertThat(list, hasSize(3));
    assertThat(solves,
        hasToString("[BOUNDED:true, BOUNDED:true, BOUNDED:true, "
            + "BOUNDED:false]"));
    assertThat(compiles.isEmpty(), is(false));

    solves.clear();
    final Optional<ImmutableList<Object>> found =
        f.find((args, result) ->
            builder.lt(result, builder.intLiteral(uint8, 3)),
            Backend.GENERAL);
    assertThat(found.isPresent(), is(true));
    assertThat(solves, hasToString("[GENERAL:true]"));

    final int removed = engine.compact();
    assertThat(removed, greaterThanOrEqualTo(0));
    assertThat(compacts, is(ImmutableList.of(removed)));
  }

  @Test void testSolverTimeout() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SOLVER_TIMEOUT.setLenient(map, "10000");
    final Engine engine = Engine.create(map);
    final SymBuilder builder = engine.builder();
    final SymFunction f =
        engine.function(engine.typeSystem().bigintType, x ->
            builder.times(x, x));
    final Optional<ImmutableList<Object>> found =
        f.find((args, result) ->
            builder.eq(result, builder.bigintLiteral(49)));
    assertThat(found.isPresent(), is(true));
    final BigInteger x = (BigInteger) found.get().get(0);
    assertThat(x.abs(), is(BigInteger.valueOf(7)));
  }

  @Test void testInvariantNotBoolean() {
    final Engine engine = Engine.create();
    final IntType uint8 = engine.typeSystem().byteType();
    final SymFunction f = engine.function(uint8, x -> x);
    assertThrows(IllegalArgumentException.class,
        () -> f.find((args, result) -> result));
  }
}

// End EngineTest.java

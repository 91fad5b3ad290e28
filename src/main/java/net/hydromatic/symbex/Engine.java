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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.Tracer;
import net.hydromatic.symbex.compile.Tracers;
import net.hydromatic.symbex.transform.TransformerManager;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Context for building and analyzing functions.
 *
 * <p>Holds the {@link TypeSystem}, the {@link SymBuilder} that interns
 * expressions, the properties, the {@link Tracer}, and (created on first
 * use) the {@link TransformerManager}.
 *
 * <p>An engine is not thread-safe.
 */
public class Engine {
  private final TypeSystem typeSystem;
  private final SymBuilder builder;
  private final Tracer tracer;
  /** Property values; a property not in the map has its default value. */
  public final ImmutableMap<Prop, Object> props;
  private @Nullable TransformerManager transformerManager;

  private Engine(Map<Prop, Object> props, Tracer tracer) {
    this.typeSystem = new TypeSystem();
    this.builder = new SymBuilder(typeSystem);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an engine with default properties. */
  public static Engine create() {
    return create(ImmutableMap.of());
  }

  /** Creates an engine with the given properties. */
  public static Engine create(Map<Prop, Object> props) {
    return create(props, Tracers.empty());
  }

  /** Creates an engine with the given properties and tracer. */
  public static Engine create(Map<Prop, Object> props, Tracer tracer) {
    return new Engine(props, tracer);
  }

  public TypeSystem typeSystem() {
    return typeSystem;
  }

  public SymBuilder builder() {
    return builder;
  }

  public Tracer tracer() {
    return tracer;
  }

  /** Returns the backend used when a caller does not specify one. */
  public Backend backend() {
    return Prop.BACKEND.enumValue(props, Backend.class);
  }

  /** Creates a function of several parameters.
   *
   * @param paramTypes Types of the parameters
   * @param body Given expressions for the parameters, returns the body
   */
  public SymFunction function(List<? extends Type> paramTypes,
      Function<List<Sym.Exp>, Sym.Exp> body) {
    final ImmutableList.Builder<Sym.Var> params = ImmutableList.builder();
    for (int i = 0; i < paramTypes.size(); i++) {
      params.add(builder.var(paramTypes.get(i), "a" + i));
    }
    final ImmutableList<Sym.Var> paramList = params.build();
    return new SymFunction(this, paramList,
        body.apply(ImmutableList.copyOf(paramList)));
  }

  /** Creates a function of one parameter. */
  public SymFunction function(Type paramType, UnaryOperator<Sym.Exp> body) {
    return function(ImmutableList.of(paramType),
        args -> body.apply(args.get(0)));
  }

  /** Returns this engine's transformer manager, creating it if
   * necessary. */
  public TransformerManager transformerManager() {
    if (transformerManager == null) {
      transformerManager =
          new TransformerManager(builder, Prop.CACHE_SIZE.intValue(props));
    }
    return transformerManager;
  }

  /** Removes collected entries from the expression table and, if it
   * exists, the transformer manager's diagrams. Returns the number of
   * entries removed. */
  public int compact() {
    int removed = builder.compact();
    if (transformerManager != null) {
      removed += transformerManager.compact();
    }
    tracer.onCompact(removed);
    return removed;
  }
}

// End Engine.java

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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Maps;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.symbex.SymFunction;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.dd.DdCompiler;
import net.hydromatic.symbex.dd.DdManager;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.util.FiniteCache;

/**
 * Creates {@link StateSetTransformer} and {@link StateSet} objects that
 * share a {@link DdManager} and a {@link VariableRegistry}, and so can be
 * combined.
 */
public class TransformerManager {
  final SymBuilder builder;
  final DdManager manager;
  final VariableRegistry registry;
  private final FiniteCache<SymFunction, StateSetTransformer> transformers;
  /** State sets, keyed by type and condition; a condition that ignores
   * its variable is the same expression for every type. */
  private final FiniteCache<Map.Entry<Type, Sym.Exp>, StateSet> stateSets;

  public TransformerManager(SymBuilder builder, int cacheSize) {
    this.builder = builder;
    this.manager = new DdManager();
    this.registry = new VariableRegistry(manager, builder);
    this.transformers = new FiniteCache<>(cacheSize);
    this.stateSets = new FiniteCache<>(cacheSize);
  }

  /** Returns a transformer for a function of one parameter.
   *
   * @throws net.hydromatic.symbex.compile.BackendException if the function
   *   uses a type that is not finite */
  public StateSetTransformer transformer(SymFunction fn) {
    checkArgument(fn.params.size() == 1,
        "transformer requires a function of one parameter, got %s",
        fn.params.size());
    return transformers.computeIfAbsent(fn, f ->
        new StateSetTransformer(this, f.params.get(0), f.body));
  }

  /** Returns the set of values of a type that satisfy a predicate. */
  public StateSet stateSet(Type type,
      Function<Sym.Exp, Sym.Exp> predicate) {
    final Sym.Var var = registry.variable(type);
    final Sym.Exp condition = predicate.apply(var);
    return stateSets.computeIfAbsent(Maps.immutableEntry(type, condition),
        key -> {
          final DdCompiler compiler =
              new DdCompiler(builder.typeSystem(), manager);
          compiler.reserve(var, registry.canonical(type));
          return new StateSet(this, type,
              manager.and(compiler.compileBool(condition),
                  registry.validity(type)));
        });
  }

  /** Returns the set of every value of a type. */
  public StateSet fullSet(Type type) {
    return new StateSet(this, type, registry.validity(type));
  }

  public StateSet emptySet(Type type) {
    return new StateSet(this, type, manager.zero());
  }

  /** Removes collected decision-diagram nodes. Returns the number
   * removed. */
  public int compact() {
    return manager.compact();
  }
}

// End TransformerManager.java

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

import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.dd.DdCompiler;
import net.hydromatic.symbex.dd.DdManager;
import net.hydromatic.symbex.dd.DdNode;
import net.hydromatic.symbex.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Allocates the decision-diagram variables that represent a value of each
 * type.
 *
 * <p>Each type has two sets of variables: canonical, for state sets and
 * the inputs of transformers, and primed, for the outputs of transformers.
 * Bit <i>i</i> of the primed variables immediately follows bit <i>i</i> of
 * the canonical variables. Allocation happens once per type, so every
 * state set of a given type uses the same variables.
 */
public class VariableRegistry {
  private final DdManager manager;
  private final SymBuilder builder;
  private final Map<Type, Allocation> allocations = new HashMap<>();

  public VariableRegistry(DdManager manager, SymBuilder builder) {
    this.manager = requireNonNull(manager);
    this.builder = requireNonNull(builder);
  }

  /** Returns the canonical variables of a type. */
  public int[] canonical(Type type) {
    return allocation(type).canonical.clone();
  }

  /** Returns the primed variables of a type. */
  public int[] primed(Type type) {
    return allocation(type).primed.clone();
  }

  /** Returns the variable that stands for a value of a type in predicates
   * of state sets. */
  public Sym.Var variable(Type type) {
    return allocation(type).variable;
  }

  /** Returns the diagram that is true for every valid assignment of the
   * canonical variables of a type. */
  public DdNode validity(Type type) {
    final Allocation allocation = allocation(type);
    if (allocation.validity == null) {
      final DdCompiler compiler =
          new DdCompiler(builder.typeSystem(), manager);
      compiler.valueOf(type, allocation.canonical);
      allocation.validity = compiler.validity();
    }
    return allocation.validity;
  }

  private Allocation allocation(Type type) {
    Allocation allocation = allocations.get(type);
    if (allocation == null) {
      final int bitCount = DdCompiler.bitCount(type);
      final int[] canonical = new int[bitCount];
      final int[] primed = new int[bitCount];
      for (int i = 0; i < bitCount; i++) {
        canonical[i] = manager.createVariable();
        primed[i] = manager.createVariable();
      }
      allocation = new Allocation(canonical, primed,
          builder.var(type, "s" + allocations.size()));
      allocations.put(type, allocation);
    }
    return allocation;
  }

  /** Variables of one type. */
  private static class Allocation {
    final int[] canonical;
    final int[] primed;
    final Sym.Var variable;
    @Nullable DdNode validity;

    Allocation(int[] canonical, int[] primed, Sym.Var variable) {
      this.canonical = canonical;
      this.primed = primed;
      this.variable = variable;
    }
  }
}

// End VariableRegistry.java

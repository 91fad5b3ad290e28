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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.hydromatic.symbex.Engine;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.eval.Comparators;
import net.hydromatic.symbex.type.Type;

/**
 * Finds values of variables that satisfy a constraint.
 */
public class Finder {
  private final Engine engine;
  private final ImmutableList<Sym.Var> inputs;
  private final Sym.Exp constraint;
  private final Backend backend;

  /** Creates a Finder.
   *
   * @param engine Engine
   * @param inputs Variables whose values are wanted
   * @param constraint Boolean expression
   * @param backend Backend; may be {@link Backend#AUTO}
   */
  public Finder(Engine engine, List<Sym.Var> inputs, Sym.Exp constraint,
      Backend backend) {
    this.engine = engine;
    this.inputs = ImmutableList.copyOf(inputs);
    this.constraint = constraint;
    this.backend = backend;
  }

  /** Returns one assignment of the inputs that satisfies the constraint, or
   * empty. */
  public Optional<ImmutableList<Object>> find() {
    try (Solver solver = Solvers.create(engine, backend, constraint)) {
      inputs.forEach(solver::declare);
      final Assignment assignment = solver.solve();
      return assignment == null ? Optional.empty()
          : Optional.of(witness(assignment));
    }
  }

  /** Returns every assignment of the inputs that satisfies the constraint,
   * sorted. */
  public ImmutableList<ImmutableList<Object>> findAll() {
    final SymBuilder builder = engine.builder();
    final List<List<Object>> witnesses = new ArrayList<>();
    try (Solver solver = Solvers.create(engine, backend, constraint)) {
      inputs.forEach(solver::declare);
      for (;;) {
        final Assignment assignment = solver.solve();
        if (assignment == null) {
          break;
        }
        final ImmutableList<Object> witness = witness(assignment);
        witnesses.add(witness);
        // Exclude this witness from subsequent solutions
        final List<Sym.Exp> equalities = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
          final Sym.Var input = inputs.get(i);
          equalities.add(
              builder.eq(input, builder.literal(input.type, witness.get(i))));
        }
        solver.assertTrue(builder.not(builder.andAll(equalities)));
      }
    }
    final List<Type> types = new ArrayList<>();
    inputs.forEach(input -> types.add(input.type));
    witnesses.sort(Comparators.tupleComparator(types));
    final ImmutableList.Builder<ImmutableList<Object>> b =
        ImmutableList.builder();
    witnesses.forEach(w -> b.add(ImmutableList.copyOf(w)));
    return b.build();
  }

  private ImmutableList<Object> witness(Assignment assignment) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    inputs.forEach(input -> b.add(assignment.get(input)));
    return b.build();
  }
}

// End Finder.java

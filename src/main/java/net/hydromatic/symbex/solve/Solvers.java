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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbex.Engine;
import net.hydromatic.symbex.Prop;
import net.hydromatic.symbex.ast.Op;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.dd.DdManager;
import net.hydromatic.symbex.dd.DdSolver;
import net.hydromatic.symbex.z3.Z3Solver;

/** Utilities for {@link Solver}. */
public abstract class Solvers {
  private Solvers() {}

  /** Creates a solver and asserts a constraint.
   *
   * <p>If {@code backend} is {@link Backend#AUTO}, uses
   * {@link Backend#BOUNDED} if the constraint allows it. */
  public static Solver create(Engine engine, Backend backend,
      Sym.Exp constraint) {
    final Solver solver = create(engine, choose(backend, constraint));
    try {
      if (solver instanceof DdSolver) {
        ((DdSolver) solver).allocate(constraint);
      }
      solver.assertTrue(constraint);
      return solver;
    } catch (RuntimeException e) {
      solver.close();
      throw e;
    }
  }

  /** Creates a solver with no constraints. */
  public static Solver create(Engine engine, Backend backend) {
    checkArgument(backend != Backend.AUTO,
        "cannot create a solver for the AUTO backend without a constraint");
    switch (backend) {
    case BOUNDED:
      return new DdSolver(engine.typeSystem(), new DdManager(),
          engine.tracer());
    case GENERAL:
      return new Z3Solver(engine.typeSystem(), engine.tracer(),
          Prop.CONTAINER_SIZE.intValue(engine.props),
          Prop.SOLVER_TIMEOUT.optionalIntValue(engine.props));
    default:
      throw new AssertionError("unknown backend " + backend);
    }
  }

  /** Resolves {@link Backend#AUTO} for a constraint; returns other backends
   * unchanged. */
  public static Backend choose(Backend backend, Sym.Exp constraint) {
    if (backend != Backend.AUTO) {
      return backend;
    }
    return isBounded(constraint) ? Backend.BOUNDED : Backend.GENERAL;
  }

  /** Returns whether the bounded backend can compile an expression: every
   * node has a finite type, and no multiplication has two non-literal
   * operands.
   *
   * <p>The body of each list case is checked, but not the bodies of the
   * cases within it; a recursive function builds a new body at each
   * level. */
  public static boolean isBounded(Sym.Exp e) {
    final Set<Sym.Exp> seen = new HashSet<>();
    final List<Sym.ListCase> listCases = new ArrayList<>();
    if (!isBounded(e, seen, listCases)) {
      return false;
    }
    for (Sym.ListCase listCase : listCases) {
      if (!isBounded(listCase.body(), seen, new ArrayList<>())) {
        return false;
      }
    }
    return true;
  }

  private static boolean isBounded(Sym.Exp e, Set<Sym.Exp> seen,
      List<Sym.ListCase> listCases) {
    final Deque<Sym.Exp> queue = new ArrayDeque<>(ImmutableList.of(e));
    while (!queue.isEmpty()) {
      final Sym.Exp e2 = queue.pop();
      if (!seen.add(e2)) {
        continue;
      }
      if (!e2.type.isFinite()) {
        return false;
      }
      if (e2.op == Op.TIMES
          && !e2.arg(0).isLiteral()
          && !e2.arg(1).isLiteral()) {
        return false;
      }
      if (e2.op == Op.LIST_CASE) {
        listCases.add((Sym.ListCase) e2);
      }
      queue.addAll(e2.args);
    }
    return true;
  }
}

// End Solvers.java

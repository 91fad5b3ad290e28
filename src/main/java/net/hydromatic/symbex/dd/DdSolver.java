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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.ModelView;
import net.hydromatic.symbex.compile.Tracer;
import net.hydromatic.symbex.solve.Assignment;
import net.hydromatic.symbex.solve.Solver;
import net.hydromatic.symbex.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Solver that uses binary decision diagrams. */
public class DdSolver implements Solver {
  private final DdCompiler compiler;
  private final Tracer tracer;
  private final Deque<DdNode> scopes = new ArrayDeque<>();
  private DdNode constraint;

  public DdSolver(TypeSystem typeSystem, DdManager manager, Tracer tracer) {
    this.compiler = new DdCompiler(typeSystem, manager);
    this.tracer = tracer;
    this.constraint = manager.one();
  }

  /** Allocates the variables of some expressions, interleaving those that
   * are compared or combined with each other. Call before the expressions
   * are asserted. */
  public void allocate(Iterable<? extends Sym.Exp> exps) {
    compiler.interleave(InterleavingHeuristic.groups(exps));
  }

  /** Allocates the variables of one expression. */
  public void allocate(Sym.Exp e) {
    allocate(ImmutableList.of(e));
  }

  /** Returns the diagram of the constraints asserted so far. */
  public DdNode constraint() {
    return constraint;
  }

  @Override public Backend backend() {
    return Backend.BOUNDED;
  }

  @Override public void declare(Sym.Var var) {
    compiler.variable(var);
  }

  @Override public void assertTrue(Sym.Exp e) {
    tracer.onCompile(Backend.BOUNDED, e);
    constraint = compiler.manager().and(constraint, compiler.compileBool(e));
  }

  @Override public void push() {
    scopes.push(constraint);
  }

  @Override public void pop() {
    constraint = scopes.pop();
  }

  @Override public @Nullable Assignment solve() {
    final DdManager manager = compiler.manager();
    final BitSet bits =
        manager.satOne(manager.and(constraint, compiler.validity()));
    tracer.onSolve(Backend.BOUNDED, bits != null);
    if (bits == null) {
      return null;
    }
    final ModelView<DdNode, DdNode[]> model = compiler.model(bits);
    final Map<Sym.Var, Object> values = new LinkedHashMap<>();
    compiler.variables().forEach((var, value) ->
        values.put(var, compiler.decode(value, model)));
    return new Assignment(values);
  }

  @Override public void close() {
  }
}

// End DdSolver.java

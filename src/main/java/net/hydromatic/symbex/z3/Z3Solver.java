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
package net.hydromatic.symbex.z3;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Status;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.BackendException;
import net.hydromatic.symbex.compile.ModelView;
import net.hydromatic.symbex.compile.Tracer;
import net.hydromatic.symbex.solve.Assignment;
import net.hydromatic.symbex.solve.Solver;
import net.hydromatic.symbex.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solver that uses Z3.
 *
 * <p>Owns a Z3 {@link Context}; call {@link #close()} when done.
 */
public class Z3Solver implements Solver {
  private final Context context;
  private final com.microsoft.z3.Solver solver;
  private final Z3Compiler compiler;
  private final Tracer tracer;

  /** Creates a Z3Solver.
   *
   * @param containerSize Number of keys a set, bag or map variable may hold
   * @param timeout Timeout in milliseconds for each check, or null */
  public Z3Solver(TypeSystem typeSystem, Tracer tracer, int containerSize,
      @Nullable Integer timeout) {
    this.context = new Context();
    this.solver = context.mkSolver();
    if (timeout != null) {
      final Params params = context.mkParams();
      params.add("timeout", timeout);
      solver.setParameters(params);
    }
    this.compiler = new Z3Compiler(typeSystem, context, containerSize);
    this.tracer = tracer;
  }

  @Override public Backend backend() {
    return Backend.GENERAL;
  }

  @Override public void declare(Sym.Var var) {
    compiler.variable(var);
  }

  @Override public void assertTrue(Sym.Exp e) {
    tracer.onCompile(Backend.GENERAL, e);
    solver.add(compiler.compileBool(e));
  }

  @Override public void push() {
    solver.push();
  }

  @Override public void pop() {
    solver.pop();
  }

  @Override public @Nullable Assignment solve() {
    // Validity constraints of variables are assumptions, so that they
    // survive pop
    final BoolExpr validity = compiler.validity();
    final Status status = solver.check(validity);
    switch (status) {
    case UNSATISFIABLE:
      tracer.onSolve(Backend.GENERAL, false);
      return null;
    case SATISFIABLE:
      tracer.onSolve(Backend.GENERAL, true);
      final Model model = solver.getModel();
      final ModelView<BoolExpr, Expr<?>> view = compiler.model(model);
      final Map<Sym.Var, Object> values = new LinkedHashMap<>();
      compiler.variables().forEach((var, value) ->
          values.put(var, compiler.decode(value, view)));
      return new Assignment(values);
    case UNKNOWN:
      throw new BackendException("solver returned unknown: "
          + solver.getReasonUnknown(), Backend.GENERAL, Backend.GENERAL);
    default:
      throw new AssertionError("unknown status " + status);
    }
  }

  @Override public void close() {
    context.close();
  }
}

// End Z3Solver.java

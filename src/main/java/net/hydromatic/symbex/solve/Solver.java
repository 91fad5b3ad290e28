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

import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.compile.Backend;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Incremental satisfiability checker.
 *
 * <p>Holds a stack of scopes; {@link #pop()} discards the constraints
 * asserted since the matching {@link #push()}. Variables are created when
 * first seen, and outlive the scope in which they were seen.
 */
public interface Solver extends AutoCloseable {
  /** Returns the backend; never {@link Backend#AUTO}. */
  Backend backend();

  /** Registers a variable, so that every assignment contains a value for
   * it even if no constraint mentions it. */
  void declare(Sym.Var var);

  /** Adds a constraint to the current scope. */
  void assertTrue(Sym.Exp e);

  void push();

  void pop();

  /** Returns an assignment that satisfies the constraints, or null if there
   * is none. The assignment has a value for each declared variable and each
   * variable of the constraints. */
  @Nullable Assignment solve();

  /** Releases resources. Does not throw. */
  @Override void close();
}

// End Solver.java

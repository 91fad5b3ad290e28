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
package net.hydromatic.symbex.compile;

import java.util.List;
import net.hydromatic.symbex.ast.Sym;

/** Called on various events during compilation and solving. */
public interface Tracer {
  /** Called when an expression is about to be compiled for a backend. */
  void onCompile(Backend backend, Sym.Exp e);

  /** Called with the result of a satisfiability check. */
  void onSolve(Backend backend, boolean satisfiable);

  /** Called for each path found by symbolic execution, with the conditions
   * along the path and whether they are satisfiable. */
  void onPath(List<Sym.Exp> conditions, boolean feasible);

  /** Called after interning tables have been compacted, with the number of
   * entries removed. */
  void onCompact(int removed);
}

// End Tracer.java

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
package net.hydromatic.symbex.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.symbex.ast.Sym;

/** Value of a lambda expression: the lambda and the variable bindings in
 * effect where it was evaluated. */
public class Closure {
  public final Sym.Lambda lambda;
  final ImmutableMap<Sym.Var, Object> env;

  Closure(Sym.Lambda lambda, Map<Sym.Var, Object> env) {
    this.lambda = requireNonNull(lambda);
    this.env = ImmutableMap.copyOf(env);
  }

  /** Applies this closure to an argument. */
  public Object apply(Object arg) {
    final Map<Sym.Var, Object> env2 = new HashMap<>(env);
    env2.put(lambda.param, arg);
    return new Evaluator(env2).eval(lambda.body);
  }

  @Override public String toString() {
    return "closure(" + lambda + ")";
  }
}

// End Closure.java

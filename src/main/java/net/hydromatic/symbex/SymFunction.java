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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.eval.Evaluator;
import net.hydromatic.symbex.eval.Values;
import net.hydromatic.symbex.solve.Finder;
import net.hydromatic.symbex.solve.InputGenerator;
import net.hydromatic.symbex.transform.StateSetTransformer;
import net.hydromatic.symbex.type.PrimitiveType;

/**
 * Function whose body is a symbolic expression over its parameters.
 *
 * <p>A function can be evaluated on concrete arguments, searched for
 * arguments that satisfy an invariant, converted to a transformer of
 * state sets, and explored path by path to generate test inputs.
 */
public class SymFunction {
  public final Engine engine;
  public final ImmutableList<Sym.Var> params;
  public final Sym.Exp body;

  SymFunction(Engine engine, ImmutableList<Sym.Var> params, Sym.Exp body) {
    this.engine = requireNonNull(engine);
    this.params = requireNonNull(params);
    this.body = requireNonNull(body);
  }

  @Override public String toString() {
    return params + " -> " + body;
  }

  /** Evaluates this function on concrete arguments. Each argument is
   * converted to its canonical representation using
   * {@link Values#embed}. */
  public Object evaluate(Object... args) {
    checkArgument(args.length == params.size(),
        "expected %s arguments, got %s", params.size(), args.length);
    final Map<Sym.Var, Object> env = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      final Sym.Var param = params.get(i);
      env.put(param, Values.embed(param.type, args[i]));
    }
    return new Evaluator(env).eval(body);
  }

  /** Finds arguments for which an invariant holds, using the default
   * backend.
   *
   * @param invariant Given the parameters and the body, returns a boolean
   *   expression
   * @return Argument values, or empty if there are none
   */
  public Optional<ImmutableList<Object>> find(
      BiFunction<List<Sym.Exp>, Sym.Exp, Sym.Exp> invariant) {
    return find(invariant, engine.backend());
  }

  /** Finds arguments for which an invariant holds, using a given
   * backend. */
  public Optional<ImmutableList<Object>> find(
      BiFunction<List<Sym.Exp>, Sym.Exp, Sym.Exp> invariant,
      Backend backend) {
    return finder(invariant, backend).find();
  }

  /** Returns every list of arguments for which an invariant holds, sorted,
   * using the default backend. */
  public ImmutableList<ImmutableList<Object>> findAll(
      BiFunction<List<Sym.Exp>, Sym.Exp, Sym.Exp> invariant) {
    return findAll(invariant, engine.backend());
  }

  /** Returns every list of arguments for which an invariant holds, sorted,
   * using a given backend. */
  public ImmutableList<ImmutableList<Object>> findAll(
      BiFunction<List<Sym.Exp>, Sym.Exp, Sym.Exp> invariant,
      Backend backend) {
    return finder(invariant, backend).findAll();
  }

  private Finder finder(BiFunction<List<Sym.Exp>, Sym.Exp, Sym.Exp> invariant,
      Backend backend) {
    final Sym.Exp constraint =
        invariant.apply(ImmutableList.copyOf(params), body);
    checkArgument(constraint.type == PrimitiveType.BOOL,
        "invariant must be boolean, got %s", constraint.type);
    return new Finder(engine, params, constraint, backend);
  }

  /** Generates one list of arguments for each feasible path through this
   * function. */
  public ImmutableList<ImmutableList<Object>> generateInputs() {
    return generateInputs(args -> engine.builder().trueLiteral());
  }

  /** Generates one list of arguments for each path through this function
   * that is feasible under a precondition. */
  public ImmutableList<ImmutableList<Object>> generateInputs(
      Function<List<Sym.Exp>, Sym.Exp> precondition) {
    return generateInputs(precondition, ImmutableMap.of());
  }

  /** Generates inputs, with the values of some parameters given.
   *
   * @param precondition Boolean expression over the parameters
   * @param bound Values of parameters, keyed by ordinal
   */
  public ImmutableList<ImmutableList<Object>> generateInputs(
      Function<List<Sym.Exp>, Sym.Exp> precondition,
      Map<Integer, Object> bound) {
    return new InputGenerator(engine, params, body,
        precondition.apply(ImmutableList.copyOf(params)), bound).generate();
  }

  /** Returns a transformer of state sets for this function, which must
   * have one parameter. */
  public StateSetTransformer transformer() {
    return engine.transformerManager().transformer(this);
  }
}

// End SymFunction.java

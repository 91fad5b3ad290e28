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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.symbex.Engine;
import net.hydromatic.symbex.Prop;
import net.hydromatic.symbex.ast.Replacer;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.eval.Values;

/**
 * Generates inputs that exercise each path through a function.
 *
 * <p>Explores the paths of the function's body with a
 * {@link PathExplorer}, and for each path asks the general backend for
 * inputs that satisfy the path condition and the precondition. Inputs whose
 * values are given in advance are replaced by literals before the walk.
 */
public class InputGenerator {
  private final Engine engine;
  private final ImmutableList<Sym.Var> params;
  private final Sym.Exp body;
  private final Sym.Exp precondition;
  private final Map<Integer, Object> bound;

  /** Creates an InputGenerator.
   *
   * @param engine Engine
   * @param params Parameters of the function
   * @param body Body of the function
   * @param precondition Boolean expression over the parameters
   * @param bound Values of some parameters, keyed by ordinal
   */
  public InputGenerator(Engine engine, List<Sym.Var> params, Sym.Exp body,
      Sym.Exp precondition, Map<Integer, Object> bound) {
    this.engine = engine;
    this.params = ImmutableList.copyOf(params);
    this.body = body;
    this.precondition = precondition;
    final Map<Integer, Object> map = new LinkedHashMap<>();
    bound.forEach((ordinal, value) -> {
      checkArgument(ordinal >= 0 && ordinal < params.size(),
          "no parameter with ordinal %s", ordinal);
      map.put(ordinal, Values.embed(params.get(ordinal).type, value));
    });
    this.bound = map;
  }

  /** Returns one list of argument values per feasible path, without
   * duplicates, in the order the paths were found. */
  public ImmutableList<ImmutableList<Object>> generate() {
    final SymBuilder builder = engine.builder();
    final Map<Sym.Exp, Sym.Exp> substitutions = new LinkedHashMap<>();
    bound.forEach((ordinal, value) -> {
      final Sym.Var param = params.get(ordinal);
      substitutions.put(param, builder.literal(param.type, value));
    });
    final Sym.Exp body2 = Replacer.substitute(builder, substitutions, body);
    final Sym.Exp precondition2 =
        Replacer.substitute(builder, substitutions, precondition);
    final PathExplorer explorer =
        new PathExplorer(builder, Prop.PATH_DEPTH.intValue(engine.props));

    final Set<ImmutableList<Object>> inputs = new LinkedHashSet<>();
    try (Solver solver = Solvers.create(engine, Backend.GENERAL)) {
      for (int i = 0; i < params.size(); i++) {
        if (!bound.containsKey(i)) {
          solver.declare(params.get(i));
        }
      }
      solver.assertTrue(precondition2);
      for (PathExplorer.Path path : explorer.explore(body2)) {
        solver.push();
        solver.assertTrue(path.condition.conjunction);
        final Assignment assignment = solver.solve();
        engine.tracer().onPath(path.condition.conditions,
            assignment != null);
        if (assignment != null) {
          final ImmutableList.Builder<Object> values =
              ImmutableList.builder();
          for (int i = 0; i < params.size(); i++) {
            values.add(bound.containsKey(i) ? bound.get(i)
                : assignment.get(params.get(i)));
          }
          inputs.add(values.build());
        }
        solver.pop();
      }
    }
    return ImmutableList.copyOf(inputs);
  }
}

// End InputGenerator.java

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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.BitSet;
import java.util.function.BiFunction;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.dd.DdCompiler;
import net.hydromatic.symbex.dd.DdManager;
import net.hydromatic.symbex.dd.DdNode;
import net.hydromatic.symbex.type.Type;

/**
 * Relation between the inputs and outputs of a function, as a decision
 * diagram, that maps sets of inputs to sets of outputs and back.
 *
 * <p>The input is represented by the canonical variables of the input
 * type, the output by the primed variables of the output type.
 */
public class StateSetTransformer {
  private final TransformerManager transformerManager;
  public final Type inputType;
  public final Type outputType;
  private final Sym.Var input;
  private final Sym.Var output;
  /** {@code f(input) == output}, restricted to valid inputs and outputs. */
  private final DdNode relation;

  StateSetTransformer(TransformerManager transformerManager, Sym.Var input,
      Sym.Exp body) {
    this.transformerManager = requireNonNull(transformerManager);
    this.inputType = input.type;
    this.outputType = body.type;
    this.input = input;
    this.output =
        transformerManager.builder.var(outputType, input.name + "'");
    final VariableRegistry registry = transformerManager.registry;
    final DdCompiler compiler = compiler();
    compiler.reserve(input, registry.canonical(inputType));
    compiler.reserve(output, registry.primed(outputType));
    final DdNode eq =
        compiler.compileBool(transformerManager.builder.eq(body, output));
    this.relation = manager().and(eq, compiler.validity());
  }

  private DdManager manager() {
    return transformerManager.manager;
  }

  private DdCompiler compiler() {
    return new DdCompiler(transformerManager.builder.typeSystem(), manager());
  }

  /** Compiles a predicate on the input and output to a diagram over the
   * canonical input and primed output variables. */
  private DdNode predicate(
      BiFunction<Sym.Exp, Sym.Exp, Sym.Exp> predicate) {
    final VariableRegistry registry = transformerManager.registry;
    final DdCompiler compiler = compiler();
    compiler.reserve(input, registry.canonical(inputType));
    compiler.reserve(output, registry.primed(outputType));
    return compiler.compileBool(predicate.apply(input, output));
  }

  /** Returns the set of inputs for which the function is defined; that is,
   * every valid input. */
  public StateSet inputSet() {
    return inputSet((i, o) -> transformerManager.builder.trueLiteral());
  }

  /** Returns the set of inputs that, with their output, satisfy a
   * predicate. */
  public StateSet inputSet(BiFunction<Sym.Exp, Sym.Exp, Sym.Exp> predicate) {
    final DdNode node =
        manager().exists(manager().and(relation, predicate(predicate)),
            bits(transformerManager.registry.primed(outputType)));
    return new StateSet(transformerManager, inputType, node);
  }

  /** Returns the set of outputs of the function over all inputs. */
  public StateSet outputSet() {
    return outputSet((i, o) -> transformerManager.builder.trueLiteral());
  }

  /** Returns the set of outputs that, with their input, satisfy a
   * predicate. */
  public StateSet outputSet(
      BiFunction<Sym.Exp, Sym.Exp, Sym.Exp> predicate) {
    final DdNode node =
        manager().exists(manager().and(relation, predicate(predicate)),
            bits(transformerManager.registry.canonical(inputType)));
    return new StateSet(transformerManager, outputType,
        primedToCanonical(node));
  }

  /** Returns the image of a set of inputs: the set of outputs of the
   * function applied to each. */
  public StateSet transformForward(StateSet inputSet) {
    check(inputSet, inputType);
    final DdNode node =
        manager().exists(manager().and(relation, inputSet.node),
            bits(transformerManager.registry.canonical(inputType)));
    return new StateSet(transformerManager, outputType,
        primedToCanonical(node));
  }

  /** Returns the preimage of a set of outputs: the set of inputs whose
   * output is in the set. */
  public StateSet transformBackwards(StateSet outputSet) {
    check(outputSet, outputType);
    final DdNode node =
        manager().exists(
            manager().and(relation, canonicalToPrimed(outputSet.node)),
            bits(transformerManager.registry.primed(outputType)));
    return new StateSet(transformerManager, inputType, node);
  }

  private void check(StateSet set, Type type) {
    checkArgument(set.transformerManager == transformerManager,
        "state set belongs to a different manager");
    checkArgument(set.type.equals(type),
        "expected a state set of type %s, got %s", type, set.type);
  }

  private static BitSet bits(int[] variables) {
    final BitSet bitSet = new BitSet();
    for (int variable : variables) {
      bitSet.set(variable);
    }
    return bitSet;
  }

  private DdNode primedToCanonical(DdNode node) {
    final VariableRegistry registry = transformerManager.registry;
    return rename(node, registry.primed(outputType),
        registry.canonical(outputType));
  }

  private DdNode canonicalToPrimed(DdNode node) {
    final VariableRegistry registry = transformerManager.registry;
    return rename(node, registry.canonical(outputType),
        registry.primed(outputType));
  }

  private DdNode rename(DdNode node, int[] from, int[] to) {
    final int[] mapping = new int[manager().variableCount()];
    Arrays.fill(mapping, -1);
    for (int i = 0; i < from.length; i++) {
      mapping[from[i]] = to[i];
    }
    return manager().replace(node, mapping);
  }
}

// End StateSetTransformer.java

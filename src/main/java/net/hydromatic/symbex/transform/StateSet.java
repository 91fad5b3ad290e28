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

import java.util.BitSet;
import java.util.Optional;
import net.hydromatic.symbex.dd.DdCompiler;
import net.hydromatic.symbex.dd.DdManager;
import net.hydromatic.symbex.dd.DdNode;
import net.hydromatic.symbex.type.Type;

/**
 * Set of values of a finite type, represented as a decision diagram over
 * the canonical variables of that type.
 *
 * <p>Two state sets are equal if they have the same type, come from the
 * same {@link TransformerManager}, and contain the same values.
 */
public class StateSet {
  final TransformerManager transformerManager;
  public final Type type;
  final DdNode node;

  StateSet(TransformerManager transformerManager, Type type, DdNode node) {
    this.transformerManager = requireNonNull(transformerManager);
    this.type = requireNonNull(type);
    this.node = requireNonNull(node);
  }

  private DdManager manager() {
    return transformerManager.manager;
  }

  void checkCompatible(StateSet that) {
    checkArgument(transformerManager == that.transformerManager,
        "state sets belong to different managers");
    checkArgument(type.equals(that.type),
        "state sets have different types: %s, %s", type, that.type);
  }

  public StateSet intersect(StateSet that) {
    checkCompatible(that);
    return new StateSet(transformerManager, type,
        manager().and(node, that.node));
  }

  public StateSet union(StateSet that) {
    checkCompatible(that);
    return new StateSet(transformerManager, type,
        manager().or(node, that.node));
  }

  /** Returns the set of valid values of this type that are not in this
   * set. */
  public StateSet complement() {
    return new StateSet(transformerManager, type,
        manager().and(manager().not(node),
            transformerManager.registry.validity(type)));
  }

  public boolean isEmpty() {
    return node == manager().zero();
  }

  /** Returns whether this set contains every value of its type. */
  public boolean isFull() {
    return node == transformerManager.registry.validity(type);
  }

  /** Returns a value in this set, or empty. */
  public Optional<Object> element() {
    final BitSet assignment = manager().satOne(node);
    if (assignment == null) {
      return Optional.empty();
    }
    final DdCompiler compiler =
        new DdCompiler(transformerManager.builder.typeSystem(), manager());
    return Optional.of(
        compiler.decode(
            compiler.valueOf(type,
                transformerManager.registry.canonical(type)),
            compiler.model(assignment)));
  }

  @Override public int hashCode() {
    return node.hashCode();
  }

  @Override public boolean equals(Object obj) {
    return this == obj
        || obj instanceof StateSet
            && transformerManager == ((StateSet) obj).transformerManager
            && type.equals(((StateSet) obj).type)
            && node == ((StateSet) obj).node;
  }

  @Override public String toString() {
    return "StateSet{" + type.moniker() + ", " + node + "}";
  }
}

// End StateSet.java

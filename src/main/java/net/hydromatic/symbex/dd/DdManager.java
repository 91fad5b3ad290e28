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

import de.tum.in.jbdd.Bdd;
import de.tum.in.jbdd.BddFactory;
import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Creates and combines binary decision diagrams.
 *
 * <p>Wraps a jbdd {@link Bdd}. Variables are ordered by index, and are
 * never reordered. Each node handle is wrapped by at most one live
 * {@link DdNode}, so that equivalent functions are the same object.
 *
 * <p>A wrapped handle is referenced in the underlying table, and so
 * survives its garbage collection, until {@link #compact} finds that the
 * wrapper has been collected.
 *
 * <p>Not thread-safe.
 */
public class DdManager {
  private final Bdd bdd;
  private final Map<Integer, NodeRef> nodes = new HashMap<>();
  private final ReferenceQueue<DdNode> queue = new ReferenceQueue<>();
  private final DdNode zero;
  private final DdNode one;

  public DdManager() {
    this.bdd = BddFactory.buildBdd();
    this.zero = wrap(bdd.falseNode());
    this.one = wrap(bdd.trueNode());
  }

  public DdNode zero() {
    return zero;
  }

  public DdNode one() {
    return one;
  }

  public DdNode constant(boolean b) {
    return b ? one : zero;
  }

  /** Allocates a new variable and returns its index. */
  public int createVariable() {
    final int index = bdd.numberOfVariables();
    bdd.createVariable();
    return index;
  }

  /** Returns the number of variables allocated so far. */
  public int variableCount() {
    return bdd.numberOfVariables();
  }

  /** Returns the function that is true when a variable is true. */
  public DdNode var(int variable) {
    if (variable < 0 || variable >= bdd.numberOfVariables()) {
      throw new IllegalArgumentException("unknown variable " + variable);
    }
    return wrap(bdd.variableNode(variable));
  }

  /** Releases the handles of nodes that are no longer reachable, so that
   * the underlying table may reclaim them. Returns the number of handles
   * released. */
  public int compact() {
    int count = 0;
    for (Reference<? extends DdNode> r; (r = queue.poll()) != null;) {
      final NodeRef ref = (NodeRef) r;
      bdd.dereference(ref.node);
      nodes.remove(ref.node, ref);
      ++count;
    }
    return count;
  }

  /** Returns the number of node handles currently wrapped. */
  public int nodeCount() {
    return nodes.size();
  }

  private DdNode wrap(int node) {
    final NodeRef ref = nodes.get(node);
    if (ref != null) {
      final DdNode existing = ref.get();
      if (existing != null) {
        return existing;
      }
    }
    final DdNode ddNode = new DdNode(node);
    bdd.reference(node);
    nodes.put(node, new NodeRef(ddNode, node, queue));
    return ddNode;
  }

  // -- operators ------------------------------------------------------------

  /** Returns "if f then g else h". */
  public DdNode ite(DdNode f, DdNode g, DdNode h) {
    return wrap(bdd.ifThenElse(f.node, g.node, h.node));
  }

  public DdNode not(DdNode f) {
    return wrap(bdd.not(f.node));
  }

  public DdNode and(DdNode f, DdNode g) {
    return wrap(bdd.and(f.node, g.node));
  }

  public DdNode or(DdNode f, DdNode g) {
    return wrap(bdd.or(f.node, g.node));
  }

  public DdNode xor(DdNode f, DdNode g) {
    return wrap(bdd.xor(f.node, g.node));
  }

  public DdNode iff(DdNode f, DdNode g) {
    return wrap(bdd.equivalence(f.node, g.node));
  }

  public DdNode implies(DdNode f, DdNode g) {
    return wrap(bdd.implication(f.node, g.node));
  }

  /** Existentially quantifies a set of variables. */
  public DdNode exists(DdNode f, BitSet variables) {
    if (variables.isEmpty()) {
      return f;
    }
    return wrap(bdd.exists(f.node, variables));
  }

  /**
   * Renames variables. {@code mapping[v]} is the new index of variable
   * {@code v}, or -1 to leave it unchanged. The mapping must be injective
   * on the variables of {@code f}.
   */
  public DdNode replace(DdNode f, int[] mapping) {
    final int n = Math.min(mapping.length, bdd.numberOfVariables());
    final int[] substitution = new int[n];
    for (int v = 0; v < n; v++) {
      substitution[v] = bdd.variableNode(mapping[v] >= 0 ? mapping[v] : v);
    }
    return wrap(bdd.compose(f.node, substitution));
  }

  /**
   * Returns a satisfying assignment, or null if {@code f} is false.
   *
   * <p>Follows the low branch whenever it leads to a solution, and leaves
   * variables not on the path false, so returns the lowest assignment.
   */
  public @Nullable BitSet satOne(DdNode f) {
    if (f == zero) {
      return null;
    }
    return bdd.getSatisfyingAssignment(f.node);
  }

  /** Evaluates a function under an assignment (the set of true
   * variables). */
  public boolean evaluate(DdNode f, BitSet assignment) {
    return bdd.evaluate(f.node, assignment);
  }

  /** Weak reference to a wrapper, remembering the handle it wraps. */
  private static final class NodeRef extends WeakReference<DdNode> {
    final int node;

    NodeRef(DdNode referent, int node, ReferenceQueue<DdNode> queue) {
      super(referent, queue);
      this.node = node;
    }
  }
}

// End DdManager.java

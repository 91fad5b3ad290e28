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
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.symbex.ast.Op;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.util.UnionFind;

/**
 * Chooses which variables should have their bits interleaved.
 *
 * <p>Two variables of the same type that are operands of the same binary
 * operator (say {@code x < y} or {@code x + y}) are placed in the same
 * group. Diagrams that relate such variables bit by bit are much smaller
 * if bit <i>i</i> of each variable is adjacent in the variable order.
 */
public class InterleavingHeuristic {
  private final UnionFind<Sym.Var> unionFind = new UnionFind<>();
  private final Set<Sym.Exp> seen = new HashSet<>();
  private final Set<Sym.Var> params = new HashSet<>();

  private InterleavingHeuristic() {
  }

  /** Returns groups of two or more variables that should be
   * interleaved. */
  public static ImmutableList<ImmutableList<Sym.Var>> groups(
      Iterable<? extends Sym.Exp> exps) {
    final InterleavingHeuristic heuristic = new InterleavingHeuristic();
    exps.forEach(heuristic::visit);
    final ImmutableList.Builder<ImmutableList<Sym.Var>> groups =
        ImmutableList.builder();
    for (ImmutableList<Sym.Var> set
        : heuristic.unionFind.getDisjointSets()) {
      if (set.size() > 1) {
        groups.add(set);
      }
    }
    return groups.build();
  }

  private void visit(Sym.Exp e) {
    if (!seen.add(e)) {
      return;
    }
    if (e.op == Op.LAMBDA) {
      params.add(((Sym.Lambda) e).param);
    }
    if (e.args.size() == 2
        && e.arg(0).op == Op.VAR
        && e.arg(1).op == Op.VAR
        && e.arg(0).type.equals(e.arg(1).type)
        && !params.contains((Sym.Var) e.arg(0))
        && !params.contains((Sym.Var) e.arg(1))) {
      final Sym.Var v0 = (Sym.Var) e.arg(0);
      final Sym.Var v1 = (Sym.Var) e.arg(1);
      unionFind.add(v0);
      unionFind.add(v1);
      unionFind.union(v0, v1);
    }
    e.args.forEach(this::visit);
  }
}

// End InterleavingHeuristic.java

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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;

/** Conditions that hold along a path through an expression. */
public class PathCondition {
  /** Branch conditions, in the order they were taken. */
  public final ImmutableList<Sym.Exp> conditions;
  /** Conjunction of {@link #conditions}, simplified. */
  public final Sym.Exp conjunction;

  private PathCondition(ImmutableList<Sym.Exp> conditions,
      Sym.Exp conjunction) {
    this.conditions = requireNonNull(conditions);
    this.conjunction = requireNonNull(conjunction);
  }

  /** Returns the condition of the path that takes no branches. */
  public static PathCondition empty(SymBuilder builder) {
    return new PathCondition(ImmutableList.of(), builder.trueLiteral());
  }

  /** Returns this condition extended with a branch condition. */
  public PathCondition add(SymBuilder builder, Sym.Exp condition) {
    if (condition.isTrue()) {
      return this;
    }
    return new PathCondition(
        ImmutableList.<Sym.Exp>builder().addAll(conditions).add(condition)
            .build(),
        builder.and(conjunction, condition));
  }

  /** Returns the number of branches taken. */
  public int depth() {
    return conditions.size();
  }

  /** Returns whether the condition simplified to false, so that the path
   * can never be taken. */
  public boolean isInfeasible() {
    return conjunction.isFalse();
  }

  @Override public String toString() {
    return conjunction.toString();
  }
}

// End PathCondition.java

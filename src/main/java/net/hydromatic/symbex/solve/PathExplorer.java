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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.symbex.ast.Replacer;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.ast.SymBuilder;
import net.hydromatic.symbex.eval.Values;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.util.Static;

/**
 * Enumerates the paths through an expression.
 *
 * <p>Each conditional forks the walk: one path assumes the condition, the
 * other its negation. {@code a && b} and {@code a || b} fork as if they were
 * written with conditionals. A case analysis of a list forks on whether
 * the list is empty; on the non-empty branch its body is expanded, so a
 * recursive function over a list unrolls one level per branch. A path
 * whose condition simplifies to false is dropped. Once a path has taken
 * {@code maxDepth} branches, conditionals below it no longer fork, and
 * recursion is no longer unrolled.
 */
public class PathExplorer {
  private final SymBuilder builder;
  private final int maxDepth;

  public PathExplorer(SymBuilder builder, int maxDepth) {
    this.builder = requireNonNull(builder);
    this.maxDepth = maxDepth;
  }

  /** Returns the paths through an expression. Applications of lambdas are
   * inlined first. */
  public ImmutableList<Path> explore(Sym.Exp e) {
    final Sym.Exp e2 = Replacer.inline(builder, e);
    return ImmutableList.copyOf(explore(e2, PathCondition.empty(builder)));
  }

  private List<Path> explore(Sym.Exp e, PathCondition pc) {
    switch (e.op) {
    case LITERAL:
    case VAR:
    case LAMBDA:
      return ImmutableList.of(new Path(pc, e));

    case IF:
      final List<Path> paths = new ArrayList<>();
      for (Path c : explore(e.arg(0), pc)) {
        if (c.condition.depth() >= maxDepth) {
          paths.add(
              new Path(c.condition,
                  builder.ifThenElse(c.value, e.arg(1), e.arg(2))));
          continue;
        }
        paths.addAll(
            fork(c.condition, c.value,
                pc2 -> explore(e.arg(1), pc2),
                pc2 -> explore(e.arg(2), pc2)));
      }
      return paths;

    case AND:
      // "if not a then false else if not b then false else true"
      return branch(e, pc, false);

    case OR:
      // "if a then true else if b then true else false"
      return branch(e, pc, true);

    case LIST_CASE:
      return listCase((Sym.ListCase) e, pc);

    default:
      return compose(e, pc);
    }
  }

  /** Explores a conjunction or disjunction. The second operand is
   * explored only on paths where the first does not decide the result. */
  private List<Path> branch(Sym.Exp e, PathCondition pc, boolean isOr) {
    final Function<PathCondition, List<Path>> decided =
        pc2 -> single(pc2, builder.boolLiteral(isOr));
    final Function<PathCondition, List<Path>> second =
        pc2 -> decide(e.arg(1), pc2);
    final List<Path> paths = new ArrayList<>();
    for (Path a : explore(e.arg(0), pc)) {
      if (a.condition.depth() >= maxDepth) {
        paths.add(
            new Path(a.condition,
                builder.copy(e, ImmutableList.of(a.value, e.arg(1)))));
        continue;
      }
      paths.addAll(isOr
          ? fork(a.condition, a.value, decided, second)
          : fork(a.condition, a.value, second, decided));
    }
    return paths;
  }

  /** Explores a case analysis of a list. */
  private List<Path> listCase(Sym.ListCase e, PathCondition pc) {
    final ListType listType = (ListType) e.arg(0).type;
    final List<Path> paths = new ArrayList<>();
    for (Path l : explore(e.arg(0), pc)) {
      if (l.condition.depth() >= maxDepth) {
        paths.add(
            new Path(l.condition,
                builder.copy(e, ImmutableList.of(l.value, e.arg(1)))));
        continue;
      }
      final Sym.Exp isEmpty =
          builder.eq(builder.listLength(l.value),
              builder.intLiteral(builder.typeSystem().lengthType(listType), 0));
      paths.addAll(
          fork(l.condition, isEmpty,
              pc2 -> explore(e.arg(1), pc2),
              pc2 -> explore(expand(e, l.value), pc2)));
    }
    return paths;
  }

  /** Returns the body of a case analysis, for a list that is not empty. */
  private Sym.Exp expand(Sym.ListCase e, Sym.Exp list) {
    final ListType listType = (ListType) list.type;
    final Sym.Exp head =
        builder.valueOr(builder.listHead(list),
            builder.literal(listType.elementType,
                Values.defaultValue(listType.elementType)));
    final Sym.Exp body =
        Replacer.substitute(builder,
            ImmutableMap.of(e.head, head, e.tail, builder.listTail(list)),
            e.body());
    return Replacer.inline(builder, body);
  }

  /** Explores a boolean expression, forking on its value so that the value
   * on each path is a literal. */
  private List<Path> decide(Sym.Exp e, PathCondition pc) {
    final List<Path> paths = new ArrayList<>();
    for (Path b : explore(e, pc)) {
      if (b.condition.depth() >= maxDepth) {
        paths.add(b);
      } else {
        paths.addAll(
            fork(b.condition, b.value,
                pc2 -> single(pc2, builder.trueLiteral()),
                pc2 -> single(pc2, builder.falseLiteral())));
      }
    }
    return paths;
  }

  private static List<Path> single(PathCondition pc, Sym.Exp value) {
    return ImmutableList.of(new Path(pc, value));
  }

  /** Explores the "then" continuation assuming a condition and the "else"
   * continuation assuming its negation, dropping infeasible paths. */
  private List<Path> fork(PathCondition pc, Sym.Exp condition,
      Function<PathCondition, List<Path>> ifTrue,
      Function<PathCondition, List<Path>> ifFalse) {
    final List<Path> paths = new ArrayList<>();
    final PathCondition pcTrue = pc.add(builder, condition);
    if (!pcTrue.isInfeasible()) {
      paths.addAll(ifTrue.apply(pcTrue));
    }
    final PathCondition pcFalse = pc.add(builder, builder.not(condition));
    if (!pcFalse.isInfeasible()) {
      paths.addAll(ifFalse.apply(pcFalse));
    }
    return paths;
  }

  /** Explores each operand in turn, and rebuilds the node for each
   * combination of operand paths. */
  private List<Path> compose(Sym.Exp e, PathCondition pc) {
    List<Partial> partials = ImmutableList.of(new Partial(pc,
        ImmutableList.of()));
    for (Sym.Exp arg : e.args) {
      final List<Partial> next = new ArrayList<>();
      for (Partial partial : partials) {
        for (Path path : explore(arg, partial.condition)) {
          next.add(
              new Partial(path.condition,
                  Static.append(partial.values, path.value)));
        }
      }
      partials = next;
    }
    final List<Path> paths = new ArrayList<>();
    for (Partial partial : partials) {
      paths.add(new Path(partial.condition, builder.copy(e, partial.values)));
    }
    return paths;
  }

  /** A path and the value of the expression along it. */
  public static class Path {
    public final PathCondition condition;
    /** Value of the expression on this path; contains no conditionals
     * unless the path reached the depth limit. */
    public final Sym.Exp value;

    Path(PathCondition condition, Sym.Exp value) {
      this.condition = requireNonNull(condition);
      this.value = requireNonNull(value);
    }

    @Override public String toString() {
      return condition + " => " + value;
    }
  }

  /** Values of the operands explored so far, and the condition under which
   * they hold. */
  private static class Partial {
    final PathCondition condition;
    final ImmutableList<Sym.Exp> values;

    Partial(PathCondition condition, ImmutableList<Sym.Exp> values) {
      this.condition = condition;
      this.values = values;
    }
  }
}

// End PathExplorer.java

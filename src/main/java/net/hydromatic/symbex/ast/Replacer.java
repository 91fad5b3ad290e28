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
package net.hydromatic.symbex.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites an expression, replacing variables and inlining applications of
 * lambdas.
 *
 * <p>Each rewritten node is rebuilt via {@link SymBuilder#copy}, so the
 * result is simplified and interned. Shared sub-expressions are rewritten
 * once. The body of a {@link Sym.ListCase} is rewritten when it is first
 * built.
 */
public class Replacer {
  private final SymBuilder builder;
  private final ImmutableMap<Sym.Exp, Sym.Exp> substitutions;
  private final boolean inline;
  private final Map<Sym.Exp, Sym.Exp> cache = new HashMap<>();

  private Replacer(SymBuilder builder,
      Map<? extends Sym.Exp, ? extends Sym.Exp> substitutions,
      boolean inline) {
    this.builder = requireNonNull(builder);
    this.substitutions = ImmutableMap.copyOf(substitutions);
    this.inline = inline;
  }

  /** Replaces variables in an expression. */
  public static Sym.Exp substitute(SymBuilder builder,
      Map<? extends Sym.Exp, ? extends Sym.Exp> substitutions, Sym.Exp e) {
    if (substitutions.isEmpty()) {
      return e;
    }
    return new Replacer(builder, substitutions, false).visit(e);
  }

  /** Replaces each application of a lambda by the lambda's body, with the
   * argument substituted for the parameter. */
  public static Sym.Exp inline(SymBuilder builder, Sym.Exp e) {
    return new Replacer(builder, ImmutableMap.of(), true).visit(e);
  }

  private Sym.Exp visit(Sym.Exp e) {
    Sym.Exp e2 = cache.get(e);
    if (e2 == null) {
      e2 = visit2(e);
      cache.put(e, e2);
    }
    return e2;
  }

  private Sym.Exp visit2(Sym.Exp e) {
    switch (e.op) {
    case LITERAL:
    case VAR:
      return substitutions.getOrDefault(e, e);
    default:
      break;
    }
    final List<Sym.Exp> args = new ArrayList<>(e.args.size());
    boolean changed = false;
    for (Sym.Exp arg : e.args) {
      final Sym.Exp arg2 = visit(arg);
      args.add(arg2);
      changed |= arg2 != arg;
    }
    if (inline && e.op == Op.APPLY) {
      return beta(args.get(0), args.get(1));
    }
    if (e.op == Op.LIST_CASE) {
      final Sym.ListCase listCase = (Sym.ListCase) e;
      return builder.listCase(args.get(0), args.get(1), (head, tail) ->
          new Replacer(builder, substitutions, inline)
              .visit(listCase.cons.apply(head, tail)));
    }
    return changed ? builder.copy(e, args) : e;
  }

  private Sym.Exp beta(Sym.Exp fn, Sym.Exp arg) {
    switch (fn.op) {
    case LAMBDA:
      final Sym.Lambda lambda = (Sym.Lambda) fn;
      final Sym.Exp body =
          substitute(builder, ImmutableMap.of(lambda.param, arg), lambda.body);
      return inline(builder, body);
    case IF:
      return builder.ifThenElse(fn.arg(0), beta(fn.arg(1), arg),
          beta(fn.arg(2), arg));
    default:
      return builder.apply(fn, arg);
    }
  }
}

// End Replacer.java

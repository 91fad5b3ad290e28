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
package net.hydromatic.symbex.compile;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.symbex.ast.Sym;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each compiled
   * expression, then calls the underlying tracer. */
  public static Tracer withOnCompile(Tracer tracer,
      BiConsumer<Backend, Sym.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCompile(Backend backend, Sym.Exp e) {
        consumer.accept(backend, e);
        super.onCompile(backend, e);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * satisfiability check, then calls the underlying tracer. */
  public static Tracer withOnSolve(Tracer tracer,
      BiConsumer<Backend, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSolve(Backend backend, boolean satisfiable) {
        consumer.accept(backend, satisfiable);
        super.onSolve(backend, satisfiable);
      }
    };
  }

  public static Tracer withOnPath(Tracer tracer,
      BiConsumer<List<Sym.Exp>, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPath(List<Sym.Exp> conditions,
          boolean feasible) {
        consumer.accept(conditions, feasible);
        super.onPath(conditions, feasible);
      }
    };
  }

  public static Tracer withOnCompact(Tracer tracer,
      Consumer<Integer> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCompact(int removed) {
        consumer.accept(removed);
        super.onCompact(removed);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onCompile(Backend backend, Sym.Exp e) {
    }

    @Override public void onSolve(Backend backend, boolean satisfiable) {
    }

    @Override public void onPath(List<Sym.Exp> conditions,
        boolean feasible) {
    }

    @Override public void onCompact(int removed) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onCompile(Backend backend, Sym.Exp e) {
      tracer.onCompile(backend, e);
    }

    @Override public void onSolve(Backend backend, boolean satisfiable) {
      tracer.onSolve(backend, satisfiable);
    }

    @Override public void onPath(List<Sym.Exp> conditions,
        boolean feasible) {
      tracer.onPath(conditions, feasible);
    }

    @Override public void onCompact(int removed) {
      tracer.onCompact(removed);
    }
  }
}

// End Tracers.java

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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.symbex.ast.Sym;

/** Values of variables that satisfy a constraint. */
public class Assignment {
  private final ImmutableMap<Sym.Var, Object> values;

  public Assignment(Map<Sym.Var, Object> values) {
    this.values = ImmutableMap.copyOf(values);
  }

  /** Returns the value of a variable.
   *
   * @throws IllegalArgumentException if the variable was not declared to
   *   the solver */
  public Object get(Sym.Var var) {
    final Object value = values.get(var);
    checkArgument(value != null, "variable not in assignment: %s", var);
    return value;
  }

  public ImmutableMap<Sym.Var, Object> values() {
    return values;
  }

  @Override public String toString() {
    return values.toString();
  }
}

// End Assignment.java

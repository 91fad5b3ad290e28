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

import java.util.Map;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.Type;

/**
 * Reads the values of backend terms from a satisfying assignment.
 *
 * @param <B> Backend boolean term
 * @param <W> Backend scalar term
 */
public interface ModelView<B, W> {
  /** Returns the value of a boolean term. */
  boolean bool(B b);

  /** Returns the value of a scalar term, in the canonical representation of
   * its type (see {@link net.hydromatic.symbex.eval.Values}). */
  Object scalar(Type type, W w);

  /** Returns the value of a map, given its presence and value arrays. */
  Map<Object, Object> map(MapType type, W present, W values);
}

// End ModelView.java

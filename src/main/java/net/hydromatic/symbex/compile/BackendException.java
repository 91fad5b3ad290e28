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

import static java.util.Objects.requireNonNull;

import net.hydromatic.symbex.util.SymbexException;

/**
 * A backend cannot compile or solve an expression.
 *
 * <p>For example, the bounded backend cannot handle a sequence, or the
 * product of two variables. {@link #suggested} is the backend that the caller
 * should use instead.
 */
public class BackendException extends RuntimeException
    implements SymbexException {
  public final Backend backend;
  public final Backend suggested;

  public BackendException(String message, Backend backend,
      Backend suggested) {
    super(message);
    this.backend = requireNonNull(backend);
    this.suggested = requireNonNull(suggested);
  }

  /** Creates an exception for an expression that the bounded backend cannot
   * handle. */
  public static BackendException notBounded(String message) {
    return new BackendException(message + "; use the general backend",
        Backend.BOUNDED, Backend.GENERAL);
  }
}

// End BackendException.java

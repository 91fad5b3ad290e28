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
package net.hydromatic.symbex.type;

import net.hydromatic.symbex.util.SymbexException;

/**
 * A value is outside the valid range of its type; for example, a character
 * code above {@link PrimitiveType#MAX_CHAR}, or 256 as a {@code uint8}.
 */
public class DomainException extends RuntimeException
    implements SymbexException {
  public DomainException(String message) {
    super(message);
  }
}

// End DomainException.java

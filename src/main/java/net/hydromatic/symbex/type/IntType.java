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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import java.util.Objects;
import net.hydromatic.symbex.ast.Op;

/**
 * Fixed-width integer type, signed or unsigned, of any width from 1 bit.
 *
 * <p>Values are {@link BigInteger}s in the range {@link #min()} to
 * {@link #max()}. Arithmetic wraps around, as in two's complement.
 */
public class IntType extends BaseType {
  public final int width;
  public final boolean signed;

  IntType(int width, boolean signed) {
    super(Op.INT_TYPE);
    checkArgument(width > 0, "width must be positive: %s", width);
    this.width = width;
    this.signed = signed;
  }

  @Override
  public String moniker() {
    return (signed ? "int" : "uint") + width;
  }

  @Override
  public boolean isFinite() {
    return true;
  }

  @Override
  public boolean isAtomic() {
    return true;
  }

  @Override
  public <R> R accept(TypeVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, signed);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof IntType
            && width == ((IntType) o).width
            && signed == ((IntType) o).signed;
  }

  /** Returns the smallest value. */
  public BigInteger min() {
    return signed ? BigInteger.ONE.shiftLeft(width - 1).negate()
        : BigInteger.ZERO;
  }

  /** Returns the largest value. */
  public BigInteger max() {
    return signed ? BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE)
        : BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }

  /** Returns whether a value is in range. */
  public boolean contains(BigInteger value) {
    return value.compareTo(min()) >= 0 && value.compareTo(max()) <= 0;
  }

  /** Reduces a value into range, modulo 2<sup>width</sup>. */
  public BigInteger wrap(BigInteger value) {
    final BigInteger modulus = BigInteger.ONE.shiftLeft(width);
    final BigInteger v = value.mod(modulus);
    if (signed && v.testBit(width - 1)) {
      return v.subtract(modulus);
    }
    return v;
  }

  /** Returns the unsigned bit pattern of a value in range. */
  public BigInteger toUnsigned(BigInteger value) {
    return value.signum() < 0 ? value.add(BigInteger.ONE.shiftLeft(width))
        : value;
  }

  /** Converts an unsigned bit pattern to a value of this type. */
  public BigInteger fromUnsigned(BigInteger bits) {
    return wrap(bits);
  }
}

// End IntType.java

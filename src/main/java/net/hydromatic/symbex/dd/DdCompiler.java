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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PrimitiveIterator;
import net.hydromatic.symbex.ast.Op;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.BackendException;
import net.hydromatic.symbex.compile.ModelView;
import net.hydromatic.symbex.compile.SymValue;
import net.hydromatic.symbex.compile.SymbolicCompiler;
import net.hydromatic.symbex.type.ConstMapType;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.OptionType;
import net.hydromatic.symbex.type.PrimitiveType;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles expressions to binary decision diagrams.
 *
 * <p>Every value is a vector of bits; a scalar is an array of
 * {@link DdNode}, least significant bit first. Integer arithmetic is
 * bit-blasted.
 *
 * <p>Types must be finite. Sequences, maps, sets, bags and {@code bigint}
 * cause {@link BackendException}, as does multiplication of two
 * non-literal operands. A map whose keys are constants is finite if its
 * values are; each key has its own bits.
 */
public class DdCompiler extends SymbolicCompiler<DdNode, DdNode[]> {
  /** Number of bits in a {@code char}. */
  public static final int CHAR_WIDTH = 16;

  private final DdManager manager;
  /** BDD variables requested for variables not yet compiled. */
  private final Map<Sym.Var, int[]> reserved = new HashMap<>();
  /** BDD variables of each compiled variable, in leaf order. */
  private final Map<Sym.Var, int[]> allocated = new LinkedHashMap<>();
  /** Supplies BDD variables while a variable is being created. */
  private PrimitiveIterator.@Nullable OfInt bitSource;

  public DdCompiler(TypeSystem typeSystem, DdManager manager) {
    super(Backend.BOUNDED, typeSystem);
    this.manager = manager;
  }

  public DdManager manager() {
    return manager;
  }

  /** Returns the number of BDD variables needed to represent a value of a
   * type.
   *
   * @throws BackendException if the type is not finite */
  public static int bitCount(Type type) {
    switch (type.op()) {
    case BOOL_TYPE:
      return 1;
    case INT_TYPE:
      return ((IntType) type).width;
    case CHAR_TYPE:
      return CHAR_WIDTH;
    case OBJECT_TYPE:
      return ((ObjectType) type).fieldTypes.values().stream()
          .mapToInt(DdCompiler::bitCount)
          .sum();
    case OPTION_TYPE:
      return 1 + bitCount(((OptionType) type).elementType);
    case LIST_TYPE:
      final ListType listType = (ListType) type;
      return listType.lengthWidth()
          + listType.capacity * bitCount(listType.elementType);
    case CONST_MAP_TYPE:
      final ConstMapType constMapType = (ConstMapType) type;
      return constMapType.keys.size() * bitCount(constMapType.valueType);
    default:
      throw notFinite(type);
    }
  }

  private static BackendException notFinite(Type type) {
    return BackendException.notBounded("type " + type.moniker()
        + " is not finite");
  }

  /** Requests that a variable, when first compiled, use the given BDD
   * variables. */
  public void reserve(Sym.Var var, int[] bits) {
    checkArgument(bits.length == bitCount(var.type),
        "wrong number of bits for %s", var);
    checkArgument(!allocated.containsKey(var), "already compiled: %s", var);
    reserved.put(var, bits.clone());
  }

  /** Allocates variables in groups, interleaving the bits of the members
   * of each group. See {@link InterleavingHeuristic}. */
  public void interleave(List<? extends List<Sym.Var>> groups) {
    for (List<Sym.Var> group : groups) {
      final int bitCount = bitCount(group.get(0).type);
      final int[][] bits = new int[group.size()][bitCount];
      for (int i = 0; i < bitCount; i++) {
        for (int[] memberBits : bits) {
          memberBits[i] = manager.createVariable();
        }
      }
      for (int j = 0; j < group.size(); j++) {
        reserve(group.get(j), bits[j]);
      }
    }
  }

  /** Returns the BDD variables of a variable, compiling it if
   * necessary. */
  public int[] bits(Sym.Var var) {
    variable(var);
    return allocated.get(var).clone();
  }

  /** Returns the value whose bits are the given BDD variables. */
  public SymValue<DdNode, DdNode[]> valueOf(Type type, int[] bits) {
    checkArgument(bits.length == bitCount(type));
    bitSource = Arrays.stream(bits).iterator();
    try {
      return fresh(type, "value");
    } finally {
      bitSource = null;
    }
  }

  @Override protected SymValue<DdNode, DdNode[]> freshVariable(Sym.Var var) {
    int[] bits = reserved.remove(var);
    if (bits == null) {
      bits = new int[bitCount(var.type)];
      for (int i = 0; i < bits.length; i++) {
        bits[i] = manager.createVariable();
      }
    }
    allocated.put(var, bits);
    bitSource = Arrays.stream(bits).iterator();
    try {
      return super.freshVariable(var);
    } finally {
      bitSource = null;
    }
  }

  private int nextBit() {
    return bitSource == null ? manager.createVariable() : bitSource.nextInt();
  }

  @Override protected void check(Sym.Exp e) {
    if (!e.type.isFinite()) {
      throw notFinite(e.type);
    }
  }

  /** Returns a view of an assignment of BDD variables. */
  public ModelView<DdNode, DdNode[]> model(BitSet assignment) {
    return new ModelView<DdNode, DdNode[]>() {
      @Override public boolean bool(DdNode b) {
        return manager.evaluate(b, assignment);
      }

      @Override public Object scalar(Type type, DdNode[] w) {
        BigInteger bits = BigInteger.ZERO;
        for (int i = 0; i < w.length; i++) {
          if (manager.evaluate(w[i], assignment)) {
            bits = bits.setBit(i);
          }
        }
        if (type == PrimitiveType.CHAR) {
          return (char) bits.intValue();
        }
        return ((IntType) type).fromUnsigned(bits);
      }

      @Override public Map<Object, Object> map(MapType type,
          DdNode[] present, DdNode[] values) {
        throw notFinite(type);
      }
    };
  }

  // -- theory ---------------------------------------------------------------

  @Override protected SymValue<DdNode, DdNode[]> theory(Sym.Exp e,
      List<SymValue<DdNode, DdNode[]>> args) {
    switch (e.op) {
    case PLUS:
      return scalar(e.type, add(bits(args.get(0)), bits(args.get(1))));

    case MINUS:
      return scalar(e.type,
          subtract(bits(args.get(0)), bits(args.get(1))));

    case TIMES:
      if (e.arg(0).isLiteral()) {
        return scalar(e.type,
            multiply(bits(args.get(1)), literal(e.type, e.arg(0))));
      }
      if (e.arg(1).isLiteral()) {
        return scalar(e.type,
            multiply(bits(args.get(0)), literal(e.type, e.arg(1))));
      }
      throw BackendException.notBounded("multiplication of two non-literal "
          + "values: " + e);

    case BIT_AND:
    case BIT_OR:
    case BIT_XOR:
      return scalar(e.type,
          bitwise(e.op, bits(args.get(0)), bits(args.get(1))));

    case BIT_NOT:
      return scalar(e.type, not(bits(args.get(0))));

    case LT:
      return bool(
          lessThan(bits(args.get(0)), bits(args.get(1)),
              isSigned(e.arg(0).type)));

    case LE:
      return bool(
          manager.not(
              lessThan(bits(args.get(1)), bits(args.get(0)),
                  isSigned(e.arg(0).type))));

    case CAST:
      return scalar(e.type,
          cast(bits(args.get(0)), isSigned(e.arg(0).type),
              width(e.type)));

    default:
      throw BackendException.notBounded("operator " + e.op
          + " is not supported");
    }
  }

  private static DdNode[] bits(SymValue<DdNode, DdNode[]> v) {
    return ((SymValue.Scalar<DdNode, DdNode[]>) v).value;
  }

  private SymValue<DdNode, DdNode[]> scalar(Type type, DdNode[] bits) {
    return new SymValue.Scalar<>(type, bits);
  }

  private static BigInteger literal(Type type, Sym.Exp e) {
    final BigInteger value = ((Sym.Literal) e).unwrap(BigInteger.class);
    return ((IntType) type).toUnsigned(value);
  }

  private static boolean isSigned(Type type) {
    return type instanceof IntType && ((IntType) type).signed;
  }

  private static int width(Type type) {
    switch (type.op()) {
    case INT_TYPE:
      return ((IntType) type).width;
    case CHAR_TYPE:
      return CHAR_WIDTH;
    default:
      throw notFinite(type);
    }
  }

  private DdNode[] add(DdNode[] a, DdNode[] b) {
    return add(a, b, manager.zero());
  }

  /** Ripple-carry addition, modulo 2<sup>width</sup>. */
  private DdNode[] add(DdNode[] a, DdNode[] b, DdNode carryIn) {
    final DdNode[] sum = new DdNode[a.length];
    DdNode carry = carryIn;
    for (int i = 0; i < a.length; i++) {
      final DdNode x = manager.xor(a[i], b[i]);
      sum[i] = manager.xor(x, carry);
      carry = manager.or(manager.and(a[i], b[i]), manager.and(carry, x));
    }
    return sum;
  }

  /** Subtraction as {@code a + ~b + 1}. */
  private DdNode[] subtract(DdNode[] a, DdNode[] b) {
    return add(a, not(b), manager.one());
  }

  /** Shift-and-add multiplication by a constant. */
  private DdNode[] multiply(DdNode[] a, BigInteger k) {
    DdNode[] product = constant(a.length, BigInteger.ZERO);
    for (int i = 0; i < a.length; i++) {
      if (k.testBit(i)) {
        product = add(product, shiftLeft(a, i));
      }
    }
    return product;
  }

  private DdNode[] shiftLeft(DdNode[] a, int n) {
    final DdNode[] r = new DdNode[a.length];
    for (int i = 0; i < a.length; i++) {
      r[i] = i < n ? manager.zero() : a[i - n];
    }
    return r;
  }

  private DdNode[] bitwise(Op op, DdNode[] a, DdNode[] b) {
    final DdNode[] r = new DdNode[a.length];
    for (int i = 0; i < a.length; i++) {
      switch (op) {
      case BIT_AND:
        r[i] = manager.and(a[i], b[i]);
        break;
      case BIT_OR:
        r[i] = manager.or(a[i], b[i]);
        break;
      case BIT_XOR:
        r[i] = manager.xor(a[i], b[i]);
        break;
      default:
        throw new AssertionError("unknown op " + op);
      }
    }
    return r;
  }

  private DdNode[] not(DdNode[] a) {
    final DdNode[] r = new DdNode[a.length];
    for (int i = 0; i < a.length; i++) {
      r[i] = manager.not(a[i]);
    }
    return r;
  }

  /** Returns whether {@code a < b}. A signed comparison is an unsigned
   * comparison with the sign bits inverted. */
  private DdNode lessThan(DdNode[] a, DdNode[] b, boolean signed) {
    DdNode lt = manager.zero();
    for (int i = 0; i < a.length; i++) {
      DdNode x = a[i];
      DdNode y = b[i];
      if (signed && i == a.length - 1) {
        x = manager.not(x);
        y = manager.not(y);
      }
      lt = manager.or(manager.and(manager.not(x), y),
          manager.and(manager.iff(x, y), lt));
    }
    return lt;
  }

  /** Truncates, or extends with zeros or copies of the sign bit. */
  private DdNode[] cast(DdNode[] a, boolean signed, int width) {
    final DdNode[] r = new DdNode[width];
    for (int i = 0; i < width; i++) {
      r[i] = i < a.length ? a[i]
          : signed ? a[a.length - 1]
          : manager.zero();
    }
    return r;
  }

  private DdNode[] constant(int width, BigInteger bits) {
    final DdNode[] r = new DdNode[width];
    for (int i = 0; i < width; i++) {
      r[i] = manager.constant(bits.testBit(i));
    }
    return r;
  }

  // -- primitives -----------------------------------------------------------

  @Override public DdNode trueTerm() {
    return manager.one();
  }

  @Override public DdNode falseTerm() {
    return manager.zero();
  }

  @Override public DdNode and(DdNode a, DdNode b) {
    return manager.and(a, b);
  }

  @Override public DdNode or(DdNode a, DdNode b) {
    return manager.or(a, b);
  }

  @Override public DdNode not(DdNode a) {
    return manager.not(a);
  }

  @Override public DdNode iff(DdNode a, DdNode b) {
    return manager.iff(a, b);
  }

  @Override public DdNode ite(DdNode c, DdNode a, DdNode b) {
    return manager.ite(c, a, b);
  }

  @Override protected DdNode boolVariable(String name) {
    return manager.var(nextBit());
  }

  @Override protected DdNode[] scalarVariable(Type type, String name) {
    final DdNode[] bits = new DdNode[width(type)];
    for (int i = 0; i < bits.length; i++) {
      bits[i] = manager.var(nextBit());
    }
    return bits;
  }

  @Override protected DdNode[] scalarConstant(Type type, Object value) {
    final BigInteger bits = type == PrimitiveType.CHAR
        ? BigInteger.valueOf((Character) value)
        : ((IntType) type).toUnsigned((BigInteger) value);
    return constant(width(type), bits);
  }

  @Override protected DdNode[] scalarIte(DdNode c, DdNode[] a, DdNode[] b) {
    final DdNode[] r = new DdNode[a.length];
    for (int i = 0; i < a.length; i++) {
      r[i] = manager.ite(c, a[i], b[i]);
    }
    return r;
  }

  @Override protected DdNode scalarEq(Type type, DdNode[] a, DdNode[] b) {
    DdNode eq = manager.one();
    for (int i = 0; i < a.length; i++) {
      eq = manager.and(eq, manager.iff(a[i], b[i]));
    }
    return eq;
  }

  @Override protected DdNode[] intAdd(IntType type, DdNode[] a, DdNode[] b) {
    return add(a, b);
  }

  @Override protected DdNode intLt(IntType type, DdNode[] a, DdNode[] b) {
    return lessThan(a, b, type.signed);
  }

  @Override protected DdNode intLe(IntType type, DdNode[] a, DdNode[] b) {
    return manager.not(lessThan(b, a, type.signed));
  }

  @Override protected SymValue<DdNode, DdNode[]> mapConstant(MapType type,
      Map<?, ?> map) {
    throw notFinite(type);
  }

  @Override protected SymValue<DdNode, DdNode[]> freshMap(MapType type,
      String name) {
    throw notFinite(type);
  }

  @Override protected DdNode mapEq(MapType type,
      SymValue.MapPair<DdNode, DdNode[]> a,
      SymValue.MapPair<DdNode, DdNode[]> b) {
    throw notFinite(type);
  }
}

// End DdCompiler.java

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
package net.hydromatic.symbex.z3;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.FuncInterp;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Model;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.symbex.ast.Op;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.compile.Backend;
import net.hydromatic.symbex.compile.BackendException;
import net.hydromatic.symbex.compile.ModelView;
import net.hydromatic.symbex.compile.SymValue;
import net.hydromatic.symbex.compile.SymbolicCompiler;
import net.hydromatic.symbex.eval.Values;
import net.hydromatic.symbex.type.BagType;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.PrimitiveType;
import net.hydromatic.symbex.type.SeqType;
import net.hydromatic.symbex.type.SetType;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles expressions to Z3 terms.
 *
 * <p>Fixed-width integers and {@code char} are bit-vectors; {@code bigint}
 * is an unbounded integer; strings and sequences use the sequence theory;
 * sets are arrays to Bool, bags arrays to Int, and a map is a pair of
 * arrays.
 *
 * <p>A set, bag or map variable differs from the empty collection at no
 * more than {@code containerSize} symbolic keys, so that every model of it
 * decodes to a finite value.
 */
@SuppressWarnings("unchecked")
public class Z3Compiler extends SymbolicCompiler<BoolExpr, Expr<?>> {
  /** Matches the escapes in strings returned by Z3. */
  private static final Pattern ESCAPE =
      Pattern.compile("\\\\u\\{([0-9a-fA-F]+)\\}");

  private final Context context;
  private final int containerSize;
  private int boundCount;

  public Z3Compiler(TypeSystem typeSystem, Context context,
      int containerSize) {
    super(Backend.GENERAL, typeSystem);
    this.context = context;
    this.containerSize = containerSize;
  }

  /** Returns the Z3 sort of an atomic, sequence, set or bag type. */
  Sort sort(Type type) {
    switch (type.op()) {
    case BOOL_TYPE:
      return context.mkBoolSort();
    case INT_TYPE:
      return context.mkBitVecSort(((IntType) type).width);
    case CHAR_TYPE:
      return context.mkBitVecSort(16);
    case BIGINT_TYPE:
      return context.mkIntSort();
    case STRING_TYPE:
      return context.mkStringSort();
    case SEQ_TYPE:
      return context.mkSeqSort(sort(((SeqType) type).elementType));
    case SET_TYPE:
      return context.mkArraySort(sort(((SetType) type).elementType),
          context.mkBoolSort());
    case BAG_TYPE:
      return context.mkArraySort(sort(((BagType) type).elementType),
          context.mkIntSort());
    default:
      throw new AssertionError("no sort for " + type);
    }
  }

  private static Expr<Sort> any(Expr<?> e) {
    return (Expr<Sort>) e;
  }

  private static Expr<BitVecSort> bv(Expr<?> e) {
    return (Expr<BitVecSort>) e;
  }

  private static Expr<IntSort> num(Expr<?> e) {
    return (Expr<IntSort>) e;
  }

  private static Expr<SeqSort<Sort>> seq(Expr<?> e) {
    return (Expr<SeqSort<Sort>>) e;
  }

  private static Expr<ArraySort<Sort, Sort>> array(Expr<?> e) {
    return (Expr<ArraySort<Sort, Sort>>) e;
  }

  private static Expr<ArraySort<Sort, BoolSort>> set(Expr<?> e) {
    return (Expr<ArraySort<Sort, BoolSort>>) e;
  }

  /** Returns the Z3 term of an atomic value. */
  private static Expr<?> term(SymValue<BoolExpr, Expr<?>> v) {
    return v instanceof SymValue.Bool
        ? ((SymValue.Bool<BoolExpr, Expr<?>>) v).value
        : ((SymValue.Scalar<BoolExpr, Expr<?>>) v).value;
  }

  /** Wraps a Z3 term as the value of an atomic type. */
  private SymValue<BoolExpr, Expr<?>> wrap(Type type, Expr<?> e) {
    return type == PrimitiveType.BOOL
        ? bool((BoolExpr) e)
        : new SymValue.Scalar<>(type, e);
  }

  private Expr<?> constantTerm(Type type, Object value) {
    return term(constant(type, value));
  }

  /** Creates a new constant to be bound by a quantifier. */
  private Expr<?> bound(Sort sort) {
    return context.mkConst("k!" + boundCount++, sort);
  }

  private BoolExpr forall(Expr<?> bound, BoolExpr body) {
    return context.mkForall(new Expr<?>[] {bound}, body, 1, null, null,
        null, null);
  }

  private Expr<?> select(Expr<?> array, Expr<?> index) {
    return context.mkSelect(array(array), any(index));
  }

  private Expr<?> store(Expr<?> array, Expr<?> index, Expr<?> value) {
    return context.mkStore(array(array), any(index), any(value));
  }

  /** Creates an array that equals a constant array except at
   * {@code containerSize} symbolic indexes. */
  private Expr<?> finiteArray(String name, Sort indexSort, Expr<?> empty,
      Sort valueSort) {
    Expr<?> array = context.mkConstArray(indexSort, any(empty));
    for (int i = 0; i < containerSize; i++) {
      array = store(array, context.mkConst(name + "#k" + i, indexSort),
          context.mkConst(name + "#v" + i, valueSort));
    }
    return array;
  }

  // -- theory ---------------------------------------------------------------

  @Override protected SymValue<BoolExpr, Expr<?>> theory(Sym.Exp e,
      List<SymValue<BoolExpr, Expr<?>>> args) {
    final Type argType = e.args.isEmpty() ? e.type : e.arg(0).type;
    final boolean bigint = argType == PrimitiveType.BIGINT;
    final Expr<?> a0 = operand(args, 0);
    final Expr<?> a1 = operand(args, 1);
    final Expr<?> a2 = operand(args, 2);
    switch (e.op) {
    case PLUS:
      return scalar(e.type,
          bigint ? context.mkAdd(num(a0), num(a1))
              : context.mkBVAdd(bv(a0), bv(a1)));
    case MINUS:
      return scalar(e.type,
          bigint ? context.mkSub(num(a0), num(a1))
              : context.mkBVSub(bv(a0), bv(a1)));
    case TIMES:
      return scalar(e.type,
          bigint ? context.mkMul(num(a0), num(a1))
              : context.mkBVMul(bv(a0), bv(a1)));
    case BIT_AND:
      return scalar(e.type, context.mkBVAND(bv(a0), bv(a1)));
    case BIT_OR:
      return scalar(e.type, context.mkBVOR(bv(a0), bv(a1)));
    case BIT_XOR:
      return scalar(e.type, context.mkBVXOR(bv(a0), bv(a1)));
    case BIT_NOT:
      return scalar(e.type, context.mkBVNot(bv(a0)));
    case LT:
      return bool(bigint ? context.mkLt(num(a0), num(a1))
          : isSigned(argType) ? context.mkBVSLT(bv(a0), bv(a1))
          : context.mkBVULT(bv(a0), bv(a1)));
    case LE:
      return bool(bigint ? context.mkLe(num(a0), num(a1))
          : isSigned(argType) ? context.mkBVSLE(bv(a0), bv(a1))
          : context.mkBVULE(bv(a0), bv(a1)));
    case CAST:
      return scalar(e.type, cast(a0, argType, e.type));

    case SEQ_UNIT:
      return scalar(e.type, context.mkUnit(any(a0)));
    case SEQ_CONCAT:
      return scalar(e.type, context.mkConcat(seq(a0), seq(a1)));
    case SEQ_LENGTH:
      return scalar(e.type, context.mkLength(seq(a0)));
    case SEQ_AT:
      return scalar(e.type, context.mkAt(seq(a0), num(a1)));
    case SEQ_CONTAINS:
      return bool(context.mkContains(seq(a0), seq(a1)));
    case SEQ_INDEX_OF:
      return scalar(e.type, context.mkIndexOf(seq(a0), seq(a1), num(a2)));
    case SEQ_SLICE:
      return scalar(e.type, context.mkExtract(seq(a0), num(a1), num(a2)));
    case SEQ_REPLACE_FIRST:
      return scalar(e.type, context.mkReplace(seq(a0), seq(a1), seq(a2)));

    case MAP_SET:
      final SymValue.MapPair<BoolExpr, Expr<?>> map =
          (SymValue.MapPair<BoolExpr, Expr<?>>) args.get(0);
      return new SymValue.MapPair<>(e.type,
          store(map.present, a1, context.mkTrue()),
          store(map.values, a1, a2));
    case MAP_DELETE:
      final SymValue.MapPair<BoolExpr, Expr<?>> map2 =
          (SymValue.MapPair<BoolExpr, Expr<?>>) args.get(0);
      return new SymValue.MapPair<>(e.type,
          store(map2.present, a1, context.mkFalse()),
          map2.values);
    case MAP_GET:
      final SymValue.MapPair<BoolExpr, Expr<?>> map3 =
          (SymValue.MapPair<BoolExpr, Expr<?>>) args.get(0);
      final Type valueType = ((MapType) argType).valueType;
      return new SymValue.Option<>(e.type,
          (BoolExpr) select(map3.present, a1),
          wrap(valueType, select(map3.values, a1)));

    case SET_ADD:
      return scalar(e.type, store(a0, a1, context.mkTrue()));
    case SET_REMOVE:
      return scalar(e.type, store(a0, a1, context.mkFalse()));
    case SET_CONTAINS:
      return bool((BoolExpr) select(a0, a1));
    case SET_UNION:
      return scalar(e.type, context.mkSetUnion(set(a0), set(a1)));
    case SET_INTERSECT:
      return scalar(e.type, context.mkSetIntersection(set(a0), set(a1)));

    case BAG_ADD:
      return scalar(e.type,
          store(a0, a1,
              context.mkAdd(num(select(a0, a1)), context.mkInt(1))));
    case BAG_COUNT:
      return scalar(e.type, select(a0, a1));

    default:
      throw new AssertionError("unknown op " + e.op);
    }
  }

  /** Returns the term of the {@code i}th argument, or null if there is no
   * such argument or it is a map. */
  private static @Nullable Expr<?> operand(
      List<SymValue<BoolExpr, Expr<?>>> args, int i) {
    if (i >= args.size() || args.get(i) instanceof SymValue.MapPair) {
      return null;
    }
    return term(args.get(i));
  }

  private SymValue<BoolExpr, Expr<?>> scalar(Type type, Expr<?> e) {
    return new SymValue.Scalar<>(type, e);
  }

  private static boolean isSigned(Type type) {
    return type instanceof IntType && ((IntType) type).signed;
  }

  private static int width(Type type) {
    return type == PrimitiveType.CHAR ? 16 : ((IntType) type).width;
  }

  /** Converts between bit-vectors of different widths and unbounded
   * integers. */
  private Expr<?> cast(Expr<?> e, Type from, Type to) {
    if (from == PrimitiveType.BIGINT) {
      return context.mkInt2BV(width(to), num(e));
    }
    if (to == PrimitiveType.BIGINT) {
      return context.mkBV2Int(bv(e), isSigned(from));
    }
    final int fromWidth = width(from);
    final int toWidth = width(to);
    if (toWidth < fromWidth) {
      return context.mkExtract(toWidth - 1, 0, bv(e));
    } else if (toWidth > fromWidth) {
      return isSigned(from)
          ? context.mkSignExt(toWidth - fromWidth, bv(e))
          : context.mkZeroExt(toWidth - fromWidth, bv(e));
    } else {
      return e;
    }
  }

  // -- primitives -----------------------------------------------------------

  @Override public BoolExpr trueTerm() {
    return context.mkTrue();
  }

  @Override public BoolExpr falseTerm() {
    return context.mkFalse();
  }

  @Override public BoolExpr and(BoolExpr a, BoolExpr b) {
    if (a.isTrue()) {
      return b;
    }
    if (b.isTrue()) {
      return a;
    }
    return context.mkAnd(a, b);
  }

  @Override public BoolExpr or(BoolExpr a, BoolExpr b) {
    if (a.isFalse()) {
      return b;
    }
    if (b.isFalse()) {
      return a;
    }
    return context.mkOr(a, b);
  }

  @Override public BoolExpr not(BoolExpr a) {
    return context.mkNot(a);
  }

  @Override public BoolExpr iff(BoolExpr a, BoolExpr b) {
    return context.mkIff(a, b);
  }

  @Override public BoolExpr ite(BoolExpr c, BoolExpr a, BoolExpr b) {
    return (BoolExpr) context.mkITE(c, a, b);
  }

  @Override protected BoolExpr boolVariable(String name) {
    return context.mkBoolConst(name);
  }

  @Override protected Expr<?> scalarVariable(Type type, String name) {
    switch (type.op()) {
    case SET_TYPE:
      return finiteArray(name, sort(((SetType) type).elementType),
          context.mkFalse(), context.mkBoolSort());
    case BAG_TYPE:
      return finiteArray(name, sort(((BagType) type).elementType),
          context.mkInt(0), context.mkIntSort());
    default:
      return context.mkConst(name, sort(type));
    }
  }

  @Override protected Expr<?> scalarConstant(Type type, Object value) {
    switch (type.op()) {
    case INT_TYPE:
      final IntType intType = (IntType) type;
      return context.mkBV(intType.toUnsigned((BigInteger) value).toString(),
          intType.width);
    case CHAR_TYPE:
      return context.mkBV((int) (Character) value, 16);
    case BIGINT_TYPE:
      return context.mkInt(value.toString());
    case STRING_TYPE:
      return context.mkString((String) value);
    case SEQ_TYPE:
      final Type elementType = ((SeqType) type).elementType;
      final List<?> list = (List<?>) value;
      if (list.isEmpty()) {
        return context.mkEmptySeq(sort(type));
      }
      Expr<SeqSort<Sort>> result = null;
      for (Object element : list) {
        final Expr<SeqSort<Sort>> unit =
            seq(context.mkUnit(any(constantTerm(elementType, element))));
        result = result == null ? unit : context.mkConcat(result, unit);
      }
      return result;
    case SET_TYPE:
      final Type setElementType = ((SetType) type).elementType;
      Expr<?> set = context.mkConstArray(sort(setElementType),
          context.mkFalse());
      for (Object element : (Set<?>) value) {
        set = store(set, constantTerm(setElementType, element),
            context.mkTrue());
      }
      return set;
    case BAG_TYPE:
      final Type bagElementType = ((BagType) type).elementType;
      Expr<?> bag = context.mkConstArray(sort(bagElementType),
          context.mkInt(0));
      for (Multiset.Entry<?> entry : ((Multiset<?>) value).entrySet()) {
        bag = store(bag, constantTerm(bagElementType, entry.getElement()),
            context.mkInt(entry.getCount()));
      }
      return bag;
    default:
      throw new AssertionError("not a scalar type: " + type);
    }
  }

  @Override protected BoolExpr scalarConstraint(Type type, Expr<?> w) {
    BoolExpr constraint = trueTerm();
    if (type.op() == Op.BAG_TYPE) {
      // Counts are never negative
      for (Expr<?> a = w; a.isStore(); a = a.getArgs()[0]) {
        constraint = and(constraint,
            context.mkGe(num(a.getArgs()[2]), context.mkInt(0)));
      }
    }
    return constraint;
  }

  @Override protected Expr<?> scalarIte(BoolExpr c, Expr<?> a, Expr<?> b) {
    return context.mkITE(c, any(a), any(b));
  }

  @Override protected BoolExpr scalarEq(Type type, Expr<?> a, Expr<?> b) {
    return context.mkEq(any(a), any(b));
  }

  @Override protected Expr<?> intAdd(IntType type, Expr<?> a, Expr<?> b) {
    return context.mkBVAdd(bv(a), bv(b));
  }

  @Override protected BoolExpr intLt(IntType type, Expr<?> a, Expr<?> b) {
    return type.signed ? context.mkBVSLT(bv(a), bv(b))
        : context.mkBVULT(bv(a), bv(b));
  }

  @Override protected BoolExpr intLe(IntType type, Expr<?> a, Expr<?> b) {
    return type.signed ? context.mkBVSLE(bv(a), bv(b))
        : context.mkBVULE(bv(a), bv(b));
  }

  // -- maps -----------------------------------------------------------------

  @Override protected SymValue<BoolExpr, Expr<?>> mapConstant(MapType type,
      Map<?, ?> map) {
    final Sort keySort = sort(type.keyType);
    Expr<?> present = context.mkConstArray(keySort, context.mkFalse());
    Expr<?> values = context.mkConstArray(keySort,
        any(
            constantTerm(type.valueType,
                Values.defaultValue(type.valueType))));
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      final Expr<?> key = constantTerm(type.keyType, entry.getKey());
      present = store(present, key, context.mkTrue());
      values = store(values, key,
          constantTerm(type.valueType, entry.getValue()));
    }
    return new SymValue.MapPair<>(type, present, values);
  }

  /** A map variable has finitely many present keys; its values array is
   * unconstrained, because values of absent keys are never read. */
  @Override protected SymValue<BoolExpr, Expr<?>> freshMap(MapType type,
      String name) {
    final Sort keySort = sort(type.keyType);
    return new SymValue.MapPair<>(type,
        finiteArray(name + ".present", keySort, context.mkFalse(),
            context.mkBoolSort()),
        context.mkConst(name + ".values",
            context.mkArraySort(keySort, sort(type.valueType))));
  }

  /** Two maps are equal if they have the same keys, and the same value for
   * each key; values of absent keys are ignored. */
  @Override protected BoolExpr mapEq(MapType type,
      SymValue.MapPair<BoolExpr, Expr<?>> a,
      SymValue.MapPair<BoolExpr, Expr<?>> b) {
    final Expr<?> k = bound(sort(type.keyType));
    final BoolExpr presentA = (BoolExpr) select(a.present, k);
    final BoolExpr presentB = (BoolExpr) select(b.present, k);
    return forall(k,
        context.mkAnd(context.mkEq(presentA, presentB),
            context.mkImplies(presentA,
                context.mkEq(any(select(a.values, k)),
                    any(select(b.values, k))))));
  }

  // -- decoding -------------------------------------------------------------

  /** Returns a view of a Z3 model. */
  public ModelView<BoolExpr, Expr<?>> model(Model model) {
    return new ModelView<BoolExpr, Expr<?>>() {
      @Override public boolean bool(BoolExpr b) {
        return model.eval(b, true).isTrue();
      }

      @Override public Object scalar(Type type, Expr<?> w) {
        return decodeScalar(model, type, w);
      }

      @Override public Map<Object, Object> map(MapType type,
          Expr<?> present, Expr<?> values) {
        final Map<Object, Object> map = new LinkedHashMap<>();
        final Map<Expr<?>, Expr<?>> entries = new LinkedHashMap<>();
        checkEmpty(type,
            arrayEntries(model, model.eval(present, true), entries));
        entries.forEach((key, isPresent) -> {
          if (isPresent.isTrue()) {
            map.put(decodeValue(type.keyType, key),
                decodeScalar(model, type.valueType, select(values, key)));
          }
        });
        return map;
      }
    };
  }

  private Object decodeScalar(Model model, Type type, Expr<?> w) {
    final Expr<?> value = model.eval(w, true);
    switch (type.op()) {
    case SEQ_TYPE:
      final Type elementType = ((SeqType) type).elementType;
      final int length =
          ((IntNum) model.eval(context.mkLength(seq(w)), true)).getInt();
      final ImmutableList.Builder<Object> elements = ImmutableList.builder();
      for (int i = 0; i < length; i++) {
        elements.add(
            decodeValue(elementType,
                model.eval(context.mkNth(seq(w), context.mkInt(i)), true)));
      }
      return elements.build();

    case SET_TYPE:
      final Map<Expr<?>, Expr<?>> setEntries = new LinkedHashMap<>();
      checkEmpty(type, arrayEntries(model, value, setEntries));
      final ImmutableSet.Builder<Object> set = ImmutableSet.builder();
      setEntries.forEach((element, member) -> {
        if (member.isTrue()) {
          set.add(decodeValue(((SetType) type).elementType, element));
        }
      });
      return set.build();

    case BAG_TYPE:
      final Map<Expr<?>, Expr<?>> bagEntries = new LinkedHashMap<>();
      checkEmpty(type, arrayEntries(model, value, bagEntries));
      final ImmutableMultiset.Builder<Object> bag =
          ImmutableMultiset.builder();
      bagEntries.forEach((element, count) ->
          bag.addCopies(decodeValue(((BagType) type).elementType, element),
              ((IntNum) count).getInt()));
      return bag.build();

    default:
      return decodeValue(type, value);
    }
  }

  /** Converts an evaluated Z3 term of an atomic type to a value. */
  private Object decodeValue(Type type, Expr<?> value) {
    switch (type.op()) {
    case BOOL_TYPE:
      return value.isTrue();
    case INT_TYPE:
      return ((IntType) type)
          .fromUnsigned(((BitVecNum) value).getBigInteger());
    case CHAR_TYPE:
      return (char) ((BitVecNum) value).getBigInteger().intValue();
    case BIGINT_TYPE:
      return ((IntNum) value).getBigInteger();
    case STRING_TYPE:
      return unescape(value.getString());
    default:
      throw new BackendException("cannot decode value of type "
          + type.moniker(), Backend.GENERAL, Backend.GENERAL);
    }
  }

  /** Replaces the backslash-u escapes, with the code point in braces, that
   * Z3 uses in strings. */
  static String unescape(String s) {
    final Matcher matcher = ESCAPE.matcher(s);
    final StringBuilder b = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(b, "");
      b.appendCodePoint(Integer.parseInt(matcher.group(1), 16));
    }
    matcher.appendTail(b);
    return b.toString();
  }

  /** Collects the explicit entries of an array value, and returns the
   * value at every other index. An entry nearer the top of a chain of
   * stores takes precedence. */
  private static Expr<?> arrayEntries(Model model, Expr<?> array,
      Map<Expr<?>, Expr<?>> entries) {
    if (array.isStore()) {
      final Expr<?>[] args = array.getArgs();
      entries.putIfAbsent(args[1], args[2]);
      return arrayEntries(model, args[0], entries);
    }
    if (array.isConstantArray()) {
      return array.getArgs()[0];
    }
    if (array.isAsArray()) {
      final FuncDecl<?> f =
          array.getFuncDecl().getParameters()[0].getFuncDecl();
      final FuncInterp<?> interp = model.getFuncInterp(f);
      for (FuncInterp.Entry<?> entry : interp.getEntries()) {
        entries.putIfAbsent(entry.getArgs()[0], entry.getValue());
      }
      return interp.getElse();
    }
    throw new BackendException("cannot decode array " + array,
        Backend.GENERAL, Backend.GENERAL);
  }

  /** Throws unless the value of an array at indexes without an explicit
   * entry is false or zero; a collection with infinitely many elements has
   * no value. */
  private static void checkEmpty(Type type, Expr<?> otherwise) {
    if (!otherwise.isFalse()
        && !(otherwise instanceof IntNum
            && ((IntNum) otherwise).getInt() == 0)) {
      throw new BackendException("cannot decode " + type.moniker()
          + " that is " + otherwise + " at all but finitely many keys",
          Backend.GENERAL, Backend.GENERAL);
    }
  }
}

// End Z3Compiler.java

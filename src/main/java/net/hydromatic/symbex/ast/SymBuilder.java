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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntFunction;
import net.hydromatic.symbex.eval.Evaluator;
import net.hydromatic.symbex.eval.Values;
import net.hydromatic.symbex.type.BagType;
import net.hydromatic.symbex.type.ConstMapType;
import net.hydromatic.symbex.type.FnType;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.OptionType;
import net.hydromatic.symbex.type.PrimitiveType;
import net.hydromatic.symbex.type.SetType;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.type.TypeException;
import net.hydromatic.symbex.type.TypeSystem;
import net.hydromatic.symbex.util.HashConsTable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds symbolic expressions.
 *
 * <p>Each method checks the types of its operands, throwing
 * {@link TypeException} if they are invalid, then simplifies. For example,
 * {@code plus(x, 0)} returns {@code x}, and {@code plus(1, 1)} returns the
 * literal {@code 2}. If the result is a new expression, it is interned in a
 * {@link HashConsTable}, so that building the same expression twice returns
 * the same object.
 *
 * <p>A builder owns its table; expressions from different builders must not
 * be mixed.
 */
public class SymBuilder {
  private final TypeSystem typeSystem;
  private final HashConsTable<Key, Sym.Exp> table = new HashConsTable<>();
  private final AtomicInteger nextId = new AtomicInteger();

  private final Sym.Exp trueLiteral;
  private final Sym.Exp falseLiteral;

  /** Creates a SymBuilder. */
  public SymBuilder(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
    this.trueLiteral = literal(PrimitiveType.BOOL, true);
    this.falseLiteral = literal(PrimitiveType.BOOL, false);
  }

  /** Returns the type system. */
  public TypeSystem typeSystem() {
    return typeSystem;
  }

  /** Removes table entries for expressions that have been collected.
   * Returns the number removed. */
  public int compact() {
    return table.compact();
  }

  /** Returns the number of entries in the table. */
  public int tableSize() {
    return table.size();
  }

  // -- literals and variables -----------------------------------------------

  /**
   * Creates a literal.
   *
   * @throws TypeException if the value does not have the shape of the type
   * @throws net.hydromatic.symbex.type.DomainException if the value is out of
   *     range
   */
  public Sym.Exp literal(Type type, Object value) {
    final Object v = Values.embed(type, value);
    return intern(new Key(Op.LITERAL, type, v, ImmutableList.of()),
        id -> new Sym.Literal(id, type, v));
  }

  public Sym.Exp trueLiteral() {
    return trueLiteral;
  }

  public Sym.Exp falseLiteral() {
    return falseLiteral;
  }

  public Sym.Exp boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  /** Creates an integer literal of a fixed-width or {@code bigint} type. */
  public Sym.Exp intLiteral(Type type, long value) {
    return literal(type, BigInteger.valueOf(value));
  }

  public Sym.Exp bigintLiteral(long value) {
    return literal(PrimitiveType.BIGINT, BigInteger.valueOf(value));
  }

  /** Creates a character literal from a character code. */
  public Sym.Exp charLiteral(int code) {
    return literal(PrimitiveType.CHAR, code);
  }

  public Sym.Exp stringLiteral(String s) {
    return literal(PrimitiveType.STRING, s);
  }

  /** Creates a variable. Each call returns a distinct variable. */
  public Sym.Var var(Type type, String name) {
    if (type instanceof FnType) {
      throw new TypeException("variable '" + name + "' cannot have function"
          + " type " + type.moniker());
    }
    return new Sym.Var(nextId.getAndIncrement(), type, name);
  }

  // -- logic ----------------------------------------------------------------

  public Sym.Exp not(Sym.Exp e) {
    checkBool(e, Op.NOT);
    if (e.isLiteral()) {
      return boolLiteral(!e.isTrue());
    }
    if (e.op == Op.NOT) {
      return e.arg(0);
    }
    return make(Op.NOT, PrimitiveType.BOOL, null, e);
  }

  public Sym.Exp and(Sym.Exp a, Sym.Exp b) {
    checkBool(a, Op.AND);
    checkBool(b, Op.AND);
    if (a.isFalse() || b.isTrue()) {
      return a;
    }
    if (a.isTrue() || b.isFalse()) {
      return b;
    }
    if (a == b) {
      return a;
    }
    if (isNegation(a, b)) {
      return falseLiteral;
    }
    return make(Op.AND, PrimitiveType.BOOL, null, a, b);
  }

  public Sym.Exp or(Sym.Exp a, Sym.Exp b) {
    checkBool(a, Op.OR);
    checkBool(b, Op.OR);
    if (a.isTrue() || b.isFalse()) {
      return a;
    }
    if (a.isFalse() || b.isTrue()) {
      return b;
    }
    if (a == b) {
      return a;
    }
    if (isNegation(a, b)) {
      return trueLiteral;
    }
    return make(Op.OR, PrimitiveType.BOOL, null, a, b);
  }

  /** Returns the conjunction of a list of expressions; true if empty. */
  public Sym.Exp andAll(Iterable<? extends Sym.Exp> es) {
    Sym.Exp e = trueLiteral;
    for (Sym.Exp e2 : es) {
      e = and(e, e2);
    }
    return e;
  }

  /** Returns the disjunction of a list of expressions; false if empty. */
  public Sym.Exp orAll(Iterable<? extends Sym.Exp> es) {
    Sym.Exp e = falseLiteral;
    for (Sym.Exp e2 : es) {
      e = or(e, e2);
    }
    return e;
  }

  public Sym.Exp implies(Sym.Exp a, Sym.Exp b) {
    return or(not(a), b);
  }

  public Sym.Exp eq(Sym.Exp a, Sym.Exp b) {
    checkSameType(a, b, Op.EQ);
    if (a.type instanceof FnType) {
      throw new TypeException("cannot compare functions");
    }
    if (a == b) {
      return trueLiteral;
    }
    if (a.type == PrimitiveType.BOOL) {
      if (b.isLiteral() && !a.isLiteral()) {
        return b.isTrue() ? a : not(a);
      }
      if (a.isLiteral() && !b.isLiteral()) {
        return a.isTrue() ? b : not(b);
      }
    }
    return make(Op.EQ, PrimitiveType.BOOL, null, a, b);
  }

  public Sym.Exp ne(Sym.Exp a, Sym.Exp b) {
    return not(eq(a, b));
  }

  public Sym.Exp ifThenElse(Sym.Exp c, Sym.Exp a, Sym.Exp b) {
    checkBool(c, Op.IF);
    checkSameType(a, b, Op.IF);
    if (c.isTrue()) {
      return a;
    }
    if (c.isFalse()) {
      return b;
    }
    if (a == b) {
      return a;
    }
    if (c.op == Op.NOT) {
      return ifThenElse(c.arg(0), b, a);
    }
    if (a.type == PrimitiveType.BOOL) {
      if (a.isTrue()) {
        return or(c, b);
      }
      if (a.isFalse()) {
        return and(not(c), b);
      }
      if (b.isTrue()) {
        return or(not(c), a);
      }
      if (b.isFalse()) {
        return and(c, a);
      }
    }
    return make(Op.IF, a.type, null, c, a, b);
  }

  // -- arithmetic -----------------------------------------------------------

  public Sym.Exp plus(Sym.Exp a, Sym.Exp b) {
    checkArithmetic(a, b, Op.PLUS);
    if (isZero(a)) {
      return b;
    }
    if (isZero(b)) {
      return a;
    }
    return make(Op.PLUS, a.type, null, a, b);
  }

  public Sym.Exp minus(Sym.Exp a, Sym.Exp b) {
    checkArithmetic(a, b, Op.MINUS);
    if (isZero(b)) {
      return a;
    }
    if (a == b) {
      return intLiteral(a.type, 0);
    }
    return make(Op.MINUS, a.type, null, a, b);
  }

  public Sym.Exp times(Sym.Exp a, Sym.Exp b) {
    checkArithmetic(a, b, Op.TIMES);
    if (isOne(a) || isZero(b)) {
      return b;
    }
    if (isOne(b) || isZero(a)) {
      return a;
    }
    return make(Op.TIMES, a.type, null, a, b);
  }

  public Sym.Exp lt(Sym.Exp a, Sym.Exp b) {
    checkOrdered(a, b, Op.LT);
    if (a == b) {
      return falseLiteral;
    }
    return make(Op.LT, PrimitiveType.BOOL, null, a, b);
  }

  public Sym.Exp le(Sym.Exp a, Sym.Exp b) {
    checkOrdered(a, b, Op.LE);
    if (a == b) {
      return trueLiteral;
    }
    return make(Op.LE, PrimitiveType.BOOL, null, a, b);
  }

  /** Returns {@code a > b}, built as {@code b < a}. */
  public Sym.Exp gt(Sym.Exp a, Sym.Exp b) {
    return lt(b, a);
  }

  /** Returns {@code a >= b}, built as {@code b <= a}. */
  public Sym.Exp ge(Sym.Exp a, Sym.Exp b) {
    return le(b, a);
  }

  public Sym.Exp bitAnd(Sym.Exp a, Sym.Exp b) {
    checkBits(a, b, Op.BIT_AND);
    if (a == b) {
      return a;
    }
    return make(Op.BIT_AND, a.type, null, a, b);
  }

  public Sym.Exp bitOr(Sym.Exp a, Sym.Exp b) {
    checkBits(a, b, Op.BIT_OR);
    if (a == b) {
      return a;
    }
    return make(Op.BIT_OR, a.type, null, a, b);
  }

  public Sym.Exp bitXor(Sym.Exp a, Sym.Exp b) {
    checkBits(a, b, Op.BIT_XOR);
    if (a == b) {
      return intLiteral(a.type, 0);
    }
    return make(Op.BIT_XOR, a.type, null, a, b);
  }

  public Sym.Exp bitNot(Sym.Exp e) {
    checkBits(e, e, Op.BIT_NOT);
    if (e.op == Op.BIT_NOT) {
      return e.arg(0);
    }
    return make(Op.BIT_NOT, e.type, null, e);
  }

  /**
   * Converts between integer types, {@code bigint} and {@code char}.
   *
   * <p>Narrowing keeps the low bits; widening extends the sign of a signed
   * source.
   */
  public Sym.Exp cast(Sym.Exp e, Type type) {
    if (!isNumeric(e.type) || !isNumeric(type)) {
      throw new TypeException("cannot cast " + e.type.moniker() + " to "
          + type.moniker());
    }
    if (e.type.equals(type)) {
      return e;
    }
    return make(Op.CAST, type, null, e);
  }

  // -- objects --------------------------------------------------------------

  /**
   * Returns the value of a field of an object.
   *
   * @throws TypeException if the object has no such field
   */
  public Sym.Exp getField(Sym.Exp o, String fieldName) {
    final ObjectType objectType = objectType(o, Op.GET_FIELD);
    final Type fieldType = objectType.fieldType(fieldName);
    switch (o.op) {
    case CREATE_OBJECT:
      return o.arg(objectType.fieldOrdinal(fieldName));
    case WITH_FIELD:
      final Sym.Field field = (Sym.Field) o;
      return field.fieldName.equals(fieldName)
          ? o.arg(1)
          : getField(o.arg(0), fieldName);
    default:
      return make(Op.GET_FIELD, fieldType, fieldName, o);
    }
  }

  /**
   * Returns a copy of an object with one field changed.
   *
   * @throws TypeException if the object has no such field, or the value has
   *     the wrong type
   */
  public Sym.Exp withField(Sym.Exp o, String fieldName, Sym.Exp value) {
    final ObjectType objectType = objectType(o, Op.WITH_FIELD);
    checkType(value, objectType.fieldType(fieldName), Op.WITH_FIELD);
    switch (o.op) {
    case CREATE_OBJECT:
      final List<Sym.Exp> args = new ArrayList<>(o.args);
      args.set(objectType.fieldOrdinal(fieldName), value);
      return createObject(objectType, args);
    case WITH_FIELD:
      if (((Sym.Field) o).fieldName.equals(fieldName)) {
        return withField(o.arg(0), fieldName, value);
      }
      break;
    default:
      break;
    }
    if (value.op == Op.GET_FIELD
        && value.arg(0) == o
        && ((Sym.Field) value).fieldName.equals(fieldName)) {
      // Assigning a field its own value
      return o;
    }
    return make(Op.WITH_FIELD, objectType, fieldName, o, value);
  }

  /** Creates an object from field values in declaration order. */
  public Sym.Exp createObject(ObjectType type, List<? extends Sym.Exp> args) {
    if (args.size() != type.fieldTypes.size()) {
      throw new TypeException("type " + type.name + " has "
          + type.fieldTypes.size() + " fields, got " + args.size());
    }
    for (int i = 0; i < args.size(); i++) {
      checkType(args.get(i), type.fieldTypes.values().asList().get(i),
          Op.CREATE_OBJECT);
    }
    // If every field is read from the same object, return that object
    final Sym.Exp source = args.isEmpty() ? null : args.get(0);
    if (source != null && source.op == Op.GET_FIELD) {
      final Sym.Exp o = source.arg(0);
      boolean same = o.type.equals(type);
      for (int i = 0; same && i < args.size(); i++) {
        final Sym.Exp arg = args.get(i);
        same = arg.op == Op.GET_FIELD
            && arg.arg(0) == o
            && ((Sym.Field) arg).fieldName.equals(type.fieldNames().get(i));
      }
      if (same) {
        return o;
      }
    }
    return make(Op.CREATE_OBJECT, type, null,
        ImmutableList.<Sym.Exp>copyOf(args));
  }

  /**
   * Creates an object from a map of field values.
   *
   * @throws TypeException if a field is missing or unknown
   */
  public Sym.Exp createObject(ObjectType type,
      Map<String, ? extends Sym.Exp> fieldValues) {
    for (String fieldName : fieldValues.keySet()) {
      type.fieldType(fieldName);
    }
    final List<Sym.Exp> args = new ArrayList<>();
    for (String fieldName : type.fieldNames()) {
      final Sym.Exp arg = fieldValues.get(fieldName);
      if (arg == null) {
        throw new TypeException("missing value for field '" + fieldName
            + "' of type " + type.name);
      }
      args.add(arg);
    }
    return createObject(type, args);
  }

  // -- options --------------------------------------------------------------

  public Sym.Exp some(Sym.Exp e) {
    return make(Op.SOME, typeSystem.optionType(e.type), null, e);
  }

  public Sym.Exp none(OptionType type) {
    return literal(type, Optional.empty());
  }

  public Sym.Exp isSome(Sym.Exp o) {
    optionType(o, Op.IS_SOME);
    if (o.op == Op.SOME) {
      return trueLiteral;
    }
    return make(Op.IS_SOME, PrimitiveType.BOOL, null, o);
  }

  public Sym.Exp isNone(Sym.Exp o) {
    return not(isSome(o));
  }

  /** Returns the value of an option, or a default value if it is absent. */
  public Sym.Exp valueOr(Sym.Exp o, Sym.Exp defaultValue) {
    final OptionType optionType = optionType(o, Op.OPTION_VALUE_OR);
    checkType(defaultValue, optionType.elementType, Op.OPTION_VALUE_OR);
    if (o.op == Op.SOME) {
      return o.arg(0);
    }
    return make(Op.OPTION_VALUE_OR, optionType.elementType, null, o,
        defaultValue);
  }

  // -- bounded lists --------------------------------------------------------

  public Sym.Exp emptyList(ListType type) {
    return literal(type, ImmutableList.of());
  }

  /** Adds an element to the front of a list. If the list is full, its last
   * element is dropped. */
  public Sym.Exp listAddFront(Sym.Exp list, Sym.Exp e) {
    final ListType listType = listType(list, Op.LIST_ADD_FRONT);
    checkType(e, listType.elementType, Op.LIST_ADD_FRONT);
    return make(Op.LIST_ADD_FRONT, listType, null, list, e);
  }

  public Sym.Exp listLength(Sym.Exp list) {
    final ListType listType = listType(list, Op.LIST_LENGTH);
    return make(Op.LIST_LENGTH, typeSystem.lengthType(listType), null, list);
  }

  /** Returns the first element of a list, or none if it is empty. */
  public Sym.Exp listHead(Sym.Exp list) {
    final ListType listType = listType(list, Op.LIST_HEAD);
    if (list.op == Op.LIST_ADD_FRONT && listType.capacity > 0) {
      return some(list.arg(1));
    }
    return make(Op.LIST_HEAD, typeSystem.optionType(listType.elementType),
        null, list);
  }

  public Sym.Exp listContains(Sym.Exp list, Sym.Exp e) {
    final ListType listType = listType(list, Op.LIST_CONTAINS);
    checkType(e, listType.elementType, Op.LIST_CONTAINS);
    return make(Op.LIST_CONTAINS, PrimitiveType.BOOL, null, list, e);
  }

  /** Returns a list without its first element; the tail of an empty list
   * is empty. The result has the same type as the list. */
  public Sym.Exp listTail(Sym.Exp list) {
    final ListType listType = listType(list, Op.LIST_TAIL);
    // After as many tails as the capacity, nothing is left
    int tails = 1;
    for (Sym.Exp e = list; e.op == Op.LIST_TAIL; e = e.arg(0)) {
      ++tails;
    }
    if (tails >= listType.capacity) {
      return emptyList(listType);
    }
    if (list.op == Op.LIST_ADD_FRONT && list.arg(0).isLiteral()
        && ((List<?>) ((Sym.Literal) list.arg(0)).value).size()
            < listType.capacity) {
      return list.arg(0);
    }
    return make(Op.LIST_TAIL, listType, null, list);
  }

  /**
   * Creates a case analysis of a list.
   *
   * <p>If the list is empty, the value is {@code empty}; otherwise it is the
   * result of {@code cons} applied to the head and the tail of the list.
   * {@code cons} is called at most once, when the body is first needed, and
   * may itself call this method on the tail. For example, the sum of a
   * list:
   *
   * <blockquote><pre>
   * Sym.Exp sum(Sym.Exp list) {
   *   return b.listCase(list, zero, (h, t) -&gt; b.plus(h, sum(t)));
   * }</pre></blockquote>
   *
   * <p>If the list is a literal, the case is expanded immediately.
   */
  public Sym.Exp listCase(Sym.Exp list, Sym.Exp empty,
      BiFunction<Sym.Exp, Sym.Exp, Sym.Exp> cons) {
    final ListType listType = listType(list, Op.LIST_CASE);
    if (isEmptySeq(list)) {
      return empty;
    }
    final Sym.Var head = var(listType.elementType, "h" + nextId.get());
    final Sym.Var tail = var(listType, "t" + nextId.get());
    final Sym.ListCase listCase = (Sym.ListCase) intern(
        new Key(Op.LIST_CASE, empty.type, cons,
            ImmutableList.of(list, empty)),
        id -> new Sym.ListCase(id, empty.type, list, empty, head, tail,
            cons));
    if (list.isLiteral()) {
      final List<?> values = (List<?>) ((Sym.Literal) list).value;
      return Replacer.substitute(this,
          ImmutableMap.of(listCase.head,
              literal(listType.elementType, values.get(0)),
              listCase.tail,
              literal(listType, values.subList(1, values.size()))),
          listCase.body());
    }
    return listCase;
  }

  // -- sequences and strings ------------------------------------------------

  /** Creates a sequence of one element. */
  public Sym.Exp seqUnit(Sym.Exp e) {
    return make(Op.SEQ_UNIT, typeSystem.seqType(e.type), null, e);
  }

  public Sym.Exp seqConcat(Sym.Exp a, Sym.Exp b) {
    checkSeq(a, Op.SEQ_CONCAT);
    checkSameType(a, b, Op.SEQ_CONCAT);
    if (isEmptySeq(a)) {
      return b;
    }
    if (isEmptySeq(b)) {
      return a;
    }
    return make(Op.SEQ_CONCAT, a.type, null, a, b);
  }

  public Sym.Exp seqLength(Sym.Exp s) {
    checkSeq(s, Op.SEQ_LENGTH);
    return make(Op.SEQ_LENGTH, PrimitiveType.BIGINT, null, s);
  }

  /** Returns the sub-sequence of length 1 at an index, or the empty
   * sequence if the index is out of range. */
  public Sym.Exp seqAt(Sym.Exp s, Sym.Exp index) {
    checkSeq(s, Op.SEQ_AT);
    checkType(index, PrimitiveType.BIGINT, Op.SEQ_AT);
    return make(Op.SEQ_AT, s.type, null, s, index);
  }

  public Sym.Exp seqContains(Sym.Exp s, Sym.Exp sub) {
    checkSeq(s, Op.SEQ_CONTAINS);
    checkSameType(s, sub, Op.SEQ_CONTAINS);
    return make(Op.SEQ_CONTAINS, PrimitiveType.BOOL, null, s, sub);
  }

  /** Returns the index of the first occurrence of {@code sub} at or after
   * {@code offset}, or -1. */
  public Sym.Exp seqIndexOf(Sym.Exp s, Sym.Exp sub, Sym.Exp offset) {
    checkSeq(s, Op.SEQ_INDEX_OF);
    checkSameType(s, sub, Op.SEQ_INDEX_OF);
    checkType(offset, PrimitiveType.BIGINT, Op.SEQ_INDEX_OF);
    return make(Op.SEQ_INDEX_OF, PrimitiveType.BIGINT, null, s, sub, offset);
  }

  /** Returns at most {@code length} elements starting at {@code offset}. */
  public Sym.Exp seqSlice(Sym.Exp s, Sym.Exp offset, Sym.Exp length) {
    checkSeq(s, Op.SEQ_SLICE);
    checkType(offset, PrimitiveType.BIGINT, Op.SEQ_SLICE);
    checkType(length, PrimitiveType.BIGINT, Op.SEQ_SLICE);
    return make(Op.SEQ_SLICE, s.type, null, s, offset, length);
  }

  /** Replaces the first occurrence of {@code src} with {@code dst}. */
  public Sym.Exp seqReplaceFirst(Sym.Exp s, Sym.Exp src, Sym.Exp dst) {
    checkSeq(s, Op.SEQ_REPLACE_FIRST);
    checkSameType(s, src, Op.SEQ_REPLACE_FIRST);
    checkSameType(s, dst, Op.SEQ_REPLACE_FIRST);
    return make(Op.SEQ_REPLACE_FIRST, s.type, null, s, src, dst);
  }

  // -- maps -----------------------------------------------------------------

  public Sym.Exp emptyMap(MapType type) {
    return literal(type, ImmutableMap.of());
  }

  public Sym.Exp mapSet(Sym.Exp map, Sym.Exp key, Sym.Exp value) {
    final MapType mapType = mapType(map, Op.MAP_SET);
    checkType(key, mapType.keyType, Op.MAP_SET);
    checkType(value, mapType.valueType, Op.MAP_SET);
    return make(Op.MAP_SET, mapType, null, map, key, value);
  }

  public Sym.Exp mapDelete(Sym.Exp map, Sym.Exp key) {
    final MapType mapType = mapType(map, Op.MAP_DELETE);
    checkType(key, mapType.keyType, Op.MAP_DELETE);
    return make(Op.MAP_DELETE, mapType, null, map, key);
  }

  /** Returns the value for a key, or none. */
  public Sym.Exp mapGet(Sym.Exp map, Sym.Exp key) {
    final MapType mapType = mapType(map, Op.MAP_GET);
    checkType(key, mapType.keyType, Op.MAP_GET);
    if (map.op == Op.MAP_SET && map.arg(1) == key) {
      return some(map.arg(2));
    }
    return make(Op.MAP_GET, typeSystem.optionType(mapType.valueType), null,
        map, key);
  }

  // -- maps with constant keys ----------------------------------------------

  /** Returns the value of a constant-key map for a key. The key must be a
   * literal, and one of the keys of the map's type. */
  public Sym.Exp constMapGet(Sym.Exp map, Sym.Exp key) {
    final ConstMapType mapType = constMapType(map, Op.CONST_MAP_GET);
    checkConstKey(mapType, key, Op.CONST_MAP_GET);
    if (map.op == Op.CONST_MAP_SET) {
      return map.arg(1) == key ? map.arg(2) : constMapGet(map.arg(0), key);
    }
    return make(Op.CONST_MAP_GET, mapType.valueType, null, map, key);
  }

  /** Returns a constant-key map with a new value for a key. The key must be
   * a literal, and one of the keys of the map's type. */
  public Sym.Exp constMapSet(Sym.Exp map, Sym.Exp key, Sym.Exp value) {
    final ConstMapType mapType = constMapType(map, Op.CONST_MAP_SET);
    checkConstKey(mapType, key, Op.CONST_MAP_SET);
    checkType(value, mapType.valueType, Op.CONST_MAP_SET);
    if (map.op == Op.CONST_MAP_SET && map.arg(1) == key) {
      // The earlier value is overwritten
      return constMapSet(map.arg(0), key, value);
    }
    return make(Op.CONST_MAP_SET, mapType, null, map, key, value);
  }

  private static void checkConstKey(ConstMapType mapType, Sym.Exp key,
      Op op) {
    checkType(key, mapType.keyType, op);
    if (!key.isLiteral()) {
      throw new TypeException("key of " + op.opName + " must be a literal, "
          + "but was " + key);
    }
    mapType.keyOrdinal(((Sym.Literal) key).value);
  }

  // -- sets, bags -----------------------------------------------------------

  public Sym.Exp emptySet(SetType type) {
    return literal(type, ImmutableSet.of());
  }

  public Sym.Exp setAdd(Sym.Exp set, Sym.Exp e) {
    checkType(e, setType(set, Op.SET_ADD).elementType, Op.SET_ADD);
    return make(Op.SET_ADD, set.type, null, set, e);
  }

  public Sym.Exp setRemove(Sym.Exp set, Sym.Exp e) {
    checkType(e, setType(set, Op.SET_REMOVE).elementType, Op.SET_REMOVE);
    return make(Op.SET_REMOVE, set.type, null, set, e);
  }

  public Sym.Exp setContains(Sym.Exp set, Sym.Exp e) {
    checkType(e, setType(set, Op.SET_CONTAINS).elementType, Op.SET_CONTAINS);
    if (set.op == Op.SET_ADD && set.arg(1) == e) {
      return trueLiteral;
    }
    return make(Op.SET_CONTAINS, PrimitiveType.BOOL, null, set, e);
  }

  public Sym.Exp setUnion(Sym.Exp a, Sym.Exp b) {
    setType(a, Op.SET_UNION);
    checkSameType(a, b, Op.SET_UNION);
    if (a == b) {
      return a;
    }
    return make(Op.SET_UNION, a.type, null, a, b);
  }

  public Sym.Exp setIntersect(Sym.Exp a, Sym.Exp b) {
    setType(a, Op.SET_INTERSECT);
    checkSameType(a, b, Op.SET_INTERSECT);
    if (a == b) {
      return a;
    }
    return make(Op.SET_INTERSECT, a.type, null, a, b);
  }

  public Sym.Exp emptyBag(BagType type) {
    return literal(type, ImmutableMultiset.of());
  }

  public Sym.Exp bagAdd(Sym.Exp bag, Sym.Exp e) {
    checkType(e, bagType(bag, Op.BAG_ADD).elementType, Op.BAG_ADD);
    return make(Op.BAG_ADD, bag.type, null, bag, e);
  }

  /** Returns the number of occurrences of an element in a bag, as a
   * {@code bigint}. */
  public Sym.Exp bagCount(Sym.Exp bag, Sym.Exp e) {
    checkType(e, bagType(bag, Op.BAG_COUNT).elementType, Op.BAG_COUNT);
    return make(Op.BAG_COUNT, PrimitiveType.BIGINT, null, bag, e);
  }

  // -- functions ------------------------------------------------------------

  /** Creates a function, calling {@code body} with a new parameter
   * variable. */
  public Sym.Lambda lambda(Type paramType,
      Function<Sym.Exp, Sym.Exp> body) {
    final Sym.Var param = var(paramType, "p" + nextId.get());
    return lambda(param, body.apply(param));
  }

  /** Creates a function with a given parameter and body. */
  public Sym.Lambda lambda(Sym.Var param, Sym.Exp body) {
    final FnType type = typeSystem.fnType(param.type, body.type);
    return (Sym.Lambda) intern(
        new Key(Op.LAMBDA, type, null, ImmutableList.of(param, body)),
        id -> new Sym.Lambda(id, type, param, body));
  }

  /** Applies a function to an argument. */
  public Sym.Exp apply(Sym.Exp fn, Sym.Exp arg) {
    if (!(fn.type instanceof FnType)) {
      throw new TypeException("not a function: " + fn.type.moniker());
    }
    final FnType fnType = (FnType) fn.type;
    checkType(arg, fnType.paramType, Op.APPLY);
    return make(Op.APPLY, fnType.resultType, null, fn, arg);
  }

  // -- rebuilding -----------------------------------------------------------

  /**
   * Creates an expression like a given expression but with different
   * arguments, simplifying as if it were built from scratch.
   *
   * <p>If the arguments are the same, returns the expression itself.
   */
  public Sym.Exp copy(Sym.Exp e, List<Sym.Exp> args) {
    switch (e.op) {
    case LITERAL:
    case VAR:
      return e;
    case NOT:
      return not(args.get(0));
    case AND:
      return and(args.get(0), args.get(1));
    case OR:
      return or(args.get(0), args.get(1));
    case EQ:
      return eq(args.get(0), args.get(1));
    case IF:
      return ifThenElse(args.get(0), args.get(1), args.get(2));
    case PLUS:
      return plus(args.get(0), args.get(1));
    case MINUS:
      return minus(args.get(0), args.get(1));
    case TIMES:
      return times(args.get(0), args.get(1));
    case LT:
      return lt(args.get(0), args.get(1));
    case LE:
      return le(args.get(0), args.get(1));
    case BIT_AND:
      return bitAnd(args.get(0), args.get(1));
    case BIT_OR:
      return bitOr(args.get(0), args.get(1));
    case BIT_XOR:
      return bitXor(args.get(0), args.get(1));
    case BIT_NOT:
      return bitNot(args.get(0));
    case CAST:
      return cast(args.get(0), e.type);
    case GET_FIELD:
      return getField(args.get(0), ((Sym.Field) e).fieldName);
    case WITH_FIELD:
      return withField(args.get(0), ((Sym.Field) e).fieldName, args.get(1));
    case CREATE_OBJECT:
      return createObject((ObjectType) e.type, args);
    case SOME:
      return some(args.get(0));
    case IS_SOME:
      return isSome(args.get(0));
    case OPTION_VALUE_OR:
      return valueOr(args.get(0), args.get(1));
    case LIST_ADD_FRONT:
      return listAddFront(args.get(0), args.get(1));
    case LIST_LENGTH:
      return listLength(args.get(0));
    case LIST_HEAD:
      return listHead(args.get(0));
    case LIST_CONTAINS:
      return listContains(args.get(0), args.get(1));
    case LIST_TAIL:
      return listTail(args.get(0));
    case LIST_CASE:
      return listCase(args.get(0), args.get(1), ((Sym.ListCase) e).cons);
    case SEQ_UNIT:
      return seqUnit(args.get(0));
    case SEQ_CONCAT:
      return seqConcat(args.get(0), args.get(1));
    case SEQ_LENGTH:
      return seqLength(args.get(0));
    case SEQ_AT:
      return seqAt(args.get(0), args.get(1));
    case SEQ_CONTAINS:
      return seqContains(args.get(0), args.get(1));
    case SEQ_INDEX_OF:
      return seqIndexOf(args.get(0), args.get(1), args.get(2));
    case SEQ_SLICE:
      return seqSlice(args.get(0), args.get(1), args.get(2));
    case SEQ_REPLACE_FIRST:
      return seqReplaceFirst(args.get(0), args.get(1), args.get(2));
    case MAP_SET:
      return mapSet(args.get(0), args.get(1), args.get(2));
    case MAP_DELETE:
      return mapDelete(args.get(0), args.get(1));
    case MAP_GET:
      return mapGet(args.get(0), args.get(1));
    case SET_ADD:
      return setAdd(args.get(0), args.get(1));
    case SET_REMOVE:
      return setRemove(args.get(0), args.get(1));
    case SET_CONTAINS:
      return setContains(args.get(0), args.get(1));
    case SET_UNION:
      return setUnion(args.get(0), args.get(1));
    case SET_INTERSECT:
      return setIntersect(args.get(0), args.get(1));
    case BAG_ADD:
      return bagAdd(args.get(0), args.get(1));
    case BAG_COUNT:
      return bagCount(args.get(0), args.get(1));
    case CONST_MAP_GET:
      return constMapGet(args.get(0), args.get(1));
    case CONST_MAP_SET:
      return constMapSet(args.get(0), args.get(1), args.get(2));
    case LAMBDA:
      return lambda((Sym.Var) args.get(0), args.get(1));
    case APPLY:
      return apply(args.get(0), args.get(1));
    default:
      throw new AssertionError("unknown op " + e.op);
    }
  }

  // -- implementation -------------------------------------------------------

  private Sym.Exp make(Op op, Type type, @Nullable String fieldName,
      Sym.Exp... args) {
    return make(op, type, fieldName, ImmutableList.copyOf(args));
  }

  /** Creates a call, folding it to a literal if its arguments are
   * literals, and interns it. */
  private Sym.Exp make(Op op, Type type, @Nullable String fieldName,
      ImmutableList<Sym.Exp> args) {
    if (op.isFoldable() && args.stream().allMatch(Sym.Exp::isLiteral)) {
      final List<Object> values = new ArrayList<>(args.size());
      args.forEach(arg -> values.add(((Sym.Literal) arg).value));
      return literal(type, Evaluator.call(op, type, fieldName, values));
    }
    return intern(new Key(op, type, fieldName, args),
        id -> fieldName == null
            ? new Sym.Call(id, op, type, args)
            : new Sym.Field(id, op, type, args, fieldName));
  }

  private Sym.Exp intern(Key key, IntFunction<Sym.Exp> factory) {
    return table.getOrAdd(key,
        () -> factory.apply(nextId.getAndIncrement())).value;
  }

  private static boolean isNegation(Sym.Exp a, Sym.Exp b) {
    return a.op == Op.NOT && a.arg(0) == b
        || b.op == Op.NOT && b.arg(0) == a;
  }

  private static boolean isZero(Sym.Exp e) {
    return e.isLiteral()
        && ((Sym.Literal) e).value instanceof BigInteger
        && ((BigInteger) ((Sym.Literal) e).value).signum() == 0;
  }

  private static boolean isOne(Sym.Exp e) {
    return e.isLiteral()
        && BigInteger.ONE.equals(((Sym.Literal) e).value);
  }

  private static boolean isEmptySeq(Sym.Exp e) {
    if (!e.isLiteral()) {
      return false;
    }
    final Object value = ((Sym.Literal) e).value;
    return value instanceof String ? ((String) value).isEmpty()
        : ((List<?>) value).isEmpty();
  }

  private static boolean isNumeric(Type type) {
    return type instanceof IntType
        || type == PrimitiveType.BIGINT
        || type == PrimitiveType.CHAR;
  }

  private static void checkType(Sym.Exp e, Type type, Op op) {
    if (!e.type.equals(type)) {
      throw new TypeException("operand of " + op.opName + " must have type "
          + type.moniker() + ", but was " + e.type.moniker());
    }
  }

  private static void checkBool(Sym.Exp e, Op op) {
    checkType(e, PrimitiveType.BOOL, op);
  }

  private static void checkSameType(Sym.Exp a, Sym.Exp b, Op op) {
    if (!a.type.equals(b.type)) {
      throw new TypeException("operands of " + op.opName
          + " must have the same type, but were " + a.type.moniker()
          + " and " + b.type.moniker());
    }
  }

  private static void checkArithmetic(Sym.Exp a, Sym.Exp b, Op op) {
    checkSameType(a, b, op);
    if (!(a.type instanceof IntType) && a.type != PrimitiveType.BIGINT) {
      throw new TypeException("operands of " + op.opName
          + " must be integers, but were " + a.type.moniker());
    }
  }

  private static void checkOrdered(Sym.Exp a, Sym.Exp b, Op op) {
    checkSameType(a, b, op);
    if (!isNumeric(a.type)) {
      throw new TypeException("operands of " + op.opName
          + " must be ordered, but were " + a.type.moniker());
    }
  }

  private static void checkBits(Sym.Exp a, Sym.Exp b, Op op) {
    checkSameType(a, b, op);
    if (!(a.type instanceof IntType)) {
      throw new TypeException("operands of " + op.opName
          + " must be fixed-width integers, but were " + a.type.moniker());
    }
  }

  private static void checkSeq(Sym.Exp e, Op op) {
    if (e.type != PrimitiveType.STRING && e.type.op() != Op.SEQ_TYPE) {
      throw new TypeException("operand of " + op.opName
          + " must be a sequence or string, but was " + e.type.moniker());
    }
  }

  private static <T extends Type> T typeOf(Sym.Exp e, Class<T> clazz,
      Op op) {
    if (!clazz.isInstance(e.type)) {
      throw new TypeException("operand of " + op.opName + " must have "
          + "type " + clazz.getSimpleName() + ", but was "
          + e.type.moniker());
    }
    return clazz.cast(e.type);
  }

  private static ObjectType objectType(Sym.Exp e, Op op) {
    return typeOf(e, ObjectType.class, op);
  }

  private static OptionType optionType(Sym.Exp e, Op op) {
    return typeOf(e, OptionType.class, op);
  }

  private static ListType listType(Sym.Exp e, Op op) {
    return typeOf(e, ListType.class, op);
  }

  private static MapType mapType(Sym.Exp e, Op op) {
    return typeOf(e, MapType.class, op);
  }

  private static ConstMapType constMapType(Sym.Exp e, Op op) {
    return typeOf(e, ConstMapType.class, op);
  }

  private static SetType setType(Sym.Exp e, Op op) {
    return typeOf(e, SetType.class, op);
  }

  private static BagType bagType(Sym.Exp e, Op op) {
    return typeOf(e, BagType.class, op);
  }

  /** Structural key of an expression. Refers to arguments by id, so that
   * the table does not keep them alive. */
  private static final class Key {
    final Op op;
    final Type type;
    final @Nullable Object param;
    final int[] argIds;

    Key(Op op, Type type, @Nullable Object param, List<Sym.Exp> args) {
      this.op = op;
      this.type = type;
      this.param = param;
      this.argIds = new int[args.size()];
      for (int i = 0; i < args.size(); i++) {
        argIds[i] = args.get(i).id;
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, type, param, Arrays.hashCode(argIds));
    }

    @Override public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Key
          && op == ((Key) obj).op
          && type.equals(((Key) obj).type)
          && Objects.equals(param, ((Key) obj).param)
          && Arrays.equals(argIds, ((Key) obj).argIds);
    }
  }
}

// End SymBuilder.java

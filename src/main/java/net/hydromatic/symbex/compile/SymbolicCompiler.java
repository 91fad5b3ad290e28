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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.symbex.ast.Sym;
import net.hydromatic.symbex.eval.ObjectValue;
import net.hydromatic.symbex.eval.Values;
import net.hydromatic.symbex.type.ConstMapType;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.MapType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.OptionType;
import net.hydromatic.symbex.type.PrimitiveType;
import net.hydromatic.symbex.type.Type;
import net.hydromatic.symbex.type.TypeException;
import net.hydromatic.symbex.type.TypeSystem;

/**
 * Compiles expressions to the terms of a backend.
 *
 * <p>This class handles logic, objects, options, bounded lists, maps with
 * constant keys and functions, which every backend represents the same way
 * in terms of booleans and scalars. Subclasses provide the primitive
 * operations on booleans ({@code B}) and scalars ({@code W}), and compile
 * the remaining operators in {@link #theory}.
 *
 * <p>Each variable is compiled once, to the same symbolic value, however
 * many times it occurs. Compilation is memoized per expression node.
 *
 * @param <B> Backend boolean term
 * @param <W> Backend scalar term
 */
public abstract class SymbolicCompiler<B, W> {
  public final Backend backend;
  protected final TypeSystem typeSystem;

  /** Compiled values of the nodes seen in the current scope. */
  private Map<Sym.Exp, SymValue<B, W>> cache = new HashMap<>();
  /** Values of lambda parameters in the current scope. */
  private ImmutableMap<Sym.Var, SymValue<B, W>> env = ImmutableMap.of();
  private final Map<Sym.Var, SymValue<B, W>> variables =
      new LinkedHashMap<>();
  private final List<B> constraints = new ArrayList<>();

  protected SymbolicCompiler(Backend backend, TypeSystem typeSystem) {
    checkArgument(backend != Backend.AUTO);
    this.backend = backend;
    this.typeSystem = typeSystem;
  }

  /** Returns the free variables compiled so far, with their values, in the
   * order they were first seen. */
  public ImmutableMap<Sym.Var, SymValue<B, W>> variables() {
    return ImmutableMap.copyOf(variables);
  }

  /** Returns the constraint that every variable compiled so far holds a
   * valid value of its type; for example, that the length of a list does
   * not exceed its capacity. */
  public B validity() {
    B b = trueTerm();
    for (B constraint : constraints) {
      b = and(b, constraint);
    }
    return b;
  }

  /** Compiles an expression. */
  public SymValue<B, W> compile(Sym.Exp e) {
    SymValue<B, W> v = cache.get(e);
    if (v == null) {
      v = compile2(e);
      cache.put(e, v);
    }
    return v;
  }

  /** Compiles a boolean expression. */
  public B compileBool(Sym.Exp e) {
    return ((SymValue.Bool<B, W>) compile(e)).value;
  }

  /** Returns the value of a variable, creating it if necessary. */
  public SymValue<B, W> variable(Sym.Var var) {
    final SymValue<B, W> bound = env.get(var);
    if (bound != null) {
      return bound;
    }
    SymValue<B, W> v = variables.get(var);
    if (v == null) {
      v = freshVariable(var);
      variables.put(var, v);
    }
    return v;
  }

  /** Creates the value of a free variable. */
  protected SymValue<B, W> freshVariable(Sym.Var var) {
    return fresh(var.type, var.name + "!" + var.id);
  }

  /** Called before each node is compiled. Throws if the backend cannot
   * handle the node. */
  protected void check(Sym.Exp e) {
  }

  private SymValue<B, W> compile2(Sym.Exp e) {
    check(e);
    switch (e.op) {
    case LITERAL:
      return constant(e.type, ((Sym.Literal) e).value);

    case VAR:
      return variable((Sym.Var) e);

    case NOT:
      return bool(not(compileBool(e.arg(0))));

    case AND:
      return bool(and(compileBool(e.arg(0)), compileBool(e.arg(1))));

    case OR:
      return bool(or(compileBool(e.arg(0)), compileBool(e.arg(1))));

    case EQ:
      return bool(equal(compile(e.arg(0)), compile(e.arg(1))));

    case IF:
      return ite(compileBool(e.arg(0)), compile(e.arg(1)),
          compile(e.arg(2)));

    case GET_FIELD:
      final Sym.Field get = (Sym.Field) e;
      return ((SymValue.Struct<B, W>) compile(get.arg(0))).fields
          .get(get.objectType().fieldOrdinal(get.fieldName));

    case WITH_FIELD:
      final Sym.Field with = (Sym.Field) e;
      final SymValue.Struct<B, W> struct =
          (SymValue.Struct<B, W>) compile(with.arg(0));
      final List<SymValue<B, W>> fields = new ArrayList<>(struct.fields);
      fields.set(with.objectType().fieldOrdinal(with.fieldName),
          compile(with.arg(1)));
      return new SymValue.Struct<>(e.type, ImmutableList.copyOf(fields));

    case CREATE_OBJECT:
      return new SymValue.Struct<>(e.type, compileAll(e.args));

    case SOME:
      return new SymValue.Option<>(e.type, trueTerm(), compile(e.arg(0)));

    case IS_SOME:
      return bool(((SymValue.Option<B, W>) compile(e.arg(0))).present);

    case OPTION_VALUE_OR:
      final SymValue.Option<B, W> option =
          (SymValue.Option<B, W>) compile(e.arg(0));
      return ite(option.present, option.value, compile(e.arg(1)));

    case LIST_ADD_FRONT:
      return addFront((SymValue.BoundedList<B, W>) compile(e.arg(0)),
          compile(e.arg(1)));

    case LIST_LENGTH:
      return new SymValue.Scalar<>(e.type,
          ((SymValue.BoundedList<B, W>) compile(e.arg(0))).length);

    case LIST_HEAD:
      return head((SymValue.BoundedList<B, W>) compile(e.arg(0)),
          (OptionType) e.type);

    case LIST_CONTAINS:
      return bool(
          contains((SymValue.BoundedList<B, W>) compile(e.arg(0)),
              compile(e.arg(1))));

    case LIST_TAIL:
      return tail((SymValue.BoundedList<B, W>) compile(e.arg(0)));

    case LIST_CASE:
      return listCase((Sym.ListCase) e);

    case CONST_MAP_GET:
      return ((SymValue.Struct<B, W>) compile(e.arg(0))).fields
          .get(keyOrdinal(e));

    case CONST_MAP_SET:
      final SymValue.Struct<B, W> map =
          (SymValue.Struct<B, W>) compile(e.arg(0));
      final List<SymValue<B, W>> entries = new ArrayList<>(map.fields);
      entries.set(keyOrdinal(e), compile(e.arg(2)));
      return new SymValue.Struct<>(e.type, ImmutableList.copyOf(entries));

    case LAMBDA:
      return new SymValue.Fn<>(e.type,
          ImmutableList.of(
              new SymValue.Alternative<>(trueTerm(), (Sym.Lambda) e, env)));

    case APPLY:
      return apply((SymValue.Fn<B, W>) compile(e.arg(0)), compile(e.arg(1)));

    default:
      return theory(e, compileAll(e.args));
    }
  }

  private ImmutableList<SymValue<B, W>> compileAll(List<Sym.Exp> args) {
    final ImmutableList.Builder<SymValue<B, W>> b = ImmutableList.builder();
    args.forEach(arg -> b.add(compile(arg)));
    return b.build();
  }

  /** Compiles an operator specific to this backend: arithmetic,
   * comparison, casts, sequences, maps, sets and bags. */
  protected abstract SymValue<B, W> theory(Sym.Exp e,
      List<SymValue<B, W>> args);

  // -- lists ----------------------------------------------------------------

  private SymValue<B, W> addFront(SymValue.BoundedList<B, W> list,
      SymValue<B, W> element) {
    final ListType listType = (ListType) list.type;
    final int capacity = listType.capacity;
    if (capacity == 0) {
      return list;
    }
    final IntType lengthType = typeSystem.lengthType(listType);
    final ImmutableList<SymValue<B, W>> slots =
        ImmutableList.<SymValue<B, W>>builder()
            .add(element)
            .addAll(
                list.slots.subList(0,
                    Math.min(list.slots.size(), capacity - 1)))
            .build();
    // A full list keeps its length; its last element drops off
    final B full =
        scalarEq(lengthType, list.length, length(lengthType, capacity));
    final W length =
        scalarIte(full, list.length,
            intAdd(lengthType, list.length, length(lengthType, 1)));
    return new SymValue.BoundedList<>(listType, length, slots);
  }

  private SymValue<B, W> head(SymValue.BoundedList<B, W> list,
      OptionType type) {
    final ListType listType = (ListType) list.type;
    if (list.slots.isEmpty()) {
      return new SymValue.Option<>(type, falseTerm(),
          defaultValue(type.elementType));
    }
    final IntType lengthType = typeSystem.lengthType(listType);
    return new SymValue.Option<>(type,
        not(scalarEq(lengthType, list.length, length(lengthType, 0))),
        list.slots.get(0));
  }

  /** Returns a list without its first element. The length of an empty
   * list stays zero. */
  private SymValue<B, W> tail(SymValue.BoundedList<B, W> list) {
    if (list.slots.isEmpty()) {
      return list;
    }
    final IntType lengthType = typeSystem.lengthType((ListType) list.type);
    // Adding all ones decrements, modulo the width of the length
    final W minusOne =
        scalarConstant(lengthType,
            BigInteger.ONE.shiftLeft(lengthType.width)
                .subtract(BigInteger.ONE));
    final W length =
        scalarIte(isEmpty(lengthType, list), list.length,
            intAdd(lengthType, list.length, minusOne));
    return new SymValue.BoundedList<>(list.type, length,
        list.slots.subList(1, list.slots.size()));
  }

  /** Compiles a case analysis of a list. Each level of recursion in the
   * body works on a list with one slot fewer, so recursion on the tail
   * stops when the slots run out. */
  private SymValue<B, W> listCase(Sym.ListCase e) {
    final SymValue.BoundedList<B, W> list =
        (SymValue.BoundedList<B, W>) compile(e.arg(0));
    final SymValue<B, W> empty = compile(e.arg(1));
    if (list.slots.isEmpty()) {
      return empty;
    }
    final SymValue<B, W> nonEmpty =
        compileIn(
            ImmutableMap.<Sym.Var, SymValue<B, W>>builder()
                .putAll(env)
                .put(e.head, list.slots.get(0))
                .put(e.tail, tail(list))
                .buildKeepingLast(),
            e.body());
    final IntType lengthType = typeSystem.lengthType((ListType) list.type);
    return ite(isEmpty(lengthType, list), empty, nonEmpty);
  }

  private B isEmpty(IntType lengthType, SymValue.BoundedList<B, W> list) {
    return scalarEq(lengthType, list.length, length(lengthType, 0));
  }

  private B contains(SymValue.BoundedList<B, W> list,
      SymValue<B, W> element) {
    final IntType lengthType = typeSystem.lengthType((ListType) list.type);
    B b = falseTerm();
    for (int i = 0; i < list.slots.size(); i++) {
      b = or(b,
          and(inRange(lengthType, i, list.length),
              equal(list.slots.get(i), element)));
    }
    return b;
  }

  /** Returns whether slot {@code i} is within a list's length. */
  private B inRange(IntType lengthType, int i, W length) {
    return intLt(lengthType, length(lengthType, i), length);
  }

  private W length(IntType lengthType, int n) {
    return scalarConstant(lengthType, BigInteger.valueOf(n));
  }

  // -- functions ------------------------------------------------------------

  private SymValue<B, W> apply(SymValue.Fn<B, W> fn, SymValue<B, W> arg) {
    final List<SymValue.Alternative<B, W>> alternatives = fn.alternatives;
    // Guards are exclusive and exhaustive, so the last alternative needs
    // no test
    SymValue<B, W> result =
        applyLambda(alternatives.get(alternatives.size() - 1), arg);
    for (int i = alternatives.size() - 2; i >= 0; i--) {
      final SymValue.Alternative<B, W> alternative = alternatives.get(i);
      result = ite(alternative.guard, applyLambda(alternative, arg), result);
    }
    return result;
  }

  private SymValue<B, W> applyLambda(SymValue.Alternative<B, W> alternative,
      SymValue<B, W> arg) {
    return compileIn(
        ImmutableMap.<Sym.Var, SymValue<B, W>>builder()
            .putAll(alternative.env)
            .put(alternative.lambda.param, arg)
            .buildKeepingLast(),
        alternative.lambda.body);
  }

  /** Compiles an expression in a new scope with the given bindings. */
  private SymValue<B, W> compileIn(
      ImmutableMap<Sym.Var, SymValue<B, W>> env2, Sym.Exp e) {
    final Map<Sym.Exp, SymValue<B, W>> savedCache = cache;
    final ImmutableMap<Sym.Var, SymValue<B, W>> savedEnv = env;
    cache = new HashMap<>();
    env = env2;
    try {
      return compile(e);
    } finally {
      cache = savedCache;
      env = savedEnv;
    }
  }

  // -- maps with constant keys ----------------------------------------------

  /** Returns the position of the key of a {@link
   * net.hydromatic.symbex.ast.Op#CONST_MAP_GET} or {@link
   * net.hydromatic.symbex.ast.Op#CONST_MAP_SET}. */
  private static int keyOrdinal(Sym.Exp e) {
    return ((ConstMapType) e.arg(0).type)
        .keyOrdinal(((Sym.Literal) e.arg(1)).value);
  }

  // -- values of any type ---------------------------------------------------

  /** Returns a boolean value. */
  protected SymValue<B, W> bool(B b) {
    return new SymValue.Bool<>(PrimitiveType.BOOL, b);
  }

  /** Returns the symbolic value of a constant. */
  public SymValue<B, W> constant(Type type, Object value) {
    switch (type.op()) {
    case BOOL_TYPE:
      return bool((Boolean) value ? trueTerm() : falseTerm());

    case OBJECT_TYPE:
      final ObjectType objectType = (ObjectType) type;
      final ObjectValue o = (ObjectValue) value;
      final ImmutableList.Builder<SymValue<B, W>> fields =
          ImmutableList.builder();
      objectType.fieldTypes.forEach((name, fieldType) ->
          fields.add(constant(fieldType, o.get(name))));
      return new SymValue.Struct<>(type, fields.build());

    case OPTION_TYPE:
      final Type elementType = ((OptionType) type).elementType;
      final Optional<?> optional = (Optional<?>) value;
      return new SymValue.Option<>(type,
          optional.isPresent() ? trueTerm() : falseTerm(),
          optional.isPresent() ? constant(elementType, optional.get())
              : defaultValue(elementType));

    case LIST_TYPE:
      final ListType listType = (ListType) type;
      final List<?> list = (List<?>) value;
      final ImmutableList.Builder<SymValue<B, W>> slots =
          ImmutableList.builder();
      for (int i = 0; i < listType.capacity; i++) {
        slots.add(i < list.size()
            ? constant(listType.elementType, list.get(i))
            : defaultValue(listType.elementType));
      }
      return new SymValue.BoundedList<>(type,
          length(typeSystem.lengthType(listType), list.size()),
          slots.build());

    case MAP_TYPE:
      return mapConstant((MapType) type, (Map<?, ?>) value);

    case CONST_MAP_TYPE:
      final ConstMapType constMapType = (ConstMapType) type;
      final Map<?, ?> map = (Map<?, ?>) value;
      final ImmutableList.Builder<SymValue<B, W>> values =
          ImmutableList.builder();
      constMapType.keys.forEach(key ->
          values.add(constant(constMapType.valueType, map.get(key))));
      return new SymValue.Struct<>(type, values.build());

    case FN_TYPE:
      throw new TypeException("function constant: " + type.moniker());

    default:
      return new SymValue.Scalar<>(type, scalarConstant(type, value));
    }
  }

  private SymValue<B, W> defaultValue(Type type) {
    return constant(type, Values.defaultValue(type));
  }

  /** Creates a symbolic value whose leaves are new backend variables. */
  protected SymValue<B, W> fresh(Type type, String name) {
    switch (type.op()) {
    case BOOL_TYPE:
      return bool(boolVariable(name));

    case OBJECT_TYPE:
      final ImmutableList.Builder<SymValue<B, W>> fields =
          ImmutableList.builder();
      ((ObjectType) type).fieldTypes.forEach((fieldName, fieldType) ->
          fields.add(fresh(fieldType, name + "." + fieldName)));
      return new SymValue.Struct<>(type, fields.build());

    case OPTION_TYPE:
      return new SymValue.Option<>(type, boolVariable(name + ".present"),
          fresh(((OptionType) type).elementType, name + ".value"));

    case LIST_TYPE:
      final ListType listType = (ListType) type;
      final IntType lengthType = typeSystem.lengthType(listType);
      final W length = scalarVariable(lengthType, name + ".length");
      addConstraint(
          intLe(lengthType, length, length(lengthType, listType.capacity)));
      final ImmutableList.Builder<SymValue<B, W>> slots =
          ImmutableList.builder();
      for (int i = 0; i < listType.capacity; i++) {
        slots.add(fresh(listType.elementType, name + "[" + i + "]"));
      }
      return new SymValue.BoundedList<>(type, length, slots.build());

    case MAP_TYPE:
      return freshMap((MapType) type, name);

    case CONST_MAP_TYPE:
      final ConstMapType constMapType = (ConstMapType) type;
      final ImmutableList.Builder<SymValue<B, W>> values =
          ImmutableList.builder();
      constMapType.keys.forEach(key ->
          values.add(
              fresh(constMapType.valueType, name + "[" + key + "]")));
      return new SymValue.Struct<>(type, values.build());

    case FN_TYPE:
      throw new TypeException("function variable: " + type.moniker());

    default:
      final W w = scalarVariable(type, name);
      addConstraint(scalarConstraint(type, w));
      return new SymValue.Scalar<>(type, w);
    }
  }

  /** Adds a constraint that holds for every valid value of the variables
   * compiled so far. */
  protected void addConstraint(B b) {
    constraints.add(b);
  }

  /** Returns whether two values of the same type are equal. Ignores the
   * payload of an absent option, and slots beyond the length of a list. */
  public B equal(SymValue<B, W> a, SymValue<B, W> b) {
    switch (a.type.op()) {
    case BOOL_TYPE:
      return iff(((SymValue.Bool<B, W>) a).value,
          ((SymValue.Bool<B, W>) b).value);

    case OBJECT_TYPE:
    case CONST_MAP_TYPE:
      final List<SymValue<B, W>> fieldsA = ((SymValue.Struct<B, W>) a).fields;
      final List<SymValue<B, W>> fieldsB = ((SymValue.Struct<B, W>) b).fields;
      B result = trueTerm();
      for (int i = 0; i < fieldsA.size(); i++) {
        result = and(result, equal(fieldsA.get(i), fieldsB.get(i)));
      }
      return result;

    case OPTION_TYPE:
      final SymValue.Option<B, W> optionA = (SymValue.Option<B, W>) a;
      final SymValue.Option<B, W> optionB = (SymValue.Option<B, W>) b;
      return and(iff(optionA.present, optionB.present),
          or(not(optionA.present), equal(optionA.value, optionB.value)));

    case LIST_TYPE:
      final SymValue.BoundedList<B, W> listA =
          (SymValue.BoundedList<B, W>) a;
      final SymValue.BoundedList<B, W> listB =
          (SymValue.BoundedList<B, W>) b;
      final IntType lengthType = typeSystem.lengthType((ListType) a.type);
      B eq = scalarEq(lengthType, listA.length, listB.length);
      // A missing slot is beyond the length of both lists
      final int n = Math.min(listA.slots.size(), listB.slots.size());
      for (int i = 0; i < n; i++) {
        eq = and(eq,
            or(not(inRange(lengthType, i, listA.length)),
                equal(listA.slots.get(i), listB.slots.get(i))));
      }
      return eq;

    case MAP_TYPE:
      return mapEq((MapType) a.type, (SymValue.MapPair<B, W>) a,
          (SymValue.MapPair<B, W>) b);

    case FN_TYPE:
      throw new TypeException("cannot compare functions");

    default:
      return scalarEq(a.type, ((SymValue.Scalar<B, W>) a).value,
          ((SymValue.Scalar<B, W>) b).value);
    }
  }

  /** Returns "if c then a else b" for values of the same type. */
  public SymValue<B, W> ite(B c, SymValue<B, W> a, SymValue<B, W> b) {
    switch (a.type.op()) {
    case BOOL_TYPE:
      return bool(
          ite(c, ((SymValue.Bool<B, W>) a).value,
              ((SymValue.Bool<B, W>) b).value));

    case OBJECT_TYPE:
    case CONST_MAP_TYPE:
      final List<SymValue<B, W>> fieldsA = ((SymValue.Struct<B, W>) a).fields;
      final List<SymValue<B, W>> fieldsB = ((SymValue.Struct<B, W>) b).fields;
      final ImmutableList.Builder<SymValue<B, W>> fields =
          ImmutableList.builder();
      for (int i = 0; i < fieldsA.size(); i++) {
        fields.add(ite(c, fieldsA.get(i), fieldsB.get(i)));
      }
      return new SymValue.Struct<>(a.type, fields.build());

    case OPTION_TYPE:
      final SymValue.Option<B, W> optionA = (SymValue.Option<B, W>) a;
      final SymValue.Option<B, W> optionB = (SymValue.Option<B, W>) b;
      return new SymValue.Option<>(a.type,
          ite(c, optionA.present, optionB.present),
          ite(c, optionA.value, optionB.value));

    case LIST_TYPE:
      final SymValue.BoundedList<B, W> listA =
          (SymValue.BoundedList<B, W>) a;
      final SymValue.BoundedList<B, W> listB =
          (SymValue.BoundedList<B, W>) b;
      final Type elementType = ((ListType) a.type).elementType;
      final ImmutableList.Builder<SymValue<B, W>> slots =
          ImmutableList.builder();
      final int n = Math.max(listA.slots.size(), listB.slots.size());
      for (int i = 0; i < n; i++) {
        slots.add(
            ite(c, slot(listA, i, elementType),
                slot(listB, i, elementType)));
      }
      return new SymValue.BoundedList<>(a.type,
          scalarIte(c, listA.length, listB.length), slots.build());

    case MAP_TYPE:
      final SymValue.MapPair<B, W> mapA = (SymValue.MapPair<B, W>) a;
      final SymValue.MapPair<B, W> mapB = (SymValue.MapPair<B, W>) b;
      return new SymValue.MapPair<>(a.type,
          scalarIte(c, mapA.present, mapB.present),
          scalarIte(c, mapA.values, mapB.values));

    case FN_TYPE:
      final ImmutableList.Builder<SymValue.Alternative<B, W>> alternatives =
          ImmutableList.builder();
      ((SymValue.Fn<B, W>) a).alternatives.forEach(alt ->
          alternatives.add(
              new SymValue.Alternative<>(and(c, alt.guard), alt.lambda,
                  alt.env)));
      ((SymValue.Fn<B, W>) b).alternatives.forEach(alt ->
          alternatives.add(
              new SymValue.Alternative<>(and(not(c), alt.guard), alt.lambda,
                  alt.env)));
      return new SymValue.Fn<>(a.type, alternatives.build());

    default:
      return new SymValue.Scalar<>(a.type,
          scalarIte(c, ((SymValue.Scalar<B, W>) a).value,
              ((SymValue.Scalar<B, W>) b).value));
    }
  }

  private SymValue<B, W> slot(SymValue.BoundedList<B, W> list, int i,
      Type elementType) {
    return i < list.slots.size() ? list.slots.get(i)
        : defaultValue(elementType);
  }

  /** Reads the value of a symbolic value from a model. */
  public Object decode(SymValue<B, W> v, ModelView<B, W> model) {
    switch (v.type.op()) {
    case BOOL_TYPE:
      return model.bool(((SymValue.Bool<B, W>) v).value);

    case OBJECT_TYPE:
      final List<SymValue<B, W>> fields = ((SymValue.Struct<B, W>) v).fields;
      final Object[] values = new Object[fields.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = decode(fields.get(i), model);
      }
      return Values.object((ObjectType) v.type, values);

    case OPTION_TYPE:
      final SymValue.Option<B, W> option = (SymValue.Option<B, W>) v;
      return model.bool(option.present)
          ? Optional.of(decode(option.value, model))
          : Optional.empty();

    case LIST_TYPE:
      final SymValue.BoundedList<B, W> list = (SymValue.BoundedList<B, W>) v;
      final IntType lengthType = typeSystem.lengthType((ListType) v.type);
      final int length =
          Math.min(list.slots.size(),
              ((BigInteger) model.scalar(lengthType, list.length))
                  .intValueExact());
      final ImmutableList.Builder<Object> elements = ImmutableList.builder();
      for (int i = 0; i < length; i++) {
        elements.add(decode(list.slots.get(i), model));
      }
      return elements.build();

    case MAP_TYPE:
      final SymValue.MapPair<B, W> map = (SymValue.MapPair<B, W>) v;
      return ImmutableMap.copyOf(
          model.map((MapType) v.type, map.present, map.values));

    case CONST_MAP_TYPE:
      final List<Object> keys = ((ConstMapType) v.type).keys;
      final List<SymValue<B, W>> entries = ((SymValue.Struct<B, W>) v).fields;
      final ImmutableMap.Builder<Object, Object> b = ImmutableMap.builder();
      for (int i = 0; i < keys.size(); i++) {
        b.put(keys.get(i), decode(entries.get(i), model));
      }
      return b.build();

    case FN_TYPE:
      throw new TypeException("cannot decode a function");

    default:
      return model.scalar(v.type, ((SymValue.Scalar<B, W>) v).value);
    }
  }

  // -- primitives -----------------------------------------------------------

  public abstract B trueTerm();

  public abstract B falseTerm();

  public abstract B and(B a, B b);

  public abstract B or(B a, B b);

  public abstract B not(B a);

  public abstract B iff(B a, B b);

  public abstract B ite(B c, B a, B b);

  protected abstract B boolVariable(String name);

  protected abstract W scalarVariable(Type type, String name);

  protected abstract W scalarConstant(Type type, Object value);

  protected abstract W scalarIte(B c, W a, W b);

  protected abstract B scalarEq(Type type, W a, W b);

  /** Returns a constraint that a new variable of an atomic, sequence, set
   * or bag type must satisfy. */
  protected B scalarConstraint(Type type, W w) {
    return trueTerm();
  }

  protected abstract W intAdd(IntType type, W a, W b);

  protected abstract B intLt(IntType type, W a, W b);

  protected abstract B intLe(IntType type, W a, W b);

  protected abstract SymValue<B, W> mapConstant(MapType type,
      Map<?, ?> map);

  protected abstract SymValue<B, W> freshMap(MapType type, String name);

  protected abstract B mapEq(MapType type, SymValue.MapPair<B, W> a,
      SymValue.MapPair<B, W> b);
}

// End SymbolicCompiler.java

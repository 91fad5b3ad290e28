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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import java.math.BigInteger;
import net.hydromatic.symbex.type.DomainException;
import net.hydromatic.symbex.type.IntType;
import net.hydromatic.symbex.type.ListType;
import net.hydromatic.symbex.type.ObjectType;
import net.hydromatic.symbex.type.OptionType;
import net.hydromatic.symbex.type.TypeException;
import net.hydromatic.symbex.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymBuilder}: interning and simplification. */
public class SimplifierTest {
  private final TypeSystem typeSystem = new TypeSystem();
  private final SymBuilder builder = new SymBuilder(typeSystem);
  private final IntType int32 = typeSystem.intType();
  private final ObjectType point =
      typeSystem.objectType("Point", "x", int32, "y", int32);

  @Test void testHashCons() {
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Exp e1 = builder.plus(x, builder.intLiteral(int32, 1));
    final Sym.Exp e2 = builder.plus(x, builder.intLiteral(int32, 1));
    assertThat(e2, sameInstance(e1));
    assertThat(e1, hasToString("+(x, 1)"));
    final int size = builder.tableSize();
    builder.plus(x, builder.intLiteral(int32, 1));
    assertThat(builder.tableSize(), is(size));

    // Variables are never shared
    final Sym.Var x2 = builder.var(int32, "x");
    assertThat(x2, not(sameInstance(x)));
    assertThat(builder.plus(x2, builder.intLiteral(int32, 1)),
        not(sameInstance(e1)));
  }

  @Test void testConstantFolding() {
    final Sym.Exp two = builder.intLiteral(int32, 2);
    final Sym.Exp onePlusOne =
        builder.plus(builder.intLiteral(int32, 1),
            builder.intLiteral(int32, 1));
    assertThat(onePlusOne, sameInstance(two));

    // Arithmetic on fixed-width integers wraps
    final IntType uint8 = typeSystem.byteType();
    final Sym.Exp e =
        builder.plus(builder.intLiteral(uint8, 200),
            builder.intLiteral(uint8, 100));
    assertThat(((Sym.Literal) e).value, is(BigInteger.valueOf(44)));

    final Sym.Exp lt =
        builder.lt(builder.intLiteral(int32, 3), builder.intLiteral(int32, 4));
    assertThat(lt, sameInstance(builder.trueLiteral()));
  }

  @Test void testBooleanRules() {
    final Sym.Var p = builder.var(typeSystem.boolType, "p");
    final Sym.Var q = builder.var(typeSystem.boolType, "q");
    assertThat(builder.not(builder.not(p)), sameInstance(p));
    assertThat(builder.and(p, builder.trueLiteral()), sameInstance(p));
    assertThat(builder.and(p, builder.falseLiteral()),
        sameInstance(builder.falseLiteral()));
    assertThat(builder.or(p, builder.trueLiteral()),
        sameInstance(builder.trueLiteral()));
    assertThat(builder.and(p, p), sameInstance(p));
    assertThat(builder.and(p, builder.not(p)),
        sameInstance(builder.falseLiteral()));
    assertThat(builder.or(builder.not(q), q),
        sameInstance(builder.trueLiteral()));
    assertThat(builder.eq(p, builder.trueLiteral()), sameInstance(p));
    assertThat(builder.eq(builder.falseLiteral(), p),
        sameInstance(builder.not(p)));
    assertThat(builder.andAll(ImmutableList.of()),
        sameInstance(builder.trueLiteral()));
  }

  @Test void testIdempotence() {
    final Sym.Var p = builder.var(typeSystem.boolType, "p");
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Exp e =
        builder.ifThenElse(p, builder.plus(x, x), builder.intLiteral(int32, 0));
    assertThat(builder.copy(e, e.args), sameInstance(e));
    final Sym.Exp n = builder.not(builder.lt(x, builder.intLiteral(int32, 7)));
    assertThat(builder.copy(n, n.args), sameInstance(n));
  }

  @Test void testIf() {
    final Sym.Var p = builder.var(typeSystem.boolType, "p");
    final Sym.Var q = builder.var(typeSystem.boolType, "q");
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Var y = builder.var(int32, "y");
    assertThat(builder.ifThenElse(builder.trueLiteral(), x, y),
        sameInstance(x));
    assertThat(builder.ifThenElse(builder.falseLiteral(), x, y),
        sameInstance(y));
    assertThat(builder.ifThenElse(p, x, x), sameInstance(x));
    assertThat(builder.ifThenElse(builder.not(p), x, y),
        sameInstance(builder.ifThenElse(p, y, x)));
    assertThat(builder.ifThenElse(p, builder.trueLiteral(), q),
        sameInstance(builder.or(p, q)));
    assertThat(builder.ifThenElse(p, q, builder.falseLiteral()),
        sameInstance(builder.and(p, q)));
  }

  @Test void testFields() {
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Var y = builder.var(int32, "y");
    final Sym.Exp o = builder.createObject(point, ImmutableList.of(x, y));
    assertThat(builder.getField(o, "y"), sameInstance(y));

    final Sym.Var v = builder.var(point, "v");
    final Sym.Exp w = builder.withField(v, "x", y);
    assertThat(builder.getField(w, "x"), sameInstance(y));
    assertThat(builder.getField(w, "y"),
        sameInstance(builder.getField(v, "y")));

    // Rebuilding an object from its own fields yields the object
    final Sym.Exp rebuilt =
        builder.createObject(point,
            ImmutableMap.of("y", builder.getField(v, "y"),
                "x", builder.getField(v, "x")));
    assertThat(rebuilt, sameInstance(v));
    assertThat(builder.withField(v, "x", builder.getField(v, "x")),
        sameInstance(v));
  }

  @Test void testFieldErrors() {
    final Sym.Var v = builder.var(point, "v");
    final TypeException e =
        assertThrows(TypeException.class, () -> builder.getField(v, "z"));
    assertThat(e.getMessage(), containsString("has no field 'z'"));
    assertThrows(TypeException.class,
        () -> builder.createObject(point,
            ImmutableMap.of("x", builder.intLiteral(int32, 1))));
    assertThrows(TypeException.class,
        () -> builder.withField(v, "x", builder.trueLiteral()));
  }

  @Test void testOperandErrors() {
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Var c = builder.var(typeSystem.charType, "c");
    assertThrows(TypeException.class, () -> builder.plus(x, c));
    assertThrows(TypeException.class, () -> builder.not(x));
    assertThrows(TypeException.class,
        () -> builder.bitAnd(builder.var(typeSystem.bigintType, "b"),
            builder.var(typeSystem.bigintType, "b")));
    assertThrows(DomainException.class,
        () -> builder.intLiteral(typeSystem.byteType(), 256));
    assertThrows(DomainException.class, () -> builder.charLiteral(0x10000));
  }

  @Test void testOptionsAndLists() {
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Exp some = builder.some(x);
    assertThat(builder.isSome(some), sameInstance(builder.trueLiteral()));
    assertThat(builder.valueOr(some, builder.intLiteral(int32, 0)),
        sameInstance(x));
    final OptionType optionType = typeSystem.optionType(int32);
    assertThat(builder.isSome(builder.none(optionType)),
        sameInstance(builder.falseLiteral()));

    final ListType listType = typeSystem.listType(int32, 3);
    final Sym.Var list = builder.var(listType, "list");
    assertThat(builder.listHead(builder.listAddFront(list, x)),
        sameInstance(some));
    final Sym.Exp length =
        builder.listLength(
            builder.listAddFront(builder.emptyList(listType),
                builder.intLiteral(int32, 5)));
    assertThat(((Sym.Literal) length).value, is(BigInteger.ONE));
  }

  @Test void testLambda() {
    final Sym.Lambda inc =
        builder.lambda(int32,
            p -> builder.plus(p, builder.intLiteral(int32, 1)));
    final Sym.Exp e = builder.apply(inc, builder.intLiteral(int32, 41));
    assertThat(e.op, is(Op.APPLY));
    assertThat(e.type, is(int32));
    assertThat(builder.apply(inc, builder.intLiteral(int32, 41)),
        sameInstance(e));
    assertThrows(TypeException.class,
        () -> builder.apply(inc, builder.trueLiteral()));
    assertThrows(TypeException.class,
        () -> builder.var(typeSystem.fnType(int32, int32), "f"));
  }

  /** Derived operators are built from the primitive ones. */
  @Test void testDerivedOperators() {
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Var y = builder.var(int32, "y");
    assertThat(builder.gt(x, y), sameInstance(builder.lt(y, x)));
    assertThat(builder.ge(x, y), sameInstance(builder.le(y, x)));
    assertThat(builder.ne(x, y), sameInstance(builder.not(builder.eq(x, y))));
    assertThat(builder.ne(x, x), is(builder.falseLiteral()));

    final Sym.Var p = builder.var(typeSystem.boolType, "p");
    final Sym.Var q = builder.var(typeSystem.boolType, "q");
    assertThat(builder.orAll(ImmutableList.of()),
        is(builder.falseLiteral()));
    assertThat(builder.orAll(ImmutableList.of(p, q)),
        sameInstance(builder.or(p, q)));

    final OptionType optionType = typeSystem.optionType(int32);
    assertThat(builder.isNone(builder.none(optionType)),
        is(builder.trueLiteral()));
    assertThat(builder.isNone(builder.some(x)),
        is(builder.falseLiteral()));

    final Sym.Exp bag = builder.emptyBag(typeSystem.bagType(int32));
    assertThat(((Sym.Literal) bag).value, is(ImmutableMultiset.of()));
  }

  @Test void testReplacer() {
    final Sym.Var x = builder.var(int32, "x");
    final Sym.Exp e = builder.plus(x, builder.intLiteral(int32, 1));
    final Sym.Exp e2 =
        Replacer.substitute(builder,
            ImmutableMap.of(x, builder.intLiteral(int32, 5)), e);
    assertThat(e2, sameInstance(builder.intLiteral(int32, 6)));

    final Sym.Lambda inc =
        builder.lambda(int32,
            p -> builder.plus(p, builder.intLiteral(int32, 1)));
    final Sym.Exp apply = builder.apply(inc, x);
    assertThat(Replacer.inline(builder, apply), sameInstance(e));
    assertThat(Replacer.inline(builder, e), sameInstance(e));
  }
}

// End SimplifierTest.java

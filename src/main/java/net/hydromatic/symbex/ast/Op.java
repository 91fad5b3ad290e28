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

import com.google.common.collect.ImmutableMap;

/**
 * Kinds of {@link Sym.Exp} and of {@link net.hydromatic.symbex.type.Type}.
 */
public enum Op {
  // atoms
  LITERAL(true),
  VAR(true),

  // logic
  NOT("not"),
  AND("and"),
  OR("or"),
  EQ("=="),
  IF("if"),

  // integer arithmetic, bitwise and comparison
  PLUS("+"),
  MINUS("-"),
  TIMES("*"),
  LT("<"),
  LE("<="),
  BIT_AND("&"),
  BIT_OR("|"),
  BIT_XOR("^"),
  BIT_NOT("~"),
  CAST("cast"),

  // objects
  GET_FIELD("get"),
  WITH_FIELD("with"),
  CREATE_OBJECT("create"),

  // options
  SOME("some"),
  IS_SOME("isSome"),
  OPTION_VALUE_OR("valueOr"),

  // bounded lists
  LIST_ADD_FRONT("addFront"),
  LIST_LENGTH("length"),
  LIST_HEAD("head"),
  LIST_CONTAINS("contains"),
  LIST_TAIL("tail"),
  LIST_CASE("case"),

  // sequences and strings
  SEQ_UNIT("unit"),
  SEQ_CONCAT("concat"),
  SEQ_LENGTH("seqLength"),
  SEQ_AT("at"),
  SEQ_CONTAINS("seqContains"),
  SEQ_INDEX_OF("indexOf"),
  SEQ_SLICE("slice"),
  SEQ_REPLACE_FIRST("replaceFirst"),

  // maps, sets and bags
  MAP_SET("mapSet"),
  MAP_DELETE("mapDelete"),
  MAP_GET("mapGet"),
  SET_ADD("setAdd"),
  SET_REMOVE("setRemove"),
  SET_CONTAINS("setContains"),
  SET_UNION("union"),
  SET_INTERSECT("intersect"),
  BAG_ADD("bagAdd"),
  BAG_COUNT("bagCount"),

  // maps with constant keys
  CONST_MAP_GET("cmapGet"),
  CONST_MAP_SET("cmapSet"),

  // functions
  LAMBDA("fn"),
  APPLY("apply"),

  // types
  BOOL_TYPE("bool"),
  CHAR_TYPE("char"),
  BIGINT_TYPE("bigint"),
  STRING_TYPE("string"),
  INT_TYPE("int"),
  OBJECT_TYPE("object"),
  OPTION_TYPE("option"),
  LIST_TYPE("list"),
  SEQ_TYPE("seq"),
  MAP_TYPE("map"),
  CONST_MAP_TYPE("cmap"),
  SET_TYPE("set"),
  BAG_TYPE("bag"),
  FN_TYPE("fn");

  /** Operator name, e.g. "+"; null for atoms. */
  public final String opName;

  /** Expression operators, keyed by {@link #opName}. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.opName != null && !op.isType()) {
        b.put(op.opName, op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op(boolean atom) {
    assert atom;
    this.opName = null;
  }

  Op(String opName) {
    this.opName = opName;
  }

  /** Returns whether this is the kind of a type. */
  public boolean isType() {
    return name().endsWith("_TYPE");
  }

  /**
   * Returns whether a call to this operator, all of whose arguments are
   * literals, can be replaced by a literal.
   */
  public boolean isFoldable() {
    switch (this) {
    case LITERAL:
    case VAR:
    case IF:
    case LAMBDA:
    case APPLY:
    case LIST_CASE:
      return false;
    default:
      return !isType();
    }
  }
}

// End Op.java

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

/**
 * Visitor over types.
 *
 * <p>The default implementation of each method visits component types and
 * returns null.
 *
 * @param <R> Return type
 */
public class TypeVisitor<R> {
  public R visit(PrimitiveType type) {
    return null;
  }

  public R visit(IntType type) {
    return null;
  }

  public R visit(ObjectType type) {
    type.fieldTypes.values().forEach(t -> t.accept(this));
    return null;
  }

  public R visit(OptionType type) {
    return type.elementType.accept(this);
  }

  public R visit(ListType type) {
    return type.elementType.accept(this);
  }

  public R visit(SeqType type) {
    return type.elementType.accept(this);
  }

  public R visit(MapType type) {
    type.keyType.accept(this);
    return type.valueType.accept(this);
  }

  public R visit(ConstMapType type) {
    type.keyType.accept(this);
    return type.valueType.accept(this);
  }

  public R visit(SetType type) {
    return type.elementType.accept(this);
  }

  public R visit(BagType type) {
    return type.elementType.accept(this);
  }

  public R visit(FnType type) {
    type.paramType.accept(this);
    return type.resultType.accept(this);
  }
}

// End TypeVisitor.java

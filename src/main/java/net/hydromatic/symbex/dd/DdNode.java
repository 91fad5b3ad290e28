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

/**
 * Node of a reduced, ordered binary decision diagram.
 *
 * <p>Nodes are unique within a {@link DdManager}: two nodes represent the
 * same boolean function if and only if they are the same object.
 */
public final class DdNode {
  /** Handle of the node in the manager's table. */
  final int node;

  DdNode(int node) {
    this.node = node;
  }

  @Override public int hashCode() {
    return node;
  }

  @Override public boolean equals(Object obj) {
    return this == obj;
  }

  @Override public String toString() {
    return "dd" + node;
  }
}

// End DdNode.java

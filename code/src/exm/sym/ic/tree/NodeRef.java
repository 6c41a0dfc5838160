/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sym.ic.tree;

import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.ic.CanonicalPrinter;
import exm.sym.ic.tree.Node.FuncApp;
import exm.sym.ic.tree.Node.NodeKind;
import exm.sym.ic.tree.Node.Poly;
import exm.sym.ic.tree.Node.Tuple;
import exm.sym.ic.tree.Node.Var;

/**
 * Canonical handle for an interned {@link Node}.  Only
 * {@link InternStore} creates these, and it never creates two handles for
 * structurally equal nodes that are alive at the same time, so equality
 * is reference equality.  Hashing and ordering use values cached at
 * creation and never walk the tree.
 */
public final class NodeRef implements Comparable<NodeRef> {

  private final Node node;

  /** Structural hash of node */
  private final int hashCode;

  /** Creation order within the store, breaks ties between equal hashes */
  private final long serial;

  NodeRef(Node node, long serial) {
    this.node = node;
    this.hashCode = node.hashCode();
    this.serial = serial;
  }

  public Node node() {
    return node;
  }

  public NodeKind kind() {
    return node.kind;
  }

  public boolean isVar() {
    return node.kind == NodeKind.VAR;
  }

  public boolean isPoly() {
    return node.kind == NodeKind.POLY;
  }

  public boolean isTuple() {
    return node.kind == NodeKind.TUPLE;
  }

  public boolean isFuncApp() {
    return node.kind == NodeKind.FUNC_APP;
  }

  public Var asVar() {
    checkKind(NodeKind.VAR);
    return (Var)node;
  }

  public Poly asPoly() {
    checkKind(NodeKind.POLY);
    return (Poly)node;
  }

  public Tuple asTuple() {
    checkKind(NodeKind.TUPLE);
    return (Tuple)node;
  }

  public FuncApp asFuncApp() {
    checkKind(NodeKind.FUNC_APP);
    return (FuncApp)node;
  }

  private void checkKind(NodeKind expected) {
    if (node.kind != expected) {
      throw new SymRuntimeError("Expected " + expected + " node but got "
                                + node.kind + ": " + this);
    }
  }

  long serial() {
    return serial;
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public int compareTo(NodeRef o) {
    if (this == o) {
      return 0;
    }
    int c = Integer.compare(this.hashCode, o.hashCode);
    if (c != 0) {
      return c;
    }
    return Long.compare(this.serial, o.serial);
  }

  @Override
  public String toString() {
    return CanonicalPrinter.print(this);
  }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sym.common.lang.FunctionTag;
import exm.sym.ic.poly.Monomial;
import exm.sym.ic.poly.Polynomial;
import exm.sym.ic.poly.Power;

/**
 * An immutable expression node.  Nodes are only compared structurally
 * while being interned: the children of a node are themselves interned
 * {@link NodeRef}s, so comparing a node against another only needs to
 * look one level deep.
 *
 * The variants are closed: {@link Var}, {@link FuncApp}, {@link Poly}
 * and {@link Tuple}.
 */
public abstract class Node {

  public static enum NodeKind {
    /** A free symbol */
    VAR,
    /** Unevaluated elementary function application */
    FUNC_APP,
    /** Canonical polynomial: constants, sums, products, integer powers */
    POLY,
    /** Fixed-size vector, broadcast under arithmetic */
    TUPLE,
  }

  public final NodeKind kind;

  /** Structural hash, computed once at construction, same in every run */
  private final int hashCode;

  protected Node(NodeKind kind, int contentHash) {
    this.kind = kind;
    this.hashCode = 37 * kind.ordinal() + contentHash;
  }

  public NodeKind kind() {
    return kind;
  }

  /**
   * Child nodes, one entry per position that refers to them.
   * A child appearing in several positions is listed several times.
   */
  public abstract List<NodeRef> children();

  @Override
  public final int hashCode() {
    return hashCode;
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Node)) {
      return false;
    }
    Node other = (Node) obj;
    if (other.kind != this.kind || other.hashCode != this.hashCode) {
      return false;
    }
    return contentEquals(other);
  }

  /**
   * Compare content of node of same kind
   */
  protected abstract boolean contentEquals(Node other);

  public static class Var extends Node {
    private final String name;

    public Var(String name) {
      super(NodeKind.VAR, name.hashCode());
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public List<NodeRef> children() {
      return Collections.emptyList();
    }

    @Override
    protected boolean contentEquals(Node other) {
      return name.equals(((Var)other).name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class FuncApp extends Node {
    private final FunctionTag tag;
    private final NodeRef arg;

    public FuncApp(FunctionTag tag, NodeRef arg) {
      super(NodeKind.FUNC_APP, 31 * tag.ordinal() + arg.hashCode());
      this.tag = tag;
      this.arg = arg;
    }

    public FunctionTag tag() {
      return tag;
    }

    public NodeRef arg() {
      return arg;
    }

    @Override
    public List<NodeRef> children() {
      return Collections.singletonList(arg);
    }

    @Override
    protected boolean contentEquals(Node other) {
      FuncApp o = (FuncApp)other;
      return tag == o.tag && arg == o.arg;
    }

    @Override
    public String toString() {
      return tag + "(" + arg + ")";
    }
  }

  public static class Poly extends Node {
    private final Polynomial poly;

    public Poly(Polynomial poly) {
      super(NodeKind.POLY, poly.hashCode());
      this.poly = poly;
    }

    public Polynomial poly() {
      return poly;
    }

    @Override
    public List<NodeRef> children() {
      List<NodeRef> result = new ArrayList<NodeRef>();
      for (Monomial m: poly.monomials()) {
        for (Power p: m.powers()) {
          result.add(p.base());
        }
      }
      return result;
    }

    @Override
    protected boolean contentEquals(Node other) {
      return poly.equals(((Poly)other).poly);
    }

    @Override
    public String toString() {
      return poly.toString();
    }
  }

  public static class Tuple extends Node {
    private final ImmutableList<NodeRef> elements;

    public Tuple(List<NodeRef> elements) {
      super(NodeKind.TUPLE, elements.hashCode());
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<NodeRef> elements() {
      return elements;
    }

    public int size() {
      return elements.size();
    }

    @Override
    public List<NodeRef> children() {
      return elements;
    }

    @Override
    protected boolean contentEquals(Node other) {
      List<NodeRef> o = ((Tuple)other).elements;
      if (o.size() != elements.size()) {
        return false;
      }
      for (int i = 0; i < elements.size(); i++) {
        if (elements.get(i) != o.get(i)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return elements.toString();
    }
  }
}

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
package exm.sym.ic;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import exm.sym.common.Logging;
import exm.sym.common.Settings;
import exm.sym.common.exceptions.DivisionByZeroException;
import exm.sym.common.exceptions.ExponentOverflowException;
import exm.sym.common.exceptions.IntegerFormatException;
import exm.sym.common.exceptions.NestingDepthException;
import exm.sym.common.exceptions.NotImplementedException;
import exm.sym.common.exceptions.ShapeMismatchException;
import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.common.exceptions.UserException;
import exm.sym.common.lang.FunctionTag;
import exm.sym.common.lang.Rational;
import exm.sym.ic.poly.Monomial;
import exm.sym.ic.poly.Polynomial;
import exm.sym.ic.poly.Power;
import exm.sym.ic.tree.InternStore;
import exm.sym.ic.tree.Node;
import exm.sym.ic.tree.NodeRef;

/**
 * Public construction API for expressions.  Every operation simplifies
 * its result into canonical form and interns it, so two constructions of
 * the same mathematical value return the identical handle.
 *
 * Arithmetic broadcasts over tuples: if either operand is a tuple the
 * operation is applied element-wise, with a scalar operand repeated for
 * every element.
 *
 * The builder also owns the table of named function definitions used
 * by {@link #apply(NodeRef, NodeRef)}.
 */
public class ExprBuilder {

  private static final Logger logger = Logging.getSymLogger();

  /** Name of the bound variable in the built-in definitions */
  private static final String BUILTIN_PARAM = "x";

  private final InternStore store;
  private final Map<String, Definition> definitions =
                                      new HashMap<String, Definition>();
  private final long maxDepth;

  public ExprBuilder() {
    this(new InternStore());
  }

  public ExprBuilder(InternStore store) {
    this.store = store;
    this.maxDepth = Settings.getLongUnchecked(Settings.MAX_DEPTH);
    initBuiltins();
  }

  /**
   * Seed the definition table with one-argument wrappers for the
   * elementary functions, e.g. sin(x) = SIN(x)
   */
  private void initBuiltins() {
    NodeRef x = var(BUILTIN_PARAM);
    List<String> params = Collections.singletonList(BUILTIN_PARAM);
    for (FunctionTag tag: FunctionTag.values()) {
      define(tag.displayName(), params, intern(new Node.FuncApp(tag, x)));
    }
    define("ln", params, intern(new Node.FuncApp(FunctionTag.LOG, x)));
  }

  public InternStore store() {
    return store;
  }

  public NodeRef intern(Node node) {
    return store.intern(node);
  }

  /* Definitions */

  /**
   * Register or replace a named function
   */
  public Definition define(String name, List<String> params, NodeRef body) {
    Definition def = new Definition(name, params, body);
    Definition prev = definitions.put(name, def);
    if (logger.isDebugEnabled()) {
      logger.debug((prev == null ? "Defined " : "Redefined ") + def);
    }
    return def;
  }

  /**
   * @return the definition, or null if none with that name
   */
  public Definition lookupDefinition(String name) {
    return definitions.get(name);
  }

  public Set<String> definitionNames() {
    return Collections.unmodifiableSet(
            new TreeSet<String>(definitions.keySet()));
  }

  /* Leaves */

  public NodeRef var(String name) {
    return intern(new Node.Var(name));
  }

  public NodeRef integer(long i) {
    return poly(Polynomial.integer(i));
  }

  public NodeRef rational(Rational r) {
    return poly(Polynomial.rational(r));
  }

  public NodeRef poly(Polynomial p) {
    return intern(new Node.Poly(p));
  }

  /**
   * Decimal integer literal
   */
  public NodeRef decimal(String digits) throws IntegerFormatException {
    return integer(parseLong(digits));
  }

  /**
   * Decimal literal with a fractional part, e.g. 12.05 is built exactly
   * as 12 + 5/100
   */
  public NodeRef decimalFloat(String s) throws UserException {
    int dp = s.indexOf('.');
    if (dp < 0) {
      throw new IntegerFormatException(s);
    }
    String intPart = s.substring(0, dp);
    String fracPart = s.substring(dp + 1);
    long i = parseLong(intPart);
    long j = parseLong(fracPart);
    NodeRef scale = rational(Rational.valueOf(
                            BigInteger.TEN.pow(fracPart.length())));
    return add(integer(i), div(integer(j), scale));
  }

  private static long parseLong(String digits) throws IntegerFormatException {
    try {
      return Long.parseLong(digits);
    } catch (NumberFormatException e) {
      throw new IntegerFormatException(digits);
    }
  }

  /* Arithmetic */

  private static interface BinaryOp {
    public NodeRef apply(NodeRef a, NodeRef b) throws UserException;
  }

  private static interface UnaryOp {
    public NodeRef apply(NodeRef a) throws UserException;
  }

  /**
   * Apply op element-wise if either operand is a tuple
   */
  private NodeRef broadcast(NodeRef a, NodeRef b, BinaryOp op)
      throws UserException {
    List<NodeRef> result;
    if (a.isTuple() && b.isTuple()) {
      List<NodeRef> ta = a.asTuple().elements();
      List<NodeRef> tb = b.asTuple().elements();
      if (ta.size() != tb.size()) {
        throw new ShapeMismatchException(ta.size(), tb.size());
      }
      result = new ArrayList<NodeRef>(ta.size());
      for (int i = 0; i < ta.size(); i++) {
        result.add(broadcast(ta.get(i), tb.get(i), op));
      }
    } else if (a.isTuple()) {
      List<NodeRef> ta = a.asTuple().elements();
      result = new ArrayList<NodeRef>(ta.size());
      for (NodeRef elem: ta) {
        result.add(broadcast(elem, b, op));
      }
    } else if (b.isTuple()) {
      List<NodeRef> tb = b.asTuple().elements();
      result = new ArrayList<NodeRef>(tb.size());
      for (NodeRef elem: tb) {
        result.add(broadcast(a, elem, op));
      }
    } else {
      return op.apply(a, b);
    }
    return tuple(result);
  }

  private NodeRef broadcast(NodeRef a, UnaryOp op) throws UserException {
    if (a.isTuple()) {
      List<NodeRef> ta = a.asTuple().elements();
      List<NodeRef> result = new ArrayList<NodeRef>(ta.size());
      for (NodeRef elem: ta) {
        result.add(broadcast(elem, op));
      }
      return tuple(result);
    }
    return op.apply(a);
  }

  private final BinaryOp addOp = new BinaryOp() {
    @Override
    public NodeRef apply(NodeRef a, NodeRef b) {
      return poly(Polynomial.fromNode(a).add(Polynomial.fromNode(b)));
    }
  };

  private final BinaryOp subOp = new BinaryOp() {
    @Override
    public NodeRef apply(NodeRef a, NodeRef b) {
      return poly(Polynomial.fromNode(a).subtract(Polynomial.fromNode(b)));
    }
  };

  private final BinaryOp mulOp = new BinaryOp() {
    @Override
    public NodeRef apply(NodeRef a, NodeRef b)
        throws ExponentOverflowException {
      return poly(Polynomial.fromNode(a).multiply(Polynomial.fromNode(b)));
    }
  };

  private final BinaryOp divOp = new BinaryOp() {
    @Override
    public NodeRef apply(NodeRef a, NodeRef b) throws UserException {
      Polynomial divisor = Polynomial.fromNode(b);
      if (divisor.isZero()) {
        throw new DivisionByZeroException("division of " + a + " by zero");
      }
      return poly(Polynomial.fromNode(a).multiply(
                              divisor.integerPower(store, -1)));
    }
  };

  private final BinaryOp powOp = new BinaryOp() {
    @Override
    public NodeRef apply(NodeRef a, NodeRef b) throws UserException {
      if (b.isPoly()) {
        Integer i = b.asPoly().poly().asInt();
        if (i != null) {
          return powInt(a, i);
        }
      }
      // a^b = exp(b log a) for anything but a literal integer exponent
      NodeRef logA = func(FunctionTag.LOG, a);
      return func(FunctionTag.EXP, mul(b, logA));
    }
  };

  /** a + b */
  public NodeRef add(NodeRef a, NodeRef b) throws UserException {
    return broadcast(a, b, addOp);
  }

  /** a - b */
  public NodeRef sub(NodeRef a, NodeRef b) throws UserException {
    return broadcast(a, b, subOp);
  }

  /** a * b */
  public NodeRef mul(NodeRef a, NodeRef b) throws UserException {
    return broadcast(a, b, mulOp);
  }

  /**
   * a / b.  Only a literal zero divisor is rejected: a symbolic divisor
   * is assumed nonzero, so a / a is 1.
   */
  public NodeRef div(NodeRef a, NodeRef b) throws UserException {
    return broadcast(a, b, divOp);
  }

  /** - a */
  public NodeRef neg(NodeRef a) throws UserException {
    return mul(integer(-1), a);
  }

  /** a ^ b */
  public NodeRef pow(NodeRef a, NodeRef b) throws UserException {
    return broadcast(a, b, powOp);
  }

  /** a ^ i */
  public NodeRef powInt(NodeRef a, final int i) throws UserException {
    return broadcast(a, new UnaryOp() {
      @Override
      public NodeRef apply(NodeRef x) throws UserException {
        return poly(Polynomial.fromNode(x).integerPower(store, i));
      }
    });
  }

  /** f(g) */
  public NodeRef func(final FunctionTag tag, NodeRef arg)
      throws UserException {
    return broadcast(arg, new UnaryOp() {
      @Override
      public NodeRef apply(NodeRef x) {
        return intern(new Node.FuncApp(tag, x));
      }
    });
  }

  /**
   * Juxtaposition, e.g. "f x" or "2 x".  If left names a definition, it is
   * applied to right, otherwise this is multiplication.
   *
   * A one-parameter definition applied to a tuple is mapped over the
   * elements.  A definition with n parameters takes an n-tuple.
   */
  public NodeRef apply(NodeRef left, NodeRef right) throws UserException {
    if (left.isVar()) {
      Definition def = definitions.get(left.asVar().name());
      if (def != null) {
        return applyDefinition(def, right);
      }
    }
    return mul(left, right);
  }

  private NodeRef applyDefinition(Definition def, NodeRef arg)
      throws UserException {
    if (logger.isTraceEnabled()) {
      logger.trace("Apply " + def.name() + " to " + arg);
    }
    if (arg.isTuple()) {
      List<NodeRef> parts = arg.asTuple().elements();
      if (def.arity() == 1) {
        List<NodeRef> result = new ArrayList<NodeRef>(parts.size());
        for (NodeRef part: parts) {
          result.add(substitute(def.body(),
                        bind(def, Collections.singletonList(part))));
        }
        return tuple(result);
      } else if (def.arity() == parts.size()) {
        return substitute(def.body(), bind(def, parts));
      } else {
        throw new ShapeMismatchException(def.arity(), parts.size());
      }
    } else if (def.arity() == 1) {
      return substitute(def.body(),
                        bind(def, Collections.singletonList(arg)));
    } else {
      throw new ShapeMismatchException(def.arity(), 1);
    }
  }

  private static Map<String, NodeRef> bind(Definition def,
                                           List<NodeRef> args) {
    assert(def.arity() == args.size());
    Map<String, NodeRef> bindings = new HashMap<String, NodeRef>();
    for (int i = 0; i < args.size(); i++) {
      bindings.put(def.params().get(i), args.get(i));
    }
    return bindings;
  }

  /**
   * Replace free variables named in bindings.  Polynomials are rebuilt
   * term by term through the arithmetic operations, so the result is
   * normalized again and may cancel or combine terms.
   *
   * Substitution is not capture-avoiding: every occurrence of a bound
   * name is replaced.
   */
  public NodeRef substitute(NodeRef node, Map<String, NodeRef> bindings)
      throws UserException {
    return substitute(node, bindings, new HashMap<NodeRef, NodeRef>(), 0);
  }

  private NodeRef substitute(NodeRef node, Map<String, NodeRef> bindings,
      Map<NodeRef, NodeRef> done, int depth) throws UserException {
    checkDepth(depth);
    NodeRef result = done.get(node);
    if (result != null) {
      return result;
    }
    switch (node.kind()) {
      case VAR: {
        NodeRef replacement = bindings.get(node.asVar().name());
        result = replacement != null ? replacement : node;
        break;
      }
      case TUPLE: {
        List<NodeRef> parts = new ArrayList<NodeRef>();
        for (NodeRef part: node.asTuple().elements()) {
          parts.add(substitute(part, bindings, done, depth + 1));
        }
        result = tuple(parts);
        break;
      }
      case POLY: {
        List<NodeRef> summands = new ArrayList<NodeRef>();
        for (Map.Entry<Monomial, Rational> term:
                        node.asPoly().poly().sortedTerms()) {
          List<NodeRef> factors = new ArrayList<NodeRef>();
          factors.add(rational(term.getValue()));
          for (Power p: term.getKey().powers()) {
            NodeRef base = substitute(p.base(), bindings, done, depth + 1);
            factors.add(powInt(base, exponentAsInt(p.exponent())));
          }
          summands.add(product(factors));
        }
        result = sum(summands);
        break;
      }
      case FUNC_APP: {
        Node.FuncApp app = node.asFuncApp();
        result = func(app.tag(),
                      substitute(app.arg(), bindings, done, depth + 1));
        break;
      }
      default:
        throw new SymRuntimeError("Unknown node kind " + node.kind());
    }
    done.put(node, result);
    return result;
  }

  private static int exponentAsInt(long exponent)
      throws ExponentOverflowException {
    if (exponent < Integer.MIN_VALUE || exponent > Integer.MAX_VALUE) {
      throw new ExponentOverflowException("exponent " + exponent +
                                        " outside 32-bit range");
    }
    return (int)exponent;
  }

  private void checkDepth(int depth) throws NestingDepthException {
    if (depth > maxDepth) {
      throw new NestingDepthException(maxDepth);
    }
  }

  /* Aggregates */

  /** f_0 * f_1 * ... * f_n, 1 if empty */
  public NodeRef product(List<NodeRef> factors) throws UserException {
    NodeRef result = integer(1);
    for (NodeRef f: factors) {
      result = mul(result, f);
    }
    return result;
  }

  /** f_0 + f_1 + ... + f_n, 0 if empty */
  public NodeRef sum(List<NodeRef> summands) throws UserException {
    NodeRef result = integer(0);
    for (NodeRef s: summands) {
      result = add(result, s);
    }
    return result;
  }

  public NodeRef tuple(List<NodeRef> parts) {
    return intern(new Node.Tuple(parts));
  }

  /**
   * Array literals are accepted by the language but not supported
   */
  public NodeRef array(List<NodeRef> parts) throws NotImplementedException {
    throw new NotImplementedException("arrays");
  }
}

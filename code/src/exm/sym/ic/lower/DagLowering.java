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
package exm.sym.ic.lower;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;

import exm.sym.common.Logging;
import exm.sym.common.NumericBackend;
import exm.sym.common.Settings;
import exm.sym.common.exceptions.BackendException;
import exm.sym.common.exceptions.BackendUnsupportedException;
import exm.sym.common.exceptions.NestingDepthException;
import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.common.exceptions.UserException;
import exm.sym.common.lang.Rational;
import exm.sym.ic.poly.Monomial;
import exm.sym.ic.poly.Polynomial;
import exm.sym.ic.poly.Power;
import exm.sym.ic.tree.Node;
import exm.sym.ic.tree.NodeRef;

/**
 * Lowers a finished expression into a program for a numeric backend.
 *
 * The expression is a DAG: interning makes every shared subexpression a
 * single node.  Each node is lowered once, bottom-up.  A node referred to
 * from more than one parent position is stored in a temporary right after
 * it is computed and loaded at every use.  A node with a single use is
 * inlined at that use.  This is common subexpression elimination that
 * relies only on handle identity.  The one other temporary is a compound
 * base repeated in an expanded power.
 *
 * Instances are single use: create one per expression.
 */
public class DagLowering<V, S> {

  private static final Logger logger = Logging.getSymLogger();

  private final NumericBackend<V, S> backend;
  private final long maxDepth;
  private final long powerExpandLimit;

  private final Multiset<NodeRef> refCounts = HashMultiset.create();
  private final Map<NodeRef, S> stored = new HashMap<NodeRef, S>();
  private final List<S> stores = new ArrayList<S>();
  private final List<String> inputs = new ArrayList<String>();
  private int loads = 0;
  private boolean used = false;

  public DagLowering(NumericBackend<V, S> backend) {
    this.backend = backend;
    this.maxDepth = Settings.getLongUnchecked(Settings.MAX_DEPTH);
    this.powerExpandLimit = Settings.getLongUnchecked(
                                    Settings.LOWER_POWER_EXPAND_LIMIT);
  }

  /**
   * Lower root with a fresh pass
   */
  public static <V, S> LoweredProgram<V, S> lower(
      NumericBackend<V, S> backend, NodeRef root) throws UserException {
    return new DagLowering<V, S>(backend).run(root);
  }

  public LoweredProgram<V, S> run(NodeRef root) throws UserException {
    if (used) {
      throw new SymRuntimeError("DagLowering instance already used");
    }
    used = true;

    countReferences(root, new HashSet<NodeRef>(), 0);

    List<V> results = new ArrayList<V>();
    boolean tuple = root.isTuple();
    if (tuple) {
      for (NodeRef elem: root.asTuple().elements()) {
        results.add(lowerNode(elem, 1));
      }
    } else {
      results.add(lowerNode(root, 0));
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Lowered for " + backend.name() + ": " +
                   refCounts.elementSet().size() + " shared or inner nodes, "
                   + stores.size() + " temporaries, inputs " + inputs);
    }
    return new LoweredProgram<V, S>(stores, results, tuple, inputs,
                          ImmutableMultiset.copyOf(refCounts), loads);
  }

  /**
   * Count, for every node below root, the number of parent positions that
   * refer to it.  Each distinct parent is only visited once.
   */
  private void countReferences(NodeRef node, Set<NodeRef> visited,
                               int depth) throws NestingDepthException {
    checkDepth(depth);
    if (!visited.add(node)) {
      return;
    }
    for (NodeRef child: node.node().children()) {
      refCounts.add(child);
      countReferences(child, visited, depth + 1);
    }
  }

  private V lowerNode(NodeRef node, int depth) throws UserException {
    checkDepth(depth);
    S storage = stored.get(node);
    if (storage != null) {
      return load(storage);
    }

    V value = lowerUncached(node, depth);

    int uses = refCounts.count(node);
    if (uses > 1) {
      S s = backend.store(value, uses);
      stored.put(node, s);
      stores.add(s);
      if (logger.isTraceEnabled()) {
        logger.trace("Stored " + node + " for " + uses + " uses");
      }
      return load(s);
    }
    return value;
  }

  private V load(S storage) throws BackendException {
    loads++;
    return backend.load(storage);
  }

  private V lowerUncached(NodeRef node, int depth) throws UserException {
    switch (node.kind()) {
      case VAR: {
        String name = node.asVar().name();
        inputs.add(name);
        return backend.input(name);
      }
      case FUNC_APP: {
        Node.FuncApp app = node.asFuncApp();
        V arg = lowerNode(app.arg(), depth + 1);
        switch (app.tag()) {
          case FLOOR:
            return backend.roundDown(arg);
          case CEIL:
            return backend.roundUp(arg);
          case STEP:
            return backend.stepAt(backend.literalInt(0), arg);
          default:
            return backend.function(app.tag(), arg);
        }
      }
      case POLY:
        return lowerPoly(node.asPoly().poly(), depth);
      case TUPLE:
        throw new BackendUnsupportedException(backend.name(),
                                              "nested tuple " + node);
      default:
        throw new SymRuntimeError("Unknown node kind " + node.kind());
    }
  }

  private V lowerPoly(Polynomial p, int depth) throws UserException {
    if (p.isZero()) {
      return backend.literalInt(0);
    }
    List<V> summands = new ArrayList<V>(p.size());
    for (Map.Entry<Monomial, Rational> term: p.sortedTerms()) {
      summands.add(lowerTerm(term.getKey(), term.getValue(), depth));
    }
    if (summands.size() == 1) {
      return summands.get(0);
    }
    return backend.sum(summands);
  }

  /**
   * coefficient * product of powers.  Factors with negative exponents and
   * the coefficient's denominator go below a single division.
   */
  private V lowerTerm(Monomial m, Rational coefficient, int depth)
      throws UserException {
    if (m.isConstant()) {
      return lowerRational(coefficient);
    }
    List<V> numer = new ArrayList<V>();
    List<V> denom = new ArrayList<V>();
    if (!coefficient.numerator().equals(BigInteger.ONE)) {
      numer.add(literal(coefficient.numerator()));
    }
    if (!coefficient.denominator().equals(BigInteger.ONE)) {
      denom.add(literal(coefficient.denominator()));
    }
    for (Power p: m.powers()) {
      V base = lowerNode(p.base(), depth + 1);
      if (p.exponent() > 0) {
        appendPower(numer, p.base(), base, p.exponent());
      } else {
        appendPower(denom, p.base(), base, -p.exponent());
      }
    }

    V top = multiplyAll(numer);
    V bottom = multiplyAll(denom);
    if (bottom == null) {
      return top;
    } else if (top == null) {
      return backend.invert(bottom);
    } else {
      return backend.divide(top, bottom);
    }
  }

  private V multiplyAll(List<V> factors) throws BackendException {
    if (factors.isEmpty()) {
      return null;
    } else if (factors.size() == 1) {
      return factors.get(0);
    }
    return backend.product(factors);
  }

  /**
   * Add base^e, e >= 1, to a list of factors.  Small powers repeat the
   * base; a compound base that is not already in a temporary is stored
   * once so it is only computed once.  Larger powers go to the backend's
   * power operation.
   */
  private void appendPower(List<V> factors, NodeRef node, V base, long e)
      throws BackendException {
    assert(e >= 1);
    if (e == 1) {
      factors.add(base);
    } else if (e > powerExpandLimit) {
      factors.add(backend.power(base, e));
    } else if (node.isVar() || stored.containsKey(node)) {
      for (long i = 0; i < e; i++) {
        factors.add(base);
      }
    } else {
      S temp = backend.store(base, (int)Math.min(e, Integer.MAX_VALUE));
      stores.add(temp);
      if (logger.isTraceEnabled()) {
        logger.trace("Stored " + node + " for power " + e);
      }
      for (long i = 0; i < e; i++) {
        factors.add(load(temp));
      }
    }
  }

  private V lowerRational(Rational r) throws BackendException {
    if (r.isInteger()) {
      return literal(r.numerator());
    }
    return backend.divide(literal(r.numerator()), literal(r.denominator()));
  }

  private V literal(BigInteger i) throws BackendException {
    if (i.bitLength() < 64) {
      return backend.literalInt(i.longValue());
    }
    return backend.literalFloat(i.doubleValue());
  }

  private void checkDepth(int depth) throws NestingDepthException {
    if (depth > maxDepth) {
      throw new NestingDepthException(maxDepth);
    }
  }
}

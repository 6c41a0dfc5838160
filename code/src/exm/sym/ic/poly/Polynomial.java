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
package exm.sym.ic.poly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.sym.common.exceptions.DivisionByZeroException;
import exm.sym.common.exceptions.ExponentOverflowException;
import exm.sym.common.lang.Rational;
import exm.sym.ic.CanonicalPrinter;
import exm.sym.ic.tree.InternStore;
import exm.sym.ic.tree.Node;
import exm.sym.ic.tree.NodeRef;

/**
 * Canonical multivariate polynomial with rational coefficients over
 * interned base expressions.  This is the normal form for all arithmetic.
 *
 * Invariants: no stored coefficient is zero, and each monomial is in
 * canonical form (see {@link Monomial}).  Instances are immutable; all
 * operations return new polynomials.
 */
public final class Polynomial implements Comparable<Polynomial> {

  /**
   * Positive integer powers of general polynomials below this are expanded
   * by multiplication; others are kept as an opaque power of the whole
   * polynomial.
   */
  public static final int EXPAND_THRESHOLD = 4;

  private static final Polynomial ZERO = new Polynomial(
                            Collections.<Monomial, Rational>emptyMap());
  private static final Polynomial ONE = monomial(Monomial.CONSTANT,
                                                 Rational.ONE);

  private final Map<Monomial, Rational> terms;
  private final int hashCode;

  private Polynomial(Map<Monomial, Rational> terms) {
    this.terms = Collections.unmodifiableMap(terms);
    this.hashCode = terms.hashCode();
  }

  public static Polynomial zero() {
    return ZERO;
  }

  public static Polynomial one() {
    return ONE;
  }

  public static Polynomial integer(long i) {
    return rational(Rational.valueOf(i));
  }

  public static Polynomial rational(Rational r) {
    if (r.isZero()) {
      return ZERO;
    }
    return monomial(Monomial.CONSTANT, r);
  }

  public static Polynomial monomial(Monomial m, Rational coefficient) {
    if (coefficient.isZero()) {
      return ZERO;
    }
    Map<Monomial, Rational> terms = new HashMap<Monomial, Rational>(2);
    terms.put(m, coefficient);
    return new Polynomial(terms);
  }

  /**
   * Polynomial view of any node: polynomial nodes are unwrapped, anything
   * else becomes a degree one monomial with unit coefficient.
   */
  public static Polynomial fromNode(NodeRef node) {
    if (node.isPoly()) {
      return node.asPoly().poly();
    }
    return monomial(Monomial.of(node, 1), Rational.ONE);
  }

  private static void addTo(Map<Monomial, Rational> terms, Monomial m,
                            Rational coefficient) {
    Rational prev = terms.get(m);
    if (prev == null) {
      terms.put(m, coefficient);
    } else {
      Rational sum = prev.add(coefficient);
      if (sum.isZero()) {
        terms.remove(m);
      } else {
        terms.put(m, sum);
      }
    }
  }

  public Polynomial add(Polynomial o) {
    if (this.isZero()) {
      return o;
    } else if (o.isZero()) {
      return this;
    }
    Map<Monomial, Rational> result = new HashMap<Monomial, Rational>(terms);
    for (Map.Entry<Monomial, Rational> e: o.terms.entrySet()) {
      addTo(result, e.getKey(), e.getValue());
    }
    return new Polynomial(result);
  }

  public Polynomial negate() {
    return scale(Rational.MINUS_ONE);
  }

  public Polynomial subtract(Polynomial o) {
    return add(o.negate());
  }

  /**
   * Multiply every pair of terms, O(|this| * |o|)
   */
  public Polynomial multiply(Polynomial o) throws ExponentOverflowException {
    if (this.isZero() || o.isZero()) {
      return ZERO;
    }
    Map<Monomial, Rational> result = new HashMap<Monomial, Rational>(
                              Math.max(terms.size(), o.terms.size()));
    for (Map.Entry<Monomial, Rational> a: terms.entrySet()) {
      for (Map.Entry<Monomial, Rational> b: o.terms.entrySet()) {
        addTo(result, a.getKey().multiply(b.getKey()),
                      a.getValue().multiply(b.getValue()));
      }
    }
    return new Polynomial(result);
  }

  /**
   * Multiply every coefficient by k
   */
  public Polynomial scale(Rational k) {
    if (k.isZero()) {
      return ZERO;
    } else if (k.isOne()) {
      return this;
    }
    Map<Monomial, Rational> result = new HashMap<Monomial, Rational>(
                                                          terms.size());
    for (Map.Entry<Monomial, Rational> e: terms.entrySet()) {
      result.put(e.getKey(), e.getValue().multiply(k));
    }
    return new Polynomial(result);
  }

  /**
   * Raise to an integer power.
   * @param store used to intern this polynomial if it has to be kept as
   *              an opaque base
   * @throws DivisionByZeroException if this is zero and i is negative
   * @throws ExponentOverflowException if an exponent or coefficient of
   *      the result is too large
   */
  public Polynomial integerPower(InternStore store, int i)
      throws DivisionByZeroException, ExponentOverflowException {
    if (i == 0) {
      return ONE;
    }
    Rational r = asRational();
    if (r != null) {
      if (r.isZero() && i < 0) {
        throw new DivisionByZeroException("0 raised to negative power " + i);
      }
      return rational(coefficientPower(r, i));
    }

    if (terms.size() == 1) {
      Map.Entry<Monomial, Rational> term = terms.entrySet().iterator().next();
      return monomial(term.getKey().pow(i),
                      coefficientPower(term.getValue(), i));
    }

    if (i > 0 && i < EXPAND_THRESHOLD) {
      return powerBySquaring(i);
    }

    NodeRef base = store.intern(new Node.Poly(this));
    return monomial(Monomial.of(base, i), Rational.ONE);
  }

  /**
   * r^i for nonzero r
   */
  private static Rational coefficientPower(Rational r, int i)
      throws ExponentOverflowException {
    try {
      return r.pow(i);
    } catch (ArithmeticException e) {
      throw new ExponentOverflowException(e.getMessage(), e);
    }
  }

  /**
   * Exact expansion of this^n for n >= 1
   */
  Polynomial powerBySquaring(int n) throws ExponentOverflowException {
    assert(n >= 1);
    Polynomial result = ONE;
    Polynomial square = this;
    while (n > 1) {
      if ((n & 1) == 1) {
        result = result.multiply(square);
      }
      n >>= 1;
      square = square.multiply(square);
    }
    return result.multiply(square);
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  /**
   * @return the constant value, or null if not a constant
   */
  public Rational asRational() {
    switch (terms.size()) {
      case 0:
        return Rational.ZERO;
      case 1:
        return terms.get(Monomial.CONSTANT);
      default:
        return null;
    }
  }

  /**
   * @return the value as a 32-bit integer, or null if not an integer
   *         constant in that range
   */
  public Integer asInt() {
    Rational r = asRational();
    return r == null ? null : r.asInt();
  }

  /** Number of terms */
  public int size() {
    return terms.size();
  }

  public Set<Monomial> monomials() {
    return terms.keySet();
  }

  /**
   * Terms in the map's own order
   */
  public Set<Map.Entry<Monomial, Rational>> terms() {
    return terms.entrySet();
  }

  /**
   * Terms sorted by monomial: constant term first
   */
  public List<Map.Entry<Monomial, Rational>> sortedTerms() {
    List<Map.Entry<Monomial, Rational>> sorted =
            new ArrayList<Map.Entry<Monomial, Rational>>(terms.entrySet());
    Collections.sort(sorted, TERM_ORDER);
    return sorted;
  }

  /**
   * @return coefficient of monomial, zero if absent
   */
  public Rational coefficient(Monomial m) {
    Rational r = terms.get(m);
    return r == null ? Rational.ZERO : r;
  }

  /**
   * Split into one single-term polynomial per term
   */
  public List<Polynomial> split() {
    List<Polynomial> result = new ArrayList<Polynomial>(terms.size());
    for (Map.Entry<Monomial, Rational> e: sortedTerms()) {
      result.add(monomial(e.getKey(), e.getValue()));
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Polynomial)) {
      return false;
    }
    Polynomial other = (Polynomial)obj;
    return hashCode == other.hashCode && terms.equals(other.terms);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  /**
   * Order by number of terms, then by sorted monomials.  Polynomials with
   * the same monomials are ordered by coefficients so that the order is
   * consistent with equals.
   */
  @Override
  public int compareTo(Polynomial o) {
    int c = Integer.compare(terms.size(), o.terms.size());
    if (c != 0) {
      return c;
    }
    List<Map.Entry<Monomial, Rational>> a = this.sortedTerms();
    List<Map.Entry<Monomial, Rational>> b = o.sortedTerms();
    for (int i = 0; i < a.size(); i++) {
      c = a.get(i).getKey().compareTo(b.get(i).getKey());
      if (c != 0) {
        return c;
      }
    }
    for (int i = 0; i < a.size(); i++) {
      c = a.get(i).getValue().compareTo(b.get(i).getValue());
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  @Override
  public String toString() {
    return CanonicalPrinter.printSum(this);
  }

  private static final Comparator<Map.Entry<Monomial, Rational>>
      TERM_ORDER = new Comparator<Map.Entry<Monomial, Rational>>() {
    @Override
    public int compare(Map.Entry<Monomial, Rational> a,
                       Map.Entry<Monomial, Rational> b) {
      return a.getKey().compareTo(b.getKey());
    }
  };
}

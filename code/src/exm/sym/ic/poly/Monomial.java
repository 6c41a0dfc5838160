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
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sym.common.exceptions.ExponentOverflowException;
import exm.sym.ic.tree.NodeRef;

/**
 * A product of powers of base expressions.  The power list is sorted by
 * base and holds each base at most once, so two monomials are equal iff
 * they denote the same product.  The empty monomial is the constant 1.
 */
public final class Monomial implements Comparable<Monomial> {

  public static final Monomial CONSTANT =
                          new Monomial(ImmutableList.<Power>of());

  private final ImmutableList<Power> powers;
  private final int hashCode;

  private Monomial(ImmutableList<Power> powers) {
    this.powers = powers;
    this.hashCode = powers.hashCode();
  }

  public static Monomial of(NodeRef base, long exponent) {
    if (exponent == 0) {
      return CONSTANT;
    }
    return new Monomial(ImmutableList.of(new Power(base, exponent)));
  }

  /**
   * Build a monomial from powers in any order, merging repeated bases
   * and dropping those whose exponents cancel out.
   */
  public static Monomial of(List<Power> powers)
      throws ExponentOverflowException {
    List<Power> sorted = new ArrayList<Power>(powers);
    Collections.sort(sorted);
    List<Power> merged = new ArrayList<Power>(sorted.size());
    NodeRef base = null;
    long exponent = 0;
    for (Power p: sorted) {
      if (p.base() == base) {
        exponent = addExponents(exponent, p.exponent());
      } else {
        if (base != null && exponent != 0) {
          merged.add(new Power(base, exponent));
        }
        base = p.base();
        exponent = p.exponent();
      }
    }
    if (base != null && exponent != 0) {
      merged.add(new Power(base, exponent));
    }
    return new Monomial(ImmutableList.copyOf(merged));
  }

  public ImmutableList<Power> powers() {
    return powers;
  }

  public int size() {
    return powers.size();
  }

  public boolean isConstant() {
    return powers.isEmpty();
  }

  /**
   * Product of two monomials: exponents of shared bases are summed.
   * Both power lists are sorted, so this is a single merge pass.
   */
  public Monomial multiply(Monomial o) throws ExponentOverflowException {
    if (this.isConstant()) {
      return o;
    } else if (o.isConstant()) {
      return this;
    }
    List<Power> result = new ArrayList<Power>(powers.size() + o.size());
    int i = 0, j = 0;
    while (i < powers.size() && j < o.powers.size()) {
      Power a = powers.get(i);
      Power b = o.powers.get(j);
      if (a.base() == b.base()) {
        long exponent = addExponents(a.exponent(), b.exponent());
        if (exponent != 0) {
          result.add(new Power(a.base(), exponent));
        }
        i++;
        j++;
      } else if (a.base().compareTo(b.base()) < 0) {
        result.add(a);
        i++;
      } else {
        result.add(b);
        j++;
      }
    }
    result.addAll(powers.subList(i, powers.size()));
    result.addAll(o.powers.subList(j, o.powers.size()));
    return new Monomial(ImmutableList.copyOf(result));
  }

  /**
   * Raise to integer power by scaling every exponent
   */
  public Monomial pow(long i) throws ExponentOverflowException {
    if (i == 0) {
      return CONSTANT;
    } else if (i == 1) {
      return this;
    }
    ImmutableList.Builder<Power> result = ImmutableList.builder();
    for (Power p: powers) {
      result.add(new Power(p.base(), multiplyExponents(p.exponent(), i)));
    }
    return new Monomial(result.build());
  }

  /**
   * Order by length, then by bases, then by exponents
   */
  @Override
  public int compareTo(Monomial o) {
    int c = Integer.compare(powers.size(), o.powers.size());
    if (c != 0) {
      return c;
    }
    for (int i = 0; i < powers.size(); i++) {
      c = powers.get(i).base().compareTo(o.powers.get(i).base());
      if (c != 0) {
        return c;
      }
    }
    for (int i = 0; i < powers.size(); i++) {
      c = Long.compare(powers.get(i).exponent(), o.powers.get(i).exponent());
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Monomial)) {
      return false;
    }
    Monomial other = (Monomial)obj;
    return hashCode == other.hashCode && powers.equals(other.powers);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return powers.toString();
  }

  /*
   * Exponents stay within +/- Long.MAX_VALUE so that they can always be
   * negated
   */

  private static long addExponents(long a, long b)
      throws ExponentOverflowException {
    try {
      return checkExponent(Math.addExact(a, b));
    } catch (ArithmeticException e) {
      throw new ExponentOverflowException("exponent " + a + " + " + b +
                                          " is out of range", e);
    }
  }

  private static long multiplyExponents(long a, long b)
      throws ExponentOverflowException {
    try {
      return checkExponent(Math.multiplyExact(a, b));
    } catch (ArithmeticException e) {
      throw new ExponentOverflowException("exponent " + a + " * " + b +
                                          " is out of range", e);
    }
  }

  private static long checkExponent(long exponent) {
    if (exponent == Long.MIN_VALUE) {
      throw new ArithmeticException("long overflow");
    }
    return exponent;
  }
}

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
package exm.sym.common.lang;

import java.math.BigInteger;

import exm.sym.common.exceptions.SymRuntimeError;

/**
 * Exact rational number.  Always stored in lowest terms with a positive
 * denominator, so structural equality is numeric equality.
 */
public final class Rational implements Comparable<Rational> {

  public static final Rational ZERO = new Rational(BigInteger.ZERO,
                                                   BigInteger.ONE);
  public static final Rational ONE = new Rational(BigInteger.ONE,
                                                  BigInteger.ONE);
  public static final Rational MINUS_ONE = new Rational(
                              BigInteger.ONE.negate(), BigInteger.ONE);

  private static final BigInteger INT_MIN =
                                BigInteger.valueOf(Integer.MIN_VALUE);
  private static final BigInteger INT_MAX =
                                BigInteger.valueOf(Integer.MAX_VALUE);

  /** Largest numerator or denominator, in bits, that pow() will build */
  public static final long MAX_POW_BITS = 1L << 20;

  private final BigInteger num;
  private final BigInteger den;

  /** Caller guarantees lowest terms and den > 0 */
  private Rational(BigInteger num, BigInteger den) {
    this.num = num;
    this.den = den;
  }

  public static Rational valueOf(long i) {
    if (i == 0) {
      return ZERO;
    } else if (i == 1) {
      return ONE;
    }
    return new Rational(BigInteger.valueOf(i), BigInteger.ONE);
  }

  public static Rational valueOf(BigInteger i) {
    return new Rational(i, BigInteger.ONE);
  }

  public static Rational of(long num, long den) {
    return of(BigInteger.valueOf(num), BigInteger.valueOf(den));
  }

  public static Rational of(BigInteger num, BigInteger den) {
    if (den.signum() == 0) {
      throw new ArithmeticException("zero denominator in " + num + "/" + den);
    }
    if (num.signum() == 0) {
      return ZERO;
    }
    if (den.signum() < 0) {
      num = num.negate();
      den = den.negate();
    }
    BigInteger gcd = num.gcd(den);
    if (!gcd.equals(BigInteger.ONE)) {
      num = num.divide(gcd);
      den = den.divide(gcd);
    }
    return new Rational(num, den);
  }

  public BigInteger numerator() {
    return num;
  }

  public BigInteger denominator() {
    return den;
  }

  public boolean isZero() {
    return num.signum() == 0;
  }

  public boolean isOne() {
    return num.equals(BigInteger.ONE) && den.equals(BigInteger.ONE);
  }

  public boolean isInteger() {
    return den.equals(BigInteger.ONE);
  }

  public int signum() {
    return num.signum();
  }

  public Rational add(Rational o) {
    if (this.isZero()) {
      return o;
    } else if (o.isZero()) {
      return this;
    }
    if (this.den.equals(o.den)) {
      return of(this.num.add(o.num), den);
    }
    return of(this.num.multiply(o.den).add(o.num.multiply(this.den)),
              this.den.multiply(o.den));
  }

  public Rational subtract(Rational o) {
    return add(o.negate());
  }

  public Rational multiply(Rational o) {
    if (this.isZero() || o.isZero()) {
      return ZERO;
    }
    return of(this.num.multiply(o.num), this.den.multiply(o.den));
  }

  public Rational negate() {
    return new Rational(num.negate(), den);
  }

  public Rational abs() {
    return num.signum() < 0 ? negate() : this;
  }

  /**
   * @throws ArithmeticException if zero
   */
  public Rational reciprocal() {
    if (isZero()) {
      throw new ArithmeticException("reciprocal of zero");
    }
    return of(den, num);
  }

  /**
   * Integer power.
   * @throws ArithmeticException for zero raised to a negative power, or
   *      if the result would be larger than MAX_POW_BITS
   */
  public Rational pow(int i) {
    if (i == 0) {
      return ONE;
    } else if (i < 0) {
      Rational r = reciprocal();
      if (i == Integer.MIN_VALUE) {
        // -i is not an int
        return r.pow(Integer.MAX_VALUE).multiply(r);
      }
      return r.pow(-i);
    }
    if (den.equals(BigInteger.ONE) && num.abs().equals(BigInteger.ONE)) {
      return (i & 1) == 1 ? this : ONE;
    }
    long bits = (long)Math.max(num.bitLength(), den.bitLength()) * i;
    if (bits > MAX_POW_BITS) {
      throw new ArithmeticException("(" + this + ")^" + i +
                                    " is too large to represent");
    }
    return new Rational(num.pow(i), den.pow(i));
  }

  /**
   * @return the value as an int if it is an integer in the 32-bit range,
   *         otherwise null
   */
  public Integer asInt() {
    if (!isInteger()) {
      return null;
    }
    if (num.compareTo(INT_MIN) < 0 || num.compareTo(INT_MAX) > 0) {
      return null;
    }
    return num.intValue();
  }

  /**
   * @return the value as a long, only valid for integers that fit
   */
  public long longValueExact() {
    if (!isInteger()) {
      throw new SymRuntimeError("Not an integer: " + this);
    }
    return num.longValueExact();
  }

  public boolean fitsLong() {
    return isInteger() && num.bitLength() < 64;
  }

  public double doubleValue() {
    return num.doubleValue() / den.doubleValue();
  }

  @Override
  public int compareTo(Rational o) {
    return this.num.multiply(o.den).compareTo(o.num.multiply(this.den));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Rational)) {
      return false;
    }
    Rational other = (Rational) obj;
    return num.equals(other.num) && den.equals(other.den);
  }

  @Override
  public int hashCode() {
    return 31 * num.hashCode() + den.hashCode();
  }

  @Override
  public String toString() {
    if (isInteger()) {
      return num.toString();
    }
    return num + "/" + den;
  }
}

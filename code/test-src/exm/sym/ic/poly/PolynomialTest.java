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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sym.common.exceptions.DivisionByZeroException;
import exm.sym.common.lang.Rational;
import exm.sym.ic.tree.InternStore;
import exm.sym.ic.tree.Node;
import exm.sym.ic.tree.NodeRef;

public class PolynomialTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private InternStore store;
  private NodeRef x;
  private NodeRef y;
  private Polynomial px;
  private Polynomial py;

  @Before
  public void setup() {
    store = new InternStore();
    x = store.intern(new Node.Var("x"));
    y = store.intern(new Node.Var("y"));
    px = Polynomial.fromNode(x);
    py = Polynomial.fromNode(y);
  }

  @Test
  public void testAlgebraLaws() throws Exception {
    Polynomial a = px.add(Polynomial.integer(3));
    Polynomial b = py.scale(Rational.of(1, 2)).subtract(px);
    Polynomial c = px.multiply(py).add(Polynomial.one());

    assertEquals("a + b = b + a", a.add(b), b.add(a));
    assertEquals("a * b = b * a", a.multiply(b), b.multiply(a));
    assertEquals("(a + b) + c = a + (b + c)",
                 a.add(b).add(c), a.add(b.add(c)));
    assertEquals("(a * b) * c = a * (b * c)",
                 a.multiply(b).multiply(c), a.multiply(b.multiply(c)));
    assertEquals("a * (b + c) = a * b + a * c",
                 a.multiply(b.add(c)), a.multiply(b).add(a.multiply(c)));
    assertEquals(a, a.add(Polynomial.zero()));
    assertEquals(a, a.multiply(Polynomial.one()));
  }

  @Test
  public void testCancellationRemovesTerms() throws Exception {
    Polynomial p = px.add(py).subtract(px);
    assertEquals(py, p);
    assertEquals(1, p.size());
    assertTrue(px.subtract(px).isZero());
    assertEquals(0, px.subtract(px).size());
    assertTrue(px.multiply(Polynomial.zero()).isZero());
  }

  @Test
  public void testConstants() throws Exception {
    assertEquals(Rational.valueOf(3),
        Polynomial.integer(1).add(Polynomial.integer(2)).asRational());
    assertNull(px.asRational());
    assertEquals(Integer.valueOf(27),
        Polynomial.integer(3).integerPower(store, 3).asInt());
  }

  @Test
  public void testIntegerPowerSingleTerm() throws Exception {
    Polynomial p = px.scale(Rational.valueOf(2)).integerPower(store, 3);
    assertEquals(1, p.size());
    assertEquals(Rational.valueOf(8), p.coefficient(Monomial.of(x, 3)));

    Polynomial inv = px.integerPower(store, -2);
    assertEquals(Rational.ONE, inv.coefficient(Monomial.of(x, -2)));
    assertEquals("x * x^-1 is 1", Polynomial.one(),
                 px.multiply(px.integerPower(store, -1)));
  }

  @Test
  public void testSmallPowerExpands() throws Exception {
    Polynomial sum = px.add(Polynomial.one());
    Polynomial sq = sum.integerPower(store, 2);
    assertEquals(3, sq.size());
    assertEquals(Rational.valueOf(2), sq.coefficient(Monomial.of(x, 1)));
    assertEquals(sum.multiply(sum).multiply(sum), sum.powerBySquaring(3));
  }

  @Test
  public void testLargePowerIsOpaque() throws Exception {
    Polynomial sum = px.add(py);
    Polynomial p = sum.integerPower(store, Polynomial.EXPAND_THRESHOLD);
    assertEquals(1, p.size());
    Monomial m = p.monomials().iterator().next();
    assertEquals(1, m.size());
    Power pow = m.powers().get(0);
    assertEquals(Polynomial.EXPAND_THRESHOLD, pow.exponent());
    assertTrue(pow.base().isPoly());
    assertEquals(sum, pow.base().asPoly().poly());

    Polynomial inv = sum.integerPower(store, -1);
    assertTrue("Same opaque base is reused",
        inv.monomials().iterator().next().powers().get(0).base()
        == pow.base());
  }

  @Test
  public void testZeroToNegativePower() throws Exception {
    exception.expect(DivisionByZeroException.class);
    Polynomial.zero().integerPower(store, -1);
  }

  @Test
  public void testMonomialMerge() throws Exception {
    Monomial m = Monomial.of(x, 2).multiply(Monomial.of(y, 1))
                         .multiply(Monomial.of(x, -2));
    assertEquals(Monomial.of(y, 1), m);
    assertTrue(Monomial.of(x, 1).multiply(Monomial.of(x, -1)).isConstant());
    assertEquals(Monomial.CONSTANT, Monomial.of(x, 0));
  }

  @Test
  public void testOrderConsistentWithEquals() throws Exception {
    Polynomial a = px.add(Polynomial.integer(2));
    Polynomial b = px.add(Polynomial.integer(3));
    assertTrue(a.compareTo(b) != 0);
    assertEquals(0, a.compareTo(px.add(Polynomial.integer(2))));
  }
}

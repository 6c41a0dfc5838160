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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import exm.sym.common.Settings;
import exm.sym.common.lang.FunctionTag;
import exm.sym.common.lang.Rational;
import exm.sym.ic.poly.Polynomial;
import exm.sym.ic.tree.NodeRef;

public class CanonicalPrinterTest {

  private ExprBuilder b;
  private NodeRef x;
  private NodeRef y;

  @Before
  public void setup() {
    b = new ExprBuilder();
    x = b.var("x");
    y = b.var("y");
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testConstants() {
    assertEquals("0", CanonicalPrinter.print(b.integer(0)));
    assertEquals("3", CanonicalPrinter.print(b.integer(3)));
    assertEquals("- 3", CanonicalPrinter.print(b.integer(-3)));
    assertEquals("3 / 4", CanonicalPrinter.print(b.rational(Rational.of(3, 4))));
  }

  @Test
  public void testSums() throws Exception {
    assertEquals("x", x.toString());
    assertEquals("- x", b.neg(x).toString());
    assertEquals("1 - x", b.sub(b.integer(1), x).toString());
    assertEquals("- 1 + x", b.sub(x, b.integer(1)).toString());
    assertEquals("x / 2", b.div(x, b.integer(2)).toString());
    assertEquals("1 + 2 x + x²",
        b.powInt(b.add(x, b.integer(1)), 2).toString());
  }

  @Test
  public void testPowers() throws Exception {
    assertEquals("x⁻¹", b.div(b.integer(1), x).toString());
    assertEquals("x¹²", b.powInt(x, 12).toString());
    assertEquals("(1 + x)⁻¹",
        b.div(b.integer(1), b.add(x, b.integer(1))).toString());
  }

  @Test
  public void testFunctionsAndTuples() throws Exception {
    assertEquals("sin(x)", b.func(FunctionTag.SIN, x).toString());
    assertEquals("floor(1 + x)",
                 b.func(FunctionTag.FLOOR, b.add(x, b.integer(1))).toString());
    assertEquals("(x, 1 + y)",
                 b.tuple(Arrays.asList(x, b.add(y, b.integer(1)))).toString());
  }

  @Test
  public void testFactorized() throws Exception {
    NodeRef e = b.add(b.mul(b.integer(2), x),
                      b.mul(b.integer(2), b.mul(x, y)));
    assertEquals("2 x (1 + y)", e.toString());
    assertEquals("x (1 + x)", b.add(b.mul(x, x), x).toString());

    Settings.set(Settings.PRINT_FACTORIZE, "false");
    assertEquals("2 x + 2 x y", e.toString());
  }

  @Test
  public void testFactorize() throws Exception {
    Polynomial p = b.add(b.mul(b.integer(6), b.mul(x, x)),
                         b.mul(b.integer(4), x)).asPoly().poly();
    Polynomial[] parts = CanonicalPrinter.factorize(p);
    assertEquals(b.mul(b.integer(2), x).asPoly().poly(), parts[0]);
    assertEquals(b.add(b.mul(b.integer(3), x), b.integer(2)).asPoly().poly(),
                 parts[1]);
    assertEquals(p, parts[0].multiply(parts[1]));

    assertNull("Nothing in common",
        CanonicalPrinter.factorize(b.add(x, y).asPoly().poly()));
    assertNull("Single term",
        CanonicalPrinter.factorize(b.mul(b.integer(2), x).asPoly().poly()));
  }
}

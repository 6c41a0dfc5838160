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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sym.common.Logging;
import exm.sym.common.Settings;
import exm.sym.common.exceptions.DivisionByZeroException;
import exm.sym.common.exceptions.ExponentOverflowException;
import exm.sym.common.exceptions.IntegerFormatException;
import exm.sym.common.exceptions.NestingDepthException;
import exm.sym.common.exceptions.NotImplementedException;
import exm.sym.common.exceptions.ShapeMismatchException;
import exm.sym.common.lang.FunctionTag;
import exm.sym.common.lang.Rational;
import exm.sym.ic.tree.NodeRef;

public class ExprBuilderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private ExprBuilder b;
  private NodeRef x;
  private NodeRef y;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ExprBuilderTest.sym.log", true);
  }

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
  public void testConstantFolding() throws Exception {
    assertSame(b.integer(3), b.add(b.integer(1), b.integer(2)));
    assertSame(b.integer(27), b.pow(b.integer(3), b.integer(3)));
    assertSame(b.rational(Rational.of(1, 4)),
               b.pow(b.integer(2), b.integer(-2)));
    assertSame(b.integer(0), b.sub(x, x));
  }

  @Test
  public void testMinimumIntExponent() throws Exception {
    NodeRef e = b.pow(x, b.integer(Integer.MIN_VALUE));
    assertSame("x^-2147483648 * x^2147483647 = 1 / x", b.powInt(x, -1),
               b.mul(e, b.powInt(x, Integer.MAX_VALUE)));
    assertSame(b.integer(1),
               b.pow(b.integer(-1), b.integer(Integer.MIN_VALUE)));
  }

  @Test
  public void testExponentOverflow() throws Exception {
    NodeRef big = b.powInt(b.powInt(x, Integer.MAX_VALUE), Integer.MAX_VALUE);
    exception.expect(ExponentOverflowException.class);
    b.powInt(big, 4);
  }

  @Test
  public void testExponentOverflowInProduct() throws Exception {
    NodeRef big = b.powInt(b.powInt(x, Integer.MAX_VALUE), Integer.MAX_VALUE);
    NodeRef bigger = b.powInt(big, 2);
    exception.expect(ExponentOverflowException.class);
    b.mul(bigger, bigger);
  }

  @Test
  public void testCoefficientPowerTooLarge() throws Exception {
    exception.expect(ExponentOverflowException.class);
    b.pow(b.integer(2), b.integer(Integer.MIN_VALUE));
  }

  @Test
  public void testSelfDivision() throws Exception {
    assertSame(b.integer(1), b.div(x, x));
    NodeRef xy = b.mul(x, y);
    assertSame(b.mul(b.integer(1), x), b.div(xy, y));
  }

  @Test
  public void testCommutative() throws Exception {
    assertSame(b.add(x, y), b.add(y, x));
    assertSame(b.mul(x, y), b.mul(y, x));
    assertSame(b.mul(b.integer(2), x), b.add(x, x));
  }

  @Test
  public void testDistribution() throws Exception {
    NodeRef lhs = b.mul(b.add(x, b.integer(1)), b.add(x, b.integer(-1)));
    NodeRef rhs = b.sub(b.mul(x, x), b.integer(1));
    assertSame(lhs, rhs);
  }

  @Test
  public void testNonIntegerPower() throws Exception {
    NodeRef expected = b.func(FunctionTag.EXP,
                              b.mul(y, b.func(FunctionTag.LOG, x)));
    assertSame(expected, b.pow(x, y));

    NodeRef half = b.rational(Rational.of(1, 2));
    assertSame(b.func(FunctionTag.EXP, b.mul(half, b.func(FunctionTag.LOG, x))),
               b.pow(x, half));
  }

  @Test
  public void testDecimal() throws Exception {
    assertSame(b.integer(42), b.decimal("42"));
    assertSame(b.rational(Rational.of(5, 4)), b.decimalFloat("1.25"));
    assertSame(b.rational(Rational.of(241, 20)), b.decimalFloat("12.05"));
  }

  @Test
  public void testDecimalFormatError() throws Exception {
    exception.expect(IntegerFormatException.class);
    b.decimal("12a");
  }

  @Test
  public void testDecimalFloatFormatError() throws Exception {
    exception.expect(IntegerFormatException.class);
    b.decimalFloat("1.x");
  }

  @Test
  public void testDivisionByZero() throws Exception {
    exception.expect(DivisionByZeroException.class);
    b.div(x, b.sub(y, y));
  }

  @Test
  public void testBroadcast() throws Exception {
    NodeRef t = b.tuple(Arrays.asList(x, y));
    NodeRef one = b.integer(1);
    NodeRef expected = b.tuple(Arrays.asList(b.add(x, one), b.add(y, one)));
    assertSame(expected, b.add(t, one));
    assertSame(expected, b.add(one, t));

    NodeRef sq = b.tuple(Arrays.asList(b.mul(x, x), b.mul(y, y)));
    assertSame(sq, b.mul(t, t));
    assertSame(b.tuple(Arrays.asList(b.neg(x), b.neg(y))), b.neg(t));
    assertSame(b.tuple(Arrays.asList(b.func(FunctionTag.SIN, x),
                                     b.func(FunctionTag.SIN, y))),
               b.func(FunctionTag.SIN, t));
  }

  @Test
  public void testNestedBroadcast() throws Exception {
    NodeRef inner = b.tuple(Arrays.asList(x, y));
    NodeRef outer = b.tuple(Arrays.asList(inner, x));
    NodeRef two = b.integer(2);
    NodeRef expected = b.tuple(Arrays.asList(
        b.tuple(Arrays.asList(b.mul(two, x), b.mul(two, y))),
        b.mul(two, x)));
    assertSame(expected, b.mul(outer, two));
  }

  @Test
  public void testShapeMismatch() throws Exception {
    NodeRef t2 = b.tuple(Arrays.asList(x, y));
    NodeRef t3 = b.tuple(Arrays.asList(x, y, x));
    try {
      b.add(t2, t3);
      fail("Expected shape mismatch");
    } catch (ShapeMismatchException e) {
      assertEquals(2, e.expected());
      assertEquals(3, e.actual());
    }
  }

  @Test
  public void testApplyDefinition() throws Exception {
    b.define("f", Collections.singletonList("x"), b.mul(x, x));
    NodeRef p = b.var("p");
    NodeRef q = b.var("q");
    assertSame(b.mul(p, p), b.apply(b.var("f"), p));
    assertSame(b.tuple(Arrays.asList(b.mul(p, p), b.mul(q, q))),
               b.apply(b.var("f"), b.tuple(Arrays.asList(p, q))));
  }

  @Test
  public void testApplyMultiParam() throws Exception {
    NodeRef a = b.var("a");
    NodeRef c = b.var("c");
    b.define("g", Arrays.asList("a", "c"), b.sub(a, c));
    assertSame(b.integer(-1),
        b.apply(b.var("g"), b.tuple(Arrays.asList(b.integer(2),
                                                  b.integer(3)))));
    try {
      b.apply(b.var("g"), x);
      fail("Expected shape mismatch");
    } catch (ShapeMismatchException e) {
      assertEquals(2, e.expected());
      assertEquals(1, e.actual());
    }
  }

  @Test
  public void testApplyFallsBackToMultiply() throws Exception {
    assertSame(b.mul(b.integer(2), x), b.apply(b.integer(2), x));
    assertSame(b.mul(x, y), b.apply(x, y));
  }

  @Test
  public void testBuiltins() throws Exception {
    assertNotNull(b.lookupDefinition("sin"));
    assertNotNull(b.lookupDefinition("ln"));
    assertTrue(b.definitionNames().contains("step"));
    assertSame(b.func(FunctionTag.LOG, y), b.apply(b.var("ln"), y));
    assertSame(b.func(FunctionTag.COS, b.add(x, y)),
               b.apply(b.var("cos"), b.add(x, y)));
  }

  @Test
  public void testSubstitute() throws Exception {
    NodeRef expr = b.add(b.mul(x, x), b.func(FunctionTag.SIN, x));
    Map<String, NodeRef> bindings = new HashMap<String, NodeRef>();
    bindings.put("x", b.integer(2));
    assertSame(b.add(b.integer(4), b.func(FunctionTag.SIN, b.integer(2))),
               b.substitute(expr, bindings));

    bindings.put("x", y);
    assertSame(b.add(b.mul(y, y), b.func(FunctionTag.SIN, y)),
               b.substitute(expr, bindings));
  }

  @Test
  public void testSubstituteNormalizes() throws Exception {
    NodeRef expr = b.sub(x, y);
    Map<String, NodeRef> bindings = new HashMap<String, NodeRef>();
    bindings.put("y", x);
    assertSame(b.integer(0), b.substitute(expr, bindings));
  }

  @Test
  public void testDepthLimit() throws Exception {
    Settings.set(Settings.MAX_DEPTH, "5");
    ExprBuilder shallow = new ExprBuilder();
    NodeRef v = shallow.var("v");
    NodeRef e = v;
    for (int i = 0; i < 10; i++) {
      e = shallow.func(FunctionTag.SIN, e);
    }
    Map<String, NodeRef> bindings = new HashMap<String, NodeRef>();
    bindings.put("v", shallow.integer(1));
    exception.expect(NestingDepthException.class);
    shallow.substitute(e, bindings);
  }

  @Test
  public void testArrayNotImplemented() throws Exception {
    exception.expect(NotImplementedException.class);
    b.array(Arrays.asList(x, y));
  }

  @Test
  public void testDistinctBuilders() {
    ExprBuilder other = new ExprBuilder();
    assertNotSame("Handles are per store", x, other.var("x"));
  }
}

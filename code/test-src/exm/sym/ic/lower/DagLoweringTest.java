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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.After;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sym.common.Logging;
import exm.sym.common.Settings;
import exm.sym.common.exceptions.BackendUnsupportedException;
import exm.sym.common.lang.FunctionTag;
import exm.sym.common.lang.Rational;
import exm.sym.ic.ExprBuilder;
import exm.sym.ic.tree.NodeRef;

public class DagLoweringTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private ExprBuilder b;
  private NodeRef x;
  private NodeRef y;
  private RecordingBackend backend;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/DagLoweringTest.sym.log", true);
  }

  @Before
  public void setup() {
    b = new ExprBuilder();
    x = b.var("x");
    y = b.var("y");
    backend = new RecordingBackend();
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testLeaves() throws Exception {
    assertEquals("x", DagLowering.lower(backend, x).result());
    assertEquals("0", DagLowering.lower(backend, b.integer(0)).result());
    assertEquals("-7", DagLowering.lower(backend, b.integer(-7)).result());
    assertEquals("(3 / 4)", DagLowering.lower(backend,
                      b.rational(Rational.of(3, 4))).result());
  }

  @Test
  public void testSum() throws Exception {
    LoweredProgram<String, String> prog =
        DagLowering.lower(backend, b.add(b.mul(b.integer(2), x),
                                         b.integer(1)));
    assertEquals("(1 + (2 * x))", prog.result());
    assertEquals(Arrays.asList("x"), prog.inputs());
    assertTrue(prog.stores().isEmpty());
    assertEquals(0, prog.loadCount());
  }

  @Test
  public void testQuotients() throws Exception {
    assertEquals("(1 / (x * x))", DagLowering.lower(backend,
        b.powInt(x, -2)).result());
    assertEquals("((2 * x) / 3)", DagLowering.lower(backend,
        b.mul(b.rational(Rational.of(2, 3)), x)).result());
    assertEquals("(x / y)", DagLowering.lower(backend,
        b.div(x, y)).result());
  }

  @Test
  public void testSharedSubexpression() throws Exception {
    NodeRef s = b.func(FunctionTag.SIN, b.add(x, b.integer(1)));
    NodeRef e = b.add(b.mul(s, s), s);

    LoweredProgram<String, String> prog = DagLowering.lower(backend, e);
    assertEquals(Arrays.asList("t0 = sin((1 + x))"), backend.storeLog);
    assertEquals(Arrays.asList(2), backend.storeUses);
    assertEquals("(t0 + (t0 * t0))", prog.result());
    assertEquals(2, prog.refCount(s));
    assertEquals("Each use of a stored node loads it", 2, prog.loadCount());
    assertEquals(Arrays.asList("x"), prog.inputs());
  }

  @Test
  public void testSharedVariable() throws Exception {
    // x appears below two different parents
    NodeRef e = b.add(b.func(FunctionTag.SIN, x), b.func(FunctionTag.COS, x));
    LoweredProgram<String, String> prog = DagLowering.lower(backend, e);
    assertEquals(Arrays.asList("t0 = x"), backend.storeLog);
    assertEquals(2, prog.refCount(x));
    assertEquals(2, prog.loadCount());
    assertEquals(Arrays.asList("x"), prog.inputs());
    assertTrue(prog.result().contains("sin(t0)"));
    assertTrue(prog.result().contains("cos(t0)"));
  }

  @Test
  public void testRoundingAndStep() throws Exception {
    assertEquals("floor(x)", DagLowering.lower(backend,
        b.func(FunctionTag.FLOOR, x)).result());
    assertEquals("ceil(x)", DagLowering.lower(backend,
        b.func(FunctionTag.CEIL, x)).result());
    assertEquals("step(0, x)", DagLowering.lower(backend,
        b.func(FunctionTag.STEP, x)).result());
  }

  @Test
  public void testSmallPowerExpanded() throws Exception {
    assertEquals("(x * x * x)",
        DagLowering.lower(backend, b.powInt(x, 3)).result());
    assertTrue(backend.storeLog.isEmpty());
  }

  @Test
  public void testLargePowerUsesBackendPower() throws Exception {
    LoweredProgram<String, String> prog =
        DagLowering.lower(backend, b.powInt(x, 20));
    assertEquals("(x ^ 20)", prog.result());
    assertTrue("no node is shared, so nothing is stored",
               backend.storeLog.isEmpty());
    assertEquals(0, prog.loadCount());

    assertEquals("(1 / (x ^ 13))",
        DagLowering.lower(backend, b.powInt(x, -13)).result());
  }

  @Test
  public void testLargeMinimumExponent() throws Exception {
    NodeRef e = b.pow(x, b.integer(Integer.MIN_VALUE));
    assertEquals("(1 / (x ^ 2147483648))",
                 DagLowering.lower(backend, e).result());
    assertTrue(backend.storeLog.isEmpty());
  }

  @Test
  public void testPowerExpandLimitSetting() throws Exception {
    Settings.set(Settings.LOWER_POWER_EXPAND_LIMIT, "1");
    LoweredProgram<String, String> prog =
        DagLowering.lower(backend, b.powInt(x, 2));
    assertTrue(backend.storeLog.isEmpty());
    assertEquals("(x ^ 2)", prog.result());
  }

  @Test
  public void testCompoundBaseComputedOnce() throws Exception {
    NodeRef s = b.func(FunctionTag.SIN, x);
    LoweredProgram<String, String> prog =
        DagLowering.lower(backend, b.powInt(s, 5));
    assertEquals(Arrays.asList("t0 = sin(x)"), backend.storeLog);
    assertEquals(Arrays.asList(5), backend.storeUses);
    assertEquals("(t0 * t0 * t0 * t0 * t0)", prog.result());
    assertEquals(5, prog.loadCount());
  }

  @Test
  public void testCompoundBaseAboveLimitNotStored() throws Exception {
    NodeRef s = b.func(FunctionTag.SIN, x);
    assertEquals("(sin(x) ^ 20)",
        DagLowering.lower(backend, b.powInt(s, 20)).result());
    assertTrue(backend.storeLog.isEmpty());
  }

  @Test
  public void testTopLevelTuple() throws Exception {
    NodeRef s = b.func(FunctionTag.SIN, x);
    NodeRef t = b.tuple(Arrays.asList(s, b.add(s, y)));
    LoweredProgram<String, String> prog = DagLowering.lower(backend, t);
    assertTrue(prog.isTuple());
    assertEquals(2, prog.results().size());
    assertEquals(Arrays.asList("t0 = sin(x)"), backend.storeLog);
    assertEquals("t0", prog.results().get(0));
    assertEquals(Arrays.asList("x", "y"), prog.inputs());
  }

  @Test
  public void testNestedTupleUnsupported() throws Exception {
    NodeRef inner = b.tuple(Arrays.asList(x, y));
    exception.expect(BackendUnsupportedException.class);
    DagLowering.lower(backend, b.tuple(Arrays.asList(inner, x)));
  }

  @Test
  public void testScalarResult() throws Exception {
    LoweredProgram<String, String> prog = DagLowering.lower(backend, x);
    assertFalse(prog.isTuple());
    assertEquals(1, prog.results().size());
  }
}

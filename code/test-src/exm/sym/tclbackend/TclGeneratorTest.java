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
package exm.sym.tclbackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sym.common.Settings;
import exm.sym.common.exceptions.BackendUnsupportedException;
import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.common.lang.FunctionTag;
import exm.sym.ic.ExprBuilder;
import exm.sym.ic.lower.DagLowering;
import exm.sym.ic.lower.LoweredProgram;
import exm.sym.ic.tree.NodeRef;
import exm.sym.tclbackend.tree.Expression;

public class TclGeneratorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

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
  public void testSimpleProc() throws Exception {
    NodeRef e = b.add(b.mul(b.integer(2), x), b.integer(1));
    assertEquals("proc f { x } {\n" +
                 "    return [ expr 1 + (2 * ${x}) ]\n" +
                 "}\n",
                 TclGenerator.generateCode(e, "f"));
  }

  @Test
  public void testTemporaries() throws Exception {
    NodeRef s = b.func(FunctionTag.SIN, b.add(x, b.integer(1)));
    NodeRef e = b.add(b.mul(s, s), s);
    assertEquals("proc g { x } {\n" +
                 "    set _t0 [ expr sin(1 + ${x}) ]\n" +
                 "    return [ expr ${_t0} + (${_t0} * ${_t0}) ]\n" +
                 "}\n",
                 TclGenerator.generateCode(e, "g"));
  }

  @Test
  public void testFloatingDivision() throws Exception {
    String code = TclGenerator.generateCode(b.div(x, y), "f");
    assertTrue(code, code.contains("double(${x}) / ${y}"));
    code = TclGenerator.generateCode(b.powInt(x, -1), "f");
    assertTrue(code, code.contains("1.0 / ${x}"));
  }

  @Test
  public void testPowers() throws Exception {
    assertEquals("proc f { x } {\n" +
                 "    return [ expr pow(${x}, 20) ]\n" +
                 "}\n",
                 TclGenerator.generateCode(b.powInt(x, 20), "f"));

    NodeRef s = b.func(FunctionTag.SIN, x);
    assertEquals("proc f { x } {\n" +
                 "    set _t0 [ expr sin(${x}) ]\n" +
                 "    return [ expr ${_t0} * ${_t0} * ${_t0} ]\n" +
                 "}\n",
                 TclGenerator.generateCode(b.powInt(s, 3), "f"));
  }

  @Test
  public void testNegativeLiteralParenthesized() throws Exception {
    String code = TclGenerator.generateCode(b.sub(b.integer(1), x), "f");
    assertTrue(code, code.contains("expr 1 + ((-1) * ${x})"));
  }

  @Test
  public void testStepAndRounding() throws Exception {
    String code = TclGenerator.generateCode(b.func(FunctionTag.STEP, x), "f");
    assertTrue(code, code.contains("(${x} >= 0 ? 1 : 0)"));
    code = TclGenerator.generateCode(b.func(FunctionTag.CEIL, x), "f");
    assertTrue(code, code.contains("ceil(${x})"));
  }

  @Test
  public void testTupleReturnsList() throws Exception {
    NodeRef t = b.tuple(Arrays.asList(x, b.integer(2)));
    String code = TclGenerator.generateCode(t, "f");
    assertTrue(code, code.contains("return [ list [ expr ${x} ] [ expr 2 ] ]"));
  }

  @Test
  public void testProcNameFromSettings() throws Exception {
    Settings.set(Settings.CODEGEN_PROC_NAME, "area");
    TclGenerator gen = new TclGenerator();
    LoweredProgram<Expression, String> prog =
        DagLowering.lower(gen, b.mul(x, y));
    String code = gen.generateProc(prog).toString();
    assertTrue(code, code.startsWith("proc area { x y } {\n"));
  }

  @Test
  public void testBadProcName() throws Exception {
    exception.expect(SymRuntimeError.class);
    new TclGenerator("bad name");
  }

  @Test
  public void testNestedTuple() throws Exception {
    NodeRef inner = b.tuple(Arrays.asList(x, y));
    exception.expect(BackendUnsupportedException.class);
    TclGenerator.generateCode(b.tuple(Arrays.asList(inner, y)), "f");
  }
}

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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.sym.common.Logging;
import exm.sym.common.NumericBackend;
import exm.sym.common.Settings;
import exm.sym.common.exceptions.BackendException;
import exm.sym.common.exceptions.UserException;
import exm.sym.common.lang.FunctionTag;
import exm.sym.ic.lower.DagLowering;
import exm.sym.ic.lower.LoweredProgram;
import exm.sym.ic.tree.NodeRef;
import exm.sym.tclbackend.tree.Command;
import exm.sym.tclbackend.tree.Conditional;
import exm.sym.tclbackend.tree.Expression;
import exm.sym.tclbackend.tree.Infix;
import exm.sym.tclbackend.tree.LiteralFloat;
import exm.sym.tclbackend.tree.LiteralInt;
import exm.sym.tclbackend.tree.MathFunction;
import exm.sym.tclbackend.tree.Proc;
import exm.sym.tclbackend.tree.Sequence;
import exm.sym.tclbackend.tree.SetVariable;
import exm.sym.tclbackend.tree.Square;
import exm.sym.tclbackend.tree.TclList;
import exm.sym.tclbackend.tree.Token;
import exm.sym.tclbackend.tree.Value;

/**
 * Numeric backend that emits a Tcl proc.
 *
 * Values are fragments of expr arithmetic.  Each stored temporary becomes
 * a set statement in the proc body, in the order the lowering pass
 * created them.  The proc takes one argument per input, in order of first
 * occurrence.
 *
 * A generator collects statements for one program: use a fresh instance
 * for each expression.
 */
public class TclGenerator implements NumericBackend<Expression, String> {

  private static final Logger logger = Logging.getSymLogger();

  public static final String NAME = "tcl";

  /** Temporary names cannot clash with inputs: identifiers start with a
      letter */
  private static final String TEMP_PREFIX = "_t";

  private final String procName;
  private final Sequence body = new Sequence();
  private int tempCounter = 0;

  public TclGenerator(String procName) {
    Proc.checkTclFunctionName(procName);
    this.procName = procName;
  }

  public TclGenerator() {
    this(Settings.get(Settings.CODEGEN_PROC_NAME).trim());
  }

  /**
   * Lower root and render the resulting Tcl proc
   */
  public static String generateCode(NodeRef root, String procName)
      throws UserException {
    TclGenerator gen = new TclGenerator(procName);
    LoweredProgram<Expression, String> prog = DagLowering.lower(gen, root);
    return gen.generateProc(prog).toString();
  }

  /**
   * Wrap up a program lowered against this generator
   */
  public Proc generateProc(LoweredProgram<Expression, String> prog) {
    Expression ret;
    if (prog.isTuple()) {
      List<Expression> elems = new ArrayList<Expression>();
      for (Expression e: prog.results()) {
        elems.add(Square.arithExpr(e));
      }
      ret = new TclList(elems);
    } else {
      ret = Square.arithExpr(prog.result());
    }
    body.add(new Command(new Token("return"), ret));

    List<String> args = prog.inputs();
    logger.debug("Generated tcl proc " + procName + " with " +
                 tempCounter + " temporaries");
    return new Proc(procName, args, body);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Expression literalInt(long i) {
    return new LiteralInt(i);
  }

  @Override
  public Expression literalFloat(double x) {
    return new LiteralFloat(x);
  }

  @Override
  public Expression input(String name) {
    return new Value(name);
  }

  @Override
  public Expression sum(List<Expression> parts) {
    return new Infix("+", parts);
  }

  @Override
  public Expression product(List<Expression> parts) {
    return new Infix("*", parts);
  }

  /**
   * pow() rather than ** so that integer inputs do not produce bignums
   */
  @Override
  public Expression power(Expression base, long exponent) {
    return new MathFunction("pow", base, new LiteralInt(exponent));
  }

  @Override
  public String store(Expression value, int uses) {
    String var = TEMP_PREFIX + tempCounter++;
    body.add(new SetVariable(var, Square.arithExpr(value)));
    return var;
  }

  @Override
  public Expression load(String storage) {
    return new Value(storage);
  }

  /**
   * Tcl's / truncates on integers, so force floating point division
   */
  @Override
  public Expression divide(Expression a, Expression b) {
    return new Infix("/", new MathFunction("double", a), b);
  }

  @Override
  public Expression invert(Expression a) {
    return new Infix("/", new LiteralFloat(1.0), a);
  }

  @Override
  public Expression roundUp(Expression x) {
    return new MathFunction("ceil", x);
  }

  @Override
  public Expression roundDown(Expression x) {
    return new MathFunction("floor", x);
  }

  @Override
  public Expression stepAt(Expression threshold, Expression x) {
    return new Conditional(new Infix(">=", x, threshold),
                           new LiteralInt(1), new LiteralInt(0));
  }

  @Override
  public Expression function(FunctionTag tag, Expression arg)
      throws BackendException {
    switch (tag) {
      case SIN:
      case COS:
      case EXP:
      case LOG:
        return new MathFunction(tag.displayName(), arg);
      case FLOOR:
        return roundDown(arg);
      case CEIL:
        return roundUp(arg);
      case STEP:
        return stepAt(new LiteralInt(0), arg);
      default:
        throw new BackendException("Unknown function tag " + tag);
    }
  }
}

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
package exm.sym.ui;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import exm.sym.common.Logging;
import exm.sym.common.exceptions.InvalidSyntaxException;
import exm.sym.common.exceptions.SymFatal;
import exm.sym.common.exceptions.UserException;
import exm.sym.evalbackend.DoubleEvaluator;
import exm.sym.frontend.ExprFrontend;
import exm.sym.frontend.Statement;
import exm.sym.ic.lower.DagLowering;
import exm.sym.ic.lower.LoweredProgram;
import exm.sym.ic.tree.NodeRef;
import exm.sym.tclbackend.TclGenerator;
import exm.sym.tclbackend.tree.Expression;

/**
 * This is the main entry point to the compiler: runs the statements of a
 * program through the front end and hands the result to the selected
 * output.
 */
public class SymCompiler {

  public static enum OutputMode {
    /** Canonical form of every expression statement */
    CANONICAL,
    /** Tcl procedure for the last expression */
    TCL,
    /** Numeric value of the last expression */
    EVALUATE,
  }

  private final Logger logger;
  private final OutputMode mode;
  private final Map<String, Double> bindings;

  public SymCompiler(Logger logger, OutputMode mode,
                     Map<String, Double> bindings) {
    this.logger = logger;
    this.mode = mode;
    this.bindings = new HashMap<String, Double>(bindings);
  }

  /**
   * Compile program text, one statement per line, and write results to
   * output.  Errors are reported on stderr.
   * @throws SymFatal with the exit code on any error
   */
  public void compile(String program, PrintStream output) {
    try {
      logger.info("sym starting, mode " + mode);
      compileOnce(program, output);
      output.flush();
      logger.info("sym done");
    }
    catch (SymFatal e) {
      // Rethrow
      throw e;
    }
    catch (InvalidSyntaxException e) {
      System.err.println("sym syntax error:");
      System.err.println(e.getMessage());
      throw new SymFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      System.err.println("sym error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(ExceptionUtils.getStackTrace(e));
      throw new SymFatal(ExitCode.ERROR_USER.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new SymFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (RuntimeException e) {
      reportInternalError(e);
      throw new SymFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  void compileOnce(String program, PrintStream output) throws UserException {
    ExprFrontend frontend = new ExprFrontend();
    List<Statement> stmts = frontend.evaluateLines(program);

    List<NodeRef> exprs = new ArrayList<NodeRef>();
    for (Statement stmt: stmts) {
      if (stmt.kind() == Statement.Kind.EXPRESSION) {
        exprs.add(stmt.expr());
      }
    }
    logger.debug("Program has " + stmts.size() + " statements, " +
                 exprs.size() + " expressions");

    switch (mode) {
      case CANONICAL:
        for (NodeRef expr: exprs) {
          output.println(expr);
        }
        break;
      case TCL:
        output.print(generateTcl(lastExpr(exprs)));
        break;
      case EVALUATE:
        output.println(evaluate(lastExpr(exprs)));
        break;
      default:
        throw new UserException("unknown output mode " + mode);
    }
  }

  private static NodeRef lastExpr(List<NodeRef> exprs) throws UserException {
    if (exprs.isEmpty()) {
      throw new UserException("no expression to compile");
    }
    return exprs.get(exprs.size() - 1);
  }

  private String generateTcl(NodeRef expr) throws UserException {
    TclGenerator gen = new TclGenerator();
    LoweredProgram<Expression, String> prog = DagLowering.lower(gen, expr);
    logger.debug("Lowered: " + prog);
    return gen.generateProc(prog).toString();
  }

  private String evaluate(NodeRef expr) throws UserException {
    DoubleEvaluator eval = new DoubleEvaluator(bindings);
    LoweredProgram<Double, Integer> prog = DagLowering.lower(eval, expr);
    for (String name: bindings.keySet()) {
      if (!prog.inputs().contains(name)) {
        Logging.uniqueWarn("Value bound for " + name +
                           " is not used by the expression");
      }
    }
    if (prog.isTuple()) {
      return "(" + StringUtils.join(prog.results(), ", ") + ")";
    } else {
      return prog.result().toString();
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("SYM INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}

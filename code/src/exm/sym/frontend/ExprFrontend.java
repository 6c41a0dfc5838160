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
package exm.sym.frontend;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import exm.sym.common.Logging;
import exm.sym.common.exceptions.InvalidSyntaxException;
import exm.sym.common.exceptions.UserException;
import exm.sym.ic.ExprBuilder;
import exm.sym.ic.tree.NodeRef;

/**
 * Text entry point: parses statements and feeds them to a builder.
 * Definitions made by earlier statements are visible to later ones.
 */
public class ExprFrontend {

  private static final Logger logger = Logging.getSymLogger();

  private final ExprBuilder builder;
  private final ExprWalker walker;

  public ExprFrontend(ExprBuilder builder) {
    this.builder = builder;
    this.walker = new ExprWalker(builder);
  }

  public ExprFrontend() {
    this(new ExprBuilder());
  }

  public ExprBuilder builder() {
    return builder;
  }

  /**
   * Parse a single expression
   * @throws InvalidSyntaxException if the text is blank or a definition
   */
  public NodeRef parse(String text) throws UserException {
    Statement stmt = evaluate(text);
    if (stmt.kind() != Statement.Kind.EXPRESSION) {
      throw new InvalidSyntaxException(text, "expected an expression");
    }
    return stmt.expr();
  }

  /**
   * Evaluate one statement: an expression, a definition, or nothing
   */
  public Statement evaluate(String text) throws UserException {
    return evaluate(text, 1);
  }

  private Statement evaluate(String text, int lineNum) throws UserException {
    ParsedInput parsed = ParsedInput.parse(text, lineNum);
    if (logger.isTraceEnabled() && !parsed.isEmpty()) {
      logger.trace("Parse tree for \"" + text + "\":\n" +
                   parsed.ast.printTree());
    }
    return walker.walkStatement(parsed.ast);
  }

  /**
   * Evaluate a program with one statement per line.  The first failing
   * line aborts evaluation, with its line number added to the message.
   */
  public List<Statement> evaluateLines(String program) throws UserException {
    List<String> lines = IOUtils.readLines(new StringReader(program));
    List<Statement> result = new ArrayList<Statement>(lines.size());
    int lineNum = 1;
    for (String line: lines) {
      try {
        result.add(evaluate(line, lineNum));
      } catch (InvalidSyntaxException e) {
        // Diagnostics already carry the line number
        throw e;
      } catch (UserException e) {
        throw new UserException("line " + lineNum + ": " + e.getMessage(), e);
      }
      lineNum++;
    }
    return result;
  }
}

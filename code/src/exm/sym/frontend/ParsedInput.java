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

import java.util.ArrayList;
import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.tree.RewriteCardinalityException;

import exm.sym.ast.SymAST;
import exm.sym.ast.antlr.ExprLexer;
import exm.sym.ast.antlr.ExprParser;
import exm.sym.common.exceptions.InvalidSyntaxException;
import exm.sym.common.exceptions.SymRuntimeError;

/**
 * One parsed statement of input text
 */
public class ParsedInput {

  public final String source;

  /** null for a blank or comment-only statement */
  public final SymAST ast;

  private ParsedInput(String source, SymAST ast) {
    this.source = source;
    this.ast = ast;
  }

  public boolean isEmpty() {
    return ast == null;
  }

  /**
   * Parse a single statement
   * @throws InvalidSyntaxException if the lexer or parser reported any
   *        error, even one it recovered from
   */
  public static ParsedInput parse(String source)
      throws InvalidSyntaxException {
    return parse(source, 1);
  }

  /**
   * @param line line number of source in its input, for diagnostics
   */
  public static ParsedInput parse(String source, int line)
      throws InvalidSyntaxException {
    return new ParsedInput(source, runANTLR(source, line));
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static SymAST runANTLR(String source, int lineNum)
      throws InvalidSyntaxException {
    ANTLRStringStream input = new ANTLRStringStream(source);
    input.setLine(lineNum);
    ExprLexer lexer = new ExprLexer(input);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    ExprParser parser = new ExprParser(tokens);
    parser.setTreeAdaptor(new SymAST.SymTreeAdaptor());

    ExprParser.line_return line = null;
    try {
      line = parser.line();
    } catch (RecognitionException e) {
      // Errors are normally reported and recovered from inside the parser
      throw new SymRuntimeError("Parsing failed: internal error", e);
    } catch (RewriteCardinalityException e) {
      // Tree rewrite after a recovered error can find missing elements
      if (!lexer.lexerError && !parser.parserError) {
        throw new SymRuntimeError("Parsing failed: internal error", e);
      }
    }

    /* The parser may recover from errors, print an error message and
     * continue, generating the tree that it thinks is most plausible.
     * That still counts as a failure.
     */
    if (lexer.lexerError || parser.parserError) {
      List<String> diagnostics = new ArrayList<String>();
      diagnostics.addAll(lexer.errors);
      diagnostics.addAll(parser.errors);
      throw new InvalidSyntaxException(source, diagnostics);
    }

    return (SymAST)line.getTree();
  }
}

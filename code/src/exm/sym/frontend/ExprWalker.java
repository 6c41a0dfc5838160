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

import org.apache.log4j.Logger;

import exm.sym.ast.SymAST;
import exm.sym.ast.antlr.ExprParser;
import exm.sym.common.Logging;
import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.common.exceptions.UserException;
import exm.sym.ic.Definition;
import exm.sym.ic.ExprBuilder;
import exm.sym.ic.tree.NodeRef;

/**
 * Walks parse trees and makes the matching builder calls.  All
 * simplification happens in the builder.
 */
public class ExprWalker {

  private static final Logger logger = Logging.getSymLogger();

  private final ExprBuilder builder;

  public ExprWalker(ExprBuilder builder) {
    this.builder = builder;
  }

  public Statement walkStatement(SymAST tree) throws UserException {
    if (tree == null) {
      return Statement.empty();
    } else if (tree.getType() == ExprParser.DEFINE) {
      return Statement.definition(walkDefinition(tree));
    } else {
      return Statement.expression(walkExpr(tree));
    }
  }

  public Definition walkDefinition(SymAST tree) throws UserException {
    assert(tree.getType() == ExprParser.DEFINE);
    assert(tree.childCount() == 3);
    String name = tree.child(0).getText();
    SymAST paramsT = tree.child(1);
    assert(paramsT.getType() == ExprParser.PARAMS);
    List<String> params = new ArrayList<String>(paramsT.childCount());
    for (SymAST p: paramsT.children()) {
      if (params.contains(p.getText())) {
        throw new UserException(p.getLine(), p.getCharPositionInLine(),
                  "duplicate parameter " + p.getText() + " in " + name);
      }
      params.add(p.getText());
    }
    NodeRef body = walkExpr(tree.child(2));
    return builder.define(name, params, body);
  }

  public NodeRef walkExpr(SymAST tree) throws UserException {
    int token = tree.getType();
    if (logger.isTraceEnabled()) {
      logger.trace("walkExpr " + tokName(token) + " at " + tree.location());
    }

    switch (token) {
      case ExprParser.NUMBER: {
        String text = tree.getText();
        if (text.indexOf('.') >= 0) {
          return builder.decimalFloat(text);
        } else {
          return builder.decimal(text);
        }
      }
      case ExprParser.ID:
        return builder.var(tree.getText());
      case ExprParser.ADD:
        return builder.add(walkExpr(tree.child(0)), walkExpr(tree.child(1)));
      case ExprParser.SUB:
        return builder.sub(walkExpr(tree.child(0)), walkExpr(tree.child(1)));
      case ExprParser.MUL:
        return builder.mul(walkExpr(tree.child(0)), walkExpr(tree.child(1)));
      case ExprParser.DIV:
        return builder.div(walkExpr(tree.child(0)), walkExpr(tree.child(1)));
      case ExprParser.POW:
        return builder.pow(walkExpr(tree.child(0)), walkExpr(tree.child(1)));
      case ExprParser.NEG:
        return builder.neg(walkExpr(tree.child(0)));
      case ExprParser.APPLY:
        return builder.apply(walkExpr(tree.child(0)),
                             walkExpr(tree.child(1)));
      case ExprParser.TUPLE:
        if (tree.childCount() == 1) {
          // Just parentheses
          return walkExpr(tree.child(0));
        }
        return builder.tuple(walkChildren(tree));
      case ExprParser.ARRAY:
        return builder.array(walkChildren(tree));
      default:
        throw new SymRuntimeError("Unexpected token type in expression " +
                                  "context: " + tokName(token));
    }
  }

  private List<NodeRef> walkChildren(SymAST tree) throws UserException {
    List<NodeRef> result = new ArrayList<NodeRef>(tree.childCount());
    for (SymAST child: tree.children()) {
      result.add(walkExpr(child));
    }
    return result;
  }

  private static String tokName(int token) {
    if (token >= 0 && token < ExprParser.tokenNames.length) {
      return ExprParser.tokenNames[token];
    }
    return "<token " + token + ">";
  }
}

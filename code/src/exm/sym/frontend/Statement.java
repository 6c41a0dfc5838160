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

import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.ic.Definition;
import exm.sym.ic.tree.NodeRef;

/**
 * Result of evaluating one input statement
 */
public class Statement {

  public static enum Kind {
    /** Blank or comment only */
    EMPTY,
    EXPRESSION,
    DEFINITION,
  }

  private static final Statement EMPTY_STATEMENT =
                        new Statement(Kind.EMPTY, null, null);

  private final Kind kind;
  private final NodeRef expr;
  private final Definition definition;

  private Statement(Kind kind, NodeRef expr, Definition definition) {
    this.kind = kind;
    this.expr = expr;
    this.definition = definition;
  }

  public static Statement empty() {
    return EMPTY_STATEMENT;
  }

  public static Statement expression(NodeRef expr) {
    return new Statement(Kind.EXPRESSION, expr, null);
  }

  public static Statement definition(Definition def) {
    return new Statement(Kind.DEFINITION, null, def);
  }

  public Kind kind() {
    return kind;
  }

  public NodeRef expr() {
    if (kind != Kind.EXPRESSION) {
      throw new SymRuntimeError("Not an expression: " + this);
    }
    return expr;
  }

  public Definition definition() {
    if (kind != Kind.DEFINITION) {
      throw new SymRuntimeError("Not a definition: " + this);
    }
    return definition;
  }

  @Override
  public String toString() {
    switch (kind) {
      case EXPRESSION:
        return expr.toString();
      case DEFINITION:
        return definition.toString();
      default:
        return "";
    }
  }
}

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
package exm.sym.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;
import org.antlr.runtime.tree.CommonTreeAdaptor;

/**
 * Parse tree node with typed child accessors
 */
public class SymAST extends CommonTree {

  public SymAST(Token t) {
    super(t);
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * SymAST everywhere
   */
  public SymAST child(int i) {
    return (SymAST)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<SymAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  /**
   * @return "line:column" of the token
   */
  public String location() {
    return getLine() + ":" + getCharPositionInLine();
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
    writer.println(this.getText());
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  public static class SymTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new SymAST(t);
    }
  }
}

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
package exm.sym.tclbackend.tree;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Tcl square bracket expression, e.g., [ expr ... ]
 * */
public class Square extends Expression
{
  private final List<Expression> items;

  public Square(Expression... tokens)
  {
    this.items = new ArrayList<Expression>(tokens.length);
    for (Expression e: tokens) {
      items.add(e);
    }
  }

  public void add(Expression item)
  {
    items.add(item);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append("[ ");
    Iterator<Expression> it = items.iterator();
    while (it.hasNext())
    {
      Expression tree = it.next();
      tree.appendTo(sb);
      if (it.hasNext())
        sb.append(' ');
    }
    sb.append(" ]");
  }

  public static Square arithExpr(Expression... contents) {
    Expression newE[] = new Expression[contents.length + 1];
    newE[0] = new Token("expr");
    int i = 1;
    for (Expression expr: contents) {
      assert(expr != null);
      newE[i] = expr;
      i++;
    }
    return new Square(newE);
  }

}

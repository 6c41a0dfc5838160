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
 * Operands of an expr expression joined by a binary operator,
 * e.g. ( a + b + c ).  Compound operands are parenthesized.
 */
public class Infix extends Expression
{
  private final String operator;
  private final List<Expression> operands;

  public Infix(String operator, List<? extends Expression> operands)
  {
    assert(operands.size() >= 2);
    this.operator = operator;
    this.operands = new ArrayList<Expression>(operands);
  }

  public Infix(String operator, Expression a, Expression b)
  {
    this.operator = operator;
    this.operands = new ArrayList<Expression>(2);
    operands.add(a);
    operands.add(b);
  }

  public String operator() {
    return operator;
  }

  @Override
  public boolean isAtomic() {
    return false;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    Iterator<Expression> it = operands.iterator();
    while (it.hasNext())
    {
      appendOperand(sb, it.next());
      if (it.hasNext()) {
        sb.append(' ');
        sb.append(operator);
        sb.append(' ');
      }
    }
  }

  private static void appendOperand(StringBuilder sb, Expression e) {
    if (e.isAtomic()) {
      e.appendTo(sb);
    } else {
      sb.append("(");
      e.appendTo(sb);
      sb.append(")");
    }
  }
}

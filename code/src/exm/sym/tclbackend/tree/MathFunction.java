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

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Call of a Tcl math function inside expr, e.g. sin(x)
 */
public class MathFunction extends Expression
{
  private final String name;
  private final List<Expression> args;

  public MathFunction(String name, Expression... args)
  {
    this.name = name;
    this.args = ImmutableList.copyOf(args);
  }

  public String name() {
    return name;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(name);
    sb.append("(");
    Iterator<Expression> it = args.iterator();
    while (it.hasNext()) {
      it.next().appendTo(sb);
      if (it.hasNext()) {
        sb.append(", ");
      }
    }
    sb.append(")");
  }
}

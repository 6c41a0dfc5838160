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

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * A single Tcl command on its own line
 */
public class Command extends TclTree
{
  private final List<TclTree> tokens;

  public Command(TclTree... tokens)
  {
    this.tokens = Arrays.asList(tokens);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    Iterator<TclTree> it = tokens.iterator();
    while (it.hasNext())
    {
      TclTree tree = it.next();
      tree.appendTo(sb);
      if (it.hasNext())
        sb.append(' ');
    }
    sb.append('\n');
  }
}

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

import java.util.List;

import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.common.util.StringUtil;

public class Proc extends TclTree
{
  private final String name;
  private final List<String> args;
  private final Sequence body;

  public Proc(String name, List<String> args, Sequence body)
  {
    checkTclFunctionName(name);
    this.name = name;
    this.args = args;
    this.body = body;
  }

  public String name() {
    return name;
  }

  public Sequence getBody() {
    return body;
  }

  /**
   * Check that there are no invalid characters
   */
  public static void checkTclFunctionName(String name) {
    if (name.isEmpty()) {
      throw new SymRuntimeError("Empty tcl function name");
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isLetter(c) || Character.isDigit(c) ||
          c == ':' || c == '_' || c == '-') {
        // Whitelist of characters
      } else {
        throw new SymRuntimeError("Bad character '" + c +
                                  "' in tcl function name " + name);
      }
    }
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("proc ");
    sb.append(name);
    sb.append(" { ");
    sb.append(StringUtil.concat(args));
    sb.append(" } {\n");
    body.setIndentation(indentation+indentWidth);
    body.appendTo(sb);
    indent(sb);
    sb.append("}\n");
  }
}

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

public class LiteralFloat extends Expression
{
  private final double value;

  public LiteralFloat(double value)
  {
    this.value = value;
  }

  @Override
  public boolean isAtomic() {
    return value >= 0;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    if (Double.isInfinite(value)) {
      sb.append(value > 0 ? "Inf" : "-Inf");
    } else {
      // Java's formatting (e.g. 1.0E20) is also valid for Tcl
      sb.append(Double.toString(value));
    }
  }
}

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
package exm.sym.ic;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sym.common.util.StringUtil;
import exm.sym.ic.tree.NodeRef;

/**
 * A named function: parameter names and a body expression in which the
 * parameters occur as free variables.
 */
public class Definition {
  private final String name;
  private final ImmutableList<String> params;
  private final NodeRef body;

  public Definition(String name, List<String> params, NodeRef body) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.body = body;
  }

  public String name() {
    return name;
  }

  public ImmutableList<String> params() {
    return params;
  }

  public int arity() {
    return params.size();
  }

  public NodeRef body() {
    return body;
  }

  @Override
  public String toString() {
    return name + "(" + StringUtil.concat(", ", params) + ") = " + body;
  }
}

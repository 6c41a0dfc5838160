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
package exm.sym.ic.lower;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;

import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.ic.tree.NodeRef;

/**
 * Result of lowering one expression: everything needed to assemble a
 * callable that takes one parameter per input.
 *
 * @param <V> backend value type
 * @param <S> backend storage handle type
 */
public class LoweredProgram<V, S> {

  /** Temporaries in program order, later ones may refer to earlier */
  private final ImmutableList<S> stores;

  /** One per element of a top-level tuple, otherwise exactly one */
  private final ImmutableList<V> results;

  private final boolean tuple;

  /** Distinct input names in order of first occurrence */
  private final ImmutableList<String> inputs;

  /** Number of parent positions referring to each node */
  private final ImmutableMultiset<NodeRef> refCounts;

  private final int loads;

  LoweredProgram(List<S> stores, List<V> results, boolean tuple,
                 List<String> inputs, ImmutableMultiset<NodeRef> refCounts,
                 int loads) {
    this.stores = ImmutableList.copyOf(stores);
    this.results = ImmutableList.copyOf(results);
    this.tuple = tuple;
    this.inputs = ImmutableList.copyOf(inputs);
    this.refCounts = refCounts;
    this.loads = loads;
  }

  public ImmutableList<S> stores() {
    return stores;
  }

  public ImmutableList<V> results() {
    return results;
  }

  /**
   * @return the value of a scalar expression
   */
  public V result() {
    if (tuple) {
      throw new SymRuntimeError("Lowered a tuple, use results()");
    }
    return results.get(0);
  }

  public boolean isTuple() {
    return tuple;
  }

  public ImmutableList<String> inputs() {
    return inputs;
  }

  public int refCount(NodeRef node) {
    return refCounts.count(node);
  }

  public int loadCount() {
    return loads;
  }

  @Override
  public String toString() {
    return "LoweredProgram(inputs=" + inputs + ", stores=" + stores.size()
           + ", results=" + results + ")";
  }
}

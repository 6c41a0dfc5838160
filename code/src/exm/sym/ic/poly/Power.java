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
package exm.sym.ic.poly;

import exm.sym.ic.tree.NodeRef;

/**
 * One factor of a monomial: base raised to a nonzero integer exponent
 */
public final class Power implements Comparable<Power> {
  private final NodeRef base;
  private final long exponent;

  public Power(NodeRef base, long exponent) {
    assert(base != null);
    assert(exponent != 0) : "zero exponent for " + base;
    this.base = base;
    this.exponent = exponent;
  }

  public NodeRef base() {
    return base;
  }

  public long exponent() {
    return exponent;
  }

  @Override
  public int compareTo(Power o) {
    int c = base.compareTo(o.base);
    if (c != 0) {
      return c;
    }
    return Long.compare(exponent, o.exponent);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Power)) {
      return false;
    }
    Power other = (Power)obj;
    return base == other.base && exponent == other.exponent;
  }

  @Override
  public int hashCode() {
    return 31 * base.hashCode() + Long.hashCode(exponent);
  }

  @Override
  public String toString() {
    return base + "^" + exponent;
  }
}

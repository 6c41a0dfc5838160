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

package exm.sym.common.exceptions;

/**
 * Tuple arity mismatch, either between the two operands of a broadcast
 * operation or between a definition's parameters and its arguments.
 */
public class ShapeMismatchException extends UserException {

  private final int expected;
  private final int actual;

  public ShapeMismatchException(int expected, int actual) {
    super("shape mismatch: " + expected + " vs. " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int expected() {
    return expected;
  }

  public int actual() {
    return actual;
  }

  private static final long serialVersionUID = 1L;
}

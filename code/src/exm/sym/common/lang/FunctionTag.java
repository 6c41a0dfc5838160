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
package exm.sym.common.lang;

/**
 * Elementary functions that are carried through simplification
 * unevaluated.  The lowering pass maps the rounding and step tags to
 * dedicated backend operations; everything else is left to the backend's
 * function handler.
 */
public enum FunctionTag {
  SIN("sin"),
  COS("cos"),
  EXP("exp"),
  LOG("log"),
  FLOOR("floor"),
  CEIL("ceil"),
  /** Heaviside step at zero */
  STEP("step");

  private final String displayName;

  private FunctionTag(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * @return true if this is one of the transcendental functions
   */
  public boolean isTranscendental() {
    switch (this) {
      case SIN:
      case COS:
      case EXP:
      case LOG:
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return displayName;
  }
}

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

import exm.sym.common.Settings;

/**
 * Expression nesting exceeded the configured maximum depth of recursive
 * walks ({@link Settings#MAX_DEPTH}).
 */
public class NestingDepthException extends UserException {

  public NestingDepthException(long maxDepth) {
    super("expression nested deeper than " + maxDepth + " levels, raise "
          + Settings.MAX_DEPTH + " to allow it");
  }

  private static final long serialVersionUID = 1L;
}

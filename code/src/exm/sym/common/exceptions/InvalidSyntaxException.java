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

import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Malformed input text.  Keeps the offending source text and the
 * diagnostics reported by the parser.
 */
public class InvalidSyntaxException extends UserException {

  private final String source;
  private final List<String> diagnostics;

  public InvalidSyntaxException(String source, List<String> diagnostics) {
    super("could not parse \"" + source + "\": " +
          StringUtils.join(diagnostics, "; "));
    this.source = source;
    this.diagnostics = Collections.unmodifiableList(diagnostics);
  }

  public InvalidSyntaxException(String source, String diagnostic) {
    this(source, Collections.singletonList(diagnostic));
  }

  public String source() {
    return source;
  }

  public List<String> diagnostics() {
    return diagnostics;
  }

  private static final long serialVersionUID = 1L;
}

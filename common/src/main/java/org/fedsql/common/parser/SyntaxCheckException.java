/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.common.parser;

/** Query text that cannot be parsed, or parses to a shape that cannot be planned. */
public class SyntaxCheckException extends RuntimeException {

  public SyntaxCheckException(String message) {
    super(message);
  }

  public SyntaxCheckException(String message, Throwable cause) {
    super(message, cause);
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.common.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringUtilsTest {

  @Test
  void unquoteIdentifier() {
    assertEquals("my-db", StringUtils.unquoteIdentifier("`my-db`"));
    assertEquals("my-db", StringUtils.unquoteIdentifier("\"my-db\""));
    assertEquals("plain", StringUtils.unquoteIdentifier("plain"));
    assertEquals("`", StringUtils.unquoteIdentifier("`"));
    assertEquals("", StringUtils.unquoteIdentifier(""));
  }

  @Test
  void toLowerCaseIsNullSafe() {
    assertEquals("mindsdb", StringUtils.toLowerCase("MindsDB"));
    assertNull(StringUtils.toLowerCase(null));
  }

  @Test
  void equalsIgnoreCase() {
    assertTrue(StringUtils.equalsIgnoreCase("Int1", "int1"));
    assertTrue(StringUtils.equalsIgnoreCase(null, null));
    assertFalse(StringUtils.equalsIgnoreCase("int1", null));
    assertFalse(StringUtils.equalsIgnoreCase("int1", "int2"));
  }

  @Test
  void formatAndJoin() {
    assertEquals("step 3 of 5", StringUtils.format("step %d of %d", 3, 5));
    assertEquals("int1.schema.t1", StringUtils.joinPath(List.of("int1", "schema", "t1")));
  }
}

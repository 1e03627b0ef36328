/*
 * Copyright (C) 2025 Isima, Inc.
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
 * limitations under the License.
 */
package io.isima.grammar.dfa;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import io.isima.grammar.errors.RuntimeError;
import org.junit.Test;

public class EncodedTablesTest {

  @Test
  public void testUnpackRuns() {
    assertArrayEquals(
        new short[] {2, 9, 9, 9}, EncodedTables.unpackEncodedString("\1\2\3\11"));
  }

  @Test
  public void testUnpackEmpty() {
    assertEquals(0, EncodedTables.unpackEncodedString("").length);
    assertEquals(0, EncodedTables.unpackEncodedStringToUnsignedChars("").length);
  }

  @Test
  public void testZeroCountContributesNothing() {
    assertArrayEquals(new short[] {5}, EncodedTables.unpackEncodedString("\0\7\1\5"));
  }

  @Test
  public void testSignedAndUnsignedReadings() {
    final String encoded = "\2\uffff\1\u8000";
    assertArrayEquals(
        new short[] {-1, -1, Short.MIN_VALUE}, EncodedTables.unpackEncodedString(encoded));
    assertArrayEquals(
        new char[] {'\uffff', '\uffff', '\u8000'},
        EncodedTables.unpackEncodedStringToUnsignedChars(encoded));
  }

  @Test
  public void testLongRun() {
    final short[] data = EncodedTables.unpackEncodedString("\u0400a");
    assertEquals(1024, data.length);
    for (final short value : data) {
      assertEquals(0x61, value);
    }
  }

  @Test
  public void testOddLength() {
    final var e =
        assertThrows(MalformedTableException.class, () -> EncodedTables.unpackEncodedString("\1"));
    assertEquals(RuntimeError.MALFORMED_TABLE.getErrorCode(), e.getErrorCode());
    assertThat(e.getMessage(), containsString("must be even"));
    assertThrows(
        MalformedTableException.class,
        () -> EncodedTables.unpackEncodedStringToUnsignedChars("\1\2\3"));
  }

  @Test
  public void testNull() {
    assertThrows(MalformedTableException.class, () -> EncodedTables.unpackEncodedString(null));
    assertThrows(
        MalformedTableException.class,
        () -> EncodedTables.unpackEncodedStringToUnsignedChars(null));
  }
}

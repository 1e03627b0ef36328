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

/**
 * Decoder of run-length encoded DFA tables.
 *
 * <p>An encoded table is a string read as 16-bit code units in (count, value) pairs. The pair
 * {@code (n, v)} stands for {@code v} repeated {@code n} times, so {@code "\1\2\3\11"} decodes to
 * {@code {2, 9, 9, 9}}. Generated recognizers ship tables this way because large static array
 * initializers exceed the class file method size limit.
 */
public final class EncodedTables {

  private EncodedTables() {}

  /**
   * Decodes into signed 16-bit values; used for transition, accept, special, EOT and EOF tables
   * where the code unit 0xFFFF stands for -1.
   *
   * @throws MalformedTableException if the string is null or has odd length
   */
  public static short[] unpackEncodedString(String encodedString) {
    final short[] data = new short[decodedSize(encodedString)];
    int di = 0;
    for (int i = 0; i < encodedString.length(); i += 2) {
      final char n = encodedString.charAt(i);
      final short v = (short) encodedString.charAt(i + 1);
      for (int j = 0; j < n; ++j) {
        data[di++] = v;
      }
    }
    return data;
  }

  /**
   * Decodes into unsigned 16-bit values; used for the min and max symbol tables.
   *
   * @throws MalformedTableException if the string is null or has odd length
   */
  public static char[] unpackEncodedStringToUnsignedChars(String encodedString) {
    final char[] data = new char[decodedSize(encodedString)];
    int di = 0;
    for (int i = 0; i < encodedString.length(); i += 2) {
      final char n = encodedString.charAt(i);
      final char v = encodedString.charAt(i + 1);
      for (int j = 0; j < n; ++j) {
        data[di++] = v;
      }
    }
    return data;
  }

  private static int decodedSize(String encodedString) {
    if (encodedString == null) {
      throw new MalformedTableException("encoded table is null");
    }
    if (encodedString.length() % 2 != 0) {
      throw new MalformedTableException(
          String.format(
              "encoded table length must be even, but was %d", encodedString.length()));
    }
    int size = 0;
    for (int i = 0; i < encodedString.length(); i += 2) {
      size += encodedString.charAt(i);
    }
    return size;
  }
}

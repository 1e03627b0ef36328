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
package io.isima.grammar.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import io.isima.grammar.stream.Token;
import org.junit.Test;

public class CommonTreeTest {

  private static final int PLUS = 4;
  private static final int MULT = 5;
  private static final int INT = 6;

  private final CommonTreeAdaptor adaptor = new CommonTreeAdaptor();

  @Test
  public void testToStringTree() {
    final var plus = adaptor.create(PLUS, "+");
    final var mult = adaptor.create(MULT, "*");
    plus.addChild(adaptor.create(INT, "1"));
    plus.addChild(mult);
    mult.addChild(adaptor.create(INT, "2"));
    mult.addChild(adaptor.create(INT, "3"));
    assertEquals("(+ 1 (* 2 3))", plus.toStringTree());
    assertSame(plus, mult.getParent());
    assertEquals(1, mult.getChildIndex());
  }

  @Test
  public void testNilChildrenAreFlattened() {
    final var list = adaptor.nil();
    list.addChild(adaptor.create(INT, "1"));
    list.addChild(adaptor.create(INT, "2"));
    assertEquals("1 2", list.toStringTree());

    final var plus = adaptor.create(PLUS, "+");
    plus.addChild(list);
    assertEquals(2, plus.getChildCount());
    assertSame(plus, plus.getChild(1).getParent());
    assertEquals(1, plus.getChild(1).getChildIndex());
  }

  @Test
  public void testSetChild() {
    final var plus = adaptor.create(PLUS, "+");
    plus.addChild(adaptor.create(INT, "1"));
    final var two = adaptor.create(INT, "2");
    adaptor.setChild(plus, 0, two);
    assertSame(two, plus.getChild(0));
    assertSame(plus, two.getParent());
    assertThrows(IllegalArgumentException.class, () -> plus.setChild(0, CommonTree.nil()));
    assertThrows(
        IndexOutOfBoundsException.class, () -> plus.setChild(1, adaptor.create(INT, "3")));
  }

  @Test
  public void testNilAndTypelessNodes() {
    final var nil = CommonTree.nil();
    assertTrue(nil.isNil());
    assertEquals(Token.INVALID_TOKEN_TYPE, nil.getType());
    assertNull(nil.getText());
    assertEquals("nil", nil.toString());
    assertEquals("<7>", new CommonTree(new Token(7)).toString());
    assertNull(nil.getChild(0));
    assertTrue(nil.getChildren().isEmpty());
  }

  @Test
  public void testAdaptorToleratesNull() {
    assertEquals(0, adaptor.getChildCount(null));
    assertNull(adaptor.getChild(null, 0));
    assertNull(adaptor.getText(null));
    assertNull(adaptor.getToken(null));
    assertEquals(Token.INVALID_TOKEN_TYPE, adaptor.getType(null));
  }
}

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

import io.isima.grammar.stream.Token;

public class CommonTreeAdaptor implements TreeAdaptor<CommonTree> {

  @Override
  public CommonTree create(Token payload) {
    return new CommonTree(payload);
  }

  /** Convenience for building trees by hand. */
  public CommonTree create(int tokenType, String text) {
    return new CommonTree(new Token(tokenType, text));
  }

  @Override
  public CommonTree nil() {
    return CommonTree.nil();
  }

  @Override
  public boolean isNil(CommonTree t) {
    return t.isNil();
  }

  @Override
  public void addChild(CommonTree t, CommonTree child) {
    if (t != null && child != null) {
      t.addChild(child);
    }
  }

  @Override
  public int getChildCount(CommonTree t) {
    return t == null ? 0 : t.getChildCount();
  }

  @Override
  public CommonTree getChild(CommonTree t, int i) {
    return t == null ? null : t.getChild(i);
  }

  @Override
  public void setChild(CommonTree t, int i, CommonTree child) {
    t.setChild(i, child);
  }

  @Override
  public int getType(CommonTree t) {
    return t == null ? Token.INVALID_TOKEN_TYPE : t.getType();
  }

  @Override
  public String getText(CommonTree t) {
    return t == null ? null : t.getText();
  }

  @Override
  public Token getToken(CommonTree t) {
    return t == null ? null : t.getToken();
  }
}

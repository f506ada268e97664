/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.deltapack.codec;

/**
 * Element types supported by {@link DeltaBlockCodec}. The codec runs the same algorithm for all of them; only the native width
 * {@code W} of deltas, zigzag values and raw words changes.
 *
 * @author DeltaPack developers
 */
public enum ElementType {
  INT32(Integer.SIZE),
  INT64(Long.SIZE),
  UINT64(Long.SIZE);

  private final int bits;

  ElementType(final int bits) {
    this.bits = bits;
  }

  /**
   * Native width {@code W} of the element, which is also the widest bit width a block of this type can require.
   */
  public int bits() {
    return bits;
  }

  /**
   * Tells if the encoder can produce a pack of {@code wordCount} words for this element type. 32-bit blocks never need more
   * than 32 bits per delta, so they never produce wider fixed-width packs nor raw packs.
   */
  public boolean canProduce(final int wordCount) {
    if (!PackLayout.isValidWordCount(wordCount))
      return false;
    return wordCount == PackLayout.RAW_WORD_COUNT ? bits > PackLayout.COMPACTION_THRESHOLD : wordCount <= bits;
  }
}

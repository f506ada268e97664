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

import com.deltapack.exception.ErrorCode;
import com.deltapack.exception.ExceptionBuilder;

/**
 * Kernel identity of a pack. The word count of a pack alone tells which kernel produced it, so packs carry no width field:
 * <ul>
 *   <li>0 words: {@link #ZERO_WIDTH}, every delta is zero</li>
 *   <li>1 to {@value #COMPACTION_THRESHOLD} words: {@link #FIXED_WIDTH}, the word count is the bit width</li>
 *   <li>{@value #RAW_WORD_COUNT} words: {@link #RAW}, one original value per word</li>
 * </ul>
 * Widths above the threshold all map to the same raw layout, so the exact width of a raw block is not recoverable and not
 * needed.
 *
 * @author DeltaPack developers
 */
public enum PackLayout {
  ZERO_WIDTH,
  FIXED_WIDTH,
  RAW;

  /**
   * Number of values in a block.
   */
  public static final int BLOCK_SIZE           = 64;
  /**
   * Widest bit width still bit-packed. Wider blocks are stored raw.
   */
  public static final int COMPACTION_THRESHOLD = 42;
  /**
   * Word count of a raw pack: one 64-bit word per value.
   */
  public static final int RAW_WORD_COUNT       = BLOCK_SIZE;

  /**
   * Returns the layout used to encode a block whose zigzag deltas need {@code bitN} bits.
   */
  public static PackLayout forWidth(final int bitN) {
    if (bitN < 0 || bitN > Long.SIZE)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BIT_WIDTH)
          .message("Bit width %d is outside [0, %d]", bitN, Long.SIZE)
          .context("bitWidth", bitN)
          .build();

    if (bitN == 0)
      return ZERO_WIDTH;
    return bitN <= COMPACTION_THRESHOLD ? FIXED_WIDTH : RAW;
  }

  /**
   * Returns the number of 64-bit words of the pack of a block whose zigzag deltas need {@code bitN} bits: 0, {@code bitN} or
   * {@value #RAW_WORD_COUNT}.
   */
  public static int wordCount(final int bitN) {
    return switch (forWidth(bitN)) {
      case ZERO_WIDTH -> 0;
      case FIXED_WIDTH -> bitN;
      case RAW -> RAW_WORD_COUNT;
    };
  }

  public static boolean isValidWordCount(final int wordCount) {
    return (wordCount >= 0 && wordCount <= COMPACTION_THRESHOLD) || wordCount == RAW_WORD_COUNT;
  }

  /**
   * Infers the kernel that produced a pack of {@code wordCount} words.
   *
   * @throws com.deltapack.exception.DecodingException if no kernel produces that many words
   */
  public static PackLayout fromWordCount(final int wordCount) {
    return fromWordCount(wordCount, null);
  }

  /**
   * Same as {@link #fromWordCount(int)}, reporting {@code elementType} in the error context.
   */
  public static PackLayout fromWordCount(final int wordCount, final ElementType elementType) {
    if (!isValidWordCount(wordCount))
      throw ExceptionBuilder.decoding()
          .code(ErrorCode.MALFORMED_PACK)
          .message("Pack of %d words does not match any kernel (expected 0, 1..%d or %d words)", wordCount, COMPACTION_THRESHOLD,
              RAW_WORD_COUNT)
          .context("wordCount", wordCount)
          .context("elementType", elementType)
          .build();

    if (wordCount == 0)
      return ZERO_WIDTH;
    return wordCount == RAW_WORD_COUNT ? RAW : FIXED_WIDTH;
  }
}

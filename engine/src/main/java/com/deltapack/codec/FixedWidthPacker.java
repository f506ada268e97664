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
import org.eclipse.collections.api.list.primitive.LongList;
import org.eclipse.collections.api.list.primitive.MutableLongList;

/**
 * Fixed-width packing of a block of 64 unsigned values into {@code bitWidth} 64-bit words.
 * <p>
 * The block is written as one contiguous little-endian bitstream: stream bit {@code k} is bit {@code k % 64} (bit 0 being the
 * least significant) of word {@code k / 64}, and value {@code i} occupies stream bits {@code [i * bitWidth, (i + 1) * bitWidth)},
 * least significant bit first. Value 0 therefore sits in the low bits of word 0. A value crossing a word boundary keeps its low
 * bits at the top of one word and its high bits at the bottom of the next one.
 * <p>
 * 64 values of {@code bitWidth} bits are exactly {@code bitWidth} words, with no padding, which is what lets the decoder infer the
 * width from the word count alone.
 *
 * @see PackLayout
 *
 * @author DeltaPack developers
 */
public final class FixedWidthPacker {

  public static final int MIN_BIT_WIDTH = 1;
  public static final int MAX_BIT_WIDTH = Long.SIZE;

  private FixedWidthPacker() {
  }

  /**
   * Appends the {@code bitWidth} words packing the 64 {@code values} to {@code dst}. Every value must be lower than
   * {@code 2^bitWidth} when read as unsigned.
   */
  public static void pack(final long[] values, final int bitWidth, final MutableLongList dst) {
    checkBitWidth(bitWidth);
    checkBlock(values, "values");

    final long mask = mask(bitWidth);
    long or = 0;
    for (final long v : values)
      or |= v;
    if ((or & ~mask) != 0)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.VALUE_OUT_OF_RANGE)
          .message("Values do not fit in %d bits (highest bit set is %d)", bitWidth, BitWidth.bitsRequired(or))
          .context("bitWidth", bitWidth)
          .build();

    long word = 0;
    int used = 0;
    for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
      final long v = values[i];
      word |= v << used;
      used += bitWidth;
      if (used >= Long.SIZE) {
        dst.add(word);
        used -= Long.SIZE;
        // CARRY THE HIGH BITS THAT DID NOT FIT. A SHIFT BY 64 IS A NO-OP IN JAVA, HENCE THE ZERO CASE
        word = used == 0 ? 0 : v >>> (bitWidth - used);
      }
    }
  }

  /**
   * Reads the {@code bitWidth} words starting at {@code from} and writes the 64 unpacked values into {@code dst[0..63]}.
   */
  public static void unpack(final LongList words, final int from, final int bitWidth, final long[] dst) {
    checkBitWidth(bitWidth);
    checkBlock(dst, "dst");
    if (words == null || from < 0 || bitWidth > words.size() - from)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BLOCK_SIZE)
          .message("Unpacking %d bits per value needs %d words from offset %d, available %s", bitWidth, bitWidth, from,
              words == null ? "null" : words.size())
          .context("bitWidth", bitWidth)
          .build();

    final long mask = mask(bitWidth);
    final int end = from + bitWidth;

    int wordIndex = from;
    long word = words.get(wordIndex++);
    int bitPos = 0;
    for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
      long v = word >>> bitPos;
      bitPos += bitWidth;
      if (bitPos >= Long.SIZE) {
        bitPos -= Long.SIZE;
        if (wordIndex < end) {
          word = words.get(wordIndex++);
          if (bitPos > 0)
            v |= word << (bitWidth - bitPos);
        }
      }
      dst[i] = v & mask;
    }
  }

  static long mask(final int bitWidth) {
    return bitWidth == Long.SIZE ? -1L : (1L << bitWidth) - 1;
  }

  private static void checkBitWidth(final int bitWidth) {
    if (bitWidth < MIN_BIT_WIDTH || bitWidth > MAX_BIT_WIDTH)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BIT_WIDTH)
          .message("Fixed-width kernels support %d to %d bits, got %d", MIN_BIT_WIDTH, MAX_BIT_WIDTH, bitWidth)
          .context("bitWidth", bitWidth)
          .build();
  }

  private static void checkBlock(final long[] block, final String name) {
    if (block == null || block.length != PackLayout.BLOCK_SIZE)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BLOCK_SIZE)
          .message("'%s' must hold exactly %d values, got %s", name, PackLayout.BLOCK_SIZE, block == null ? "null" : block.length)
          .build();
  }
}

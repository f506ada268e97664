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

import com.deltapack.GlobalConfiguration;
import com.deltapack.exception.ErrorCode;
import com.deltapack.exception.ExceptionBuilder;
import com.deltapack.log.LogManager;
import org.eclipse.collections.api.list.primitive.LongList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.list.primitive.MutableLongList;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;

import java.util.logging.Level;

/**
 * Delta/zigzag bit-packing codec for blocks of {@value PackLayout#BLOCK_SIZE} integers.
 * <p>
 * Encoding computes the wrapping differences {@code previous - current} of the block, starting from a baseline (the value
 * preceding the block in the stream), maps them through {@link ZigZag}, selects the minimal bit width with {@link BitWidth} and
 * then appends:
 * <ul>
 *   <li>no word when every delta is zero,</li>
 *   <li>{@code bitN} words of {@link FixedWidthPacker} output when {@code bitN <= }{@value PackLayout#COMPACTION_THRESHOLD},</li>
 *   <li>the {@value PackLayout#RAW_WORD_COUNT} original values otherwise, one per word, with no delta applied.</li>
 * </ul>
 * Decoding infers the kernel from the number of words ({@link PackLayout#fromWordCount(int, ElementType)}) and rebuilds the block
 * by subtracting the decoded differences one after the other from the baseline, with wrapping arithmetic, except for raw packs
 * which hold the values themselves.
 * <p>
 * Packs are not self-delimiting: framing several blocks in one stream and chaining baselines (the baseline of a block is
 * usually the last value of the previous one) is up to the caller. All the methods are stateless and thread safe as long as
 * concurrent calls do not share an output buffer.
 *
 * @see PackLayout
 *
 * @author DeltaPack developers
 */
public final class DeltaBlockCodec {

  private DeltaBlockCodec() {
  }

  // ---------------------------------------------------------------------------------------------------------------- ENCODING

  /**
   * Encodes a block of 32-bit signed integers, appending the pack to {@code dst}.
   *
   * @param dst      buffer the pack is appended to, its content is preserved. If null a new list is created
   * @param block    exactly 64 values
   * @param baseline value preceding the block in the stream
   *
   * @return the buffer the pack was appended to
   */
  public static MutableLongList encode(MutableLongList dst, final int[] block, final int baseline) {
    final long[] zigzag = new long[PackLayout.BLOCK_SIZE];
    zigzagDeltas(block, baseline, zigzag);

    final int bitN = BitWidth.select(zigzag);
    final PackLayout layout = PackLayout.forWidth(bitN);

    if (dst == null)
      dst = new LongArrayList(PackLayout.wordCount(bitN));

    switch (layout) {
    case ZERO_WIDTH:
      break;
    case FIXED_WIDTH:
      FixedWidthPacker.pack(zigzag, bitN, dst);
      break;
    case RAW:
      // SIGN-EXTENDED
      for (final int v : block)
        dst.add(v);
      break;
    }

    traceEncoding(ElementType.INT32, bitN, layout);
    return dst;
  }

  /**
   * Encodes a block of 64-bit signed integers, appending the pack to {@code dst}.
   *
   * @see #encode(MutableLongList, int[], int)
   */
  public static MutableLongList encode(final MutableLongList dst, final long[] block, final long baseline) {
    return encode64(dst, block, baseline, ElementType.INT64);
  }

  /**
   * Encodes a block of 64-bit unsigned integers, appending the pack to {@code dst}. Values are Java {@code long}s read as
   * unsigned; the wrapping arithmetic is the same as for signed values.
   *
   * @see #encode(MutableLongList, int[], int)
   */
  public static MutableLongList encodeUnsigned(final MutableLongList dst, final long[] block, final long baseline) {
    return encode64(dst, block, baseline, ElementType.UINT64);
  }

  /**
   * Returns the bit width the zigzag deltas of the block need, in {@code [0, 32]}.
   */
  public static int requiredWidth(final int[] block, final int baseline) {
    final long[] zigzag = new long[PackLayout.BLOCK_SIZE];
    zigzagDeltas(block, baseline, zigzag);
    return BitWidth.select(zigzag);
  }

  /**
   * Returns the bit width the zigzag deltas of the block need, in {@code [0, 64]}. Valid for signed and unsigned blocks.
   */
  public static int requiredWidth(final long[] block, final long baseline) {
    final long[] zigzag = new long[PackLayout.BLOCK_SIZE];
    zigzagDeltas(block, baseline, zigzag);
    return BitWidth.select(zigzag);
  }

  /**
   * Returns the number of words {@link #encode(MutableLongList, int[], int)} appends for the block.
   */
  public static int encodedWordCount(final int[] block, final int baseline) {
    return PackLayout.wordCount(requiredWidth(block, baseline));
  }

  /**
   * Returns the number of words the 64-bit encoders append for the block.
   */
  public static int encodedWordCount(final long[] block, final long baseline) {
    return PackLayout.wordCount(requiredWidth(block, baseline));
  }

  // ---------------------------------------------------------------------------------------------------------------- DECODING

  /**
   * Decodes the pack of a block of 32-bit signed integers, appending the 64 values to {@code dst}.
   *
   * @param dst      buffer the values are appended to, its content is preserved. If null a new list is created
   * @param pack     the words of exactly one block
   * @param baseline the baseline used to encode the block
   *
   * @return the buffer the values were appended to
   *
   * @throws com.deltapack.exception.DecodingException if the word count does not match any kernel
   */
  public static MutableIntList decode(final MutableIntList dst, final LongList pack, final int baseline) {
    return decode(dst, pack, 0, pack == null ? 0 : pack.size(), baseline);
  }

  /**
   * Decodes the block packed in {@code words[from, from + length)}, appending the 64 values to {@code dst}.
   */
  public static MutableIntList decode(MutableIntList dst, final LongList words, final int from, final int length, final int baseline) {
    final int[] values = new int[PackLayout.BLOCK_SIZE];
    decode(words, from, length, baseline, values, 0);

    if (dst == null)
      dst = new IntArrayList(PackLayout.BLOCK_SIZE);
    dst.addAll(values);
    return dst;
  }

  /**
   * Decodes the block packed in {@code words[from, from + length)} into {@code output[outputOffset, outputOffset + 64)}.
   *
   * @return the number of decoded values, always 64
   */
  public static int decode(final LongList words, final int from, final int length, final int baseline, final int[] output,
      final int outputOffset) {
    checkSlice(words, from, length);
    checkOutput(output == null ? -1 : output.length, outputOffset);

    final PackLayout layout = PackLayout.fromWordCount(length, ElementType.INT32);
    final boolean strict = GlobalConfiguration.CODEC_STRICT_DECODE.getValueAsBoolean();

    switch (layout) {
    case ZERO_WIDTH:
      for (int i = 0; i < PackLayout.BLOCK_SIZE; i++)
        output[outputOffset + i] = baseline;
      break;

    case FIXED_WIDTH: {
      if (strict && !ElementType.INT32.canProduce(length))
        throw ExceptionBuilder.decoding()
            .code(ErrorCode.CORRUPTED_PACK)
            .message("%d-bit blocks are never packed with %d bits per value", ElementType.INT32.bits(), length)
            .context("wordCount", length)
            .context("elementType", ElementType.INT32)
            .build();

      final long[] zigzag = new long[PackLayout.BLOCK_SIZE];
      FixedWidthPacker.unpack(words, from, length, zigzag);

      int value = baseline;
      for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
        value -= ZigZag.decode((int) zigzag[i]);
        output[outputOffset + i] = value;
      }
      break;
    }

    case RAW:
      for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
        final long word = words.get(from + i);
        if (strict && word != (int) word)
          throw ExceptionBuilder.decoding()
              .code(ErrorCode.CORRUPTED_PACK)
              .message("Raw word %d (0x%016x) is not a sign-extended 32-bit value", i, word)
              .context("wordIndex", i)
              .context("elementType", ElementType.INT32)
              .build();
        output[outputOffset + i] = (int) word;
      }
      break;
    }

    traceDecoding(ElementType.INT32, length, layout);
    return PackLayout.BLOCK_SIZE;
  }

  /**
   * Decodes the pack of a block of 64-bit signed integers, appending the 64 values to {@code dst}.
   *
   * @see #decode(MutableIntList, LongList, int)
   */
  public static MutableLongList decode(final MutableLongList dst, final LongList pack, final long baseline) {
    return decode64(dst, pack, 0, pack == null ? 0 : pack.size(), baseline, ElementType.INT64);
  }

  /**
   * Decodes the block of 64-bit signed integers packed in {@code words[from, from + length)}, appending the 64 values to
   * {@code dst}.
   */
  public static MutableLongList decode(final MutableLongList dst, final LongList words, final int from, final int length,
      final long baseline) {
    return decode64(dst, words, from, length, baseline, ElementType.INT64);
  }

  /**
   * Decodes the block of 64-bit signed integers packed in {@code words[from, from + length)} into
   * {@code output[outputOffset, outputOffset + 64)}.
   *
   * @return the number of decoded values, always 64
   */
  public static int decode(final LongList words, final int from, final int length, final long baseline, final long[] output,
      final int outputOffset) {
    return decode64(words, from, length, baseline, output, outputOffset, ElementType.INT64);
  }

  /**
   * Decodes the pack of a block of 64-bit unsigned integers, appending the 64 values to {@code dst}.
   *
   * @see #decode(MutableIntList, LongList, int)
   */
  public static MutableLongList decodeUnsigned(final MutableLongList dst, final LongList pack, final long baseline) {
    return decode64(dst, pack, 0, pack == null ? 0 : pack.size(), baseline, ElementType.UINT64);
  }

  /**
   * Decodes the block of 64-bit unsigned integers packed in {@code words[from, from + length)}, appending the 64 values to
   * {@code dst}.
   */
  public static MutableLongList decodeUnsigned(final MutableLongList dst, final LongList words, final int from, final int length,
      final long baseline) {
    return decode64(dst, words, from, length, baseline, ElementType.UINT64);
  }

  /**
   * Decodes the block of 64-bit unsigned integers packed in {@code words[from, from + length)} into
   * {@code output[outputOffset, outputOffset + 64)}.
   *
   * @return the number of decoded values, always 64
   */
  public static int decodeUnsigned(final LongList words, final int from, final int length, final long baseline, final long[] output,
      final int outputOffset) {
    return decode64(words, from, length, baseline, output, outputOffset, ElementType.UINT64);
  }

  // ---------------------------------------------------------------------------------------------------------------- INTERNALS

  private static MutableLongList encode64(MutableLongList dst, final long[] block, final long baseline, final ElementType type) {
    final long[] zigzag = new long[PackLayout.BLOCK_SIZE];
    zigzagDeltas(block, baseline, zigzag);

    final int bitN = BitWidth.select(zigzag);
    final PackLayout layout = PackLayout.forWidth(bitN);

    if (dst == null)
      dst = new LongArrayList(PackLayout.wordCount(bitN));

    switch (layout) {
    case ZERO_WIDTH:
      break;
    case FIXED_WIDTH:
      FixedWidthPacker.pack(zigzag, bitN, dst);
      break;
    case RAW:
      dst.addAll(block);
      break;
    }

    traceEncoding(type, bitN, layout);
    return dst;
  }

  private static MutableLongList decode64(MutableLongList dst, final LongList words, final int from, final int length,
      final long baseline, final ElementType type) {
    final long[] values = new long[PackLayout.BLOCK_SIZE];
    decode64(words, from, length, baseline, values, 0, type);

    if (dst == null)
      dst = new LongArrayList(PackLayout.BLOCK_SIZE);
    dst.addAll(values);
    return dst;
  }

  private static int decode64(final LongList words, final int from, final int length, final long baseline, final long[] output,
      final int outputOffset, final ElementType type) {
    checkSlice(words, from, length);
    checkOutput(output == null ? -1 : output.length, outputOffset);

    final PackLayout layout = PackLayout.fromWordCount(length, type);
    switch (layout) {
    case ZERO_WIDTH:
      for (int i = 0; i < PackLayout.BLOCK_SIZE; i++)
        output[outputOffset + i] = baseline;
      break;

    case FIXED_WIDTH: {
      final long[] zigzag = new long[PackLayout.BLOCK_SIZE];
      FixedWidthPacker.unpack(words, from, length, zigzag);

      long value = baseline;
      for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
        value -= ZigZag.decode(zigzag[i]);
        output[outputOffset + i] = value;
      }
      break;
    }

    case RAW:
      for (int i = 0; i < PackLayout.BLOCK_SIZE; i++)
        output[outputOffset + i] = words.get(from + i);
      break;
    }

    traceDecoding(type, length, layout);
    return PackLayout.BLOCK_SIZE;
  }

  static void zigzagDeltas(final int[] block, final int baseline, final long[] zigzag) {
    checkBlock(block == null ? -1 : block.length);

    int previous = baseline;
    for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
      final int v = block[i];
      // 32-BIT WRAPPING DIFFERENCE, CARRIED AS UNSIGNED IN THE LOW HALF OF THE LONG
      zigzag[i] = Integer.toUnsignedLong(ZigZag.encode(previous - v));
      previous = v;
    }
  }

  static void zigzagDeltas(final long[] block, final long baseline, final long[] zigzag) {
    checkBlock(block == null ? -1 : block.length);

    long previous = baseline;
    for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
      final long v = block[i];
      zigzag[i] = ZigZag.encode(previous - v);
      previous = v;
    }
  }

  private static void checkBlock(final int length) {
    if (length != PackLayout.BLOCK_SIZE)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BLOCK_SIZE)
          .message("A block must hold exactly %d values, got %s", PackLayout.BLOCK_SIZE, length < 0 ? "null" : length)
          .build();
  }

  private static void checkOutput(final int outputLength, final int outputOffset) {
    if (outputLength < 0 || outputOffset < 0 || outputOffset > outputLength - PackLayout.BLOCK_SIZE)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BLOCK_SIZE)
          .message("Output needs room for %d values from offset %d, its length is %s", PackLayout.BLOCK_SIZE, outputOffset,
              outputLength < 0 ? "null" : outputLength)
          .build();
  }

  private static void checkSlice(final LongList words, final int from, final int length) {
    if (words == null || from < 0 || length < 0 || length > words.size() - from)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BLOCK_SIZE)
          .message("Slice of %d words from offset %d is outside the %s available words", length, from, words == null ? "null" : words.size())
          .build();
  }

  private static void traceEncoding(final ElementType type, final int bitN, final PackLayout layout) {
    if (LogManager.instance().isDebugEnabled())
      LogManager.instance()
          .log(DeltaBlockCodec.class, Level.FINE, "Encoded %s block: width=%d layout=%s words=%d", type, bitN, layout, PackLayout.wordCount(bitN));
  }

  private static void traceDecoding(final ElementType type, final int wordCount, final PackLayout layout) {
    if (LogManager.instance().isDebugEnabled())
      LogManager.instance().log(DeltaBlockCodec.class, Level.FINE, "Decoded %s block: words=%d layout=%s", type, wordCount, layout);
  }
}

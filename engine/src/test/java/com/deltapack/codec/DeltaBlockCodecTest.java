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
import com.deltapack.exception.DecodingException;
import com.deltapack.exception.ErrorCode;
import com.deltapack.exception.InvalidBlockException;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.list.primitive.MutableLongList;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DeltaBlockCodecTest {

  @AfterEach
  void resetConfiguration() {
    GlobalConfiguration.CODEC_STRICT_DECODE.reset();
  }

  @Test
  void testIncrementingCounterFitsOneBit() {
    final int baseline = -10;
    final int[] input = new int[PackLayout.BLOCK_SIZE];
    for (int i = 0; i < input.length; i++)
      input[i] = baseline + i + 1;

    final MutableLongList pack = DeltaBlockCodec.encode(new LongArrayList(), input, baseline);
    assertThat(pack.toArray()).containsExactly(0xFFFFFFFFFFFFFFFFL);

    final MutableIntList decoded = DeltaBlockCodec.decode(new IntArrayList(), pack, baseline);
    assertThat(decoded.toArray()).containsExactly(input);
  }

  @Test
  void testDecrementingCounterFitsTwoBits() {
    final long baseline = 10;
    final long[] input = new long[PackLayout.BLOCK_SIZE];
    for (int i = 0; i < input.length; i++)
      input[i] = baseline - (i + 1);

    final MutableLongList pack = DeltaBlockCodec.encode(new LongArrayList(), input, baseline);
    assertThat(pack.toArray()).containsExactly(0xAAAAAAAAAAAAAAAAL, 0xAAAAAAAAAAAAAAAAL);

    final MutableLongList decoded = DeltaBlockCodec.decode(new LongArrayList(), pack, baseline);
    assertThat(decoded.toArray()).containsExactly(input);
    assertThat(decoded.getLast()).isEqualTo(-54L);
  }

  @Test
  void testConstantBlockEncodesToNothing() {
    final int[] ints = new int[PackLayout.BLOCK_SIZE];
    Arrays.fill(ints, 1234);
    assertThat(DeltaBlockCodec.encode(new LongArrayList(), ints, 1234).isEmpty()).isTrue();
    assertThat(DeltaBlockCodec.decode(new IntArrayList(), new LongArrayList(), 1234).toArray()).containsExactly(ints);

    final long[] longs = new long[PackLayout.BLOCK_SIZE];
    Arrays.fill(longs, Long.MIN_VALUE);
    assertThat(DeltaBlockCodec.encode(new LongArrayList(), longs, Long.MIN_VALUE).isEmpty()).isTrue();
    assertThat(DeltaBlockCodec.decode(new LongArrayList(), new LongArrayList(), Long.MIN_VALUE).toArray()).containsExactly(longs);

    Arrays.fill(longs, -1L);
    assertThat(DeltaBlockCodec.encodeUnsigned(new LongArrayList(), longs, -1L).isEmpty()).isTrue();
    assertThat(DeltaBlockCodec.decodeUnsigned(new LongArrayList(), new LongArrayList(), -1L).toArray()).containsExactly(longs);
  }

  @Test
  void testConstantBlockAfterDifferentBaselineIsNotEmpty() {
    final int[] ints = new int[PackLayout.BLOCK_SIZE];
    Arrays.fill(ints, 7);

    // only the first delta is not zero: 0 - 7 = -7, zigzag 13, 4 bits
    assertThat(DeltaBlockCodec.requiredWidth(ints, 0)).isEqualTo(4);
    final MutableLongList pack = DeltaBlockCodec.encode(new LongArrayList(), ints, 0);
    assertThat(pack.toArray()).containsExactly(13L, 0L, 0L, 0L);
    assertThat(DeltaBlockCodec.decode(new IntArrayList(), pack, 0).toArray()).containsExactly(ints);
  }

  @Test
  void testRandomFullWidthFallsBackToRaw() {
    final Random random = new Random(42);
    final long[] input = new long[PackLayout.BLOCK_SIZE];
    for (int i = 0; i < input.length; i++)
      input[i] = random.nextLong();
    final long baseline = random.nextLong();

    final MutableLongList pack = DeltaBlockCodec.encode(new LongArrayList(), input, baseline);
    assertThat(pack.size()).isEqualTo(PackLayout.RAW_WORD_COUNT);
    // raw words are the values themselves
    assertThat(pack.toArray()).containsExactly(input);
    assertThat(DeltaBlockCodec.decode(new LongArrayList(), pack, baseline).toArray()).containsExactly(input);

    final MutableLongList unsignedPack = DeltaBlockCodec.encodeUnsigned(new LongArrayList(), input, baseline);
    assertThat(unsignedPack).isEqualTo(pack);
    assertThat(DeltaBlockCodec.decodeUnsigned(new LongArrayList(), unsignedPack, baseline).toArray()).containsExactly(input);

    // raw packs do not depend on the baseline
    assertThat(DeltaBlockCodec.decode(new LongArrayList(), pack, 0L).toArray()).containsExactly(input);
  }

  @Test
  void testThresholdBoundary() {
    final RandomBlocks random = new RandomBlocks(42);
    final long baseline = random.nextLong();

    final long[] atThreshold = random.longBlock(baseline, PackLayout.COMPACTION_THRESHOLD);
    assertThat(DeltaBlockCodec.requiredWidth(atThreshold, baseline)).isEqualTo(42);
    final MutableLongList packed = DeltaBlockCodec.encode(new LongArrayList(), atThreshold, baseline);
    assertThat(packed.size()).isEqualTo(42);
    assertThat(DeltaBlockCodec.decode(new LongArrayList(), packed, baseline).toArray()).containsExactly(atThreshold);

    final long[] aboveThreshold = random.longBlock(baseline, PackLayout.COMPACTION_THRESHOLD + 1);
    assertThat(DeltaBlockCodec.requiredWidth(aboveThreshold, baseline)).isEqualTo(43);
    final MutableLongList raw = DeltaBlockCodec.encode(new LongArrayList(), aboveThreshold, baseline);
    assertThat(raw.size()).isEqualTo(64);
    assertThat(raw.toArray()).containsExactly(aboveThreshold);
    assertThat(DeltaBlockCodec.decode(new LongArrayList(), raw, baseline).toArray()).containsExactly(aboveThreshold);
  }

  @Test
  void testWrapAroundAtTypeLimits() {
    final int[] ints = new int[PackLayout.BLOCK_SIZE];
    final long[] longs = new long[PackLayout.BLOCK_SIZE];
    for (int i = 0; i < PackLayout.BLOCK_SIZE; i++) {
      ints[i] = i % 2 == 0 ? Integer.MAX_VALUE : Integer.MIN_VALUE;
      longs[i] = i % 2 == 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
    }

    // MIN - MAX wraps to 1 and MAX - MIN to -1: two bits are enough
    assertThat(DeltaBlockCodec.requiredWidth(ints, Integer.MIN_VALUE)).isEqualTo(2);
    assertThat(DeltaBlockCodec.requiredWidth(longs, Long.MIN_VALUE)).isEqualTo(2);

    for (final int baseline : new int[] { Integer.MIN_VALUE, Integer.MAX_VALUE, 0, -1 }) {
      final MutableLongList pack = DeltaBlockCodec.encode(new LongArrayList(), ints, baseline);
      assertThat(DeltaBlockCodec.decode(new IntArrayList(), pack, baseline).toArray()).as("baseline %d", baseline).containsExactly(ints);
    }

    for (final long baseline : new long[] { Long.MIN_VALUE, Long.MAX_VALUE, 0L, -1L }) {
      final MutableLongList pack = DeltaBlockCodec.encode(new LongArrayList(), longs, baseline);
      assertThat(DeltaBlockCodec.decode(new LongArrayList(), pack, baseline).toArray()).as("baseline %d", baseline).containsExactly(longs);

      final MutableLongList unsignedPack = DeltaBlockCodec.encodeUnsigned(new LongArrayList(), longs, baseline);
      assertThat(DeltaBlockCodec.decodeUnsigned(new LongArrayList(), unsignedPack, baseline).toArray()).containsExactly(longs);
    }
  }

  @Test
  void testUnsignedExtremes() {
    // 0 and 2^64 - 1 are neighbours modulo 2^64
    final long[] block = new long[PackLayout.BLOCK_SIZE];
    for (int i = 0; i < block.length; i++)
      block[i] = i % 2 == 0 ? 0xFFFFFFFFFFFFFFFFL : 0L;

    final MutableLongList pack = DeltaBlockCodec.encodeUnsigned(new LongArrayList(), block, 0L);
    assertThat(pack.size()).isEqualTo(2);
    assertThat(DeltaBlockCodec.decodeUnsigned(new LongArrayList(), pack, 0L).toArray()).containsExactly(block);
  }

  @Test
  void testBlocksAppendToOneStream() {
    final RandomBlocks random = new RandomBlocks(7);
    final int[] widths = { 0, 5, 64, 42, 17 };

    final MutableLongList stream = LongArrayList.newListWith(-1L);
    final long[][] blocks = new long[widths.length][];
    final int[] offsets = new int[widths.length + 1];
    offsets[0] = stream.size();

    long baseline = 100;
    for (int b = 0; b < widths.length; b++) {
      blocks[b] = random.longBlock(baseline, widths[b]);
      assertThat(DeltaBlockCodec.encode(stream, blocks[b], baseline)).isSameAs(stream);
      offsets[b + 1] = stream.size();
      baseline = blocks[b][PackLayout.BLOCK_SIZE - 1];
    }

    // previous content is preserved
    assertThat(stream.get(0)).isEqualTo(-1L);

    final MutableLongList decoded = new LongArrayList();
    baseline = 100;
    for (int b = 0; b < widths.length; b++) {
      final int length = offsets[b + 1] - offsets[b];
      assertThat(length).isEqualTo(PackLayout.wordCount(widths[b]));
      DeltaBlockCodec.decode(decoded, stream, offsets[b], length, baseline);
      baseline = decoded.getLast();
    }

    assertThat(decoded.size()).isEqualTo(widths.length * PackLayout.BLOCK_SIZE);
    for (int b = 0; b < widths.length; b++)
      for (int i = 0; i < PackLayout.BLOCK_SIZE; i++)
        assertThat(decoded.get(b * PackLayout.BLOCK_SIZE + i)).isEqualTo(blocks[b][i]);
  }

  @Test
  void testDecodeIntoArrays() {
    final RandomBlocks random = new RandomBlocks(11);

    final int[] ints = random.intBlock(3, 9);
    final MutableLongList intPack = DeltaBlockCodec.encode(new LongArrayList(), ints, 3);
    final int[] intOutput = new int[PackLayout.BLOCK_SIZE + 10];
    assertThat(DeltaBlockCodec.decode(intPack, 0, intPack.size(), 3, intOutput, 10)).isEqualTo(PackLayout.BLOCK_SIZE);
    assertThat(Arrays.copyOfRange(intOutput, 10, intOutput.length)).containsExactly(ints);
    assertThat(Arrays.copyOfRange(intOutput, 0, 10)).containsOnly(0);

    final long[] longs = random.longBlock(-3L, 30);
    final MutableLongList longPack = DeltaBlockCodec.encode(new LongArrayList(), longs, -3L);
    final long[] longOutput = new long[PackLayout.BLOCK_SIZE];
    DeltaBlockCodec.decode(longPack, 0, longPack.size(), -3L, longOutput, 0);
    assertThat(longOutput).containsExactly(longs);

    final long[] unsignedOutput = new long[PackLayout.BLOCK_SIZE];
    DeltaBlockCodec.decodeUnsigned(longPack, 0, longPack.size(), -3L, unsignedOutput, 0);
    assertThat(unsignedOutput).containsExactly(longs);

    final InvalidBlockException e = catchThrowableOfType(() -> DeltaBlockCodec.decode(longPack, 0, longPack.size(), -3L, new long[70], 7),
        InvalidBlockException.class);
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_BLOCK_SIZE);
  }

  @Test
  void testNullDestinationAllocates() {
    final long[] block = new RandomBlocks(5).longBlock(0L, 12);
    final MutableLongList nullWords = null;
    final MutableLongList pack = DeltaBlockCodec.encode(nullWords, block, 0L);
    assertThat(pack.size()).isEqualTo(12);

    final MutableLongList nullValues = null;
    assertThat(DeltaBlockCodec.decode(nullValues, pack, 0L).toArray()).containsExactly(block);
  }

  @Test
  void testMalformedPack() {
    for (final int words : new int[] { 43, 50, 63, 65 }) {
      final MutableLongList pack = new LongArrayList();
      for (int i = 0; i < words; i++)
        pack.add(i);

      final DecodingException e = catchThrowableOfType(() -> DeltaBlockCodec.decode(new LongArrayList(), pack, 0L), DecodingException.class);
      assertThat(e).as("%d words", words).isNotNull();
      assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MALFORMED_PACK);
      assertThat(e.getContext()).containsEntry("wordCount", words).containsEntry("elementType", ElementType.INT64);

      final DecodingException e32 = catchThrowableOfType(() -> DeltaBlockCodec.decode(new IntArrayList(), pack, 0), DecodingException.class);
      assertThat(e32.getContext()).containsEntry("elementType", ElementType.INT32);
    }
  }

  @Test
  void testFailedDecodeLeavesDestinationUntouched() {
    final MutableIntList dst = IntArrayList.newListWith(1, 2, 3);
    final MutableLongList pack = new LongArrayList();
    for (int i = 0; i < 50; i++)
      pack.add(i);

    catchThrowableOfType(() -> DeltaBlockCodec.decode(dst, pack, 0), DecodingException.class);
    assertThat(dst.toArray()).containsExactly(1, 2, 3);
  }

  @Test
  void testWrongBlockSize() {
    final InvalidBlockException e = catchThrowableOfType(() -> DeltaBlockCodec.encode(new LongArrayList(), new int[63], 0),
        InvalidBlockException.class);
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_BLOCK_SIZE);

    final long[] nullBlock = null;
    final InvalidBlockException e2 = catchThrowableOfType(() -> DeltaBlockCodec.encodeUnsigned(new LongArrayList(), nullBlock, 0L),
        InvalidBlockException.class);
    assertThat(e2.getErrorCode()).isEqualTo(ErrorCode.INVALID_BLOCK_SIZE);
  }

  @Test
  void testSliceOutsideWords() {
    final MutableLongList words = LongArrayList.newListWith(1L, 2L);
    final InvalidBlockException e = catchThrowableOfType(() -> DeltaBlockCodec.decode(new LongArrayList(), words, 1, 2, 0L),
        InvalidBlockException.class);
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_BLOCK_SIZE);
  }

  @Test
  void testOffsetsNearIntegerLimit() {
    final MutableLongList words = LongArrayList.newListWith(1L, 2L);

    final InvalidBlockException e = catchThrowableOfType(() -> DeltaBlockCodec.decode(new LongArrayList(), words, Integer.MAX_VALUE, 1, 0L),
        InvalidBlockException.class);
    assertThat(e).isNotNull();
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_BLOCK_SIZE);

    final MutableLongList raw = new LongArrayList();
    for (int i = 0; i < PackLayout.RAW_WORD_COUNT; i++)
      raw.add(i);
    final InvalidBlockException e2 = catchThrowableOfType(
        () -> DeltaBlockCodec.decode(new IntArrayList(), raw, Integer.MAX_VALUE - 10, PackLayout.RAW_WORD_COUNT, 0), InvalidBlockException.class);
    assertThat(e2).isNotNull();
    assertThat(e2.getErrorCode()).isEqualTo(ErrorCode.INVALID_BLOCK_SIZE);

    final InvalidBlockException e3 = catchThrowableOfType(
        () -> DeltaBlockCodec.decode(raw, 0, PackLayout.RAW_WORD_COUNT, 0L, new long[PackLayout.BLOCK_SIZE], Integer.MAX_VALUE - 10),
        InvalidBlockException.class);
    assertThat(e3).isNotNull();
    assertThat(e3.getErrorCode()).isEqualTo(ErrorCode.INVALID_BLOCK_SIZE);
  }

  @Test
  void testStrictDecodeAcceptsEvery32BitWidth() {
    GlobalConfiguration.CODEC_STRICT_DECODE.setValue(true);

    final MutableLongList words = new LongArrayList();
    for (int i = 0; i < Integer.SIZE; i++)
      words.add(0L);
    assertThat(DeltaBlockCodec.decode(new IntArrayList(), words, 5).toArray()).containsOnly(5);

    words.add(0L);
    final DecodingException e = catchThrowableOfType(() -> DeltaBlockCodec.decode(new IntArrayList(), words, 5), DecodingException.class);
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CORRUPTED_PACK);
    assertThat(e.getMessage()).isEqualTo("32-bit blocks are never packed with 33 bits per value");
  }

  @Test
  void testLenientDecodeTruncatesTo32Bits() {
    final MutableLongList raw = new LongArrayList();
    for (int i = 0; i < PackLayout.RAW_WORD_COUNT; i++)
      raw.add((1L << 32) + i);

    final MutableIntList decoded = DeltaBlockCodec.decode(new IntArrayList(), raw, 0);
    for (int i = 0; i < PackLayout.BLOCK_SIZE; i++)
      assertThat(decoded.get(i)).isEqualTo(i);
  }

  @Test
  void testStrictDecodeRejectsPacksThe32BitEncoderNeverWrites() {
    GlobalConfiguration.CODEC_STRICT_DECODE.setValue(true);

    final MutableLongList raw = new LongArrayList();
    for (int i = 0; i < PackLayout.RAW_WORD_COUNT; i++)
      raw.add(i == 40 ? 0x80000000L : -i);

    final DecodingException e = catchThrowableOfType(() -> DeltaBlockCodec.decode(new IntArrayList(), raw, 0), DecodingException.class);
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CORRUPTED_PACK);
    assertThat(e.getContext()).containsEntry("wordIndex", 40);

    final MutableLongList wide = new LongArrayList();
    for (int i = 0; i < 33; i++)
      wide.add(0L);
    final DecodingException e2 = catchThrowableOfType(() -> DeltaBlockCodec.decode(new IntArrayList(), wide, 0), DecodingException.class);
    assertThat(e2.getErrorCode()).isEqualTo(ErrorCode.CORRUPTED_PACK);

    // sign-extended raw words are accepted
    raw.set(40, -40L);
    final MutableIntList decoded = DeltaBlockCodec.decode(new IntArrayList(), raw, 0);
    assertThat(decoded.get(40)).isEqualTo(-40);

    // 64-bit packs are not affected
    assertThat(DeltaBlockCodec.decode(new LongArrayList(), wide, 0L).size()).isEqualTo(PackLayout.BLOCK_SIZE);
  }

  @Test
  void testEncodedWordCount() {
    final RandomBlocks random = new RandomBlocks(99);
    for (final int bitN : new int[] { 0, 1, 31, 32 }) {
      final int[] block = random.intBlock(-5, bitN);
      assertThat(DeltaBlockCodec.encodedWordCount(block, -5)).isEqualTo(bitN);
      assertThat(DeltaBlockCodec.encode(new LongArrayList(), block, -5).size()).isEqualTo(bitN);
    }
    for (final int bitN : new int[] { 0, 2, 42, 43, 63, 64 }) {
      final long[] block = random.longBlock(5L, bitN);
      assertThat(DeltaBlockCodec.encodedWordCount(block, 5L)).isEqualTo(PackLayout.wordCount(bitN));
    }
  }
}

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
 * Width selection for blocks of zigzag values.
 *
 * @author DeltaPack developers
 */
public final class BitWidth {

  private BitWidth() {
  }

  /**
   * Returns the number of bits needed to store {@code value} read as unsigned: 0 for 0, 64 when the top bit is set.
   */
  public static int bitsRequired(final long value) {
    return Long.SIZE - Long.numberOfLeadingZeros(value);
  }

  /**
   * Returns the minimal {@code bitN} such that every value of the block, read as unsigned, is lower than {@code 2^bitN}. The
   * block must hold exactly {@link PackLayout#BLOCK_SIZE} values.
   */
  public static int select(final long[] zigzagValues) {
    if (zigzagValues == null || zigzagValues.length != PackLayout.BLOCK_SIZE)
      throw ExceptionBuilder.invalidBlock()
          .code(ErrorCode.INVALID_BLOCK_SIZE)
          .message("Width selection needs %d values, got %s", PackLayout.BLOCK_SIZE, zigzagValues == null ? "null" : zigzagValues.length)
          .build();

    // the OR of all values has the same highest bit as their unsigned maximum
    long or = 0;
    for (final long v : zigzagValues)
      or |= v;
    return bitsRequired(or);
  }
}

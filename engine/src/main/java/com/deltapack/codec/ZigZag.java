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
 * ZigZag mapping between signed deltas and unsigned values of the same width: 0 → 0, -1 → 1, 1 → 2, -2 → 3, ... Small
 * magnitudes of either sign map to small unsigned values, so the bit width of a block of deltas stays small. Both directions
 * are total over the type, {@code MIN_VALUE} included. Results are unsigned: read them with {@link Integer#toUnsignedLong(int)}
 * or the {@code Long} unsigned helpers.
 *
 * @author DeltaPack developers
 */
public final class ZigZag {

  private ZigZag() {
  }

  public static int encode(final int value) {
    return (value << 1) ^ (value >> 31);
  }

  public static int decode(final int encoded) {
    return (encoded >>> 1) ^ -(encoded & 1);
  }

  public static long encode(final long value) {
    return (value << 1) ^ (value >> 63);
  }

  public static long decode(final long encoded) {
    return (encoded >>> 1) ^ -(encoded & 1);
  }
}

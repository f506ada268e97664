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
package com.deltapack.exception;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for DeltaPack exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Encoding errors (block shape, bit width, value range)</li>
 *   <li>2xxx - Decoding errors (framing, corrupted content)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see DeltaPackException
 */
public enum ErrorCode {

  // ========== Encoding Errors (1xxx) ==========
  /** Block or output array does not hold exactly the expected number of values */
  INVALID_BLOCK_SIZE(1001, "Invalid block size"),

  /** Bit width outside the range supported by the kernel */
  INVALID_BIT_WIDTH(1002, "Invalid bit width"),

  /** Value does not fit in the requested bit width */
  VALUE_OUT_OF_RANGE(1003, "Value out of range"),

  // ========== Decoding Errors (2xxx) ==========
  /** Word count of a pack does not match any kernel */
  MALFORMED_PACK(2001, "Malformed pack"),

  /** Pack content can not be produced by the encoder of the element type */
  CORRUPTED_PACK(2002, "Corrupted pack"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  /**
   * Returns the numeric error code.
   *
   * @return the error code (e.g., 1001, 2001, etc.)
   */
  public int getCode() {
    return code;
  }

  /**
   * Returns the default human-readable error message, used when an exception is built without a custom one.
   */
  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public ErrorCategory getCategory() {
    return switch (code / 1000) {
      case 1 -> ErrorCategory.ENCODING;
      case 2 -> ErrorCategory.DECODING;
      default -> ErrorCategory.INTERNAL;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @param code the numeric error code to look up
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}

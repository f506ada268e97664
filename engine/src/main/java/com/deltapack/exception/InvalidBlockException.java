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

/**
 * Exception thrown when a caller breaks the contract of the encoder or of a packing kernel: a block that does not hold
 * exactly 64 values, a bit width the kernel does not support, a value wider than the requested width or a word range
 * shorter than the width. These are programming errors, not data errors.
 *
 * @see ErrorCode#INVALID_BLOCK_SIZE
 * @see ErrorCode#INVALID_BIT_WIDTH
 * @see ErrorCode#VALUE_OUT_OF_RANGE
 */
public class InvalidBlockException extends DeltaPackException {

  public InvalidBlockException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public InvalidBlockException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }
}

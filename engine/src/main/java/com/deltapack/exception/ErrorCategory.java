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
 * Categories for organizing error codes in the DeltaPack exception hierarchy.
 * <p>
 * Each {@link ErrorCode} belongs to exactly one category:
 * <ul>
 *   <li>{@link #ENCODING} - Blocks, widths or values handed to the encoder or to a packing kernel that break its contract</li>
 *   <li>{@link #DECODING} - Packs whose word count or content cannot come from the encoder</li>
 *   <li>{@link #INTERNAL} - Internal system errors and unexpected conditions</li>
 * </ul>
 *
 * @see ErrorCode
 * @see DeltaPackException
 */
public enum ErrorCategory {
  ENCODING("Encoding"),
  DECODING("Decoding"),
  INTERNAL("Internal");

  private final String displayName;

  ErrorCategory(final String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the human-readable name used in error messages and JSON output.
   */
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}

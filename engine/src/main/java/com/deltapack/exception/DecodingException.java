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
 * Exception thrown when a pack can not be decoded.
 * <p>
 * This exception category covers:
 * <ul>
 *   <li>Packs whose word count does not correspond to any kernel ({@link ErrorCode#MALFORMED_PACK})</li>
 *   <li>Packs whose words can not come from the encoder of the element type, detected in strict mode
 *   ({@link ErrorCode#CORRUPTED_PACK})</li>
 * </ul>
 *
 * @see ErrorCode
 * @see DeltaPackException
 */
public class DecodingException extends DeltaPackException {

  public DecodingException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public DecodingException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }
}

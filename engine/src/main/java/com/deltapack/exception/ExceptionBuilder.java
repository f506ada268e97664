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

import java.lang.reflect.Constructor;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing DeltaPack exceptions with error codes and diagnostic context.
 * <pre>{@code
 * throw ExceptionBuilder.decoding()
 *     .code(ErrorCode.MALFORMED_PACK)
 *     .message("Pack of %d words does not match any kernel", words)
 *     .context("wordCount", words)
 *     .context("elementType", ElementType.INT64)
 *     .build();
 * }</pre>
 *
 * @see DeltaPackException
 * @see ErrorCode
 */
public class ExceptionBuilder {
  private       ErrorCode                           errorCode;
  private       String                              message;
  private       Throwable                           cause;
  private final Map<String, Object>                 context = new LinkedHashMap<>();
  private final Class<? extends DeltaPackException> exceptionClass;

  private ExceptionBuilder(final Class<? extends DeltaPackException> exceptionClass) {
    this.exceptionClass = exceptionClass;
  }

  /**
   * Creates a builder for errors raised while reading a pack.
   */
  public static ExceptionBuilder decoding() {
    return new ExceptionBuilder(DecodingException.class);
  }

  /**
   * Creates a builder for contract violations on blocks, widths and values.
   */
  public static ExceptionBuilder invalidBlock() {
    return new ExceptionBuilder(InvalidBlockException.class);
  }

  public ExceptionBuilder code(final ErrorCode errorCode) {
    this.errorCode = errorCode;
    return this;
  }

  public ExceptionBuilder message(final String message) {
    this.message = message;
    return this;
  }

  /**
   * Sets the error message using String.format() syntax.
   */
  public ExceptionBuilder message(final String format, final Object... args) {
    this.message = String.format(format, args);
    return this;
  }

  public ExceptionBuilder cause(final Throwable cause) {
    this.cause = cause;
    return this;
  }

  /**
   * Adds a diagnostic context entry. Null keys and values are ignored.
   */
  public ExceptionBuilder context(final String key, final Object value) {
    if (key != null && value != null)
      this.context.put(key, value);
    return this;
  }

  /**
   * Builds and returns the configured exception. The concrete type is instantiated through its
   * {@code (ErrorCode, String)} or {@code (ErrorCode, String, Throwable)} constructor.
   *
   * @throws IllegalStateException if error code is not specified
   * @throws InternalException     if the exception can not be instantiated
   */
  public DeltaPackException build() {
    if (errorCode == null)
      throw new IllegalStateException("Error code must be specified");

    if (message == null || message.isEmpty())
      message = errorCode.getDefaultMessage();

    final DeltaPackException exception;
    try {
      if (cause != null) {
        final Constructor<? extends DeltaPackException> constructor = exceptionClass.getConstructor(ErrorCode.class, String.class,
            Throwable.class);
        exception = constructor.newInstance(errorCode, message, cause);
      } else {
        final Constructor<? extends DeltaPackException> constructor = exceptionClass.getConstructor(ErrorCode.class, String.class);
        exception = constructor.newInstance(errorCode, message);
      }
    } catch (final ReflectiveOperationException e) {
      throw new InternalException("Failed to build exception: " + exceptionClass.getName(), e);
    }

    context.forEach(exception::addContext);
    return exception;
  }
}

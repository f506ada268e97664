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

import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class for all DeltaPack exceptions.
 * Provides standardized error codes and diagnostic context.
 */
public class DeltaPackException extends RuntimeException {
  private final ErrorCode           errorCode;
  private final Map<String, Object> context;

  public DeltaPackException(final String message) {
    this(ErrorCode.INTERNAL_ERROR, message);
  }

  public DeltaPackException(final String message, final Throwable cause) {
    this(ErrorCode.INTERNAL_ERROR, message, cause);
  }

  public DeltaPackException(final ErrorCode errorCode, final String message) {
    super(message);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
    this.context = new LinkedHashMap<>();
  }

  public DeltaPackException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
    this.context = new LinkedHashMap<>();
  }

  /**
   * Gets the error code associated with this exception.
   *
   * @return the error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the diagnostic context for this exception, as an unmodifiable map in insertion order.
   */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /**
   * Adds a context entry to this exception.
   *
   * @param key   the context key
   * @param value the context value
   *
   * @return this exception for method chaining
   */
  public DeltaPackException addContext(final String key, final Object value) {
    if (key != null)
      this.context.put(key, value);
    return this;
  }

  /**
   * Converts this exception to a JSON string.
   *
   * @return JSON representation of this exception
   */
  public String toJSON() {
    final JsonObject json = new JsonObject();
    json.addProperty("errorCode", errorCode.getCode());
    json.addProperty("errorName", errorCode.name());
    json.addProperty("category", errorCode.getCategory().getDisplayName());
    json.addProperty("message", getMessage());

    if (!context.isEmpty()) {
      final JsonObject ctx = new JsonObject();
      for (final Map.Entry<String, Object> entry : context.entrySet()) {
        final Object value = entry.getValue();
        if (value == null)
          ctx.add(entry.getKey(), null);
        else if (value instanceof Number)
          ctx.addProperty(entry.getKey(), (Number) value);
        else if (value instanceof Boolean)
          ctx.addProperty(entry.getKey(), (Boolean) value);
        else
          ctx.addProperty(entry.getKey(), value.toString());
      }
      json.add("context", ctx);
    }

    if (getCause() != null)
      json.addProperty("cause", getCause().getMessage());

    return json.toString();
  }

  @Override
  public String toString() {
    return String.format("%s [%s-%d]: %s", getClass().getSimpleName(), errorCode.getCategory(), errorCode.getCode(), getMessage());
  }
}

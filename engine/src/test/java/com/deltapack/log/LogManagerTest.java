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
package com.deltapack.log;

import com.deltapack.GlobalConfiguration;
import com.deltapack.codec.DeltaBlockCodec;
import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class LogManagerTest {
  private final List<String> messages = new ArrayList<>();
  private       Logger       previous;

  private final Logger capturing = new Logger() {
    @Override
    public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
        final Object arg1, final Object arg2, final Object arg3, final Object arg4) {
      messages.add(level + " " + (context != null ? "<" + context + "> " : "") + String.format(message, arg1, arg2, arg3, arg4) + (
          exception != null ? " " + exception.getMessage() : ""));
    }

    @Override
    public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
        final Object... args) {
      messages.add(level + " " + (context != null ? "<" + context + "> " : "") + String.format(message, args) + (exception != null ?
          " " + exception.getMessage() :
          ""));
    }

    @Override
    public void flush() {
    }
  };

  @BeforeEach
  void installLogger() {
    previous = LogManager.instance().getLogger();
    LogManager.instance().setLogger(capturing);
  }

  @AfterEach
  void restoreLogger() {
    LogManager.instance().setLogger(previous);
    LogManager.instance().setContext(null);
    GlobalConfiguration.CODEC_DEBUG.reset();
  }

  @Test
  void testFormatting() {
    LogManager.instance().log(this, Level.INFO, "plain");
    LogManager.instance().log(this, Level.INFO, "%d words", 42);
    LogManager.instance().log(this, Level.WARNING, "%s-%s-%s-%s-%s", "a", "b", "c", "d", "e");
    LogManager.instance().log(this, Level.SEVERE, "failed %s", new IllegalStateException("cause"), "x");

    assertThat(messages).containsExactly("INFO plain", "INFO 42 words", "WARNING a-b-c-d-e", "SEVERE failed x cause");
  }

  @Test
  void testContextIsPerThread() throws InterruptedException {
    LogManager.instance().setContext("block-7");
    LogManager.instance().log(this, Level.INFO, "here");

    final Thread other = new Thread(() -> LogManager.instance().log(this, Level.INFO, "there"));
    other.start();
    other.join();

    assertThat(messages).containsExactly("INFO <block-7> here", "INFO there");
    assertThat(LogManager.instance().getContext()).isEqualTo("block-7");
  }

  @Test
  void testCodecTracesOnlyWhenDebugIsEnabled() {
    final long[] block = new long[64];
    for (int i = 0; i < block.length; i++)
      block[i] = 10 - (i + 1);

    assertThat(LogManager.instance().isDebugEnabled()).isFalse();
    DeltaBlockCodec.encode(new LongArrayList(), block, 10L);
    assertThat(messages).isEmpty();

    GlobalConfiguration.CODEC_DEBUG.setValue(true);
    assertThat(LogManager.instance().isDebugEnabled()).isTrue();

    final LongArrayList pack = new LongArrayList();
    DeltaBlockCodec.encode(pack, block, 10L);
    DeltaBlockCodec.decode(new LongArrayList(), pack, 10L);

    assertThat(messages).containsExactly("FINE Encoded INT64 block: width=2 layout=FIXED_WIDTH words=2",
        "FINE Decoded INT64 block: words=2 layout=FIXED_WIDTH");
  }

  @Test
  void testDefaultLoggerNames() {
    final DefaultLogger logger = new DefaultLogger();
    assertThat(logger.getLogger(DeltaBlockCodec.class).getName()).isEqualTo("com.deltapack.codec.DeltaBlockCodec");
    assertThat(logger.getLogger("custom").getName()).isEqualTo("custom");
    assertThat(logger.getLogger(null).getName()).isEqualTo("com.deltapack");
    assertThat(logger.getLogger(this).getName()).isEqualTo(LogManagerTest.class.getName());
    assertThat(logger.getLogger(this)).isSameAs(logger.getLogger(LogManagerTest.class));
  }
}

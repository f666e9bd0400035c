/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.internal.recorder;

import chaintrace.Clock;
import chaintrace.internal.Platform;

/**
 * Reads the epoch clock once, then ticks forward with {@link Platform#nanoTime()}. Every segment of
 * one request shares an instance, so NTP or system clock changes do not skew a trace.
 */
public final class TickClock implements Clock {
  public static TickClock create(Platform platform, Clock baseClock) {
    return new TickClock(platform, baseClock.currentTimeMicroseconds(), platform.nanoTime());
  }

  final Platform platform;
  final long baseEpochMicros;
  final long baseTickNanos;

  TickClock(Platform platform, long baseEpochMicros, long baseTickNanos) {
    this.platform = platform;
    this.baseEpochMicros = baseEpochMicros;
    this.baseTickNanos = baseTickNanos;
  }

  @Override public long currentTimeMicroseconds() {
    return ((platform.nanoTime() - baseTickNanos) / 1000) + baseEpochMicros;
  }

  @Override public String toString() {
    return "TickClock{"
      + "baseEpochMicros=" + baseEpochMicros + ", "
      + "baseTickNanos=" + baseTickNanos
      + "}";
  }
}

/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

/**
 * Epoch microseconds used for {@link Segment#startTimestamp()} and {@link
 * Segment#finishTimestamp()}.
 *
 * <p>This should use the most precise value possible. For example, {@code gettimeofday} or
 * multiplying {@link System#currentTimeMillis} by 1000.
 *
 * <p><em>Note</em>: Within a request, this is read once when the {@link SegmentTree} is created.
 * Later timestamps tick forward from that base using {@link System#nanoTime()}.
 */
// @FunctionalInterface, do not add methods as it will break lambdas
public interface Clock {

  long currentTimeMicroseconds();
}

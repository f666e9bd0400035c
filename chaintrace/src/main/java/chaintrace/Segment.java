/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

import chaintrace.internal.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named span of execution time inside one request, such as one middleware call. Segments nest to
 * reflect call structure: children are kept in the order they started.
 *
 * <p>Segments are created and closed by their {@link SegmentTree}. Reads are safe once the owning
 * request has finished. Before that, state is guarded by the owning {@link RequestContext}.
 *
 * @see SegmentTree#open(Segment, String)
 */
public final class Segment {
  /** Prefix of segments that were cut short, either collapsed over budget or left open. */
  public static final String TRUNCATED_PREFIX = "Truncated/";

  /**
   * Returned instead of a real segment when the request already finished. Closing or nesting under
   * this has no effect.
   */
  public static final Segment NOOP = new Segment(null, null, "", 0L, false);

  @Nullable final SegmentTree tree;
  @Nullable final Segment parent;
  final List<Segment> children = new ArrayList<>();
  final boolean placeholder;
  final long startTimestamp;
  String name;
  long finishTimestamp;
  boolean truncated;
  @Nullable Throwable error;

  // only used when a child collapses over budget
  @Nullable Segment placeholderChild;
  // only used by placeholders
  int collapsedCount, outstanding;
  long lastCollapsedFinish;

  Segment(@Nullable SegmentTree tree, @Nullable Segment parent, String name, long startTimestamp,
    boolean placeholder) {
    this.tree = tree;
    this.parent = parent;
    this.name = name;
    this.startTimestamp = startTimestamp;
    this.placeholder = placeholder;
    this.truncated = placeholder;
  }

  /**
   * Returns the reported name. When {@link #isTruncated() truncated}, this includes the {@link
   * #TRUNCATED_PREFIX}.
   */
  public String name() {
    return truncated ? TRUNCATED_PREFIX + name : name;
  }

  /** Epoch microseconds when this segment started */
  public long startTimestamp() {
    return startTimestamp;
  }

  /** Epoch microseconds when this segment finished, or zero if it is still open. */
  public long finishTimestamp() {
    return finishTimestamp;
  }

  public boolean isFinished() {
    return finishTimestamp != 0L;
  }

  /** Microseconds between start and finish, or zero if still open. */
  public long durationMicros() {
    return finishTimestamp != 0L ? Math.max(0L, finishTimestamp - startTimestamp) : 0L;
  }

  /**
   * True when this segment is a placeholder for segments collapsed over budget, or when it was
   * still open when the request finished.
   */
  public boolean isTruncated() {
    return truncated;
  }

  /** True when this stands in for segments opened after the tree's budget was exhausted. */
  public boolean isPlaceholder() {
    return placeholder;
  }

  /** Count of segment opens collapsed into this placeholder. Zero for normal segments. */
  public int collapsedCount() {
    return collapsedCount;
  }

  /**
   * The error raised by the work this segment represents, or null. An error here is not
   * necessarily reported as a request failure: an enclosing middleware may have handled it.
   */
  @Nullable public Throwable error() {
    return error;
  }

  @Nullable public Segment parent() {
    return parent;
  }

  public List<Segment> children() {
    return Collections.unmodifiableList(children);
  }

  public boolean isNoop() {
    return this == NOOP;
  }

  @Override public String toString() {
    if (this == NOOP) return "NoopSegment";
    StringBuilder result = new StringBuilder("Segment{name=").append(name());
    if (placeholder) result.append(", collapsedCount=").append(collapsedCount);
    if (!children.isEmpty()) result.append(", children=").append(children);
    return result.append('}').toString();
  }
}

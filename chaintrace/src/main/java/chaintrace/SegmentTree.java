/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

import chaintrace.internal.Nullable;
import java.util.List;

/**
 * Append-only tree of {@link Segment segments} recorded for one request.
 *
 * <p>The number of concurrently open segments tracked in detail is bounded. Once the bound is
 * reached, further opens under the same parent collapse into one placeholder child named {@code
 * Truncated/<name>}, which counts the attempts instead of keeping their identity. This bounds
 * memory for pathological middleware chains or recursive frameworks.
 *
 * <p>This type is not thread safe. {@link RequestContext} guards an instance with its own lock.
 */
public final class SegmentTree {
  final Clock clock;
  final int maxOpenSegments;
  final Segment root;
  @Nullable RequestContext owner; // set when a request owns this tree
  int openCount;

  /**
   * @param rootName initial name of the root segment, usually replaced by the transaction name
   * @param clock source of segment timestamps
   * @param maxOpenSegments how many segments besides the root may be open in detail at once
   */
  public SegmentTree(String rootName, Clock clock, int maxOpenSegments) {
    if (rootName == null) throw new NullPointerException("rootName == null");
    if (clock == null) throw new NullPointerException("clock == null");
    if (maxOpenSegments <= 0) {
      throw new IllegalArgumentException("maxOpenSegments <= 0: " + maxOpenSegments);
    }
    this.clock = clock;
    this.maxOpenSegments = maxOpenSegments;
    this.root = new Segment(this, null, rootName, clock.currentTimeMicroseconds(), false);
  }

  public Segment root() {
    return root;
  }

  /** Count of segments, excluding the root and placeholders, that are open right now. */
  public int openCount() {
    return openCount;
  }

  public boolean isFinished() {
    return root.isFinished();
  }

  /**
   * Opens a child segment starting now.
   *
   * <p>When the parent is already closed, the segment attaches to the nearest open ancestor. When
   * the whole tree is finished, this returns {@link Segment#NOOP}. This never fails due to the
   * budget: a placeholder is returned instead.
   *
   * @param parent the parent segment, or null for the root
   * @param name the segment name, such as {@code Middleware/Koa/auth}
   */
  public Segment open(@Nullable Segment parent, String name) {
    if (name == null) throw new NullPointerException("name == null");
    if (parent == null) parent = root;
    if (parent.isNoop()) return Segment.NOOP;
    if (parent.tree != this) {
      throw new IllegalArgumentException(parent + " is not a segment of this tree");
    }

    parent = nearestOpen(parent);
    if (parent == null) return Segment.NOOP;

    if (parent.placeholder) { // children of a placeholder are not kept in detail
      collapse(parent);
      return parent;
    }

    long timestamp = clock.currentTimeMicroseconds();
    if (openCount >= maxOpenSegments) {
      Segment placeholder = parent.placeholderChild;
      if (placeholder == null) {
        placeholder = new Segment(this, parent, name, timestamp, true);
        parent.children.add(placeholder);
        parent.placeholderChild = placeholder;
      }
      collapse(placeholder);
      return placeholder;
    }

    Segment child = new Segment(this, parent, name, timestamp, false);
    parent.children.add(child);
    openCount++;
    return child;
  }

  /**
   * Finishes the segment now. Calling this more than once has no effect, which guards against both
   * a success and an error path completing the same work.
   *
   * <p>Closing a placeholder accounts for one collapsed attempt. The placeholder itself finishes
   * with its parent.
   *
   * @return true if this call finished the segment
   */
  public boolean close(Segment segment) {
    if (segment == null) throw new NullPointerException("segment == null");
    if (segment.isNoop() || segment.tree != this) return false;

    long timestamp = clock.currentTimeMicroseconds();
    if (segment.placeholder) {
      if (segment.isFinished() || segment.outstanding == 0) return false;
      segment.outstanding--;
      segment.lastCollapsedFinish = timestamp;
      return true;
    }

    if (segment.isFinished()) return false;
    finish(segment, timestamp);
    if (segment != root) openCount--;
    return true;
  }

  /**
   * Closes every open segment except the root as {@link Segment#isTruncated() truncated}, children
   * before parents. This handles work that never signalled completion.
   *
   * @return the count of segments truncated
   */
  public int truncateOpenSegments() {
    return truncateOpen(root, clock.currentTimeMicroseconds());
  }

  /**
   * Truncates any open descendants, then closes the root under the given name.
   *
   * @return false if the tree was already finished
   */
  public boolean finish(String rootName) {
    if (rootName == null) throw new NullPointerException("rootName == null");
    if (root.isFinished()) return false;
    truncateOpenSegments();
    root.name = rootName;
    return close(root);
  }

  int truncateOpen(Segment parent, long timestamp) {
    int truncated = 0;
    List<Segment> children = parent.children;
    for (int i = 0, length = children.size(); i < length; i++) {
      Segment child = children.get(i);
      truncated += truncateOpen(child, timestamp);
      if (child.isFinished() || child.placeholder) continue;
      child.truncated = true;
      finish(child, timestamp);
      openCount--;
      truncated++;
    }
    return truncated;
  }

  void finish(Segment segment, long timestamp) {
    Segment placeholder = segment.placeholderChild;
    if (placeholder != null && !placeholder.isFinished()) {
      long placeholderFinish = placeholder.outstanding > 0 || placeholder.lastCollapsedFinish == 0L
        ? timestamp
        : placeholder.lastCollapsedFinish;
      placeholder.finishTimestamp = Math.max(placeholderFinish, placeholder.startTimestamp);
      placeholder.outstanding = 0;
    }
    // zero means open, so never record a zero finish even with a frozen test clock
    segment.finishTimestamp = Math.max(timestamp, Math.max(segment.startTimestamp, 1L));
  }

  static void collapse(Segment placeholder) {
    placeholder.collapsedCount++;
    placeholder.outstanding++;
  }

  @Nullable static Segment nearestOpen(Segment segment) {
    for (Segment current = segment; current != null; current = current.parent) {
      if (!current.isFinished()) return current;
    }
    return null;
  }

  @Override public String toString() {
    return "SegmentTree{root=" + root + ", openCount=" + openCount + "}";
  }
}

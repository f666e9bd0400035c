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
 * Path components that name a request, in causal order, plus the snapshot claimed by the
 * middleware that produced the response.
 *
 * <p>The path stays mutable for the whole request. What is reported is the path as it stood when
 * a {@link NameTrigger name trigger} last took effect:
 * <ul>
 *   <li>{@link NameTrigger#BODY}: always claims the current path, so the last body wins.</li>
 *   <li>{@link NameTrigger#STATUS}: claims only while no body has been assigned.</li>
 * </ul>
 *
 * <p>For example, a middleware that appends after {@code next()} resolved does not change the
 * name when a downstream middleware already assigned the body.
 *
 * <p>Operations are no-ops once the owning request has finished.
 */
public final class NameState {
  final Object lock;
  final ArrayList<String> path = new ArrayList<>();
  @Nullable List<String> claimed;
  boolean bodyAssigned, sealed;

  /** @param lock guards this state, usually the owning {@link RequestContext} */
  NameState(Object lock) {
    if (lock == null) throw new NullPointerException("lock == null");
    this.lock = lock;
  }

  /** Pushes a path component. Null or empty components are ignored. */
  public void appendPath(@Nullable String component) {
    if (component == null || component.isEmpty()) return;
    synchronized (lock) {
      if (sealed) return;
      path.add(component);
    }
  }

  /** Re-evaluates the claimed name in response to a body or status assignment. */
  public void trigger(NameTrigger kind) {
    if (kind == null) throw new NullPointerException("kind == null");
    synchronized (lock) {
      if (sealed) return;
      if (kind == NameTrigger.BODY) {
        bodyAssigned = true;
      } else if (bodyAssigned) {
        return; // status after body doesn't re-claim
      }
      claimed = Collections.unmodifiableList(new ArrayList<>(path));
    }
  }

  /** Claims the current path unless something already claimed it. Calling again has no effect. */
  public void freeze() {
    synchronized (lock) {
      if (sealed || claimed != null) return;
      claimed = Collections.unmodifiableList(new ArrayList<>(path));
    }
  }

  /** True once any trigger or {@link #freeze()} claimed a path. */
  public boolean isFrozen() {
    synchronized (lock) {
      return claimed != null;
    }
  }

  /** Returns a copy of every component appended so far. */
  public List<String> path() {
    synchronized (lock) {
      return Collections.unmodifiableList(new ArrayList<>(path));
    }
  }

  /** Returns the claimed path, or the current path when nothing claimed one. */
  public List<String> capturedPath() {
    synchronized (lock) {
      return claimed != null ? claimed : Collections.unmodifiableList(new ArrayList<>(path));
    }
  }

  /** Returns the captured path joined with slashes and a leading slash, such as {@code /a/b}. */
  public String capturedPathString() {
    return toPathString(capturedPath());
  }

  /** Stops accepting changes. Called when the owning request finishes. */
  void seal() {
    synchronized (lock) {
      sealed = true;
    }
  }

  static String toPathString(List<String> components) {
    StringBuilder result = new StringBuilder();
    for (int i = 0, length = components.size(); i < length; i++) {
      result.append('/').append(components.get(i));
    }
    return result.length() == 0 ? "/" : result.toString();
  }

  @Override public String toString() {
    synchronized (lock) {
      return "NameState{path=" + path + ", claimed=" + claimed + "}";
    }
  }
}

/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

/**
 * A response mutation that marks which middleware handled the request, for naming purposes.
 *
 * @see NameState#trigger(NameTrigger)
 */
public enum NameTrigger {
  /** The response body was assigned. Every assignment claims the current path. */
  BODY,
  /** The response status was assigned. This only claims the path until a body is assigned. */
  STATUS
}

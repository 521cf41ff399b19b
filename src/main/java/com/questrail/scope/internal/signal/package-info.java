/**
 * One-shot broadcast primitive underneath every cancellable scope.
 *
 * <p>Nothing in this package knows about scopes, parents or deadlines. A
 * {@link com.questrail.scope.internal.signal.Signal} only guarantees:</p>
 * <ul>
 *   <li>idempotent single fire with exactly one recorded termination</li>
 *   <li>unlimited concurrent waiters and subscribers</li>
 *   <li>immediate return for waiters and subscribers arriving after the fire</li>
 * </ul>
 */
package com.questrail.scope.internal.signal;

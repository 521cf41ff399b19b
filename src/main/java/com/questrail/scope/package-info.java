/**
 * Hierarchical cancellation, deadline propagation and request-scoped values.
 *
 * <h2>Model</h2>
 * <pre>
 *   background()
 *        → withTimeout(5s)          (own signal + deadline timer)
 *            → withValue(USER, u)   (view: binding only)
 *                → withCancel()     (own signal, follows ancestors)
 * </pre>
 *
 * <p>Firing is terminal and flows downward only. A child's deadline can only
 * shorten the effective deadline. Bindings are immutable and a child may
 * shadow an ancestor's binding for its own subtree.</p>
 *
 * <h2>Release</h2>
 * Every {@link com.questrail.scope.api.CancellableScope} must be closed by its
 * creator on every exit path. try-with-resources is the intended idiom.
 */
package com.questrail.scope;

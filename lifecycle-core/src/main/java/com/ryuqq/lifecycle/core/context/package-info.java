/**
 * Machine context package.
 *
 * <p>Immutable, typed key/value data carried alongside a state machine's current state.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.context.ContextKey} - Named, typed field key</li>
 *   <li>{@link com.ryuqq.lifecycle.core.context.MachineContext} - Immutable context value</li>
 *   <li>{@link com.ryuqq.lifecycle.core.context.ContextDelta} - Partial update merged into a context</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ContextKey&lt;String&gt; lastError = ContextKey.of("lastError", String.class);
 *
 * MachineContext context = MachineContext.of(ContextDelta.of(lastError, null));
 * MachineContext updated = context.merge(ContextDelta.of(lastError, "timeout"));
 *
 * // context is unchanged, updated carries the new value
 * </pre>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.context;

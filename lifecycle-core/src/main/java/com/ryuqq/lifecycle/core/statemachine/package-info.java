/**
 * Generic finite state machine package.
 *
 * <p>This package implements a small, in-memory state machine engine that enforces a
 * declarative transition table, owns an immutable context, notifies subscribers and keeps
 * a bounded snapshot history.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.TransitionRule} - (from states, event, to state) triple</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.TransitionTable} - Ordered, unambiguous rule set</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateMachineConfig} - Table, initial state/context, history capacity</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateMachine} - The engine</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateSnapshot} - History entry</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateListener} / {@link com.ryuqq.lifecycle.core.statemachine.Subscription} - Observation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateMachine&lt;ServiceState&gt; machine = new StateMachine&lt;&gt;(config);
 *
 * Subscription subscription = machine.subscribe((state, context) -&gt; render(state));
 *
 * if (!machine.transition("CHECK")) {
 *     // not allowed from the current state; nothing changed
 * }
 *
 * subscription.unsubscribe();
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Silent rejection:</strong> An invalid transition returns false and logs a warning</li>
 *   <li><strong>Fail-Fast configuration:</strong> Ambiguous tables and unknown initial states are rejected at construction</li>
 *   <li><strong>Committed before notified:</strong> Subscribers always observe a fully applied change</li>
 *   <li><strong>Single owner:</strong> No internal locking; callers serialize access if they share a machine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.statemachine;

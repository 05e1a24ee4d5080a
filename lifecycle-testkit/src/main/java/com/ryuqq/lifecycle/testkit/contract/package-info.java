/**
 * Reusable contract tests for state machines.
 *
 * <p>{@link com.ryuqq.lifecycle.testkit.contract.AbstractStateMachineContractTest} verifies the
 * engine guarantees against any transition table; {@link com.ryuqq.lifecycle.testkit.contract.RecordingListener}
 * captures notifications for assertions.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.testkit.contract;

package com.ryuqq.lifecycle.core.statemachine;

/**
 * {@link StateMachine#subscribe(StateListener)}가 반환하는 구독 해제 핸들.
 *
 * <p>try-with-resources로 구독 범위를 제한할 수 있습니다.</p>
 *
 * <pre>
 * try (Subscription ignored = machine.subscribe(listener)) {
 *     machine.transition("CHECK");
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    /**
     * 구독 해제. 여러 번 호출해도 안전합니다.
     */
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}

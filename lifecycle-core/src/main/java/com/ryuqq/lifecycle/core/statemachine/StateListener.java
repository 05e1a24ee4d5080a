package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.context.MachineContext;

/**
 * 상태 변경 구독자.
 *
 * <p>구독 직후 한 번, 이후 전이/Context 갱신/reset마다 호출됩니다.
 * 호출은 변경을 일으킨 스레드에서 동기적으로, 구독 순서대로 이루어집니다.</p>
 *
 * @param <S> 상태 타입
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateListener<S extends Enum<S>> {

    /**
     * 상태 변경 통지.
     *
     * @param state 현재 상태
     * @param context 현재 Context
     */
    void onStateChanged(S state, MachineContext context);
}

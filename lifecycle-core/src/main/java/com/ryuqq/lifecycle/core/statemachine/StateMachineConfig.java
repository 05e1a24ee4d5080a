package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.context.MachineContext;

/**
 * 상태 머신 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>transitions: 전이 테이블</li>
 *   <li>initialState: 초기 상태 (테이블이 언급하는 상태여야 함)</li>
 *   <li>initialContext: 초기 Context (reset 시 복원됨)</li>
 *   <li>historyCapacity: 보관할 스냅샷 수 (기본 10)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param transitions 전이 테이블 (null이 아니어야 함)
 * @param initialState 초기 상태 (null이 아니어야 함)
 * @param initialContext 초기 Context (null이 아니어야 함)
 * @param historyCapacity 이력 용량 (1 이상이어야 함)
 * @param <S> 상태 타입
 */
public record StateMachineConfig<S extends Enum<S>>(
    TransitionTable<S> transitions,
    S initialState,
    MachineContext initialContext,
    int historyCapacity
) {

    /**
     * 기본 이력 용량.
     */
    public static final int DEFAULT_HISTORY_CAPACITY = 10;

    /**
     * 기본 이력 용량(10)으로 설정 생성.
     */
    public StateMachineConfig(TransitionTable<S> transitions, S initialState, MachineContext initialContext) {
        this(transitions, initialState, initialContext, DEFAULT_HISTORY_CAPACITY);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StateMachineConfig {
        if (transitions == null) {
            throw new IllegalArgumentException("transitions cannot be null");
        }
        if (initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }
        if (initialContext == null) {
            throw new IllegalArgumentException("initialContext cannot be null");
        }
        if (!transitions.referencedStates().contains(initialState)) {
            throw new IllegalArgumentException(
                "initialState " + initialState + " does not appear in the transition table"
            );
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException(
                "historyCapacity must be positive (current: " + historyCapacity + ")"
            );
        }
    }

    /**
     * initialContext만 변경한 새 인스턴스 생성.
     */
    public StateMachineConfig<S> withInitialContext(MachineContext initialContext) {
        return new StateMachineConfig<>(transitions, initialState, initialContext, historyCapacity);
    }

    /**
     * historyCapacity만 변경한 새 인스턴스 생성.
     */
    public StateMachineConfig<S> withHistoryCapacity(int historyCapacity) {
        return new StateMachineConfig<>(transitions, initialState, initialContext, historyCapacity);
    }
}

package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.context.MachineContext;

import java.time.Instant;

/**
 * 이력에 기록되는 상태 머신의 불변 스냅샷.
 *
 * <p>생성, 전이 성공, reset 시점마다 하나씩 기록됩니다.</p>
 *
 * @param state 기록 시점의 상태
 * @param context 기록 시점의 Context (불변)
 * @param sequence 논리 순번 (생성/reset 직후 0, 전이마다 1씩 증가)
 * @param timestamp 기록 시각 (머신의 Clock 기준)
 * @param <S> 상태 타입
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record StateSnapshot<S extends Enum<S>>(
    S state,
    MachineContext context,
    long sequence,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException state, context, timestamp가 null이거나 sequence가 음수인 경우
     */
    public StateSnapshot {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative, but was: " + sequence);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}

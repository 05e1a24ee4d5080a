package com.ryuqq.lifecycle.core.statemachine;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 상태 전이 규칙 (출발 상태 집합, 도착 상태, 이벤트 이름).
 *
 * <p>현재 상태가 {@code from}에 포함되고 이벤트 이름이 일치할 때 {@code to}로 전이합니다.</p>
 *
 * @param from 출발 상태 집합 (비어있으면 안 됨)
 * @param to 도착 상태
 * @param event 이벤트 이름
 * @param <S> 상태 타입
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record TransitionRule<S extends Enum<S>>(
    Set<S> from,
    S to,
    String event
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null이거나 from이 비어있거나 event가 비어있는 경우
     */
    public TransitionRule {
        if (from == null || from.isEmpty()) {
            throw new IllegalArgumentException("from cannot be null or empty");
        }
        if (from.contains(null)) {
            throw new IllegalArgumentException("from cannot contain null");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event cannot be null or blank");
        }
        from = Collections.unmodifiableSet(EnumSet.copyOf(from));
    }

    /**
     * 단일 출발 상태 규칙 생성.
     *
     * @param from 출발 상태
     * @param to 도착 상태
     * @param event 이벤트 이름
     * @param <S> 상태 타입
     * @return TransitionRule 인스턴스
     */
    public static <S extends Enum<S>> TransitionRule<S> of(S from, S to, String event) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return new TransitionRule<>(EnumSet.of(from), to, event);
    }

    /**
     * 규칙이 (이벤트, 현재 상태) 쌍에 적용되는지 확인.
     *
     * @param event 이벤트 이름
     * @param current 현재 상태
     * @return 적용되면 true
     */
    public boolean matches(String event, S current) {
        return this.event.equals(event) && appliesFrom(current);
    }

    /**
     * 현재 상태에서 이 규칙이 출발 가능한지 확인.
     *
     * @param current 현재 상태
     * @return from에 포함되면 true
     */
    public boolean appliesFrom(S current) {
        return from.contains(current);
    }

    @Override
    public String toString() {
        return from + " --" + event + "--> " + to;
    }
}

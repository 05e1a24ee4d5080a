package com.ryuqq.lifecycle.application.service;

import com.ryuqq.lifecycle.core.context.ContextDelta;
import com.ryuqq.lifecycle.core.context.MachineContext;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StateMachineConfig;
import com.ryuqq.lifecycle.core.statemachine.TransitionTable;

import java.time.Clock;
import java.util.EnumSet;

import static com.ryuqq.lifecycle.application.service.ServiceContext.*;
import static com.ryuqq.lifecycle.application.service.ServiceState.*;

/**
 * 단일 서비스의 가용성 점검 머신.
 *
 * <p>점검 결과 주기(UNKNOWN/AVAILABLE/BLOCKED/ERROR → CHECKING → 결과)를 모델링합니다.</p>
 *
 * <p><strong>연속 실패 규칙:</strong></p>
 * <ul>
 *   <li>BLOCKED, ERROR: consecutiveFailures 1 증가</li>
 *   <li>AVAILABLE: consecutiveFailures 0, lastError null로 초기화</li>
 *   <li>ERROR만 errorCount(누적)를 증가시킴</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ServiceMachine {

    private static final TransitionTable<ServiceState> TRANSITIONS = TransitionTable.builder(ServiceState.class)
        // Check flow
        .add(EnumSet.of(UNKNOWN, AVAILABLE, BLOCKED, ERROR), CHECKING, ServiceEvents.CHECK)
        // Results
        .add(CHECKING, AVAILABLE, ServiceEvents.AVAILABLE)
        .add(CHECKING, BLOCKED, ServiceEvents.BLOCKED)
        .add(CHECKING, ERROR, ServiceEvents.ERROR)
        // Reset
        .addFromAny(UNKNOWN, ServiceEvents.RESET)
        .build();

    private final String serviceId;
    private final StateMachine<ServiceState> machine;
    private final Clock clock;

    /**
     * 시스템 UTC Clock으로 생성.
     *
     * @param serviceId 서비스 식별자
     */
    public ServiceMachine(String serviceId) {
        this(serviceId, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param serviceId 서비스 식별자
     * @param clock 타임스탬프용 Clock
     * @throws IllegalArgumentException serviceId가 비어있거나 clock이 null인 경우
     */
    public ServiceMachine(String serviceId, Clock clock) {
        if (serviceId == null || serviceId.isBlank()) {
            throw new IllegalArgumentException("serviceId cannot be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.serviceId = serviceId;
        this.clock = clock;
        this.machine = new StateMachine<>(
            new StateMachineConfig<>(TRANSITIONS, UNKNOWN, ServiceContext.initial(serviceId)),
            clock
        );
    }

    /**
     * Service 전이 테이블.
     *
     * @return 불변 전이 테이블
     */
    public static TransitionTable<ServiceState> transitionTable() {
        return TRANSITIONS;
    }

    public String serviceId() {
        return serviceId;
    }

    /**
     * 내부 상태 머신 (조회, 구독, 이력용).
     *
     * @return 상태 머신
     */
    public StateMachine<ServiceState> machine() {
        return machine;
    }

    public ServiceState state() {
        return machine.currentState();
    }

    public MachineContext context() {
        return machine.currentContext();
    }

    /**
     * 점검 시작 (→ CHECKING), lastCheck 기록.
     *
     * @return 전이 성공 여부 (이미 CHECKING이면 false)
     */
    public boolean checkService() {
        return machine.transition(ServiceEvents.CHECK, ContextDelta.of(LAST_CHECK, clock.instant()));
    }

    /**
     * 접근 가능 결과 기록 (CHECKING → AVAILABLE).
     *
     * <p>연속 실패 횟수와 lastError를 초기화합니다.</p>
     *
     * @param latencyMs 관측 지연 (ms)
     * @return 전이 성공 여부
     * @throws IllegalArgumentException latencyMs가 음수인 경우
     */
    public boolean markServiceAvailable(long latencyMs) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs cannot be negative, but was: " + latencyMs);
        }
        return machine.transition(ServiceEvents.AVAILABLE, ContextDelta.builder()
            .set(LATENCY, latencyMs)
            .set(LAST_CHECK, clock.instant())
            .set(CONSECUTIVE_FAILURES, 0)
            .set(LAST_ERROR, null)
            .build());
    }

    /**
     * 차단 결과 기록 (CHECKING → BLOCKED), 연속 실패 1 증가.
     *
     * @return 전이 성공 여부
     */
    public boolean markServiceBlocked() {
        return machine.transition(ServiceEvents.BLOCKED, ContextDelta.builder()
            .set(LATENCY, null)
            .set(LAST_CHECK, clock.instant())
            .set(CONSECUTIVE_FAILURES, consecutiveFailures() + 1)
            .build());
    }

    /**
     * 점검 오류 기록 (CHECKING → ERROR).
     *
     * <p>누적 오류 횟수와 연속 실패 횟수를 1씩 증가시키고 오류 메시지를 기록합니다.</p>
     *
     * @param error 오류 메시지
     * @return 전이 성공 여부
     * @throws IllegalArgumentException error가 null이거나 빈 문자열인 경우
     */
    public boolean markServiceError(String error) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
        return machine.transition(ServiceEvents.ERROR, ContextDelta.builder()
            .set(LATENCY, null)
            .set(LAST_CHECK, clock.instant())
            .set(ERROR_COUNT, context().getOrDefault(ERROR_COUNT, 0) + 1)
            .set(CONSECUTIVE_FAILURES, consecutiveFailures() + 1)
            .set(LAST_ERROR, error)
            .build());
    }

    /**
     * RESET 이벤트로 UNKNOWN 복귀 (Context 유지).
     *
     * @return 전이 성공 여부
     */
    public boolean resetService() {
        return machine.transition(ServiceEvents.RESET);
    }

    private int consecutiveFailures() {
        return context().getOrDefault(CONSECUTIVE_FAILURES, 0);
    }

    @Override
    public String toString() {
        return "ServiceMachine{" + serviceId + ", state=" + state() + '}';
    }
}

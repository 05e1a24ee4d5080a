package com.ryuqq.lifecycle.application.protection;

import com.ryuqq.lifecycle.core.context.ContextDelta;
import com.ryuqq.lifecycle.core.context.MachineContext;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StateMachineConfig;
import com.ryuqq.lifecycle.core.statemachine.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;

import static com.ryuqq.lifecycle.application.protection.ProtectionContext.*;
import static com.ryuqq.lifecycle.application.protection.ProtectionState.*;

/**
 * 보호 세션 생명주기 머신.
 *
 * <p>{@link StateMachine}에 Protection 전이 테이블을 적용하고, 각 전이에 맞는
 * Context 델타를 함께 넘기는 도메인 헬퍼를 제공합니다.</p>
 *
 * <p><strong>헬퍼 공통 규칙:</strong></p>
 * <ul>
 *   <li>반환값은 전이 성공 여부 (호출자는 반드시 확인해야 함)</li>
 *   <li>성공한 전이는 lastStateChange를 현재 시각으로 갱신</li>
 *   <li>실패 시 상태와 Context는 변하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProtectionMachine protection = new ProtectionMachine();
 *
 * protection.startProtection("fake-tls");   // IDLE → CHECKING
 * protection.activateProtection();          // CHECKING → STARTING
 * protection.activateProtection();          // STARTING → ACTIVE
 *
 * protection.stopProtection();              // ACTIVE → STOPPING → IDLE
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ProtectionMachine {

    private static final Logger log = LoggerFactory.getLogger(ProtectionMachine.class);

    private static final TransitionTable<ProtectionState> TRANSITIONS = TransitionTable.builder(ProtectionState.class)
        // Normal flow
        .add(IDLE, CHECKING, ProtectionEvents.CHECK)
        .add(CHECKING, STARTING, ProtectionEvents.START)
        .add(STARTING, ACTIVE, ProtectionEvents.STARTED)
        // Degradation and recovery
        .add(ACTIVE, DEGRADED, ProtectionEvents.DEGRADE)
        .add(DEGRADED, RECOVERING, ProtectionEvents.RECOVER)
        .add(RECOVERING, ACTIVE, ProtectionEvents.RECOVERED)
        .add(RECOVERING, DEGRADED, ProtectionEvents.RECOVER_FAILED)
        // Stopping
        .add(EnumSet.of(ACTIVE, DEGRADED, RECOVERING), STOPPING, ProtectionEvents.STOP)
        .add(STOPPING, IDLE, ProtectionEvents.STOPPED)
        // Error / reset / retry
        .addFromAnyExcept(ERROR, ProtectionEvents.ERROR, ERROR)
        .addFromAny(IDLE, ProtectionEvents.RESET)
        .add(ERROR, CHECKING, ProtectionEvents.RETRY)
        .build();

    private final StateMachine<ProtectionState> machine;
    private final Clock clock;

    /**
     * 시스템 UTC Clock으로 생성.
     */
    public ProtectionMachine() {
        this(Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param clock 타임스탬프용 Clock
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public ProtectionMachine(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.machine = new StateMachine<>(
            new StateMachineConfig<>(TRANSITIONS, IDLE, ProtectionContext.initial(clock.instant())),
            clock
        );
    }

    /**
     * Protection 전이 테이블.
     *
     * @return 불변 전이 테이블
     */
    public static TransitionTable<ProtectionState> transitionTable() {
        return TRANSITIONS;
    }

    /**
     * 내부 상태 머신 (조회, 구독, 이력용).
     *
     * @return 상태 머신
     */
    public StateMachine<ProtectionState> machine() {
        return machine;
    }

    public ProtectionState state() {
        return machine.currentState();
    }

    public MachineContext context() {
        return machine.currentContext();
    }

    /**
     * 보호 시작 (IDLE → CHECKING).
     *
     * <p>CHECK가 허용되지 않는 상태면 아무것도 바꾸지 않고 false를 반환합니다.
     * 성공 시 전략을 기록하고 lastError와 recoveryAttempts를 초기화합니다.</p>
     *
     * @param strategyId 적용할 전략 ID
     * @return 전이 성공 여부
     * @throws IllegalArgumentException strategyId가 null이거나 빈 문자열인 경우
     */
    public boolean startProtection(String strategyId) {
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("strategyId cannot be null or blank");
        }
        if (!machine.canTransition(ProtectionEvents.CHECK)) {
            return false;
        }
        boolean started = machine.transition(ProtectionEvents.CHECK, ContextDelta.builder()
            .set(CURRENT_STRATEGY, strategyId)
            .set(LAST_ERROR, null)
            .set(RECOVERY_ATTEMPTS, 0)
            .set(LAST_STATE_CHANGE, now())
            .build());
        if (started) {
            log.info("Protection check started with strategy {}", strategyId);
        }
        return started;
    }

    /**
     * 기동 단계를 한 단계 진행.
     *
     * <ul>
     *   <li>CHECKING: START 발행 (→ STARTING)</li>
     *   <li>STARTING: STARTED 발행, startedAt 기록 (→ ACTIVE)</li>
     *   <li>그 외: false</li>
     * </ul>
     *
     * @return 전이 성공 여부
     */
    public boolean activateProtection() {
        if (machine.matches(CHECKING)) {
            return machine.transition(ProtectionEvents.START, stamp());
        }
        if (machine.matches(STARTING)) {
            Instant now = now();
            boolean activated = machine.transition(ProtectionEvents.STARTED, ContextDelta.builder()
                .set(STARTED_AT, now)
                .set(LAST_STATE_CHANGE, now)
                .build());
            if (activated) {
                log.info("Protection active with strategy {}", context().get(CURRENT_STRATEGY));
            }
            return activated;
        }
        return false;
    }

    /**
     * 보호 정지 (STOP → STOPPED, 최종 IDLE).
     *
     * <p>STOP이 허용되지 않는 상태(ACTIVE/DEGRADED/RECOVERING 외)면 false를 반환합니다.
     * 완료 시 currentStrategy와 startedAt을 비웁니다.</p>
     *
     * @return 전이 성공 여부
     */
    public boolean stopProtection() {
        if (!machine.canTransition(ProtectionEvents.STOP)) {
            return false;
        }
        machine.transition(ProtectionEvents.STOP, stamp());
        boolean stopped = machine.transition(ProtectionEvents.STOPPED, ContextDelta.builder()
            .set(CURRENT_STRATEGY, null)
            .set(STARTED_AT, null)
            .set(LAST_STATE_CHANGE, now())
            .build());
        if (stopped) {
            log.info("Protection stopped");
        }
        return stopped;
    }

    /**
     * 오류 상태로 전이하고 오류 메시지 기록.
     *
     * @param error 오류 메시지
     * @return 전이 성공 여부 (이미 ERROR면 false)
     * @throws IllegalArgumentException error가 null이거나 빈 문자열인 경우
     */
    public boolean handleProtectionError(String error) {
        requireError(error);
        boolean failed = machine.transition(ProtectionEvents.ERROR, ContextDelta.builder()
            .set(LAST_ERROR, error)
            .set(LAST_STATE_CHANGE, now())
            .build());
        if (failed) {
            log.warn("Protection entered ERROR: {}", error);
        }
        return failed;
    }

    /**
     * 품질 저하 보고 (ACTIVE → DEGRADED).
     *
     * @param reason 저하 원인 (lastError로 기록, null 허용)
     * @return 전이 성공 여부
     */
    public boolean degradeProtection(String reason) {
        return machine.transition(ProtectionEvents.DEGRADE, ContextDelta.builder()
            .set(LAST_ERROR, reason)
            .set(LAST_STATE_CHANGE, now())
            .build());
    }

    /**
     * 복구 시도 (DEGRADED → RECOVERING), recoveryAttempts 1 증가.
     *
     * @return 전이 성공 여부 (DEGRADED가 아니면 false)
     */
    public boolean attemptRecovery() {
        if (!machine.matches(DEGRADED)) {
            return false;
        }
        int attempts = context().getOrDefault(RECOVERY_ATTEMPTS, 0) + 1;
        return machine.transition(ProtectionEvents.RECOVER, ContextDelta.builder()
            .set(RECOVERY_ATTEMPTS, attempts)
            .set(LAST_STATE_CHANGE, now())
            .build());
    }

    /**
     * 복구 성공 (RECOVERING → ACTIVE), lastError 초기화.
     *
     * @return 전이 성공 여부
     */
    public boolean completeRecovery() {
        return machine.transition(ProtectionEvents.RECOVERED, ContextDelta.builder()
            .set(LAST_ERROR, null)
            .set(LAST_STATE_CHANGE, now())
            .build());
    }

    /**
     * 복구 실패 (RECOVERING → DEGRADED).
     *
     * @param error 실패 원인
     * @return 전이 성공 여부
     * @throws IllegalArgumentException error가 null이거나 빈 문자열인 경우
     */
    public boolean failRecovery(String error) {
        requireError(error);
        return machine.transition(ProtectionEvents.RECOVER_FAILED, ContextDelta.builder()
            .set(LAST_ERROR, error)
            .set(LAST_STATE_CHANGE, now())
            .build());
    }

    /**
     * 오류 후 재시도 (ERROR → CHECKING), lastError 초기화.
     *
     * <p>전략은 유지됩니다.</p>
     *
     * @return 전이 성공 여부
     */
    public boolean retryProtection() {
        return machine.transition(ProtectionEvents.RETRY, ContextDelta.builder()
            .set(LAST_ERROR, null)
            .set(LAST_STATE_CHANGE, now())
            .build());
    }

    /**
     * RESET 이벤트로 IDLE 복귀.
     *
     * <p>{@link StateMachine#reset()}과 달리 이력을 유지하는 일반 전이이며,
     * 세션 관련 필드(전략, 시작 시각, 오류, 복구 횟수)를 비웁니다.</p>
     *
     * @return 전이 성공 여부
     */
    public boolean resetProtection() {
        return machine.transition(ProtectionEvents.RESET, ContextDelta.builder()
            .set(CURRENT_STRATEGY, null)
            .set(STARTED_AT, null)
            .set(LAST_ERROR, null)
            .set(RECOVERY_ATTEMPTS, 0)
            .set(LAST_STATE_CHANGE, now())
            .build());
    }

    private static void requireError(String error) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
    }

    private ContextDelta stamp() {
        return ContextDelta.of(LAST_STATE_CHANGE, now());
    }

    private Instant now() {
        return clock.instant();
    }

    @Override
    public String toString() {
        return "ProtectionMachine{state=" + state() + ", strategy=" + context().get(CURRENT_STRATEGY) + '}';
    }
}

package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.context.ContextDelta;
import com.ryuqq.lifecycle.core.context.MachineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 범용 유한 상태 머신.
 *
 * <p>현재 상태, 현재 Context, 제한된 스냅샷 이력, 구독자 목록을 소유하며
 * 모든 전이를 {@link TransitionTable}에 따라 검증합니다.</p>
 *
 * <p><strong>처리 흐름 (transition):</strong></p>
 * <pre>
 * 1. (event, currentState)에 일치하는 규칙 조회
 *    - 없음: false 반환 + WARN 로그 (상태/Context 변경 없음)
 * 2. 상태를 규칙의 도착 상태로 변경, 델타가 있으면 Context 병합
 * 3. 스냅샷 기록 (용량 초과 시 가장 오래된 스냅샷 제거)
 * 4. 구독자에게 구독 순서대로 동기 통지
 * 5. true 반환
 * </pre>
 *
 * <p><strong>구독자 장애 격리:</strong></p>
 * <ul>
 *   <li>통지 시점에는 이미 상태 변경이 커밋되어 있음</li>
 *   <li>한 구독자가 예외를 던져도 ERROR 로그만 남기고 다음 구독자에게 계속 통지</li>
 *   <li>구독자 콜백 안에서 다시 전이하면, 중첩 통지가 끝난 뒤 이전 상태의 남은 통지는 건너뜀
 *       (모든 구독자의 마지막 통지는 항상 커밋된 상태와 일치)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 스레드 안전하지 않습니다. 단일 소유자가 사용하는 것을 전제로 하며,
 * 여러 스레드가 같은 인스턴스를 변경해야 한다면 호출자가 외부에서 직렬화해야 합니다.</p>
 *
 * @param <S> 상태 타입
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class StateMachine<S extends Enum<S>> {

    private static final Logger log = LoggerFactory.getLogger(StateMachine.class);

    private final StateMachineConfig<S> config;
    private final Clock clock;
    private final Deque<StateSnapshot<S>> history;
    private final List<Registration> registrations;

    private S currentState;
    private MachineContext context;
    private long sequence;
    private long notificationRound;

    /**
     * 시스템 UTC Clock으로 상태 머신 생성.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public StateMachine(StateMachineConfig<S> config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * <p>초기 상태와 초기 Context로 시작하며, 즉시 스냅샷 하나를 기록합니다.</p>
     *
     * @param config 설정
     * @param clock 스냅샷 시각용 Clock
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public StateMachine(StateMachineConfig<S> config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.history = new ArrayDeque<>(config.historyCapacity());
        this.registrations = new CopyOnWriteArrayList<>();
        this.currentState = config.initialState();
        this.context = config.initialContext();
        this.sequence = 0;
        saveSnapshot();
    }

    public S currentState() {
        return currentState;
    }

    /**
     * 현재 Context 조회.
     *
     * <p>Context는 불변이므로 반환값으로 머신 내부 상태를 바꿀 수 없습니다.</p>
     *
     * @return 현재 Context
     */
    public MachineContext currentContext() {
        return context;
    }

    /**
     * 현재 상태에서 이벤트가 허용되는지 확인 (부작용 없음).
     *
     * @param event 이벤트 이름
     * @return 일치하는 규칙이 있으면 true
     */
    public boolean canTransition(String event) {
        return config.transitions().find(event, currentState).isPresent();
    }

    /**
     * 현재 상태에서 허용되는 이벤트 목록.
     *
     * @return 선언 순서의 이벤트 이름
     */
    public List<String> availableEvents() {
        return config.transitions().availableEvents(currentState);
    }

    /**
     * Context 변경 없이 전이.
     *
     * @param event 이벤트 이름
     * @return 전이 성공 여부
     */
    public boolean transition(String event) {
        return transition(event, ContextDelta.empty());
    }

    /**
     * 전이 실행.
     *
     * <p>일치하는 규칙이 없으면 아무것도 바꾸지 않고 false를 반환합니다 (예외 없음).
     * 같은 잘못된 호출을 반복해도 상태와 Context는 변하지 않습니다.</p>
     *
     * @param event 이벤트 이름
     * @param delta 전이와 함께 병합할 Context 델타
     * @return 전이 성공 여부
     * @throws IllegalArgumentException delta가 null인 경우
     */
    public boolean transition(String event, ContextDelta delta) {
        if (delta == null) {
            throw new IllegalArgumentException("delta cannot be null");
        }

        TransitionRule<S> rule = config.transitions().find(event, currentState).orElse(null);
        if (rule == null) {
            log.warn("Invalid transition: {} from {}", event, currentState);
            return false;
        }

        // 병합이 끝난 Context를 만든 뒤에 상태와 함께 교체
        MachineContext nextContext = context.merge(delta);
        S previousState = currentState;
        currentState = rule.to();
        context = nextContext;
        sequence++;

        saveSnapshot();
        notifyListeners();

        log.debug("State transition: {} → {} ({})", previousState, currentState, event);
        return true;
    }

    /**
     * 상태 변경 없이 Context만 병합.
     *
     * <p>전이 테이블을 참조하지 않으며, 이력에 스냅샷을 남기지 않습니다.</p>
     *
     * @param delta 병합할 델타
     * @throws IllegalArgumentException delta가 null인 경우
     */
    public void updateContext(ContextDelta delta) {
        if (delta == null) {
            throw new IllegalArgumentException("delta cannot be null");
        }
        context = context.merge(delta);
        notifyListeners();
        log.debug("Context updated in {}: {}", currentState, delta);
    }

    /**
     * 구독자 등록.
     *
     * <p>등록 즉시 현재 (상태, Context)로 한 번 호출하므로, 늦게 구독해도
     * 현재 스냅샷을 놓치지 않습니다. 같은 리스너를 두 번 등록하면 두 개의 독립된 구독이 됩니다.</p>
     *
     * @param listener 구독자
     * @return 이 구독만 해제하는 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Subscription subscribe(StateListener<S> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Registration registration = new Registration(listener);
        registrations.add(registration);
        registration.deliver(currentState, context);
        return () -> registrations.remove(registration);
    }

    /**
     * 보관 중인 스냅샷 이력 (오래된 것부터).
     *
     * @return 이력 복사본 (길이 ≤ historyCapacity)
     */
    public List<StateSnapshot<S>> history() {
        return List.copyOf(history);
    }

    /**
     * 초기 상태와 초기 Context로 복원.
     *
     * <p>이력을 비우고 새 스냅샷(sequence 0)을 기록한 뒤 구독자에게 통지합니다.</p>
     */
    public void reset() {
        currentState = config.initialState();
        context = config.initialContext();
        sequence = 0;
        history.clear();
        saveSnapshot();
        notifyListeners();
        log.debug("State machine reset to {}", currentState);
    }

    /**
     * 현재 상태가 주어진 상태인지 확인.
     *
     * @param state 비교할 상태
     * @return 같으면 true
     */
    public boolean matches(S state) {
        return currentState == state;
    }

    /**
     * 현재 상태가 주어진 상태 집합에 포함되는지 확인.
     *
     * @param states 비교할 상태 집합
     * @return 포함되면 true
     * @throws IllegalArgumentException states가 null인 경우
     */
    public boolean matches(Collection<S> states) {
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        return states.contains(currentState);
    }

    /**
     * 활성 구독 수.
     *
     * @return 해제되지 않은 구독 수
     */
    public int listenerCount() {
        return registrations.size();
    }

    public StateMachineConfig<S> config() {
        return config;
    }

    private void saveSnapshot() {
        history.addLast(new StateSnapshot<>(currentState, context, sequence, clock.instant()));
        while (history.size() > config.historyCapacity()) {
            history.removeFirst();
        }
    }

    private void notifyListeners() {
        long round = ++notificationRound;
        S state = currentState;
        MachineContext snapshot = context;
        for (Registration registration : registrations) {
            if (round != notificationRound) {
                // 중첩 통지가 더 최신 상태를 모든 구독자에게 이미 전달함
                log.debug("Skipping stale notification of {}, superseded by {}", state, currentState);
                return;
            }
            registration.deliver(state, snapshot);
        }
    }

    @Override
    public String toString() {
        return "StateMachine{state=" + currentState + ", context=" + context + '}';
    }

    /**
     * 구독 단위 래퍼.
     *
     * <p>identity로 비교하여 같은 리스너의 중복 구독을 서로 독립적으로 유지합니다.</p>
     */
    private final class Registration {

        private final StateListener<S> listener;

        Registration(StateListener<S> listener) {
            this.listener = listener;
        }

        void deliver(S state, MachineContext snapshot) {
            try {
                listener.onStateChanged(state, snapshot);
            } catch (RuntimeException e) {
                log.error("State listener failed on {} (state already committed)", state, e);
            }
        }
    }
}

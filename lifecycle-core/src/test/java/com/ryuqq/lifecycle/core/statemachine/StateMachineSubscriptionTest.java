package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.context.ContextDelta;
import com.ryuqq.lifecycle.core.context.MachineContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static com.ryuqq.lifecycle.core.statemachine.Phase.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * StateMachine 구독/통지 테스트.
 *
 * <p>구독 즉시 현재 상태 재생, 구독 순서 통지, 구독 해제, 구독자 장애 격리를 검증합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StateMachineSubscriptionTest {

    @Mock
    private StateListener<Phase> first;

    @Mock
    private StateListener<Phase> second;

    private StateMachine<Phase> machine;

    @BeforeEach
    void setUp() {
        machine = new StateMachine<>(Phase.config());
    }

    @Test
    void subscribe_ImmediatelyReplaysCurrentStateOnly() {
        // given: 구독 전 전이 2회
        machine.transition("START", ContextDelta.of(STEPS, 1));
        machine.transition("PAUSE");

        // when
        machine.subscribe(first);

        // then
        verify(first, times(1)).onStateChanged(eq(PAUSED), any(MachineContext.class));
        verify(first, never()).onStateChanged(eq(IDLE), any());
        verify(first, never()).onStateChanged(eq(RUNNING), any());
    }

    @Test
    void transition_NotifiesInSubscriptionOrderWithCommittedValues() {
        // given
        machine.subscribe(first);
        machine.subscribe(second);
        clearInvocations(first, second);

        // when
        machine.transition("START", ContextDelta.of(STEPS, 1));

        // then
        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).onStateChanged(RUNNING, machine.currentContext());
        inOrder.verify(second).onStateChanged(RUNNING, machine.currentContext());
        inOrder.verifyNoMoreInteractions();
    }

    @Test
    void invalidTransition_DoesNotNotify() {
        machine.subscribe(first);
        clearInvocations(first);

        machine.transition("PAUSE");

        verifyNoInteractions(first);
    }

    @Test
    void updateContextAndReset_Notify() {
        // given
        machine.subscribe(first);
        clearInvocations(first);
        ArgumentCaptor<MachineContext> contexts = ArgumentCaptor.forClass(MachineContext.class);

        // when
        machine.updateContext(ContextDelta.of(NOTE, "hello"));
        machine.reset();

        // then
        verify(first, times(2)).onStateChanged(eq(IDLE), contexts.capture());
        assertThat(contexts.getAllValues().get(0).get(NOTE)).isEqualTo("hello");
        assertThat(contexts.getAllValues().get(1)).isEqualTo(Phase.initialContext());
    }

    @Test
    void unsubscribe_StopsFurtherNotifications() {
        // given
        Subscription subscription = machine.subscribe(first);
        clearInvocations(first);

        // when
        subscription.unsubscribe();
        subscription.unsubscribe();
        machine.transition("START");

        // then
        verifyNoInteractions(first);
        assertThat(machine.listenerCount()).isZero();
    }

    @Test
    void sameListenerTwice_YieldsIndependentSubscriptions() {
        // given
        List<Phase> seen = new ArrayList<>();
        StateListener<Phase> listener = (state, context) -> seen.add(state);
        Subscription a = machine.subscribe(listener);
        machine.subscribe(listener);

        // when
        a.unsubscribe();
        machine.transition("START");

        // then: 구독 시 2회 + 전이 시 남은 구독 1회
        assertThat(seen).containsExactly(IDLE, IDLE, RUNNING);
        assertThat(machine.listenerCount()).isEqualTo(1);
    }

    @Test
    void close_ActsAsUnsubscribe() {
        try (Subscription ignored = machine.subscribe(first)) {
            assertThat(machine.listenerCount()).isEqualTo(1);
        }
        assertThat(machine.listenerCount()).isZero();
    }

    @Test
    void throwingListener_DoesNotBlockOthersOrCorruptState() {
        // given
        lenient().doThrow(new IllegalStateException("render failed"))
            .when(first).onStateChanged(eq(RUNNING), any());
        machine.subscribe(first);
        machine.subscribe(second);

        // when
        boolean moved = machine.transition("START", ContextDelta.of(STEPS, 1));

        // then
        assertThat(moved).isTrue();
        assertThat(machine.currentState()).isEqualTo(RUNNING);
        assertThat(machine.currentContext().get(STEPS)).isEqualTo(1);
        verify(second).onStateChanged(RUNNING, machine.currentContext());
    }

    @Test
    void throwingListenerOnSubscribe_IsStillRegistered() {
        // given
        lenient().doThrow(new IllegalStateException("boom")).when(first).onStateChanged(eq(IDLE), any());

        // when
        machine.subscribe(first);
        machine.transition("START");

        // then
        verify(first).onStateChanged(eq(RUNNING), any());
        assertThat(machine.listenerCount()).isEqualTo(1);
    }

    @Test
    void listenerUnsubscribingDuringNotification_IsSafe() {
        // given
        List<Subscription> holder = new ArrayList<>();
        List<Phase> seen = new ArrayList<>();
        holder.add(machine.subscribe((state, context) -> {
            seen.add(state);
            if (state == RUNNING) {
                holder.get(0).unsubscribe();
            }
        }));
        machine.subscribe(second);

        // when
        machine.transition("START");
        machine.transition("PAUSE");

        // then
        assertThat(seen).containsExactly(IDLE, RUNNING);
        verify(second).onStateChanged(eq(PAUSED), any());
    }

    @Test
    void transitionInsideListener_LaterListenersEndOnCommittedState() {
        // given: 첫 구독자가 RUNNING을 받으면 곧바로 PAUSE
        List<Phase> seenByFirst = new ArrayList<>();
        List<Phase> seenBySecond = new ArrayList<>();
        machine.subscribe((state, context) -> {
            seenByFirst.add(state);
            if (state == RUNNING) {
                machine.transition("PAUSE");
            }
        });
        machine.subscribe((state, context) -> seenBySecond.add(state));

        // when
        boolean started = machine.transition("START");

        // then: 두 번째 구독자는 지나간 RUNNING을 뒤늦게 받지 않음
        assertThat(started).isTrue();
        assertThat(machine.currentState()).isEqualTo(PAUSED);
        assertThat(seenByFirst).containsExactly(IDLE, RUNNING, PAUSED);
        assertThat(seenBySecond).containsExactly(IDLE, PAUSED);
        assertThat(seenBySecond.get(seenBySecond.size() - 1)).isEqualTo(machine.currentState());
    }

    @Test
    void updateContextInsideListener_LaterListenersReceiveLatestContext() {
        // given
        List<MachineContext> seenBySecond = new ArrayList<>();
        machine.subscribe((state, context) -> {
            if (state == RUNNING && context.get(NOTE) == null) {
                machine.updateContext(ContextDelta.of(NOTE, "warmed up"));
            }
        });
        machine.subscribe((state, context) -> seenBySecond.add(context));
        seenBySecond.clear();

        // when
        machine.transition("START");

        // then
        assertThat(seenBySecond).hasSize(1);
        assertThat(seenBySecond.get(0).get(NOTE)).isEqualTo("warmed up");
        assertThat(seenBySecond.get(0)).isSameAs(machine.currentContext());
    }
}

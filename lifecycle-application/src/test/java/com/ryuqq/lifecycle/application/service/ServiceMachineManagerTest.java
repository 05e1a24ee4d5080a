package com.ryuqq.lifecycle.application.service;

import com.ryuqq.lifecycle.core.statemachine.StateListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.lifecycle.application.service.ServiceState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ServiceMachineManager 테스트.
 *
 * <ul>
 *   <li>getOrCreate 동일 인스턴스 반환</li>
 *   <li>checkAll / resetAll 머신별 독립 처리</li>
 *   <li>remove / clear 시 통지 없음</li>
 *   <li>동시 최초 접근 시 머신 하나만 생성</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ServiceMachineManagerTest {

    @Mock
    private StateListener<ServiceState> listener;

    private ServiceMachineManager manager;

    @BeforeEach
    void setUp() {
        manager = new ServiceMachineManager();
    }

    @Test
    void getOrCreate_SameKey_ReturnsSameInstance() {
        // when
        ServiceMachine first = manager.getOrCreate("svc1");
        ServiceMachine second = manager.getOrCreate("svc1");

        // then
        assertThat(second).isSameAs(first);
        assertThat(manager.size()).isEqualTo(1);
        assertThat(manager.get("svc1")).containsSame(first);
        assertThat(manager.get("missing")).isEmpty();
    }

    @Test
    void getOrCreate_BlankKey_ThrowsException() {
        assertThatThrownBy(() -> manager.getOrCreate(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("serviceId cannot be null or blank");
    }

    @Test
    void checkAll_MovesEveryUnknownMachineToChecking() {
        // given
        manager.getOrCreate("svc1");
        manager.getOrCreate("svc2");

        // when
        int accepted = manager.checkAll();

        // then
        assertThat(accepted).isEqualTo(2);
        assertThat(manager.getAllStates()).containsOnly(
            Map.entry("svc1", CHECKING),
            Map.entry("svc2", CHECKING)
        );
    }

    @Test
    void checkAll_OneMachineAlreadyChecking_OthersStillProceed() {
        // given
        manager.getOrCreate("svc1").checkService();
        manager.getOrCreate("svc2");

        // when
        int accepted = manager.checkAll();

        // then
        assertThat(accepted).isEqualTo(1);
        assertThat(manager.get("svc1").orElseThrow().state()).isEqualTo(CHECKING);
        assertThat(manager.get("svc2").orElseThrow().state()).isEqualTo(CHECKING);
    }

    @Test
    void resetAll_ReturnsEveryMachineToUnknown() {
        // given
        ServiceMachine blocked = manager.getOrCreate("svc1");
        blocked.checkService();
        blocked.markServiceBlocked();
        manager.getOrCreate("svc2").checkService();

        // when
        int accepted = manager.resetAll();

        // then
        assertThat(accepted).isEqualTo(2);
        assertThat(manager.getAllStates().values()).containsOnly(UNKNOWN);
    }

    @Test
    void getAllStates_IsPointInTimeCopy() {
        // given
        ServiceMachine machine = manager.getOrCreate("svc1");
        Map<String, ServiceState> before = manager.getAllStates();

        // when
        machine.checkService();

        // then
        assertThat(before).containsEntry("svc1", UNKNOWN);
        assertThatThrownBy(() -> before.put("svc2", BLOCKED))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void remove_DropsWithoutNotifying() {
        // given
        ServiceMachine machine = manager.getOrCreate("svc1");
        machine.checkService();
        machine.machine().subscribe(listener);
        clearInvocations(listener);

        // when
        boolean removed = manager.remove("svc1");

        // then
        assertThat(removed).isTrue();
        assertThat(manager.remove("svc1")).isFalse();
        assertThat(manager.get("svc1")).isEmpty();
        assertThat(machine.state()).isEqualTo(CHECKING);
        verify(listener, never()).onStateChanged(any(), any());
    }

    @Test
    void clear_DropsAllMachines() {
        // given
        ServiceMachine first = manager.getOrCreate("svc1");
        manager.getOrCreate("svc2");

        // when
        manager.clear();

        // then
        assertThat(manager.size()).isZero();
        assertThat(manager.getAll()).isEmpty();
        assertThat(manager.getOrCreate("svc1")).isNotSameAs(first);
    }

    @Test
    void independentManagers_DoNotShareMachines() {
        ServiceMachineManager other = new ServiceMachineManager();

        assertThat(other.getOrCreate("svc1")).isNotSameAs(manager.getOrCreate("svc1"));
    }

    @Test
    void getOrCreate_ConcurrentFirstAccess_CreatesExactlyOneMachine() throws Exception {
        // given
        int threads = 16;
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        Set<ServiceMachine> seen = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();

        // when: 여러 스레드에서 동시에 같은 키 최초 접근
        for (int i = 0; i < threads; i++) {
            futures.add(executorService.submit(() -> {
                startGate.await();
                seen.add(manager.getOrCreate("shared"));
                return null;
            }));
        }
        startGate.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        assertThat(seen).hasSize(1);
        assertThat(manager.size()).isEqualTo(1);
    }
}

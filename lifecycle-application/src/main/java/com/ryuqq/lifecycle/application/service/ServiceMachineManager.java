package com.ryuqq.lifecycle.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 서비스별 {@link ServiceMachine} 레지스트리.
 *
 * <p>서비스 ID마다 머신을 하나씩 지연 생성하여 보관하고, 전체 머신에 대한 일괄 작업을 제공합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>한 시점에 서비스 ID당 머신은 최대 하나</li>
 *   <li>일괄 작업은 머신마다 독립적 (한 머신의 전이 거부가 다른 머신에 영향 없음)</li>
 *   <li>remove/clear는 머신을 reset하거나 구독자에게 통지하지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 레지스트리 자체는 {@link ConcurrentHashMap#computeIfAbsent}로
 * 최초 생성 경쟁을 직렬화합니다. 개별 머신은 스레드 안전하지 않습니다.</p>
 *
 * <p>전역 싱글톤이 아니며, 호출자가 직접 생성하여 전달합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ServiceMachineManager {

    private static final Logger log = LoggerFactory.getLogger(ServiceMachineManager.class);

    private final ConcurrentHashMap<String, ServiceMachine> machines;
    private final Clock clock;

    /**
     * 시스템 UTC Clock으로 생성.
     */
    public ServiceMachineManager() {
        this(Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param clock 새로 만드는 머신에 전달할 Clock
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public ServiceMachineManager(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.machines = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    /**
     * 머신 조회, 없으면 생성 후 등록.
     *
     * @param serviceId 서비스 ID
     * @return 해당 서비스의 유일한 머신
     * @throws IllegalArgumentException serviceId가 null이거나 빈 문자열인 경우
     */
    public ServiceMachine getOrCreate(String serviceId) {
        if (serviceId == null || serviceId.isBlank()) {
            throw new IllegalArgumentException("serviceId cannot be null or blank");
        }
        return machines.computeIfAbsent(serviceId, id -> {
            log.debug("Creating service machine for {}", id);
            return new ServiceMachine(id, clock);
        });
    }

    /**
     * 등록된 머신 조회.
     *
     * @param serviceId 서비스 ID
     * @return 머신 (없으면 empty)
     */
    public Optional<ServiceMachine> get(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(machines.get(serviceId));
    }

    /**
     * 등록된 모든 머신.
     *
     * @return 머신 목록 (호출 시점 복사본)
     */
    public List<ServiceMachine> getAll() {
        return List.copyOf(machines.values());
    }

    /**
     * 서비스 ID → 현재 상태의 시점 스냅샷.
     *
     * @return 읽기 전용 맵
     */
    public Map<String, ServiceState> getAllStates() {
        Map<String, ServiceState> states = new LinkedHashMap<>();
        machines.forEach((id, machine) -> states.put(id, machine.state()));
        return Collections.unmodifiableMap(states);
    }

    /**
     * 모든 머신에 CHECK 발행.
     *
     * @return CHECK를 수락한 머신 수
     */
    public int checkAll() {
        return applyToAll("checkAll", ServiceMachine::checkService);
    }

    /**
     * 모든 머신에 RESET 발행.
     *
     * @return RESET을 수락한 머신 수
     */
    public int resetAll() {
        return applyToAll("resetAll", ServiceMachine::resetService);
    }

    /**
     * 머신 제거 (reset/통지 없음).
     *
     * @param serviceId 서비스 ID
     * @return 제거되었으면 true
     */
    public boolean remove(String serviceId) {
        if (serviceId == null) {
            return false;
        }
        return machines.remove(serviceId) != null;
    }

    /**
     * 모든 머신 제거 (reset/통지 없음).
     */
    public void clear() {
        machines.clear();
    }

    public int size() {
        return machines.size();
    }

    private int applyToAll(String operation, Predicate<ServiceMachine> action) {
        int accepted = 0;
        int total = 0;
        for (ServiceMachine machine : machines.values()) {
            total++;
            if (action.test(machine)) {
                accepted++;
            }
        }
        log.info("{} completed: {} accepted out of {}", operation, accepted, total);
        return accepted;
    }
}

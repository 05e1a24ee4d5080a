package com.ryuqq.lifecycle.application.service;

import com.ryuqq.lifecycle.core.context.ContextDelta;
import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.MachineContext;

import java.time.Instant;

/**
 * Service 머신의 Context 필드.
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>serviceId: 서비스 식별자</li>
 *   <li>lastCheck: 마지막 점검 시각 (점검 전 null)</li>
 *   <li>latency: 마지막 관측 지연 (ms, AVAILABLE일 때만 값 있음)</li>
 *   <li>errorCount: 누적 ERROR 횟수</li>
 *   <li>lastError: 마지막 오류 메시지 (AVAILABLE 시 null)</li>
 *   <li>consecutiveFailures: 연속 실패 횟수 (BLOCKED/ERROR 시 증가, AVAILABLE 시 0)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ServiceContext {

    public static final ContextKey<String> SERVICE_ID = ContextKey.of("serviceId", String.class);
    public static final ContextKey<Instant> LAST_CHECK = ContextKey.of("lastCheck", Instant.class);
    public static final ContextKey<Long> LATENCY = ContextKey.of("latency", Long.class);
    public static final ContextKey<Integer> ERROR_COUNT = ContextKey.of("errorCount", Integer.class);
    public static final ContextKey<String> LAST_ERROR = ContextKey.of("lastError", String.class);
    public static final ContextKey<Integer> CONSECUTIVE_FAILURES = ContextKey.of("consecutiveFailures", Integer.class);

    // Utility class - prevent instantiation
    private ServiceContext() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 초기 Context 생성.
     *
     * @param serviceId 서비스 식별자
     * @return 초기 Context
     */
    public static MachineContext initial(String serviceId) {
        return MachineContext.of(ContextDelta.builder()
            .set(SERVICE_ID, serviceId)
            .set(LAST_CHECK, null)
            .set(LATENCY, null)
            .set(ERROR_COUNT, 0)
            .set(LAST_ERROR, null)
            .set(CONSECUTIVE_FAILURES, 0)
            .build());
    }
}

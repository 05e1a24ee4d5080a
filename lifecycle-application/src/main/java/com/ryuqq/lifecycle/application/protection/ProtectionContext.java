package com.ryuqq.lifecycle.application.protection;

import com.ryuqq.lifecycle.core.context.ContextDelta;
import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.MachineContext;

import java.time.Instant;

/**
 * Protection 머신의 Context 필드.
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>currentStrategy: 적용 중인 전략 ID (없으면 null)</li>
 *   <li>lastError: 마지막 오류 메시지 (없으면 null)</li>
 *   <li>recoveryAttempts: 복구 시도 횟수 (CHECK 시 0으로 초기화)</li>
 *   <li>startedAt: ACTIVE 진입 시각 (정지 시 null)</li>
 *   <li>lastStateChange: 마지막 상태 변경 시각</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ProtectionContext {

    public static final ContextKey<String> CURRENT_STRATEGY = ContextKey.of("currentStrategy", String.class);
    public static final ContextKey<String> LAST_ERROR = ContextKey.of("lastError", String.class);
    public static final ContextKey<Integer> RECOVERY_ATTEMPTS = ContextKey.of("recoveryAttempts", Integer.class);
    public static final ContextKey<Instant> STARTED_AT = ContextKey.of("startedAt", Instant.class);
    public static final ContextKey<Instant> LAST_STATE_CHANGE = ContextKey.of("lastStateChange", Instant.class);

    // Utility class - prevent instantiation
    private ProtectionContext() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 초기 Context 생성.
     *
     * @param createdAt 머신 생성 시각 (lastStateChange 초기값)
     * @return 초기 Context
     */
    public static MachineContext initial(Instant createdAt) {
        return MachineContext.of(ContextDelta.builder()
            .set(CURRENT_STRATEGY, null)
            .set(LAST_ERROR, null)
            .set(RECOVERY_ATTEMPTS, 0)
            .set(STARTED_AT, null)
            .set(LAST_STATE_CHANGE, createdAt)
            .build());
    }
}

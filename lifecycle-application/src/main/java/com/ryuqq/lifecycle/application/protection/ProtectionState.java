package com.ryuqq.lifecycle.application.protection;

/**
 * 보호(protection) 세션의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE ──CHECK──► CHECKING ──START──► STARTING ──STARTED──► ACTIVE
 *
 * ACTIVE ──DEGRADE──► DEGRADED ──RECOVER──► RECOVERING
 *    ▲                   ▲                      │
 *    │                   └────RECOVER_FAILED────┤
 *    └────────────────RECOVERED─────────────────┘
 *
 * ACTIVE / DEGRADED / RECOVERING ──STOP──► STOPPING ──STOPPED──► IDLE
 *
 * (ERROR 외 모든 상태) ──ERROR──► ERROR ──RETRY──► CHECKING
 * (모든 상태) ──RESET──► IDLE
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ProtectionState {

    /**
     * 대기 중 (보호 꺼짐).
     */
    IDLE,

    /**
     * 전략 적용 전 사전 점검 중.
     */
    CHECKING,

    /**
     * 전략 기동 중.
     */
    STARTING,

    /**
     * 보호 동작 중.
     */
    ACTIVE,

    /**
     * 동작 중이나 품질 저하 감지.
     */
    DEGRADED,

    /**
     * 저하 상태에서 복구 시도 중.
     */
    RECOVERING,

    /**
     * 정지 중.
     */
    STOPPING,

    /**
     * 오류 (RETRY 또는 RESET으로만 빠져나옴).
     */
    ERROR;

    /**
     * 보호가 실제로 동작 중인지 확인.
     *
     * @return ACTIVE, DEGRADED, RECOVERING인 경우 true
     */
    public boolean isRunning() {
        return this == ACTIVE || this == DEGRADED || this == RECOVERING;
    }

    /**
     * 기동 또는 정지 과정의 중간 상태인지 확인.
     *
     * @return CHECKING, STARTING, STOPPING인 경우 true
     */
    public boolean isTransitional() {
        return this == CHECKING || this == STARTING || this == STOPPING;
    }
}

package com.ryuqq.lifecycle.application.service;

/**
 * 서비스 가용성 점검 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * UNKNOWN / AVAILABLE / BLOCKED / ERROR
 *   │ CHECK
 *   ▼
 * CHECKING
 *   ├─► AVAILABLE (AVAILABLE)
 *   ├─► BLOCKED   (BLOCKED)
 *   └─► ERROR     (ERROR)
 *
 * (모든 상태) ──RESET──► UNKNOWN
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum ServiceState {

    /**
     * 아직 점검하지 않음.
     */
    UNKNOWN,

    /**
     * 점검 중.
     */
    CHECKING,

    /**
     * 접근 가능.
     */
    AVAILABLE,

    /**
     * 차단됨.
     */
    BLOCKED,

    /**
     * 점검 실패 (차단 여부 판단 불가).
     */
    ERROR;

    /**
     * 점검 결과 상태인지 확인.
     *
     * @return AVAILABLE, BLOCKED, ERROR인 경우 true
     */
    public boolean isResult() {
        return this == AVAILABLE || this == BLOCKED || this == ERROR;
    }
}

/**
 * Protection Lifecycle - 보호 세션 상태 머신.
 *
 * <p>보호 세션의 "점검 → 기동 → 동작 → (저하/복구) → 정지" 흐름과,
 * 어느 상태에서나 진입 가능한 오류/리셋 경로를 모델링합니다.</p>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.protection.ProtectionState} - 상태</li>
 *   <li>{@link com.ryuqq.lifecycle.application.protection.ProtectionEvents} - 이벤트 이름</li>
 *   <li>{@link com.ryuqq.lifecycle.application.protection.ProtectionContext} - Context 필드</li>
 *   <li>{@link com.ryuqq.lifecycle.application.protection.ProtectionMachine} - 전이 테이블 + 도메인 헬퍼</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.protection;

/**
 * Service Health Lifecycle - 서비스 가용성 점검 상태 머신과 레지스트리.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.service.ServiceMachine} - 서비스 하나의 점검 주기</li>
 *   <li>{@link com.ryuqq.lifecycle.application.service.ServiceMachineManager} - 서비스 ID별 머신 레지스트리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application (ServiceMachineManager → ServiceMachine, ProtectionMachine)
 *   ↓ depends on
 * core (StateMachine, TransitionTable, MachineContext)
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.service;

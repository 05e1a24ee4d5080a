package com.ryuqq.lifecycle.application.service;

/**
 * Service 전이 테이블의 이벤트 이름.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ServiceEvents {

    public static final String CHECK = "CHECK";
    public static final String AVAILABLE = "AVAILABLE";
    public static final String BLOCKED = "BLOCKED";
    public static final String ERROR = "ERROR";
    public static final String RESET = "RESET";

    // Utility class - prevent instantiation
    private ServiceEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}

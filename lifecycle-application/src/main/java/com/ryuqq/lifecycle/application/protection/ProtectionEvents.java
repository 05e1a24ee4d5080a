package com.ryuqq.lifecycle.application.protection;

/**
 * Protection 전이 테이블의 이벤트 이름.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ProtectionEvents {

    public static final String CHECK = "CHECK";
    public static final String START = "START";
    public static final String STARTED = "STARTED";
    public static final String DEGRADE = "DEGRADE";
    public static final String RECOVER = "RECOVER";
    public static final String RECOVERED = "RECOVERED";
    public static final String RECOVER_FAILED = "RECOVER_FAILED";
    public static final String STOP = "STOP";
    public static final String STOPPED = "STOPPED";
    public static final String ERROR = "ERROR";
    public static final String RESET = "RESET";
    public static final String RETRY = "RETRY";

    // Utility class - prevent instantiation
    private ProtectionEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}

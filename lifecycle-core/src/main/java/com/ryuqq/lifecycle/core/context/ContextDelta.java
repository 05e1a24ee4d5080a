package com.ryuqq.lifecycle.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context에 병합할 부분 업데이트.
 *
 * <p>델타에 포함된 키만 덮어쓰며, 나머지 필드는 그대로 유지됩니다 (shallow merge).
 * null 값은 "값 없음"으로 기록됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ContextDelta delta = ContextDelta.builder()
 *     .set(LAST_ERROR, null)
 *     .set(RECOVERY_ATTEMPTS, 0)
 *     .build();
 * </pre>
 *
 * <p><strong>불변성:</strong> build() 이후 값 변경 불가</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ContextDelta {

    private static final ContextDelta EMPTY = new ContextDelta(Collections.emptyMap());

    private final Map<ContextKey<?>, Object> updates;

    private ContextDelta(Map<ContextKey<?>, Object> updates) {
        this.updates = updates;
    }

    /**
     * 빈 델타.
     *
     * @return 아무 필드도 바꾸지 않는 델타
     */
    public static ContextDelta empty() {
        return EMPTY;
    }

    /**
     * 단일 필드 델타 생성.
     *
     * @param key 필드 키
     * @param value 새 값 (null 허용)
     * @param <T> 값 타입
     * @return ContextDelta 인스턴스
     */
    public static <T> ContextDelta of(ContextKey<T> key, T value) {
        return builder().set(key, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 델타가 비어있는지 확인.
     *
     * @return 업데이트가 없으면 true
     */
    public boolean isEmpty() {
        return updates.isEmpty();
    }

    /**
     * 델타가 해당 키를 포함하는지 확인.
     *
     * @param key 필드 키
     * @return 포함하면 true
     */
    public boolean contains(ContextKey<?> key) {
        return updates.containsKey(key);
    }

    Map<ContextKey<?>, Object> updates() {
        return updates;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return updates.equals(((ContextDelta) o).updates);
    }

    @Override
    public int hashCode() {
        return updates.hashCode();
    }

    @Override
    public String toString() {
        return "ContextDelta" + updates;
    }

    /**
     * ContextDelta 빌더.
     *
     * <p>같은 키를 여러 번 설정하면 마지막 값이 사용됩니다.</p>
     */
    public static final class Builder {

        private final Map<ContextKey<?>, Object> updates = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 필드 값 설정.
         *
         * @param key 필드 키
         * @param value 새 값 (null 허용)
         * @param <T> 값 타입
         * @return this
         * @throws IllegalArgumentException key가 null이거나, 값 타입이 맞지 않거나,
         *                                  같은 이름이 다른 타입으로 이미 설정된 경우
         */
        public <T> Builder set(ContextKey<T> key, T value) {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
            for (ContextKey<?> existing : updates.keySet()) {
                key.requireSameTypeIfSameName(existing);
            }
            updates.put(key, key.cast(value));
            return this;
        }

        public ContextDelta build() {
            if (updates.isEmpty()) {
                return EMPTY;
            }
            return new ContextDelta(Collections.unmodifiableMap(new LinkedHashMap<>(updates)));
        }
    }
}

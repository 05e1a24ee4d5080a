package com.ryuqq.lifecycle.core.context;

/**
 * Context 필드의 타입 있는 키.
 *
 * <p>키는 이름과 타입으로 식별되며, {@link MachineContext#get(ContextKey)} 호출 시
 * 캐스팅 없이 값을 꺼낼 수 있게 합니다.</p>
 *
 * <p>한 Context 안에서 이름 하나는 타입 하나에만 묶입니다. 같은 이름을 다른 타입으로
 * 설정하면 {@link ContextDelta.Builder#set}과 {@link MachineContext#merge}가 거부합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ContextKey&lt;Integer&gt; attempts = ContextKey.of("recoveryAttempts", Integer.class);
 * int value = context.get(attempts);
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @param <T> 값 타입
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ContextKey<T> {

    private final String name;
    private final Class<T> type;

    private ContextKey(String name, Class<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ContextKey name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.name = name;
        this.type = type;
    }

    /**
     * ContextKey 생성.
     *
     * @param name 필드 이름
     * @param type 값 타입
     * @param <T> 값 타입
     * @return ContextKey 인스턴스
     * @throws IllegalArgumentException name이 비어있거나 type이 null인 경우
     */
    public static <T> ContextKey<T> of(String name, Class<T> type) {
        return new ContextKey<>(name, type);
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    /**
     * 값이 이 키의 타입과 호환되는지 검증 후 반환.
     *
     * @param value 검증할 값 (null 허용)
     * @return 캐스팅된 값
     * @throws IllegalArgumentException 타입이 맞지 않는 경우
     */
    T cast(Object value) {
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException(String.format(
                "Value for key '%s' must be %s, but was: %s",
                name, type.getSimpleName(), value.getClass().getSimpleName()));
        }
        return type.cast(value);
    }

    /**
     * 같은 이름이 다른 타입으로 쓰였는지 검증.
     *
     * @param other 비교할 키
     * @throws IllegalArgumentException 이름은 같고 타입이 다른 경우
     */
    void requireSameTypeIfSameName(ContextKey<?> other) {
        if (name.equals(other.name) && !type.equals(other.type)) {
            throw new IllegalArgumentException(String.format(
                "Key '%s' is already bound to %s, cannot bind it to %s",
                name, other.type.getSimpleName(), type.getSimpleName()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContextKey<?> other = (ContextKey<?>) o;
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return "ContextKey{" + name + ":" + type.getSimpleName() + '}';
    }
}

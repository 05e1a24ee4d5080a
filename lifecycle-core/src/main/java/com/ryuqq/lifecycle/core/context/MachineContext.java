package com.ryuqq.lifecycle.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 상태 머신이 현재 상태와 함께 보관하는 부가 데이터.
 *
 * <p>도메인마다 필드 구성이 다른 열린(open) 매핑이며, {@link ContextKey}로 타입 있게 조회합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>불변 객체: 변경은 항상 {@link #merge(ContextDelta)}로 새 인스턴스를 만듭니다</li>
 *   <li>병합은 원자적: 새 인스턴스가 완성되기 전에는 외부에 노출되지 않음 (부분 적용 없음)</li>
 *   <li>외부에서 내부 매핑을 변경할 수 없음 ({@link #asMap()}은 읽기 전용 복사본)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class MachineContext {

    private static final MachineContext EMPTY = new MachineContext(Collections.emptyMap());

    private final Map<ContextKey<?>, Object> values;

    private MachineContext(Map<ContextKey<?>, Object> values) {
        this.values = values;
    }

    /**
     * 빈 Context.
     *
     * @return 필드가 없는 Context
     */
    public static MachineContext empty() {
        return EMPTY;
    }

    /**
     * 초기 값으로 Context 생성.
     *
     * @param initialValues 초기 필드 값
     * @return MachineContext 인스턴스
     * @throws IllegalArgumentException initialValues가 null인 경우
     */
    public static MachineContext of(ContextDelta initialValues) {
        return EMPTY.merge(initialValues);
    }

    /**
     * 필드 값 조회.
     *
     * @param key 필드 키
     * @param <T> 값 타입
     * @return 필드 값 (필드가 없거나 값이 null이면 null)
     */
    public <T> T get(ContextKey<T> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return key.cast(values.get(key));
    }

    /**
     * 필드 값 조회 (없거나 null이면 기본값).
     *
     * @param key 필드 키
     * @param defaultValue 기본값
     * @param <T> 값 타입
     * @return 필드 값 또는 기본값
     */
    public <T> T getOrDefault(ContextKey<T> key, T defaultValue) {
        T value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * 필드 존재 여부 (null 값도 존재로 간주).
     *
     * @param key 필드 키
     * @return 필드가 있으면 true
     */
    public boolean contains(ContextKey<?> key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    /**
     * 델타를 병합한 새 Context 반환 (shallow merge).
     *
     * <p>델타에 있는 키는 덮어쓰고, 나머지 키는 유지합니다.
     * 빈 델타면 같은 인스턴스를 반환합니다.</p>
     *
     * @param delta 병합할 델타
     * @return 병합된 Context
     * @throws IllegalArgumentException delta가 null이거나, 기존 필드 이름을 다른 타입의 키로 설정하는 경우
     */
    public MachineContext merge(ContextDelta delta) {
        if (delta == null) {
            throw new IllegalArgumentException("delta cannot be null");
        }
        if (delta.isEmpty()) {
            return this;
        }
        for (ContextKey<?> key : delta.updates().keySet()) {
            for (ContextKey<?> existing : values.keySet()) {
                key.requireSameTypeIfSameName(existing);
            }
        }
        Map<ContextKey<?>, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(delta.updates());
        return new MachineContext(Collections.unmodifiableMap(merged));
    }

    /**
     * 단일 필드를 바꾼 새 Context 반환.
     *
     * @param key 필드 키
     * @param value 새 값 (null 허용)
     * @param <T> 값 타입
     * @return 병합된 Context
     */
    public <T> MachineContext with(ContextKey<T> key, T value) {
        return merge(ContextDelta.of(key, value));
    }

    /**
     * 필드 이름 → 값의 읽기 전용 복사본.
     *
     * <p>로깅이나 UI 표시용입니다. 반환된 맵을 바꿔도 Context에는 영향이 없습니다.</p>
     *
     * @return 필드 이름 순서가 보존된 읽기 전용 맵
     */
    public Map<String, Object> asMap() {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key.name(), value));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((MachineContext) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MachineContext" + asMap();
    }
}

package com.ryuqq.lifecycle.core.statemachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 상태 타입별 선언적 전이 테이블.
 *
 * <p>규칙은 선언 순서대로 보관되며, 생성 후 변경할 수 없습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>(이벤트, 상태) 쌍마다 일치하는 규칙은 최대 하나</li>
 *   <li>모호한 테이블(같은 쌍에 두 규칙)은 {@link Builder#build()}에서 거부됨</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionTable&lt;ServiceState&gt; table = TransitionTable.builder(ServiceState.class)
 *     .add(EnumSet.of(UNKNOWN, AVAILABLE), CHECKING, "CHECK")
 *     .add(CHECKING, AVAILABLE, "AVAILABLE")
 *     .addFromAny(UNKNOWN, "RESET")
 *     .build();
 * </pre>
 *
 * @param <S> 상태 타입
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TransitionTable<S extends Enum<S>> {

    private final Class<S> stateType;
    private final List<TransitionRule<S>> rules;
    private final Set<S> referencedStates;

    private TransitionTable(Class<S> stateType, List<TransitionRule<S>> rules) {
        this.stateType = stateType;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));

        EnumSet<S> states = EnumSet.noneOf(stateType);
        for (TransitionRule<S> rule : rules) {
            states.addAll(rule.from());
            states.add(rule.to());
        }
        this.referencedStates = Collections.unmodifiableSet(states);
    }

    public static <S extends Enum<S>> Builder<S> builder(Class<S> stateType) {
        return new Builder<>(stateType);
    }

    /**
     * (이벤트, 현재 상태)에 일치하는 규칙 조회.
     *
     * @param event 이벤트 이름
     * @param current 현재 상태
     * @return 일치하는 규칙 (없으면 empty)
     */
    public Optional<TransitionRule<S>> find(String event, S current) {
        for (TransitionRule<S> rule : rules) {
            if (rule.matches(event, current)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * 현재 상태에서 허용되는 이벤트 이름 목록.
     *
     * @param current 현재 상태
     * @return 선언 순서의 이벤트 이름 (중복 없음)
     */
    public List<String> availableEvents(S current) {
        Set<String> events = new LinkedHashSet<>();
        for (TransitionRule<S> rule : rules) {
            if (rule.appliesFrom(current)) {
                events.add(rule.event());
            }
        }
        return List.copyOf(events);
    }

    /**
     * 테이블이 출발 또는 도착 상태로 언급하는 모든 상태.
     *
     * @return 언급된 상태 집합
     */
    public Set<S> referencedStates() {
        return referencedStates;
    }

    public List<TransitionRule<S>> rules() {
        return rules;
    }

    public Class<S> stateType() {
        return stateType;
    }

    @Override
    public String toString() {
        return "TransitionTable{" + stateType.getSimpleName() + ", rules=" + rules.size() + '}';
    }

    /**
     * TransitionTable 빌더.
     *
     * @param <S> 상태 타입
     */
    public static final class Builder<S extends Enum<S>> {

        private final Class<S> stateType;
        private final List<TransitionRule<S>> rules = new ArrayList<>();

        private Builder(Class<S> stateType) {
            if (stateType == null) {
                throw new IllegalArgumentException("stateType cannot be null");
            }
            this.stateType = stateType;
        }

        public Builder<S> add(S from, S to, String event) {
            rules.add(TransitionRule.of(from, to, event));
            return this;
        }

        public Builder<S> add(Set<S> from, S to, String event) {
            rules.add(new TransitionRule<>(from, to, event));
            return this;
        }

        /**
         * 모든 상태에서 출발하는 규칙 추가.
         */
        public Builder<S> addFromAny(S to, String event) {
            return add(EnumSet.allOf(stateType), to, event);
        }

        /**
         * 지정한 상태를 제외한 모든 상태에서 출발하는 규칙 추가.
         */
        @SafeVarargs
        public final Builder<S> addFromAnyExcept(S to, String event, S... excluded) {
            EnumSet<S> from = EnumSet.allOf(stateType);
            from.removeAll(Arrays.asList(excluded));
            return add(from, to, event);
        }

        /**
         * TransitionTable 생성.
         *
         * @return TransitionTable 인스턴스
         * @throws IllegalArgumentException 규칙이 하나도 없는 경우
         * @throws IllegalStateException 같은 (이벤트, 상태) 쌍에 두 규칙이 일치하는 경우
         */
        public TransitionTable<S> build() {
            if (rules.isEmpty()) {
                throw new IllegalArgumentException("TransitionTable must declare at least one rule");
            }
            rejectAmbiguousRules();
            return new TransitionTable<>(stateType, rules);
        }

        private void rejectAmbiguousRules() {
            for (int i = 0; i < rules.size(); i++) {
                TransitionRule<S> first = rules.get(i);
                for (int j = i + 1; j < rules.size(); j++) {
                    TransitionRule<S> second = rules.get(j);
                    if (!first.event().equals(second.event())) {
                        continue;
                    }
                    EnumSet<S> overlap = EnumSet.copyOf(first.from());
                    overlap.retainAll(second.from());
                    if (!overlap.isEmpty()) {
                        throw new IllegalStateException(String.format(
                            "Ambiguous transition table: event %s from %s matches rule #%d (%s) and rule #%d (%s)",
                            first.event(), overlap, i, first, j, second));
                    }
                }
            }
        }
    }
}

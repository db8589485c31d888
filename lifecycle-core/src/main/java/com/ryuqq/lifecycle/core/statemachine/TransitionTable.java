package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 엔티티 종류별 전이 표.
 *
 * <p>(fromState, action) → toState 부분 함수입니다. 표에 없는 쌍은
 * 해당 상태에서 구조적으로 허용되지 않는 동작을 의미합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>(fromState, action) 쌍마다 규칙은 최대 하나 (중복 등록은 {@link ConfigurationException})</li>
 *   <li>모든 규칙의 State는 선언된 State 집합에 속함</li>
 *   <li>생성 후 변경 불가</li>
 *   <li>나가는 규칙이 없는 State는 종료 상태</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionTable table = TransitionTable.builder(EntityKind.of("ARTICLE"))
 *     .states(DRAFT, MODERATION, PUBLISHED)
 *     .rule(DRAFT, SUBMIT_FOR_REVIEW, MODERATION)
 *     .rule(MODERATION, PUBLISH, PUBLISHED)
 *     .rule(MODERATION, REVERT_TO_DRAFT, DRAFT)
 *     .build();
 *
 * table.allowedTransition(DRAFT, SUBMIT_FOR_REVIEW); // Optional[Moderation]
 * table.allowedTransition(DRAFT, PUBLISH);           // Optional.empty
 * table.isTerminal(PUBLISHED);                       // true
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TransitionTable {

    private final EntityKind entityKind;
    private final Set<State> states;
    private final Set<Action> actions;
    private final Map<State, Map<Action, State>> rules;
    private final List<TransitionRule> ruleList;

    private TransitionTable(EntityKind entityKind, Set<State> states,
                            Map<State, Map<Action, State>> rules, List<TransitionRule> ruleList) {
        this.entityKind = entityKind;
        this.states = Collections.unmodifiableSet(states);
        this.rules = rules;
        this.ruleList = Collections.unmodifiableList(ruleList);

        Set<Action> collected = new LinkedHashSet<>();
        for (TransitionRule rule : ruleList) {
            collected.add(rule.action());
        }
        this.actions = Collections.unmodifiableSet(collected);
    }

    /**
     * Builder 생성.
     *
     * @param entityKind 엔티티 종류
     * @return 새 Builder
     * @throws IllegalArgumentException entityKind가 null인 경우
     */
    public static Builder builder(EntityKind entityKind) {
        return new Builder(entityKind);
    }

    /**
     * 허용된 전이 조회.
     *
     * <p>부수 효과가 없으며, 같은 인자에 대해 항상 같은 결과를 반환합니다.</p>
     *
     * @param from 현재 상태
     * @param action 요청 동작
     * @return 도착 상태 (규칙이 없으면 empty)
     * @throws IllegalArgumentException from 또는 action이 null인 경우
     */
    public Optional<State> allowedTransition(State from, Action action) {
        if (from == null || action == null) {
            throw new IllegalArgumentException("from and action cannot be null (from: " + from + ", action: " + action + ")");
        }
        Map<Action, State> outgoing = rules.get(from);
        if (outgoing == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(outgoing.get(action));
    }

    /**
     * 종료 상태인지 확인.
     *
     * @param state 상태
     * @return 나가는 규칙이 하나도 없으면 true
     */
    public boolean isTerminal(State state) {
        Map<Action, State> outgoing = rules.get(state);
        return outgoing == null || outgoing.isEmpty();
    }

    /**
     * 주어진 상태에서 구조적으로 허용되는 동작 목록.
     *
     * @param state 상태
     * @return 동작 집합 (불변, 등록 순서)
     */
    public Set<Action> actionsFrom(State state) {
        Map<Action, State> outgoing = rules.get(state);
        return outgoing == null ? Set.of() : outgoing.keySet();
    }

    /**
     * State가 이 표에 선언되었는지 확인.
     *
     * @param state 상태
     * @return 선언되었으면 true
     */
    public boolean declares(State state) {
        return states.contains(state);
    }

    /**
     * Action이 이 표의 규칙에 등장하는지 확인.
     *
     * @param action 동작
     * @return 규칙에 등장하면 true
     */
    public boolean declares(Action action) {
        return actions.contains(action);
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public Set<State> states() {
        return states;
    }

    public Set<Action> actions() {
        return actions;
    }

    public List<TransitionRule> rules() {
        return ruleList;
    }

    @Override
    public String toString() {
        return "TransitionTable{" + entityKind + ", states=" + states.size() + ", rules=" + ruleList.size() + '}';
    }

    /**
     * TransitionTable Builder.
     *
     * <p>Thread-safe하지 않습니다. 설정 단계에서 한 스레드가 사용해야 합니다.</p>
     */
    public static final class Builder {

        private final EntityKind entityKind;
        private final Set<State> declaredStates = new LinkedHashSet<>();
        private final Map<State, Map<Action, State>> rules = new LinkedHashMap<>();
        private final List<TransitionRule> ruleList = new ArrayList<>();

        private Builder(EntityKind entityKind) {
            if (entityKind == null) {
                throw new IllegalArgumentException("entityKind cannot be null");
            }
            this.entityKind = entityKind;
        }

        /**
         * State 집합을 명시적으로 선언.
         *
         * <p>선언하면 규칙은 선언된 State만 참조할 수 있습니다. 선언하지 않으면
         * 규칙에 등장한 State가 집합이 됩니다.</p>
         *
         * @param states 상태 목록
         * @return this
         * @throws IllegalArgumentException states 중 null이 있는 경우
         */
        public Builder states(State... states) {
            if (states == null) {
                throw new IllegalArgumentException("states cannot be null");
            }
            for (State state : states) {
                if (state == null) {
                    throw new IllegalArgumentException("state cannot be null");
                }
                declaredStates.add(state);
            }
            return this;
        }

        /**
         * 규칙 등록.
         *
         * @param from 출발 상태
         * @param action 동작
         * @param to 도착 상태
         * @return this
         * @throws IllegalArgumentException 인자가 null인 경우
         * @throws ConfigurationException (from, action) 규칙이 이미 등록된 경우
         */
        public Builder rule(State from, Action action, State to) {
            return rule(new TransitionRule(from, action, to));
        }

        /**
         * 규칙 등록.
         *
         * @param rule 규칙
         * @return this
         * @throws ConfigurationException (from, action) 규칙이 이미 등록된 경우
         */
        public Builder rule(TransitionRule rule) {
            if (rule == null) {
                throw new IllegalArgumentException("rule cannot be null");
            }
            Map<Action, State> outgoing = rules.computeIfAbsent(rule.from(), ignored -> new LinkedHashMap<>());
            State existing = outgoing.get(rule.action());
            if (existing != null) {
                throw new ConfigurationException(String.format(
                    "Duplicate transition rule for %s: (%s, %s) already maps to %s, cannot map to %s",
                    entityKind, rule.from(), rule.action(), existing, rule.to()));
            }
            outgoing.put(rule.action(), rule.to());
            ruleList.add(rule);
            return this;
        }

        /**
         * 규칙이 이미 등록되었는지 확인.
         *
         * @param from 출발 상태
         * @param action 동작
         * @return 등록되었으면 true
         */
        public boolean hasRule(State from, Action action) {
            Map<Action, State> outgoing = rules.get(from);
            return outgoing != null && outgoing.containsKey(action);
        }

        /**
         * TransitionTable 생성.
         *
         * @return 불변 TransitionTable
         * @throws ConfigurationException State가 하나도 없거나, 선언되지 않은 State를 참조하는 규칙이 있는 경우
         */
        public TransitionTable build() {
            Set<State> states = new LinkedHashSet<>(declaredStates);
            if (declaredStates.isEmpty()) {
                for (TransitionRule rule : ruleList) {
                    states.add(rule.from());
                    states.add(rule.to());
                }
            } else {
                for (TransitionRule rule : ruleList) {
                    if (!declaredStates.contains(rule.from()) || !declaredStates.contains(rule.to())) {
                        throw new ConfigurationException(String.format(
                            "Rule %s of %s references a state outside the declared set %s",
                            rule, entityKind, declaredStates));
                    }
                }
            }
            if (states.isEmpty()) {
                throw new ConfigurationException("TransitionTable for " + entityKind + " declares no states");
            }

            Map<State, Map<Action, State>> frozen = new LinkedHashMap<>();
            for (Map.Entry<State, Map<Action, State>> entry : rules.entrySet()) {
                frozen.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
            }
            return new TransitionTable(entityKind, states, Collections.unmodifiableMap(frozen), new ArrayList<>(ruleList));
        }
    }
}

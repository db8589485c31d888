package com.ryuqq.lifecycle.core.guard;

import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.TransitionContext;

import java.util.Set;
import java.util.function.Function;

/**
 * 전이를 거부할 수 있는 단일 책임 검증기.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>컨텍스트를 변경하지 않음 (읽기 전용)</li>
 *   <li>평가 과정에서 공유 상태를 변경하지 않음 (자체 설정값은 보유 가능, 예: 최소 비밀번호 길이)</li>
 *   <li>다른 Guard의 실행 순서에 의존하지 않음. 필요한 데이터는 {@link #requiredKeys()}로 선언</li>
 *   <li>빠른 동기 판정. 외부 사실 확인(이메일 중복 등)은 호스트가 제공하는 동기 조회 포트를 통해서만 수행</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * public final class ModeratorRoleGuard implements Guard {
 *
 *     @Override
 *     public GuardDecision evaluate(TransitionContext context) {
 *         String role = context.require(ArticleKeys.ACTOR_ROLE);
 *         return "MODERATOR".equals(role)
 *             ? GuardDecision.approve()
 *             : GuardDecision.deny("moderator role required");
 *     }
 *
 *     @Override
 *     public Set<ContextKey<?>> requiredKeys() {
 *         return Set.of(ArticleKeys.ACTOR_ROLE);
 *     }
 * }
 * }</pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface Guard {

    /**
     * 전이 요청 평가.
     *
     * @param context 전이 컨텍스트 (읽기 전용)
     * @return Approve 또는 Deny
     */
    GuardDecision evaluate(TransitionContext context);

    /**
     * Guard 이름.
     *
     * <p>거부 결과에 실패한 Guard를 식별하는 값으로 담기며, 한 Chain 안에서 유일해야 합니다.
     * 기본값은 구현 클래스의 단순 이름이며, 익명 클래스는 바이너리 이름(예: {@code Foo$1})을 사용합니다.</p>
     *
     * @return Guard 이름
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }

    /**
     * 이 Guard가 읽는 컨텍스트 속성 키.
     *
     * <p>선언된 키가 컨텍스트에 없으면 GuardChain은 이 Guard를 호출하지 않고
     * 거부로 처리합니다.</p>
     *
     * @return 필수 키 집합 (기본값: 없음)
     */
    default Set<ContextKey<?>> requiredKeys() {
        return Set.of();
    }

    /**
     * 이름이 지정된 함수형 Guard 생성.
     *
     * @param name Guard 이름
     * @param evaluator 평가 함수
     * @return Guard 인스턴스
     * @throws IllegalArgumentException name이 비어있거나 evaluator가 null인 경우
     */
    static Guard of(String name, Function<TransitionContext, GuardDecision> evaluator) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator cannot be null");
        }
        return new Guard() {
            @Override
            public GuardDecision evaluate(TransitionContext context) {
                return evaluator.apply(context);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return "Guard{" + name + '}';
            }
        };
    }
}

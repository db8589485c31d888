package com.ryuqq.lifecycle.core.engine;

import com.ryuqq.lifecycle.core.context.Attributes;
import com.ryuqq.lifecycle.core.context.ContextKey;
import com.ryuqq.lifecycle.core.context.TransitionContext;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.guard.Guard;
import com.ryuqq.lifecycle.core.guard.GuardDecision;
import com.ryuqq.lifecycle.core.guard.GuardPosition;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.EntityKind;
import com.ryuqq.lifecycle.core.model.State;
import com.ryuqq.lifecycle.core.result.Committed;
import com.ryuqq.lifecycle.core.result.ConcurrencyConflict;
import com.ryuqq.lifecycle.core.result.GuardDenied;
import com.ryuqq.lifecycle.core.result.StructurallyIllegal;
import com.ryuqq.lifecycle.core.result.TransitionResult;
import com.ryuqq.lifecycle.core.statemachine.TransitionTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * LifecycleEngine 유닛 테스트.
 *
 * <ul>
 *   <li>구조 검증 → Guard 평가 → compare-and-set 확정 순서</li>
 *   <li>거부 시 상태 불변</li>
 *   <li>후처리 리스너 실패가 확정을 되돌리지 않음</li>
 *   <li>동시 요청 중 하나만 확정</li>
 *   <li>설정 오류는 구성 시점에만 발생</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LifecycleEngineTest {

    private static final EntityKind ARTICLE = EntityKind.of("ARTICLE");
    private static final State DRAFT = State.of("Draft");
    private static final State MODERATION = State.of("Moderation");
    private static final State PUBLISHED = State.of("Published");
    private static final Action SUBMIT = Action.of("submit-for-review");
    private static final Action PUBLISH = Action.of("publish");
    private static final Action MODERATION_ACTION = Action.of("moderation");
    private static final Action REVERT = Action.of("revert-to-draft");

    private static final ContextKey<String> ROLE = ContextKey.of("actorRole", String.class);

    @Mock
    private TransitionListener listener;

    @Mock
    private TransitionListener secondListener;

    private TransitionTable table;

    @BeforeEach
    void setUp() {
        table = TransitionTable.builder(ARTICLE)
            .states(DRAFT, MODERATION, PUBLISHED)
            .rule(DRAFT, SUBMIT, MODERATION)
            .rule(MODERATION, PUBLISH, PUBLISHED)
            .rule(MODERATION, REVERT, DRAFT)
            .rule(MODERATION, MODERATION_ACTION, MODERATION)
            .build();
    }

    private LifecycleEngine engineWithoutGuards() {
        return LifecycleEngine.builder().table(table).build();
    }

    private static Guard counting(String name, AtomicInteger calls, GuardDecision decision) {
        return Guard.of(name, ctx -> {
            calls.incrementAndGet();
            return decision;
        });
    }

    // ============================================================
    // 1. 구조 검증
    // ============================================================

    @Test
    void requestTransition_규칙이_있고_Chain이_비어있으면_Committed() {
        // given
        LifecycleEngine engine = engineWithoutGuards();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        TransitionResult result = engine.requestTransition(article, SUBMIT);

        // then
        assertThat(result).isEqualTo(new Committed(DRAFT, MODERATION));
        assertThat(article.currentState()).isEqualTo(MODERATION);
    }

    @Test
    void requestTransition_규칙이_없으면_StructurallyIllegal_상태_불변() {
        // given
        LifecycleEngine engine = engineWithoutGuards();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        TransitionResult result = engine.requestTransition(article, PUBLISH);

        // then
        assertThat(result.isRejected()).isTrue();
        assertThat(result.rejectKind()).isEqualTo(new StructurallyIllegal(DRAFT, PUBLISH));
        assertThat(article.currentState()).isEqualTo(DRAFT);
    }

    @Test
    void requestTransition_규칙이_없으면_다른_상태용_Guard도_평가하지_않음() {
        // given: moderation 동작에 Guard가 있지만 Published에서는 규칙이 없음
        AtomicInteger calls = new AtomicInteger();
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, MODERATION_ACTION, counting("AlwaysApprove", calls, GuardDecision.approve()))
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", PUBLISHED, engine);

        // when
        TransitionResult result = engine.requestTransition(article, MODERATION_ACTION);

        // then
        assertThat(result.rejectKind()).isInstanceOf(StructurallyIllegal.class);
        assertThat(calls.get()).isZero();
        assertThat(article.currentState()).isEqualTo(PUBLISHED);
    }

    @Test
    void requestTransition_종료_상태에서는_모든_동작이_StructurallyIllegal() {
        // given
        LifecycleEngine engine = engineWithoutGuards();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", PUBLISHED, engine);

        // when & then
        assertThat(engine.table(ARTICLE).isTerminal(PUBLISHED)).isTrue();
        for (Action action : engine.table(ARTICLE).actions()) {
            assertThat(engine.requestTransition(article, action).rejectKind())
                .isInstanceOf(StructurallyIllegal.class);
        }
        assertThat(article.currentState()).isEqualTo(PUBLISHED);
    }

    // ============================================================
    // 2. Guard 평가
    // ============================================================

    @Test
    void requestTransition_Guard가_거부하면_GuardDenied_상태_불변() {
        // given
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, PUBLISH, Guard.of("ModeratorRole", ctx ->
                "MODERATOR".equals(ctx.require(ROLE))
                    ? GuardDecision.approve()
                    : GuardDecision.deny("moderator role required")))
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", MODERATION, engine);

        // when
        TransitionResult denied = engine.requestTransition(article, PUBLISH, Attributes.of(ROLE, "WRITER"));

        // then
        assertThat(denied.rejectKind()).isEqualTo(new GuardDenied("moderator role required", "ModeratorRole"));
        assertThat(article.currentState()).isEqualTo(MODERATION);

        // when: 입력을 고쳐 다시 요청
        TransitionResult committed = engine.requestTransition(article, PUBLISH, Attributes.of(ROLE, "MODERATOR"));

        // then
        assertThat(committed).isEqualTo(new Committed(MODERATION, PUBLISHED));
        assertThat(article.currentState()).isEqualTo(PUBLISHED);
    }

    @Test
    void requestTransition_첫_Guard가_거부하면_다음_Guard는_호출되지_않음() {
        // given
        AtomicInteger calls = new AtomicInteger();
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, SUBMIT, Guard.of("A", ctx -> GuardDecision.deny("A says no")))
            .guard(ARTICLE, SUBMIT, counting("B", calls, GuardDecision.approve()))
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        TransitionResult result = article.requestTransition(SUBMIT);

        // then
        assertThat(result.rejectKind()).isEqualTo(new GuardDenied("A says no", "A"));
        assertThat(calls.get()).isZero();
    }

    @Test
    void requestTransition_Guard는_도착_상태가_채워진_컨텍스트를_받음() {
        // given
        List<TransitionContext> seen = new ArrayList<>();
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, SUBMIT, Guard.of("Recorder", ctx -> {
                seen.add(ctx);
                return GuardDecision.approve();
            }))
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-7", DRAFT, engine);

        // when
        article.requestTransition(SUBMIT, Attributes.of(ROLE, "WRITER"));

        // then
        assertThat(seen).hasSize(1);
        TransitionContext context = seen.get(0);
        assertThat(context.entityKind()).isEqualTo(ARTICLE);
        assertThat(context.entityId()).isEqualTo("article-7");
        assertThat(context.fromState()).isEqualTo(DRAFT);
        assertThat(context.toState()).isEqualTo(MODERATION);
        assertThat(context.require(ROLE)).isEqualTo("WRITER");
    }

    @Test
    void requestTransition_공통_Guard가_먼저_평가됨() {
        // given
        AtomicInteger actionCalls = new AtomicInteger();
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, SUBMIT, counting("ActionGuard", actionCalls, GuardDecision.approve()))
            .guardForAllActions(ARTICLE, Guard.of("Authenticated", ctx -> GuardDecision.deny("not authenticated")),
                GuardPosition.append())
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        TransitionResult result = article.requestTransition(SUBMIT);

        // then
        assertThat(result.rejectKind()).isEqualTo(new GuardDenied("not authenticated", "Authenticated"));
        assertThat(actionCalls.get()).isZero();
    }

    @Test
    void registerGuard_실행_중_등록한_Guard가_다음_요청부터_적용() {
        // given
        LifecycleEngine engine = engineWithoutGuards();
        LifecycleEntity first = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);
        LifecycleEntity second = new LifecycleEntity(ARTICLE, "article-2", DRAFT, engine);
        assertThat(first.requestTransition(SUBMIT).isCommitted()).isTrue();

        // when
        engine.registerGuard(ARTICLE, SUBMIT, Guard.of("Frozen", ctx -> GuardDecision.deny("submissions closed")),
            GuardPosition.append());

        // then
        assertThat(second.requestTransition(SUBMIT).rejectKind())
            .isEqualTo(new GuardDenied("submissions closed", "Frozen"));
    }

    // ============================================================
    // 3. 후처리 리스너
    // ============================================================

    @Test
    void listener_확정_후_등록_순서대로_호출() {
        // given
        LifecycleEngine engine = LifecycleEngine.builder().table(table).listener(listener).listener(secondListener).build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        article.requestTransition(SUBMIT);

        // then
        InOrder inOrder = inOrder(listener, secondListener);
        ArgumentCaptor<TransitionContext> captor = ArgumentCaptor.forClass(TransitionContext.class);
        inOrder.verify(listener).onCommitted(captor.capture());
        inOrder.verify(secondListener).onCommitted(any());
        assertThat(captor.getValue().toState()).isEqualTo(MODERATION);
    }

    @Test
    void listener_예외가_발생해도_확정은_유지되고_다음_리스너_호출() {
        // given
        doThrow(new RuntimeException("mail server down")).when(listener).onCommitted(any());
        LifecycleEngine engine = LifecycleEngine.builder().table(table).listener(listener).listener(secondListener).build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        TransitionResult result = article.requestTransition(SUBMIT);

        // then
        assertThat(result.isCommitted()).isTrue();
        assertThat(article.currentState()).isEqualTo(MODERATION);
        verify(secondListener).onCommitted(any());
    }

    @Test
    void listener_거부된_전이에는_호출되지_않음() {
        // given
        LifecycleEngine engine = engineWithoutGuards();
        engine.addListener(listener);
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        article.requestTransition(PUBLISH);

        // then
        verify(listener, never()).onCommitted(any());
    }

    @Test
    void removeListener_제거된_리스너는_호출되지_않음() {
        // given
        LifecycleEngine engine = engineWithoutGuards();
        engine.addListener(listener);
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        boolean removed = engine.removeListener(listener);
        article.requestTransition(SUBMIT);

        // then
        assertThat(removed).isTrue();
        verifyNoInteractions(listener);
    }

    @Test
    void name_익명_리스너는_클래스_이름을_사용() {
        // given
        TransitionListener anonymous = new TransitionListener() {
            @Override
            public void onCommitted(TransitionContext context) {
            }
        };

        // when & then
        assertThat(anonymous.name()).isEqualTo(anonymous.getClass().getName()).isNotBlank();
    }

    // ============================================================
    // 4. 동시성
    // ============================================================

    @Test
    void requestTransition_동시_요청_중_하나만_확정되고_나머지는_충돌() throws Exception {
        // given: 모든 스레드가 Draft 기준 검증을 통과한 뒤 동시에 확정을 시도하도록 Guard에서 대기
        int threads = 8;
        CyclicBarrier barrier = new CyclicBarrier(threads);
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, SUBMIT, Guard.of("Barrier", ctx -> {
                try {
                    barrier.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
                return GuardDecision.approve();
            }))
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        List<Future<TransitionResult>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executorService.submit(() -> article.requestTransition(SUBMIT)));
            }

            // then
            int committed = 0;
            int conflicts = 0;
            for (Future<TransitionResult> future : futures) {
                TransitionResult result = future.get(10, TimeUnit.SECONDS);
                if (result.isCommitted()) {
                    committed++;
                } else if (result.rejectKind() instanceof ConcurrencyConflict conflict) {
                    assertThat(conflict.expected()).isEqualTo(DRAFT);
                    assertThat(conflict.actual()).isEqualTo(MODERATION);
                    conflicts++;
                }
            }
            assertThat(committed).isEqualTo(1);
            assertThat(conflicts).isEqualTo(threads - 1);
            assertThat(article.currentState()).isEqualTo(MODERATION);
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void requestTransition_자기_전이_동시_요청도_하나만_확정() throws Exception {
        // given: Moderation --moderation--> Moderation, 모든 스레드가 Moderation을 읽은 뒤 확정 시도
        int threads = 8;
        CyclicBarrier barrier = new CyclicBarrier(threads);
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, MODERATION_ACTION, Guard.of("Barrier", ctx -> {
                try {
                    barrier.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
                return GuardDecision.approve();
            }))
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", MODERATION, engine);

        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        List<Future<TransitionResult>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executorService.submit(() -> article.requestTransition(MODERATION_ACTION)));
            }

            // then
            int committed = 0;
            int conflicts = 0;
            for (Future<TransitionResult> future : futures) {
                TransitionResult result = future.get(10, TimeUnit.SECONDS);
                if (result.isCommitted()) {
                    committed++;
                } else if (result.rejectKind() instanceof ConcurrencyConflict conflict) {
                    assertThat(conflict.expected()).isEqualTo(MODERATION);
                    assertThat(conflict.actual()).isEqualTo(MODERATION);
                    conflicts++;
                }
            }
            assertThat(committed).isEqualTo(1);
            assertThat(conflicts).isEqualTo(threads - 1);
            assertThat(article.version()).isEqualTo(1L);
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void requestTransition_검증_중_A_B_A로_돌아와도_충돌() {
        // given: moderation 평가 도중 같은 엔티티가 Moderation → Draft → Moderation으로 두 번 확정됨
        AtomicReference<LifecycleEntity> target = new AtomicReference<>();
        LifecycleEngine engine = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, MODERATION_ACTION, Guard.of("RoundTrip", ctx -> {
                LifecycleEntity entity = target.get();
                assertThat(entity.requestTransition(REVERT).isCommitted()).isTrue();
                assertThat(entity.requestTransition(SUBMIT).isCommitted()).isTrue();
                return GuardDecision.approve();
            }))
            .build();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", MODERATION, engine);
        target.set(article);

        // when
        TransitionResult result = article.requestTransition(MODERATION_ACTION);

        // then
        assertThat(result.rejectKind()).isEqualTo(new ConcurrencyConflict(MODERATION, MODERATION));
        assertThat(article.currentState()).isEqualTo(MODERATION);
        assertThat(article.version()).isEqualTo(2L);
    }

    @Test
    void version_확정마다_증가하고_거부는_변화_없음() {
        // given
        LifecycleEngine engine = engineWithoutGuards();
        LifecycleEntity article = new LifecycleEntity(ARTICLE, "article-1", DRAFT, engine);

        // when
        article.requestTransition(SUBMIT);
        article.requestTransition(MODERATION_ACTION);
        article.requestTransition(SUBMIT);

        // then
        assertThat(article.currentState()).isEqualTo(MODERATION);
        assertThat(article.version()).isEqualTo(2L);
    }

    // ============================================================
    // 5. 설정 오류
    // ============================================================

    @Test
    void build_Table이_없으면_설정_오류() {
        assertThatThrownBy(() -> LifecycleEngine.builder().build())
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void build_같은_종류의_Table을_두_번_등록하면_설정_오류() {
        assertThatThrownBy(() -> LifecycleEngine.builder().table(table).table(table))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    void build_Table에_없는_동작에_묶인_Guard는_설정_오류() {
        // given
        LifecycleEngine.Builder builder = LifecycleEngine.builder()
            .table(table)
            .guard(ARTICLE, Action.of("archive"), Guard.of("A", ctx -> GuardDecision.approve()));

        // when & then
        assertThatThrownBy(builder::build)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("no rule for action archive");
    }

    @Test
    void build_등록되지_않은_종류에_묶인_Guard는_설정_오류() {
        // given
        LifecycleEngine.Builder builder = LifecycleEngine.builder()
            .table(table)
            .guardForAllActions(EntityKind.of("ACCOUNT"), Guard.of("A", ctx -> GuardDecision.approve()),
                GuardPosition.append());

        // when & then
        assertThatThrownBy(builder::build).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void registerGuard_실행_중에도_Table_기준_검증() {
        // given
        LifecycleEngine engine = engineWithoutGuards();

        // when & then
        assertThatThrownBy(() -> engine.registerGuard(ARTICLE, Action.of("archive"),
            Guard.of("A", ctx -> GuardDecision.approve()), GuardPosition.append()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void 생성자_선언되지_않은_초기_상태는_예외() {
        // given
        LifecycleEngine engine = engineWithoutGuards();

        // when & then
        assertThatThrownBy(() -> new LifecycleEntity(ARTICLE, "article-1", State.of("Archived"), engine))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not declared");
    }

    @Test
    void requestTransition_등록되지_않은_종류의_엔티티는_예외() {
        // given
        LifecycleEngine engine = engineWithoutGuards();

        // when & then
        assertThatThrownBy(() -> new LifecycleEntity(EntityKind.of("ACCOUNT"), "account-1", DRAFT, engine))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No lifecycle registered");
        assertThatThrownBy(() -> engine.requestTransition(null, SUBMIT))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void allowedTransition_반복_조회는_같은_결과() {
        // given
        LifecycleEngine engine = engineWithoutGuards();

        // when & then
        assertThat(engine.allowedTransition(ARTICLE, DRAFT, SUBMIT)).contains(MODERATION);
        assertThat(engine.allowedTransition(ARTICLE, DRAFT, SUBMIT)).contains(MODERATION);
        assertThat(engine.allowedTransition(ARTICLE, DRAFT, PUBLISH)).isEmpty();
        assertThat(engine.manages(ARTICLE)).isTrue();
        assertThat(engine.entityKinds()).containsExactly(ARTICLE);
    }
}

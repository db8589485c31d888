package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.application.service.LifecycleServiceConfig;
import com.ryuqq.lifecycle.core.result.TransitionResult;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: concurrent requests against one entity.
 *
 * <p>N concurrent requests for the same legal action from the same starting state
 * produce exactly one commit. The others either lose the race
 * (ConcurrencyConflict) or are re-validated against the new state
 * (StructurallyIllegal). The final state is the single committed target.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class ConcurrencyContractTest extends AbstractLifecycleContractTest {

    private static final int THREADS = 16;

    @Override
    protected LifecycleServiceConfig config() {
        return new LifecycleServiceConfig().withMaxConflictRetries(2);
    }

    @RepeatedTest(5)
    void testConcurrentSubmit_ExactlyOneCommits() throws Exception {
        // Given
        Document document = newDocument(DRAFT);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executorService = Executors.newFixedThreadPool(THREADS);
        List<Future<TransitionResult>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(executorService.submit(() -> {
                    start.await();
                    return request(document, SUBMIT_FOR_REVIEW);
                }));
            }

            // When
            start.countDown();

            // Then
            int committed = 0;
            for (Future<TransitionResult> future : futures) {
                TransitionResult result = future.get(10, TimeUnit.SECONDS);
                if (result.isCommitted()) {
                    committed++;
                } else {
                    assertLostRace(result);
                }
            }
            assertEquals(1, committed, "Exactly one request must commit");
            assertState(document, MODERATION);
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void testIndependentEntities_AllCommit() throws Exception {
        // Given
        List<Document> documents = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            documents.add(newDocument(DRAFT));
        }
        ExecutorService executorService = Executors.newFixedThreadPool(THREADS);
        List<Future<TransitionResult>> futures = new ArrayList<>();

        try {
            // When
            for (Document document : documents) {
                futures.add(executorService.submit(() -> request(document, SUBMIT_FOR_REVIEW)));
            }

            // Then
            for (Future<TransitionResult> future : futures) {
                assertCommitted(future.get(10, TimeUnit.SECONDS), MODERATION);
            }
            for (Document document : documents) {
                assertState(document, MODERATION);
            }
        } finally {
            executorService.shutdownNow();
        }
    }
}

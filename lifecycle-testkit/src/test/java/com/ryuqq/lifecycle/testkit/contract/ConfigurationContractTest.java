package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.model.Action;
import com.ryuqq.lifecycle.core.model.State;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: configuration errors surface at setup time only.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class ConfigurationContractTest extends AbstractLifecycleContractTest {

    @Test
    void testRegisterTransitionAfterStart_Rejected() {
        // When/Then
        assertThrows(ConfigurationException.class,
            () -> service.registerTransition(DOCUMENT, PUBLISHED, Action.of("archive"), DRAFT));
    }

    @Test
    void testUndeclaredInitialState_Rejected() {
        // When/Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> newDocument(State.of("Archived")));
        assertTrue(exception.getMessage().contains("not declared"));
    }

    @Test
    void testRequestHandling_NeverThrowsForDomainRejections() {
        // Given
        Document document = newDocument(PUBLISHED);

        // When/Then
        assertDoesNotThrow(() -> request(document, SUBMIT_FOR_REVIEW));
        assertDoesNotThrow(() -> request(document, PUBLISH));
    }
}

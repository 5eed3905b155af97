package com.ryuqq.supervisor.testkit.contract;

import com.ryuqq.supervisor.core.state.ResourceState;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: derived flags always follow the state.
 *
 * <p>Drives the probe through every state and checks isAlive/canOperate against the closed-form
 * predicates.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class StateInvariantContractTest extends AbstractSupervisedResourceTest {

    @ParameterizedTest
    @EnumSource(ResourceState.class)
    void testDerivedFlags_ForEveryProbedState_MatchPredicates(ResourceState probed) {
        // Given
        startRunning();

        // When
        operations.setState(probed);
        resource.update(handles.find(CLASS_KEY));

        // Then
        assertEquals(probed, resource.getState());
        boolean expectedAlive = probed != ResourceState.NONE && probed != ResourceState.FAIL
            && probed != ResourceState.STARTUP && probed != ResourceState.CLEANUP;
        boolean expectedOperate = probed == ResourceState.IDLE || probed == ResourceState.ACTIVE;
        assertEquals(expectedAlive, resource.isAlive(), "isAlive for " + probed);
        assertEquals(expectedOperate, resource.canOperate(), "canOperate for " + probed);
    }

    @ParameterizedTest
    @EnumSource(ResourceState.class)
    void testHandle_WhenStateIsNone_IsCleared(ResourceState probed) {
        // Given
        startRunning();

        // When
        operations.setState(probed);
        resource.update(handles.find(CLASS_KEY));

        // Then
        if (probed == ResourceState.NONE) {
            assertNull(resource.getHandle(), "NONE must not keep a handle");
        } else {
            assertNotNull(resource.getHandle(), "handle kept for " + probed);
        }
    }
}

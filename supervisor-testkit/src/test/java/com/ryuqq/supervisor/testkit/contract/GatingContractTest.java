package com.ryuqq.supervisor.testkit.contract;

import com.ryuqq.supervisor.core.result.Result;
import com.ryuqq.supervisor.core.state.ResourceState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: operations are gated on canOperate.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Resource not running → every operation returns an empty value and a message</li>
 *   <li>Resource blocked → every operation reports the blocking message without a hook call</li>
 *   <li>Resource idle → hook results are returned unchanged</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class GatingContractTest extends AbstractSupervisedResourceTest {

    private List<Supplier<Result<?>>> gatedOperations() {
        return List.of(
            () -> resource.getText(),
            () -> resource.setText("x"),
            () -> resource.getParameters(),
            () -> resource.setParameters(Map.of()),
            () -> resource.speak(),
            () -> resource.stop(),
            () -> resource.saveFile(workDir.resolve("gated.bin").toString())
        );
    }

    @Test
    void testOperations_WhenNotRunning_ReturnEmptyValueWithMessage() {
        // Given
        resource.update();
        assertResourceState(ResourceState.NONE);

        // When & Then
        for (Supplier<Result<?>> operation : gatedOperations()) {
            Result<?> result = operation.get();
            assertTrue(result.value() == null || Boolean.FALSE.equals(result.value()),
                "value should be empty but was " + result.value());
            assertEquals("not running", result.message());
        }
        assertEquals(0, operations.callCount("getText"));
        assertEquals(0, operations.callCount("speak"));
    }

    @Test
    void testOperations_WhenBlocking_ReportBlockingWithoutHookCall() {
        // Given
        startRunning();
        operations.setState(ResourceState.BLOCKING);
        resource.update(handles.find(CLASS_KEY));

        // When & Then
        for (Supplier<Result<?>> operation : gatedOperations()) {
            Result<?> result = operation.get();
            assertNotNull(result.message());
            assertEquals("blocked by the resource", result.message());
        }
        assertEquals(0, operations.callCount("setText"));
        assertEquals(0, operations.callCount("saveFile"));
    }

    @Test
    void testOperations_WhenIdle_ReturnHookValues() {
        // Given
        startRunning();

        // When
        Result<Boolean> set = resource.setText("greeting");
        Result<String> text = resource.getText();

        // Then
        assertEquals(Boolean.TRUE, set.value());
        assertNull(set.message());
        assertEquals("greeting", text.value());
        assertNull(text.message());
    }

    @Test
    void testCharacters_WhenUnsupported_ShortCircuitWithoutHook() {
        // Given
        startRunning();

        // When
        Result<Boolean> result = resource.setCharacter("narrator");

        // Then
        assertEquals(Boolean.FALSE, result.value());
        assertEquals("not supported", result.message());
    }
}

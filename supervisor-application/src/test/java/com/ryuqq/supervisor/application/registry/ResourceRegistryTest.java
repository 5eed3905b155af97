package com.ryuqq.supervisor.application.registry;

import com.ryuqq.supervisor.application.runtime.UpdateScheduler;
import com.ryuqq.supervisor.core.resource.ResourceIdentity;
import com.ryuqq.supervisor.core.resource.ResourceOperations;
import com.ryuqq.supervisor.core.resource.SupervisedResource;
import com.ryuqq.supervisor.core.spi.HandleFinder;
import com.ryuqq.supervisor.core.spi.HandleLauncher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * ResourceRegistry 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceRegistryTest {

    @Mock
    private UpdateScheduler scheduler;

    @Mock
    private ResourceOperations<String> operations;

    @Mock
    private HandleFinder finder;

    @Mock
    private HandleLauncher launcher;

    private ResourceRegistry<String> registry;

    @BeforeEach
    void setUp() {
        registry = new ResourceRegistry<>(scheduler);
    }

    private SupervisedResource<String> newResource(String classKey) {
        return new SupervisedResource<>(ResourceIdentity.of(classKey), operations, finder, launcher);
    }

    @Test
    void getOrCreate_SameKey_CreatesOnceAndRegisters() {
        // given
        AtomicInteger created = new AtomicInteger();

        // when
        SupervisedResource<?> first = registry.getOrCreate("talker", () -> {
            created.incrementAndGet();
            return newResource("talker");
        });
        SupervisedResource<?> second = registry.getOrCreate("talker", () -> {
            created.incrementAndGet();
            return newResource("talker");
        });

        // then
        assertThat(second).isSameAs(first);
        assertThat(created.get()).isEqualTo(1);
        assertThat(registry.keys()).containsExactly("talker");
        verify(scheduler).register(first);
    }

    @Test
    void remove_RegisteredKey_UnregistersFromScheduler() {
        // given
        SupervisedResource<?> resource = registry.getOrCreate("talker", () -> newResource("talker"));

        // when
        assertThat(registry.remove("talker")).contains(resource);

        // then
        verify(scheduler).unregister(resource);
        assertThat(registry.find("talker")).isEmpty();
    }

    @Test
    void remove_UnknownKey_DoesNothing() {
        assertThat(registry.remove("missing")).isEmpty();
        verify(scheduler, never()).unregister(any());
    }

    @Test
    void close_UnregistersEverythingAndIsIdempotent() {
        // given
        SupervisedResource<?> a = registry.getOrCreate("a", () -> newResource("a"));
        SupervisedResource<?> b = registry.getOrCreate("b", () -> newResource("b"));

        // when
        registry.close();
        registry.close();

        // then
        verify(scheduler).unregister(a);
        verify(scheduler).unregister(b);
        assertThat(registry.size()).isZero();
    }

    @Test
    void withoutScheduler_OnlyTracksResources() {
        // given
        ResourceRegistry<String> plain = new ResourceRegistry<>();

        // when
        SupervisedResource<?> resource = plain.getOrCreate("talker", () -> newResource("talker"));

        // then
        assertThat(plain.find("talker")).contains(resource);
        verifyNoInteractions(scheduler);
    }

    @Test
    void getOrCreate_FactoryReturnsNull_ThrowsException() {
        assertThatThrownBy(() -> registry.getOrCreate("talker", () -> null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("factory returned null");
    }
}

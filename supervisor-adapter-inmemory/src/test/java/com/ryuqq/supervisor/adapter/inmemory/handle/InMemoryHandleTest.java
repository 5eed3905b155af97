package com.ryuqq.supervisor.adapter.inmemory.handle;

import com.ryuqq.supervisor.adapter.inmemory.handle.InMemoryHandle.ExitPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryHandle 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class InMemoryHandleTest {

    private final InMemoryHandle handle = new InMemoryHandle("talker", "Talker Pro", Path.of("/opt/talker"));

    @Test
    void newHandle_IsAliveWithUniqueId() {
        // given
        InMemoryHandle other = new InMemoryHandle("talker", null, null);

        // then
        assertThat(handle.isAlive()).isTrue();
        assertThat(handle.id()).isNotEqualTo(other.id());
        assertThat(handle.mainWindowHandle()).isNotZero();
        assertThat(handle.productName()).contains("Talker Pro");
        assertThat(other.productName()).isEmpty();
        assertThat(other.executablePath()).isEmpty();
    }

    @Test
    void requestExit_Accept_KillsProcess() {
        // when
        boolean delivered = handle.requestExit();

        // then
        assertThat(delivered).isTrue();
        assertThat(handle.isAlive()).isFalse();
        assertThat(handle.waitForExit(0)).isTrue();
        assertThat(handle.exitRequestCount()).isEqualTo(1);
    }

    @Test
    void requestExit_Refuse_ReturnsFalseAndKeepsRunning() {
        // given
        handle.setExitPolicy(ExitPolicy.REFUSE);

        // when & then
        assertThat(handle.requestExit()).isFalse();
        assertThat(handle.isAlive()).isTrue();
    }

    @Test
    void requestExit_Ignore_DeliveredButKeepsRunning() {
        // given
        handle.setExitPolicy(ExitPolicy.IGNORE);

        // when & then
        assertThat(handle.requestExit()).isTrue();
        assertThat(handle.waitForExit(20)).isFalse();
        assertThat(handle.isAlive()).isTrue();
    }

    @Test
    void terminate_AlwaysKills() {
        // given
        handle.setExitPolicy(ExitPolicy.REFUSE);

        // when
        handle.terminate();

        // then
        assertThat(handle.isAlive()).isFalse();
    }

    @Test
    void waitForExit_Unbounded_ReturnsWhenKilledElsewhere() throws Exception {
        // given
        CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(() -> handle.waitForExit(-1));

        // when
        Thread.sleep(20);
        handle.kill();

        // then
        assertThat(waiting.get(2, TimeUnit.SECONDS)).isTrue();
    }
}

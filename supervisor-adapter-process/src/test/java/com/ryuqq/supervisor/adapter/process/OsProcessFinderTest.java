package com.ryuqq.supervisor.adapter.process;

import com.ryuqq.supervisor.core.spi.ExternalHandle;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThat;

/**
 * OsProcessFinder 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class OsProcessFinderTest {

    @Test
    void find_OwnClassKey_IncludesCurrentProcess() {
        // given
        Optional<String> command = ProcessHandle.current().info().command();
        assumeThat(command).isPresent();
        String classKey = OsProcessHandle.classKeyOf(Path.of(command.get()));
        OsProcessFinder finder = new OsProcessFinder();

        // when
        List<ExternalHandle> found = finder.find(classKey);

        // then
        assertThat(found)
            .extracting(ExternalHandle::id)
            .contains(Long.toString(ProcessHandle.current().pid()));
    }

    @Test
    void find_UnknownClassKey_ReturnsEmpty() {
        assertThat(new OsProcessFinder().find("no-such-program-" + System.nanoTime())).isEmpty();
    }

    @Test
    void find_NullClassKey_ThrowsException() {
        assertThatThrownBy(() -> new OsProcessFinder().find(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

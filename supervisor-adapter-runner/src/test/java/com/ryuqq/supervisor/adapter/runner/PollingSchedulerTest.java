package com.ryuqq.supervisor.adapter.runner;

import com.ryuqq.supervisor.adapter.inmemory.handle.InMemoryHandle;
import com.ryuqq.supervisor.adapter.inmemory.handle.InMemoryHandleRegistry;
import com.ryuqq.supervisor.core.resource.ResourceIdentity;
import com.ryuqq.supervisor.core.resource.ResourceOptions;
import com.ryuqq.supervisor.core.resource.SupervisedResource;
import com.ryuqq.supervisor.core.result.Result;
import com.ryuqq.supervisor.core.spi.ExternalHandle;
import com.ryuqq.supervisor.core.state.ResourceState;
import com.ryuqq.supervisor.core.support.Waiter;
import com.ryuqq.supervisor.testkit.contract.ScriptedOperations;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PollingScheduler 테스트.
 *
 * <p>인메모리 프로세스 테이블과 ScriptedOperations로 실제 워커 스레드를 돌려 검증합니다:</p>
 * <ul>
 *   <li>라운드 로빈 공정성</li>
 *   <li>리소스별 마지막 예외 기록</li>
 *   <li>워커 풀 크기 조정</li>
 *   <li>핸들 열거 공유</li>
 *   <li>종료의 멱등성과 워커 스레드에서의 종료</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class PollingSchedulerTest {

    private static final String CLASS_KEY = "talker";
    private static final long WAIT_MS = 10_000;

    private InMemoryHandleRegistry handles;
    private PollingScheduler scheduler;

    @BeforeEach
    void setUp() {
        handles = new InMemoryHandleRegistry();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
        handles.clear();
    }

    private PollingScheduler newScheduler(PollingSchedulerConfig config) {
        scheduler = new PollingScheduler(handles, config);
        return scheduler;
    }

    private SupervisedResource<String> runningResource(String productName, ScriptedOperations<String> operations) {
        handles.add(new InMemoryHandle(CLASS_KEY, productName, null));
        return idleResource(productName, operations);
    }

    private SupervisedResource<String> idleResource(String productName, ScriptedOperations<String> operations) {
        return new SupervisedResource<>(
            ResourceIdentity.of(CLASS_KEY, productName), operations, handles, handles,
            new ResourceOptions().withStandardTimeoutMs(1000));
    }

    private static int probes(ScriptedOperations<String> operations) {
        return operations.callCount("probe");
    }

    // ============================================================
    // 1. 라운드 로빈 공정성
    // ============================================================

    @Test
    void 워커_하나가_모든_리소스를_고르게_순회함() {
        // given
        newScheduler(new PollingSchedulerConfig(1, 2, 0));
        List<ScriptedOperations<String>> operations = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            ScriptedOperations<String> ops = new ScriptedOperations<>();
            operations.add(ops);
            scheduler.register(runningResource("Talker " + i, ops));
        }
        assertThat(Waiter.waitUntil(() -> operations.stream().allMatch(ops -> probes(ops) >= 2), WAIT_MS)).isTrue();
        List<Integer> baseline = operations.stream().map(PollingSchedulerTest::probes).toList();

        // when
        int sweeps = 5;
        boolean swept = Waiter.waitUntil(() -> {
            for (int i = 0; i < operations.size(); i++) {
                if (probes(operations.get(i)) < baseline.get(i) + sweeps) {
                    return false;
                }
            }
            return true;
        }, WAIT_MS);
        scheduler.close();

        // then
        assertThat(swept).isTrue();
        List<Integer> visits = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            visits.add(probes(operations.get(i)) - baseline.get(i));
        }
        assertThat(visits).allSatisfy(count -> assertThat(count).isGreaterThanOrEqualTo(sweeps));
        int spread = visits.stream().mapToInt(Integer::intValue).max().getAsInt()
            - visits.stream().mapToInt(Integer::intValue).min().getAsInt();
        assertThat(spread).isLessThanOrEqualTo(2);
    }

    @Test
    void 연속_갱신_간격은_한_바퀴_시간을_크게_넘지_않음() {
        // given
        int resourceCount = 4;
        long intervalMs = 5;
        newScheduler(new PollingSchedulerConfig(1, intervalMs, 0));
        List<TimedOperations> operations = new ArrayList<>();
        for (int i = 0; i < resourceCount; i++) {
            TimedOperations ops = new TimedOperations();
            operations.add(ops);
            scheduler.register(runningResource("Talker " + i, ops));
        }

        // when
        boolean enough = Waiter.waitUntil(
            () -> operations.stream().allMatch(ops -> ops.probeTimes.size() >= 12), WAIT_MS);
        scheduler.close();

        // then
        assertThat(enough).isTrue();
        long sweepNanos = TimeUnit.MILLISECONDS.toNanos(resourceCount * intervalMs);
        long slackNanos = TimeUnit.MILLISECONDS.toNanos(400);
        for (TimedOperations ops : operations) {
            List<Long> times = new ArrayList<>(ops.probeTimes);
            // 첫 두 번은 워밍업
            for (int i = 3; i < times.size(); i++) {
                long gap = times.get(i) - times.get(i - 1);
                assertThat(gap).isLessThanOrEqualTo(sweepNanos + slackNanos);
            }
        }
    }

    /**
     * probe 호출 시각을 기록하는 ScriptedOperations.
     */
    private static final class TimedOperations extends ScriptedOperations<String> {

        private final List<Long> probeTimes = new CopyOnWriteArrayList<>();

        @Override
        public Result<ResourceState> probe(ExternalHandle handle) {
            probeTimes.add(System.nanoTime());
            return super.probe(handle);
        }
    }

    @Test
    void 중간_리소스를_해제해도_나머지는_계속_순회함() {
        // given
        newScheduler(new PollingSchedulerConfig(1, 2, 0));
        ScriptedOperations<String> first = new ScriptedOperations<>();
        ScriptedOperations<String> middle = new ScriptedOperations<>();
        ScriptedOperations<String> last = new ScriptedOperations<>();
        scheduler.register(runningResource("Talker A", first));
        SupervisedResource<String> removed = runningResource("Talker B", middle);
        scheduler.register(removed);
        scheduler.register(runningResource("Talker C", last));

        // when
        assertThat(scheduler.unregister(removed)).isTrue();
        int firstBefore = probes(first);
        int lastBefore = probes(last);
        int middleAfter = probes(middle);

        // then
        assertThat(Waiter.waitUntil(
            () -> probes(first) >= firstBefore + 3 && probes(last) >= lastBefore + 3, WAIT_MS)).isTrue();
        assertThat(probes(middle)).isLessThanOrEqualTo(middleAfter + 1);
    }

    // ============================================================
    // 2. 마지막 예외 기록
    // ============================================================

    @Test
    void update_예외는_기록되고_다른_리소스는_계속_갱신됨() {
        // given
        newScheduler(new PollingSchedulerConfig(1, 2, 0));
        IllegalStateException boom = new IllegalStateException("boom");
        ScriptedOperations<String> failing = new ScriptedOperations<>();
        failing.throwOnProbe(boom);
        ScriptedOperations<String> healthy = new ScriptedOperations<>();
        SupervisedResource<String> broken = runningResource("Talker Broken", failing);
        SupervisedResource<String> fine = runningResource("Talker Fine", healthy);

        // when
        scheduler.register(broken);
        scheduler.register(fine);

        // then
        assertThat(Waiter.waitUntil(() -> scheduler.getLastError(broken).isPresent(), WAIT_MS)).isTrue();
        assertThat(scheduler.getLastError(broken)).containsSame(boom);
        assertThat(Waiter.waitUntil(() -> probes(healthy) >= 3 && probes(failing) >= 3, WAIT_MS)).isTrue();
        assertThat(scheduler.getLastError(fine)).isEmpty();
        assertThat(fine.getState()).isEqualTo(ResourceState.IDLE);
    }

    @Test
    void 해제된_리소스의_마지막_예외는_지워짐() {
        // given
        newScheduler(new PollingSchedulerConfig(1, 2, 0));
        ScriptedOperations<String> failing = new ScriptedOperations<>();
        failing.throwOnProbe(new IllegalStateException("boom"));
        SupervisedResource<String> broken = runningResource("Talker Broken", failing);
        scheduler.register(broken);
        assertThat(Waiter.waitUntil(() -> scheduler.getLastError(broken).isPresent(), WAIT_MS)).isTrue();

        // when
        scheduler.unregister(broken);

        // then
        assertThat(scheduler.getLastError(broken)).isEmpty();
    }

    @Test
    void update에서_던진_Error도_기록되고_워커는_계속_순회함() {
        // given
        newScheduler(new PollingSchedulerConfig(1, 2, 0));
        AssertionError hookBroke = new AssertionError("hook broke");
        ScriptedOperations<String> failing = new ScriptedOperations<>();
        failing.throwErrorOnProbe(hookBroke);
        ScriptedOperations<String> healthy = new ScriptedOperations<>();
        SupervisedResource<String> broken = runningResource("Talker Broken", failing);
        SupervisedResource<String> fine = runningResource("Talker Fine", healthy);

        // when
        scheduler.register(broken);
        scheduler.register(fine);

        // then
        assertThat(Waiter.waitUntil(() -> scheduler.getLastError(broken).isPresent(), WAIT_MS)).isTrue();
        assertThat(scheduler.getLastError(broken)).containsSame(hookBroke);
        int healthyBefore = probes(healthy);
        int failingBefore = probes(failing);
        assertThat(Waiter.waitUntil(
            () -> probes(healthy) >= healthyBefore + 3 && probes(failing) >= failingBefore + 3, WAIT_MS)).isTrue();
        assertThat(scheduler.workerCount()).isEqualTo(1);
        assertThat(scheduler.getLastError(fine)).isEmpty();
    }

    @Test
    void VirtualMachineError로_죽은_워커는_목록에서_빠지고_다음_등록에서_다시_채워짐() {
        // given
        newScheduler(new PollingSchedulerConfig(1, 2, 0));
        StackOverflowError overflow = new StackOverflowError("simulated");
        ScriptedOperations<String> failing = new ScriptedOperations<>();
        failing.throwErrorOnProbe(overflow);
        SupervisedResource<String> broken = runningResource("Talker Broken", failing);
        scheduler.register(broken);

        // when
        boolean workerGone = Waiter.waitUntil(() -> scheduler.workerCount() == 0, WAIT_MS);

        // then
        assertThat(workerGone).isTrue();
        assertThat(scheduler.getLastError(broken)).containsSame(overflow);

        // when
        assertThat(scheduler.unregister(broken)).isTrue();
        ScriptedOperations<String> healthy = new ScriptedOperations<>();
        scheduler.register(runningResource("Talker Fine", healthy));

        // then
        assertThat(scheduler.workerCount()).isEqualTo(1);
        assertThat(Waiter.waitUntil(() -> probes(healthy) >= 2, WAIT_MS)).isTrue();
    }

    // ============================================================
    // 3. 등록 / 워커 풀 크기
    // ============================================================

    @Test
    void 워커_수는_poolLimit과_등록_수_중_작은_값을_따름() {
        // given
        newScheduler(new PollingSchedulerConfig(2, 5, 100));
        SupervisedResource<String> a = idleResource("A", new ScriptedOperations<>());
        SupervisedResource<String> b = idleResource("B", new ScriptedOperations<>());
        SupervisedResource<String> c = idleResource("C", new ScriptedOperations<>());

        // when & then
        assertThat(scheduler.workerCount()).isZero();
        scheduler.register(a);
        assertThat(scheduler.workerCount()).isEqualTo(1);
        scheduler.register(b);
        scheduler.register(c);
        assertThat(scheduler.workerCount()).isEqualTo(2);
        assertThat(scheduler.registeredCount()).isEqualTo(3);

        scheduler.unregister(a);
        assertThat(scheduler.workerCount()).isEqualTo(2);
        scheduler.unregister(b);
        assertThat(scheduler.workerCount()).isEqualTo(1);
        scheduler.unregister(c);
        assertThat(scheduler.workerCount()).isZero();
    }

    @Test
    void 중복_등록과_미등록_해제는_false() {
        // given
        newScheduler(new PollingSchedulerConfig(1, 5, 100));
        SupervisedResource<String> resource = idleResource("A", new ScriptedOperations<>());

        // when & then
        assertThat(scheduler.register(resource)).isTrue();
        assertThat(scheduler.register(resource)).isFalse();
        assertThat(scheduler.registeredCount()).isEqualTo(1);
        assertThat(scheduler.unregister(resource)).isTrue();
        assertThat(scheduler.unregister(resource)).isFalse();
        assertThatThrownBy(() -> scheduler.register(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("resource cannot be null");
    }

    // ============================================================
    // 4. 핸들 열거 공유
    // ============================================================

    @Test
    void 같은_클래스_키의_리소스들은_캐시_시간_동안_열거를_공유함() {
        // given
        newScheduler(new PollingSchedulerConfig(4, 2, 60_000));
        List<ScriptedOperations<String>> operations = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            ScriptedOperations<String> ops = new ScriptedOperations<>();
            operations.add(ops);
            scheduler.register(runningResource("Talker " + i, ops));
        }

        // when
        boolean updated = Waiter.waitUntil(() -> operations.stream().allMatch(ops -> probes(ops) >= 3), WAIT_MS);

        // then
        assertThat(updated).isTrue();
        assertThat(handles.findCount()).isEqualTo(1);
    }

    // ============================================================
    // 5. 종료
    // ============================================================

    @Test
    void close는_여러_번_호출해도_안전하고_이후_등록은_예외() {
        // given
        newScheduler(new PollingSchedulerConfig(2, 2, 100));
        scheduler.register(idleResource("A", new ScriptedOperations<>()));
        scheduler.register(idleResource("B", new ScriptedOperations<>()));

        // when
        scheduler.close();
        scheduler.close();

        // then
        assertThat(scheduler.workerCount()).isZero();
        assertThat(scheduler.registeredCount()).isZero();
        assertThatThrownBy(() -> scheduler.register(idleResource("C", new ScriptedOperations<>())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("scheduler is closed");
    }

    @Test
    void 워커_스레드에서_close를_호출해도_교착되지_않음() throws Exception {
        // given
        newScheduler(new PollingSchedulerConfig(2, 2, 0));
        CountDownLatch closedFromWorker = new CountDownLatch(1);
        SupervisedResource<String> resource = runningResource("Talker", new ScriptedOperations<>());
        resource.addChangeListener(event -> {
            if (event.currentState() == ResourceState.IDLE) {
                scheduler.close();
                closedFromWorker.countDown();
            }
        });
        scheduler.register(idleResource("Other", new ScriptedOperations<>()));

        // when
        scheduler.register(resource);

        // then
        assertThat(closedFromWorker.await(WAIT_MS, TimeUnit.MILLISECONDS)).isTrue();
        assertThat(scheduler.workerCount()).isZero();
    }
}

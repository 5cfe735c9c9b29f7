package io.github.drompincen.cronsync.runtime.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DebouncedTriggerTest {

    private ManualScheduledExecutor executor;
    private AtomicInteger fired;
    private DebouncedTrigger trigger;

    @BeforeEach
    void setUp() {
        executor = new ManualScheduledExecutor();
        fired = new AtomicInteger();
        trigger = new DebouncedTrigger("test", executor, fired::incrementAndGet);
    }

    @Test
    void firesOnceAfterDelay() {
        trigger.schedule(Duration.ofMillis(250));

        executor.advanceBy(249);
        assertThat(fired.get()).isZero();
        assertThat(trigger.isPending()).isTrue();

        executor.advanceBy(1);
        assertThat(fired.get()).isEqualTo(1);
        assertThat(trigger.isPending()).isFalse();
    }

    @Test
    void burstCollapsesIntoSingleInvocationAfterLastRequest() {
        trigger.schedule(Duration.ofMillis(250));
        executor.advanceBy(100);
        trigger.schedule(Duration.ofMillis(250));
        executor.advanceBy(100);
        trigger.schedule(Duration.ofMillis(250));

        executor.advanceBy(249);
        assertThat(fired.get()).isZero();

        executor.advanceBy(1);
        assertThat(fired.get()).isEqualTo(1);

        executor.advanceBy(10_000);
        assertThat(fired.get()).isEqualTo(1);
    }

    @Test
    void cancelAllPreventsPendingInvocation() {
        trigger.schedule(Duration.ofMillis(200));
        trigger.cancelAll();

        executor.advanceBy(1_000);

        assertThat(fired.get()).isZero();
        assertThat(trigger.isPending()).isFalse();
        assertThat(executor.pendingCount()).isZero();
    }

    @Test
    void canBeReArmedAfterFiring() {
        trigger.schedule(Duration.ZERO);
        executor.runPending();
        trigger.schedule(Duration.ZERO);
        executor.runPending();

        assertThat(fired.get()).isEqualTo(2);
    }

    @Test
    void failingActionDoesNotBreakLaterInvocations() {
        AtomicInteger attempts = new AtomicInteger();
        DebouncedTrigger flaky = new DebouncedTrigger("flaky", executor, () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        flaky.schedule(Duration.ofMillis(10));
        executor.advanceBy(10);
        flaky.schedule(Duration.ofMillis(10));
        executor.advanceBy(10);

        assertThat(attempts.get()).isEqualTo(2);
    }
}

package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PollScheduler Tests")
class PollSchedulerTest {

	private PollScheduler scheduler;

	@AfterEach
	void tearDown() {
		if (scheduler != null) {
			scheduler.stop();
		}
	}

	@Test
	@DisplayName("Should tick repeatedly while running")
	void shouldTickRepeatedly() throws Exception {
		CountDownLatch ticks = new CountDownLatch(3);
		scheduler = new PollScheduler(ticks::countDown, Duration.ofMillis(20));

		assertThat(scheduler.start()).isTrue();

		assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(scheduler.isRunning()).isTrue();
	}

	@Test
	@DisplayName("Should skip a run while another one is in flight")
	void shouldSkipWhileInFlight() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger runs = new AtomicInteger();
		scheduler = new PollScheduler(() -> {
			runs.incrementAndGet();
			entered.countDown();
			try {
				release.await(5, TimeUnit.SECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, Duration.ofHours(1));

		Thread first = new Thread(scheduler::runIfIdle);
		first.start();
		assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

		assertThat(scheduler.isInFlight()).isTrue();
		assertThat(scheduler.runIfIdle()).isFalse();

		release.countDown();
		first.join(5000);
		assertThat(runs.get()).isEqualTo(1);
		assertThat(scheduler.isInFlight()).isFalse();
	}

	@Test
	@DisplayName("Should keep ticking after a run throws")
	void shouldKeepTickingAfterFailure() throws Exception {
		CountDownLatch ticks = new CountDownLatch(3);
		scheduler = new PollScheduler(() -> {
			ticks.countDown();
			throw new IllegalStateException("poll failed");
		}, Duration.ofMillis(20));

		scheduler.start();

		assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	@DisplayName("Should be idempotent on stop and restartable")
	void shouldStopIdempotentlyAndRestart() throws Exception {
		CountDownLatch ticks = new CountDownLatch(1);
		scheduler = new PollScheduler(ticks::countDown, Duration.ofMillis(20));

		scheduler.stop();
		assertThat(scheduler.start()).isTrue();
		assertThat(scheduler.start()).isFalse();
		scheduler.stop();
		scheduler.stop();
		assertThat(scheduler.isRunning()).isFalse();

		scheduler.start();
		assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	@DisplayName("Should reject a non-positive interval")
	void shouldRejectNonPositiveInterval() {
		assertThatThrownBy(() -> new PollScheduler(() -> {
		}, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
	}

}

package org.springaicommunity.github.watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a poll task at a fixed interval on a single daemon thread.
 *
 * <p>
 * At most one run is in flight: a tick that fires while a previous run (scheduled or
 * started through {@link #runIfIdle()}) is still executing is skipped, never queued.
 * {@link #stop()} does not interrupt a run in progress; it only prevents further ticks.
 */
class PollScheduler {

	private static final Logger logger = LoggerFactory.getLogger(PollScheduler.class);

	static final String THREAD_NAME = "pr-watcher-poll";

	private final Runnable task;

	private final Duration interval;

	private final AtomicBoolean inFlight = new AtomicBoolean(false);

	private ScheduledExecutorService executor;

	PollScheduler(Runnable task, Duration interval) {
		if (interval.isZero() || interval.isNegative()) {
			throw new IllegalArgumentException("Poll interval must be positive: " + interval);
		}
		this.task = task;
		this.interval = interval;
	}

	/**
	 * Start ticking. The first tick fires one interval from now.
	 * @return false if already running
	 */
	synchronized boolean start() {
		if (executor != null) {
			return false;
		}
		executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, THREAD_NAME);
			thread.setDaemon(true);
			return thread;
		});
		long millis = interval.toMillis();
		executor.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
		logger.debug("Poll scheduler started with interval {}", interval);
		return true;
	}

	/**
	 * Stop ticking. Idempotent and safe to call before {@link #start()}.
	 */
	synchronized void stop() {
		if (executor == null) {
			return;
		}
		executor.shutdown();
		executor = null;
		logger.debug("Poll scheduler stopped");
	}

	synchronized boolean isRunning() {
		return executor != null;
	}

	boolean isInFlight() {
		return inFlight.get();
	}

	/**
	 * Run the task on the calling thread unless a run is already in flight.
	 * @return true if the task ran
	 */
	boolean runIfIdle() {
		if (!inFlight.compareAndSet(false, true)) {
			logger.debug("Skipping poll, previous cycle still running");
			return false;
		}
		try {
			task.run();
			return true;
		}
		finally {
			inFlight.set(false);
		}
	}

	private void tick() {
		try {
			runIfIdle();
		}
		catch (RuntimeException e) {
			// A throwing task would cancel the periodic schedule
			logger.error("Poll cycle failed unexpectedly", e);
		}
	}

}

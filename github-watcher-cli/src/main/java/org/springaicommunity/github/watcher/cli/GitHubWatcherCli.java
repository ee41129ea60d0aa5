package org.springaicommunity.github.watcher.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.watcher.*;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * GitHub PR Watcher CLI Application
 *
 * Plain Java command-line application that watches GitHub repositories and logs pull
 * request activity as it happens. No Spring dependencies - uses GitHubWatcherBuilder for
 * wiring.
 *
 * Usage: java -jar github-watcher-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication
 *
 * Examples: java -jar github-watcher-cli.jar --repo spring-projects/spring-ai java -jar
 * github-watcher-cli.jar --repo owner/a,owner/b --push --interval 60 java -jar
 * github-watcher-cli.jar --my-prs --once
 */
public class GitHubWatcherCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubWatcherCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Watch failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		// Create argument parser with default properties
		WatchProperties properties = new WatchProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		argumentParser.validateEnvironment();

		GitHubWatcherBuilder builder = GitHubWatcherBuilder.create()
			.tokenFromEnv()
			.properties(config.toProperties(properties));
		return run(config, builder);
	}

	/**
	 * Watch with an already configured builder.
	 * @param config parsed command line
	 * @param builder builder supplying the GitHub wiring
	 * @return the exit code
	 * @throws InterruptedException if interrupted while waiting for shutdown
	 */
	static int run(ParsedConfiguration config, GitHubWatcherBuilder builder) throws InterruptedException {
		if (config.verbose) {
			enableVerboseLogging();
		}
		logConfiguration(config);

		PRWatcher watcher = builder.build();
		logRateLimit(builder.buildRestService());
		EventFormatter formatter = new EventFormatter();

		watcher.onEvent(event -> {
			if (event.type() == EventType.PUSH) {
				return;
			}
			if (event.type() == EventType.POLL_COMPLETE && !config.verbose) {
				return;
			}
			logger.info(formatter.format(event));
		});
		if (config.push) {
			watcher.onPush(push -> logger.info(formatter.push(push)));
		}
		watcher.onError(error -> logger.warn("Watch error: {}", error.getMessage()));

		List<PRStatus> initial = watcher.start();
		logger.info("Watching {} pull requests", initial.size());
		for (PRStatus status : initial) {
			logger.info("  {}", formatter.status(status));
		}

		if (config.once) {
			watcher.stop();
			return 0;
		}

		CountDownLatch shutdown = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			watcher.stop();
			shutdown.countDown();
		}, "pr-watcher-shutdown"));
		shutdown.await();
		return 0;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("GitHub PR Watcher");
		logger.info("  Repositories: {}", config.repositories.isEmpty() ? "(none)" : config.repositories);
		logger.info("  Interval: {}s", config.intervalSeconds);
		if (config.myPRs) {
			logger.info("  My PRs: {}", config.username != null ? config.username : "(token user)");
		}
		if (config.staleAfterSeconds > 0) {
			logger.info("  Stale after: {}s", config.staleAfterSeconds);
		}
		logger.info("  Push detection: {}", config.push ? "on" : "off");
	}

	private static void logRateLimit(RestService restService) {
		try {
			RateLimitInfo rateLimit = restService.getRateLimit();
			logger.info("  Rate limit: {}/{} remaining, resets at {}", rateLimit.remaining(), rateLimit.limit(),
					rateLimit.getResetTime());
		}
		catch (RuntimeException e) {
			logger.warn("Could not read rate limit: {}", e.getMessage());
		}
	}

	private static void enableVerboseLogging() {
		org.slf4j.Logger watcherLogger = LoggerFactory.getLogger("org.springaicommunity.github.watcher");
		if (watcherLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

}

package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the head commit of each watched repository's default branch across polls.
 *
 * <p>
 * The default branch name is taken from open pull request data when available (free) and
 * otherwise fetched once from the repository metadata; either way it is cached for the
 * lifetime of the tracker. The first head observed for a repository becomes its baseline
 * without an event.
 */
class BranchHeadTracker {

	private static final Logger logger = LoggerFactory.getLogger(BranchHeadTracker.class);

	private final RestService restService;

	private final Map<RepoRef, String> defaultBranches = new ConcurrentHashMap<>();

	private final Map<RepoRef, String> headShas = new ConcurrentHashMap<>();

	BranchHeadTracker(RestService restService) {
		this.restService = restService;
	}

	/**
	 * Record a default branch name discovered from pull request data.
	 * @param repo the repository
	 * @param branch the default branch name
	 */
	void harvestDefaultBranch(RepoRef repo, String branch) {
		if (defaultBranches.putIfAbsent(repo, branch) == null) {
			logger.debug("Default branch of {} is {} (from PR data)", repo, branch);
		}
	}

	/**
	 * Check a repository's default branch head.
	 * @param repo the repository
	 * @param throttle throttle to call before each request
	 * @return a push event if the head moved since the previous check
	 * @throws InterruptedException if interrupted while throttled
	 */
	Optional<PushEvent> check(RepoRef repo, WatchThrottle throttle) throws InterruptedException {
		String branch = defaultBranches.get(repo);
		if (branch == null) {
			throttle.acquire(1);
			branch = restService.getRepository(repo).defaultBranch();
			defaultBranches.put(repo, branch);
			logger.debug("Default branch of {} is {} (from repository metadata)", repo, branch);
		}

		throttle.acquire(1);
		String sha = restService.getBranchHeadSha(repo, branch);
		String previousSha = headShas.put(repo, sha);

		if (previousSha == null) {
			logger.debug("Baseline for {}@{} is {}", repo, branch, sha);
			return Optional.empty();
		}
		if (previousSha.equals(sha)) {
			return Optional.empty();
		}
		logger.debug("{}@{} moved {} -> {}", repo, branch, previousSha, sha);
		return Optional.of(new PushEvent(repo, branch, sha, previousSha));
	}

	@Nullable
	String baseline(RepoRef repo) {
		return headShas.get(repo);
	}

	/**
	 * Forget the baseline and cached default branch of a repository.
	 * @param repo the repository
	 */
	void removeRepo(RepoRef repo) {
		defaultBranches.remove(repo);
		headShas.remove(repo);
	}

}

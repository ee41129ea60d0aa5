package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Watches GitHub repositories for pull request activity and emits typed lifecycle
 * events.
 *
 * <p>
 * Every poll cycle lists the open pull requests of each watched repository, diffs them
 * against the snapshots kept from the previous cycle and emits one event per observed
 * change. Activity (comments, reviews, check runs) is refetched only when cheap signals
 * say it may have changed, see {@link SelectiveFetchPlanner}. Failures are reported on
 * the error channel and never stop the watcher.
 *
 * <pre>{@code
 * PRWatcher watcher = PRWatcher.builder(restService)
 *     .repo("spring-projects/spring-ai")
 *     .interval(Duration.ofMinutes(1))
 *     .build();
 * watcher.onMerged(e -> logger.info("{} merged", e.pr().title()));
 * watcher.onError(e -> logger.warn("Watch error", e));
 * List<PRStatus> initial = watcher.start();
 * }</pre>
 *
 * <p>
 * At most one poll cycle runs at a time. {@link #addRepo(String)},
 * {@link #removeRepo(String)}, {@link #getWatchedPRs()} and the subscription methods may
 * be called from any thread, including from inside a listener.
 */
public class PRWatcher {

	private static final Logger logger = LoggerFactory.getLogger(PRWatcher.class);

	public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

	private final RestService restService;

	private final WatchThrottle throttle;

	private final Clock clock;

	private final @Nullable RepoDiscovery discovery;

	private final boolean myPRs;

	private volatile @Nullable String username;

	private final @Nullable Duration staleThreshold;

	private final RepoWatchSet watchSet;

	private final SnapshotStore store = new SnapshotStore();

	private final StatusTracker statusTracker;

	private final BranchHeadTracker branchTracker;

	private final EventBus bus = new EventBus();

	private final PollScheduler scheduler;

	private volatile boolean stopRequested;

	private PRWatcher(Builder builder) {
		this.restService = builder.restService;
		this.throttle = builder.throttle;
		this.clock = builder.clock;
		this.discovery = builder.discovery;
		this.myPRs = builder.myPRs;
		this.username = builder.username;
		this.staleThreshold = builder.staleThreshold;
		this.watchSet = new RepoWatchSet(builder.repos);
		this.statusTracker = new StatusTracker(builder.classifier);
		this.branchTracker = new BranchHeadTracker(builder.restService);
		this.scheduler = new PollScheduler(this::poll, builder.interval);
	}

	/**
	 * Create a builder for a watcher backed by the given REST service.
	 * @param restService the GitHub REST port
	 * @return a new builder
	 */
	public static Builder builder(RestService restService) {
		return new Builder(restService);
	}

	// Lifecycle

	/**
	 * Run the first poll on the calling thread, then poll in the background at the
	 * configured interval. Calling this while running performs no poll.
	 * @return the status of every tracked pull request after the first poll
	 */
	public synchronized List<PRStatus> start() {
		if (scheduler.isRunning()) {
			return getWatchedPRs();
		}
		logger.info("Starting PR watcher for {} repositories", watchSet.repos().size());
		stopRequested = false;
		scheduler.runIfIdle();
		if (stopRequested) {
			logger.info("Stopped during the first poll");
			return getWatchedPRs();
		}
		scheduler.start();
		return getWatchedPRs();
	}

	/**
	 * Stop background polling. A poll cycle already in progress runs to completion. A stop
	 * issued during the first poll of {@link #start()} keeps the timer from being
	 * scheduled. Idempotent and safe to call before {@link #start()}.
	 */
	public synchronized void stop() {
		stopRequested = true;
		if (scheduler.isRunning()) {
			logger.info("Stopping PR watcher");
		}
		scheduler.stop();
	}

	public boolean isRunning() {
		return scheduler.isRunning();
	}

	/**
	 * Run one poll cycle on the calling thread unless a cycle is already in flight.
	 * @return true if a cycle ran
	 */
	boolean pollNow() {
		return scheduler.runIfIdle();
	}

	// Watch set

	/**
	 * Start watching a repository from the next poll cycle on.
	 * @param repo repository in any form accepted by {@link RepoRef#parse(String)}
	 * @throws IllegalArgumentException if the reference is malformed
	 */
	public void addRepo(String repo) {
		RepoRef ref = RepoRef.parse(repo);
		if (watchSet.add(ref)) {
			logger.info("Now watching {}", ref);
		}
	}

	/**
	 * Stop watching a repository. Its snapshots, push baseline and cached default branch
	 * are discarded at the start of the next poll cycle, so re-adding it later starts
	 * from scratch.
	 * @param repo repository in any form accepted by {@link RepoRef#parse(String)}
	 * @throws IllegalArgumentException if the reference is malformed
	 */
	public void removeRepo(String repo) {
		RepoRef ref = RepoRef.parse(repo);
		if (watchSet.remove(ref)) {
			logger.info("No longer watching {}", ref);
		}
	}

	/**
	 * Returns the status of every currently tracked pull request.
	 * @return statuses ordered by repository and number
	 */
	public List<PRStatus> getWatchedPRs() {
		return store.statuses();
	}

	// Subscriptions

	public Subscription onNewPR(Consumer<? super PREvent> listener) {
		return bus.subscribe(EventType.NEW_PR, listener);
	}

	public Subscription onPRUpdated(Consumer<? super PRUpdatedEvent> listener) {
		return bus.subscribe(EventType.PR_UPDATED, listener);
	}

	public Subscription onComment(Consumer<? super CommentEvent> listener) {
		return bus.subscribe(EventType.COMMENT, listener);
	}

	public Subscription onReview(Consumer<? super ReviewEvent> listener) {
		return bus.subscribe(EventType.REVIEW, listener);
	}

	public Subscription onCheckRun(Consumer<? super CheckRunEvent> listener) {
		return bus.subscribe(EventType.CHECK_RUN, listener);
	}

	public Subscription onMerged(Consumer<? super PREvent> listener) {
		return bus.subscribe(EventType.MERGED, listener);
	}

	public Subscription onClosed(Consumer<? super PREvent> listener) {
		return bus.subscribe(EventType.CLOSED, listener);
	}

	public Subscription onStatusChanged(Consumer<? super StatusChangedEvent> listener) {
		return bus.subscribe(EventType.STATUS_CHANGED, listener);
	}

	/**
	 * Subscribe to default-branch pushes. Push detection costs one or two extra requests
	 * per repository per cycle and only runs while at least one push listener is
	 * registered.
	 * @param listener receives push events
	 * @return handle that removes the listener
	 */
	public Subscription onPush(Consumer<? super PushEvent> listener) {
		return bus.subscribe(EventType.PUSH, listener);
	}

	public Subscription onPollComplete(Consumer<? super PollCompleteEvent> listener) {
		return bus.subscribe(EventType.POLL_COMPLETE, listener);
	}

	/**
	 * Subscribe to every event, tagged with its kind.
	 * @param listener receives all events
	 * @return handle that removes the listener
	 */
	public Subscription onEvent(Consumer<? super WatcherEvent<?>> listener) {
		return bus.subscribeAll(listener);
	}

	/**
	 * Subscribe to API failures and exceptions thrown by listeners.
	 * @param listener receives errors
	 * @return handle that removes the listener
	 */
	public Subscription onError(Consumer<? super Throwable> listener) {
		return bus.subscribeErrors(listener);
	}

	// Poll cycle

	private void poll() {
		try {
			runCycle();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			bus.emitError(new IllegalStateException("Poll cycle interrupted", e));
		}
		catch (RuntimeException e) {
			logger.warn("Poll cycle aborted: {}", e.getMessage());
			bus.emitError(e);
		}
	}

	private void runCycle() throws InterruptedException {
		Instant now = clock.instant();

		for (RepoRef removed : watchSet.drainRemovals()) {
			int dropped = store.removeRepo(removed);
			branchTracker.removeRepo(removed);
			logger.debug("Tore down {} ({} snapshots dropped)", removed, dropped);
		}

		List<RepoRef> repos = watchSet.currentRepos(discover());
		logger.debug("Polling {} repositories", repos.size());

		Set<PRIdentity> seen = new HashSet<>();
		Set<RepoRef> listed = new HashSet<>();
		for (RepoRef repo : repos) {
			if (pollRepository(repo, seen, now)) {
				listed.add(repo);
			}
			if (bus.hasListeners(EventType.PUSH)) {
				checkPush(repo);
			}
		}

		SearchOutcome search = pollMyPullRequests(seen, now);
		reconcileUnseen(new HashSet<>(repos), listed, seen, search, now);

		if (staleThreshold != null) {
			List<PRSnapshot> evicted = store.evictStale(now.minus(staleThreshold));
			if (!evicted.isEmpty()) {
				logger.debug("Evicted {} stale snapshots", evicted.size());
			}
		}

		List<PRStatus> statuses = store.statuses();
		logger.debug("Poll complete: {} pull requests tracked", statuses.size());
		bus.emit(EventType.POLL_COMPLETE, new PollCompleteEvent(statuses));
	}

	private List<RepoRef> discover() {
		if (discovery == null) {
			return List.of();
		}
		List<String> names;
		try {
			names = discovery.discover();
		}
		catch (Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			report("Repository discovery", e);
			return List.of();
		}
		Set<RepoRef> result = new LinkedHashSet<>();
		for (String name : names) {
			try {
				result.add(RepoRef.parse(name));
			}
			catch (IllegalArgumentException e) {
				report("Discovered repository '" + name + "'", e);
			}
		}
		return new ArrayList<>(result);
	}

	/**
	 * Process the open pull requests of one repository.
	 * @return false if the repository could not be listed
	 */
	private boolean pollRepository(RepoRef repo, Set<PRIdentity> seen, Instant now) throws InterruptedException {
		List<PullRequest> open;
		try {
			throttle.acquire(1);
			open = restService.listOpenPullRequests(repo);
		}
		catch (RuntimeException e) {
			report("Listing pull requests of " + repo, e);
			return false;
		}

		for (PullRequest pr : open) {
			String defaultBranch = pr.baseRepoDefaultBranch();
			if (defaultBranch != null) {
				branchTracker.harvestDefaultBranch(repo, defaultBranch);
				break;
			}
		}

		for (PullRequest pr : open) {
			PRIdentity identity = new PRIdentity(repo, pr.number());
			seen.add(identity);
			processPullRequest(identity, pr, now);
		}
		return true;
	}

	private void checkPush(RepoRef repo) throws InterruptedException {
		try {
			branchTracker.check(repo, throttle).ifPresent(push -> bus.emit(EventType.PUSH, push));
		}
		catch (RuntimeException e) {
			report("Push check of " + repo, e);
		}
	}

	private SearchOutcome pollMyPullRequests(Set<PRIdentity> seen, Instant now) throws InterruptedException {
		if (!myPRs) {
			return SearchOutcome.DISABLED;
		}

		List<PullRequestRef> hits;
		try {
			String login = resolveUsername();
			throttle.acquire(1);
			hits = restService.searchOpenPullRequestsByAuthor(login);
		}
		catch (RuntimeException e) {
			report("Searching authored pull requests", e);
			return SearchOutcome.FAILED;
		}

		for (PullRequestRef hit : hits) {
			PRIdentity identity = hit.identity();
			if (!seen.add(identity)) {
				continue;
			}
			PullRequest pr;
			try {
				throttle.acquire(1);
				pr = restService.getPullRequest(hit.repo(), hit.number());
			}
			catch (RuntimeException e) {
				report("Fetching " + identity, e);
				store.touch(identity, now);
				continue;
			}
			processPullRequest(identity, pr, now);
		}
		return SearchOutcome.SUCCEEDED;
	}

	private String resolveUsername() throws InterruptedException {
		String login = username;
		if (login == null) {
			throttle.acquire(1);
			login = restService.getAuthenticatedLogin();
			username = login;
			logger.info("Watching pull requests authored by {}", login);
		}
		return login;
	}

	private void processPullRequest(PRIdentity identity, PullRequest pr, Instant now) throws InterruptedException {
		PRSnapshot previous = store.get(identity);

		if (pr.isMerged() || pr.isClosed()) {
			if (previous != null) {
				finish(identity, pr);
			}
			return;
		}

		FetchStrategy strategy = SelectiveFetchPlanner.plan(previous, pr);
		ActivityCache fetched;
		try {
			fetched = fetchActivity(identity, pr, strategy);
		}
		catch (RuntimeException e) {
			report("Fetching activity of " + identity, e);
			store.touch(identity, now);
			return;
		}

		PREvent event = new PREvent(pr, identity.repo());

		if (previous == null) {
			String status = classify(event, fetched, null).status();
			store.put(new PRSnapshot(identity, pr, fetched, status, now));
			bus.emit(EventType.NEW_PR, event);
			return;
		}

		boolean sameHead = Objects.equals(previous.pr().headSha(), pr.headSha());
		ActivityCache cached = previous.activity();
		ActivityCache merged = (strategy == FetchStrategy.NONE) ? cached : cached.merge(fetched, sameHead);

		Map<String, FieldChange<?>> changes = PRDiffEngine.metadataChanges(previous.pr(), pr);
		List<Comment> comments = PRDiffEngine.newComments(cached, fetched);
		List<Review> reviews = PRDiffEngine.newReviews(cached, fetched);
		List<CheckRun> checkRuns = PRDiffEngine.changedCheckRuns(sameHead ? cached : ActivityCache.EMPTY, fetched);
		StatusTracker.Result status = classify(event, merged, previous);

		store.put(new PRSnapshot(identity, pr, merged, status.status(), now));

		if (!changes.isEmpty()) {
			bus.emit(EventType.PR_UPDATED, new PRUpdatedEvent(pr, identity.repo(), changes));
		}
		for (Comment comment : comments) {
			bus.emit(EventType.COMMENT, new CommentEvent(pr, identity.repo(), comment));
		}
		for (Review review : reviews) {
			bus.emit(EventType.REVIEW, new ReviewEvent(pr, identity.repo(), review));
		}
		for (CheckRun checkRun : checkRuns) {
			bus.emit(EventType.CHECK_RUN, new CheckRunEvent(pr, identity.repo(), checkRun));
		}
		if (status.transition() != null) {
			bus.emit(EventType.STATUS_CHANGED, status.transition());
		}
	}

	private ActivityCache fetchActivity(PRIdentity identity, PullRequest pr, FetchStrategy strategy)
			throws InterruptedException {
		if (strategy == FetchStrategy.NONE) {
			return ActivityCache.EMPTY;
		}
		logger.debug("Fetching {} activity for {}", strategy, identity);
		throttle.acquire(strategy.weight());
		RepoRef repo = identity.repo();
		List<CheckRun> checkRuns = restService.listCheckRuns(repo, pr.headSha());
		if (strategy == FetchStrategy.CHECK_RUNS_ONLY) {
			return new ActivityCache(List.of(), List.of(), checkRuns);
		}
		List<Comment> comments = restService.listIssueComments(repo, pr.number());
		List<Review> reviews = restService.listReviews(repo, pr.number());
		return new ActivityCache(comments, reviews, checkRuns);
	}

	private StatusTracker.Result classify(PREvent event, ActivityCache activity, @Nullable PRSnapshot previous) {
		try {
			return statusTracker.classify(event, activity, previous);
		}
		catch (Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			report("Classifying " + event.repo() + "#" + event.pr().number(), e);
			return new StatusTracker.Result(previous != null ? previous.status() : "", null);
		}
	}

	/**
	 * Handle tracked pull requests that were not observed in this cycle.
	 */
	private void reconcileUnseen(Set<RepoRef> cycleRepos, Set<RepoRef> listed, Set<PRIdentity> seen,
			SearchOutcome search, Instant now) throws InterruptedException {
		for (PRSnapshot snapshot : store.all()) {
			PRIdentity identity = snapshot.identity();
			if (seen.contains(identity)) {
				continue;
			}
			RepoRef repo = identity.repo();
			if (cycleRepos.contains(repo)) {
				if (listed.contains(repo)) {
					confirmDisappeared(identity, now, true);
				}
			}
			else if (search == SearchOutcome.SUCCEEDED) {
				confirmDisappeared(identity, now, false);
			}
			else if (search == SearchOutcome.DISABLED) {
				logger.debug("Dropping {}: repository no longer watched", identity);
				store.remove(identity);
			}
		}
	}

	/**
	 * Fetch a pull request that left its listing and emit its terminal event if it
	 * finished. A PR that is still open is kept only when its repository is watched.
	 */
	private void confirmDisappeared(PRIdentity identity, Instant now, boolean inScope) throws InterruptedException {
		PullRequest current;
		try {
			throttle.acquire(1);
			current = restService.getPullRequest(identity.repo(), identity.number());
		}
		catch (RuntimeException e) {
			report("Confirming state of " + identity, e);
			return;
		}
		if (current.isMerged() || current.isClosed()) {
			finish(identity, current);
		}
		else if (inScope) {
			store.touch(identity, now);
		}
		else {
			logger.debug("Dropping {}: neither watched nor authored", identity);
			store.remove(identity);
		}
	}

	private void finish(PRIdentity identity, PullRequest pr) {
		store.remove(identity);
		PREvent event = new PREvent(pr, identity.repo());
		if (pr.isMerged()) {
			bus.emit(EventType.MERGED, event);
		}
		else {
			bus.emit(EventType.CLOSED, event);
		}
	}

	private void report(String operation, Throwable error) {
		logger.debug("{} failed: {}", operation, error.getMessage());
		bus.emitError(error);
	}

	private enum SearchOutcome {

		DISABLED, SUCCEEDED, FAILED

	}

	/**
	 * Builder for {@link PRWatcher}.
	 */
	public static final class Builder {

		private final RestService restService;

		private final List<RepoRef> repos = new ArrayList<>();

		private Duration interval = DEFAULT_INTERVAL;

		private boolean myPRs;

		private @Nullable String username;

		private @Nullable RepoDiscovery discovery;

		private @Nullable StatusClassifier classifier;

		private @Nullable Duration staleThreshold;

		private WatchThrottle throttle = WatchThrottle.NONE;

		private Clock clock = Clock.systemUTC();

		private Builder(RestService restService) {
			this.restService = Objects.requireNonNull(restService, "restService must not be null");
		}

		/**
		 * Add a repository to watch.
		 * @param repo repository in any form accepted by {@link RepoRef#parse(String)}
		 * @return this builder
		 * @throws IllegalArgumentException if the reference is malformed
		 */
		public Builder repo(String repo) {
			RepoRef ref = RepoRef.parse(repo);
			if (!repos.contains(ref)) {
				repos.add(ref);
			}
			return this;
		}

		public Builder repos(Collection<String> repos) {
			repos.forEach(this::repo);
			return this;
		}

		public Builder interval(Duration interval) {
			this.interval = interval;
			return this;
		}

		/**
		 * Also track open pull requests authored by {@link #username(String)} (or, if not
		 * set, by the token's user) in any repository.
		 * @param myPRs whether to search authored pull requests each cycle
		 * @return this builder
		 */
		public Builder myPRs(boolean myPRs) {
			this.myPRs = myPRs;
			return this;
		}

		public Builder username(@Nullable String username) {
			this.username = username;
			return this;
		}

		public Builder discovery(@Nullable RepoDiscovery discovery) {
			this.discovery = discovery;
			return this;
		}

		public Builder classifier(@Nullable StatusClassifier classifier) {
			this.classifier = classifier;
			return this;
		}

		/**
		 * Evict snapshots not observed for longer than the threshold.
		 * @param staleThreshold maximum age, or null to keep snapshots indefinitely
		 * @return this builder
		 */
		public Builder staleThreshold(@Nullable Duration staleThreshold) {
			this.staleThreshold = staleThreshold;
			return this;
		}

		public Builder throttle(WatchThrottle throttle) {
			this.throttle = throttle;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public PRWatcher build() {
			if (interval.isZero() || interval.isNegative()) {
				throw new IllegalArgumentException("Poll interval must be positive: " + interval);
			}
			if (staleThreshold != null && (staleThreshold.isZero() || staleThreshold.isNegative())) {
				throw new IllegalArgumentException("Stale threshold must be positive: " + staleThreshold);
			}
			if (repos.isEmpty() && discovery == null && !myPRs) {
				logger.warn("PR watcher built without repositories, discovery or myPRs; it will track nothing "
						+ "until a repository is added");
			}
			return new PRWatcher(this);
		}

	}

}

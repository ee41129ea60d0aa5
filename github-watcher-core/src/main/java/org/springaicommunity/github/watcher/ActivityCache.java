package org.springaicommunity.github.watcher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cached comments, reviews and check runs for one pull request.
 *
 * <p>
 * Comments and reviews are append-only per id. Check runs are updated in place per id
 * for as long as the head commit is unchanged; when the head commit moves the check runs
 * of the old commit no longer apply and are replaced.
 *
 * @param comments issue comments, in first-seen order
 * @param reviews reviews, in first-seen order
 * @param checkRuns check runs for the current head commit
 */
public record ActivityCache(List<Comment> comments, List<Review> reviews, List<CheckRun> checkRuns) {

	public static final ActivityCache EMPTY = new ActivityCache(List.of(), List.of(), List.of());

	public ActivityCache {
		comments = List.copyOf(comments);
		reviews = List.copyOf(reviews);
		checkRuns = List.copyOf(checkRuns);
	}

	/**
	 * Returns true when every check run has reached a terminal state. A pull request
	 * without check runs counts as complete.
	 * @return whether a future poll may skip refetching check runs
	 */
	public boolean checksComplete() {
		return checkRuns.stream().allMatch(CheckRun::isCompleted);
	}

	/**
	 * Merge freshly fetched activity into this cache.
	 * @param fetched activity returned by the API in this poll
	 * @param sameHead whether the check runs were fetched for the same head commit as the
	 * cached ones
	 * @return the merged cache
	 */
	public ActivityCache merge(ActivityCache fetched, boolean sameHead) {
		Map<Long, Comment> mergedComments = new LinkedHashMap<>();
		comments.forEach(c -> mergedComments.put(c.id(), c));
		fetched.comments().forEach(c -> mergedComments.put(c.id(), c));

		Map<Long, Review> mergedReviews = new LinkedHashMap<>();
		reviews.forEach(r -> mergedReviews.put(r.id(), r));
		fetched.reviews().forEach(r -> mergedReviews.put(r.id(), r));

		List<CheckRun> mergedRuns;
		if (sameHead) {
			Map<Long, CheckRun> runs = new LinkedHashMap<>();
			checkRuns.forEach(cr -> runs.put(cr.id(), cr));
			fetched.checkRuns().forEach(cr -> runs.put(cr.id(), cr));
			mergedRuns = new ArrayList<>(runs.values());
		}
		else {
			mergedRuns = fetched.checkRuns();
		}

		return new ActivityCache(new ArrayList<>(mergedComments.values()), new ArrayList<>(mergedReviews.values()),
				mergedRuns);
	}

}

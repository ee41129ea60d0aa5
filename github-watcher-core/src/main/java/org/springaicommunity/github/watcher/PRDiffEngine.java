package org.springaicommunity.github.watcher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Computes the delta between a freshly fetched pull request and its stored snapshot.
 *
 * <p>
 * Pure functions without I/O; the watcher turns the results into events.
 */
public final class PRDiffEngine {

	private PRDiffEngine() {
	}

	/**
	 * Compare the metadata fields that produce {@code pr_updated} events.
	 * @param previous the pull request stored in the snapshot
	 * @param current the pull request observed in this poll
	 * @return changed fields keyed by {@link PRUpdatedEvent#DRAFT},
	 * {@link PRUpdatedEvent#LABELS} and {@link PRUpdatedEvent#MERGEABLE_STATE}; empty if
	 * nothing changed
	 */
	public static Map<String, FieldChange<?>> metadataChanges(PullRequest previous, PullRequest current) {
		Map<String, FieldChange<?>> changes = new LinkedHashMap<>();

		if (previous.draft() != current.draft()) {
			changes.put(PRUpdatedEvent.DRAFT, new FieldChange<>(previous.draft(), current.draft()));
		}

		if (!labelNames(previous.labels()).equals(labelNames(current.labels()))) {
			changes.put(PRUpdatedEvent.LABELS, new FieldChange<>(previous.labels(), current.labels()));
		}

		if (!Objects.equals(previous.mergeableState(), current.mergeableState())) {
			changes.put(PRUpdatedEvent.MERGEABLE_STATE,
					new FieldChange<>(previous.mergeableState(), current.mergeableState()));
		}

		return changes;
	}

	/**
	 * Find comments whose id is not in the cache.
	 * @param cached activity stored in the snapshot
	 * @param fetched activity observed in this poll
	 * @return new comments in fetched order
	 */
	public static List<Comment> newComments(ActivityCache cached, ActivityCache fetched) {
		Set<Long> seen = cached.comments().stream().map(Comment::id).collect(Collectors.toSet());
		List<Comment> result = new ArrayList<>();
		for (Comment comment : fetched.comments()) {
			if (!seen.contains(comment.id())) {
				result.add(comment);
			}
		}
		return result;
	}

	/**
	 * Find reviews whose id is not in the cache.
	 * @param cached activity stored in the snapshot
	 * @param fetched activity observed in this poll
	 * @return new reviews in fetched order
	 */
	public static List<Review> newReviews(ActivityCache cached, ActivityCache fetched) {
		Set<Long> seen = cached.reviews().stream().map(Review::id).collect(Collectors.toSet());
		List<Review> result = new ArrayList<>();
		for (Review review : fetched.reviews()) {
			if (!seen.contains(review.id())) {
				result.add(review);
			}
		}
		return result;
	}

	/**
	 * Find check runs that are new or whose {@code (status, conclusion)} pair changed.
	 * @param cached activity stored in the snapshot
	 * @param fetched activity observed in this poll
	 * @return new or changed check runs in fetched order
	 */
	public static List<CheckRun> changedCheckRuns(ActivityCache cached, ActivityCache fetched) {
		Map<Long, CheckRun> previous = new LinkedHashMap<>();
		cached.checkRuns().forEach(cr -> previous.put(cr.id(), cr));
		List<CheckRun> result = new ArrayList<>();
		for (CheckRun run : fetched.checkRuns()) {
			CheckRun prev = previous.get(run.id());
			if (prev == null || !Objects.equals(prev.status(), run.status())
					|| !Objects.equals(prev.conclusion(), run.conclusion())) {
				result.add(run);
			}
		}
		return result;
	}

	private static Set<String> labelNames(List<Label> labels) {
		return labels.stream().map(Label::name).collect(Collectors.toCollection(TreeSet::new));
	}

}

package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

/**
 * Resolves a pull request's status through the optional {@link StatusClassifier} and
 * detects transitions against the stored snapshot.
 */
class StatusTracker {

	private final @Nullable StatusClassifier classifier;

	StatusTracker(@Nullable StatusClassifier classifier) {
		this.classifier = classifier;
	}

	/**
	 * Classify a pull request.
	 * @param event the pull request and repository
	 * @param activity activity as of this poll
	 * @param previous the stored snapshot, or null on first observation
	 * @return the status and, when it differs from a stored status, the transition
	 * @throws Exception if the classifier fails
	 */
	Result classify(PREvent event, ActivityCache activity, @Nullable PRSnapshot previous) throws Exception {
		if (classifier == null) {
			return new Result("", null);
		}
		String status = classifier.classify(event, activity);
		if (status == null) {
			status = "";
		}
		if (previous == null || previous.status().equals(status)) {
			return new Result(status, null);
		}
		return new Result(status, new StatusChangedEvent(event.pr(), event.repo(), previous.status(), status));
	}

	record Result(String status, @Nullable StatusChangedEvent transition) {
	}

}

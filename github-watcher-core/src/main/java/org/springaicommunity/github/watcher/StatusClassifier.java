package org.springaicommunity.github.watcher;

/**
 * Caller-supplied mapping from a pull request and its activity to a domain status such
 * as {@code "needs_review"} or {@code "approved"}. The watcher emits
 * {@code status_changed} whenever the returned value differs from the previous poll.
 */
@FunctionalInterface
public interface StatusClassifier {

	/**
	 * Classify a pull request.
	 * @param event the pull request and its repository
	 * @param activity comments, reviews and check runs as of this poll
	 * @return the status string
	 * @throws Exception if classification fails; the error is reported and the previous
	 * status is kept
	 */
	String classify(PREvent event, ActivityCache activity) throws Exception;

}

package org.springaicommunity.github.watcher;

/**
 * How much of a pull request's activity to refetch in a poll, in order of cost.
 */
public enum FetchStrategy {

	/**
	 * Comments, reviews and check runs.
	 */
	FULL(3),

	/**
	 * Check runs only; cached comments and reviews are reused.
	 */
	CHECK_RUNS_ONLY(1),

	/**
	 * Nothing; the cached activity is reused verbatim.
	 */
	NONE(0);

	private final int weight;

	FetchStrategy(int weight) {
		this.weight = weight;
	}

	/**
	 * Returns the throttle weight of this strategy, equal to the number of API requests it
	 * issues.
	 * @return the throttle weight
	 */
	public int weight() {
		return weight;
	}

}

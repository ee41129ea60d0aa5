package org.springaicommunity.github.watcher;

/**
 * A pull request located by the search API, before its full data has been fetched.
 *
 * @param repo the repository the pull request belongs to
 * @param number the pull request number
 */
public record PullRequestRef(RepoRef repo, int number) {

	public PRIdentity identity() {
		return new PRIdentity(repo, number);
	}

}

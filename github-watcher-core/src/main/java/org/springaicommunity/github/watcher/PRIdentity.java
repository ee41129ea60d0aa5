package org.springaicommunity.github.watcher;

/**
 * The key under which a pull request is tracked.
 *
 * @param repo the repository the pull request belongs to
 * @param number the pull request number within the repository
 */
public record PRIdentity(RepoRef repo, int number) {

	@Override
	public String toString() {
		return repo + "#" + number;
	}

}

package org.springaicommunity.github.watcher;

import org.jspecify.annotations.Nullable;

/**
 * Repository metadata from the GitHub API. The watcher only needs it to resolve the
 * default branch of a repository that has no open pull requests.
 *
 * @param id the unique repository ID
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param description the repository description (may be null)
 * @param htmlUrl the web URL for the repository
 * @param isPrivate whether the repository is private
 * @param defaultBranch the default branch name
 */
public record RepositoryInfo(long id, String name, String fullName, @Nullable String description, String htmlUrl,
		boolean isPrivate, String defaultBranch) {

}

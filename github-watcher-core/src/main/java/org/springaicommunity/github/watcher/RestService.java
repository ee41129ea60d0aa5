package org.springaicommunity.github.watcher;

import java.util.List;

/**
 * Interface for the GitHub REST API operations the watcher depends on.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON. Implementations throw
 * {@link GitHubHttpClient.GitHubApiException} (or another runtime exception) on failure;
 * they never substitute empty results, because an empty list would be indistinguishable
 * from "every pull request was closed".
 */
public interface RestService {

	/**
	 * List open pull requests of a repository, most recently updated first.
	 * @param repo the repository
	 * @return open pull requests
	 */
	List<PullRequest> listOpenPullRequests(RepoRef repo);

	/**
	 * Get a single pull request by number, whatever its state.
	 * @param repo the repository
	 * @param number the pull request number
	 * @return the pull request
	 */
	PullRequest getPullRequest(RepoRef repo, int number);

	/**
	 * List issue comments on a pull request.
	 * @param repo the repository
	 * @param number the pull request number
	 * @return comments
	 */
	List<Comment> listIssueComments(RepoRef repo, int number);

	/**
	 * List reviews on a pull request.
	 * @param repo the repository
	 * @param number the pull request number
	 * @return reviews
	 */
	List<Review> listReviews(RepoRef repo, int number);

	/**
	 * List check runs for a commit, branch or tag.
	 * @param repo the repository
	 * @param ref commit SHA or ref name
	 * @return check runs
	 */
	List<CheckRun> listCheckRuns(RepoRef repo, String ref);

	/**
	 * Get the commit SHA at the head of a branch.
	 * @param repo the repository
	 * @param branch the branch name
	 * @return the head commit SHA
	 */
	String getBranchHeadSha(RepoRef repo, String branch);

	/**
	 * Get repository metadata.
	 * @param repo the repository
	 * @return repository information including the default branch
	 */
	RepositoryInfo getRepository(RepoRef repo);

	/**
	 * Search open pull requests authored by a user across all repositories.
	 * @param login the author's GitHub login
	 * @return references to matching pull requests
	 */
	List<PullRequestRef> searchOpenPullRequestsByAuthor(String login);

	/**
	 * Get the login of the user the token belongs to.
	 * @return the authenticated user's login
	 */
	String getAuthenticatedLogin();

	/**
	 * Get current rate limit status.
	 * @return rate limit information
	 */
	RateLimitInfo getRateLimit();

}

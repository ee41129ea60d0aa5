package org.springaicommunity.github.watcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 * Transport and parsing failures are thrown as
 * {@link GitHubHttpClient.GitHubApiException}; the watcher decides how to recover.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

	private static final Pattern REPOSITORY_URL = Pattern.compile("repos/([^/]+)/([^/]+)$");

	private static final int PAGE_SIZE = 100;

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public List<PullRequest> listOpenPullRequests(RepoRef repo) {
		JsonNode nodes = getJsonArray(repoPath(repo) + "/pulls?state=open&sort=updated&direction=desc&per_page="
				+ PAGE_SIZE);
		List<PullRequest> prs = new ArrayList<>();
		for (JsonNode node : nodes) {
			prs.add(parsePullRequest(node));
		}
		logger.debug("Listed {} open PRs in {}", prs.size(), repo);
		return prs;
	}

	@Override
	public PullRequest getPullRequest(RepoRef repo, int number) {
		return parsePullRequest(getJson(repoPath(repo) + "/pulls/" + number));
	}

	@Override
	public List<Comment> listIssueComments(RepoRef repo, int number) {
		JsonNode nodes = getJsonArray(repoPath(repo) + "/issues/" + number + "/comments?per_page=" + PAGE_SIZE);
		List<Comment> comments = new ArrayList<>();
		for (JsonNode node : nodes) {
			comments.add(new Comment(node.path("id").asLong(), parseAuthor(node.path("user")),
					node.path("body").asText(""), parseDateTime(node.path("created_at").asText(null)),
					parseDateTime(node.path("updated_at").asText(null)), node.path("html_url").asText("")));
		}
		return comments;
	}

	@Override
	public List<Review> listReviews(RepoRef repo, int number) {
		JsonNode nodes = getJsonArray(repoPath(repo) + "/pulls/" + number + "/reviews?per_page=" + PAGE_SIZE);
		List<Review> reviews = new ArrayList<>();
		for (JsonNode node : nodes) {
			reviews.add(new Review(node.path("id").asLong(), node.path("body").asText(null),
					node.path("state").asText(""), parseDateTime(node.path("submitted_at").asText(null)),
					parseAuthor(node.path("user")), node.path("author_association").asText(""),
					node.path("html_url").asText("")));
		}
		return reviews;
	}

	@Override
	public List<CheckRun> listCheckRuns(RepoRef repo, String ref) {
		JsonNode response = getJson(repoPath(repo) + "/commits/" + ref + "/check-runs?per_page=" + PAGE_SIZE);
		List<CheckRun> runs = new ArrayList<>();
		for (JsonNode node : response.path("check_runs")) {
			runs.add(new CheckRun(node.path("id").asLong(), node.path("name").asText(""),
					node.path("status").asText(""), textOrNull(node.path("conclusion")),
					parseDateTime(node.path("started_at").asText(null)),
					parseDateTime(node.path("completed_at").asText(null)), node.path("html_url").asText("")));
		}
		return runs;
	}

	@Override
	public String getBranchHeadSha(RepoRef repo, String branch) {
		JsonNode ref = getJson(repoPath(repo) + "/git/ref/heads/" + branch);
		String sha = textOrNull(ref.path("object").path("sha"));
		if (sha == null) {
			throw new GitHubHttpClient.GitHubApiException("No commit SHA for " + repo + "@" + branch, 200,
					ref.toString());
		}
		return sha;
	}

	@Override
	public RepositoryInfo getRepository(RepoRef repo) {
		JsonNode node = getJson(repoPath(repo));
		String defaultBranch = textOrNull(node.path("default_branch"));
		if (defaultBranch == null) {
			throw new GitHubHttpClient.GitHubApiException("No default branch reported for " + repo, 200,
					node.toString());
		}
		return new RepositoryInfo(node.path("id").asLong(), node.path("name").asText(""),
				node.path("full_name").asText(""), node.path("description").asText(null),
				node.path("html_url").asText(""), node.path("private").asBoolean(false), defaultBranch);
	}

	@Override
	public List<PullRequestRef> searchOpenPullRequestsByAuthor(String login) {
		String query = URLEncoder.encode("is:pr is:open author:" + login, StandardCharsets.UTF_8);
		JsonNode response = getJson("/search/issues?q=" + query + "&sort=updated&per_page=" + PAGE_SIZE);
		List<PullRequestRef> refs = new ArrayList<>();
		for (JsonNode item : response.path("items")) {
			Matcher matcher = REPOSITORY_URL.matcher(item.path("repository_url").asText(""));
			if (!matcher.find()) {
				logger.warn("Skipping search result without repository URL: {}", item.path("html_url").asText());
				continue;
			}
			refs.add(new PullRequestRef(new RepoRef(matcher.group(1), matcher.group(2)), item.path("number").asInt()));
		}
		if (response.path("incomplete_results").asBoolean(false)) {
			logger.warn("Search for open PRs by {} returned incomplete results", login);
		}
		return refs;
	}

	@Override
	public String getAuthenticatedLogin() {
		return getJson("/user").path("login").asText();
	}

	@Override
	public RateLimitInfo getRateLimit() {
		JsonNode core = getJson("/rate_limit").path("resources").path("core");
		return new RateLimitInfo(core.path("limit").asInt(), core.path("remaining").asInt(),
				core.path("reset").asLong(), core.path("used").asInt());
	}

	// ========== JSON Parsing Methods ==========

	private JsonNode getJson(String path) {
		String body = httpClient.get(path);
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed JSON response from " + path, e);
		}
	}

	private JsonNode getJsonArray(String path) {
		JsonNode node = getJson(path);
		if (!node.isArray()) {
			throw new GitHubHttpClient.GitHubApiException("Expected a JSON array from " + path, 200, node.toString());
		}
		return node;
	}

	private PullRequest parsePullRequest(JsonNode node) {
		if (!node.path("number").canConvertToInt() || node.path("number").asInt() <= 0) {
			throw new GitHubHttpClient.GitHubApiException("Pull request payload without a number", 200,
					node.toString());
		}
		JsonNode head = node.path("head");
		JsonNode base = node.path("base");
		return new PullRequest(node.path("number").asInt(), node.path("title").asText(""),
				node.path("body").asText(null), node.path("state").asText("open"), node.path("draft").asBoolean(false),
				parseLabels(node.path("labels")), textOrNull(node.path("mergeable_state")),
				parseDateTime(node.path("created_at").asText(null)),
				parseDateTime(node.path("updated_at").asText(null)),
				parseDateTime(node.path("closed_at").asText(null)), parseDateTime(node.path("merged_at").asText(null)),
				node.path("html_url").asText(""), parseAuthor(node.path("user")), head.path("ref").asText(""),
				head.path("sha").asText(""), base.path("ref").asText(""),
				textOrNull(base.path("repo").path("full_name")),
				textOrNull(base.path("repo").path("default_branch")));
	}

	private Author parseAuthor(JsonNode node) {
		if (node.isMissingNode() || node.isNull()) {
			return new Author("unknown", null);
		}
		return new Author(node.path("login").asText("unknown"), node.path("name").asText(null));
	}

	private List<Label> parseLabels(JsonNode nodes) {
		List<Label> labels = new ArrayList<>();
		for (JsonNode node : nodes) {
			labels.add(new Label(node.path("name").asText(""), node.path("color").asText(null),
					node.path("description").asText(null)));
		}
		return labels;
	}

	private static @Nullable String textOrNull(JsonNode node) {
		return node.isMissingNode() || node.isNull() ? null : node.asText();
	}

	private @Nullable LocalDateTime parseDateTime(@Nullable String dateTimeStr) {
		if (dateTimeStr == null || dateTimeStr.isEmpty()) {
			return null;
		}
		try {
			return LocalDateTime.parse(dateTimeStr, ISO_FORMATTER);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", dateTimeStr);
			return null;
		}
	}

	private static String repoPath(RepoRef repo) {
		return "/repos/" + repo.owner() + "/" + repo.name();
	}

}

package org.springaicommunity.github.watcher;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical reference to a GitHub repository.
 *
 * <p>
 * Accepted inputs are {@code owner/name}, {@code github.com/owner/name} and full URLs
 * such as {@code https://github.com/owner/name.git} or
 * {@code https://github.com/owner/name/pull/42}; all of them normalize to the same
 * lower-case {@code (owner, name)} pair. GitHub treats repository names
 * case-insensitively, so two references are equal when their normalized pairs are equal.
 *
 * @param owner the repository owner (user or organization), lower case
 * @param name the repository name, lower case
 */
public record RepoRef(String owner, String name) {

	private static final Pattern OWNER = Pattern.compile("[a-z0-9](?:[a-z0-9-]*[a-z0-9])?");

	private static final Pattern NAME = Pattern.compile("[a-z0-9._-]+");

	public RepoRef {
		owner = owner.trim().toLowerCase(Locale.ROOT);
		name = name.trim().toLowerCase(Locale.ROOT);
		if (!OWNER.matcher(owner).matches()) {
			throw new IllegalArgumentException("Invalid repository owner: '" + owner + "'");
		}
		if (!NAME.matcher(name).matches() || ".".equals(name) || "..".equals(name)) {
			throw new IllegalArgumentException("Invalid repository name: '" + name + "'");
		}
	}

	/**
	 * Parse and normalize a repository identifier.
	 * @param value repository in "owner/name", "github.com/owner/name" or URL form
	 * @return the normalized reference
	 * @throws IllegalArgumentException if the value does not identify a repository
	 */
	public static RepoRef parse(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Repository must not be empty");
		}
		String path = value.trim();
		boolean qualified = false;
		if (path.startsWith("git@github.com:")) {
			path = path.substring("git@github.com:".length());
			qualified = true;
		}
		int scheme = path.indexOf("://");
		if (scheme >= 0) {
			path = path.substring(scheme + 3);
		}
		if (path.regionMatches(true, 0, "www.", 0, 4)) {
			path = path.substring(4);
		}
		if (path.regionMatches(true, 0, "github.com/", 0, 11)) {
			path = path.substring(11);
			qualified = true;
		}
		if (!qualified && path.indexOf('.') >= 0 && path.indexOf('.') < path.indexOf('/')) {
			throw new IllegalArgumentException("Not a GitHub repository: '" + value + "'");
		}

		String[] segments = path.split("/");
		boolean shapeOk = qualified ? segments.length >= 2 : segments.length == 2;
		if (!shapeOk || segments[0].isEmpty() || segments[1].isEmpty()) {
			throw new IllegalArgumentException(
					"Invalid repository '" + value + "': expected 'owner/name' or a GitHub repository URL");
		}

		String name = segments[1];
		if (name.endsWith(".git")) {
			name = name.substring(0, name.length() - 4);
		}
		return new RepoRef(segments[0], name);
	}

	/**
	 * Returns the repository in "owner/name" form.
	 */
	@Override
	public String toString() {
		return owner + "/" + name;
	}

}

package org.springaicommunity.github.watcher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the PR watcher. Pure Java implementation with no
 * Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final WatchProperties defaultProperties;

	public ArgumentParser(WatchProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		boolean reposGiven = false;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					String repoStr = getRequiredValue(args, i, "repo");
					if (!reposGiven) {
						// Command-line repositories replace the configured defaults
						config.repositories.clear();
						reposGiven = true;
					}
					Arrays.stream(repoStr.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.forEach(config.repositories::add);
					i++; // Skip next argument since we consumed it
					break;

				case "-i", "--interval":
					config.intervalSeconds = parsePositiveInt(getRequiredValue(args, i, "interval"), "interval");
					i++;
					break;

				case "--stale-after":
					config.staleAfterSeconds = parsePositiveInt(getRequiredValue(args, i, "stale-after"),
							"stale-after");
					i++;
					break;

				case "--my-prs":
					config.myPRs = true;
					break;

				case "-u", "--user":
					config.username = getRequiredValue(args, i, "user");
					i++;
					break;

				case "--push":
					config.push = true;
					break;

				case "--once":
					config.once = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: watch.java [OPTIONS]\n");
		help.append("\n");
		help.append("Watch GitHub repositories and log pull request activity as it happens.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -r, --repo REPO         Repository to watch (owner/name or URL); repeatable,\n");
		help.append("                            comma-separated lists accepted\n");
		help.append("    -i, --interval SECONDS  Seconds between polls (default: ")
			.append(defaultProperties.getIntervalSeconds())
			.append(")\n");
		help.append("    --my-prs                Also watch your open PRs in any repository\n");
		help.append("    -u, --user LOGIN        Author for --my-prs (default: the token's user)\n");
		help.append("    --stale-after SECONDS   Forget PRs not seen for this long (default: never)\n");
		help.append("    --push                  Report pushes to each repository's default branch\n");
		help.append("    --once                  Poll once, print the watched PRs and exit\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN           GitHub personal access token (required; .env files are read)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    ./watch.java --repo spring-projects/spring-ai\n");
		help.append("    ./watch.java -r spring-projects/spring-ai,spring-projects/spring-boot --push -i 60\n");
		help.append("    ./watch.java --my-prs --once\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		EnvironmentSupport.requireGitHubToken();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositiveInt(String value, String optionName) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(
					"Invalid " + optionName + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be positive");
		}
		return parsed;
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.repositories.isEmpty() && !config.myPRs) {
			errors.add("At least one --repo or --my-prs is required");
		}

		for (String repo : config.repositories) {
			try {
				RepoRef.parse(repo);
			}
			catch (IllegalArgumentException e) {
				errors.add(e.getMessage());
			}
		}

		if (config.username != null && !config.myPRs) {
			errors.add("--user requires --my-prs");
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration validation failed: " + String.join(", ", errors));
		}
	}

}

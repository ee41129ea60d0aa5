package org.springaicommunity.github.watcher.cli;

import org.springaicommunity.github.watcher.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders watcher events as single log lines.
 */
class EventFormatter {

	private static final int SHORT_SHA = 7;

	String format(WatcherEvent<?> event) {
		EventType<?> type = event.type();
		if (type == EventType.NEW_PR) {
			return prLine("NEW", event.payloadAs(EventType.NEW_PR));
		}
		if (type == EventType.MERGED) {
			return prLine("MERGED", event.payloadAs(EventType.MERGED));
		}
		if (type == EventType.CLOSED) {
			return prLine("CLOSED", event.payloadAs(EventType.CLOSED));
		}
		if (type == EventType.PR_UPDATED) {
			PRUpdatedEvent updated = event.payloadAs(EventType.PR_UPDATED);
			String changes = updated.changes()
				.entrySet()
				.stream()
				.map(this::change)
				.collect(Collectors.joining(", "));
			return String.format("UPDATED %s#%d %s", updated.repo(), updated.pr().number(), changes);
		}
		if (type == EventType.COMMENT) {
			CommentEvent comment = event.payloadAs(EventType.COMMENT);
			return String.format("COMMENT %s#%d by %s: %s", comment.repo(), comment.pr().number(),
					comment.comment().author().login(), abbreviate(comment.comment().body()));
		}
		if (type == EventType.REVIEW) {
			ReviewEvent review = event.payloadAs(EventType.REVIEW);
			return String.format("REVIEW %s#%d %s by %s", review.repo(), review.pr().number(),
					review.review().state(), review.review().author().login());
		}
		if (type == EventType.CHECK_RUN) {
			CheckRunEvent check = event.payloadAs(EventType.CHECK_RUN);
			CheckRun run = check.checkRun();
			String outcome = run.conclusion() != null ? run.status() + "/" + run.conclusion() : run.status();
			return String.format("CHECK %s#%d %s %s", check.repo(), check.pr().number(), run.name(), outcome);
		}
		if (type == EventType.STATUS_CHANGED) {
			StatusChangedEvent status = event.payloadAs(EventType.STATUS_CHANGED);
			return String.format("STATUS %s#%d %s -> %s", status.repo(), status.pr().number(),
					status.previousStatus(), status.status());
		}
		if (type == EventType.PUSH) {
			return push(event.payloadAs(EventType.PUSH));
		}
		if (type == EventType.POLL_COMPLETE) {
			return String.format("POLL %d pull requests watched", event.payloadAs(EventType.POLL_COMPLETE).prs().size());
		}
		return type + " " + event.payload();
	}

	String push(PushEvent push) {
		return String.format("PUSH %s@%s %s -> %s", push.repo(), push.branch(), shortSha(push.previousSha()),
				shortSha(push.sha()));
	}

	String status(PRStatus status) {
		String suffix = status.status().isEmpty() ? "" : " [" + status.status() + "]";
		return String.format("%s#%d %s%s", status.repo(), status.pr().number(), status.pr().title(), suffix);
	}

	private String prLine(String verb, PREvent event) {
		return String.format("%s %s#%d %s (%s)", verb, event.repo(), event.pr().number(), event.pr().title(),
				event.pr().author().login());
	}

	private String change(Map.Entry<String, FieldChange<?>> entry) {
		return entry.getKey() + ": " + value(entry.getValue().from()) + " -> " + value(entry.getValue().to());
	}

	private String value(Object value) {
		if (value instanceof List<?> list) {
			return list.stream()
				.map(item -> item instanceof Label label ? label.name() : String.valueOf(item))
				.collect(Collectors.joining(",", "[", "]"));
		}
		return String.valueOf(value);
	}

	private static String shortSha(String sha) {
		return sha.length() > SHORT_SHA ? sha.substring(0, SHORT_SHA) : sha;
	}

	private static String abbreviate(String text) {
		String line = text.replaceAll("\\s+", " ").trim();
		return line.length() > 80 ? line.substring(0, 77) + "..." : line;
	}

}

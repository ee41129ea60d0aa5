package org.springaicommunity.github.watcher;

import java.util.List;

/**
 * Payload of {@code poll_complete}: every tracked pull request after this cycle's
 * updates and evictions.
 *
 * @param prs the tracked pull requests with their status
 */
public record PollCompleteEvent(List<PRStatus> prs) {

	public PollCompleteEvent {
		prs = List.copyOf(prs);
	}

}

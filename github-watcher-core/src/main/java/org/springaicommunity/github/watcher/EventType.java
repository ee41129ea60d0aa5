package org.springaicommunity.github.watcher;

import java.util.List;

/**
 * Typed key identifying one kind of watcher event and its payload type.
 *
 * <p>
 * The set of kinds is closed; instances exist only as the constants below.
 *
 * @param <T> the payload type carried by events of this kind
 */
public final class EventType<T> {

	public static final EventType<PREvent> NEW_PR = new EventType<>("new_pr", PREvent.class);

	public static final EventType<PRUpdatedEvent> PR_UPDATED = new EventType<>("pr_updated", PRUpdatedEvent.class);

	public static final EventType<CommentEvent> COMMENT = new EventType<>("comment", CommentEvent.class);

	public static final EventType<ReviewEvent> REVIEW = new EventType<>("review", ReviewEvent.class);

	public static final EventType<CheckRunEvent> CHECK_RUN = new EventType<>("check_run", CheckRunEvent.class);

	public static final EventType<PREvent> MERGED = new EventType<>("merged", PREvent.class);

	public static final EventType<PREvent> CLOSED = new EventType<>("closed", PREvent.class);

	public static final EventType<StatusChangedEvent> STATUS_CHANGED = new EventType<>("status_changed",
			StatusChangedEvent.class);

	public static final EventType<PushEvent> PUSH = new EventType<>("push", PushEvent.class);

	public static final EventType<PollCompleteEvent> POLL_COMPLETE = new EventType<>("poll_complete",
			PollCompleteEvent.class);

	private static final List<EventType<?>> VALUES = List.of(NEW_PR, PR_UPDATED, COMMENT, REVIEW, CHECK_RUN, MERGED,
			CLOSED, STATUS_CHANGED, PUSH, POLL_COMPLETE);

	private final String name;

	private final Class<T> payloadType;

	private EventType(String name, Class<T> payloadType) {
		this.name = name;
		this.payloadType = payloadType;
	}

	/**
	 * Returns all event kinds.
	 * @return immutable list of every event type
	 */
	public static List<EventType<?>> values() {
		return VALUES;
	}

	/**
	 * Returns the wire name of this kind, e.g. {@code new_pr}.
	 * @return the event name
	 */
	public String name() {
		return name;
	}

	public Class<T> payloadType() {
		return payloadType;
	}

	@Override
	public String toString() {
		return name;
	}

}

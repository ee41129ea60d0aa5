package org.springaicommunity.github.watcher;

/**
 * An event on the unified stream: the kind tag together with its payload.
 *
 * @param type the event kind
 * @param payload the kind-specific payload
 * @param <T> the payload type
 */
public record WatcherEvent<T>(EventType<T> type, T payload) {

	/**
	 * Returns the payload if this event is of the given kind.
	 * @param expected the kind to test for
	 * @param <U> the expected payload type
	 * @return the payload cast to the kind's payload type
	 * @throws IllegalArgumentException if this event is of a different kind
	 */
	public <U> U payloadAs(EventType<U> expected) {
		if (type != expected) {
			throw new IllegalArgumentException("Event is '" + type + "', not '" + expected + "'");
		}
		return expected.payloadType().cast(payload);
	}

}

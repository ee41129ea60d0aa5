package org.springaicommunity.github.watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * Typed listener registries, one per {@link EventType}, plus the unified event stream and
 * the error channel.
 *
 * <p>
 * Every event goes through {@link #emit(EventType, Object)}, which first notifies the
 * unified listeners and then the listeners of that kind, so both views always see the
 * same occurrences in the same order. Each listener invocation is isolated: an exception
 * is routed to the error channel and the remaining listeners still run.
 *
 * <p>
 * Listener sets are safe to modify from any thread, including from inside a listener.
 */
public class EventBus {

	private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

	private final Map<EventType<?>, Set<Consumer<?>>> listeners = new ConcurrentHashMap<>();

	private final Set<Consumer<? super WatcherEvent<?>>> eventListeners = new CopyOnWriteArraySet<>();

	private final Set<Consumer<? super Throwable>> errorListeners = new CopyOnWriteArraySet<>();

	public EventBus() {
		for (EventType<?> type : EventType.values()) {
			listeners.put(type, new CopyOnWriteArraySet<>());
		}
	}

	/**
	 * Subscribe to one kind of event.
	 * @param type the event kind
	 * @param listener receives the payload of every event of that kind
	 * @param <T> the payload type
	 * @return handle that removes the listener
	 */
	public <T> Subscription subscribe(EventType<T> type, Consumer<? super T> listener) {
		Set<Consumer<?>> set = listeners.get(type);
		set.add(listener);
		return () -> set.remove(listener);
	}

	/**
	 * Subscribe to the unified stream of all events.
	 * @param listener receives every event tagged with its kind
	 * @return handle that removes the listener
	 */
	public Subscription subscribeAll(Consumer<? super WatcherEvent<?>> listener) {
		eventListeners.add(listener);
		return () -> eventListeners.remove(listener);
	}

	/**
	 * Subscribe to the error channel.
	 * @param listener receives API failures and listener exceptions
	 * @return handle that removes the listener
	 */
	public Subscription subscribeErrors(Consumer<? super Throwable> listener) {
		errorListeners.add(listener);
		return () -> errorListeners.remove(listener);
	}

	/**
	 * Returns true if at least one listener is registered for the given kind.
	 * @param type the event kind
	 * @return whether events of this kind have a per-kind subscriber
	 */
	public boolean hasListeners(EventType<?> type) {
		return !listeners.get(type).isEmpty();
	}

	/**
	 * Dispatch one event to the unified stream and to the listeners of its kind.
	 * @param type the event kind
	 * @param payload the payload
	 * @param <T> the payload type
	 */
	@SuppressWarnings("unchecked")
	public <T> void emit(EventType<T> type, T payload) {
		logger.debug("Emitting {} event", type);
		WatcherEvent<T> event = new WatcherEvent<>(type, payload);
		for (Consumer<? super WatcherEvent<?>> listener : eventListeners) {
			invoke(listener, event, type);
		}
		for (Consumer<?> listener : listeners.get(type)) {
			invoke((Consumer<T>) listener, payload, type);
		}
	}

	/**
	 * Route an error to every error listener. When nobody listens the error is logged so
	 * that it is never lost silently.
	 * @param error the error to report
	 */
	public void emitError(Throwable error) {
		if (errorListeners.isEmpty()) {
			logger.warn("Unhandled watcher error: {}", error.getMessage(), error);
			return;
		}
		for (Consumer<? super Throwable> listener : errorListeners) {
			try {
				listener.accept(error);
			}
			catch (RuntimeException e) {
				logger.error("Error listener failed while handling '{}'", error.getMessage(), e);
			}
		}
	}

	private <P> void invoke(Consumer<? super P> listener, P payload, EventType<?> type) {
		try {
			listener.accept(payload);
		}
		catch (RuntimeException e) {
			logger.debug("Listener for {} threw: {}", type, e.getMessage());
			emitError(e);
		}
	}

}

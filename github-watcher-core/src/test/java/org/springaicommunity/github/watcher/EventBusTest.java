package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.watcher.TestData.*;

@DisplayName("EventBus Tests")
class EventBusTest {

	private final EventBus bus = new EventBus();

	private final PREvent newPr = new PREvent(pr(1), REPO);

	@Nested
	@DisplayName("Dispatch")
	class Dispatch {

		@Test
		@DisplayName("Should notify unified listeners before per-kind listeners")
		void shouldNotifyUnifiedListenersFirst() {
			List<String> calls = new ArrayList<>();
			bus.subscribe(EventType.NEW_PR, e -> calls.add("kind"));
			bus.subscribeAll(e -> calls.add("all:" + e.type()));

			bus.emit(EventType.NEW_PR, newPr);

			assertThat(calls).containsExactly("all:new_pr", "kind");
		}

		@Test
		@DisplayName("Should deliver only to listeners of the emitted kind")
		void shouldDeliverOnlyToMatchingKind() {
			List<PREvent> merged = new ArrayList<>();
			List<PREvent> created = new ArrayList<>();
			bus.subscribe(EventType.MERGED, merged::add);
			bus.subscribe(EventType.NEW_PR, created::add);

			bus.emit(EventType.NEW_PR, newPr);

			assertThat(created).containsExactly(newPr);
			assertThat(merged).isEmpty();
		}

		@Test
		@DisplayName("Should tag unified events with their kind")
		void shouldTagUnifiedEvents() {
			List<WatcherEvent<?>> events = new ArrayList<>();
			bus.subscribeAll(events::add);

			bus.emit(EventType.CLOSED, newPr);

			assertThat(events).hasSize(1);
			assertThat(events.get(0).payloadAs(EventType.CLOSED)).isSameAs(newPr);
			assertThatThrownBy(() -> events.get(0).payloadAs(EventType.MERGED))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should track whether a kind has listeners")
		void shouldTrackListenerPresence() {
			assertThat(bus.hasListeners(EventType.PUSH)).isFalse();

			Subscription subscription = bus.subscribe(EventType.PUSH, push -> {
			});
			assertThat(bus.hasListeners(EventType.PUSH)).isTrue();

			subscription.unsubscribe();
			assertThat(bus.hasListeners(EventType.PUSH)).isFalse();
		}

		@Test
		@DisplayName("Should not count unified listeners as per-kind listeners")
		void shouldNotCountUnifiedListeners() {
			bus.subscribeAll(e -> {
			});

			assertThat(bus.hasListeners(EventType.PUSH)).isFalse();
		}

	}

	@Nested
	@DisplayName("Isolation")
	class Isolation {

		@Test
		@DisplayName("Should route listener exceptions to the error channel and keep dispatching")
		void shouldIsolateListenerExceptions() {
			List<Throwable> errors = new ArrayList<>();
			List<PREvent> received = new ArrayList<>();
			RuntimeException failure = new IllegalStateException("boom");
			bus.subscribeErrors(errors::add);
			bus.subscribeAll(e -> {
				throw failure;
			});
			bus.subscribe(EventType.NEW_PR, e -> {
				throw failure;
			});
			bus.subscribe(EventType.NEW_PR, received::add);

			assertThatCode(() -> bus.emit(EventType.NEW_PR, newPr)).doesNotThrowAnyException();

			assertThat(received).containsExactly(newPr);
			assertThat(errors).containsExactly(failure, failure);
		}

		@Test
		@DisplayName("Should drop exceptions thrown by error listeners")
		void shouldDropErrorListenerExceptions() {
			List<Throwable> errors = new ArrayList<>();
			bus.subscribeErrors(e -> {
				throw new IllegalStateException("error listener bug");
			});
			bus.subscribeErrors(errors::add);
			RuntimeException failure = new RuntimeException("api down");

			assertThatCode(() -> bus.emitError(failure)).doesNotThrowAnyException();
			assertThat(errors).containsExactly(failure);
		}

		@Test
		@DisplayName("Should not fail when nobody listens for errors")
		void shouldLogUnhandledErrors() {
			assertThatCode(() -> bus.emitError(new RuntimeException("unobserved"))).doesNotThrowAnyException();
		}

		@Test
		@DisplayName("Should allow unsubscribing from inside a listener")
		void shouldAllowUnsubscribeDuringDispatch() {
			List<PREvent> received = new ArrayList<>();
			Subscription[] holder = new Subscription[1];
			holder[0] = bus.subscribe(EventType.NEW_PR, e -> {
				received.add(e);
				holder[0].unsubscribe();
			});

			bus.emit(EventType.NEW_PR, newPr);
			bus.emit(EventType.NEW_PR, newPr);

			assertThat(received).hasSize(1);
		}

	}

}

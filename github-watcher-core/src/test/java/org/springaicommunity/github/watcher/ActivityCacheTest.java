package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.watcher.TestData.*;

@DisplayName("ActivityCache Tests")
class ActivityCacheTest {

	@Test
	@DisplayName("Should treat an empty check run list as complete")
	void shouldTreatEmptyChecksAsComplete() {
		assertThat(ActivityCache.EMPTY.checksComplete()).isTrue();
	}

	@Test
	@DisplayName("Should be incomplete while any check run is not completed")
	void shouldBeIncompleteWhileAnyRunIsPending() {
		ActivityCache cache = new ActivityCache(List.of(), List.of(),
				List.of(checkRun(1, "completed", "success"), checkRun(2, "queued", null)));

		assertThat(cache.checksComplete()).isFalse();
	}

	@Test
	@DisplayName("Should append comments and reviews by id")
	void shouldAppendCommentsAndReviewsById() {
		ActivityCache cached = new ActivityCache(List.of(comment(1, "a")), List.of(review(10, "COMMENTED")),
				List.of());
		ActivityCache fetched = new ActivityCache(List.of(comment(1, "a"), comment(2, "b")),
				List.of(review(11, "APPROVED")), List.of());

		ActivityCache merged = cached.merge(fetched, true);

		assertThat(merged.comments()).extracting(Comment::id).containsExactly(1L, 2L);
		assertThat(merged.reviews()).extracting(Review::id).containsExactly(10L, 11L);
	}

	@Test
	@DisplayName("Should update check runs in place while the head is unchanged")
	void shouldUpdateCheckRunsInPlace() {
		ActivityCache cached = new ActivityCache(List.of(), List.of(),
				List.of(checkRun(301, "in_progress", null), checkRun(302, "completed", "success")));
		ActivityCache fetched = new ActivityCache(List.of(), List.of(), List.of(checkRun(301, "completed", "failure")));

		ActivityCache merged = cached.merge(fetched, true);

		assertThat(merged.checkRuns()).extracting(CheckRun::id).containsExactly(301L, 302L);
		assertThat(merged.checkRuns().get(0).conclusion()).isEqualTo("failure");
		assertThat(merged.checksComplete()).isTrue();
	}

	@Test
	@DisplayName("Should replace check runs when the head moves")
	void shouldReplaceCheckRunsWhenHeadMoves() {
		ActivityCache cached = new ActivityCache(List.of(comment(1, "a")), List.of(),
				List.of(checkRun(301, "completed", "success")));
		ActivityCache fetched = new ActivityCache(List.of(), List.of(), List.of(checkRun(401, "queued", null)));

		ActivityCache merged = cached.merge(fetched, false);

		assertThat(merged.checkRuns()).extracting(CheckRun::id).containsExactly(401L);
		assertThat(merged.comments()).hasSize(1);
	}

}

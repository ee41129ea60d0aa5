package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.github.watcher.TestData.*;

@DisplayName("SelectiveFetchPlanner Tests")
class SelectiveFetchPlannerTest {

	private final ActivityCache complete = new ActivityCache(List.of(), List.of(),
			List.of(checkRun(1, "completed", "success")));

	private final ActivityCache pending = new ActivityCache(List.of(), List.of(), List.of(checkRun(1, "queued", null)));

	@Test
	@DisplayName("Should fetch everything for a PR without snapshot")
	void shouldFetchFullForNewPr() {
		assertThat(SelectiveFetchPlanner.plan(null, pr(1))).isEqualTo(FetchStrategy.FULL);
	}

	@Test
	@DisplayName("Should fetch everything when updated_at changed")
	void shouldFetchFullWhenUpdated() {
		PRSnapshot snapshot = snapshot(pr(1), complete);

		assertThat(SelectiveFetchPlanner.plan(snapshot, pr(1, T0.plusSeconds(1), "sha-1")))
			.isEqualTo(FetchStrategy.FULL);
	}

	@Test
	@DisplayName("Should fetch everything when the head SHA changed")
	void shouldFetchFullWhenHeadMoved() {
		PRSnapshot snapshot = snapshot(pr(1), complete);

		assertThat(SelectiveFetchPlanner.plan(snapshot, pr(1, T0, "sha-other"))).isEqualTo(FetchStrategy.FULL);
	}

	@Test
	@DisplayName("Should fetch only check runs while checks are pending")
	void shouldFetchCheckRunsWhilePending() {
		assertThat(SelectiveFetchPlanner.plan(snapshot(pr(1), pending), pr(1))).isEqualTo(FetchStrategy.CHECK_RUNS_ONLY);
	}

	@Test
	@DisplayName("Should fetch nothing when unchanged and complete")
	void shouldFetchNothingWhenSettled() {
		assertThat(SelectiveFetchPlanner.plan(snapshot(pr(1), complete), pr(1))).isEqualTo(FetchStrategy.NONE);
		assertThat(SelectiveFetchPlanner.plan(snapshot(pr(1), ActivityCache.EMPTY), pr(1)))
			.isEqualTo(FetchStrategy.NONE);
	}

	@Test
	@DisplayName("Should weigh strategies by the number of requests they issue")
	void shouldWeighStrategies() {
		assertThat(FetchStrategy.FULL.weight()).isEqualTo(3);
		assertThat(FetchStrategy.CHECK_RUNS_ONLY.weight()).isEqualTo(1);
		assertThat(FetchStrategy.NONE.weight()).isZero();
	}

}

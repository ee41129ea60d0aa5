package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RepoWatchSet Tests")
class RepoWatchSetTest {

	private final RepoRef widgets = new RepoRef("acme", "widgets");

	private final RepoRef gadgets = new RepoRef("acme", "gadgets");

	private final RepoRef gizmos = new RepoRef("acme", "gizmos");

	@Test
	@DisplayName("Should union configured and discovered repositories without duplicates")
	void shouldUnionWithDiscovery() {
		RepoWatchSet set = new RepoWatchSet(List.of(widgets));

		assertThat(set.currentRepos(List.of(gadgets, widgets))).containsExactly(widgets, gadgets);
	}

	@Test
	@DisplayName("Should ignore adding a repository twice")
	void shouldIgnoreDuplicateAdd() {
		RepoWatchSet set = new RepoWatchSet(List.of(widgets));

		assertThat(set.add(widgets)).isFalse();
		assertThat(set.repos()).containsExactly(widgets);
	}

	@Test
	@DisplayName("Should queue a teardown on removal and drain it once")
	void shouldQueueTeardown() {
		RepoWatchSet set = new RepoWatchSet(List.of(widgets, gadgets));

		assertThat(set.remove(widgets)).isTrue();

		assertThat(set.repos()).containsExactly(gadgets);
		assertThat(set.drainRemovals()).containsExactly(widgets);
		assertThat(set.drainRemovals()).isEmpty();
	}

	@Test
	@DisplayName("Should keep the teardown queued when a repository is re-added")
	void shouldKeepTeardownAfterReAdd() {
		RepoWatchSet set = new RepoWatchSet(List.of(widgets));

		set.remove(widgets);
		set.add(widgets);

		assertThat(set.repos()).containsExactly(widgets);
		assertThat(set.drainRemovals()).containsExactly(widgets);
	}

	@Test
	@DisplayName("Should filter removed repositories out of discovery until re-added")
	void shouldFilterRemovedFromDiscovery() {
		RepoWatchSet set = new RepoWatchSet(List.of());

		set.remove(gizmos);
		assertThat(set.currentRepos(List.of(gizmos, gadgets))).containsExactly(gadgets);

		set.add(gizmos);
		assertThat(set.currentRepos(List.of(gizmos, gadgets))).containsExactly(gizmos, gadgets);
	}

}

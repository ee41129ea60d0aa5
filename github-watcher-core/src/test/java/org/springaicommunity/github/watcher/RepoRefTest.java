package org.springaicommunity.github.watcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RepoRef Tests")
class RepoRefTest {

	@ParameterizedTest
	@ValueSource(strings = { "spring-projects/spring-ai", "Spring-Projects/Spring-AI", "github.com/spring-projects/spring-ai",
			"https://github.com/spring-projects/spring-ai", "http://github.com/spring-projects/spring-ai/",
			"https://www.github.com/spring-projects/spring-ai.git", "https://github.com/spring-projects/spring-ai/pull/42",
			"git@github.com:spring-projects/spring-ai.git", "  spring-projects/spring-ai  " })
	@DisplayName("Should normalize every accepted form to the same reference")
	void shouldNormalizeAcceptedForms(String input) {
		RepoRef ref = RepoRef.parse(input);

		assertThat(ref).isEqualTo(new RepoRef("spring-projects", "spring-ai"));
		assertThat(ref.toString()).isEqualTo("spring-projects/spring-ai");
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "   ", "spring-ai", "a/b/c", "https://gitlab.com/owner/repo", "gitlab.com/owner/repo",
			"https://github.com/owner", "-owner/repo", "owner/..", "owner/re po" })
	@DisplayName("Should reject malformed references")
	void shouldRejectMalformedReferences(String input) {
		assertThatThrownBy(() -> RepoRef.parse(input)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Should treat owner and name case-insensitively")
	void shouldCompareCaseInsensitively() {
		assertThat(new RepoRef("Acme", "Widgets")).isEqualTo(new RepoRef("acme", "widgets"))
			.hasSameHashCodeAs(new RepoRef("acme", "widgets"));
	}

	@Test
	@DisplayName("Should keep dots and underscores in repository names")
	void shouldKeepDotsInNames() {
		assertThat(RepoRef.parse("acme/site.github.io").name()).isEqualTo("site.github.io");
		assertThat(RepoRef.parse("acme/my_repo").name()).isEqualTo("my_repo");
	}

}

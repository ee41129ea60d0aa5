package org.springaicommunity.github.watcher;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Watch engine → RestService, WatchThrottle (NOT HTTP, JSON or Spring)
 *   Models → nothing above them
 *   Wiring (builder, Spring config) → concrete implementations
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.watcher", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Engine Isolation Rules ==========

	@ArchTest
	static final ArchRule engine_should_not_depend_on_transport = noClasses().that()
		.haveSimpleName("PRWatcher")
		.or()
		.haveSimpleName("PRDiffEngine")
		.or()
		.haveSimpleName("SelectiveFetchPlanner")
		.or()
		.haveSimpleName("BranchHeadTracker")
		.or()
		.haveSimpleName("EventBus")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubRestService")
		.orShould()
		.dependOnClassesThat()
		.resideInAPackage("com.fasterxml.jackson..")
		.because("The watch engine talks to GitHub only through the RestService interface");

	@ArchTest
	static final ArchRule engine_should_not_depend_on_spring = noClasses().that()
		.doNotHaveSimpleName("GitHubWatcherConfig")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("Spring is optional; only GitHubWatcherConfig may use it");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule throttles_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("Throttle")
		.and()
		.doNotHaveSimpleName("WatchThrottle")
		.should()
		.implement(WatchThrottle.class)
		.because("All *Throttle classes should implement the WatchThrottle interface");

	@ArchTest
	static final ArchRule rest_services_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("RestService")
		.and()
		.doNotHaveSimpleName("RestService")
		.should()
		.implement(RestService.class)
		.because("All *RestService classes should implement the RestService interface");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Event")
		.or()
		.haveSimpleName("PullRequest")
		.or()
		.haveSimpleName("Author")
		.or()
		.haveSimpleName("Label")
		.or()
		.haveSimpleName("Comment")
		.or()
		.haveSimpleName("Review")
		.or()
		.haveSimpleName("CheckRun")
		.or()
		.haveSimpleName("PRSnapshot")
		.or()
		.haveSimpleName("ActivityCache")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Model classes should be pure data without service dependencies");

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Parser")
		.or()
		.haveSimpleNameEndingWith("Support")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Support classes should not depend on higher-level services");

	// ========== Builder/Configuration Rules ==========

	@ArchTest
	static final ArchRule only_wiring_should_instantiate_concrete_implementations = noClasses().that()
		.haveNameNotMatching(".*\\.(GitHubWatcherBuilder|GitHubWatcherConfig|GitHubRestService|RateLimitThrottle)(\\$.*)?")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubRestService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("RateLimitThrottle")
		.because("Only GitHubWatcherBuilder and GitHubWatcherConfig should create concrete implementations");

}

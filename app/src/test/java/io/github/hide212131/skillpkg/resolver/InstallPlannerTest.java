package io.github.hide212131.skillpkg.resolver;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InstallPlannerTest {

    private final InstallPlanner planner = new InstallPlanner();

    @Test
    void plansDependencyFirstWithNothingInstalled() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("skill-b", "skill-a")
                .skill("skill-a");
        ResolutionResult resolution = new DependencyResolver(fetcher).resolve("skill-b");

        InstallPlan plan = planner.plan(resolution, Set.of());

        assertThat(plan.steps()).extracting(InstallStep::name).containsExactly("skill-a", "skill-b");
        assertThat(plan.steps().get(0).transitive()).isTrue();
        assertThat(plan.steps().get(0).requiredBy()).contains("skill-b");
        assertThat(plan.installCount()).isEqualTo(2);
        assertThat(plan.hasErrors()).isFalse();
    }

    @Test
    void skipsInstalledSkillsInPlace() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("skill-b", "skill-a")
                .skill("skill-a");
        ResolutionResult resolution = new DependencyResolver(fetcher).resolve("skill-b");

        InstallPlan plan = planner.plan(resolution, Set.of("skill-a"));

        assertThat(plan.steps()).extracting(InstallStep::action)
                .containsExactly(InstallAction.SKIP, InstallAction.INSTALL);
        assertThat(plan.steps().get(0).skipReason()).contains(InstallStep.ALREADY_INSTALLED);
        assertThat(plan.stepsToInstall()).extracting(InstallStep::name).containsExactly("skill-b");
    }

    @Test
    void cyclicResolutionYieldsEmptyFailedPlan() {
        ResolutionResult resolution = ResolutionResult.circular(List.of("a", "b", "a"),
                List.of("Circular dependency detected: a → b → a"));

        InstallPlan plan = planner.plan(resolution, Set.of());

        assertThat(plan.steps()).isEmpty();
        assertThat(plan.hasErrors()).isTrue();
        assertThat(planner.format(plan)).isEqualTo("Circular dependency detected: a → b → a");
    }

    @Test
    void softErrorsAreReportedButNotFatal() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher().skill("root", "gone");
        ResolutionResult resolution = new DependencyResolver(fetcher).resolve("root");

        InstallPlan plan = planner.plan(resolution, Set.of());

        assertThat(plan.hasErrors()).isTrue();
        assertThat(plan.stepsToInstall()).extracting(InstallStep::name).containsExactly("root");
    }

    @Test
    void formatsAllSections() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("skill-c", List.of("skill-b", "skill-a", "gone"), List.of("browser"))
                .skill("skill-b")
                .skill("skill-a");
        InstallPlan plan = planner.plan(new DependencyResolver(fetcher).resolve("skill-c"), Set.of("skill-a"));

        String text = planner.format(plan);

        assertThat(text).isEqualTo(String.join("\n",
                "Skills to install:",
                "  + skill-b (required by skill-c)",
                "  + skill-c",
                "Skills already installed:",
                "  = skill-a",
                "External tools required:",
                "  ! browser",
                "Errors:",
                "  - Failed to fetch metadata for: gone"));
        assertThat(plan.toolRequirements()).singleElement()
                .isEqualTo(new ExternalToolRequirement("browser", List.of("skill-c")));
    }
}

package io.github.hide212131.skillpkg.resolver;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DependencyResolverTest {

    @Test
    @DisplayName("依存先が依存元より先に並ぶ")
    void ordersDependenciesBeforeDependents() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("skill-b", "skill-a")
                .skill("skill-a");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("skill-b");

        assertThat(result.dependencies()).extracting(ResolvedDependency::name).containsExactly("skill-a", "skill-b");
        ResolvedDependency a = result.dependencies().get(0);
        assertThat(a.transitive()).isTrue();
        assertThat(a.requiredBy()).contains("skill-b");
        ResolvedDependency b = result.dependencies().get(1);
        assertThat(b.transitive()).isFalse();
        assertThat(b.requiredBy()).isEmpty();
        assertThat(result.errors()).isEmpty();
        assertThat(result.circularChain()).isEmpty();
    }

    @Test
    @DisplayName("ダイヤモンド依存は一度だけ解決される")
    void emitsDiamondOnce() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("top", "left", "right")
                .skill("left", "base")
                .skill("right", "base")
                .skill("base");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("top");

        assertThat(result.dependencies()).extracting(ResolvedDependency::name)
                .containsExactly("base", "left", "right", "top");
        assertThat(result.dependencies().get(0).requiredBy()).contains("left");
        assertThat(fetcher.requests()).containsOnlyOnce("base");
        assertThat(result.edges()).contains(new DependencyEdge("left", "base"), new DependencyEdge("right", "base"));
    }

    @Test
    void reportsTwoNodeCycleAsClosedChain() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("a", "b")
                .skill("b", "a");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("a");

        assertThat(result.circularChain()).contains(List.of("a", "b", "a"));
        assertThat(result.dependencies()).isEmpty();
        assertThat(result.errors()).anyMatch(error -> error.contains("a → b → a"));
    }

    @Test
    void reportsSelfLoop() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher().skill("a", "a");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("a");

        assertThat(result.circularChain()).contains(List.of("a", "a"));
        assertThat(result.dependencies()).isEmpty();
    }

    @Test
    @DisplayName("循環はルートではなく最初に繰り返された名前から報告する")
    void reportsCycleFromFirstRepeatedName() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("root", "x")
                .skill("x", "y")
                .skill("y", "z")
                .skill("z", "x");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("root");

        assertThat(result.circularChain()).contains(List.of("x", "y", "z", "x"));
        assertThat(new DependencyResolver(fetcher).detectCircular("root")).contains(List.of("x", "y", "z", "x"));
    }

    @Test
    @DisplayName("取得できない依存はエラーに記録し、兄弟の解決は続ける")
    void recordsMissingMetadataAndContinues() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("root", "missing", "present")
                .skill("present");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("root");

        assertThat(result.dependencies()).extracting(ResolvedDependency::name).containsExactly("present", "root");
        assertThat(result.errors()).containsExactly("Failed to fetch metadata for: missing");
        assertThat(result.isCircular()).isFalse();
    }

    @Test
    void abortsOnTransportFailure() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("root", "flaky", "other")
                .skill("other")
                .broken("flaky");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("root");

        assertThat(result.dependencies()).isEmpty();
        assertThat(result.errors()).singleElement().asString().contains("connection reset");
    }

    @Test
    @DisplayName("インストール済みのスキルは辿らないが、関係は記録する")
    void prunesInstalledSkillsButKeepsEdges() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("skill-b", "skill-a")
                .skill("skill-a", "deep");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("skill-b", Set.of("skill-a"));

        assertThat(result.dependencies()).extracting(ResolvedDependency::name).containsExactly("skill-b");
        assertThat(result.edges()).containsExactly(new DependencyEdge("skill-b", "skill-a"));
        assertThat(fetcher.requests()).doesNotContain("skill-a", "deep");
    }

    @Test
    void collectsToolsOnceWithEveryRequirer() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("root", List.of("helper"), List.of("browser"))
                .skill("helper", List.of(), List.of("browser", "search"));

        ResolutionResult result = new DependencyResolver(fetcher).resolve("root");

        assertThat(result.toolsToInstall()).containsExactly("browser", "search");
        assertThat(result.toolRequirers().get("browser")).containsExactly("helper", "root");
    }

    @Test
    void normalizesSourcesToNames() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("github:acme/skill-b", "https://example.com/skills/skill-a")
                .skill("https://example.com/skills/skill-a");

        ResolutionResult result = new DependencyResolver(fetcher).resolve("github:acme/skill-b");

        assertThat(result.dependencies()).extracting(ResolvedDependency::name).containsExactly("skill-a", "skill-b");
        assertThat(result.dependencies().get(0).source()).isEqualTo("https://example.com/skills/skill-a");
    }

    @Test
    void buildsTreeWithoutLooping() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("a", "b")
                .skill("b", "a");

        DependencyNode tree = new DependencyResolver(fetcher).buildDependencyTree("a").orElseThrow();

        assertThat(tree.name()).isEqualTo("a");
        assertThat(tree.dependencies()).singleElement().satisfies(child -> {
            assertThat(child.name()).isEqualTo("b");
            assertThat(child.dependencies()).isEmpty();
        });
    }

    @Test
    void directDependenciesDoNotRecurse() {
        InMemorySkillFetcher fetcher = new InMemorySkillFetcher()
                .skill("top", "mid")
                .skill("mid", "leaf")
                .skill("leaf");
        DependencyResolver resolver = new DependencyResolver(fetcher);

        assertThat(resolver.directDependencies("top").skills()).containsExactly("mid");
        assertThat(resolver.directDependencies("github:acme/missing").skills()).isEmpty();
        assertThat(resolver.directDependencies("github:acme/missing").name()).isEqualTo("missing");
        assertThat(fetcher.requests()).doesNotContain("leaf");
    }
}

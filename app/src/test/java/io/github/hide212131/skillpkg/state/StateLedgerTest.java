package io.github.hide212131.skillpkg.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StateLedgerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path project;

    private final StateLedger ledger = new StateLedger(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void loadsEmptyLedgerWhenFileIsAbsent() {
        LedgerSnapshot snapshot = ledger.loadSnapshot(project);

        assertThat(snapshot.ledger().isEmpty()).isTrue();
        assertThat(snapshot.recovered()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{not json",
            "[]",
            "{\"schemaVersion\":\"skillpkg-state-v0\",\"skills\":{}}",
            "{\"skills\":{}}",
            "{\"schemaVersion\":\"skillpkg-state-v1\",\"skills\":{\"a\":{\"version\":\"1\"}}}"
    })
    @DisplayName("壊れた state.json は空の台帳として扱い、recovered を立てる")
    void recoversFromUnusableFile(String content) throws IOException {
        write(content);

        LedgerSnapshot snapshot = ledger.loadSnapshot(project);

        assertThat(snapshot.ledger().skills()).isEmpty();
        assertThat(snapshot.recovered()).isTrue();
        assertThat(ledger.load(project).isEmpty()).isTrue();
    }

    @Test
    void reinstallByDependentKeepsUserInstall() {
        ledger.recordSkillInstall(project, "skill-a", "1.0.0", "./skills/skill-a", InstalledBy.user());
        ledger.recordSkillInstall(project, "skill-b", "1.0.0", "./skills/skill-b", InstalledBy.skill("skill-c"));

        ledger.recordSkillInstall(project, "skill-a", "1.1.0", "./skills/skill-a", InstalledBy.skill("skill-c"));
        ledger.recordSkillInstall(project, "skill-b", "1.1.0", "./skills/skill-b", InstalledBy.user());

        assertThat(ledger.load(project).skill("skill-a").orElseThrow().installedBy()).isEqualTo(InstalledBy.user());
        assertThat(ledger.load(project).skill("skill-a").orElseThrow().version()).isEqualTo("1.1.0");
        assertThat(ledger.load(project).skill("skill-b").orElseThrow().installedBy()).isEqualTo(InstalledBy.user());
    }

    @Test
    @DisplayName("状態ディレクトリを指定すると state.json もストアと同じ場所に置く")
    void customStateDirectoryHoldsLedger() {
        StateLedger custom = new StateLedger(".custom-store", Clock.fixed(NOW, ZoneOffset.UTC));

        custom.recordSkillInstall(project, "skill-a", "1.0.0", "./skills/skill-a", InstalledBy.user());

        assertThat(custom.ledgerPath(project)).isEqualTo(project.resolve(".custom-store").resolve("state.json"));
        assertThat(project.resolve(".custom-store/state.json")).exists();
        assertThat(StateLedger.statePath(project)).doesNotExist();
        assertThat(custom.installedSkillNames(project)).containsExactly("skill-a");
        assertThat(ledger.installedSkillNames(project)).isEmpty();
    }

    @Test
    void writesExpectedDocumentShape() throws IOException {
        ledger.recordSkillInstall(project, "skill-a", "1.0.0", "./skills/skill-a", InstalledBy.skill("skill-b"));
        ledger.recordSkillInstall(project, "skill-b", "2.0.0", "./skills/skill-b", InstalledBy.user());
        ledger.addDependency(project, "skill-b", "skill-a");
        ledger.recordToolInstall(project, "browser", "@acme/browser", Optional.of("skill-b"));

        String json = Files.readString(StateLedger.statePath(project), StandardCharsets.UTF_8);

        assertThat(json).contains("\"schemaVersion\" : \"skillpkg-state-v1\"")
                .contains("\"installedBy\" : \"skill-b\"")
                .contains("\"installedBy\" : \"user\"")
                .contains("\"installedAt\" : \"2024-05-01T10:00:00Z\"")
                .contains("\"packageIdentifier\" : \"@acme/browser\"")
                .contains("\"installedBySkill\" : \"skill-b\"");
        assertThat(json.indexOf("\"skills\"")).isLessThan(json.indexOf("\"tools\""));
        assertThat(json.indexOf("\"tools\"")).isLessThan(json.indexOf("\"syncHistory\""));
        assertThat(Files.exists(StateLedger.statePath(project).resolveSibling("state.json.tmp"))).isFalse();
    }

    @Test
    @DisplayName("load と save を繰り返してもバイト列が変わらない")
    void saveOfLoadIsByteStable() throws IOException {
        ledger.recordSkillInstall(project, "skill-a", "1.0.0", "./a", InstalledBy.user());
        ledger.recordSkillInstall(project, "skill-b", "1.0.0", "./b", InstalledBy.user());
        ledger.addDependency(project, "skill-b", "skill-a");
        ledger.recordSync(project, "claude-code");

        ledger.save(project, ledger.load(project));
        byte[] first = Files.readAllBytes(StateLedger.statePath(project));
        ledger.save(project, ledger.load(project));
        byte[] second = Files.readAllBytes(StateLedger.statePath(project));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void addDependencyIsIdempotentAndOrdered() {
        installUser("base");
        installUser("x");
        installUser("y");

        ledger.addDependency(project, "y", "base");
        ledger.addDependency(project, "x", "base");
        ledger.addDependency(project, "y", "base");

        assertThat(ledger.getDependents(project, "base")).containsExactly("y", "x");
        assertThat(ledger.getDependencies(project, "x")).containsExactly("base");
    }

    @Test
    void addDependencyRejectsUnknownTarget() {
        installUser("x");

        assertThatThrownBy(() -> ledger.addDependency(project, "x", "nope"))
                .isInstanceOf(DependencyNotFoundException.class)
                .hasMessage("Dependency skill not found: nope");
    }

    @Test
    void removeDependencyIsNoOpWhenAbsent() {
        installUser("base");
        installUser("x");
        ledger.addDependency(project, "x", "base");

        ledger.removeDependency(project, "x", "base");
        ledger.removeDependency(project, "x", "base");
        ledger.removeDependency(project, "x", "missing");

        assertThat(ledger.getDependents(project, "base")).isEmpty();
    }

    @Test
    void canUninstallReportsDependents() {
        installUser("skill-b");
        ledger.recordSkillInstall(project, "skill-a", "1.0.0", "./a", InstalledBy.skill("skill-b"));
        ledger.addDependency(project, "skill-b", "skill-a");

        UninstallCheck blocked = ledger.canUninstall(project, "skill-a");
        UninstallCheck free = ledger.canUninstall(project, "skill-b");

        assertThat(blocked.ok()).isFalse();
        assertThat(blocked.dependents()).containsExactly("skill-b");
        assertThat(free.ok()).isTrue();
        assertThat(free.dependents()).isEmpty();
    }

    @Test
    @DisplayName("アンインストールすると他エントリの dependedBy からも消える")
    void uninstallPrunesReferences() {
        installUser("base");
        installUser("x");
        installUser("y");
        ledger.addDependency(project, "x", "base");
        ledger.addDependency(project, "y", "base");

        ledger.recordSkillUninstall(project, "x");

        assertThat(ledger.isSkillInstalled(project, "x")).isFalse();
        Ledger state = ledger.load(project);
        assertThat(state.skills().values()).allSatisfy(entry -> assertThat(entry.dependedBy()).doesNotContain("x"));
        assertThat(ledger.getDependents(project, "base")).containsExactly("y");
    }

    @Test
    void reinstallKeepsDependents() {
        installUser("base");
        installUser("x");
        ledger.addDependency(project, "x", "base");

        ledger.recordSkillInstall(project, "base", "2.0.0", "./base", InstalledBy.user());

        assertThat(ledger.load(project).skill("base")).get()
                .satisfies(entry -> {
                    assertThat(entry.version()).isEqualTo("2.0.0");
                    assertThat(entry.dependedBy()).containsExactly("x");
                });
    }

    @Test
    @DisplayName("孤立依存は直接のインストール元だけを確認する")
    void orphanDependenciesCheckOnlyTheImmediateInstaller() {
        installUser("top");
        ledger.recordSkillInstall(project, "mid", "1.0.0", "./mid", InstalledBy.skill("top"));
        ledger.recordSkillInstall(project, "leaf", "1.0.0", "./leaf", InstalledBy.skill("mid"));
        ledger.addDependency(project, "top", "mid");
        ledger.addDependency(project, "mid", "leaf");

        assertThat(ledger.getOrphanDependencies(project)).isEmpty();

        ledger.recordSkillUninstall(project, "top");
        assertThat(ledger.getOrphanDependencies(project)).containsExactly("mid");

        ledger.recordSkillUninstall(project, "mid");
        assertThat(ledger.getOrphanDependencies(project)).containsExactly("leaf");
    }

    @Test
    void cleansLedgerEntriesWithoutDiskAndTheirReferences() {
        installUser("base");
        installUser("x");
        installUser("gone");
        ledger.addDependency(project, "gone", "base");
        ledger.addDependency(project, "x", "base");

        assertThat(ledger.getOrphanLedgerEntries(project, List.of("base", "x"))).containsExactly("gone");
        List<String> removed = ledger.cleanOrphanLedgerEntries(project, List.of("base", "x"));

        assertThat(removed).containsExactly("gone");
        assertThat(ledger.installedSkillNames(project)).containsExactly("base", "x");
        assertThat(ledger.getDependents(project, "base")).containsExactly("x");
    }

    @Test
    void cleansDanglingReferences() throws IOException {
        write("""
                {
                  "schemaVersion" : "skillpkg-state-v1",
                  "skills" : {
                    "base" : {
                      "version" : "1.0.0",
                      "source" : "./base",
                      "installedBy" : "user",
                      "installedAt" : "2024-01-01T00:00:00Z",
                      "dependedBy" : [ "ghost", "x", "phantom" ]
                    },
                    "x" : {
                      "version" : "1.0.0",
                      "source" : "./x",
                      "installedBy" : "user",
                      "installedAt" : "2024-01-01T00:00:00Z",
                      "dependedBy" : [ ]
                    }
                  },
                  "tools" : { },
                  "syncHistory" : { }
                }
                """);

        assertThat(ledger.cleanDanglingReferences(project)).isEqualTo(2);
        assertThat(ledger.getDependents(project, "base")).containsExactly("x");
        assertThat(ledger.cleanDanglingReferences(project)).isZero();
    }

    @Test
    void updatesVersionOnlyForKnownSkills() {
        installUser("base");

        assertThat(ledger.updateSkillVersion(project, "base", "1.2.0")).isTrue();
        assertThat(ledger.updateSkillVersion(project, "missing", "1.2.0")).isFalse();
        assertThat(ledger.load(project).skill("base")).get().extracting(SkillLedgerEntry::version).isEqualTo("1.2.0");
    }

    @Test
    void tracksToolsAndSyncHistory() {
        ledger.recordToolInstall(project, "browser", "@acme/browser", Optional.empty());
        ledger.recordSync(project, "claude-code");

        assertThat(ledger.load(project).tool("browser")).get()
                .extracting(ToolLedgerEntry::installedBySkill).isEqualTo(Optional.empty());
        assertThat(ledger.lastSync(project, "claude-code")).contains(NOW);
        assertThat(ledger.lastSync(project, "cursor")).isEmpty();
        assertThat(ledger.recordToolUninstall(project, "browser")).isTrue();
        assertThat(ledger.recordToolUninstall(project, "browser")).isFalse();
    }

    @Test
    void installChainFollowsInstallersToTheUser() {
        installUser("top");
        ledger.recordSkillInstall(project, "mid", "1.0.0", "./mid", InstalledBy.skill("top"));
        ledger.recordSkillInstall(project, "leaf", "1.0.0", "./leaf", InstalledBy.skill("mid"));

        assertThat(ledger.installChain(project, "leaf")).containsExactly("leaf", "mid", "top");
        assertThat(ledger.installChain(project, "unknown")).isEmpty();
    }

    @Test
    void installedByRoundTripsThroughItsToken() {
        assertThat(InstalledBy.parse("user")).isEqualTo(InstalledBy.user());
        assertThat(InstalledBy.parse("skill-b")).isEqualTo(InstalledBy.skill("skill-b"));
        assertThat(InstalledBy.skill("skill-b").skillName()).contains("skill-b");
        assertThatThrownBy(() -> InstalledBy.skill("user")).isInstanceOf(IllegalArgumentException.class);
    }

    private void installUser(String name) {
        ledger.recordSkillInstall(project, name, "1.0.0", "./" + name, InstalledBy.user());
    }

    private void write(String content) throws IOException {
        Path path = StateLedger.statePath(project);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}

package io.github.hide212131.skillpkg.store;

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

class LocalSkillStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path project;

    @TempDir
    Path sources;

    private final LocalSkillStore store = new LocalSkillStore(LocalSkillStore.DEFAULT_STORE_DIR,
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("スキルをコピーしてレジストリに登録する")
    void addSkillCopiesFilesAndRegisters() throws IOException {
        Path content = skillSource("skill-a");
        Files.createDirectories(content.resolve("scripts"));
        Files.writeString(content.resolve("scripts/run.sh"), "echo hi", StandardCharsets.UTF_8);

        store.addSkill(project, "skill-a", content, "1.0.0", RegistrySource.LOCAL, Optional.of("./skill-a"));

        Path installed = project.resolve(".skillpkg/skills/skill-a");
        assertThat(installed.resolve("SKILL.md")).exists();
        assertThat(installed.resolve("scripts/run.sh")).hasContent("echo hi");
        assertThat(store.listSkillNames(project)).containsExactly("skill-a");
        RegistryEntry entry = store.getRegistry(project).entry("skill-a").orElseThrow();
        assertThat(entry.version()).isEqualTo("1.0.0");
        assertThat(entry.source()).isEqualTo(RegistrySource.LOCAL);
        assertThat(entry.sourceUrl()).contains("./skill-a");
        assertThat(entry.installedAt()).isEqualTo(NOW);
    }

    @Test
    void replacesExistingSkillContent() throws IOException {
        Path content = skillSource("skill-a");
        Files.writeString(content.resolve("old.txt"), "old", StandardCharsets.UTF_8);
        store.addSkill(project, "skill-a", content, "1.0.0", RegistrySource.LOCAL, Optional.empty());
        Files.delete(content.resolve("old.txt"));

        store.addSkill(project, "skill-a", content, "1.1.0", RegistrySource.LOCAL, Optional.empty());

        assertThat(project.resolve(".skillpkg/skills/skill-a/old.txt")).doesNotExist();
        assertThat(store.getRegistry(project).entry("skill-a")).get()
                .extracting(RegistryEntry::version).isEqualTo("1.1.0");
    }

    @Test
    void removeSkillDeletesDirectoryAndEntry() throws IOException {
        store.addSkill(project, "skill-a", skillSource("skill-a"), "1.0.0", RegistrySource.LOCAL, Optional.empty());

        assertThat(store.removeSkill(project, "skill-a")).isTrue();
        assertThat(store.removeSkill(project, "skill-a")).isFalse();

        assertThat(store.hasSkill(project, "skill-a")).isFalse();
        assertThat(store.getRegistry(project).skills()).isEmpty();
    }

    @Test
    @DisplayName("ディレクトリの無いレジストリエントリだけを掃除する")
    void cleanOrphansRemovesEntriesWithoutDirectories() throws IOException {
        store.addSkill(project, "kept", skillSource("kept"), "1.0.0", RegistrySource.LOCAL, Optional.empty());
        store.registerSkill(project, RegistryEntry.of("ghost", "1.0.0", NOW, RegistrySource.IMPORT, Optional.empty()));

        assertThat(store.cleanOrphans(project)).containsExactly("ghost");
        assertThat(store.cleanOrphans(project)).isEmpty();
        assertThat(store.getRegistry(project).skills()).containsOnlyKeys("kept");
    }

    @Test
    void corruptRegistryReadsAsEmpty() throws IOException {
        Path registry = project.resolve(".skillpkg/registry.json");
        Files.createDirectories(registry.getParent());
        Files.writeString(registry, "{broken", StandardCharsets.UTF_8);

        assertThat(store.getRegistry(project).skills()).isEmpty();
    }

    @Test
    void registryRoundTripsSyncMetadata() {
        RegistryEntry entry = new RegistryEntry("skill-a", "1.0.0", NOW, RegistrySource.REGISTRY,
                Optional.of("github:acme/skill-a"), List.of("claude-code"), Optional.of(NOW));
        store.registerSkill(project, entry);

        RegistryEntry loaded = store.getRegistry(project).entry("skill-a").orElseThrow();

        assertThat(loaded).isEqualTo(entry);
        assertThat(loaded.isSynced()).isTrue();
    }

    @Test
    void rejectsNamesEscapingTheStore() {
        assertThatThrownBy(() -> store.skillPath(project, "../outside"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Path skillSource(String name) throws IOException {
        Path dir = sources.resolve(name);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("SKILL.md"), "---\nname: " + name + "\n---\nbody\n", StandardCharsets.UTF_8);
        return dir;
    }
}

package io.github.hide212131.skillpkg.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonManifestStoreTest {

    @TempDir
    Path project;

    private final JsonManifestStore store = new JsonManifestStore();

    @Test
    void absentManifestIsEmptyAndNotCreatedImplicitly() {
        assertThat(store.loadManifest(project)).isEmpty();
        assertThat(store.addSkillToManifest(project, "skill-a", "./skill-a")).isFalse();
        assertThat(JsonManifestStore.manifestPath(project)).doesNotExist();
    }

    @Test
    @DisplayName("未知のフィールドを保持したままスキルを追加・削除する")
    void preservesUnknownFieldsOnRewrite() throws IOException {
        Files.writeString(JsonManifestStore.manifestPath(project), """
                {"name": "demo", "hooks": {"postinstall": "echo ok"}, "skills": {"skill-b": "./b"}}
                """, StandardCharsets.UTF_8);

        assertThat(store.addSkillToManifest(project, "skill-a", "./a")).isTrue();
        assertThat(store.removeSkillFromManifest(project, "skill-b")).isTrue();
        assertThat(store.removeSkillFromManifest(project, "skill-b")).isFalse();

        ProjectManifest manifest = store.loadManifest(project).orElseThrow();
        assertThat(manifest.name()).isEqualTo("demo");
        assertThat(manifest.skills()).containsExactly(Map.entry("skill-a", "./a"));
        assertThat(Files.readString(JsonManifestStore.manifestPath(project))).contains("postinstall");
    }

    @Test
    void malformedManifestRaisesManifestException() throws IOException {
        Files.writeString(JsonManifestStore.manifestPath(project), "{oops", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store.loadManifest(project))
                .isInstanceOf(ManifestException.class)
                .hasMessageContaining("skillpkg.json");
    }

    @Test
    void initCreatesEmptyManifestOnce() {
        ProjectManifest created = store.initManifest(project, "demo");
        store.addSkillToManifest(project, "skill-a", "./a");

        ProjectManifest again = store.initManifest(project, "other");

        assertThat(created.skills()).isEmpty();
        assertThat(again.name()).isEqualTo("demo");
        assertThat(again.declares("skill-a")).isTrue();
    }
}

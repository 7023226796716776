package io.github.hide212131.skillpkg.config;

import java.nio.file.Path;
import java.util.Optional;

/** ユーザーが宣言したスキル一覧（マニフェスト）へのアクセス。 */
public interface ManifestStore {

    /** マニフェストが無い場合は空。 */
    Optional<ProjectManifest> loadManifest(Path project);

    /** マニフェストが無い場合は何もせず false を返す。 */
    boolean addSkillToManifest(Path project, String name, String source);

    boolean removeSkillFromManifest(Path project, String name);

    ProjectManifest initManifest(Path project, String name);
}

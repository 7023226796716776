package io.github.hide212131.skillpkg.store;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * プロジェクト内の物理スキル置き場とそのレジストリ。
 * <p>
 * ディレクトリの有無が「物理的に存在するスキル」の正とし、レジストリはその付随メタデータとして扱う。
 */
public interface SkillStore {

    /** スキルディレクトリ名の一覧（名前順）。 */
    List<String> listSkillNames(Path project);

    boolean hasSkill(Path project, String name);

    Path skillPath(Path project, String name);

    Registry getRegistry(Path project);

    void saveRegistry(Path project, Registry registry);

    /** {@code contentDir} をストアにコピーし、レジストリに登録する。既存の同名スキルは置き換える。 */
    void addSkill(Path project, String name, Path contentDir, String version, RegistrySource source,
            Optional<String> sourceUrl);

    void registerSkill(Path project, RegistryEntry entry);

    /** ディレクトリとレジストリエントリを削除する。何か削除した場合 true。 */
    boolean removeSkill(Path project, String name);

    boolean removeRegistryEntry(Path project, String name);

    /** ディレクトリの無いレジストリエントリを一括削除し、削除した名前を返す。 */
    List<String> cleanOrphans(Path project);
}

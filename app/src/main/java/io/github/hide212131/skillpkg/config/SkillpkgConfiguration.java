package io.github.hide212131.skillpkg.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 実行時設定。
 *
 * @param storeDir    プロジェクト直下のスキルストアディレクトリ名
 * @param skillsBase  相対パスで指定されたスキル取得元を解決する基準ディレクトリ
 */
public record SkillpkgConfiguration(String storeDir, Path skillsBase) {

    public static final String DEFAULT_STORE_DIR = ".skillpkg";

    public SkillpkgConfiguration {
        Objects.requireNonNull(storeDir, "storeDir");
        Objects.requireNonNull(skillsBase, "skillsBase");
        if (storeDir.isBlank()) {
            throw new IllegalArgumentException("storeDir が空です");
        }
    }
}

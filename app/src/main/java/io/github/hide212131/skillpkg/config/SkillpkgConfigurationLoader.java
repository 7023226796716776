package io.github.hide212131.skillpkg.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックして skillpkg の設定を解決する。
 */
public final class SkillpkgConfigurationLoader {

    static final String ENV_STORE_DIR = "SKILLPKG_STORE_DIR";
    static final String ENV_SKILLS_BASE = "SKILLPKG_SKILLS_BASE";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public SkillpkgConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    SkillpkgConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public SkillpkgConfiguration load(Path workingDirectory) {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        String storeDir = trimToNull(resolveWithPriority(ENV_STORE_DIR));
        String skillsBase = trimToNull(resolveWithPriority(ENV_SKILLS_BASE));
        Path base = skillsBase == null ? workingDirectory : workingDirectory.resolve(skillsBase);
        return new SkillpkgConfiguration(storeDir == null ? SkillpkgConfiguration.DEFAULT_STORE_DIR : storeDir,
                base.toAbsolutePath().normalize());
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

package io.github.hide212131.skillpkg.installer;

import io.github.hide212131.skillpkg.resolver.SkillFetchException;
import io.github.hide212131.skillpkg.resolver.SkillMetadata;
import io.github.hide212131.skillpkg.store.RegistrySource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * ローカルディレクトリをスキル取得元として扱うフェッチャ。
 * <p>
 * 取得元はディレクトリパス（絶対パス、または基準ディレクトリからの相対パス）で、直下に SKILL.md が必要。
 * frontmatter の {@code name}・{@code version}・{@code dependencies} を読み取る。
 */
public final class LocalSkillFetcher implements SkillContentFetcher {

    static final String SKILL_FILE_NAME = "SKILL.md";
    static final String DEFAULT_VERSION = "0.0.0";
    private static final String FILE_PREFIX = "file:";

    private final Path baseDir;

    public LocalSkillFetcher(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
    }

    @Override
    public Optional<SkillMetadata> fetchMetadata(String source) {
        return locate(source).map(this::parse);
    }

    @Override
    public Optional<FetchedSkill> fetchSkill(String source) {
        return locate(source).map(dir -> new FetchedSkill(parse(dir), dir, RegistrySource.LOCAL));
    }

    Optional<Path> locate(String source) {
        Objects.requireNonNull(source, "source");
        String location = source.startsWith(FILE_PREFIX) ? source.substring(FILE_PREFIX.length()) : source;
        Path dir;
        try {
            Path raw = Path.of(location);
            dir = (raw.isAbsolute() ? raw : baseDir.resolve(raw)).normalize();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(dir.resolve(SKILL_FILE_NAME))) {
            return Optional.empty();
        }
        return Optional.of(dir);
    }

    private SkillMetadata parse(Path dir) {
        Path skillMd = dir.resolve(SKILL_FILE_NAME);
        String content;
        try {
            content = Files.readString(skillMd, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SkillFetchException("SKILL.md を読み取れませんでした: " + skillMd, e);
        }
        Map<String, Object> frontMatter = frontMatter(skillMd, content);
        String name = text(frontMatter.get("name")).orElse(dir.getFileName().toString());
        String version = text(frontMatter.get("version")).orElse(DEFAULT_VERSION);

        List<String> skills = new ArrayList<>();
        List<String> tools = new ArrayList<>();
        Object dependencies = frontMatter.get("dependencies");
        if (dependencies instanceof Map<?, ?> map) {
            if (map.containsKey("skills") || map.containsKey("software-skills") || map.containsKey("mcp")) {
                skills.addAll(strings(map.get("skills")));
                skills.addAll(strings(map.get("software-skills")));
                tools.addAll(toolNames(map.get("mcp")));
            } else {
                // name -> version
                map.keySet().forEach(key -> skills.add(String.valueOf(key)));
            }
        } else if (dependencies != null) {
            throw new SkillFetchException("SKILL.md の dependencies がマップではありません: " + skillMd);
        }
        return new SkillMetadata(name, version, skills, tools);
    }

    private Map<String, Object> frontMatter(Path skillMd, String content) {
        if (!content.startsWith("---")) {
            return Map.of();
        }
        int end = content.indexOf("\n---", 3);
        if (end < 0) {
            throw new SkillFetchException("SKILL.md の frontmatter 終端（---）が見つかりません: " + skillMd);
        }
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object loaded;
        try {
            loaded = yaml.load(content.substring(3, end));
        } catch (RuntimeException e) {
            throw new SkillFetchException("SKILL.md の frontmatter を YAML として解釈できません: " + skillMd, e);
        }
        if (loaded == null) {
            return Map.of();
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new SkillFetchException("SKILL.md の frontmatter がマップではありません: " + skillMd);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) loaded;
        return map;
    }

    private static Optional<String> text(Object value) {
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString().trim());
    }

    private static List<String> strings(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                text(item).ifPresent(values::add);
            }
        } else {
            text(value).ifPresent(values::add);
        }
        return values;
    }

    private static List<String> toolNames(Object value) {
        List<String> names = new ArrayList<>();
        if (!(value instanceof List<?> list)) {
            return strings(value);
        }
        for (Object item : list) {
            if (item instanceof Map<?, ?> tool) {
                text(tool.get("name")).or(() -> text(tool.get("package"))).ifPresent(names::add);
            } else {
                text(item).ifPresent(names::add);
            }
        }
        return names;
    }
}

package io.github.hide212131.skillpkg.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code <project>/<storeDir>/skills/<name>/} にスキルを置き、{@code <storeDir>/registry.json} でメタデータを管理する
 * ファイルシステム実装。
 */
public final class LocalSkillStore implements SkillStore {

    public static final String DEFAULT_STORE_DIR = ".skillpkg";
    static final String SKILLS_DIR = "skills";
    static final String REGISTRY_FILE = "registry.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalSkillStore.class);

    private final String storeDir;
    private final Clock clock;

    public LocalSkillStore() {
        this(DEFAULT_STORE_DIR, Clock.systemUTC());
    }

    public LocalSkillStore(String storeDir, Clock clock) {
        this.storeDir = Objects.requireNonNull(storeDir, "storeDir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    Path skillsRoot(Path project) {
        return project.resolve(storeDir).resolve(SKILLS_DIR);
    }

    Path registryPath(Path project) {
        return project.resolve(storeDir).resolve(REGISTRY_FILE);
    }

    @Override
    public List<String> listSkillNames(Path project) {
        Path root = skillsRoot(project);
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            return children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("スキルディレクトリを読み取れませんでした: " + root, e);
        }
    }

    @Override
    public boolean hasSkill(Path project, String name) {
        return Files.isDirectory(skillPath(project, name));
    }

    @Override
    public Path skillPath(Path project, String name) {
        Path root = skillsRoot(project).toAbsolutePath().normalize();
        Path resolved = root.resolve(name).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("スキル名が不正です: " + name);
        }
        return resolved;
    }

    @Override
    public Registry getRegistry(Path project) {
        Path path = registryPath(project);
        if (!Files.exists(path)) {
            return Registry.empty(clock.instant());
        }
        try {
            return RegistryCodec.decode(Files.readString(path, StandardCharsets.UTF_8), clock.instant());
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("registry.json を読み取れないため空として扱います: {} ({})", path, e.getMessage());
            return Registry.empty(clock.instant());
        }
    }

    @Override
    public void saveRegistry(Path project, Registry registry) {
        Objects.requireNonNull(registry, "registry");
        Path path = registryPath(project);
        Path temp = path.resolveSibling(REGISTRY_FILE + ".tmp");
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(temp, RegistryCodec.encode(registry), StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("registry.json の書き込みに失敗しました: " + path, e);
        }
    }

    @Override
    public void addSkill(Path project, String name, Path contentDir, String version, RegistrySource source,
            Optional<String> sourceUrl) {
        Objects.requireNonNull(contentDir, "contentDir");
        Path target = skillPath(project, name);
        if (Files.exists(target)) {
            deleteRecursively(target);
        }
        try {
            int copied = copyDirectoryRecursively(contentDir, target);
            LOGGER.debug("{} を {} にコピーしました ({} files)", contentDir, target, copied);
        } catch (IOException e) {
            throw new IllegalStateException("スキルのコピーに失敗しました: " + contentDir, e);
        }
        registerSkill(project, RegistryEntry.of(name, version, clock.instant(), source, sourceUrl));
    }

    @Override
    public void registerSkill(Path project, RegistryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        saveRegistry(project, getRegistry(project).with(entry, clock.instant()));
    }

    @Override
    public boolean removeSkill(Path project, String name) {
        boolean removed = false;
        Path target = skillPath(project, name);
        if (Files.exists(target)) {
            deleteRecursively(target);
            removed = true;
        }
        return removeRegistryEntry(project, name) || removed;
    }

    @Override
    public boolean removeRegistryEntry(Path project, String name) {
        Registry registry = getRegistry(project);
        if (!registry.contains(name)) {
            return false;
        }
        saveRegistry(project, registry.without(name, clock.instant()));
        return true;
    }

    @Override
    public List<String> cleanOrphans(Path project) {
        Registry registry = getRegistry(project);
        List<String> onDisk = listSkillNames(project);
        List<String> removed = new ArrayList<>();
        Registry updated = registry;
        for (String name : registry.skills().keySet()) {
            if (!onDisk.contains(name)) {
                updated = updated.without(name, clock.instant());
                removed.add(name);
            }
        }
        if (!removed.isEmpty()) {
            saveRegistry(project, updated);
            LOGGER.info("ディレクトリの無いレジストリエントリを削除しました: {}", removed);
        }
        return removed;
    }

    private static int copyDirectoryRecursively(Path source, Path destination) throws IOException {
        if (!Files.isDirectory(source)) {
            throw new IllegalArgumentException("コピー元がディレクトリではありません: " + source);
        }
        final int[] fileCount = { 0 };
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(destination.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, destination.resolve(source.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING);
                fileCount[0]++;
                return FileVisitResult.CONTINUE;
            }
        });
        return fileCount[0];
    }

    private static void deleteRecursively(Path target) {
        try {
            Files.walkFileTree(target, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new IllegalStateException("スキルディレクトリの削除に失敗しました: " + target, e);
        }
    }
}

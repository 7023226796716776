package io.github.hide212131.skillpkg.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@code <project>/skillpkg.json} を読み書きする。書き戻し時は未知のフィールドをそのまま残す。
 */
public final class JsonManifestStore implements ManifestStore {

    public static final String MANIFEST_FILE = "skillpkg.json";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static Path manifestPath(Path project) {
        return project.resolve(MANIFEST_FILE);
    }

    @Override
    public Optional<ProjectManifest> loadManifest(Path project) {
        return readTree(project).map(root -> toManifest(project, root));
    }

    @Override
    public boolean addSkillToManifest(Path project, String name, String source) {
        Optional<ObjectNode> tree = readTree(project);
        if (tree.isEmpty()) {
            return false;
        }
        ObjectNode root = tree.get();
        ObjectNode skills = skillsNode(project, root);
        if (source.equals(skills.path(name).asText(null))) {
            return false;
        }
        skills.put(name, source);
        write(project, root);
        return true;
    }

    @Override
    public boolean removeSkillFromManifest(Path project, String name) {
        Optional<ObjectNode> tree = readTree(project);
        if (tree.isEmpty()) {
            return false;
        }
        ObjectNode root = tree.get();
        ObjectNode skills = skillsNode(project, root);
        if (skills.remove(name) == null) {
            return false;
        }
        write(project, root);
        return true;
    }

    @Override
    public ProjectManifest initManifest(Path project, String name) {
        Optional<ProjectManifest> existing = loadManifest(project);
        if (existing.isPresent()) {
            return existing.get();
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", name);
        root.put("version", "1.0.0");
        root.putObject("skills");
        write(project, root);
        return toManifest(project, root);
    }

    private Optional<ObjectNode> readTree(Path project) {
        Path path = manifestPath(project);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new ManifestException("skillpkg.json を JSON として解釈できません: " + path, e);
        } catch (IOException e) {
            throw new ManifestException("skillpkg.json を読み取れませんでした: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestException("skillpkg.json のルートがオブジェクトではありません: " + path);
        }
        return Optional.of((ObjectNode) root);
    }

    private ProjectManifest toManifest(Path project, ObjectNode root) {
        Map<String, String> skills = new LinkedHashMap<>();
        JsonNode skillsNode = root.path("skills");
        if (skillsNode.isObject()) {
            for (Iterator<Map.Entry<String, JsonNode>> it = skillsNode.fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> field = it.next();
                skills.put(field.getKey(), field.getValue().asText());
            }
        } else if (!skillsNode.isMissingNode() && !skillsNode.isNull()) {
            throw new ManifestException("skillpkg.json の skills がオブジェクトではありません: "
                    + manifestPath(project));
        }
        String name = root.path("name").asText(project.toAbsolutePath().normalize().getFileName().toString());
        JsonNode version = root.get("version");
        return new ProjectManifest(name,
                version == null || version.isNull() ? Optional.empty() : Optional.of(version.asText()), skills);
    }

    private ObjectNode skillsNode(Path project, ObjectNode root) {
        JsonNode skills = root.get("skills");
        if (skills == null || skills.isNull()) {
            return root.putObject("skills");
        }
        if (!skills.isObject()) {
            throw new ManifestException("skillpkg.json の skills がオブジェクトではありません: "
                    + manifestPath(project));
        }
        return (ObjectNode) skills;
    }

    private void write(Path project, ObjectNode root) {
        Path path = manifestPath(project);
        try {
            Files.writeString(path, MAPPER.writeValueAsString(root) + System.lineSeparator(),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestException("skillpkg.json の書き込みに失敗しました: " + path, e);
        }
    }
}

package io.github.hide212131.skillpkg.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** registry.json と {@link Registry} の相互変換。 */
final class RegistryCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private RegistryCodec() {
    }

    static String encode(Registry registry) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", registry.version());
        ObjectNode skills = root.putObject("skills");
        registry.skills().forEach((name, entry) -> {
            ObjectNode node = skills.putObject(name);
            node.put("name", entry.name());
            node.put("version", entry.version());
            node.put("installedAt", entry.installedAt().toString());
            node.put("source", entry.source().value());
            entry.sourceUrl().ifPresent(url -> node.put("sourceUrl", url));
            ArrayNode platforms = node.putArray("syncedPlatforms");
            entry.syncedPlatforms().forEach(platforms::add);
            entry.lastSynced().ifPresent(at -> node.put("lastSynced", at.toString()));
        });
        root.put("lastUpdated", registry.lastUpdated().toString());
        try {
            return MAPPER.writeValueAsString(root) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("registry.json の生成に失敗しました", e);
        }
    }

    /**
     * @throws IllegalArgumentException JSON として解釈できない、または形式が不正な場合
     */
    static Registry decode(String json, Instant fallbackTime) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("registry.json を JSON として解釈できません", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("registry.json のルートがオブジェクトではありません");
        }
        Map<String, RegistryEntry> skills = new LinkedHashMap<>();
        JsonNode skillsNode = root.path("skills");
        if (skillsNode.isObject()) {
            for (Iterator<Map.Entry<String, JsonNode>> it = skillsNode.fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> field = it.next();
                skills.put(field.getKey(), decodeEntry(field.getKey(), field.getValue(), fallbackTime));
            }
        } else if (!skillsNode.isMissingNode() && !skillsNode.isNull()) {
            throw new IllegalArgumentException("registry.json の skills がオブジェクトではありません");
        }
        String version = root.path("version").asText(Registry.FORMAT_VERSION);
        Instant lastUpdated = optionalInstant(root.get("lastUpdated")).orElse(fallbackTime);
        return new Registry(version, skills, lastUpdated);
    }

    private static RegistryEntry decodeEntry(String key, JsonNode node, Instant fallbackTime) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("registry.json のエントリが不正です: " + key);
        }
        List<String> platforms = new ArrayList<>();
        node.path("syncedPlatforms").forEach(item -> platforms.add(item.asText()));
        JsonNode url = node.get("sourceUrl");
        return new RegistryEntry(
                node.path("name").asText(key),
                node.path("version").asText("0.0.0"),
                optionalInstant(node.get("installedAt")).orElse(fallbackTime),
                RegistrySource.from(node.path("source").asText(null)),
                url == null || url.isNull() ? Optional.empty() : Optional.of(url.asText()),
                platforms,
                optionalInstant(node.get("lastSynced")));
    }

    private static Optional<Instant> optionalInstant(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(Instant.parse(node.asText()));
    }
}

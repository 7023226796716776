package io.github.hide212131.skillpkg.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps {@link Ledger} to and from the {@code state.json} document. Built on the tree model so that field
 * order in the output is fixed.
 */
final class LedgerCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private LedgerCodec() {
    }

    static String encode(Ledger ledger) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("schemaVersion", Ledger.SCHEMA_VERSION);

        ObjectNode skills = root.putObject("skills");
        ledger.skills().forEach((name, entry) -> {
            ObjectNode node = skills.putObject(name);
            node.put("version", entry.version());
            node.put("source", entry.source());
            node.put("installedBy", entry.installedBy().token());
            node.put("installedAt", entry.installedAt().toString());
            ArrayNode dependedBy = node.putArray("dependedBy");
            entry.dependedBy().forEach(dependedBy::add);
        });

        ObjectNode tools = root.putObject("tools");
        ledger.tools().forEach((name, entry) -> {
            ObjectNode node = tools.putObject(name);
            node.put("packageIdentifier", entry.packageIdentifier());
            if (entry.installedBySkill().isPresent()) {
                node.put("installedBySkill", entry.installedBySkill().get());
            } else {
                node.putNull("installedBySkill");
            }
            node.put("installedAt", entry.installedAt().toString());
        });

        ObjectNode sync = root.putObject("syncHistory");
        ledger.syncHistory().forEach((target, at) -> sync.put(target, at.toString()));

        try {
            return MAPPER.writeValueAsString(root) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("state.json の生成に失敗しました", e);
        }
    }

    /**
     * @throws LedgerFormatException when the document is not a ledger this version understands
     */
    static Ledger decode(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LedgerFormatException("not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new LedgerFormatException("root is not an object");
        }
        JsonNode schema = root.get("schemaVersion");
        if (schema == null || !Ledger.SCHEMA_VERSION.equals(schema.asText(null))) {
            throw new LedgerFormatException("unsupported schemaVersion: " + schema);
        }

        Map<String, SkillLedgerEntry> skills = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = objectFields(root, "skills"); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode node = field.getValue();
            skills.put(field.getKey(), new SkillLedgerEntry(
                    requiredText(node, "version"),
                    requiredText(node, "source"),
                    InstalledBy.parse(requiredText(node, "installedBy")),
                    instant(requiredText(node, "installedAt")),
                    textList(node.get("dependedBy"))));
        }

        Map<String, ToolLedgerEntry> tools = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = objectFields(root, "tools"); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode node = field.getValue();
            JsonNode by = node.get("installedBySkill");
            tools.put(field.getKey(), new ToolLedgerEntry(
                    requiredText(node, "packageIdentifier"),
                    by == null || by.isNull() ? Optional.empty() : Optional.of(by.asText()),
                    instant(requiredText(node, "installedAt"))));
        }

        Map<String, Instant> syncHistory = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = objectFields(root, "syncHistory"); it.hasNext();) {
            Map.Entry<String, JsonNode> field = it.next();
            if (!field.getValue().isTextual()) {
                throw new LedgerFormatException("syncHistory." + field.getKey() + " is not a timestamp");
            }
            syncHistory.put(field.getKey(), instant(field.getValue().asText()));
        }
        return new Ledger(skills, tools, syncHistory);
    }

    private static Iterator<Map.Entry<String, JsonNode>> objectFields(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return Collections.emptyIterator();
        }
        if (!node.isObject()) {
            throw new LedgerFormatException(field + " is not an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        List<Map.Entry<String, JsonNode>> checked = new ArrayList<>();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isObject() && !"syncHistory".equals(field)) {
                throw new LedgerFormatException(field + "." + entry.getKey() + " is not an object");
            }
            checked.add(entry);
        }
        return checked.iterator();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new LedgerFormatException("missing or non-text field: " + field);
        }
        return value.asText();
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new LedgerFormatException("dependedBy is not an array");
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> values.add(item.asText()));
        return values;
    }

    private static Instant instant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new LedgerFormatException("invalid timestamp: " + text);
        }
    }

    static final class LedgerFormatException extends RuntimeException {

        LedgerFormatException(String message) {
            super(message);
        }
    }
}

package io.github.hide212131.skillpkg.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory snapshot of {@code state.json}. Instances are only mutated by {@link StateLedger} inside one
 * load, mutate and save cycle; callers that receive one from {@link StateLedger#load} should treat it as
 * read-only.
 */
public final class Ledger {

    public static final String SCHEMA_VERSION = "skillpkg-state-v1";

    private final Map<String, SkillLedgerEntry> skills;
    private final Map<String, ToolLedgerEntry> tools;
    private final Map<String, Instant> syncHistory;

    Ledger(Map<String, SkillLedgerEntry> skills, Map<String, ToolLedgerEntry> tools,
            Map<String, Instant> syncHistory) {
        this.skills = new LinkedHashMap<>(Objects.requireNonNull(skills, "skills"));
        this.tools = new LinkedHashMap<>(Objects.requireNonNull(tools, "tools"));
        this.syncHistory = new LinkedHashMap<>(Objects.requireNonNull(syncHistory, "syncHistory"));
    }

    public static Ledger empty() {
        return new Ledger(Map.of(), Map.of(), Map.of());
    }

    public Map<String, SkillLedgerEntry> skills() {
        return Collections.unmodifiableMap(skills);
    }

    public Map<String, ToolLedgerEntry> tools() {
        return Collections.unmodifiableMap(tools);
    }

    public Map<String, Instant> syncHistory() {
        return Collections.unmodifiableMap(syncHistory);
    }

    public Optional<SkillLedgerEntry> skill(String name) {
        return Optional.ofNullable(skills.get(name));
    }

    public Optional<ToolLedgerEntry> tool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean hasSkill(String name) {
        return skills.containsKey(name);
    }

    public Set<String> skillNames() {
        return Collections.unmodifiableSet(skills.keySet());
    }

    public boolean isEmpty() {
        return skills.isEmpty() && tools.isEmpty() && syncHistory.isEmpty();
    }

    void putSkill(String name, SkillLedgerEntry entry) {
        skills.put(name, entry);
    }

    void removeSkill(String name) {
        skills.remove(name);
    }

    void replaceSkills(Map<String, SkillLedgerEntry> updated) {
        skills.clear();
        skills.putAll(updated);
    }

    void putTool(String name, ToolLedgerEntry entry) {
        tools.put(name, entry);
    }

    boolean removeTool(String name) {
        return tools.remove(name) != null;
    }

    void putSync(String target, Instant at) {
        syncHistory.put(target, at);
    }
}

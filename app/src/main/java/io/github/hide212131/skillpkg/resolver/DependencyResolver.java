package io.github.hide212131.skillpkg.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the transitive skill dependencies of a source into a flat, topologically ordered list.
 * <p>
 * The traversal is a post-order depth-first search driven by an explicit frame stack. A skill already
 * installed is pruned, a skill already completed in this run is emitted only once (diamonds), and a skill
 * reached again while still on the stack aborts the whole resolution with the offending chain.
 */
public final class DependencyResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyResolver.class);

    private final SkillFetcher fetcher;

    public DependencyResolver(SkillFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    public ResolutionResult resolve(String rootSource) {
        return resolve(rootSource, Set.of());
    }

    public ResolutionResult resolve(String rootSource, Set<String> alreadyInstalled) {
        Objects.requireNonNull(rootSource, "rootSource");
        Objects.requireNonNull(alreadyInstalled, "alreadyInstalled");
        Traversal traversal = new Traversal(Set.copyOf(alreadyInstalled));
        try {
            traversal.run(rootSource);
        } catch (CircularDependencyException ex) {
            LOGGER.warn("{}", ex.getMessage());
            List<String> errors = new ArrayList<>(traversal.errors);
            errors.add(ex.getMessage());
            return ResolutionResult.circular(ex.chain(), errors);
        } catch (SkillFetchException ex) {
            LOGGER.warn("Resolution of {} aborted: {}", rootSource, ex.getMessage());
            List<String> errors = new ArrayList<>(traversal.errors);
            errors.add(ex.getMessage());
            return ResolutionResult.failed(errors);
        }
        return new ResolutionResult(traversal.resolved, List.copyOf(traversal.tools.keySet()), traversal.tools,
                List.copyOf(traversal.edges), traversal.errors, Optional.empty());
    }

    /** Returns the chain when {@code rootSource} reaches a cycle. */
    public Optional<List<String>> detectCircular(String rootSource) {
        return resolve(rootSource).circularChain();
    }

    /**
     * Metadata of the skill at {@code source} without recursing. An unknown source yields a skill with no
     * dependencies.
     */
    public SkillMetadata directDependencies(String source) {
        return fetcher.fetchMetadata(source).orElseGet(() -> SkillMetadata.of(SkillNames.fromSource(source), ""));
    }

    /**
     * Builds a nested view of the dependency graph. A skill seen earlier in the walk is left out of the
     * later branch, which also stops cycles.
     */
    public Optional<DependencyNode> buildDependencyTree(String rootSource) {
        return buildTree(rootSource, new HashSet<>());
    }

    private Optional<DependencyNode> buildTree(String source, Set<String> seen) {
        if (!seen.add(SkillNames.fromSource(source))) {
            return Optional.empty();
        }
        Optional<SkillMetadata> metadata = fetcher.fetchMetadata(source);
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        List<DependencyNode> children = new ArrayList<>();
        for (String child : metadata.get().skills()) {
            buildTree(child, seen).ifPresent(children::add);
        }
        return Optional.of(new DependencyNode(metadata.get().name(), metadata.get().version(), source, children,
                metadata.get().tools()));
    }

    private final class Traversal {

        private final Set<String> installed;
        private final Set<String> visited = new HashSet<>();
        // insertion order mirrors the active DFS stack
        private final LinkedHashSet<String> onStack = new LinkedHashSet<>();
        private final List<ResolvedDependency> resolved = new ArrayList<>();
        private final Map<String, List<String>> tools = new LinkedHashMap<>();
        private final Set<DependencyEdge> edges = new LinkedHashSet<>();
        private final List<String> errors = new ArrayList<>();

        Traversal(Set<String> installed) {
            this.installed = installed;
        }

        void run(String rootSource) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(rootSource, null));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.entered) {
                    if (!enter(frame)) {
                        stack.pop();
                    }
                    continue;
                }
                if (frame.nextChild < frame.metadata.skills().size()) {
                    String childSource = frame.metadata.skills().get(frame.nextChild++);
                    edges.add(new DependencyEdge(frame.name, SkillNames.fromSource(childSource)));
                    stack.push(new Frame(childSource, frame.name));
                    continue;
                }
                complete(frame);
                stack.pop();
            }
        }

        /** @return whether the frame stays on the stack to have its children visited */
        private boolean enter(Frame frame) {
            frame.entered = true;
            if (installed.contains(frame.name) || visited.contains(frame.name)) {
                return false;
            }
            if (onStack.contains(frame.name)) {
                throw new CircularDependencyException(chainTo(frame.name));
            }
            Optional<SkillMetadata> metadata = fetcher.fetchMetadata(frame.source);
            if (metadata.isEmpty()) {
                errors.add("Failed to fetch metadata for: " + frame.source);
                visited.add(frame.name);
                return false;
            }
            frame.metadata = metadata.get();
            onStack.add(frame.name);
            return true;
        }

        private void complete(Frame frame) {
            for (String tool : frame.metadata.tools()) {
                List<String> requirers = tools.computeIfAbsent(tool, ignored -> new ArrayList<>());
                if (!requirers.contains(frame.name)) {
                    requirers.add(frame.name);
                }
            }
            resolved.add(frame.requiredBy == null
                    ? ResolvedDependency.root(frame.name, frame.source)
                    : ResolvedDependency.transitive(frame.name, frame.source, frame.requiredBy));
            onStack.remove(frame.name);
            visited.add(frame.name);
        }

        private List<String> chainTo(String repeated) {
            List<String> chain = new ArrayList<>();
            boolean inCycle = false;
            for (String name : onStack) {
                inCycle = inCycle || name.equals(repeated);
                if (inCycle) {
                    chain.add(name);
                }
            }
            chain.add(repeated);
            return chain;
        }
    }

    private static final class Frame {

        private final String source;
        private final String name;
        private final String requiredBy;
        private boolean entered;
        private SkillMetadata metadata;
        private int nextChild;

        Frame(String source, String requiredBy) {
            this.source = source;
            this.name = SkillNames.fromSource(source);
            this.requiredBy = requiredBy;
        }
    }
}

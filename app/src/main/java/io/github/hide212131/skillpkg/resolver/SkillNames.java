package io.github.hide212131.skillpkg.resolver;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Derives the short skill name from a source locator.
 * <p>
 * This is the only identity function used to compare skills: two locators that produce the same name are
 * treated as the same skill by the resolver, the ledger and the store.
 */
public final class SkillNames {

    private static final String GITHUB_PREFIX = "github:";
    private static final String HTTP_PREFIX = "http://";
    private static final String HTTPS_PREFIX = "https://";

    private SkillNames() {
    }

    /**
     * Examples: {@code github:user/skill-name} → {@code skill-name}, {@code https://github.com/user/repo} →
     * {@code repo}, {@code ./skills/local-skill} → {@code local-skill}.
     */
    public static String fromSource(String source) {
        Objects.requireNonNull(source, "source");
        String trimmed = source.trim();
        if (trimmed.startsWith(GITHUB_PREFIX)) {
            return lastSegment(trimmed.substring(GITHUB_PREFIX.length()), trimmed);
        }
        if (trimmed.startsWith(HTTP_PREFIX) || trimmed.startsWith(HTTPS_PREFIX)) {
            try {
                String path = new URI(trimmed).getPath();
                return lastSegment(path == null ? "" : path, trimmed);
            } catch (URISyntaxException ex) {
                return trimmed;
            }
        }
        return lastSegment(trimmed, trimmed);
    }

    /** A tracked name must never carry a path separator; such names point at an identity extraction bug. */
    public static boolean isValid(String name) {
        return name != null && !name.isBlank() && name.indexOf('/') < 0 && name.indexOf('\\') < 0;
    }

    private static String lastSegment(String path, String fallback) {
        List<String> segments = Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
        if (segments.isEmpty()) {
            return fallback;
        }
        return segments.get(segments.size() - 1);
    }
}

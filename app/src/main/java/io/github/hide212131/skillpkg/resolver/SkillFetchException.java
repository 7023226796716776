package io.github.hide212131.skillpkg.resolver;

/**
 * Transport-level failure while fetching a skill. "Not found" is never reported through this exception.
 */
public class SkillFetchException extends RuntimeException {

    public SkillFetchException(String message) {
        super(message);
    }

    public SkillFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

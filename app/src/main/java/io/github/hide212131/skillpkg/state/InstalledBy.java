package io.github.hide212131.skillpkg.state;

import java.util.Objects;
import java.util.Optional;

/**
 * Who caused a skill to be installed: the user directly, or another skill that requires it.
 * <p>
 * Persisted as the literal {@code "user"} or as the requiring skill's name.
 */
public sealed interface InstalledBy permits InstalledBy.User, InstalledBy.Skill {

    String USER_TOKEN = "user";

    static InstalledBy user() {
        return User.INSTANCE;
    }

    static InstalledBy skill(String name) {
        return new Skill(name);
    }

    static InstalledBy parse(String token) {
        Objects.requireNonNull(token, "token");
        if (USER_TOKEN.equals(token)) {
            return User.INSTANCE;
        }
        return new Skill(token);
    }

    String token();

    default boolean isUser() {
        return this instanceof User;
    }

    /** Name of the requiring skill, empty for a user install. */
    default Optional<String> skillName() {
        if (this instanceof Skill skill) {
            return Optional.of(skill.name());
        }
        return Optional.empty();
    }

    record User() implements InstalledBy {

        static final User INSTANCE = new User();

        @Override
        public String token() {
            return USER_TOKEN;
        }
    }

    record Skill(String name) implements InstalledBy {

        public Skill {
            Objects.requireNonNull(name, "name");
            if (name.isBlank() || USER_TOKEN.equals(name)) {
                throw new IllegalArgumentException("invalid installer skill name: '" + name + "'");
            }
        }

        @Override
        public String token() {
            return name;
        }
    }
}

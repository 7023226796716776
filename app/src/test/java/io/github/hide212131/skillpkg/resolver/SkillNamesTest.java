package io.github.hide212131.skillpkg.resolver;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SkillNamesTest {

    @ParameterizedTest
    @CsvSource({
            "github:user/skill-a, skill-a",
            "github:user/repo/, repo",
            "https://example.com/skills/skill-b, skill-b",
            "https://example.com/skills/skill-b/, skill-b",
            "./skills/skill-c, skill-c",
            "/abs/path/skill-d/, skill-d",
            "skill-e, skill-e"
    })
    void derivesNameFromLastPathSegment(String source, String expected) {
        assertThat(SkillNames.fromSource(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({ "a/b, false", "'a\\b', false", "'  ', false", "skill-a, true" })
    void rejectsNamesWithPathSeparators(String name, boolean valid) {
        assertThat(SkillNames.isValid(name)).isEqualTo(valid);
    }
}

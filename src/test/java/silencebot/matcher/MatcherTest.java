package silencebot.matcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MatcherTest {

    @Test
    void comparisonSemantics() {
        assertThat(Matcher.of(MatchType.EQUAL, "env", "prod").matches("prod")).isTrue();
        assertThat(Matcher.of(MatchType.EQUAL, "env", "prod").matches("production")).isFalse();
        assertThat(Matcher.of(MatchType.NOT_EQUAL, "env", "prod").matches("dev")).isTrue();
        assertThat(Matcher.of(MatchType.REGEXP, "env", "pro.*").matches("production")).isTrue();
        assertThat(Matcher.of(MatchType.NOT_REGEXP, "env", "pro.*").matches("production")).isFalse();
        assertThat(Matcher.of(MatchType.NOT_REGEXP, "env", "pro.*").matches("dev")).isTrue();
    }

    @Test
    void regexDoesNotMatchSubstring() {
        Matcher m = Matcher.of(MatchType.REGEXP, "instance", "db");

        assertThat(m.matches("db")).isTrue();
        assertThat(m.matches("db-1")).isFalse();
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void nestedQuantifierDoesNotBacktrack() {
        Matcher m = Matcher.of(MatchType.REGEXP, "path", "(a+)+b");

        assertThat(m.matches("a".repeat(5000))).isFalse();
        assertThat(m.matches("a".repeat(5000) + "b")).isTrue();
    }

    @Test
    void equalityIgnoresCompiledPattern() {
        assertThat(Matcher.of(MatchType.REGEXP, "a", "b.*"))
                .isEqualTo(Matcher.of(MatchType.REGEXP, "a", "b.*"))
                .hasSameHashCodeAs(Matcher.of(MatchType.REGEXP, "a", "b.*"))
                .isNotEqualTo(Matcher.of(MatchType.EQUAL, "a", "b.*"));
    }

    @Test
    void renderEscapesSpecialCharacters() {
        Matcher m = Matcher.of(MatchType.NOT_EQUAL, "msg", "x\"y\\z\n");

        assertThat(m.render()).isEqualTo("msg!=\"x\\\"y\\\\z\\n\"");
    }

    @Test
    void matchTypeSymbols() {
        assertThat(MatchType.fromSymbol("=~")).contains(MatchType.REGEXP);
        assertThat(MatchType.fromSymbol("~=")).isEmpty();
        assertThat(MatchType.of(true, false)).isEqualTo(MatchType.NOT_REGEXP);
        assertThat(MatchType.of(false, true)).isEqualTo(MatchType.EQUAL);
        for (MatchType type : MatchType.values()) {
            assertThat(MatchType.of(type.isRegex(), type.isEqual())).isEqualTo(type);
        }
    }
}

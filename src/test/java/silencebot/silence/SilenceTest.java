package silencebot.silence;

import org.junit.jupiter.api.Test;
import silencebot.matcher.MatcherList;
import silencebot.matcher.MatcherParser;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SilenceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final MatcherList MATCHERS = MatcherParser.parseAll("{alertname=\"Down\", env=\"prod\"}");

    @Test
    void createRequiresEndAfterStart() {
        assertThatThrownBy(() -> Silence.create(MATCHERS, NOW, NOW, "bot", "c", NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Silence.create(MATCHERS, NOW, NOW.minusSeconds(1), "bot", "c", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createComputesState() {
        Silence active = Silence.create(MATCHERS, NOW, NOW.plusSeconds(60), "bot", "c", NOW);
        Silence pending = Silence.create(MATCHERS, NOW.plusSeconds(10), NOW.plusSeconds(60), "bot", "c", NOW);

        assertThat(active.getState()).isEqualTo(SilenceState.ACTIVE);
        assertThat(active.getUpdatedAt()).isEqualTo(NOW);
        assertThat(active.getId()).isNull();
        assertThat(pending.getState()).isEqualTo(SilenceState.PENDING);
    }

    @Test
    void refreshProducesNewInstance() {
        Silence silence = Silence.create(MATCHERS, NOW, NOW.plus(Duration.ofHours(1)), "bot", "c", NOW);

        Silence later = silence.refreshedAt(NOW.plus(Duration.ofHours(2)));

        assertThat(later.getState()).isEqualTo(SilenceState.EXPIRED);
        assertThat(silence.getState()).isEqualTo(SilenceState.ACTIVE);
        assertThat(silence.refreshedAt(NOW)).isSameAs(silence);
    }

    @Test
    void isResolvedOnceEndPassed() {
        Silence silence = Silence.create(MATCHERS, NOW, NOW.plusSeconds(60), "bot", "c", NOW);

        assertThat(silence.isResolved(NOW)).isFalse();
        assertThat(silence.isResolved(NOW.plusSeconds(60))).isTrue();
        assertThat(silence.isResolved(NOW.plusSeconds(61))).isTrue();
    }

    @Test
    void unsetEndIsNeverResolved() {
        Silence zeroEnd = Silence.restore("id", MATCHERS, NOW, Silence.ZERO_TIME, NOW, "bot", "c", NOW);
        Silence epochEnd = Silence.restore("id", MATCHERS, NOW, Instant.EPOCH, NOW, "bot", "c", NOW);
        Silence noEnd = Silence.restore("id", MATCHERS, NOW, null, NOW, "bot", "c", NOW);

        for (Silence silence : new Silence[]{zeroEnd, epochEnd, noEnd}) {
            assertThat(silence.getEndsAt()).isNull();
            assertThat(silence.isResolved(NOW)).isFalse();
            assertThat(silence.isResolved(Instant.MAX)).isFalse();
        }
    }

    @Test
    void restoreAcceptsExpiredWindow() {
        Silence deleted = Silence.restore("id", MATCHERS, NOW, NOW, NOW, "bot", "c", NOW);

        assertThat(deleted.getState()).isEqualTo(SilenceState.EXPIRED);
        assertThat(deleted.isResolved(NOW)).isTrue();
    }

    @Test
    void appliesOnlyWhileActiveAndMatching() {
        Silence silence = Silence.create(MATCHERS, NOW, NOW.plusSeconds(60), "bot", "c", NOW);
        Map<String, String> labels = Map.of("alertname", "Down", "env", "prod", "job", "api");

        assertThat(silence.appliesTo(labels, NOW)).isTrue();
        assertThat(silence.appliesTo(Map.of("alertname", "Down", "env", "dev"), NOW)).isFalse();
        assertThat(silence.appliesTo(labels, NOW.minusSeconds(1))).isFalse();
        assertThat(silence.appliesTo(labels, NOW.plusSeconds(60))).isFalse();
    }

    @Test
    void withIdKeepsEverythingElse() {
        Silence silence = Silence.create(MATCHERS, NOW, NOW.plusSeconds(60), "bot", "c", NOW);

        Silence submitted = silence.withId("abc");

        assertThat(submitted.getId()).isEqualTo("abc");
        assertThat(submitted.getMatchers()).isEqualTo(silence.getMatchers());
        assertThat(submitted.getEndsAt()).isEqualTo(silence.getEndsAt());
    }
}

package silencebot.silence;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SilenceStateTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = START.plus(Duration.ofHours(2));

    @Test
    void pendingBeforeStart() {
        assertThat(SilenceState.compute(START, END, START.minusMillis(1))).isEqualTo(SilenceState.PENDING);
    }

    @Test
    void activeFromStartUntilEnd() {
        assertThat(SilenceState.compute(START, END, START)).isEqualTo(SilenceState.ACTIVE);
        assertThat(SilenceState.compute(START, END, END.minusMillis(1))).isEqualTo(SilenceState.ACTIVE);
    }

    @Test
    void expiredAtAndAfterEnd() {
        assertThat(SilenceState.compute(START, END, END)).isEqualTo(SilenceState.EXPIRED);
        assertThat(SilenceState.compute(START, END, END.plusSeconds(60))).isEqualTo(SilenceState.EXPIRED);
    }

    @Test
    void degenerateAndReversedWindowsStillHaveAState() {
        assertThat(SilenceState.compute(START, START, START.minusMillis(1))).isEqualTo(SilenceState.PENDING);
        assertThat(SilenceState.compute(START, START, START)).isEqualTo(SilenceState.EXPIRED);

        assertThat(SilenceState.compute(END, START, START.minusMillis(1))).isEqualTo(SilenceState.PENDING);
        assertThat(SilenceState.compute(END, START, START.plusSeconds(1))).isEqualTo(SilenceState.PENDING);
        assertThat(SilenceState.compute(END, START, END)).isEqualTo(SilenceState.EXPIRED);
    }

    @Test
    void unsetEndNeverExpires() {
        assertThat(SilenceState.compute(START, null, Instant.MAX)).isEqualTo(SilenceState.ACTIVE);
    }
}

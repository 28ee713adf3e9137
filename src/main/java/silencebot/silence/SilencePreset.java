package silencebot.silence;

import java.time.Duration;

/**
 * 预设的静默时长
 */
public enum SilencePreset {
    TWO_HOURS(Duration.ofHours(2)),
    FORTY_EIGHT_HOURS(Duration.ofHours(48)),
    TWO_WEEKS(Duration.ofDays(14));

    private final Duration duration;

    SilencePreset(Duration duration) {
        this.duration = duration;
    }

    public Duration getDuration() {
        return duration;
    }
}

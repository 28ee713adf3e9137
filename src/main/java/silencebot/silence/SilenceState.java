package silencebot.silence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * 静默状态
 */
public enum SilenceState {
    PENDING("pending"),
    ACTIVE("active"),
    EXPIRED("expired");

    private final String value;

    SilenceState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 计算给定时刻的状态; 对任意时间顺序都有定义, 未设置的开始时间视为已开始, 未设置的结束时间视为永不结束
     */
    public static SilenceState compute(Instant startsAt, Instant endsAt, Instant now) {
        if (startsAt != null && now.isBefore(startsAt)) {
            return PENDING;
        }
        if (endsAt == null || now.isBefore(endsAt)) {
            return ACTIVE;
        }
        return EXPIRED;
    }
}

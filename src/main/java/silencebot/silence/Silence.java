package silencebot.silence;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import silencebot.matcher.MatcherList;

import java.time.Instant;
import java.util.Map;

/**
 * 静默规则: 在时间窗口内屏蔽标签满足匹配器的告警
 *
 * <p>实例不可变, 状态变化通过 with* 方法返回新实例。state 为最近一次求值时刻的状态,
 * 任何生命周期判断都应通过 {@link #stateAt(Instant)} 重新计算。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Silence {

    // Go 语言零值时间, 上游用它表示未设置
    static final Instant ZERO_TIME = Instant.parse("0001-01-01T00:00:00Z");

    private final String id;
    private final MatcherList matchers;
    private final Instant startsAt;
    private final Instant endsAt;
    private final Instant updatedAt;
    private final String createdBy;
    private final String comment;
    private final SilenceState state;

    private Silence(String id, MatcherList matchers, Instant startsAt, Instant endsAt,
                    Instant updatedAt, String createdBy, String comment, SilenceState state) {
        this.id = id;
        this.matchers = matchers;
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.updatedAt = updatedAt;
        this.createdBy = createdBy;
        this.comment = comment;
        this.state = state;
    }

    /**
     * 创建新的静默, 结束时间必须晚于开始时间
     */
    public static Silence create(MatcherList matchers, Instant startsAt, Instant endsAt,
                                 String createdBy, String comment, Instant now) {
        if (startsAt == null || endsAt == null || !endsAt.isAfter(startsAt)) {
            throw new IllegalArgumentException(
                    "静默结束时间必须晚于开始时间: startsAt=" + startsAt + ", endsAt=" + endsAt);
        }
        return new Silence(null, matchers, startsAt, endsAt, now, createdBy, comment,
                SilenceState.compute(startsAt, endsAt, now));
    }

    /**
     * 还原上游已有的静默, 不校验时间窗口
     */
    public static Silence restore(String id, MatcherList matchers, Instant startsAt, Instant endsAt,
                                  Instant updatedAt, String createdBy, String comment, Instant now) {
        Instant start = unsetToNull(startsAt);
        Instant end = unsetToNull(endsAt);
        return new Silence(id, matchers, start, end, unsetToNull(updatedAt), createdBy, comment,
                SilenceState.compute(start, end, now));
    }

    public SilenceState stateAt(Instant now) {
        return SilenceState.compute(startsAt, endsAt, now);
    }

    /**
     * 在给定时刻重新计算状态
     */
    public Silence refreshedAt(Instant now) {
        SilenceState current = stateAt(now);
        if (current == state) {
            return this;
        }
        return new Silence(id, matchers, startsAt, endsAt, updatedAt, createdBy, comment, current);
    }

    public Silence withId(String newId) {
        return new Silence(newId, matchers, startsAt, endsAt, updatedAt, createdBy, comment, state);
    }

    /**
     * 结束时间已设置且不晚于 now; 未设置结束时间的静默永不视为已结束
     */
    public boolean isResolved(Instant now) {
        return endsAt != null && !endsAt.isAfter(now);
    }

    /**
     * 在 now 时刻是否屏蔽带有给定标签的告警
     */
    public boolean appliesTo(Map<String, String> labels, Instant now) {
        return stateAt(now) == SilenceState.ACTIVE && matchers.matches(labels);
    }

    private static Instant unsetToNull(Instant instant) {
        if (instant == null || instant.equals(ZERO_TIME) || instant.equals(Instant.EPOCH)) {
            return null;
        }
        return instant;
    }
}

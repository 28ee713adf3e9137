package silencebot.silence;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import silencebot.matcher.MatcherList;
import silencebot.matcher.MatcherParser;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 静默构建器 - 根据匹配器和时长组装新的静默
 */
@Slf4j
public class SilenceFactory {

    /**
     * 匹配所有带非空 alertname 的告警
     */
    public static final String BLANKET_MATCHER = "alertname=~\".+\"";

    private static final MatcherList BLANKET_MATCHERS = MatcherParser.parseAll(BLANKET_MATCHER);

    private final Clock clock;
    private final String createdBy;
    private final String comment;

    public SilenceFactory(Clock clock, String createdBy, String comment) {
        this.clock = clock;
        this.createdBy = createdBy;
        this.comment = comment;
    }

    /**
     * 构建屏蔽全部告警的静默
     */
    public Silence buildBlanketSilence(Duration duration) {
        return build(BLANKET_MATCHERS, duration);
    }

    /**
     * 按指纹在候选告警中定位目标, 以其标签集构建静默
     *
     * @throws NoAlertsException     候选列表为空
     * @throws AlertNotFoundException 没有与指纹匹配的告警
     */
    public Silence buildTargetedSilence(String fingerprint, Duration duration, List<AlertSummary> candidates) {
        AlertSummary target = findByFingerprint(fingerprint, candidates);
        log.debug("找到匹配告警, labels: {}", target.getLabelString());

        MatcherList matchers = MatcherParser.parseAll(target.getLabelString());
        log.debug("解析得到匹配器: {}", matchers);
        return build(matchers, duration);
    }

    /**
     * 是否为本机器人创建的全局静默
     */
    public boolean isOwnBlanketSilence(Silence silence) {
        return BLANKET_MATCHERS.equals(silence.getMatchers()) && createdBy.equals(silence.getCreatedBy());
    }

    /**
     * 在候选告警中按指纹查找
     *
     * @throws NoAlertsException     候选列表为空
     * @throws AlertNotFoundException 没有与指纹匹配的告警
     */
    public static AlertSummary findByFingerprint(String fingerprint, List<AlertSummary> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoAlertsException();
        }
        return candidates.stream()
                .filter(alert -> alert.getFingerprint().equals(fingerprint))
                .findFirst()
                .orElseThrow(() -> new AlertNotFoundException(fingerprint));
    }

    private Silence build(MatcherList matchers, Duration duration) {
        Preconditions.checkArgument(duration != null && !duration.isNegative() && !duration.isZero(),
                "静默时长必须为正: %s", duration);
        Instant now = clock.instant();
        return Silence.create(matchers, now, now.plus(duration), createdBy, comment, now);
    }
}

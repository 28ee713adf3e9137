package silencebot.silence;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 静默服务 - 串联告警来源, 静默构建和上游提交
 */
@Slf4j
public class SilenceService {

    private final SilenceFactory silenceFactory;
    private final AlertSource alertSource;
    private final SilenceSink silenceSink;
    private final SilenceSource silenceSource;
    private final Clock clock;

    // 维护窗口配置
    private final int maintenanceDefaultHours;
    private final int maintenanceMaxHours;

    public SilenceService(SilenceFactory silenceFactory,
                          AlertSource alertSource,
                          SilenceSink silenceSink,
                          SilenceSource silenceSource,
                          Clock clock,
                          int maintenanceDefaultHours,
                          int maintenanceMaxHours) {
        this.silenceFactory = silenceFactory;
        this.alertSource = alertSource;
        this.silenceSink = silenceSink;
        this.silenceSource = silenceSource;
        this.clock = clock;
        this.maintenanceDefaultHours = maintenanceDefaultHours;
        this.maintenanceMaxHours = maintenanceMaxHours;
    }

    /**
     * 按预设时长静默指定告警
     */
    public Silence silenceAlert(String fingerprint, SilencePreset preset) {
        return silenceAlert(fingerprint, preset.getDuration());
    }

    /**
     * 静默指纹对应的告警
     */
    public Silence silenceAlert(String fingerprint, Duration duration) {
        log.debug("静默告警, fingerprint: {}, duration: {}", fingerprint, duration);

        List<AlertSummary> alerts = fetchAlerts();
        log.debug("当前告警数量: {}", alerts.size());

        Silence silence;
        try {
            silence = silenceFactory.buildTargetedSilence(fingerprint, duration, alerts);
        } catch (NoAlertsException e) {
            log.error("当前没有任何告警");
            throw e;
        } catch (AlertNotFoundException e) {
            log.error("没有与指纹匹配的告警: {}, 告警数量: {}", fingerprint, alerts.size());
            throw e;
        }
        return submit(silence);
    }

    /**
     * 静默全部告警(过去, 现在和将来)
     */
    public Silence silenceAll(Duration duration) {
        return submit(silenceFactory.buildBlanketSilence(duration));
    }

    /**
     * 开启维护窗口; hours 为空或超出 [1, 最大小时数] 时使用默认小时数
     */
    public Silence startMaintenance(Integer hours) {
        int effective = maintenanceHours(hours);
        log.info("开启维护窗口, 时长: {}小时", effective);
        return silenceAll(Duration.ofHours(effective));
    }

    /**
     * 结束维护窗口: 撤销本机器人创建且尚未结束的全局静默
     *
     * @return 被撤销的静默ID
     */
    public List<String> stopMaintenance() {
        Instant now = clock.instant();
        List<String> ids = fetchSilences(now).stream()
                .filter(silence -> !silence.isResolved(now))
                .filter(silenceFactory::isOwnBlanketSilence)
                .map(Silence::getId)
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            log.warn("没有需要结束的维护静默");
            return ids;
        }

        for (String id : ids) {
            try {
                silenceSink.withdraw(id);
            } catch (UpstreamException e) {
                log.error("撤销维护静默失败: {}", id, e);
                throw e;
            }
            log.info("维护静默已撤销: {}", id);
        }
        return ids;
    }

    int maintenanceHours(Integer hours) {
        if (hours == null || hours < 1 || hours > maintenanceMaxHours) {
            return maintenanceDefaultHours;
        }
        return hours;
    }

    /**
     * 按指纹查找当前告警
     */
    public AlertSummary findAlert(String fingerprint) {
        AlertSummary alert = SilenceFactory.findByFingerprint(fingerprint, fetchAlerts());
        log.debug("找到匹配告警: {}", alert);
        return alert;
    }

    /**
     * 列出全部静默, 按结束时间倒序, 未设置结束时间的排在最后
     */
    public List<Silence> listSilences() {
        Instant now = clock.instant();
        return fetchSilences(now).stream()
                .map(silence -> silence.refreshedAt(now))
                .sorted(Comparator.comparing(Silence::getEndsAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .collect(Collectors.toList());
    }

    private List<Silence> fetchSilences(Instant now) {
        try {
            return silenceSource.listSilences(now);
        } catch (UpstreamException e) {
            log.error("获取静默列表失败", e);
            throw e;
        }
    }

    private List<AlertSummary> fetchAlerts() {
        try {
            return alertSource.listCurrentAlerts();
        } catch (UpstreamException e) {
            log.error("获取告警列表失败", e);
            throw e;
        }
    }

    private Silence submit(Silence silence) {
        try {
            String id = silenceSink.submit(silence);
            log.info("静默已提交: {}, matchers: {}, endsAt: {}", id, silence.getMatchers(), silence.getEndsAt());
            return silence.withId(id);
        } catch (UpstreamException e) {
            log.error("提交静默失败, matchers: {}", silence.getMatchers(), e);
            throw e;
        }
    }
}

package silencebot.silence;

import java.util.List;

/**
 * 当前告警来源
 */
public interface AlertSource {
    /**
     * 列出当前告警
     *
     * @throws UpstreamException 上游调用失败
     */
    List<AlertSummary> listCurrentAlerts();
}

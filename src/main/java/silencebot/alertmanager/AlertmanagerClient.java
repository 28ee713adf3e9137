package silencebot.alertmanager;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import silencebot.silence.AlertSource;
import silencebot.silence.AlertSummary;
import silencebot.silence.Silence;
import silencebot.silence.SilenceSink;
import silencebot.silence.SilenceSource;
import silencebot.silence.UpstreamException;
import silencebot.utils.HttpUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Alertmanager v2 API 客户端
 */
@Slf4j
public class AlertmanagerClient implements AlertSource, SilenceSink, SilenceSource {

    private static final TypeReference<List<AlertResource>> ALERTS = new TypeReference<>() {
    };
    private static final TypeReference<List<SilenceResource>> SILENCES = new TypeReference<>() {
    };

    private final String baseUrl;

    public AlertmanagerClient(String baseUrl) {
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
    }

    @Override
    public List<AlertSummary> listCurrentAlerts() {
        String url = baseUrl + "/api/v2/alerts";
        log.debug("请求告警列表: {}", url);
        try {
            List<AlertResource> alerts = HttpUtils.get(url, ALERTS);
            if (alerts == null) {
                return Collections.emptyList();
            }
            return alerts.stream()
                    .map(AlertmanagerClient::toSummary)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UpstreamException("获取告警列表失败: " + url, e);
        }
    }

    @Override
    public List<Silence> listSilences(Instant now) {
        String url = baseUrl + "/api/v2/silences";
        log.debug("请求静默列表: {}", url);
        try {
            List<SilenceResource> silences = HttpUtils.get(url, SILENCES);
            if (silences == null) {
                return Collections.emptyList();
            }
            return silences.stream()
                    .map(resource -> resource.toSilence(now))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UpstreamException("获取静默列表失败: " + url, e);
        }
    }

    @Override
    public String submit(Silence silence) {
        String url = baseUrl + "/api/v2/silences";
        log.debug("提交静默: {}, matchers: {}", url, silence.getMatchers());
        try {
            PostSilenceResponse response = HttpUtils.post(url, SilenceResource.from(silence), PostSilenceResponse.class);
            return response == null ? null : response.getSilenceId();
        } catch (IOException e) {
            throw new UpstreamException("提交静默失败: " + url, e);
        }
    }

    @Override
    public void withdraw(String id) {
        String url = baseUrl + "/api/v2/silence/" + id;
        log.debug("撤销静默: {}", url);
        try {
            HttpUtils.delete(url);
        } catch (IOException e) {
            throw new UpstreamException("撤销静默失败: " + url, e);
        }
    }

    private static AlertSummary toSummary(AlertResource alert) {
        Map<String, String> labels = alert.getLabels() == null ? Collections.emptyMap() : alert.getLabels();
        String fingerprint = StringUtils.isNotBlank(alert.getFingerprint())
                ? alert.getFingerprint()
                : Fingerprints.of(labels);
        return AlertSummary.of(fingerprint, labels);
    }
}

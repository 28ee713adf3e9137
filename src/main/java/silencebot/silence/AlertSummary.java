package silencebot.silence;

import lombok.Data;
import silencebot.matcher.LabelSets;

import java.util.Map;

/**
 * 当前告警的摘要: 指纹与渲染后的标签集
 */
@Data
public class AlertSummary {
    private final String fingerprint;
    private final String labelString;

    public static AlertSummary of(String fingerprint, Map<String, String> labels) {
        return new AlertSummary(fingerprint, LabelSets.render(labels));
    }
}
